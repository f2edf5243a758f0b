package io.pagesync.server.spi;

import io.pagesync.core.Operation;
import io.pagesync.core.state.PageSnapshot;
import io.pagesync.core.state.Props;
import io.pagesync.core.state.Replay;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryOperationLogTest {

    @Test
    void keepsPagesApartAndPreservesOrder() {
        InMemoryOperationLog log = new InMemoryOperationLog();
        Operation a = new Operation.EntityCreate("a", "root", "item", Props.empty());
        Operation b = new Operation.EntityCreate("b", "a", "item", Props.empty());

        log.append("one", List.of(a));
        log.append("one", List.of(b));
        log.append("two", List.of(b));

        assertThat(log.load("one")).containsExactly(a, b);
        assertThat(log.load("two")).containsExactly(b);
        assertThat(log.load("missing")).isEmpty();
    }

    @Test
    void loadedLogReplaysToThePage() {
        InMemoryOperationLog log = new InMemoryOperationLog();
        log.append("p", List.of(
                new Operation.EntityCreate("page", "root", "page", Props.empty()),
                new Operation.EntityCreate("milk", "page", "item", Props.empty())));

        PageSnapshot s = Replay.replay(log.load("p"));

        assertThat(s.childrenOf("page")).containsExactly("milk");
    }
}
