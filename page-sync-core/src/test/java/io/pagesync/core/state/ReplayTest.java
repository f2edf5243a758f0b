package io.pagesync.core.state;

import io.pagesync.core.Message;
import io.pagesync.core.Operation;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static io.pagesync.core.state.Ops.create;
import static io.pagesync.core.state.Ops.move;
import static io.pagesync.core.state.Ops.relSet;
import static io.pagesync.core.state.Ops.remove;
import static io.pagesync.core.state.Ops.reorder;
import static io.pagesync.core.state.Ops.update;
import static org.assertj.core.api.Assertions.assertThat;

class ReplayTest {

    @Test
    void replayingTheSameLogTwiceYieldsEqualSnapshots() {
        List<Message> log = randomLog(new Random(42), 400);

        PageSnapshot first = Replay.replay(log);
        PageSnapshot second = Replay.replay(log);

        assertThat(second).isEqualTo(first);
        assertThat(second.rootOrder()).isEqualTo(first.rootOrder());
        assertThat(second.children()).isEqualTo(first.children());
    }

    @Test
    void replayMatchesIncrementalApplication() {
        List<Message> log = randomLog(new Random(7), 300);

        EntityStore store = new EntityStore();
        PageSnapshot viaReducer = PageSnapshot.empty();
        for (Message m : log) {
            viaReducer = Reducer.apply(viaReducer, m).snapshot();
        }
        Replay.replayInto(store, log);

        assertThat(store.snapshot()).isEqualTo(viaReducer);
        assertThat(Replay.replay(log)).isEqualTo(viaReducer);
    }

    @Test
    void everyLiveNonRootEntityHasALiveParentAfterRandomOperations() {
        PageSnapshot s = Replay.replay(randomLog(new Random(99), 500));

        for (Entity e : s.entities().values()) {
            if (!e.isLive() || "root".equals(e.parent())) continue;
            assertThat(s.isLive(e.parent())).as("parent of %s", e.id()).isTrue();
            assertThat(s.childrenOf(e.parent())).contains(e.id());
        }
    }

    @Test
    void tombstonesStayAddressableAfterReplay() {
        List<Message> log = List.of(create("a", "root", "item"), remove("a"), create("a", "root", "item"));

        PageSnapshot s = Replay.replay(log);

        assertThat(s.entity("a").removed()).isTrue();
        assertThat(s.sequence()).isEqualTo(2);
    }

    private static List<Message> randomLog(Random random, int size) {
        List<Message> log = new ArrayList<>();
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            String id = "e" + i;
            String other = ids.isEmpty() ? "root" : ids.get(random.nextInt(ids.size()));
            String another = ids.isEmpty() ? "root" : ids.get(random.nextInt(ids.size()));
            Operation op;
            switch (random.nextInt(7)) {
                case 0:
                case 1:
                    op = create(id, random.nextBoolean() ? "root" : other, "item");
                    ids.add(id);
                    break;
                case 2:
                    op = update(other, Props.builder().number("n", random.nextInt(5)).build());
                    break;
                case 3:
                    op = remove(other);
                    break;
                case 4:
                    op = move(other, another, random.nextInt(4) - 1);
                    break;
                case 5:
                    op = reorder(other, another);
                    break;
                default:
                    op = relSet(other, another, random.nextBoolean() ? "owns" : "likes",
                            random.nextBoolean() ? Cardinality.MANY_TO_ONE : null);
                    break;
            }
            log.add(op);
            if (random.nextInt(10) == 0) {
                log.add(Message.BATCH_START);
            }
        }
        return log;
    }
}
