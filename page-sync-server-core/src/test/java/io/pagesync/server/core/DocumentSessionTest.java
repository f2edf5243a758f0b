package io.pagesync.server.core;

import io.pagesync.core.Message;
import io.pagesync.core.Operation;
import io.pagesync.core.PageSyncException.ValidationError;
import io.pagesync.core.state.Cardinality;
import io.pagesync.core.state.PageSnapshot;
import io.pagesync.core.state.PropValue;
import io.pagesync.core.state.Props;
import io.pagesync.core.state.Relationship;
import io.pagesync.core.state.Replay;
import io.pagesync.json.jackson.JacksonMessageCodec;
import io.pagesync.server.spi.InMemoryOperationLog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DocumentSessionTest {

    private final JacksonMessageCodec codec = new JacksonMessageCodec();
    private ManualExecutor executor;
    private InMemoryOperationLog log;
    private PageSyncHandler handler;

    @BeforeEach
    void setUp() {
        executor = new ManualExecutor();
        log = new InMemoryOperationLog();
        handler = PageSyncHandler.builder().operationLog(log).codec(codec).executor(executor).outboxCapacity(8).build();
    }

    private DocumentSession seeded() {
        DocumentSession session = handler.session("groceries");
        session.submit(new Operation.EntityCreate("page", "root", "page", Props.empty()));
        session.submit(new Operation.EntityCreate("milk", "page", "item", Props.builder().text("name", "Milk").build()));
        return session;
    }

    private List<Message> decoded(RecordingConnection c) {
        return c.frames.stream().map(codec::decode).toList();
    }

    @Test
    void newConnectionIsHydratedThenReceivesCommitsInOrder() {
        DocumentSession session = seeded();
        RecordingConnection conn = new RecordingConnection("c1");

        assertThat(session.attach(conn)).isTrue();
        session.submit(new Operation.EntityUpdate("milk", Props.builder().bool("done", true).build()));

        List<Message> messages = decoded(conn);
        assertThat(messages).hasSize(5);
        assertThat(messages.get(0)).isEqualTo(Message.SNAPSHOT_START);
        assertThat(messages.get(1)).isInstanceOf(Operation.EntityCreate.class);
        assertThat(((Operation.EntityCreate) messages.get(2)).id()).isEqualTo("milk");
        assertThat(messages.get(3)).isEqualTo(Message.SNAPSHOT_END);
        assertThat(messages.get(4)).isInstanceOf(Operation.EntityUpdate.class);
    }

    @Test
    void rejectedDirectEditReachesOnlyTheRequester() {
        DocumentSession session = seeded();
        RecordingConnection a = new RecordingConnection("a");
        RecordingConnection b = new RecordingConnection("b");
        session.attach(a);
        session.attach(b);
        a.clear();
        b.clear();
        PageSnapshot before = session.snapshot();

        SubmitOutcome outcome = session.directEdit("a", new Message.DirectEdit("nonexistent_id", "name", PropValue.text("x")));

        assertThat(outcome.status()).isEqualTo(SubmitOutcome.Status.REJECTED);
        assertThat(outcome.error().kind()).isEqualTo(ValidationError.Kind.UNKNOWN_ENTITY);
        assertThat(decoded(a)).singleElement().isInstanceOf(Message.DirectEditError.class);
        assertThat(b.frames).isEmpty();
        assertThat(session.snapshot()).isSameAs(before);
        assertThat(log.load("groceries")).hasSize(2);
    }

    @Test
    void acceptedDirectEditIsBroadcastToEveryoneIncludingRequester() {
        DocumentSession session = seeded();
        RecordingConnection a = new RecordingConnection("a");
        RecordingConnection b = new RecordingConnection("b");
        session.attach(a);
        session.attach(b);
        a.clear();
        b.clear();

        session.directEdit("a", new Message.DirectEdit("milk", "name", PropValue.text("Oat milk")));

        Operation.EntityUpdate expected = new Operation.EntityUpdate("milk", Props.of("name", PropValue.text("Oat milk")));
        assertThat(decoded(a)).containsExactly(expected);
        assertThat(decoded(b)).containsExactly(expected);
        assertThat(session.snapshot().entity("milk").props().get("name")).isEqualTo(PropValue.text("Oat milk"));
    }

    @Test
    void directEditWithoutEntityIdIsReportedAsMissingField() {
        DocumentSession session = seeded();
        RecordingConnection a = new RecordingConnection("a");
        session.attach(a);
        a.clear();

        SubmitOutcome outcome = session.directEdit("a", new Message.DirectEdit(null, "name", PropValue.text("x")));

        assertThat(outcome.error().kind()).isEqualTo(ValidationError.Kind.MISSING_FIELD);
        assertThat(((Message.DirectEditError) decoded(a).get(0)).error()).contains("entity_id");
    }

    @Test
    void batchIsBroadcastContiguouslyWithoutRejectedOperations() {
        DocumentSession session = seeded();
        RecordingConnection a = new RecordingConnection("a");
        session.attach(a);
        a.clear();

        List<SubmitOutcome> outcomes = session.submitBatch(List.of(
                new Operation.EntityCreate("eggs", "page", "item", Props.empty()),
                new Operation.EntityCreate("bad", "ghost", "item", Props.empty()),
                new Operation.EntityCreate("bread", "page", "item", Props.empty())));

        assertThat(outcomes).extracting(SubmitOutcome::status).containsExactly(
                SubmitOutcome.Status.APPLIED, SubmitOutcome.Status.REJECTED, SubmitOutcome.Status.APPLIED);
        List<Message> messages = decoded(a);
        assertThat(messages).hasSize(4);
        assertThat(messages.get(0)).isEqualTo(Message.BATCH_START);
        assertThat(messages.get(3)).isEqualTo(Message.BATCH_END);
        assertThat(log.load("groceries")).hasSize(4);
    }

    @Test
    void overflowingOutboxClosesTheConnectionAndDropsIt() {
        DocumentSession session = seeded();
        RecordingConnection slow = new RecordingConnection("slow");
        executor.pause();
        session.attach(slow);

        for (int i = 0; i < 10; i++) {
            session.submit(new Operation.EntityUpdate("milk", Props.builder().number("qty", i).build()));
        }

        assertThat(session.connectionCount()).isZero();
        assertThat(slow.closeCode).as("socket close waits for the executor").isNull();

        executor.resume();

        assertThat(slow.closeCode).isEqualTo(ConnectionOutbox.CLOSE_TRY_AGAIN_LATER);
        assertThat(slow.frames).isEmpty();
    }

    @Test
    void noEffectOperationsAreNeitherLoggedNorBroadcast() {
        DocumentSession session = seeded();
        RecordingConnection a = new RecordingConnection("a");
        session.attach(a);
        a.clear();

        SubmitOutcome outcome = session.submit(new Operation.EntityUpdate("milk", Props.builder().text("name", "Milk").build()));

        assertThat(outcome.status()).isEqualTo(SubmitOutcome.Status.UNCHANGED);
        assertThat(a.frames).isEmpty();
        assertThat(log.load("groceries")).hasSize(2);
    }

    @Test
    void sessionIsRebuiltFromTheOperationLog() {
        PageSnapshot original = seeded().snapshot();

        PageSyncHandler restarted = PageSyncHandler.builder().operationLog(log).codec(codec).executor(executor).build();

        assertThat(restarted.snapshot("groceries")).isEqualTo(original);
    }

    @Test
    void valueThatCannotBeEncodedIsRejectedBeforeItIsCommitted() {
        DocumentSession session = seeded();
        RecordingConnection a = new RecordingConnection("a");
        session.attach(a);
        a.clear();
        PageSnapshot before = session.snapshot();
        PropValue huge = PropValue.number(new BigDecimal("1E+10000"));

        SubmitOutcome outcome = session.submit(new Operation.EntityUpdate("milk", Props.of("qty", huge)));
        SubmitOutcome edit = session.directEdit("a", new Message.DirectEdit("milk", "qty", huge));
        List<SubmitOutcome> batch = session.submitBatch(List.of(
                new Operation.EntityUpdate("milk", Props.of("qty", huge)),
                new Operation.EntityUpdate("milk", Props.builder().number("qty", 3).build())));

        assertThat(outcome.error().kind()).isEqualTo(ValidationError.Kind.INVALID_VALUE);
        assertThat(edit.error().kind()).isEqualTo(ValidationError.Kind.INVALID_VALUE);
        assertThat(batch).extracting(SubmitOutcome::status)
                .containsExactly(SubmitOutcome.Status.REJECTED, SubmitOutcome.Status.APPLIED);
        assertThat(decoded(a)).hasSize(4);
        assertThat(decoded(a).get(0)).isInstanceOf(Message.DirectEditError.class);
        assertThat(session.snapshot().entity("milk").props().get("qty")).isEqualTo(PropValue.number(3));
        assertThat(session.snapshot().sequence()).isEqualTo(before.sequence() + 1);
        assertThat(log.load("groceries")).hasSize(3);

        RecordingConnection late = new RecordingConnection("late");
        assertThat(session.attach(late)).isTrue();
        assertThat(Replay.replay(decoded(late)).entity("milk").props()).isEqualTo(session.snapshot().entity("milk").props());
    }

    @Test
    void replicaKeepsTheServersCardinalityAfterTheLastEdgeIsRemoved() {
        DocumentSession session = handler.session("groceries");
        for (String id : List.of("a", "b", "c")) {
            session.submit(new Operation.EntityCreate(id, "root", "item", Props.empty()));
        }
        session.submit(new Operation.RelSet("a", "b", "owner", Cardinality.MANY_TO_ONE));
        session.submit(new Operation.RelRemove("a", "b", "owner"));
        RecordingConnection replica = new RecordingConnection("replica");
        session.attach(replica);

        session.submit(new Operation.RelSet("a", "b", "owner", null));
        session.submit(new Operation.RelSet("a", "c", "owner", null));

        List<Relationship> expected = List.of(new Relationship("a", "c", "owner", Cardinality.MANY_TO_ONE));
        assertThat(session.snapshot().relationships()).isEqualTo(expected);
        assertThat(Replay.replay(decoded(replica)).relationships()).isEqualTo(expected);
        assertThat(log.load("groceries").stream()
                .filter(Operation.RelSet.class::isInstance)
                .map(op -> ((Operation.RelSet) op).cardinality()))
                .containsOnly(Cardinality.MANY_TO_ONE);
    }
}
