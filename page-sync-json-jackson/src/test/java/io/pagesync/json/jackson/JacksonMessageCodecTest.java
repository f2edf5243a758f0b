package io.pagesync.json.jackson;

import io.pagesync.core.Message;
import io.pagesync.core.MessageCodec;
import io.pagesync.core.MessageCodecs;
import io.pagesync.core.Operation;
import io.pagesync.core.PageSyncException.ProtocolError;
import io.pagesync.core.state.Cardinality;
import io.pagesync.core.state.MetaConstraint;
import io.pagesync.core.state.PropValue;
import io.pagesync.core.state.Props;
import io.pagesync.core.state.RelConstraint;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JacksonMessageCodecTest {

    private final JacksonMessageCodec codec = new JacksonMessageCodec();

    @Test
    void serviceLoaderFindsJacksonCodec() {
        MessageCodec loaded = MessageCodecs.load();
        assertThat(loaded).isInstanceOf(JacksonMessageCodec.class);
    }

    @Test
    void decodesEntityCreateWithCoercedProps() {
        Message m = codec.decode("{\"t\":\"entity.create\",\"id\":\"milk\",\"parent\":\"list\",\"display\":\"item\","
                + "\"p\":{\"name\":\"Milk\",\"qty\":2.50,\"done\":false,\"due\":\"2025-03-01\",\"note\":null,\"tags\":[\"a\",1]}}");

        assertThat(m).isInstanceOf(Operation.EntityCreate.class);
        Operation.EntityCreate c = (Operation.EntityCreate) m;
        assertThat(c.id()).isEqualTo("milk");
        assertThat(c.parent()).isEqualTo("list");
        assertThat(c.props().asMap()).containsOnlyKeys("name", "qty", "done", "due", "tags");
        assertThat(c.props().get("qty")).isEqualTo(PropValue.number(new BigDecimal("2.5")));
        assertThat(c.props().get("due")).isEqualTo(PropValue.date(LocalDate.of(2025, 3, 1)));
        assertThat(c.props().get("tags")).isEqualTo(new PropValue.Array(List.of(PropValue.text("a"), PropValue.number(1))));
    }

    @Test
    void createWithoutParentDefaultsToRoot() {
        Operation.EntityCreate c = (Operation.EntityCreate) codec.decode("{\"t\":\"entity.create\",\"id\":\"page\",\"display\":\"page\"}");
        assertThat(c.parent()).isEqualTo("root");
        assertThat(c.props().isEmpty()).isTrue();
    }

    @Test
    void relationshipTypeTravelsBesideTheDiscriminator() {
        Operation.RelSet rel = (Operation.RelSet) codec.decode(
                "{\"t\":\"rel.set\",\"from\":\"a\",\"to\":\"b\",\"type\":\"assigned_to\",\"cardinality\":\"many_to_one\"}");

        assertThat(rel.type()).isEqualTo("assigned_to");
        assertThat(rel.cardinality()).isEqualTo(Cardinality.MANY_TO_ONE);
        assertThat(codec.encode(rel)).contains("\"t\":\"rel.set\"").contains("\"type\":\"assigned_to\"");
    }

    @Test
    void acceptsTypeAsDiscriminatorWhenTIsAbsent() {
        assertThat(codec.decode("{\"type\":\"snapshot.start\"}")).isEqualTo(Message.SNAPSHOT_START);
        assertThat(codec.decode("{\"type\":\"entity.remove\",\"ref\":\"a\"}")).isEqualTo(new Operation.EntityRemove("a"));
    }

    @Test
    void metaSetDecodesToMetaUpdate() {
        assertThat(codec.decode("{\"t\":\"meta.set\",\"p\":{\"title\":\"Groceries\"}}"))
                .isEqualTo(new Operation.MetaUpdate("Groceries", null));
        assertThat(codec.decode("{\"t\":\"meta.update\",\"data\":{\"identity\":\"shopping list\"}}"))
                .isEqualTo(new Operation.MetaUpdate(null, "shopping list"));
    }

    @Test
    void directEditKeepsMissingFieldsForServerSideRejection() {
        Message.DirectEdit edit = (Message.DirectEdit) codec.decode("{\"t\":\"direct_edit\",\"field\":\"name\",\"value\":\"x\"}");

        assertThat(edit.entityId()).isNull();
        assertThat(edit.value()).isEqualTo(PropValue.text("x"));
    }

    @Test
    void encodesNumbersPlainAndRoundTripsUpdates() {
        Operation.EntityUpdate update = new Operation.EntityUpdate("a",
                Props.builder().put("price", PropValue.number(new BigDecimal("100"))).text("when", "later").build());

        String json = codec.encode(update);

        assertThat(json).isEqualTo("{\"t\":\"entity.update\",\"ref\":\"a\",\"p\":{\"price\":100,\"when\":\"later\"}}");
        assertThat(codec.decode(json)).isEqualTo(update);
    }

    @Test
    void rejectsMalformedMessages() {
        assertThatThrownBy(() -> codec.decode("not json")).isInstanceOf(ProtocolError.class);
        assertThatThrownBy(() -> codec.decode("[1,2]")).isInstanceOf(ProtocolError.class);
        assertThatThrownBy(() -> codec.decode("{\"ref\":\"a\"}")).isInstanceOf(ProtocolError.class);
        assertThatThrownBy(() -> codec.decode("{\"t\":\"entity.explode\"}")).isInstanceOf(ProtocolError.class);
        assertThatThrownBy(() -> codec.decode("{\"t\":\"entity.update\",\"ref\":\"a\",\"p\":{\"x\":{\"nested\":1}}}"))
                .isInstanceOf(ProtocolError.class);
        assertThatThrownBy(() -> codec.decode("{\"t\":\"rel.set\",\"from\":\"a\",\"to\":\"b\",\"type\":\"x\",\"cardinality\":\"lots\"}"))
                .isInstanceOf(ProtocolError.class);
    }

    @Test
    void numbersThatCannotBeWrittenPlainAreRejected() {
        assertThatThrownBy(() -> codec.decode("{\"t\":\"entity.update\",\"ref\":\"a\",\"p\":{\"qty\":1e10000}}"))
                .isInstanceOf(ProtocolError.class)
                .hasMessageContaining("qty");
        assertThatThrownBy(() -> codec.decode("{\"t\":\"style.set\",\"p\":{\"w\":[1e-10000]}}"))
                .isInstanceOf(ProtocolError.class);

        Operation.EntityUpdate big = (Operation.EntityUpdate) codec.decode(
                "{\"t\":\"entity.update\",\"ref\":\"a\",\"p\":{\"qty\":1e20}}");
        assertThat(codec.encode(big)).contains("\"qty\":100000000000000000000");

        Operation unencodable = new Operation.EntityUpdate("a",
                Props.of("qty", PropValue.number(new BigDecimal("1E+10000"))));
        assertThatThrownBy(() -> codec.encode(unencodable))
                .isInstanceOf(ProtocolError.class)
                .hasMessageContaining("entity.update");
    }

    @Test
    void relRegisterCarriesTypeAndCardinality() {
        Operation.RelRegister reg = (Operation.RelRegister) codec.decode(
                "{\"t\":\"rel.register\",\"type\":\"owner\",\"cardinality\":\"one_to_one\"}");

        assertThat(reg).isEqualTo(new Operation.RelRegister("owner", Cardinality.ONE_TO_ONE));
        assertThat(codec.encode(reg)).isEqualTo("{\"t\":\"rel.register\",\"type\":\"owner\",\"cardinality\":\"one_to_one\"}");
    }

    @Test
    void decodesConstraints() {
        Operation.RelConstrain rel = (Operation.RelConstrain) codec.decode("{\"t\":\"rel.constrain\",\"id\":\"apart\","
                + "\"rule\":\"exclude_pair\",\"entities\":[\"alice\",\"bob\"],\"rel_type\":\"seated\","
                + "\"message\":\"keep apart\",\"strict\":true}");
        Operation.MetaConstrain meta = (Operation.MetaConstrain) codec.decode(
                "{\"t\":\"meta.constrain\",\"id\":\"cap\",\"rule\":\"max_children\",\"parent\":\"list\",\"value\":3}");

        assertThat(rel.constraint()).isEqualTo(new RelConstraint("apart", RelConstraint.EXCLUDE_PAIR,
                List.of("alice", "bob"), "seated", null, "keep apart", true));
        assertThat(meta.constraint()).isEqualTo(new MetaConstraint("cap", MetaConstraint.MAX_CHILDREN, "list", 3, null, false));
        assertThat(codec.decode(codec.encode(rel))).isEqualTo(rel);
        assertThat(codec.encode(meta)).contains("\"value\":3").contains("\"strict\":false").doesNotContain("message");

        assertThatThrownBy(() -> codec.decode("{\"t\":\"meta.constrain\",\"id\":\"cap\",\"strict\":\"yes\"}"))
                .isInstanceOf(ProtocolError.class);
        assertThatThrownBy(() -> codec.decode("{\"t\":\"rel.constrain\",\"id\":\"x\",\"entities\":[1]}"))
                .isInstanceOf(ProtocolError.class);
    }
}
