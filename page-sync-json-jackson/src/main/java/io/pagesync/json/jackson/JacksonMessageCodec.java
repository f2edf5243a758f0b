package io.pagesync.json.jackson;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.pagesync.core.Message;
import io.pagesync.core.MessageCodec;
import io.pagesync.core.Operation;
import io.pagesync.core.PageSyncException.ProtocolError;
import io.pagesync.core.Protocol;
import io.pagesync.core.state.Cardinality;
import io.pagesync.core.state.MetaConstraint;
import io.pagesync.core.state.PropValue;
import io.pagesync.core.state.Props;
import io.pagesync.core.state.RelConstraint;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Jackson implementation of {@link MessageCodec}.
 *
 * <p>Messages are flat JSON objects discriminated by {@code t}; {@code type} is accepted as the
 * discriminator when {@code t} is absent. Properties travel under {@code p}.
 */
public final class JacksonMessageCodec implements MessageCodec {

    private final ObjectMapper mapper;

    /**
     * Creates a codec with the default ObjectMapper.
     */
    public JacksonMessageCodec() {
        this(new ObjectMapper(new JsonFactory()));
    }

    /**
     * Creates a codec with a custom ObjectMapper.
     * @param mapper the ObjectMapper to use
     */
    public JacksonMessageCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper")
                .copy()
                .enable(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN)
                .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getMapper() {
        return mapper;
    }

    /**
     * @throws ProtocolError if the message holds a value the wire format cannot carry
     */
    @Override
    public String encode(Message message) {
        Objects.requireNonNull(message, "message");
        ObjectNode n = toNode(message);
        try {
            return mapper.writeValueAsString(n);
        } catch (JsonProcessingException e) {
            throw new ProtocolError("cannot encode " + message.wireType() + ": " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Builds the JSON tree for a message.
     */
    public ObjectNode toNode(Message message) {
        ObjectNode n = mapper.createObjectNode();
        n.put(Protocol.F_T, message.wireType());
        if (message instanceof Operation.EntityCreate m) {
            n.put(Protocol.F_ID, m.id());
            n.put(Protocol.F_PARENT, m.parent());
            n.put(Protocol.F_DISPLAY, m.display());
            n.set(Protocol.F_PROPS, PropsJson.write(mapper, m.props()));
        } else if (message instanceof Operation.EntityUpdate m) {
            n.put(Protocol.F_REF, m.ref());
            n.set(Protocol.F_PROPS, PropsJson.write(mapper, m.props()));
        } else if (message instanceof Operation.EntityRemove m) {
            n.put(Protocol.F_REF, m.ref());
        } else if (message instanceof Operation.EntityMove m) {
            n.put(Protocol.F_REF, m.ref());
            n.put(Protocol.F_PARENT, m.parent());
            if (m.position() != null) n.put(Protocol.F_POSITION, m.position());
        } else if (message instanceof Operation.EntityReorder m) {
            n.put(Protocol.F_REF, m.ref());
            ArrayNode arr = n.putArray(Protocol.F_CHILDREN);
            if (m.children() != null) m.children().forEach(arr::add);
        } else if (message instanceof Operation.RelSet m) {
            n.put(Protocol.F_FROM, m.from());
            n.put(Protocol.F_TO, m.to());
            n.put(Protocol.F_TYPE, m.type());
            if (m.cardinality() != null) n.put(Protocol.F_CARDINALITY, m.cardinality().wireName());
        } else if (message instanceof Operation.RelRemove m) {
            n.put(Protocol.F_FROM, m.from());
            n.put(Protocol.F_TO, m.to());
            n.put(Protocol.F_TYPE, m.type());
        } else if (message instanceof Operation.RelRegister m) {
            n.put(Protocol.F_TYPE, m.type());
            if (m.cardinality() != null) n.put(Protocol.F_CARDINALITY, m.cardinality().wireName());
        } else if (message instanceof Operation.RelConstrain m) {
            RelConstraint c = m.constraint();
            n.put(Protocol.F_ID, c.id());
            n.put(Protocol.F_RULE, c.rule());
            c.entities().forEach(n.putArray(Protocol.F_ENTITIES)::add);
            n.put(Protocol.F_REL_TYPE, c.relType());
            constraintTail(n, c.value(), c.message(), c.strict());
        } else if (message instanceof Operation.MetaConstrain m) {
            MetaConstraint c = m.constraint();
            n.put(Protocol.F_ID, c.id());
            n.put(Protocol.F_RULE, c.rule());
            n.put(Protocol.F_PARENT, c.parent());
            constraintTail(n, c.value(), c.message(), c.strict());
        } else if (message instanceof Operation.MetaUpdate m) {
            ObjectNode data = n.putObject(Protocol.F_DATA);
            if (m.title() != null) data.put(Protocol.F_TITLE, m.title());
            if (m.identity() != null) data.put(Protocol.F_IDENTITY, m.identity());
        } else if (message instanceof Operation.StyleSet m) {
            n.set(Protocol.F_PROPS, PropsJson.write(mapper, m.props()));
        } else if (message instanceof Operation.StyleEntity m) {
            n.put(Protocol.F_REF, m.ref());
            n.set(Protocol.F_PROPS, PropsJson.write(mapper, m.props()));
        } else if (message instanceof Message.Voice m) {
            n.put(Protocol.F_TEXT, m.text());
        } else if (message instanceof Message.DirectEdit m) {
            n.put(Protocol.F_ENTITY_ID, m.entityId());
            n.put(Protocol.F_FIELD, m.field());
            n.set(Protocol.F_VALUE, m.value() == null ? mapper.nullNode() : PropsJson.writeValue(mapper, m.value()));
        } else if (message instanceof Message.DirectEditError m) {
            n.put(Protocol.F_ERROR, m.error());
        }
        return n;
    }

    private static void constraintTail(ObjectNode n, Integer value, String message, boolean strict) {
        if (value != null) n.put(Protocol.F_VALUE, value);
        if (message != null) n.put(Protocol.F_MESSAGE, message);
        n.put(Protocol.F_STRICT, strict);
    }

    @Override
    public Message decode(String text) {
        Objects.requireNonNull(text, "text");
        JsonNode root;
        try {
            root = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new ProtocolError("invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ProtocolError("message must be a JSON object");
        }
        return fromNode((ObjectNode) root);
    }

    /**
     * Decodes a JSON tree into a message.
     */
    public Message fromNode(ObjectNode n) {
        String t = text(n, Protocol.F_T);
        if (t == null) t = text(n, Protocol.F_TYPE);
        if (t == null) {
            throw new ProtocolError("message has no '" + Protocol.F_T + "' field");
        }
        switch (t) {
            case Protocol.SNAPSHOT_START:
                return Message.SNAPSHOT_START;
            case Protocol.SNAPSHOT_END:
                return Message.SNAPSHOT_END;
            case Protocol.BATCH_START:
                return Message.BATCH_START;
            case Protocol.BATCH_END:
                return Message.BATCH_END;
            case Protocol.STREAM_START:
                return Message.STREAM_START;
            case Protocol.STREAM_END:
                return Message.STREAM_END;
            case Protocol.VOICE:
                return new Message.Voice(requireText(n, Protocol.F_TEXT));
            case Protocol.ENTITY_CREATE:
                return new Operation.EntityCreate(text(n, Protocol.F_ID), text(n, Protocol.F_PARENT),
                        text(n, Protocol.F_DISPLAY), PropsJson.read(n.get(Protocol.F_PROPS)));
            case Protocol.ENTITY_UPDATE:
                return new Operation.EntityUpdate(text(n, Protocol.F_REF), PropsJson.read(n.get(Protocol.F_PROPS)));
            case Protocol.ENTITY_REMOVE:
                return new Operation.EntityRemove(text(n, Protocol.F_REF));
            case Protocol.ENTITY_MOVE:
                return new Operation.EntityMove(text(n, Protocol.F_REF), text(n, Protocol.F_PARENT), integer(n, Protocol.F_POSITION));
            case Protocol.ENTITY_REORDER:
                return new Operation.EntityReorder(text(n, Protocol.F_REF), stringList(n, Protocol.F_CHILDREN));
            case Protocol.REL_SET:
                return new Operation.RelSet(text(n, Protocol.F_FROM), text(n, Protocol.F_TO),
                        relType(n), cardinality(n));
            case Protocol.REL_REMOVE:
                return new Operation.RelRemove(text(n, Protocol.F_FROM), text(n, Protocol.F_TO), relType(n));
            case Protocol.REL_REGISTER:
                return new Operation.RelRegister(relType(n), cardinality(n));
            case Protocol.REL_CONSTRAIN:
                return new Operation.RelConstrain(new RelConstraint(text(n, Protocol.F_ID), text(n, Protocol.F_RULE),
                        stringList(n, Protocol.F_ENTITIES), text(n, Protocol.F_REL_TYPE), integer(n, Protocol.F_VALUE),
                        text(n, Protocol.F_MESSAGE), flag(n, Protocol.F_STRICT)));
            case Protocol.META_CONSTRAIN:
                return new Operation.MetaConstrain(new MetaConstraint(text(n, Protocol.F_ID), text(n, Protocol.F_RULE),
                        text(n, Protocol.F_PARENT), integer(n, Protocol.F_VALUE), text(n, Protocol.F_MESSAGE),
                        flag(n, Protocol.F_STRICT)));
            case Protocol.META_UPDATE:
                return meta(n.get(Protocol.F_DATA));
            case Protocol.META_SET:
                return meta(n.get(Protocol.F_PROPS));
            case Protocol.STYLE_SET:
                return new Operation.StyleSet(PropsJson.read(n.get(Protocol.F_PROPS)));
            case Protocol.STYLE_ENTITY:
                return new Operation.StyleEntity(text(n, Protocol.F_REF), PropsJson.read(n.get(Protocol.F_PROPS)));
            case Protocol.DIRECT_EDIT: {
                JsonNode v = n.get(Protocol.F_VALUE);
                PropValue value = (v == null || v.isNull()) ? null : PropsJson.readValue(Protocol.F_VALUE, v);
                return new Message.DirectEdit(text(n, Protocol.F_ENTITY_ID), text(n, Protocol.F_FIELD), value);
            }
            case Protocol.DIRECT_EDIT_ERROR:
                return new Message.DirectEditError(requireText(n, Protocol.F_ERROR));
            default:
                throw new ProtocolError("unknown message type '" + t + "'");
        }
    }

    // With "type" as the discriminator there is no relationship type left on the frame.
    private static String relType(ObjectNode n) {
        return n.has(Protocol.F_T) ? text(n, Protocol.F_TYPE) : null;
    }

    private static Operation.MetaUpdate meta(JsonNode data) {
        if (data == null || data.isNull()) {
            return new Operation.MetaUpdate(null, null);
        }
        if (!data.isObject()) {
            throw new ProtocolError("meta payload must be an object");
        }
        return new Operation.MetaUpdate(text(data, Protocol.F_TITLE), text(data, Protocol.F_IDENTITY));
    }

    private static Integer integer(ObjectNode n, String field) {
        JsonNode p = n.get(field);
        if (p == null || p.isNull()) return null;
        if (!p.canConvertToInt() || !p.isIntegralNumber()) {
            throw new ProtocolError("'" + field + "' must be an integer");
        }
        return p.intValue();
    }

    private static boolean flag(ObjectNode n, String field) {
        JsonNode v = n.get(field);
        if (v == null || v.isNull()) return false;
        if (!v.isBoolean()) {
            throw new ProtocolError("'" + field + "' must be a boolean");
        }
        return v.booleanValue();
    }

    private static Cardinality cardinality(ObjectNode n) {
        String c = text(n, Protocol.F_CARDINALITY);
        if (c == null) return null;
        try {
            return Cardinality.fromWire(c);
        } catch (IllegalArgumentException e) {
            throw new ProtocolError(e.getMessage(), e);
        }
    }

    private static List<String> stringList(ObjectNode n, String field) {
        JsonNode node = n.get(field);
        if (node == null || node.isNull()) return null;
        if (!node.isArray()) {
            throw new ProtocolError("'" + field + "' must be an array");
        }
        List<String> out = new ArrayList<>(node.size());
        for (Iterator<JsonNode> it = node.elements(); it.hasNext(); ) {
            JsonNode e = it.next();
            if (!e.isTextual()) {
                throw new ProtocolError("'" + field + "' must contain strings");
            }
            out.add(e.textValue());
        }
        return out;
    }

    private static String text(JsonNode n, String field) {
        JsonNode v = n.get(field);
        if (v == null || v.isNull()) return null;
        if (!v.isTextual()) {
            throw new ProtocolError("'" + field + "' must be a string");
        }
        return v.textValue();
    }

    private static String requireText(JsonNode n, String field) {
        String v = text(n, field);
        if (v == null) {
            throw new ProtocolError("'" + field + "' is required");
        }
        return v;
    }
}
