package io.pagesync.json.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.pagesync.core.state.Entity;
import io.pagesync.core.state.MetaConstraint;
import io.pagesync.core.state.PageSnapshot;
import io.pagesync.core.state.Props;
import io.pagesync.core.state.RelConstraint;
import io.pagesync.core.state.Relationship;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Canonical JSON form of a {@link PageSnapshot}: object keys sorted, no whitespace, numbers plain.
 * Equal snapshots always produce identical text.
 */
public final class SnapshotJson {

    private static final ObjectMapper CANONICAL = new ObjectMapper()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .enable(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN);

    private SnapshotJson() {}

    public static String toJson(PageSnapshot snapshot) {
        try {
            return CANONICAL.writeValueAsString(toMap(snapshot));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("failed to serialize snapshot", e);
        }
    }

    /** Plain map tree of the snapshot; used for the snapshot endpoint body. */
    public static Map<String, Object> toMap(PageSnapshot s) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("title", s.meta().title());
        meta.put("identity", s.meta().identity());

        Map<String, Object> entities = new LinkedHashMap<>();
        for (Entity e : s.entities().values()) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("id", e.id());
            m.put("parent", e.parent());
            m.put("display", e.display());
            m.put("props", props(e.props()));
            m.put("created_seq", e.creationSeq());
            m.put("updated_seq", e.updatedSeq());
            m.put("removed", e.removed());
            entities.put(e.id(), m);
        }

        List<Object> rels = new ArrayList<>();
        for (Relationship r : s.relationships()) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("from", r.from());
            m.put("to", r.to());
            m.put("type", r.type());
            m.put("cardinality", r.cardinality().wireName());
            rels.add(m);
        }

        Map<String, Object> cardinalities = new LinkedHashMap<>();
        s.cardinalities().forEach((k, v) -> cardinalities.put(k, v.wireName()));

        Map<String, Object> relConstraints = new LinkedHashMap<>();
        for (RelConstraint c : s.relConstraints().values()) {
            Map<String, Object> m = constraint(c.id(), c.rule(), c.value(), c.message(), c.strict());
            m.put("entities", c.entities());
            m.put("rel_type", c.relType());
            relConstraints.put(c.id(), m);
        }
        Map<String, Object> metaConstraints = new LinkedHashMap<>();
        for (MetaConstraint c : s.metaConstraints().values()) {
            Map<String, Object> m = constraint(c.id(), c.rule(), c.value(), c.message(), c.strict());
            m.put("parent", c.parent());
            metaConstraints.put(c.id(), m);
        }

        Map<String, Object> entityStyles = new LinkedHashMap<>();
        s.entityStyles().forEach((k, v) -> entityStyles.put(k, props(v)));
        Map<String, Object> styles = new LinkedHashMap<>();
        styles.put("global", props(s.styles()));
        styles.put("entities", entityStyles);

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("meta", meta);
        out.put("entities", entities);
        out.put("root_order", s.rootOrder());
        out.put("children", s.children());
        out.put("relationships", rels);
        out.put("rel_cardinalities", cardinalities);
        out.put("rel_constraints", relConstraints);
        out.put("meta_constraints", metaConstraints);
        out.put("styles", styles);
        out.put("sequence", s.sequence());
        return out;
    }

    private static Map<String, Object> constraint(String id, String rule, Integer value, String message, boolean strict) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", id);
        m.put("rule", rule);
        m.put("value", value);
        m.put("message", message);
        m.put("strict", strict);
        return m;
    }

    private static Map<String, Object> props(Props props) {
        Map<String, Object> m = new LinkedHashMap<>();
        props.asMap().forEach((k, v) -> m.put(k, PropsJson.toPlain(v)));
        return m;
    }
}
