package io.pagesync.core.state;

import io.pagesync.core.Protocol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable value of a page at one point in its operation history.
 *
 * <p>Two snapshots are equal when their entities, root order, children orders, relationships,
 * registered cardinalities, constraints, meta, styles and sequence are all equal.
 */
public final class PageSnapshot implements PageView {

    private static final PageSnapshot EMPTY = new PageSnapshot(Map.of(), List.of(), Map.of(), List.of(), Map.of(),
            Map.of(), Map.of(), Meta.EMPTY, Props.empty(), Map.of(), 0L);

    private final Map<String, Entity> entities;
    private final List<String> rootOrder;
    private final Map<String, List<String>> children;
    private final List<Relationship> relationships;
    private final Map<String, Cardinality> cardinalities;
    private final Map<String, RelConstraint> relConstraints;
    private final Map<String, MetaConstraint> metaConstraints;
    private final Meta meta;
    private final Props styles;
    private final Map<String, Props> entityStyles;
    private final long sequence;

    PageSnapshot(Map<String, Entity> entities,
                 List<String> rootOrder,
                 Map<String, List<String>> children,
                 List<Relationship> relationships,
                 Map<String, Cardinality> cardinalities,
                 Map<String, RelConstraint> relConstraints,
                 Map<String, MetaConstraint> metaConstraints,
                 Meta meta,
                 Props styles,
                 Map<String, Props> entityStyles,
                 long sequence) {
        this.entities = entities;
        this.rootOrder = rootOrder;
        this.children = children;
        this.relationships = relationships;
        this.cardinalities = cardinalities;
        this.relConstraints = relConstraints;
        this.metaConstraints = metaConstraints;
        this.meta = meta;
        this.styles = styles;
        this.entityStyles = entityStyles;
        this.sequence = sequence;
    }

    public static PageSnapshot empty() {
        return EMPTY;
    }

    static PageSnapshot copyOf(Map<String, Entity> entities,
                               List<String> rootOrder,
                               Map<String, List<String>> children,
                               List<Relationship> relationships,
                               Map<String, Cardinality> cardinalities,
                               Map<String, RelConstraint> relConstraints,
                               Map<String, MetaConstraint> metaConstraints,
                               Meta meta,
                               Props styles,
                               Map<String, Props> entityStyles,
                               long sequence) {
        Map<String, List<String>> kids = new LinkedHashMap<>();
        children.forEach((k, v) -> kids.put(k, List.copyOf(v)));
        return new PageSnapshot(
                Collections.unmodifiableMap(new LinkedHashMap<>(entities)),
                List.copyOf(rootOrder),
                Collections.unmodifiableMap(kids),
                List.copyOf(relationships),
                Collections.unmodifiableMap(new LinkedHashMap<>(cardinalities)),
                Collections.unmodifiableMap(new LinkedHashMap<>(relConstraints)),
                Collections.unmodifiableMap(new LinkedHashMap<>(metaConstraints)),
                meta,
                styles,
                Collections.unmodifiableMap(new LinkedHashMap<>(entityStyles)),
                sequence);
    }

    /** All entities including tombstones, in creation order. */
    public Map<String, Entity> entities() {
        return entities;
    }

    public List<String> rootOrder() {
        return rootOrder;
    }

    /** Children index: only parents with at least one live child appear. */
    public Map<String, List<String>> children() {
        return children;
    }

    @Override
    public List<Relationship> relationships() {
        return relationships;
    }

    public Map<String, Cardinality> cardinalities() {
        return cardinalities;
    }

    @Override
    public Map<String, RelConstraint> relConstraints() {
        return relConstraints;
    }

    @Override
    public Map<String, MetaConstraint> metaConstraints() {
        return metaConstraints;
    }

    public Meta meta() {
        return meta;
    }

    public Props styles() {
        return styles;
    }

    public Map<String, Props> entityStyles() {
        return entityStyles;
    }

    /** Number of effective operations applied so far. */
    public long sequence() {
        return sequence;
    }

    @Override
    public Entity entity(String id) {
        return entities.get(id);
    }

    @Override
    public List<String> childrenOf(String parentId) {
        if (Protocol.ROOT.equals(parentId)) return rootOrder;
        return children.getOrDefault(parentId, List.of());
    }

    @Override
    public Cardinality cardinalityOf(String type) {
        return cardinalities.get(type);
    }

    @Override
    public String livePageId() {
        for (Entity e : entities.values()) {
            if (e.isLive() && Protocol.DISPLAY_PAGE.equals(e.display())) return e.id();
        }
        return null;
    }

    /** Live entities in tree pre-order starting from the root order. */
    public List<Entity> liveEntitiesInTreeOrder() {
        List<Entity> out = new ArrayList<>();
        for (String id : rootOrder) {
            collect(id, out);
        }
        return out;
    }

    private void collect(String id, List<Entity> out) {
        Entity e = entities.get(id);
        if (e == null || !e.isLive()) return;
        out.add(e);
        for (String child : childrenOf(id)) {
            collect(child, out);
        }
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof PageSnapshot)) return false;
        PageSnapshot o = (PageSnapshot) other;
        return sequence == o.sequence
                && entities.equals(o.entities)
                && rootOrder.equals(o.rootOrder)
                && children.equals(o.children)
                && relationships.equals(o.relationships)
                && cardinalities.equals(o.cardinalities)
                && relConstraints.equals(o.relConstraints)
                && metaConstraints.equals(o.metaConstraints)
                && meta.equals(o.meta)
                && styles.equals(o.styles)
                && entityStyles.equals(o.entityStyles);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entities, rootOrder, children, relationships, cardinalities, relConstraints,
                metaConstraints, meta, styles, entityStyles, sequence);
    }

    @Override
    public String toString() {
        return "PageSnapshot{sequence=" + sequence + ", entities=" + entities.size()
                + ", relationships=" + relationships.size() + '}';
    }
}
