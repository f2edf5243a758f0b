package io.pagesync.core.state;

import java.util.Objects;

/**
 * Directed, typed edge between two entities, independent of the tree.
 */
public record Relationship(String from, String to, String type, Cardinality cardinality) {

    public Relationship {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(cardinality, "cardinality");
    }

    public boolean matches(String f, String t, String ty) {
        return from.equals(f) && to.equals(t) && type.equals(ty);
    }

    public boolean touches(String entityId) {
        return from.equals(entityId) || to.equals(entityId);
    }
}
