package io.pagesync.core.state;

import java.util.List;
import java.util.Map;

/**
 * Read-only view of page state used for validation.
 */
public interface PageView {

    /** The entity with this id, live or tombstoned, or {@code null}. */
    Entity entity(String id);

    /** Live children of {@code parentId} in order; {@code root} yields the root order. */
    List<String> childrenOf(String parentId);

    /** Registered cardinality of a relationship type, or {@code null} if the type is unused. */
    Cardinality cardinalityOf(String type);

    List<Relationship> relationships();

    /** Registered relationship rules keyed by id. */
    Map<String, RelConstraint> relConstraints();

    /** Registered page rules keyed by id. */
    Map<String, MetaConstraint> metaConstraints();

    /** Id of the live {@code page} entity, or {@code null}. */
    String livePageId();

    default boolean isLive(String id) {
        Entity e = entity(id);
        return e != null && e.isLive();
    }
}
