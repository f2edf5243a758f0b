package io.pagesync.core.state;

/**
 * A named page-level rule, registered with {@code meta.constrain}.
 *
 * <p>{@link #MAX_CHILDREN} caps the number of live children under {@code parent} at {@code value}.
 * Only strict constraints are enforced.
 */
public record MetaConstraint(String id, String rule, String parent, Integer value, String message, boolean strict) {

    public static final String MAX_CHILDREN = "max_children";

    /** Whether this is an enforced cap on the children of {@code parentId}. */
    boolean capsChildrenOf(String parentId) {
        return strict && MAX_CHILDREN.equals(rule) && value != null && parent != null && parent.equals(parentId);
    }
}
