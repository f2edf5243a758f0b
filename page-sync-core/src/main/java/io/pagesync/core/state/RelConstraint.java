package io.pagesync.core.state;

import java.util.List;

/**
 * A named rule over relationships, registered with {@code rel.constrain}.
 *
 * <p>Only {@link #EXCLUDE_PAIR} is enforced: the two {@code entities} may not point at the same target
 * through {@code relType}. Strict constraints reject violating operations; the rest are recorded for
 * renderers and producers to consult. Unknown rules are stored as given.
 *
 * @param id       constraint id; re-registering an id replaces the constraint
 * @param entities entity ids the rule applies to
 * @param value    rule parameter, if the rule takes one
 */
public record RelConstraint(String id, String rule, List<String> entities, String relType, Integer value,
                            String message, boolean strict) {

    public static final String EXCLUDE_PAIR = "exclude_pair";

    public RelConstraint {
        entities = entities == null ? List.of() : List.copyOf(entities);
    }

    /** The two entities of a well-formed {@code exclude_pair} rule, or {@code null}. */
    List<String> excludedPair() {
        if (!EXCLUDE_PAIR.equals(rule) || relType == null || entities.size() != 2) return null;
        if (entities.get(0).equals(entities.get(1))) return null;
        return entities;
    }
}
