package io.pagesync.core.state;

import java.util.Locale;

/**
 * How many active edges of one relationship type an entity may take part in.
 */
public enum Cardinality {
    /** At most one edge per {@code (from, type)}; a new edge replaces the prior one. */
    MANY_TO_ONE("many_to_one"),
    /** At most one edge per {@code (from, type)} and per {@code (to, type)}. */
    ONE_TO_ONE("one_to_one"),
    MANY_TO_MANY("many_to_many");

    private final String wireName;

    Cardinality(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Cardinality fromWire(String name) {
        String n = name.toLowerCase(Locale.ROOT);
        for (Cardinality c : values()) {
            if (c.wireName.equals(n)) return c;
        }
        throw new IllegalArgumentException("unknown cardinality: " + name);
    }
}
