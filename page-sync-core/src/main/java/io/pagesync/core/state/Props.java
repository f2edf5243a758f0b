package io.pagesync.core.state;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable, insertion-ordered mapping of property names to {@link PropValue}s.
 */
public final class Props {

    private static final Props EMPTY = new Props(Map.of());

    private final Map<String, PropValue> values;

    private Props(Map<String, PropValue> values) {
        this.values = values;
    }

    public static Props empty() {
        return EMPTY;
    }

    public static Props of(Map<String, PropValue> values) {
        Objects.requireNonNull(values, "values");
        if (values.isEmpty()) return EMPTY;
        LinkedHashMap<String, PropValue> copy = new LinkedHashMap<>();
        values.forEach((k, v) -> copy.put(Objects.requireNonNull(k, "key"), Objects.requireNonNull(v, "value")));
        return new Props(Collections.unmodifiableMap(copy));
    }

    public static Props of(String key, PropValue value) {
        LinkedHashMap<String, PropValue> m = new LinkedHashMap<>();
        m.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
        return new Props(Collections.unmodifiableMap(m));
    }

    public static Builder builder() {
        return new Builder();
    }

    public PropValue get(String key) {
        return values.get(key);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public int size() {
        return values.size();
    }

    public Map<String, PropValue> asMap() {
        return values;
    }

    /**
     * Shallow merge: keys in {@code patch} overwrite, new keys append in patch order.
     * Returns {@code this} when the patch changes nothing.
     */
    public Props merge(Props patch) {
        Objects.requireNonNull(patch, "patch");
        if (patch.isEmpty()) return this;
        boolean changed = false;
        for (Map.Entry<String, PropValue> e : patch.values.entrySet()) {
            if (!e.getValue().equals(values.get(e.getKey()))) {
                changed = true;
                break;
            }
        }
        if (!changed) return this;
        LinkedHashMap<String, PropValue> merged = new LinkedHashMap<>(values);
        merged.putAll(patch.values);
        return new Props(Collections.unmodifiableMap(merged));
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof Props)) return false;
        return values.equals(((Props) other).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }

    public static final class Builder {
        private final LinkedHashMap<String, PropValue> values = new LinkedHashMap<>();

        private Builder() {}

        public Builder put(String key, PropValue value) {
            values.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder text(String key, String value) {
            return put(key, PropValue.text(value));
        }

        public Builder number(String key, long value) {
            return put(key, PropValue.number(value));
        }

        public Builder bool(String key, boolean value) {
            return put(key, PropValue.bool(value));
        }

        public Props build() {
            return Props.of(values);
        }
    }
}
