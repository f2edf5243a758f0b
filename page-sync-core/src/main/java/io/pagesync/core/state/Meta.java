package io.pagesync.core.state;

import java.util.Objects;

/**
 * Page-level metadata. Either field may be {@code null} until first set.
 */
public record Meta(String title, String identity) {

    public static final Meta EMPTY = new Meta(null, null);

    /** Per-field last-write-wins; {@code null} fields of the patch keep the current value. */
    public Meta merge(String newTitle, String newIdentity) {
        String t = newTitle != null ? newTitle : title;
        String i = newIdentity != null ? newIdentity : identity;
        if (Objects.equals(t, title) && Objects.equals(i, identity)) return this;
        return new Meta(t, i);
    }
}
