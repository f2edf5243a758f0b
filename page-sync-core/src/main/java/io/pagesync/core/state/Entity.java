package io.pagesync.core.state;

import java.util.Objects;

/**
 * One node of the page tree.
 *
 * @param id immutable, document-unique id
 * @param parent parent entity id or {@code root}
 * @param display display tag, {@code page} for the top of the tree; may be {@code null}
 * @param props shallow-merged properties
 * @param creationSeq sequence of the operation that created the entity
 * @param updatedSeq sequence of the last operation that touched the entity
 * @param removed tombstone flag
 */
public record Entity(String id, String parent, String display, Props props, long creationSeq, long updatedSeq, boolean removed) {

    public Entity {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(parent, "parent");
        Objects.requireNonNull(props, "props");
    }

    public boolean isLive() {
        return !removed;
    }

    Entity withProps(Props p, long seq) {
        return new Entity(id, parent, display, p, creationSeq, seq, removed);
    }

    Entity withParent(String p, long seq) {
        return new Entity(id, p, display, props, creationSeq, seq, removed);
    }

    Entity tombstoned(long seq) {
        return new Entity(id, parent, display, props, creationSeq, seq, true);
    }

    Entity touched(long seq) {
        return new Entity(id, parent, display, props, creationSeq, seq, removed);
    }
}
