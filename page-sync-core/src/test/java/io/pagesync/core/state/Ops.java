package io.pagesync.core.state;

import io.pagesync.core.Operation;

import java.util.List;

/** Short constructors for test operations. */
final class Ops {

    private Ops() {}

    static Operation.EntityCreate create(String id, String parent, String display) {
        return new Operation.EntityCreate(id, parent, display, Props.empty());
    }

    static Operation.EntityCreate create(String id, String parent, String display, Props props) {
        return new Operation.EntityCreate(id, parent, display, props);
    }

    static Operation.EntityUpdate update(String ref, Props props) {
        return new Operation.EntityUpdate(ref, props);
    }

    static Operation.EntityRemove remove(String ref) {
        return new Operation.EntityRemove(ref);
    }

    static Operation.EntityMove move(String ref, String parent, Integer position) {
        return new Operation.EntityMove(ref, parent, position);
    }

    static Operation.EntityReorder reorder(String ref, String... children) {
        return new Operation.EntityReorder(ref, List.of(children));
    }

    static Operation.RelSet relSet(String from, String to, String type, Cardinality cardinality) {
        return new Operation.RelSet(from, to, type, cardinality);
    }

    static Operation.RelRemove relRemove(String from, String to, String type) {
        return new Operation.RelRemove(from, to, type);
    }

    static Operation.RelConstrain excludePair(String id, String first, String second, String relType) {
        return new Operation.RelConstrain(new RelConstraint(id, RelConstraint.EXCLUDE_PAIR, List.of(first, second),
                relType, null, null, true));
    }

    static Operation.MetaConstrain maxChildren(String id, String parent, int value) {
        return new Operation.MetaConstrain(new MetaConstraint(id, MetaConstraint.MAX_CHILDREN, parent, value,
                null, true));
    }
}
