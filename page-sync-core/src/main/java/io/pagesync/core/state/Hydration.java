package io.pagesync.core.state;

import io.pagesync.core.Message;
import io.pagesync.core.Operation;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Renders a snapshot as the message sequence a fresh connection receives.
 *
 * <p>Order: {@code snapshot.start}, {@code meta.update}, {@code style.set}, {@code entity.create} for
 * every live entity in tree pre-order, {@code style.entity}, {@code rel.register} for types registered
 * without a live edge, {@code rel.set}, {@code meta.constrain}, {@code rel.constrain}, {@code snapshot.end}.
 * Replaying the operations between the markers onto an empty store reproduces the live tree,
 * relationships, registered cardinalities, constraints, meta and styles of the source snapshot.
 */
public final class Hydration {

    private Hydration() {}

    public static List<Message> messages(PageSnapshot snapshot) {
        List<Message> out = new ArrayList<>();
        out.add(Message.SNAPSHOT_START);
        out.addAll(operations(snapshot));
        out.add(Message.SNAPSHOT_END);
        return out;
    }

    /** The state-carrying part of {@link #messages(PageSnapshot)}, without the markers. */
    public static List<Operation> operations(PageSnapshot snapshot) {
        List<Operation> out = new ArrayList<>();
        Meta meta = snapshot.meta();
        if (meta.title() != null || meta.identity() != null) {
            out.add(new Operation.MetaUpdate(meta.title(), meta.identity()));
        }
        if (!snapshot.styles().isEmpty()) {
            out.add(new Operation.StyleSet(snapshot.styles()));
        }
        for (Entity e : snapshot.liveEntitiesInTreeOrder()) {
            out.add(new Operation.EntityCreate(e.id(), e.parent(), e.display(), e.props()));
        }
        for (Map.Entry<String, Props> e : snapshot.entityStyles().entrySet()) {
            out.add(new Operation.StyleEntity(e.getKey(), e.getValue()));
        }
        Set<String> withEdges = new HashSet<>();
        for (Relationship r : snapshot.relationships()) {
            withEdges.add(r.type());
        }
        for (Map.Entry<String, Cardinality> e : snapshot.cardinalities().entrySet()) {
            if (!withEdges.contains(e.getKey())) {
                out.add(new Operation.RelRegister(e.getKey(), e.getValue()));
            }
        }
        for (Relationship r : snapshot.relationships()) {
            out.add(new Operation.RelSet(r.from(), r.to(), r.type(), r.cardinality()));
        }
        for (MetaConstraint c : snapshot.metaConstraints().values()) {
            out.add(new Operation.MetaConstrain(c));
        }
        for (RelConstraint c : snapshot.relConstraints().values()) {
            out.add(new Operation.RelConstrain(c));
        }
        return out;
    }
}
