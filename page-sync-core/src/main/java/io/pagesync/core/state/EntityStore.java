package io.pagesync.core.state;

import io.pagesync.core.Operation;
import io.pagesync.core.PageSyncException.ValidationError;
import io.pagesync.core.Protocol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable working copy of one page.
 *
 * <p>The store validates every operation before touching state, so a rejected operation leaves it
 * exactly as it was. The children index and root order are maintained per operation rather than
 * recomputed. Not thread-safe: callers serialize access (one writer per document).
 */
public final class EntityStore implements PageView {

    private final Map<String, Entity> entities;
    private final List<String> rootOrder;
    private final Map<String, List<String>> children;
    private final List<Relationship> relationships;
    private final Map<String, Cardinality> cardinalities;
    private final Map<String, RelConstraint> relConstraints;
    private final Map<String, MetaConstraint> metaConstraints;
    private final Map<String, Props> entityStyles;
    private Meta meta;
    private Props styles;
    private long sequence;
    private String livePageId;

    private PageSnapshot cached;

    public EntityStore() {
        this(PageSnapshot.empty());
    }

    private EntityStore(PageSnapshot from) {
        this.entities = new LinkedHashMap<>(from.entities());
        this.rootOrder = new ArrayList<>(from.rootOrder());
        this.children = new LinkedHashMap<>();
        from.children().forEach((k, v) -> children.put(k, new ArrayList<>(v)));
        this.relationships = new ArrayList<>(from.relationships());
        this.cardinalities = new LinkedHashMap<>(from.cardinalities());
        this.relConstraints = new LinkedHashMap<>(from.relConstraints());
        this.metaConstraints = new LinkedHashMap<>(from.metaConstraints());
        this.entityStyles = new LinkedHashMap<>(from.entityStyles());
        this.meta = from.meta();
        this.styles = from.styles();
        this.sequence = from.sequence();
        this.livePageId = from.livePageId();
        this.cached = from;
    }

    public static EntityStore from(PageSnapshot snapshot) {
        return new EntityStore(snapshot);
    }

    /**
     * Validates and applies one operation.
     *
     * @return {@code true} if state changed, {@code false} for a valid operation with no effect
     * @throws ValidationError if the operation is invalid; state is untouched
     */
    public boolean apply(Operation op) {
        OperationValidator.validate(this, op);
        boolean changed = mutate(op);
        if (changed) {
            cached = null;
        }
        return changed;
    }

    /** Immutable view of the current state; the same instance is returned until the next change. */
    public PageSnapshot snapshot() {
        PageSnapshot s = cached;
        if (s == null) {
            s = PageSnapshot.copyOf(entities, rootOrder, children, relationships, cardinalities, relConstraints,
                    metaConstraints, meta, styles, entityStyles, sequence);
            cached = s;
        }
        return s;
    }

    public long sequence() {
        return sequence;
    }

    @Override
    public Entity entity(String id) {
        return entities.get(id);
    }

    @Override
    public List<String> childrenOf(String parentId) {
        if (Protocol.ROOT.equals(parentId)) return List.copyOf(rootOrder);
        List<String> kids = children.get(parentId);
        return kids == null ? List.of() : List.copyOf(kids);
    }

    @Override
    public Cardinality cardinalityOf(String type) {
        return cardinalities.get(type);
    }

    @Override
    public List<Relationship> relationships() {
        return Collections.unmodifiableList(relationships);
    }

    @Override
    public Map<String, RelConstraint> relConstraints() {
        return Collections.unmodifiableMap(relConstraints);
    }

    @Override
    public Map<String, MetaConstraint> metaConstraints() {
        return Collections.unmodifiableMap(metaConstraints);
    }

    @Override
    public String livePageId() {
        return livePageId;
    }

    private boolean mutate(Operation op) {
        if (op instanceof Operation.EntityCreate create) return create(create);
        if (op instanceof Operation.EntityUpdate update) return update(update);
        if (op instanceof Operation.EntityRemove remove) return remove(remove.ref());
        if (op instanceof Operation.EntityMove move) return move(move);
        if (op instanceof Operation.EntityReorder reorder) return reorder(reorder);
        if (op instanceof Operation.RelSet rel) return relSet(rel);
        if (op instanceof Operation.RelRemove rel) return relRemove(rel);
        if (op instanceof Operation.RelRegister rel) return relRegister(rel);
        if (op instanceof Operation.RelConstrain c) return constrain(relConstraints, c.constraint().id(), c.constraint());
        if (op instanceof Operation.MetaUpdate m) return metaUpdate(m);
        if (op instanceof Operation.MetaConstrain c) return constrain(metaConstraints, c.constraint().id(), c.constraint());
        if (op instanceof Operation.StyleSet s) return styleSet(s);
        if (op instanceof Operation.StyleEntity s) return styleEntity(s);
        throw new IllegalArgumentException("unsupported operation: " + op.wireType());
    }

    private boolean create(Operation.EntityCreate op) {
        long seq = ++sequence;
        entities.put(op.id(), new Entity(op.id(), op.parent(), op.display(), op.props(), seq, seq, false));
        listFor(op.parent()).add(op.id());
        if (Protocol.DISPLAY_PAGE.equals(op.display())) {
            livePageId = op.id();
        }
        return true;
    }

    private boolean update(Operation.EntityUpdate op) {
        Entity e = entities.get(op.ref());
        Props merged = e.props().merge(op.props());
        if (merged == e.props()) return false;
        entities.put(e.id(), e.withProps(merged, ++sequence));
        return true;
    }

    private boolean remove(String ref) {
        long seq = ++sequence;
        Entity top = entities.get(ref);
        detach(top.parent(), ref);
        Set<String> removed = new HashSet<>();
        tombstone(ref, seq, removed);
        relationships.removeIf(r -> removed.contains(r.from()) || removed.contains(r.to()));
        entityStyles.keySet().removeAll(removed);
        if (livePageId != null && removed.contains(livePageId)) {
            livePageId = null;
        }
        return true;
    }

    private void tombstone(String id, long seq, Set<String> removed) {
        Entity e = entities.get(id);
        if (e == null || e.removed()) return;
        entities.put(id, e.tombstoned(seq));
        removed.add(id);
        List<String> kids = children.remove(id);
        if (kids != null) {
            for (String child : kids) {
                tombstone(child, seq, removed);
            }
        }
    }

    private boolean move(Operation.EntityMove op) {
        Entity e = entities.get(op.ref());
        String newParent = op.parent();
        List<String> before = childrenOf(newParent);
        if (newParent.equals(e.parent())) {
            List<String> reordered = new ArrayList<>(before);
            reordered.remove(op.ref());
            insert(reordered, op.ref(), op.position());
            if (reordered.equals(before)) return false;
            replaceList(newParent, reordered);
        } else {
            detach(e.parent(), op.ref());
            insert(listFor(newParent), op.ref(), op.position());
        }
        entities.put(e.id(), e.withParent(newParent, ++sequence));
        return true;
    }

    private static void insert(List<String> list, String id, Integer position) {
        if (position != null && position >= 0 && position <= list.size()) {
            list.add(position, id);
        } else {
            list.add(id);
        }
    }

    private boolean reorder(Operation.EntityReorder op) {
        List<String> before = childrenOf(op.ref());
        List<String> after = new ArrayList<>(op.children());
        for (String child : before) {
            if (!after.contains(child)) after.add(child);
        }
        if (after.equals(before)) return false;
        long seq = ++sequence;
        replaceList(op.ref(), after);
        if (!Protocol.ROOT.equals(op.ref())) {
            entities.put(op.ref(), entities.get(op.ref()).touched(seq));
        }
        return true;
    }

    private boolean relSet(Operation.RelSet op) {
        Cardinality registered = cardinalities.get(op.type());
        Cardinality card = registered != null ? registered
                : op.cardinality() != null ? op.cardinality() : Cardinality.MANY_TO_MANY;
        boolean present = false;
        boolean conflicts = false;
        for (Relationship r : relationships) {
            if (r.matches(op.from(), op.to(), op.type())) {
                present = true;
            } else if (conflictsWith(r, op, card)) {
                conflicts = true;
            }
        }
        if (present && !conflicts) return false;
        cardinalities.putIfAbsent(op.type(), card);
        relationships.removeIf(r -> !r.matches(op.from(), op.to(), op.type()) && conflictsWith(r, op, card));
        if (!present) {
            relationships.add(new Relationship(op.from(), op.to(), op.type(), card));
        }
        sequence++;
        return true;
    }

    private static boolean conflictsWith(Relationship r, Operation.RelSet op, Cardinality card) {
        if (!r.type().equals(op.type())) return false;
        switch (card) {
            case MANY_TO_ONE:
                return r.from().equals(op.from());
            case ONE_TO_ONE:
                return r.from().equals(op.from()) || r.to().equals(op.to());
            default:
                return false;
        }
    }

    private boolean relRemove(Operation.RelRemove op) {
        boolean removed = false;
        Iterator<Relationship> it = relationships.iterator();
        while (it.hasNext()) {
            if (it.next().matches(op.from(), op.to(), op.type())) {
                it.remove();
                removed = true;
            }
        }
        if (removed) sequence++;
        return removed;
    }

    private boolean relRegister(Operation.RelRegister op) {
        if (cardinalities.putIfAbsent(op.type(), op.cardinality()) != null) return false;
        sequence++;
        return true;
    }

    private <C> boolean constrain(Map<String, C> registry, String id, C constraint) {
        if (constraint.equals(registry.put(id, constraint))) return false;
        sequence++;
        return true;
    }

    private boolean metaUpdate(Operation.MetaUpdate op) {
        Meta merged = meta.merge(op.title(), op.identity());
        if (merged == meta) return false;
        meta = merged;
        sequence++;
        return true;
    }

    private boolean styleSet(Operation.StyleSet op) {
        Props merged = styles.merge(op.props());
        if (merged == styles) return false;
        styles = merged;
        sequence++;
        return true;
    }

    private boolean styleEntity(Operation.StyleEntity op) {
        Props current = entityStyles.getOrDefault(op.ref(), Props.empty());
        Props merged = current.merge(op.props());
        if (merged == current) return false;
        entityStyles.put(op.ref(), merged);
        sequence++;
        return true;
    }

    private List<String> listFor(String parent) {
        if (Protocol.ROOT.equals(parent)) return rootOrder;
        return children.computeIfAbsent(parent, k -> new ArrayList<>());
    }

    private void replaceList(String parent, List<String> ordered) {
        List<String> target = listFor(parent);
        target.clear();
        target.addAll(ordered);
    }

    private void detach(String parent, String id) {
        if (Protocol.ROOT.equals(parent)) {
            rootOrder.remove(id);
            return;
        }
        List<String> kids = children.get(parent);
        if (kids == null) return;
        kids.remove(id);
        if (kids.isEmpty()) children.remove(parent);
    }
}
