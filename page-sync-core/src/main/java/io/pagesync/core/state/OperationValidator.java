package io.pagesync.core.state;

import io.pagesync.core.Operation;
import io.pagesync.core.PageSyncException.ValidationError;
import io.pagesync.core.PageSyncException.ValidationError.Kind;
import io.pagesync.core.Protocol;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Checks an operation against the current page state before anything is mutated.
 *
 * <p>Every producer goes through the same checks: the model feed, the HTTP producer endpoint,
 * client operation messages, direct edits and client replicas.
 */
public final class OperationValidator {

    private static final Pattern ID_PATTERN = Pattern.compile("^[a-z][a-z0-9_]{0,63}$");

    private OperationValidator() {}

    public static boolean isValidId(String id) {
        return id != null && !Protocol.ROOT.equals(id) && ID_PATTERN.matcher(id).matches();
    }

    /**
     * @throws ValidationError if applying {@code op} to {@code view} would break an invariant
     */
    public static void validate(PageView view, Operation op) {
        if (op instanceof Operation.EntityCreate create) {
            validateCreate(view, create);
        } else if (op instanceof Operation.EntityUpdate update) {
            requireLive(view, require(update.ref(), "entity.update", Protocol.F_REF));
        } else if (op instanceof Operation.EntityRemove remove) {
            requireLive(view, require(remove.ref(), "entity.remove", Protocol.F_REF));
        } else if (op instanceof Operation.EntityMove move) {
            validateMove(view, move);
        } else if (op instanceof Operation.EntityReorder reorder) {
            validateReorder(view, reorder);
        } else if (op instanceof Operation.RelSet rel) {
            validateRelSet(view, rel);
        } else if (op instanceof Operation.RelRemove rel) {
            requireLive(view, require(rel.from(), "rel.remove", Protocol.F_FROM));
            requireLive(view, require(rel.to(), "rel.remove", Protocol.F_TO));
            require(rel.type(), "rel.remove", Protocol.F_TYPE);
        } else if (op instanceof Operation.RelRegister rel) {
            validateRelRegister(view, rel);
        } else if (op instanceof Operation.RelConstrain c) {
            validateRelConstrain(view, c.constraint());
        } else if (op instanceof Operation.MetaConstrain c) {
            validateMetaConstrain(view, c.constraint());
        } else if (op instanceof Operation.StyleEntity style) {
            requireLive(view, require(style.ref(), "style.entity", Protocol.F_REF));
        }
        // meta.update and style.set have no preconditions
    }

    private static void validateCreate(PageView view, Operation.EntityCreate create) {
        String id = require(create.id(), "entity.create", Protocol.F_ID);
        if (!isValidId(id)) {
            throw new ValidationError(Kind.INVALID_ID, "'" + id + "' must match " + ID_PATTERN.pattern() + " and not be 'root'");
        }
        if (view.entity(id) != null) {
            throw new ValidationError(Kind.DUPLICATE_ID, "'" + id + "' already exists");
        }
        String parent = create.parent();
        if (!Protocol.ROOT.equals(parent) && !view.isLive(parent)) {
            throw new ValidationError(Kind.UNKNOWN_PARENT, "'" + parent + "' does not exist or is removed");
        }
        if (Protocol.DISPLAY_PAGE.equals(create.display())) {
            String page = view.livePageId();
            if (page != null) {
                throw new ValidationError(Kind.DUPLICATE_PAGE, "'" + page + "' is already the page");
            }
        }
        requireRoomUnder(view, parent);
    }

    private static void validateMove(PageView view, Operation.EntityMove move) {
        String ref = require(move.ref(), "entity.move", Protocol.F_REF);
        requireLive(view, ref);
        String parent = move.parent();
        if (!Protocol.ROOT.equals(parent)) {
            if (!view.isLive(parent)) {
                throw new ValidationError(Kind.UNKNOWN_PARENT, "'" + parent + "' does not exist or is removed");
            }
            String cursor = parent;
            while (cursor != null && !Protocol.ROOT.equals(cursor)) {
                if (cursor.equals(ref)) {
                    throw new ValidationError(Kind.INVALID_MOVE, "moving '" + ref + "' under '" + parent + "' would create a cycle");
                }
                Entity e = view.entity(cursor);
                cursor = e == null ? null : e.parent();
            }
        }
        if (!parent.equals(view.entity(ref).parent())) {
            requireRoomUnder(view, parent);
        }
    }

    private static void requireRoomUnder(PageView view, String parent) {
        for (MetaConstraint c : view.metaConstraints().values()) {
            if (c.capsChildrenOf(parent) && view.childrenOf(parent).size() >= c.value()) {
                throw violated(c.id(), c.message(), "'" + parent + "' already has " + c.value() + " children");
            }
        }
    }

    private static void validateReorder(PageView view, Operation.EntityReorder reorder) {
        String ref = require(reorder.ref(), "entity.reorder", Protocol.F_REF);
        if (!Protocol.ROOT.equals(ref)) {
            requireLive(view, ref);
        }
        List<String> listed = reorder.children();
        if (listed == null) {
            throw new ValidationError(Kind.MISSING_FIELD, "entity.reorder requires '" + Protocol.F_CHILDREN + "'");
        }
        Set<String> current = new HashSet<>(view.childrenOf(ref));
        Set<String> seen = new HashSet<>();
        for (String child : listed) {
            if (!seen.add(child)) {
                throw new ValidationError(Kind.INVALID_REORDER, "'" + child + "' is listed more than once");
            }
            if (!current.contains(child)) {
                throw new ValidationError(Kind.INVALID_REORDER, "'" + child + "' is not a live child of '" + ref + "'");
            }
        }
    }

    private static void validateRelSet(PageView view, Operation.RelSet rel) {
        requireLive(view, require(rel.from(), "rel.set", Protocol.F_FROM));
        requireLive(view, require(rel.to(), "rel.set", Protocol.F_TO));
        String type = require(rel.type(), "rel.set", Protocol.F_TYPE);
        Cardinality registered = view.cardinalityOf(type);
        if (registered != null && rel.cardinality() != null && registered != rel.cardinality()) {
            throw new ValidationError(Kind.INVALID_CARDINALITY,
                    "'" + type + "' is " + registered.wireName() + ", not " + rel.cardinality().wireName());
        }
        Cardinality effective = registered != null ? registered
                : rel.cardinality() != null ? rel.cardinality() : Cardinality.MANY_TO_MANY;
        // one_to_one evicts the partner's edge to the same target instead of sharing it
        if (effective == Cardinality.ONE_TO_ONE) return;
        for (RelConstraint c : view.relConstraints().values()) {
            List<String> pair = c.strict() ? c.excludedPair() : null;
            if (pair == null || !type.equals(c.relType()) || !pair.contains(rel.from())) continue;
            String partner = pair.get(0).equals(rel.from()) ? pair.get(1) : pair.get(0);
            for (Relationship r : view.relationships()) {
                if (r.matches(partner, rel.to(), type)) {
                    throw violated(c.id(), c.message(), "'" + rel.from() + "' and '" + partner + "' cannot both point at '"
                            + rel.to() + "' through '" + type + "'");
                }
            }
        }
    }

    private static void validateRelRegister(PageView view, Operation.RelRegister rel) {
        String type = require(rel.type(), "rel.register", Protocol.F_TYPE);
        if (rel.cardinality() == null) {
            throw new ValidationError(Kind.MISSING_FIELD, "rel.register requires '" + Protocol.F_CARDINALITY + "'");
        }
        Cardinality registered = view.cardinalityOf(type);
        if (registered != null && registered != rel.cardinality()) {
            throw new ValidationError(Kind.INVALID_CARDINALITY,
                    "'" + type + "' is " + registered.wireName() + ", not " + rel.cardinality().wireName());
        }
    }

    private static void validateRelConstrain(PageView view, RelConstraint c) {
        require(c.id(), "rel.constrain", Protocol.F_ID);
        List<String> pair = c.strict() ? c.excludedPair() : null;
        if (pair == null) return;
        Set<String> firstTargets = new HashSet<>();
        for (Relationship r : view.relationships()) {
            if (r.type().equals(c.relType()) && r.from().equals(pair.get(0))) firstTargets.add(r.to());
        }
        for (Relationship r : view.relationships()) {
            if (r.type().equals(c.relType()) && r.from().equals(pair.get(1)) && firstTargets.contains(r.to())) {
                throw violated(c.id(), c.message(), "'" + pair.get(0) + "' and '" + pair.get(1) + "' already share '" + r.to() + "'");
            }
        }
    }

    private static void validateMetaConstrain(PageView view, MetaConstraint c) {
        require(c.id(), "meta.constrain", Protocol.F_ID);
        if (c.capsChildrenOf(c.parent()) && view.childrenOf(c.parent()).size() > c.value()) {
            throw violated(c.id(), c.message(), "'" + c.parent() + "' already has " + view.childrenOf(c.parent()).size() + " children");
        }
    }

    private static ValidationError violated(String id, String message, String detail) {
        return new ValidationError(Kind.CONSTRAINT_VIOLATED,
                "constraint '" + id + "': " + (message != null ? message : detail));
    }

    private static String require(String value, String op, String field) {
        if (value == null) {
            throw new ValidationError(Kind.MISSING_FIELD, op + " requires '" + field + "'");
        }
        return value;
    }

    private static void requireLive(PageView view, String id) {
        if (!view.isLive(id)) {
            throw new ValidationError(Kind.UNKNOWN_ENTITY, "'" + id + "' does not exist or is removed");
        }
    }
}
