package io.pagesync.core;

import io.pagesync.core.state.Cardinality;
import io.pagesync.core.state.MetaConstraint;
import io.pagesync.core.state.Props;
import io.pagesync.core.state.RelConstraint;

import java.util.List;
import java.util.Objects;

/**
 * Messages that change page state when applied by the entity store.
 *
 * <p>Required fields may be {@code null} after decoding; the validator rejects them with
 * {@code MISSING_FIELD} rather than the codec failing the whole frame.
 */
public sealed interface Operation extends Message permits Operation.EntityCreate, Operation.EntityUpdate,
        Operation.EntityRemove, Operation.EntityMove, Operation.EntityReorder, Operation.RelSet, Operation.RelRemove,
        Operation.RelRegister, Operation.RelConstrain, Operation.MetaUpdate, Operation.MetaConstrain,
        Operation.StyleSet, Operation.StyleEntity {

    /**
     * A missing {@code parent} means {@code root}.
     */
    record EntityCreate(String id, String parent, String display, Props props) implements Operation {
        public EntityCreate {
            parent = parent == null ? Protocol.ROOT : parent;
            props = props == null ? Props.empty() : props;
        }

        @Override
        public String wireType() {
            return Protocol.ENTITY_CREATE;
        }
    }

    record EntityUpdate(String ref, Props props) implements Operation {
        public EntityUpdate {
            props = props == null ? Props.empty() : props;
        }

        @Override
        public String wireType() {
            return Protocol.ENTITY_UPDATE;
        }
    }

    record EntityRemove(String ref) implements Operation {
        @Override
        public String wireType() {
            return Protocol.ENTITY_REMOVE;
        }
    }

    /**
     * Reparents {@code ref} under {@code parent}. A {@code position} within {@code [0, size]} inserts
     * there; anything else (including {@code null}) appends.
     */
    record EntityMove(String ref, String parent, Integer position) implements Operation {
        public EntityMove {
            parent = parent == null ? Protocol.ROOT : parent;
        }

        @Override
        public String wireType() {
            return Protocol.ENTITY_MOVE;
        }
    }

    record EntityReorder(String ref, List<String> children) implements Operation {
        public EntityReorder {
            children = children == null ? null : List.copyOf(children);
        }

        @Override
        public String wireType() {
            return Protocol.ENTITY_REORDER;
        }
    }

    /**
     * @param cardinality optional; registered for the type on first use, {@code many_to_many} if absent
     */
    record RelSet(String from, String to, String type, Cardinality cardinality) implements Operation {
        @Override
        public String wireType() {
            return Protocol.REL_SET;
        }
    }

    record RelRemove(String from, String to, String type) implements Operation {
        @Override
        public String wireType() {
            return Protocol.REL_REMOVE;
        }
    }

    /**
     * Registers {@code type} with {@code cardinality}. A no-op when already registered the same way.
     */
    record RelRegister(String type, Cardinality cardinality) implements Operation {
        @Override
        public String wireType() {
            return Protocol.REL_REGISTER;
        }
    }

    record RelConstrain(RelConstraint constraint) implements Operation {
        public RelConstrain {
            Objects.requireNonNull(constraint, "constraint");
        }

        @Override
        public String wireType() {
            return Protocol.REL_CONSTRAIN;
        }
    }

    record MetaConstrain(MetaConstraint constraint) implements Operation {
        public MetaConstrain {
            Objects.requireNonNull(constraint, "constraint");
        }

        @Override
        public String wireType() {
            return Protocol.META_CONSTRAIN;
        }
    }

    record MetaUpdate(String title, String identity) implements Operation {
        @Override
        public String wireType() {
            return Protocol.META_UPDATE;
        }
    }

    record StyleSet(Props props) implements Operation {
        public StyleSet {
            Objects.requireNonNull(props, "props");
        }

        @Override
        public String wireType() {
            return Protocol.STYLE_SET;
        }
    }

    record StyleEntity(String ref, Props props) implements Operation {
        public StyleEntity {
            props = props == null ? Props.empty() : props;
        }

        @Override
        public String wireType() {
            return Protocol.STYLE_ENTITY;
        }
    }
}
