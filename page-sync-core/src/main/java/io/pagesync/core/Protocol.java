package io.pagesync.core;

/**
 * Page Sync protocol constants (message types, field names, and well-known values).
 *
 * <p>This module intentionally contains no transport bindings and no JSON library dependencies.
 * It only models protocol-level concerns that are shared across clients and servers.
 */
public final class Protocol {
    private Protocol() {}

    // Discriminator keys. "t" is written; "type" is accepted when "t" is absent.
    public static final String F_T = "t";
    public static final String F_TYPE = "type";

    // Hydration
    public static final String SNAPSHOT_START = "snapshot.start";
    public static final String SNAPSHOT_END = "snapshot.end";

    // Entity operations
    public static final String ENTITY_CREATE = "entity.create";
    public static final String ENTITY_UPDATE = "entity.update";
    public static final String ENTITY_REMOVE = "entity.remove";
    public static final String ENTITY_MOVE = "entity.move";
    public static final String ENTITY_REORDER = "entity.reorder";

    // Relationship operations
    public static final String REL_SET = "rel.set";
    public static final String REL_REMOVE = "rel.remove";
    /** Registers a relationship type's cardinality without creating an edge. */
    public static final String REL_REGISTER = "rel.register";
    public static final String REL_CONSTRAIN = "rel.constrain";

    // Meta and styles
    public static final String META_UPDATE = "meta.update";
    /** Producer-side alias of {@link #META_UPDATE} carrying {@code p} instead of {@code data}. */
    public static final String META_SET = "meta.set";
    public static final String META_CONSTRAIN = "meta.constrain";
    public static final String STYLE_SET = "style.set";
    public static final String STYLE_ENTITY = "style.entity";

    // Signals
    public static final String BATCH_START = "batch.start";
    public static final String BATCH_END = "batch.end";
    public static final String VOICE = "voice";
    public static final String STREAM_START = "stream.start";
    public static final String STREAM_END = "stream.end";

    // Direct edits
    public static final String DIRECT_EDIT = "direct_edit";
    public static final String DIRECT_EDIT_ERROR = "direct_edit.error";

    // Field names
    public static final String F_ID = "id";
    public static final String F_REF = "ref";
    public static final String F_PARENT = "parent";
    public static final String F_DISPLAY = "display";
    public static final String F_PROPS = "p";
    public static final String F_POSITION = "position";
    public static final String F_CHILDREN = "children";
    public static final String F_FROM = "from";
    public static final String F_TO = "to";
    public static final String F_CARDINALITY = "cardinality";
    public static final String F_DATA = "data";
    public static final String F_TITLE = "title";
    public static final String F_IDENTITY = "identity";
    public static final String F_TEXT = "text";
    public static final String F_ENTITY_ID = "entity_id";
    public static final String F_FIELD = "field";
    public static final String F_VALUE = "value";
    public static final String F_ERROR = "error";
    public static final String F_RULE = "rule";
    public static final String F_ENTITIES = "entities";
    public static final String F_REL_TYPE = "rel_type";
    public static final String F_MESSAGE = "message";
    public static final String F_STRICT = "strict";

    /** Parent sentinel for top-level entities. Never a valid entity id. */
    public static final String ROOT = "root";

    /** Display tag of the single top-of-tree entity. */
    public static final String DISPLAY_PAGE = "page";
}
