package org.agenticscript.frontend.parser;

/**
 * The grammar rules a {@link ParseNode} can be produced by. The comment on each
 * constant documents the node's token and the layout of its children.
 */
public enum Rule {
    /** children: top-level statements. */
    PROGRAM,
    /** token: 'import'; children: [MODULE_PATH, NAME_LIST]. */
    IMPORT,
    /** children: IDENTIFIER leaves. */
    MODULE_PATH,
    /** children: IDENTIFIER leaves. */
    NAME_LIST,
    /** token: agent name; children: [IDENTIFIER kind, MODEL_SPEC, CONFIG_ENTRY...]. */
    AGENT_DECLARATION,
    /** token: synthetic token carrying the assembled model descriptor. */
    MODEL_SPEC,
    /** token: key; children: [expression]. */
    CONFIG_ENTRY,
    /** token: '=' or '+='; children: [IDENTIFIER agent, IDENTIFIER property, expression]. */
    PROPERTY_ASSIGNMENT,
    /** token: variable name; children: [expression]. */
    ASSIGNMENT,
    /** token: variable name; children: [expression]. */
    LET_DECLARATION,
    /** token: 'print'; children: [expression]. */
    PRINT,
    /** children: [expression]. */
    EXPRESSION_STATEMENT,
    /** token: 'if'; children: [condition, BLOCK, optional BLOCK or IF]. */
    IF,
    /** token: '{'; children: statements. */
    BLOCK,
    /** token: 'and' or 'or'; children: [left, right]. */
    LOGICAL,
    /** token: 'not'; children: [operand]. */
    NOT,
    /** token: comparison operator; children: [left, right]. */
    COMPARISON,
    /** token: method name; children: [receiver, ARGUMENT...]. */
    METHOD_CALL,
    /** token: argument name for named arguments, otherwise null; children: [expression]. */
    ARGUMENT,
    /** token: property name; children: [receiver]. */
    PROPERTY_ACCESS,
    /** Leaf: identifier token. */
    IDENTIFIER,
    /** Leaf: string token. */
    STRING,
    /** Leaf: number token. */
    NUMBER,
    /** Leaf: 'true' or 'false' token. */
    BOOLEAN,
    /** Leaf: 'null' token. */
    NULL,
    /** token: the f-string token; children: TEXT_SEGMENT / EXPRESSION_SEGMENT. */
    INTERPOLATED_STRING,
    /** token: synthetic string token holding the literal text. */
    TEXT_SEGMENT,
    /** children: [expression]. */
    EXPRESSION_SEGMENT,
    /** token: '['; children: elements. */
    LIST,
    /** token: '{'; children: MAP_ENTRY nodes. */
    MAP,
    /** token: key (string or identifier); children: [value]. */
    MAP_ENTRY,
    /** token: '{'; children: TOOL_SPEC nodes. */
    TOOL_LIST,
    /** token: tool name; children: IDENTIFIER leaves naming routed agents. */
    TOOL_SPEC
}
