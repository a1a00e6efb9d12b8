package org.agenticscript.runtime.api;

/**
 * Classifies every error a script can raise.
 */
public enum ErrorCode {
    SYNTAX_ERROR,
    DUPLICATE_NAME,
    UNKNOWN_AGENT,
    UNKNOWN_AGENT_KIND,
    UNKNOWN_TOOL,
    DUPLICATE_TOOL,
    TYPE_ERROR,
    TOOL_NOT_ASSIGNED,
    TOOL_EXECUTION_ERROR,
    TIMEOUT,
    UNDEFINED_VARIABLE,
    READ_ONLY_PROPERTY,
    UNKNOWN_METHOD,
    ARGUMENT_ERROR,
    IMPORT_ERROR,
    AGENT_PROCESSING_ERROR
}
