package org.agenticscript.frontend.parser.ast;

/**
 * How a property assignment combines the new value with the existing one.
 */
public enum AssignmentMode {
    /** {@code =} replaces the value. */
    SET,
    /** {@code +=} merges into the existing list-like value. */
    APPEND
}
