package org.agenticscript.runtime.api;

/**
 * Raised when a declaration would shadow or redefine a visible name.
 */
public class DuplicateNameException extends ScriptError {

    public DuplicateNameException(String name) {
        super(ErrorCode.DUPLICATE_NAME, "Name already defined: " + name);
    }
}
