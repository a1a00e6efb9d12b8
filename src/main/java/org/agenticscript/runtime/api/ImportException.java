package org.agenticscript.runtime.api;

public class ImportException extends ScriptError {

    public ImportException(String message) {
        super(ErrorCode.IMPORT_ERROR, message);
    }
}
