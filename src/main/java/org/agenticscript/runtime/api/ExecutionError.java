package org.agenticscript.runtime.api;

import org.agenticscript.frontend.api.SourceInfo;

/**
 * Describes the statement failure that stopped a program.
 *
 * @param code The error classification.
 * @param message The human-readable message.
 * @param sourceInfo The position of the failing statement.
 */
public record ExecutionError(ErrorCode code, String message, SourceInfo sourceInfo) {

    @Override
    public String toString() {
        return String.format("[%s] %s: %s", code, sourceInfo, message);
    }
}
