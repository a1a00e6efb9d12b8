package org.agenticscript.runtime.api;

import java.util.Optional;

/**
 * The outcome of executing a program.
 *
 * @param completedStatements The number of top-level statements that completed.
 * @param error The error that stopped execution, empty on success.
 */
public record ExecutionResult(int completedStatements, Optional<ExecutionError> error) {

    public static ExecutionResult success(int completedStatements) {
        return new ExecutionResult(completedStatements, Optional.empty());
    }

    public static ExecutionResult failure(int completedStatements, ExecutionError error) {
        return new ExecutionResult(completedStatements, Optional.of(error));
    }

    public boolean isSuccess() {
        return error.isEmpty();
    }
}
