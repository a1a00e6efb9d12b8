package org.agenticscript.runtime.tools;

import org.agenticscript.runtime.model.Value;

import java.util.List;

/**
 * A named capability agents can invoke through {@code execute_tool}.
 * <p>
 * Handlers are called from the interpreter thread of whichever script uses them and must be
 * thread-safe, unless they report {@link #isReentrant()} as {@code false}, in which case the
 * registry serializes their calls.
 */
@FunctionalInterface
public interface Tool {

    /**
     * Executes the tool.
     *
     * @param context The calling agent and its binding of this tool.
     * @param args    The script arguments following the tool name.
     * @return The result value.
     * @throws ToolExecutionException if the call fails.
     */
    Value execute(ToolContext context, List<Value> args) throws ToolExecutionException;

    default boolean isReentrant() {
        return true;
    }
}
