package org.agenticscript.runtime.stdlib;

import org.agenticscript.runtime.model.Value;
import org.agenticscript.runtime.tools.Tool;
import org.agenticscript.runtime.tools.ToolContext;
import org.agenticscript.runtime.tools.ToolExecutionException;

import java.util.List;

/**
 * Stand-in for a web search capability. Answers with a canned result for the query.
 */
public class WebSearchTool implements Tool {

    @Override
    public Value execute(ToolContext context, List<Value> args) {
        if (args.size() != 1) {
            throw new ToolExecutionException("WebSearch expects 1 argument (query) but got " + args.size());
        }
        return Value.of("Mock search results for: " + args.get(0).display());
    }
}
