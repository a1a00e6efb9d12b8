package org.agenticscript.runtime.stdlib;

import org.agenticscript.runtime.agent.AgentKind;
import org.agenticscript.runtime.model.Value;
import org.agenticscript.runtime.modules.ScriptModule;
import org.agenticscript.runtime.tools.ToolDefinition;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The modules shipped with the runtime.
 */
public final class StandardLibrary {

    public static final String TOOLS_MODULE = "agenticscript.stdlib.tools";
    public static final String AGENTS_MODULE = "agenticscript.stdlib.agents";

    private StandardLibrary() {
    }

    /**
     * @return {@code agenticscript.stdlib.tools}: WebSearch, AgentRouting, FileManager, Calculator.
     */
    public static ScriptModule toolsModule() {
        return new ScriptModule(TOOLS_MODULE, List.of(
                new ToolDefinition("WebSearch", "Searches the web for a query", Set.of("stdlib", "search"), new WebSearchTool()),
                new ToolDefinition("AgentRouting", "Routes a message to the bound agents", Set.of("stdlib", "communication"), new AgentRoutingTool()),
                new ToolDefinition("FileManager", "Performs a file operation", Set.of("stdlib", "files"), new FileManagerTool()),
                new ToolDefinition("Calculator", "Evaluates an arithmetic expression", Set.of("stdlib", "math"), new CalculatorTool())
        ), List.of());
    }

    /**
     * @return {@code agenticscript.stdlib.agents}: the SupervisorAgent kind.
     */
    public static ScriptModule agentsModule() {
        Map<String, Value> defaults = new LinkedHashMap<>();
        defaults.put("children", new Value.ListVal(List.of()));
        defaults.put("restart_policy", Value.of("one_for_one"));
        AgentKind supervisor = new AgentKind("SupervisorAgent", defaults);
        return new ScriptModule(AGENTS_MODULE, List.of(), List.of(supervisor));
    }
}
