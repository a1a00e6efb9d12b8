package org.agenticscript.runtime.modules;

import org.agenticscript.runtime.agent.AgentKind;
import org.agenticscript.runtime.tools.ToolDefinition;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * An importable module: a dotted name and the tools and agent kinds it exports.
 *
 * @param name The dotted module path, e.g. {@code agenticscript.stdlib.tools}.
 * @param tools The exported tools.
 * @param agentKinds The exported agent kinds.
 */
public record ScriptModule(String name, List<ToolDefinition> tools, List<AgentKind> agentKinds) {

    public ScriptModule {
        tools = List.copyOf(tools);
        agentKinds = List.copyOf(agentKinds);
    }

    /**
     * @return All exported names, tools first.
     */
    public Set<String> exports() {
        Set<String> exports = new LinkedHashSet<>();
        tools.forEach(t -> exports.add(t.name()));
        agentKinds.forEach(k -> exports.add(k.name()));
        return exports;
    }
}
