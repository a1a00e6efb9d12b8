package org.agenticscript.runtime.tools;

import java.util.Set;

/**
 * Everything needed to register a tool.
 *
 * @param name The tool name.
 * @param description The human-readable description.
 * @param tags Free-form tags for grouping.
 * @param handler The implementation.
 */
public record ToolDefinition(String name, String description, Set<String> tags, Tool handler) {

    public ToolDefinition {
        tags = Set.copyOf(tags);
    }

    /**
     * Registers this definition with the given registry.
     */
    public void registerWith(ToolRegistry registry) {
        registry.register(name, handler, description, tags);
    }
}
