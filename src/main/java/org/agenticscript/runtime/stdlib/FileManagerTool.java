package org.agenticscript.runtime.stdlib;

import org.agenticscript.runtime.model.Value;
import org.agenticscript.runtime.tools.Tool;
import org.agenticscript.runtime.tools.ToolContext;
import org.agenticscript.runtime.tools.ToolExecutionException;

import java.util.List;

/**
 * Stand-in for file system access. Never touches the disk.
 */
public class FileManagerTool implements Tool {

    @Override
    public Value execute(ToolContext context, List<Value> args) {
        if (args.size() != 1) {
            throw new ToolExecutionException("FileManager expects 1 argument (operation) but got " + args.size());
        }
        return Value.of("Mock file operation: " + args.get(0).display());
    }
}
