package org.agenticscript.runtime.interpreter;

import org.agenticscript.frontend.parser.ast.AgentDeclarationNode;
import org.agenticscript.frontend.parser.ast.AssignmentMode;
import org.agenticscript.frontend.parser.ast.AssignmentNode;
import org.agenticscript.frontend.parser.ast.AstNode;
import org.agenticscript.frontend.parser.ast.BooleanLiteralNode;
import org.agenticscript.frontend.parser.ast.ComparisonNode;
import org.agenticscript.frontend.parser.ast.ComparisonOperator;
import org.agenticscript.frontend.parser.ast.ConfigEntryNode;
import org.agenticscript.frontend.parser.ast.ExpressionStatementNode;
import org.agenticscript.frontend.parser.ast.IdentifierNode;
import org.agenticscript.frontend.parser.ast.IfStatementNode;
import org.agenticscript.frontend.parser.ast.ImportStatementNode;
import org.agenticscript.frontend.parser.ast.InterpolatedStringNode;
import org.agenticscript.frontend.parser.ast.ListLiteralNode;
import org.agenticscript.frontend.parser.ast.LogicalExpressionNode;
import org.agenticscript.frontend.parser.ast.LogicalOperator;
import org.agenticscript.frontend.parser.ast.MapEntryNode;
import org.agenticscript.frontend.parser.ast.MapLiteralNode;
import org.agenticscript.frontend.parser.ast.MethodCallNode;
import org.agenticscript.frontend.parser.ast.NotExpressionNode;
import org.agenticscript.frontend.parser.ast.NullLiteralNode;
import org.agenticscript.frontend.parser.ast.NumberLiteralNode;
import org.agenticscript.frontend.parser.ast.PrintStatementNode;
import org.agenticscript.frontend.parser.ast.Program;
import org.agenticscript.frontend.parser.ast.PropertyAccessNode;
import org.agenticscript.frontend.parser.ast.PropertyAssignmentNode;
import org.agenticscript.frontend.parser.ast.StringLiteralNode;
import org.agenticscript.frontend.parser.ast.ToolListNode;
import org.agenticscript.frontend.parser.ast.ToolSpecNode;
import org.agenticscript.runtime.RuntimeContext;
import org.agenticscript.runtime.agent.Agent;
import org.agenticscript.runtime.agent.AgentKind;
import org.agenticscript.runtime.api.DuplicateNameException;
import org.agenticscript.runtime.api.ExecutionResult;
import org.agenticscript.runtime.api.ReadOnlyPropertyException;
import org.agenticscript.runtime.api.ScriptError;
import org.agenticscript.runtime.api.ScriptExecutionException;
import org.agenticscript.runtime.api.ToolNotAssignedException;
import org.agenticscript.runtime.api.UnknownAgentException;
import org.agenticscript.runtime.api.UnknownAgentKindException;
import org.agenticscript.runtime.api.UnknownMethodException;
import org.agenticscript.runtime.api.UnknownToolException;
import org.agenticscript.runtime.bus.MessageBus;
import org.agenticscript.runtime.model.AgentStatus;
import org.agenticscript.runtime.model.ToolBinding;
import org.agenticscript.runtime.model.Value;
import org.agenticscript.runtime.tools.ToolContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * The tree-walking interpreter. It executes statements in program order on the calling thread
 * against one global {@link Environment} and the session's {@link RuntimeContext}.
 * <p>
 * A failing statement aborts only itself. Every statement validates its inputs before it
 * mutates agents, the bus or the environment, so a failure leaves the session consistent.
 */
public class Interpreter {

    private static final Logger log = LoggerFactory.getLogger(Interpreter.class);
    private static final String TOOLS_PROPERTY = "tools";
    private static final Set<String> CONSTRUCTOR_RESERVED = Set.of("status", "model", "name", "id", TOOLS_PROPERTY);

    private final RuntimeContext context;
    private final Environment globals = new Environment();

    public Interpreter(RuntimeContext context) {
        this.context = context;
    }

    /**
     * Executes the program's top-level statements in order, stopping at the first failure.
     *
     * @param program The program to run.
     * @return How many statements completed and the error that stopped execution, if any.
     */
    public ExecutionResult execute(Program program) {
        int completed = 0;
        for (AstNode statement : program.statements()) {
            try {
                executeStatement(statement);
            } catch (ScriptExecutionException e) {
                log.debug("Execution of {} stopped: {}", program.fileName(), e.getMessage());
                return ExecutionResult.failure(completed, e.getError());
            }
            completed++;
        }
        return ExecutionResult.success(completed);
    }

    /**
     * Executes one top-level statement, e.g. a line entered in the REPL.
     *
     * @param statement The statement to execute.
     * @throws ScriptExecutionException if the statement fails.
     */
    public void executeStatement(AstNode statement) throws ScriptExecutionException {
        try {
            execute(statement, globals);
        } catch (ScriptError e) {
            throw new ScriptExecutionException(e, statement.sourceInfo());
        }
    }

    /**
     * @return The global environment, for inspection.
     */
    public Environment getGlobals() {
        return globals;
    }

    public RuntimeContext getContext() {
        return context;
    }

    private void execute(AstNode node, Environment env) {
        if (node instanceof ImportStatementNode importNode) {
            context.getModules().importNames(importNode.moduleName(), importNode.names());
        } else if (node instanceof AgentDeclarationNode declaration) {
            declareAgent(declaration, env);
        } else if (node instanceof PropertyAssignmentNode assignment) {
            assignProperty(assignment, env);
        } else if (node instanceof AssignmentNode assignment) {
            Value value = evaluate(assignment.value(), env);
            if (assignment.declaration()) {
                env.declare(assignment.name(), value);
            } else {
                env.assign(assignment.name(), value);
            }
        } else if (node instanceof PrintStatementNode print) {
            context.print(evaluate(print.expression(), env).display());
        } else if (node instanceof ExpressionStatementNode statement) {
            evaluate(statement.expression(), env);
        } else if (node instanceof IfStatementNode ifStatement) {
            executeIf(ifStatement, env);
        } else {
            evaluate(node, env);
        }
    }

    private void declareAgent(AgentDeclarationNode declaration, Environment env) {
        if (env.isVisible(declaration.name())) {
            throw new DuplicateNameException(declaration.name());
        }
        AgentKind kind = context.getModules().agentKind(declaration.kind())
                .orElseThrow(() -> new UnknownAgentKindException(declaration.kind()));
        Map<String, Value> config = new LinkedHashMap<>();
        for (ConfigEntryNode entry : declaration.config()) {
            if (CONSTRUCTOR_RESERVED.contains(entry.key())) {
                throw ScriptError.argumentError("Property '" + entry.key() + "' cannot be set in the agent constructor");
            }
            config.put(entry.key(), evaluate(entry.value(), env));
        }
        Agent agent = context.spawnAgent(declaration.name(), kind, declaration.model(), config);
        env.declare(declaration.name(), new Value.AgentRef(agent.getId()));
    }

    private void assignProperty(PropertyAssignmentNode assignment, Environment env) {
        Agent agent = resolveAgent(assignment.agentName(), env);
        String property = assignment.property();
        if (Agent.READ_ONLY_PROPERTIES.contains(property)) {
            throw new ReadOnlyPropertyException(property);
        }
        Value value = evaluate(assignment.value(), env);

        if (TOOLS_PROPERTY.equals(property)) {
            Value.ToolSet tools = asToolSet(value);
            validateTools(tools);
            agent.setTools(assignment.mode() == AssignmentMode.APPEND ? agent.getTools().union(tools) : tools);
            log.debug("Tools of {} are now {}", agent.getId(), agent.getTools().display());
            return;
        }

        if (assignment.mode() == AssignmentMode.SET || !agent.hasProperty(property)) {
            agent.setProperty(property, value);
        } else {
            agent.setProperty(property, append(agent.getProperty(property), value, property));
        }
    }

    private Value.ToolSet asToolSet(Value value) {
        if (value instanceof Value.ToolSet tools) {
            return tools;
        }
        if (value instanceof Value.MapVal map && map.entries().isEmpty()) {
            return new Value.ToolSet(List.of());
        }
        throw ScriptError.typeError("Property 'tools' requires a tool list but got " + value.typeName());
    }

    private void validateTools(Value.ToolSet tools) {
        for (ToolBinding binding : tools.bindings()) {
            if (!context.getRegistry().isRegistered(binding.toolName())) {
                throw new UnknownToolException(binding.toolName());
            }
            for (String target : binding.targetAgentIds()) {
                if (!context.getAgents().contains(target)) {
                    throw new UnknownAgentException(target);
                }
            }
        }
    }

    private Value append(Value existing, Value addition, String property) {
        if (existing instanceof Value.ListVal list && addition instanceof Value.ListVal more) {
            List<Value> elements = new ArrayList<>(list.elements());
            elements.addAll(more.elements());
            return new Value.ListVal(elements);
        }
        if (existing instanceof Value.MapVal map && addition instanceof Value.MapVal more) {
            Map<String, Value> entries = new LinkedHashMap<>(map.entries());
            entries.putAll(more.entries());
            return new Value.MapVal(entries);
        }
        if (existing instanceof Value.ToolSet tools && addition instanceof Value.ToolSet more) {
            return tools.union(more);
        }
        throw ScriptError.typeError("Cannot append " + addition.typeName() + " to property '" + property
                + "' of type " + existing.typeName());
    }

    private void executeIf(IfStatementNode ifStatement, Environment env) {
        boolean condition = requireBool(evaluate(ifStatement.condition(), env), "if condition");
        List<AstNode> block = condition ? ifStatement.thenBlock() : ifStatement.elseBlock();
        if (block == null) {
            return;
        }
        Environment scope = env.child();
        for (AstNode statement : block) {
            execute(statement, scope);
        }
    }

    private Value evaluate(AstNode node, Environment env) {
        if (node instanceof StringLiteralNode literal) return Value.of(literal.value());
        if (node instanceof NumberLiteralNode literal) return Value.of(literal.value());
        if (node instanceof BooleanLiteralNode literal) return Value.of(literal.value());
        if (node instanceof NullLiteralNode) return Value.NULL;
        if (node instanceof IdentifierNode identifier) return env.get(identifier.name());
        if (node instanceof InterpolatedStringNode interpolated) return interpolate(interpolated, env);
        if (node instanceof ListLiteralNode list) {
            return new Value.ListVal(list.elements().stream().map(e -> evaluate(e, env)).toList());
        }
        if (node instanceof MapLiteralNode map) {
            Map<String, Value> entries = new LinkedHashMap<>();
            for (MapEntryNode entry : map.entries()) {
                entries.put(entry.key(), evaluate(entry.value(), env));
            }
            return new Value.MapVal(entries);
        }
        if (node instanceof ToolListNode toolList) return toolSet(toolList, env);
        if (node instanceof LogicalExpressionNode logical) return logical(logical, env);
        if (node instanceof NotExpressionNode not) {
            return Value.of(!requireBool(evaluate(not.operand(), env), "'not' operand"));
        }
        if (node instanceof ComparisonNode comparison) return compare(comparison, env);
        if (node instanceof PropertyAccessNode access) return readProperty(access, env);
        if (node instanceof MethodCallNode call) return callMethod(call, env);
        throw new IllegalStateException("Not an expression: " + node.getClass().getSimpleName());
    }

    private Value interpolate(InterpolatedStringNode node, Environment env) {
        StringBuilder result = new StringBuilder();
        for (InterpolatedStringNode.Segment segment : node.segments()) {
            if (segment instanceof InterpolatedStringNode.Segment.Text text) {
                result.append(text.text());
            } else if (segment instanceof InterpolatedStringNode.Segment.Embedded embedded) {
                result.append(evaluate(embedded.expression(), env).display());
            }
        }
        return Value.of(result.toString());
    }

    /**
     * Resolves routing targets to agent ids and checks the tool names against the registry.
     */
    private Value.ToolSet toolSet(ToolListNode toolList, Environment env) {
        Map<String, ToolBinding> bindings = new LinkedHashMap<>();
        for (ToolSpecNode spec : toolList.tools()) {
            if (!context.getRegistry().isRegistered(spec.toolName())) {
                throw new UnknownToolException(spec.toolName());
            }
            List<String> targets = new ArrayList<>();
            for (String agentName : spec.routedAgents()) {
                targets.add(resolveAgent(agentName, env).getId());
            }
            bindings.put(spec.toolName(), new ToolBinding(spec.toolName(), targets));
        }
        return new Value.ToolSet(List.copyOf(bindings.values()));
    }

    private Value logical(LogicalExpressionNode node, Environment env) {
        String operator = node.operator().name().toLowerCase(Locale.ROOT);
        boolean left = requireBool(evaluate(node.left(), env), "left operand of '" + operator + "'");
        if (node.operator() == LogicalOperator.AND && !left) return Value.FALSE;
        if (node.operator() == LogicalOperator.OR && left) return Value.TRUE;
        return Value.of(requireBool(evaluate(node.right(), env), "right operand of '" + operator + "'"));
    }

    private Value compare(ComparisonNode node, Environment env) {
        Value left = evaluate(node.left(), env);
        Value right = evaluate(node.right(), env);
        String symbol = node.operator().symbol();
        if (node.operator().isEquality()) {
            if (!(left instanceof Value.Null) && !(right instanceof Value.Null) && left.getClass() != right.getClass()) {
                throw ScriptError.typeError("Cannot compare " + left.typeName() + " " + symbol + " " + right.typeName());
            }
            boolean equal = left.equals(right);
            return Value.of(node.operator() == ComparisonOperator.EQUAL ? equal : !equal);
        }
        int order;
        if (left instanceof Value.Num a && right instanceof Value.Num b) {
            order = Double.compare(a.value(), b.value());
        } else if (left instanceof Value.Str a && right instanceof Value.Str b) {
            order = a.value().compareTo(b.value());
        } else {
            throw ScriptError.typeError("Cannot order " + left.typeName() + " " + symbol + " " + right.typeName());
        }
        return Value.of(switch (node.operator()) {
            case LESS -> order < 0;
            case LESS_EQUAL -> order <= 0;
            case GREATER -> order > 0;
            case GREATER_EQUAL -> order >= 0;
            default -> throw new IllegalStateException("Unexpected operator " + symbol);
        });
    }

    private Value readProperty(PropertyAccessNode access, Environment env) {
        Agent agent = agentOf(evaluate(access.receiver(), env), access.property());
        return switch (access.property()) {
            case "status" -> Value.of(agent.getStatus().label());
            case "model" -> Value.of(agent.getModel());
            case "name" -> Value.of(agent.getName());
            case "id" -> Value.of(agent.getId());
            case TOOLS_PROPERTY -> agent.getTools();
            default -> agent.getProperty(access.property());
        };
    }

    private Value callMethod(MethodCallNode call, Environment env) {
        Agent agent = agentOf(evaluate(call.receiver(), env), call.method() + "()");
        List<Value> args = call.arguments().stream().map(a -> evaluate(a, env)).toList();
        Map<String, Value> named = new LinkedHashMap<>();
        call.namedArguments().forEach((name, value) -> named.put(name, evaluate(value, env)));

        switch (call.method()) {
            case "ask" -> {
                return ask(agent, args, named);
            }
            case "tell" -> {
                requireArity(call, args, named, 1, 1);
                context.getBus().tell(MessageBus.SYSTEM_SENDER, agent.getId(), args.get(0));
                return Value.NULL;
            }
            case "has_tool" -> {
                requireArity(call, args, named, 1, 1);
                return Value.of(agent.hasTool(requireString(args.get(0), "tool name")));
            }
            case "execute_tool" -> {
                requireArity(call, args, named, 1, Integer.MAX_VALUE);
                return executeTool(agent, requireString(args.get(0), "tool name"), args.subList(1, args.size()));
            }
            default -> throw new UnknownMethodException(call.method());
        }
    }

    private Value ask(Agent agent, List<Value> args, Map<String, Value> named) {
        for (String name : named.keySet()) {
            if (!"timeout".equals(name)) {
                throw ScriptError.argumentError("ask() got an unexpected argument '" + name + "'");
            }
        }
        if (args.isEmpty() || args.size() > 2) {
            throw ScriptError.argumentError("ask() expects 1 or 2 arguments but got " + args.size());
        }
        if (args.size() == 2 && named.containsKey("timeout")) {
            throw ScriptError.argumentError("ask() got the timeout twice");
        }
        Duration timeout = context.getOptions().defaultAskTimeout();
        Value timeoutValue = args.size() == 2 ? args.get(1) : named.get("timeout");
        if (timeoutValue != null) {
            if (!(timeoutValue instanceof Value.Num seconds)) {
                throw ScriptError.typeError("ask() timeout must be a number of seconds but got " + timeoutValue.typeName());
            }
            timeout = Duration.ofMillis(Math.round(seconds.value() * 1000));
        }
        return context.getBus().ask(MessageBus.SYSTEM_SENDER, agent.getId(), args.get(0), timeout);
    }

    private Value executeTool(Agent agent, String toolName, List<Value> toolArgs) {
        ToolBinding binding = agent.toolBinding(toolName)
                .orElseThrow(() -> new ToolNotAssignedException(agent.getName(), toolName));
        ToolContext toolContext = new ToolContext(agent.getId(), binding.targetAgentIds(), context.getBus());
        AgentStatus before = agent.swapStatus(AgentStatus.ACTIVE);
        try {
            return context.getRegistry().execute(toolName, toolContext, toolArgs);
        } finally {
            agent.restoreStatus(AgentStatus.ACTIVE, before);
        }
    }

    private Agent resolveAgent(String name, Environment env) {
        Value value = env.lookup(name).orElseThrow(() -> new UnknownAgentException(name));
        return agentOf(value, name);
    }

    private Agent agentOf(Value value, String usage) {
        if (!(value instanceof Value.AgentRef ref)) {
            throw ScriptError.typeError("Expected an agent for " + usage + " but got " + value.typeName());
        }
        return context.getAgents().require(ref.agentId());
    }

    private void requireArity(MethodCallNode call, List<Value> args, Map<String, Value> named, int min, int max) {
        if (!named.isEmpty()) {
            throw ScriptError.argumentError(call.method() + "() does not accept named arguments");
        }
        if (args.size() < min || args.size() > max) {
            String expected = min == max ? Integer.toString(min) : "at least " + min;
            throw ScriptError.argumentError(call.method() + "() expects " + expected + " argument(s) but got " + args.size());
        }
    }

    private boolean requireBool(Value value, String usage) {
        if (value instanceof Value.Bool bool) {
            return bool.value();
        }
        throw ScriptError.typeError("Expected boolean for " + usage + " but got " + value.typeName());
    }

    private String requireString(Value value, String usage) {
        if (value instanceof Value.Str str) {
            return str.value();
        }
        throw ScriptError.typeError("Expected string for " + usage + " but got " + value.typeName());
    }
}
