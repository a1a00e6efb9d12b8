package org.agenticscript.frontend.transform;

import org.agenticscript.frontend.parser.ParseNode;
import org.agenticscript.frontend.parser.Rule;
import org.agenticscript.frontend.transform.converters.ExpressionConverters;
import org.agenticscript.frontend.transform.converters.LiteralConverters;
import org.agenticscript.frontend.transform.converters.StatementConverters;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry mapping grammar rules to converter instances.
 * <p>
 * Provides explicit registration and a default converter fallback, used for rules that have
 * no standalone AST form (blocks, arguments, segments) and are consumed by their parent's converter.
 */
public final class ConverterRegistry {

    private final Map<Rule, IParseNodeConverter> byRule = new EnumMap<>(Rule.class);
    private final IParseNodeConverter defaultConverter;

    private ConverterRegistry(IParseNodeConverter defaultConverter) {
        this.defaultConverter = defaultConverter;
    }

    /**
     * Registers a converter for the given rule.
     *
     * @param rule      The grammar rule.
     * @param converter The converter handling that rule.
     */
    public void register(Rule rule, IParseNodeConverter converter) {
        byRule.put(rule, converter);
    }

    /**
     * Retrieves the converter registered for the given rule.
     *
     * @param rule The rule to look up.
     * @return Optional converter if present.
     */
    public Optional<IParseNodeConverter> get(Rule rule) {
        return Optional.ofNullable(byRule.get(rule));
    }

    /**
     * Resolves a converter for the given node, falling back to the default converter.
     *
     * @param node The parse node to resolve a converter for.
     * @return A non-null converter to handle the node.
     */
    public IParseNodeConverter resolve(ParseNode node) {
        return byRule.getOrDefault(node.rule(), defaultConverter);
    }

    /**
     * Creates a registry with the given default converter and no specific converters.
     *
     * @param defaultConverter The fallback converter used for unregistered rules.
     * @return A new registry instance.
     */
    public static ConverterRegistry initialize(IParseNodeConverter defaultConverter) {
        return new ConverterRegistry(defaultConverter);
    }

    /**
     * Initializes a registry with converters for every rule that maps to an AST node.
     *
     * @return A registry pre-populated with the standard converters.
     */
    public static ConverterRegistry initializeWithDefaults() {
        ConverterRegistry reg = initialize((node, builder) -> {
            throw new IllegalStateException("Rule " + node.rule() + " has no standalone AST form");
        });
        reg.register(Rule.IMPORT, StatementConverters::importStatement);
        reg.register(Rule.AGENT_DECLARATION, StatementConverters::agentDeclaration);
        reg.register(Rule.CONFIG_ENTRY, StatementConverters::configEntry);
        reg.register(Rule.PROPERTY_ASSIGNMENT, StatementConverters::propertyAssignment);
        reg.register(Rule.ASSIGNMENT, StatementConverters::assignment);
        reg.register(Rule.LET_DECLARATION, StatementConverters::assignment);
        reg.register(Rule.PRINT, StatementConverters::print);
        reg.register(Rule.EXPRESSION_STATEMENT, StatementConverters::expressionStatement);
        reg.register(Rule.IF, StatementConverters::ifStatement);
        reg.register(Rule.LOGICAL, ExpressionConverters::logical);
        reg.register(Rule.NOT, ExpressionConverters::not);
        reg.register(Rule.COMPARISON, ExpressionConverters::comparison);
        reg.register(Rule.METHOD_CALL, ExpressionConverters::methodCall);
        reg.register(Rule.PROPERTY_ACCESS, ExpressionConverters::propertyAccess);
        reg.register(Rule.IDENTIFIER, ExpressionConverters::identifier);
        reg.register(Rule.INTERPOLATED_STRING, ExpressionConverters::interpolatedString);
        reg.register(Rule.STRING, LiteralConverters::string);
        reg.register(Rule.NUMBER, LiteralConverters::number);
        reg.register(Rule.BOOLEAN, LiteralConverters::bool);
        reg.register(Rule.NULL, LiteralConverters::nullLiteral);
        reg.register(Rule.LIST, LiteralConverters::list);
        reg.register(Rule.MAP, LiteralConverters::map);
        reg.register(Rule.MAP_ENTRY, LiteralConverters::mapEntry);
        reg.register(Rule.TOOL_LIST, LiteralConverters::toolList);
        reg.register(Rule.TOOL_SPEC, LiteralConverters::toolSpec);
        return reg;
    }
}
