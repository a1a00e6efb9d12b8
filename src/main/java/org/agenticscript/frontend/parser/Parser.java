package org.agenticscript.frontend.parser;

import org.agenticscript.frontend.diagnostics.DiagnosticsEngine;
import org.agenticscript.frontend.lexer.Lexer;
import org.agenticscript.frontend.lexer.Token;
import org.agenticscript.frontend.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * The recursive-descent parser for AgenticScript. It consumes the tokens produced by the
 * {@link Lexer} and builds a concrete parse tree of {@link ParseNode}s, one node per grammar rule.
 * <p>
 * Syntax errors are reported to the {@link DiagnosticsEngine}. After an error the parser skips
 * to the next newline and continues, so that a single pass reports as many errors as possible.
 */
public class Parser {

    private final List<Token> tokens;
    private final DiagnosticsEngine diagnostics;
    private int current = 0;

    /**
     * Constructs a new Parser.
     * @param tokens The list of tokens to parse, terminated by {@link TokenType#END_OF_FILE}.
     * @param diagnostics The engine for reporting errors.
     */
    public Parser(List<Token> tokens, DiagnosticsEngine diagnostics) {
        this.tokens = tokens;
        this.diagnostics = diagnostics;
    }

    /**
     * Parses the entire token stream.
     * @return The {@link Rule#PROGRAM} node holding all successfully parsed statements.
     */
    public ParseNode parse() {
        List<ParseNode> statements = new ArrayList<>();
        while (!isAtEnd()) {
            if (match(TokenType.NEWLINE)) {
                continue;
            }
            ParseNode statement = declaration();
            if (statement != null) {
                statements.add(statement);
            }
        }
        return new ParseNode(Rule.PROGRAM, null, statements);
    }

    /**
     * Parses the token stream as exactly one expression, as used for the embedded parts of
     * interpolated strings.
     * @return The expression node, or null if it could not be parsed.
     */
    public ParseNode parseStandaloneExpression() {
        try {
            ParseNode expression = expression();
            if (!isAtEnd()) {
                throw error(peek(), "Expected end of embedded expression");
            }
            return expression;
        } catch (ParseError e) {
            return null;
        }
    }

    private ParseNode declaration() {
        try {
            ParseNode statement = statement();
            endOfStatement();
            return statement;
        } catch (ParseError e) {
            synchronize();
            return null;
        }
    }

    private ParseNode statement() {
        if (match(TokenType.IMPORT)) return importStatement();
        if (match(TokenType.AGENT)) return agentDeclaration();
        if (match(TokenType.STAR)) return propertyAssignment();
        if (match(TokenType.LET)) {
            Token name = consume(TokenType.IDENTIFIER, "Expected variable name after 'let'");
            consume(TokenType.EQUAL, "Expected '=' after variable name");
            return new ParseNode(Rule.LET_DECLARATION, name, List.of(expression()));
        }
        if (match(TokenType.IF)) return ifStatement();
        if (match(TokenType.PRINT)) {
            Token print = previous();
            consume(TokenType.LEFT_PAREN, "Expected '(' after 'print'");
            skipNewlines();
            ParseNode expression = expression();
            skipNewlines();
            consume(TokenType.RIGHT_PAREN, "Expected ')' after print argument");
            return new ParseNode(Rule.PRINT, print, List.of(expression));
        }
        if (check(TokenType.IDENTIFIER) && checkNext(TokenType.EQUAL)) {
            Token name = advance();
            advance();
            return new ParseNode(Rule.ASSIGNMENT, name, List.of(expression()));
        }
        return new ParseNode(Rule.EXPRESSION_STATEMENT, peek(), List.of(expression()));
    }

    private ParseNode importStatement() {
        Token importToken = previous();
        List<ParseNode> path = new ArrayList<>();
        path.add(ParseNode.leaf(Rule.IDENTIFIER, consume(TokenType.IDENTIFIER, "Expected module path after 'import'")));
        while (match(TokenType.DOT)) {
            path.add(ParseNode.leaf(Rule.IDENTIFIER, consume(TokenType.IDENTIFIER, "Expected module path segment after '.'")));
        }
        consume(TokenType.LEFT_BRACE, "Expected '{' before imported names");
        skipNewlines();
        List<ParseNode> names = new ArrayList<>();
        do {
            skipNewlines();
            names.add(ParseNode.leaf(Rule.IDENTIFIER, consume(TokenType.IDENTIFIER, "Expected imported name")));
            skipNewlines();
        } while (match(TokenType.COMMA));
        consume(TokenType.RIGHT_BRACE, "Expected '}' after imported names");
        return new ParseNode(Rule.IMPORT, importToken, List.of(
                new ParseNode(Rule.MODULE_PATH, path.get(0).token(), path),
                new ParseNode(Rule.NAME_LIST, names.get(0).token(), names)));
    }

    private ParseNode agentDeclaration() {
        Token name = consume(TokenType.IDENTIFIER, "Expected agent name after 'agent'");
        consume(TokenType.EQUAL, "Expected '=' after agent name");
        consume(TokenType.SPAWN, "Expected 'spawn' in agent declaration");
        Token kind = consume(TokenType.IDENTIFIER, "Expected agent kind after 'spawn'");
        consume(TokenType.LEFT_BRACE, "Expected '{' after agent kind");
        skipNewlines();

        List<ParseNode> children = new ArrayList<>();
        children.add(ParseNode.leaf(Rule.IDENTIFIER, kind));
        children.add(modelSpec());
        skipNewlines();
        while (match(TokenType.COMMA)) {
            skipNewlines();
            if (check(TokenType.RIGHT_BRACE)) break;
            Token key = consume(TokenType.IDENTIFIER, "Expected configuration key");
            consume(TokenType.COLON, "Expected ':' after configuration key");
            skipNewlines();
            children.add(new ParseNode(Rule.CONFIG_ENTRY, key, List.of(expression())));
            skipNewlines();
        }
        consume(TokenType.RIGHT_BRACE, "Expected '}' after agent configuration");
        return new ParseNode(Rule.AGENT_DECLARATION, name, children);
    }

    /**
     * Reads a model descriptor. It is either a string literal or a run of directly adjacent
     * identifier, number, '/', '-' and '.' tokens such as {@code openai/gpt-4o}.
     */
    private ParseNode modelSpec() {
        if (match(TokenType.STRING)) {
            Token literal = previous();
            return ParseNode.leaf(Rule.MODEL_SPEC, synthetic(literal, (String) literal.value()));
        }
        if (!check(TokenType.IDENTIFIER)) {
            throw error(peek(), "Expected model descriptor");
        }
        Token first = advance();
        StringBuilder model = new StringBuilder(first.text());
        Token last = first;
        while (isModelPart(peek()) && peek().line() == last.line() && peek().column() == last.endColumn()) {
            last = advance();
            model.append(last.text());
        }
        return ParseNode.leaf(Rule.MODEL_SPEC, synthetic(first, model.toString()));
    }

    private boolean isModelPart(Token token) {
        return switch (token.type()) {
            case IDENTIFIER, NUMBER, SLASH, MINUS, DOT -> true;
            default -> false;
        };
    }

    private ParseNode propertyAssignment() {
        Token agent = consume(TokenType.IDENTIFIER, "Expected agent name after '*'");
        consume(TokenType.ARROW, "Expected '->' after agent name");
        Token property = consume(TokenType.IDENTIFIER, "Expected property name after '->'");
        if (!match(TokenType.EQUAL, TokenType.PLUS_EQUAL)) {
            throw error(peek(), "Expected '=' or '+=' after property name");
        }
        Token operator = previous();
        return new ParseNode(Rule.PROPERTY_ASSIGNMENT, operator, List.of(
                ParseNode.leaf(Rule.IDENTIFIER, agent),
                ParseNode.leaf(Rule.IDENTIFIER, property),
                expression()));
    }

    private ParseNode ifStatement() {
        Token ifToken = previous();
        List<ParseNode> children = new ArrayList<>();
        children.add(expression());
        children.add(block());
        if (checkAfterNewlines(TokenType.ELSE)) {
            skipNewlines();
            advance();
            if (match(TokenType.IF)) {
                children.add(ifStatement());
            } else {
                children.add(block());
            }
        }
        return new ParseNode(Rule.IF, ifToken, children);
    }

    private ParseNode block() {
        Token brace = consume(TokenType.LEFT_BRACE, "Expected '{' to start block");
        List<ParseNode> statements = new ArrayList<>();
        while (true) {
            skipNewlines();
            if (check(TokenType.RIGHT_BRACE) || isAtEnd()) break;
            statements.add(statement());
            endOfStatement();
        }
        consume(TokenType.RIGHT_BRACE, "Expected '}' to close block");
        return new ParseNode(Rule.BLOCK, brace, statements);
    }

    private ParseNode expression() {
        return or();
    }

    private ParseNode or() {
        ParseNode left = and();
        while (match(TokenType.OR)) {
            Token operator = previous();
            left = new ParseNode(Rule.LOGICAL, operator, List.of(left, and()));
        }
        return left;
    }

    private ParseNode and() {
        ParseNode left = not();
        while (match(TokenType.AND)) {
            Token operator = previous();
            left = new ParseNode(Rule.LOGICAL, operator, List.of(left, not()));
        }
        return left;
    }

    private ParseNode not() {
        if (match(TokenType.NOT)) {
            Token operator = previous();
            return new ParseNode(Rule.NOT, operator, List.of(not()));
        }
        return comparison();
    }

    private ParseNode comparison() {
        ParseNode left = postfix();
        if (match(TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL, TokenType.LESS, TokenType.LESS_EQUAL,
                TokenType.GREATER, TokenType.GREATER_EQUAL)) {
            Token operator = previous();
            return new ParseNode(Rule.COMPARISON, operator, List.of(left, postfix()));
        }
        return left;
    }

    private ParseNode postfix() {
        ParseNode expression = primary();
        while (match(TokenType.DOT)) {
            Token member = consume(TokenType.IDENTIFIER, "Expected method or property name after '.'");
            if (match(TokenType.LEFT_PAREN)) {
                List<ParseNode> children = new ArrayList<>();
                children.add(expression);
                children.addAll(arguments());
                expression = new ParseNode(Rule.METHOD_CALL, member, children);
            } else {
                expression = new ParseNode(Rule.PROPERTY_ACCESS, member, List.of(expression));
            }
        }
        return expression;
    }

    private List<ParseNode> arguments() {
        List<ParseNode> arguments = new ArrayList<>();
        skipNewlines();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                skipNewlines();
                if (check(TokenType.IDENTIFIER) && checkNext(TokenType.EQUAL)) {
                    Token name = advance();
                    advance();
                    arguments.add(new ParseNode(Rule.ARGUMENT, name, List.of(expression())));
                } else {
                    arguments.add(new ParseNode(Rule.ARGUMENT, null, List.of(expression())));
                }
                skipNewlines();
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_PAREN, "Expected ')' after arguments");
        return arguments;
    }

    private ParseNode primary() {
        if (match(TokenType.STRING)) return ParseNode.leaf(Rule.STRING, previous());
        if (match(TokenType.NUMBER)) return ParseNode.leaf(Rule.NUMBER, previous());
        if (match(TokenType.TRUE, TokenType.FALSE)) return ParseNode.leaf(Rule.BOOLEAN, previous());
        if (match(TokenType.NULL)) return ParseNode.leaf(Rule.NULL, previous());
        if (match(TokenType.IDENTIFIER)) return ParseNode.leaf(Rule.IDENTIFIER, previous());
        if (match(TokenType.FSTRING)) return interpolatedString(previous());
        if (match(TokenType.MINUS)) {
            Token minus = previous();
            Token number = consume(TokenType.NUMBER, "Expected number after '-'");
            Token negated = new Token(TokenType.NUMBER, "-" + number.text(), -((Double) number.value()),
                    minus.line(), minus.column(), minus.fileName());
            return ParseNode.leaf(Rule.NUMBER, negated);
        }
        if (match(TokenType.LEFT_PAREN)) {
            skipNewlines();
            ParseNode inner = expression();
            skipNewlines();
            consume(TokenType.RIGHT_PAREN, "Expected ')' after expression");
            return inner;
        }
        if (match(TokenType.LEFT_BRACKET)) return list();
        if (match(TokenType.LEFT_BRACE)) return braceLiteral();
        throw error(peek(), "Expected expression");
    }

    private ParseNode list() {
        Token bracket = previous();
        List<ParseNode> elements = new ArrayList<>();
        skipNewlines();
        if (!check(TokenType.RIGHT_BRACKET)) {
            do {
                skipNewlines();
                if (check(TokenType.RIGHT_BRACKET)) break;
                elements.add(expression());
                skipNewlines();
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_BRACKET, "Expected ']' after list elements");
        return new ParseNode(Rule.LIST, bracket, elements);
    }

    /**
     * A brace in expression position opens a map literal when it is empty or its first entry is
     * {@code key:}; otherwise it opens a tool list.
     */
    private ParseNode braceLiteral() {
        Token brace = previous();
        skipNewlines();
        if (check(TokenType.RIGHT_BRACE)
                || ((check(TokenType.STRING) || check(TokenType.IDENTIFIER)) && checkNext(TokenType.COLON))) {
            return map(brace);
        }
        return toolList(brace);
    }

    private ParseNode map(Token brace) {
        List<ParseNode> entries = new ArrayList<>();
        if (!check(TokenType.RIGHT_BRACE)) {
            do {
                skipNewlines();
                if (check(TokenType.RIGHT_BRACE)) break;
                if (!match(TokenType.STRING, TokenType.IDENTIFIER)) {
                    throw error(peek(), "Expected map key");
                }
                Token key = previous();
                consume(TokenType.COLON, "Expected ':' after map key");
                skipNewlines();
                entries.add(new ParseNode(Rule.MAP_ENTRY, key, List.of(expression())));
                skipNewlines();
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_BRACE, "Expected '}' after map entries");
        return new ParseNode(Rule.MAP, brace, entries);
    }

    private ParseNode toolList(Token brace) {
        List<ParseNode> tools = new ArrayList<>();
        do {
            skipNewlines();
            if (check(TokenType.RIGHT_BRACE)) break;
            Token toolName = consume(TokenType.IDENTIFIER, "Expected tool name");
            List<ParseNode> targets = new ArrayList<>();
            if (match(TokenType.LEFT_BRACE)) {
                skipNewlines();
                if (!check(TokenType.RIGHT_BRACE)) {
                    do {
                        skipNewlines();
                        targets.add(ParseNode.leaf(Rule.IDENTIFIER, consume(TokenType.IDENTIFIER, "Expected agent name")));
                        skipNewlines();
                    } while (match(TokenType.COMMA));
                }
                consume(TokenType.RIGHT_BRACE, "Expected '}' after routed agents");
            }
            tools.add(new ParseNode(Rule.TOOL_SPEC, toolName, targets));
            skipNewlines();
        } while (match(TokenType.COMMA));
        consume(TokenType.RIGHT_BRACE, "Expected '}' after tool list");
        return new ParseNode(Rule.TOOL_LIST, brace, tools);
    }

    /**
     * Splits the raw content of an f-string into text and expression segments. Embedded
     * expressions are lexed and parsed on their own, with positions relative to the enclosing file.
     */
    private ParseNode interpolatedString(Token token) {
        String content = (String) token.value();
        int contentColumn = token.column() + 2;
        List<ParseNode> segments = new ArrayList<>();
        StringBuilder text = new StringBuilder();
        int i = 0;
        while (i < content.length()) {
            char c = content.charAt(i);
            if (c == '\\' && i + 1 < content.length()) {
                text.append(Lexer.unescape(content.charAt(i + 1)));
                i += 2;
            } else if (c == '{' && i + 1 < content.length() && content.charAt(i + 1) == '{') {
                text.append('{');
                i += 2;
            } else if (c == '}' && i + 1 < content.length() && content.charAt(i + 1) == '}') {
                text.append('}');
                i += 2;
            } else if (c == '}') {
                diagnostics.reportError("Single '}' in interpolated string.", token.fileName(), token.line(), contentColumn + i);
                throw new ParseError();
            } else if (c == '{') {
                int end = closingBrace(content, i);
                String source = content.substring(i + 1, end);
                if (source.isBlank()) {
                    diagnostics.reportError("Empty expression in interpolated string.", token.fileName(), token.line(), contentColumn + i);
                    throw new ParseError();
                }
                if (text.length() > 0) {
                    segments.add(ParseNode.leaf(Rule.TEXT_SEGMENT, synthetic(token, text.toString())));
                    text.setLength(0);
                }
                segments.add(new ParseNode(Rule.EXPRESSION_SEGMENT, token,
                        List.of(embeddedExpression(source, token, contentColumn + i + 1))));
                i = end + 1;
            } else {
                text.append(c);
                i++;
            }
        }
        if (text.length() > 0) {
            segments.add(ParseNode.leaf(Rule.TEXT_SEGMENT, synthetic(token, text.toString())));
        }
        return new ParseNode(Rule.INTERPOLATED_STRING, token, segments);
    }

    private int closingBrace(String content, int open) {
        int depth = 0;
        int i = open;
        while (i < content.length()) {
            char c = content.charAt(i);
            if (c == '"') {
                i++;
                while (i < content.length() && content.charAt(i) != '"') {
                    if (content.charAt(i) == '\\') i++;
                    i++;
                }
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) return i;
            }
            i++;
        }
        return content.length() - 1;
    }

    private ParseNode embeddedExpression(String source, Token enclosing, int column) {
        int errorsBefore = diagnostics.getDiagnostics().size();
        List<Token> embeddedTokens = new Lexer(source, diagnostics, enclosing.fileName(), enclosing.line(), column).scanTokens();
        if (diagnostics.getDiagnostics().size() > errorsBefore) {
            throw new ParseError();
        }
        ParseNode expression = new Parser(embeddedTokens, diagnostics).parseStandaloneExpression();
        if (expression == null) {
            throw new ParseError();
        }
        return expression;
    }

    private void endOfStatement() {
        if (isAtEnd() || check(TokenType.RIGHT_BRACE)) return;
        consume(TokenType.NEWLINE, "Expected end of statement");
    }

    private void synchronize() {
        while (!isAtEnd()) {
            if (advance().type() == TokenType.NEWLINE) return;
        }
    }

    private Token synthetic(Token origin, String text) {
        return new Token(TokenType.STRING, text, text, origin.line(), origin.column(), origin.fileName());
    }

    private void skipNewlines() {
        while (match(TokenType.NEWLINE)) {
            // skip
        }
    }

    private boolean checkAfterNewlines(TokenType type) {
        int index = current;
        while (tokens.get(index).type() == TokenType.NEWLINE) index++;
        return tokens.get(index).type() == type;
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type() == type;
    }

    private boolean checkNext(TokenType type) {
        if (isAtEnd() || current + 1 >= tokens.size()) return false;
        return tokens.get(current + 1).type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_FILE;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token previous() {
        return tokens.get(current - 1);
    }

    private Token consume(TokenType type, String errorMessage) {
        if (check(type)) return advance();
        throw error(peek(), errorMessage);
    }

    private ParseError error(Token found, String message) {
        String shown = found.type() == TokenType.END_OF_FILE ? "end of file"
                : found.type() == TokenType.NEWLINE ? "newline" : found.text();
        diagnostics.reportError(message + ", but found '" + shown + "'.", found);
        return new ParseError();
    }

    /**
     * Unwinds the parser to the enclosing statement after an error has been reported.
     */
    private static final class ParseError extends RuntimeException {
        ParseError() {
            super(null, null, false, false);
        }
    }
}
