package org.agenticscript.frontend.lexer;

import org.agenticscript.frontend.diagnostics.DiagnosticsEngine;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * a sequence of characters (source code) into a sequence of tokens.
 */
public class Lexer {

    private static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
            Map.entry("agent", TokenType.AGENT),
            Map.entry("spawn", TokenType.SPAWN),
            Map.entry("import", TokenType.IMPORT),
            Map.entry("if", TokenType.IF),
            Map.entry("else", TokenType.ELSE),
            Map.entry("print", TokenType.PRINT),
            Map.entry("let", TokenType.LET),
            Map.entry("true", TokenType.TRUE),
            Map.entry("false", TokenType.FALSE),
            Map.entry("null", TokenType.NULL),
            Map.entry("and", TokenType.AND),
            Map.entry("or", TokenType.OR),
            Map.entry("not", TokenType.NOT)
    );

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final List<Token> tokens = new ArrayList<>();
    private final String logicalFileName;
    private int start = 0;
    private int current = 0;
    private int line;
    private int lineStart;
    private int startLine;
    private int startColumn;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this(source, diagnostics, "<memory>");
    }

    /**
     * Creates a new Lexer with an explicit logical file name.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     * @param logicalFileName The name of the file being parsed, for error reporting.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics, String logicalFileName) {
        this(source, diagnostics, logicalFileName, 1, 1);
    }

    /**
     * Creates a Lexer for a source fragment that starts at a known position of an enclosing file,
     * e.g. an expression embedded in an interpolated string.
     * @param source The fragment to scan.
     * @param diagnostics The engine for reporting errors.
     * @param logicalFileName The enclosing file name.
     * @param firstLine The line on which the fragment starts.
     * @param firstColumn The column at which the fragment starts.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics, String logicalFileName, int firstLine, int firstColumn) {
        this.source = source;
        this.diagnostics = diagnostics;
        this.logicalFileName = logicalFileName;
        this.line = firstLine;
        this.lineStart = 1 - firstColumn;
    }

    /**
     * Performs the tokenization of the entire source code.
     * @return A list of the recognized tokens, always terminated by {@link TokenType#END_OF_FILE}.
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            startLine = line;
            startColumn = current - lineStart + 1;
            scanToken();
        }
        tokens.add(new Token(TokenType.END_OF_FILE, "", null, line, current - lineStart + 1, logicalFileName));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(' -> addToken(TokenType.LEFT_PAREN);
            case ')' -> addToken(TokenType.RIGHT_PAREN);
            case '{' -> addToken(TokenType.LEFT_BRACE);
            case '}' -> addToken(TokenType.RIGHT_BRACE);
            case '[' -> addToken(TokenType.LEFT_BRACKET);
            case ']' -> addToken(TokenType.RIGHT_BRACKET);
            case ',' -> addToken(TokenType.COMMA);
            case '.' -> addToken(TokenType.DOT);
            case ':' -> addToken(TokenType.COLON);
            case '*' -> addToken(TokenType.STAR);
            case '%' -> addToken(TokenType.PERCENT);
            case '+' -> addToken(match('=') ? TokenType.PLUS_EQUAL : TokenType.PLUS);
            case '-' -> addToken(match('>') ? TokenType.ARROW : TokenType.MINUS);
            case '=' -> addToken(match('=') ? TokenType.EQUAL_EQUAL : TokenType.EQUAL);
            case '<' -> addToken(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS);
            case '>' -> addToken(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER);
            case '!' -> {
                if (match('=')) {
                    addToken(TokenType.BANG_EQUAL);
                } else {
                    reportUnexpected(c);
                }
            }
            case '/' -> {
                if (match('/')) {
                    // A comment goes until the end of the line.
                    while (peek() != '\n' && !isAtEnd()) advance();
                } else {
                    addToken(TokenType.SLASH);
                }
            }
            case '"' -> string();
            // Ignore whitespace
            case ' ', '\r', '\t' -> { }
            case '\n' -> {
                addToken(TokenType.NEWLINE);
                line++;
                lineStart = current;
            }
            default -> {
                if (c == 'f' && peek() == '"') {
                    advance();
                    interpolatedString();
                } else if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    reportUnexpected(c);
                }
            }
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        addToken(KEYWORDS.getOrDefault(text, TokenType.IDENTIFIER));
    }

    private void number() {
        while (isDigit(peek())) advance();
        if (peek() == '.' && isDigit(peekNext())) {
            advance(); // consume the '.'
            while (isDigit(peek())) advance();
        }
        String numberString = source.substring(start, current);
        try {
            addToken(TokenType.NUMBER, Double.parseDouble(numberString));
        } catch (NumberFormatException e) {
            diagnostics.reportError("Invalid number format: " + numberString, logicalFileName, startLine, startColumn);
        }
    }

    private void string() {
        StringBuilder value = new StringBuilder();
        while (peek() != '"' && !isAtEnd()) {
            if (peek() == '\n') {
                break;
            }
            char c = advance();
            if (c == '\\' && !isAtEnd()) {
                value.append(unescape(advance()));
            } else {
                value.append(c);
            }
        }

        if (isAtEnd() || peek() == '\n') {
            diagnostics.reportError("Unterminated string.", logicalFileName, startLine, startColumn);
            return;
        }

        // The closing "
        advance();
        // The text of the token is the string *with* quotes, the value is the content.
        addToken(TokenType.STRING, value.toString());
    }

    /**
     * Scans an f-string. Embedded expressions may contain string literals of their own,
     * so quotes only terminate the literal outside of braces.
     */
    private void interpolatedString() {
        int depth = 0;
        while (!isAtEnd()) {
            char c = peek();
            if (c == '\n') {
                break;
            }
            if (depth == 0) {
                if (c == '"') {
                    break;
                }
                if (c == '\\') {
                    advance();
                    if (!isAtEnd() && peek() != '\n') advance();
                    continue;
                }
                if ((c == '{' && peekNext() == '{') || (c == '}' && peekNext() == '}')) {
                    advance();
                    advance();
                    continue;
                }
                if (c == '{') depth++;
                advance();
            } else {
                if (c == '"') {
                    skipNestedString();
                    continue;
                }
                if (c == '{') depth++;
                if (c == '}') depth--;
                advance();
            }
        }

        if (isAtEnd() || peek() == '\n') {
            diagnostics.reportError("Unterminated interpolated string.", logicalFileName, startLine, startColumn);
            return;
        }

        advance();
        // The value is the raw content between f" and the closing quote.
        addToken(TokenType.FSTRING, source.substring(start + 2, current - 1));
    }

    private void skipNestedString() {
        advance(); // opening quote
        while (!isAtEnd() && peek() != '"' && peek() != '\n') {
            if (advance() == '\\' && !isAtEnd()) advance();
        }
        if (peek() == '"') advance();
    }

    /**
     * Resolves the character following a backslash in a string literal.
     * @param c The escaped character.
     * @return The character it stands for.
     */
    public static char unescape(char c) {
        return switch (c) {
            case 'n' -> '\n';
            case 't' -> '\t';
            case 'r' -> '\r';
            default -> c;
        };
    }

    private void reportUnexpected(char c) {
        diagnostics.reportError("Unexpected character: " + c, logicalFileName, startLine, startColumn);
    }

    private char advance() {
        return source.charAt(current++);
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) return false;
        current++;
        return true;
    }

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, literal, startLine, startColumn, logicalFileName));
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z') ||
                c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }
}
