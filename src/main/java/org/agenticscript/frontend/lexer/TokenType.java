package org.agenticscript.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Single-character tokens.
    LEFT_PAREN, RIGHT_PAREN,
    LEFT_BRACE, RIGHT_BRACE,
    LEFT_BRACKET, RIGHT_BRACKET,
    COMMA, DOT, COLON, SLASH, STAR, PLUS, MINUS, PERCENT,

    // One or two character tokens.
    /** The '=' assignment operator. */
    EQUAL,
    /** The '+=' append operator. */
    PLUS_EQUAL,
    /** The '->' property arrow. */
    ARROW,
    EQUAL_EQUAL, BANG_EQUAL,
    LESS, LESS_EQUAL,
    GREATER, GREATER_EQUAL,

    // Literals.
    /** An identifier, such as an agent or variable name. */
    IDENTIFIER,
    /** A string literal; the value holds the unescaped content. */
    STRING,
    /** An interpolated string literal (f"..."); the value holds the raw content. */
    FSTRING,
    /** A numeric literal; the value is a {@link Double}. */
    NUMBER,

    // Keywords.
    AGENT, SPAWN, IMPORT, IF, ELSE, PRINT, LET,
    TRUE, FALSE, NULL,
    AND, OR, NOT,

    // Miscellaneous.
    /** A newline character, used as a statement terminator. */
    NEWLINE,
    /** Represents the end of the source file. */
    END_OF_FILE
}
