package org.asymptote.analyzer.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Delimiters.
    /** The '(' character. */
    LEFT_PAREN,
    /** The ')' character. */
    RIGHT_PAREN,
    /** The '[' character, used for indexing and parameter annotations. */
    LEFT_BRACKET,
    /** The ']' character. */
    RIGHT_BRACKET,
    /** The ',' character. */
    COMMA,
    /** The ';' character, an optional statement separator. */
    SEMICOLON,
    /** The '.' character, used for field access. */
    DOT,
    /** The '..' range operator. */
    RANGE,

    // Operators.
    PLUS,
    MINUS,
    STAR,
    SLASH,
    CARET,
    /** Any assignment glyph: {@code <-}, {@code ←}, {@code 🡨}, {@code ↨} or {@code :=}. */
    ASSIGN,
    EQUAL,
    /** {@code <>}, {@code !=} or {@code ≠}. */
    NOT_EQUAL,
    LESS,
    /** {@code <=} or {@code ≤}. */
    LESS_EQUAL,
    GREATER,
    /** {@code >=} or {@code ≥}. */
    GREATER_EQUAL,
    CEIL_OPEN,
    CEIL_CLOSE,
    FLOOR_OPEN,
    FLOOR_CLOSE,

    // Literals.
    /** An identifier, such as a variable or procedure name. */
    IDENTIFIER,
    /** A numeric literal, integral or decimal. */
    NUMBER,
    /** A double-quoted string literal. */
    STRING,
    /** The {@code ∞} glyph. */
    INFINITY,

    // Keywords.
    BEGIN,
    END,
    FOR,
    TO,
    DOWNTO,
    STEP,
    DO,
    WHILE,
    REPEAT,
    UNTIL,
    IF,
    THEN,
    ELSE,
    CALL,
    RETURN,
    AND,
    OR,
    NOT,
    MOD,
    DIV,
    NULL,
    TRUE,
    FALSE,
    WITH,
    /** {@code procedure}, {@code function} or {@code procedimiento}. */
    PROCEDURE,
    /** {@code algorithm} or {@code algoritmo}. */
    ALGORITHM,

    // Miscellaneous.
    /** Represents the end of the source text. */
    END_OF_FILE
}
