package org.asymptote.analyzer.frontend.lexer;

import org.asymptote.analyzer.api.LexException;
import org.asymptote.analyzer.api.SourceInfo;
import org.asymptote.analyzer.diagnostics.DiagnosticsEngine;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * pseudocode text into a sequence of tokens.
 * <p>
 * Scanning works on Unicode code points, since several glyphs of the dialect
 * (for example the {@code 🡨} assignment arrow) lie outside the Basic Multilingual Plane.
 * Whitespace and {@code ►} line comments are dropped. The first unrecognized symbol is
 * reported to the {@link DiagnosticsEngine} and aborts the scan with a {@link LexException}.
 */
public class Lexer {

    private static final Map<String, TokenType> KEYWORDS = new HashMap<>();

    static {
        KEYWORDS.put("begin", TokenType.BEGIN);
        KEYWORDS.put("end", TokenType.END);
        KEYWORDS.put("for", TokenType.FOR);
        KEYWORDS.put("to", TokenType.TO);
        KEYWORDS.put("downto", TokenType.DOWNTO);
        KEYWORDS.put("step", TokenType.STEP);
        KEYWORDS.put("do", TokenType.DO);
        KEYWORDS.put("while", TokenType.WHILE);
        KEYWORDS.put("repeat", TokenType.REPEAT);
        KEYWORDS.put("until", TokenType.UNTIL);
        KEYWORDS.put("if", TokenType.IF);
        KEYWORDS.put("then", TokenType.THEN);
        KEYWORDS.put("else", TokenType.ELSE);
        KEYWORDS.put("call", TokenType.CALL);
        KEYWORDS.put("return", TokenType.RETURN);
        KEYWORDS.put("and", TokenType.AND);
        KEYWORDS.put("or", TokenType.OR);
        KEYWORDS.put("not", TokenType.NOT);
        KEYWORDS.put("mod", TokenType.MOD);
        KEYWORDS.put("div", TokenType.DIV);
        KEYWORDS.put("null", TokenType.NULL);
        KEYWORDS.put("true", TokenType.TRUE);
        KEYWORDS.put("false", TokenType.FALSE);
        KEYWORDS.put("with", TokenType.WITH);
        KEYWORDS.put("procedure", TokenType.PROCEDURE);
        KEYWORDS.put("function", TokenType.PROCEDURE);
        KEYWORDS.put("procedimiento", TokenType.PROCEDURE);
        KEYWORDS.put("algorithm", TokenType.ALGORITHM);
        KEYWORDS.put("algoritmo", TokenType.ALGORITHM);
    }

    private static final int COMMENT = '►';

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final List<Token> tokens = new ArrayList<>();
    private final String logicalFileName;
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startColumn = 1;

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
     * @param logicalFileName The name of the file being scanned, for error reporting.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics, String logicalFileName) {
        this.source = source;
        this.diagnostics = diagnostics;
        this.logicalFileName = logicalFileName;
    }

    /**
     * Performs the tokenization of the entire source code.
     * @return A list of the recognized tokens, terminated by {@link TokenType#END_OF_FILE}.
     * @throws LexException on the first unrecognized symbol or unterminated string.
     */
    public List<Token> scanTokens() throws LexException {
        while (!isAtEnd()) {
            start = current;
            startColumn = column;
            scanToken();
        }
        tokens.add(new Token(TokenType.END_OF_FILE, "", null, line, column, logicalFileName));
        return tokens;
    }

    private void scanToken() throws LexException {
        int c = advance();
        switch (c) {
            case '(': addToken(TokenType.LEFT_PAREN); break;
            case ')': addToken(TokenType.RIGHT_PAREN); break;
            case '[': addToken(TokenType.LEFT_BRACKET); break;
            case ']': addToken(TokenType.RIGHT_BRACKET); break;
            case ',': addToken(TokenType.COMMA); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case '+': addToken(TokenType.PLUS); break;
            case '-': addToken(TokenType.MINUS); break;
            case '*': addToken(TokenType.STAR); break;
            case '/': addToken(TokenType.SLASH); break;
            case '^': addToken(TokenType.CARET); break;
            case '=': addToken(TokenType.EQUAL); break;
            case '.':
                addToken(match('.') ? TokenType.RANGE : TokenType.DOT);
                break;
            case '<':
                if (match('-')) {
                    addToken(TokenType.ASSIGN, "<-");
                } else if (match('=')) {
                    addToken(TokenType.LESS_EQUAL);
                } else if (match('>')) {
                    addToken(TokenType.NOT_EQUAL, "<>");
                } else {
                    addToken(TokenType.LESS);
                }
                break;
            case '>':
                addToken(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER);
                break;
            case ':':
                if (!match('=')) {
                    fail("Unexpected character", ":");
                }
                addToken(TokenType.ASSIGN, "<-");
                break;
            case '!':
                if (!match('=')) {
                    fail("Unexpected character", "!");
                }
                addToken(TokenType.NOT_EQUAL, "<>");
                break;
            case '←', '↨', 0x1F868: addToken(TokenType.ASSIGN, "<-"); break;
            case '≤': addToken(TokenType.LESS_EQUAL, "<="); break;
            case '≥': addToken(TokenType.GREATER_EQUAL, ">="); break;
            case '≠': addToken(TokenType.NOT_EQUAL, "<>"); break;
            case '⌈': addToken(TokenType.CEIL_OPEN); break;
            case '⌉': addToken(TokenType.CEIL_CLOSE); break;
            case '⌊': addToken(TokenType.FLOOR_OPEN); break;
            case '⌋': addToken(TokenType.FLOOR_CLOSE); break;
            case '∞': addToken(TokenType.INFINITY); break;
            case '"': string(); break;
            case COMMENT:
                // A comment goes until the end of the line.
                while (peek() != '\n' && !isAtEnd()) advance();
                break;
            case ' ', '\r', '\t', 0xA0, 0xFEFF:
                break;
            case '\n':
                line++;
                column = 1;
                break;
            default:
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    fail("Unexpected character", new String(Character.toChars(c)));
                }
                break;
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        TokenType type = KEYWORDS.getOrDefault(text.toLowerCase(Locale.ROOT), TokenType.IDENTIFIER);
        addToken(type);
    }

    private void number() {
        while (isDigit(peek())) advance();
        // A single dot followed by a digit is a fraction; '..' is the range operator.
        if (peek() == '.' && isDigit(peekNext())) {
            advance();
            while (isDigit(peek())) advance();
        }
        String text = source.substring(start, current);
        Object value;
        if (text.contains(".")) {
            value = Double.parseDouble(text);
        } else {
            try {
                value = Long.parseLong(text);
            } catch (NumberFormatException e) {
                value = Double.parseDouble(text);
            }
        }
        addToken(TokenType.NUMBER, text, value);
    }

    private void string() throws LexException {
        while (peek() != '"' && !isAtEnd()) {
            if (peek() == '\n') {
                break;
            }
            advance();
        }
        if (isAtEnd() || peek() == '\n') {
            fail("Unterminated string", "\"");
        }
        advance(); // The closing quote.
        String value = source.substring(start + 1, current - 1);
        addToken(TokenType.STRING, source.substring(start, current), value);
    }

    private void fail(String message, String offending) throws LexException {
        SourceInfo position = new SourceInfo(logicalFileName, line, startColumn);
        diagnostics.reportError(message + ": '" + offending + "'", logicalFileName, line, startColumn);
        throw new LexException(message, offending, position);
    }

    private boolean match(int expected) {
        if (isAtEnd() || source.codePointAt(current) != expected) return false;
        advance();
        return true;
    }

    private int advance() {
        int cp = source.codePointAt(current);
        current += Character.charCount(cp);
        column++;
        return cp;
    }

    private int peek() {
        if (isAtEnd()) return '\0';
        return source.codePointAt(current);
    }

    private int peekNext() {
        if (isAtEnd()) return '\0';
        int next = current + Character.charCount(source.codePointAt(current));
        if (next >= source.length()) return '\0';
        return source.codePointAt(next);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private boolean isDigit(int c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(int c) {
        return c == '_' || Character.isLetter(c);
    }

    private boolean isAlphaNumeric(int c) {
        return isAlpha(c) || isDigit(c);
    }

    private void addToken(TokenType type) {
        addToken(type, source.substring(start, current), null);
    }

    private void addToken(TokenType type, String text) {
        addToken(type, text, null);
    }

    private void addToken(TokenType type, String text, Object literal) {
        tokens.add(new Token(type, text, literal, line, startColumn, logicalFileName));
    }
}
