package org.ghgcalc.formula;

/**
 * Lexer for canonical formula text.
 *
 * Recognises numeric literals, identifiers (letters, digits and underscores,
 * not starting with a digit), the arithmetic operators {@code + - * / **}
 * ({@code ^} is read as {@code **}), parentheses and commas. Anything else,
 * including LaTeX leftovers such as backslashes and braces, is rejected.
 */
public final class Lexer {

    private final String text;
    private int pos;
    private char ch;

    // Current token state
    private Token token;
    private String stringVal;
    private int tokenPos;

    public Lexer(String text) {
        this.text = text;
        this.pos = 0;
        this.ch = pos < text.length() ? text.charAt(pos) : '\0';
        nextToken(); // Prime the lexer
    }

    // ==================== Token Access ====================

    public Token token() {
        return token;
    }

    public String stringVal() {
        return stringVal;
    }

    public int tokenPos() {
        return tokenPos;
    }

    public String text() {
        return text;
    }

    public String info() {
        return token.display() + (stringVal != null ? " '" + stringVal + "'" : "");
    }

    // ==================== Scanning ====================

    public void nextToken() {
        skipWhitespace();

        tokenPos = pos;
        stringVal = null;

        if (pos >= text.length()) {
            token = Token.EOF;
            return;
        }

        if (isIdentifierStart(ch)) {
            scanIdentifier();
            return;
        }

        if (isDigit(ch) || (ch == '.' && isDigit(peek()))) {
            scanNumber();
            return;
        }

        scanOperator();
    }

    private void scanIdentifier() {
        int start = pos;
        while (isIdentifierPart(ch)) {
            advance();
        }
        stringVal = text.substring(start, pos);
        token = Token.IDENTIFIER;
    }

    private void scanNumber() {
        int start = pos;

        while (isDigit(ch)) advance();

        if (ch == '.') {
            advance();
            while (isDigit(ch)) advance();
        }

        // Scientific notation: 1e10, 1E-5
        if ((ch == 'e' || ch == 'E')
                && (isDigit(peek()) || ((peek() == '+' || peek() == '-') && isDigit(peekAt(2))))) {
            advance();
            if (ch == '+' || ch == '-') advance();
            while (isDigit(ch)) advance();
        }

        // 1.2.3, 2e, 3x: the literal runs straight into something it cannot absorb
        if (ch == '.' || isIdentifierPart(ch)) {
            while (ch == '.' || isIdentifierPart(ch)) advance();
            throw new FormulaParseException("Invalid numeric literal '" + text.substring(start, pos) + "'",
                    text, start);
        }

        stringVal = text.substring(start, pos);
        token = Token.NUMBER;
    }

    private void scanOperator() {
        switch (ch) {
            case '(' -> { advance(); token = Token.LPAREN; }
            case ')' -> { advance(); token = Token.RPAREN; }
            case ',' -> { advance(); token = Token.COMMA; }
            case '+' -> { advance(); token = Token.PLUS; }
            case '-' -> { advance(); token = Token.MINUS; }
            case '/' -> { advance(); token = Token.SLASH; }
            case '^' -> { advance(); token = Token.POWER; }
            case '*' -> {
                advance();
                if (ch == '*') { advance(); token = Token.POWER; }
                else { token = Token.STAR; }
            }
            default -> throw new FormulaParseException("Unexpected character '" + ch + "'", text, pos);
        }
    }

    // ==================== Helpers ====================

    private void advance() {
        pos++;
        ch = pos < text.length() ? text.charAt(pos) : '\0';
    }

    private char peek() {
        return peekAt(1);
    }

    private char peekAt(int offset) {
        return pos + offset < text.length() ? text.charAt(pos + offset) : '\0';
    }

    private void skipWhitespace() {
        while (pos < text.length() && Character.isWhitespace(ch)) advance();
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
