package org.ghgcalc.formula;

/**
 * Token types of the canonical formula syntax.
 */
public enum Token {
    // Literals
    EOF,
    IDENTIFIER,
    NUMBER,

    // Operators - Arithmetic
    PLUS,       // +
    MINUS,      // -
    STAR,       // *
    SLASH,      // /
    POWER,      // ** or ^

    // Punctuation
    COMMA,      // ,
    LPAREN,     // (
    RPAREN,     // )
    ;

    public boolean isBinaryOperator() {
        return this == PLUS || this == MINUS || this == STAR || this == SLASH || this == POWER;
    }

    /**
     * Human-readable form used in parse error messages.
     */
    public String display() {
        return switch (this) {
            case EOF -> "end of formula";
            case IDENTIFIER -> "identifier";
            case NUMBER -> "number";
            case PLUS -> "'+'";
            case MINUS -> "'-'";
            case STAR -> "'*'";
            case SLASH -> "'/'";
            case POWER -> "'**'";
            case COMMA -> "','";
            case LPAREN -> "'('";
            case RPAREN -> "')'";
        };
    }
}
