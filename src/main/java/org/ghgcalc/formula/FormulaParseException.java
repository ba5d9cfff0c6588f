package org.ghgcalc.formula;

/**
 * Exception thrown when formula text cannot be parsed.
 */
public class FormulaParseException extends FormulaException {

    private final String text;
    private final int position;

    public FormulaParseException(String message, String text, int position) {
        super(message + " at position " + position + " in '" + text + "'", 0, null);
        this.text = text;
        this.position = position;
    }

    private FormulaParseException(String message, String text, int position, int termIndex, Throwable cause) {
        super(message, termIndex, cause);
        this.text = text;
        this.position = position;
    }

    /**
     * The text handed to the parser.
     */
    public String text() {
        return text;
    }

    public int position() {
        return position;
    }

    @Override
    public FormulaParseException atTerm(int termIndex) {
        return new FormulaParseException(termPrefix(termIndex) + getMessage(), text, position, termIndex, this);
    }
}
