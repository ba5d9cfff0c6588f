package org.ghgcalc.formula;

/**
 * Base class for every failure raised while parsing or evaluating a formula.
 *
 * When the failure happened inside a summation block, {@link #termIndex()}
 * holds the 1-based index of the failing term; otherwise it is 0.
 */
public abstract class FormulaException extends RuntimeException {

    private final int termIndex;

    protected FormulaException(String message, int termIndex, Throwable cause) {
        super(message, cause);
        this.termIndex = termIndex;
    }

    public int termIndex() {
        return termIndex;
    }

    public boolean isSummationTerm() {
        return termIndex > 0;
    }

    /**
     * Returns a copy of this exception attributed to the given summation term.
     * The copy keeps this exception as its cause.
     */
    public abstract FormulaException atTerm(int termIndex);

    protected static String termPrefix(int termIndex) {
        return "Summation term " + termIndex + ": ";
    }
}
