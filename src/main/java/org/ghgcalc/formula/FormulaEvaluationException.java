package org.ghgcalc.formula;

import java.util.Set;

/**
 * Exception thrown when a parsed formula cannot be reduced to a finite number:
 * a referenced variable has no value, or an operation leaves its domain.
 */
public class FormulaEvaluationException extends FormulaException {

    private final Set<String> missingVariables;

    public FormulaEvaluationException(String message) {
        this(message, Set.of(), 0, null);
    }

    public FormulaEvaluationException(String message, Set<String> missingVariables) {
        this(message, missingVariables, 0, null);
    }

    private FormulaEvaluationException(String message, Set<String> missingVariables, int termIndex, Throwable cause) {
        super(message, termIndex, cause);
        this.missingVariables = Set.copyOf(missingVariables);
    }

    /**
     * Names that had no value in the bindings. Empty for domain errors.
     */
    public Set<String> missingVariables() {
        return missingVariables;
    }

    public boolean isMissingVariables() {
        return !missingVariables.isEmpty();
    }

    @Override
    public FormulaEvaluationException atTerm(int termIndex) {
        return new FormulaEvaluationException(termPrefix(termIndex) + getMessage(), missingVariables, termIndex, this);
    }
}
