package org.ghgcalc.engine;

/**
 * Outcome of a syntax check on formula text.
 *
 * @param valid   whether the text parses
 * @param message the parse error message, empty when valid
 */
public record FormulaValidation(boolean valid, String message) {

    public static FormulaValidation ok() {
        return new FormulaValidation(true, "");
    }

    public static FormulaValidation invalid(String message) {
        return new FormulaValidation(false, message);
    }
}
