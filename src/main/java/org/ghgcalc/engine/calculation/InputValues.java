package org.ghgcalc.engine.calculation;

import org.ghgcalc.formula.FormulaEvaluationException;

/**
 * Parsing of numbers typed into input fields.
 */
public final class InputValues {

    private InputValues() {
        // Static utility class
    }

    /**
     * Parses a user-typed number. A comma is accepted as decimal separator.
     *
     * @param text      raw field content
     * @param fieldName variable the field belongs to, used in error messages
     * @return the parsed finite value
     * @throws FormulaEvaluationException if the field is blank or not a finite number
     */
    public static double parse(String text, String fieldName) {
        String value = text == null ? "" : text.replace(',', '.').strip();
        if (value.isEmpty()) {
            throw new FormulaEvaluationException("Field '" + fieldName + "' cannot be empty");
        }
        double parsed;
        try {
            parsed = Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new FormulaEvaluationException(
                    "Invalid numeric value in field '" + fieldName + "': '" + text + "'");
        }
        if (!Double.isFinite(parsed)) {
            throw new FormulaEvaluationException(
                    "Invalid numeric value in field '" + fieldName + "': '" + text + "'");
        }
        return parsed;
    }
}
