package org.ghgcalc.engine.evaluation;

import org.ghgcalc.formula.FormulaEvaluationException;
import org.ghgcalc.formula.ast.Expression;
import org.ghgcalc.formula.ast.ExpressionVisitor;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Reduces an expression tree to a single finite {@code double}.
 *
 * Every referenced variable must be bound; there is no defaulting. Division by
 * zero, {@code sqrt} of a negative number, {@code log} of a non-positive number,
 * a fractional power of a negative base and any intermediate result that is not
 * finite all fail with {@link FormulaEvaluationException}.
 */
public final class ScalarEvaluator {

    private ScalarEvaluator() {
        // Static utility class
    }

    /**
     * Evaluates a tree against a complete set of bindings.
     *
     * @param tree     a parsed expression
     * @param bindings value for every variable the tree references
     * @return the finite result
     * @throws FormulaEvaluationException if a variable is unbound or a domain is violated
     */
    public static double evaluate(Expression tree, Map<String, Double> bindings) {
        Objects.requireNonNull(tree, "Expression cannot be null");
        Objects.requireNonNull(bindings, "Bindings cannot be null");

        Set<String> missing = new TreeSet<>();
        for (String name : VariableExtractor.extract(tree)) {
            if (bindings.get(name) == null) {
                missing.add(name);
            }
        }
        if (!missing.isEmpty()) {
            throw new FormulaEvaluationException(
                    "Missing values for variables: " + String.join(", ", missing), missing);
        }

        return tree.accept(new Walker(bindings));
    }

    private static final class Walker implements ExpressionVisitor<Double> {

        private final Map<String, Double> bindings;

        private Walker(Map<String, Double> bindings) {
            this.bindings = bindings;
        }

        @Override
        public Double visitNumber(Expression.NumberLiteral number) {
            return finite(number.value(), "literal");
        }

        @Override
        public Double visitVariable(Expression.VariableRef variable) {
            double value = bindings.get(variable.name());
            if (!Double.isFinite(value)) {
                throw new FormulaEvaluationException(
                        "Variable '" + variable.name() + "' is bound to a non-finite value: " + value);
            }
            return value;
        }

        @Override
        public Double visitBinary(Expression.BinaryOperation binary) {
            double left = binary.left().accept(this);
            double right = binary.right().accept(this);
            return switch (binary.operator()) {
                case ADD -> finite(left + right, "addition");
                case SUBTRACT -> finite(left - right, "subtraction");
                case MULTIPLY -> finite(left * right, "multiplication");
                case DIVIDE -> divide(left, right);
                case POWER -> power(left, right);
            };
        }

        @Override
        public Double visitNegation(Expression.Negation negation) {
            double operand = negation.operand().accept(this);
            return -operand;
        }

        @Override
        public Double visitFunctionCall(Expression.FunctionCall call) {
            double argument = call.argument().accept(this);
            return switch (call.function()) {
                case SQRT -> {
                    if (argument < 0) {
                        throw new FormulaEvaluationException("sqrt of a negative number: " + argument);
                    }
                    yield Math.sqrt(argument);
                }
                case LOG -> {
                    if (argument <= 0) {
                        throw new FormulaEvaluationException("log of a non-positive number: " + argument);
                    }
                    yield Math.log(argument);
                }
                case EXP -> finite(Math.exp(argument), "exp(" + argument + ")");
                case ABS -> Math.abs(argument);
            };
        }

        @Override
        public Double visitConstant(Expression.NamedConstant constant) {
            return constant.constant().value();
        }

        private static double divide(double left, double right) {
            if (right == 0.0) {
                throw new FormulaEvaluationException("Division by zero");
            }
            return finite(left / right, "division");
        }

        private static double power(double base, double exponent) {
            if (base < 0 && exponent != Math.rint(exponent)) {
                throw new FormulaEvaluationException(
                        "Fractional power of a negative number: " + base + " ** " + exponent);
            }
            if (base == 0.0 && exponent < 0) {
                throw new FormulaEvaluationException("Division by zero: 0 raised to negative power " + exponent);
            }
            return finite(Math.pow(base, exponent), "power " + base + " ** " + exponent);
        }

        private static double finite(double value, String operation) {
            if (!Double.isFinite(value)) {
                throw new FormulaEvaluationException("Result of " + operation + " is not a finite number");
            }
            return value;
        }
    }
}
