package org.ghgcalc.formula.ast;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable expression tree produced by the formula parser.
 *
 * Node kinds:
 * - NumberLiteral: a 64-bit floating point constant
 * - VariableRef: a case-sensitive variable name
 * - BinaryOperation: left op right
 * - Negation: -operand
 * - FunctionCall: one of the allow-listed single-argument functions
 * - NamedConstant: pi or e
 */
public sealed interface Expression
        permits Expression.NumberLiteral, Expression.VariableRef, Expression.BinaryOperation,
        Expression.Negation, Expression.FunctionCall, Expression.NamedConstant {

    /**
     * Accept method for the expression visitor pattern.
     *
     * @param visitor The visitor to accept
     * @param <T>     The return type of the visitor
     * @return The result of visiting this expression
     */
    <T> T accept(ExpressionVisitor<T> visitor);

    // ==================== Factory Methods ====================

    static NumberLiteral number(double value) {
        return new NumberLiteral(value);
    }

    static VariableRef variable(String name) {
        return new VariableRef(name);
    }

    static BinaryOperation binary(Expression left, BinaryOperator operator, Expression right) {
        return new BinaryOperation(operator, left, right);
    }

    static Negation negate(Expression operand) {
        return new Negation(operand);
    }

    static FunctionCall call(MathFunction function, Expression argument) {
        return new FunctionCall(function, argument);
    }

    static NamedConstant constant(Constant constant) {
        return new NamedConstant(constant);
    }

    // ==================== AST Node Types ====================

    /**
     * Numeric literal: 2, 0.98, 1e-3
     */
    record NumberLiteral(double value) implements Expression {
        @Override
        public <T> T accept(ExpressionVisitor<T> visitor) {
            return visitor.visitNumber(this);
        }
    }

    /**
     * Variable reference: FC_j_y, EF_CO2
     */
    record VariableRef(String name) implements Expression {
        public VariableRef {
            Objects.requireNonNull(name, "Variable name cannot be null");
        }

        @Override
        public <T> T accept(ExpressionVisitor<T> visitor) {
            return visitor.visitVariable(this);
        }
    }

    /**
     * Binary operation: left op right
     * e.g., FC * EF, a ** 2
     */
    record BinaryOperation(BinaryOperator operator, Expression left, Expression right) implements Expression {
        public BinaryOperation {
            Objects.requireNonNull(operator, "Operator cannot be null");
            Objects.requireNonNull(left, "Left operand cannot be null");
            Objects.requireNonNull(right, "Right operand cannot be null");
        }

        @Override
        public <T> T accept(ExpressionVisitor<T> visitor) {
            return visitor.visitBinary(this);
        }
    }

    enum BinaryOperator {
        ADD("+"), SUBTRACT("-"), MULTIPLY("*"), DIVIDE("/"), POWER("**");

        private final String symbol;

        BinaryOperator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    /**
     * Unary minus: -operand
     */
    record Negation(Expression operand) implements Expression {
        public Negation {
            Objects.requireNonNull(operand, "Operand cannot be null");
        }

        @Override
        public <T> T accept(ExpressionVisitor<T> visitor) {
            return visitor.visitNegation(this);
        }
    }

    /**
     * Function call with exactly one argument: sqrt(x), log(x)
     */
    record FunctionCall(MathFunction function, Expression argument) implements Expression {
        public FunctionCall {
            Objects.requireNonNull(function, "Function cannot be null");
            Objects.requireNonNull(argument, "Argument cannot be null");
        }

        @Override
        public <T> T accept(ExpressionVisitor<T> visitor) {
            return visitor.visitFunctionCall(this);
        }
    }

    /**
     * The functions a formula may call. Nothing outside this list is callable.
     */
    enum MathFunction {
        SQRT("sqrt"), EXP("exp"), LOG("log"), ABS("abs");

        private final String functionName;

        MathFunction(String functionName) {
            this.functionName = functionName;
        }

        public String functionName() {
            return functionName;
        }

        public static Optional<MathFunction> byName(String name) {
            return Arrays.stream(values()).filter(f -> f.functionName.equals(name)).findFirst();
        }
    }

    /**
     * Named constant: pi or e
     */
    record NamedConstant(Constant constant) implements Expression {
        public NamedConstant {
            Objects.requireNonNull(constant, "Constant cannot be null");
        }

        @Override
        public <T> T accept(ExpressionVisitor<T> visitor) {
            return visitor.visitConstant(this);
        }
    }

    enum Constant {
        PI("pi", Math.PI), E("e", Math.E);

        private final String constantName;
        private final double value;

        Constant(String constantName, double value) {
            this.constantName = constantName;
            this.value = value;
        }

        public String constantName() {
            return constantName;
        }

        public double value() {
            return value;
        }

        public static Optional<Constant> byName(String name) {
            return Arrays.stream(values()).filter(c -> c.constantName.equals(name)).findFirst();
        }
    }
}
