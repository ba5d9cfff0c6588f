package org.ghgcalc.formula.ast;

/**
 * Visitor interface for traversing formula expression trees.
 *
 * @param <T> The return type of the visitor methods
 */
public interface ExpressionVisitor<T> {

    T visitNumber(Expression.NumberLiteral number);

    T visitVariable(Expression.VariableRef variable);

    T visitBinary(Expression.BinaryOperation binary);

    T visitNegation(Expression.Negation negation);

    T visitFunctionCall(Expression.FunctionCall call);

    T visitConstant(Expression.NamedConstant constant);
}
