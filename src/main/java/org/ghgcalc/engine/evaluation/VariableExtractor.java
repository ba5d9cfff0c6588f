package org.ghgcalc.engine.evaluation;

import org.ghgcalc.formula.ast.Expression;
import org.ghgcalc.formula.ast.ExpressionVisitor;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Collects the distinct variable names an expression tree references.
 * Function names and the named constants are never variables.
 */
public final class VariableExtractor {

    private VariableExtractor() {
        // Static utility class
    }

    /**
     * @param tree a parsed expression
     * @return unmodifiable set of variable names, in order of first appearance
     */
    public static Set<String> extract(Expression tree) {
        Set<String> names = new LinkedHashSet<>();
        tree.accept(new Collector(names));
        return Collections.unmodifiableSet(names);
    }

    private static final class Collector implements ExpressionVisitor<Void> {

        private final Set<String> names;

        private Collector(Set<String> names) {
            this.names = names;
        }

        @Override
        public Void visitNumber(Expression.NumberLiteral number) {
            return null;
        }

        @Override
        public Void visitVariable(Expression.VariableRef variable) {
            names.add(variable.name());
            return null;
        }

        @Override
        public Void visitBinary(Expression.BinaryOperation binary) {
            binary.left().accept(this);
            binary.right().accept(this);
            return null;
        }

        @Override
        public Void visitNegation(Expression.Negation negation) {
            return negation.operand().accept(this);
        }

        @Override
        public Void visitFunctionCall(Expression.FunctionCall call) {
            return call.argument().accept(this);
        }

        @Override
        public Void visitConstant(Expression.NamedConstant constant) {
            return null;
        }
    }
}
