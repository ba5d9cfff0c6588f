package org.ghgcalc.formula;

import org.ghgcalc.formula.ast.Expression;
import org.ghgcalc.formula.ast.Expression.BinaryOperator;
import org.ghgcalc.formula.ast.Expression.Constant;
import org.ghgcalc.formula.ast.Expression.MathFunction;

import java.util.Optional;

import static org.ghgcalc.formula.Token.*;

/**
 * Recursive descent parser for canonical formula text.
 *
 * Grammar, lowest to highest precedence:
 * <pre>
 * formula        := additive EOF
 * additive       := multiplicative (('+' | '-') multiplicative)*
 * multiplicative := unary (('*' | '/') unary)*
 * unary          := ('-' | '+') unary | power
 * power          := primary ('**' unary)?
 * primary        := NUMBER | constant | IDENTIFIER | function '(' additive ')' | '(' additive ')'
 * </pre>
 *
 * The grammar admits arithmetic only, so user-typed text can never reach
 * anything beyond the allow-listed functions.
 */
public final class FormulaParser {

    private final Lexer lexer;

    public FormulaParser(String text) {
        this.lexer = new Lexer(text);
    }

    public FormulaParser(Lexer lexer) {
        this.lexer = lexer;
    }

    /**
     * Parses canonical formula text into an expression tree.
     *
     * @param text canonical formula text, see {@link NotationNormalizer}
     * @return the root of a freshly built tree
     * @throws FormulaParseException if the text is not a well-formed formula
     */
    public static Expression parse(String text) {
        if (text == null) {
            throw new FormulaParseException("Empty formula", "", 0);
        }
        return new FormulaParser(text).parseFormula();
    }

    // ==================== Token Helpers ====================

    private Token current() {
        return lexer.token();
    }

    private String stringVal() {
        return lexer.stringVal();
    }

    private boolean check(Token t) {
        return current() == t;
    }

    private void advance() {
        lexer.nextToken();
    }

    private boolean consumeIf(Token t) {
        if (check(t)) {
            advance();
            return true;
        }
        return false;
    }

    private void expect(Token t) {
        if (!check(t)) {
            throw error("Expected " + t.display() + ", got " + lexer.info());
        }
        advance();
    }

    private FormulaParseException error(String message) {
        return new FormulaParseException(message, lexer.text(), lexer.tokenPos());
    }

    // ==================== Formula ====================

    public Expression parseFormula() {
        if (check(EOF)) {
            throw error("Empty formula");
        }
        Expression expr = parseAdditive();
        if (check(RPAREN)) {
            throw error("Unbalanced parentheses: unexpected ')'");
        }
        if (!check(EOF)) {
            throw error("Unexpected " + lexer.info() + " after complete expression");
        }
        return expr;
    }

    private Expression parseAdditive() {
        Expression left = parseMultiplicative();
        while (check(PLUS) || check(MINUS)) {
            BinaryOperator op = check(PLUS) ? BinaryOperator.ADD : BinaryOperator.SUBTRACT;
            advance();
            left = Expression.binary(left, op, parseMultiplicative());
        }
        return left;
    }

    private Expression parseMultiplicative() {
        Expression left = parseUnary();
        while (check(STAR) || check(SLASH)) {
            BinaryOperator op = check(STAR) ? BinaryOperator.MULTIPLY : BinaryOperator.DIVIDE;
            advance();
            left = Expression.binary(left, op, parseUnary());
        }
        return left;
    }

    private Expression parseUnary() {
        if (consumeIf(MINUS)) {
            return Expression.negate(parseUnary());
        }
        if (consumeIf(PLUS)) {
            return parseUnary();
        }
        return parsePower();
    }

    private Expression parsePower() {
        Expression base = parsePrimary();
        if (consumeIf(POWER)) {
            // Right-associative: a ** b ** c == a ** (b ** c)
            return Expression.binary(base, BinaryOperator.POWER, parseUnary());
        }
        return base;
    }

    private Expression parsePrimary() {
        if (consumeIf(LPAREN)) {
            if (check(RPAREN)) {
                throw error("Empty parentheses");
            }
            Expression expr = parseAdditive();
            if (!check(RPAREN)) {
                throw error("Unbalanced parentheses: expected ')', got " + lexer.info());
            }
            advance();
            return expr;
        }

        if (check(NUMBER)) {
            return parseNumber();
        }

        if (check(IDENTIFIER)) {
            return parseIdentifier();
        }

        if (check(EOF)) {
            throw error("Expected operand, got end of formula");
        }
        if (current().isBinaryOperator()) {
            throw error("Operator " + current().display() + " cannot follow another operator or start a formula");
        }
        throw error("Expected operand, got " + lexer.info());
    }

    private Expression parseNumber() {
        String literal = stringVal();
        double value;
        try {
            value = Double.parseDouble(literal);
        } catch (NumberFormatException e) {
            throw error("Invalid numeric literal '" + literal + "'");
        }
        if (!Double.isFinite(value)) {
            throw error("Numeric literal out of range '" + literal + "'");
        }
        advance();
        return Expression.number(value);
    }

    private Expression parseIdentifier() {
        String name = stringVal();
        int namePos = lexer.tokenPos();
        advance();

        if (consumeIf(LPAREN)) {
            Optional<MathFunction> function = MathFunction.byName(name);
            if (function.isEmpty()) {
                throw new FormulaParseException("Unknown function '" + name + "'", lexer.text(), namePos);
            }
            if (check(RPAREN)) {
                throw error("Function '" + name + "' requires exactly one argument");
            }
            Expression argument = parseAdditive();
            if (check(COMMA)) {
                throw error("Function '" + name + "' takes exactly one argument");
            }
            if (!check(RPAREN)) {
                throw error("Unbalanced parentheses: expected ')' to close '" + name + "(', got " + lexer.info());
            }
            advance();
            return Expression.call(function.get(), argument);
        }

        if (MathFunction.byName(name).isPresent()) {
            throw new FormulaParseException("Function '" + name + "' must be called as " + name + "(...)",
                    lexer.text(), namePos);
        }

        Optional<Constant> constant = Constant.byName(name);
        if (constant.isPresent()) {
            return Expression.constant(constant.get());
        }
        return Expression.variable(name);
    }
}
