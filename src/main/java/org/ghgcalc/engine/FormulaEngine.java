package org.ghgcalc.engine;

import org.ghgcalc.engine.evaluation.ScalarEvaluator;
import org.ghgcalc.engine.evaluation.SummationBlockEvaluator;
import org.ghgcalc.engine.evaluation.VariableExtractor;
import org.ghgcalc.formula.FormulaParseException;
import org.ghgcalc.formula.FormulaParser;
import org.ghgcalc.formula.NotationNormalizer;
import org.ghgcalc.formula.ast.Expression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Entry point for calculators that work with user-typed formulas.
 *
 * <pre>
 * FormulaEngine engine = new FormulaEngine();
 * Set&lt;String&gt; inputs = engine.variablesOf("E = FC * EF * OF");
 * double e = engine.evaluate("E = FC * EF * OF", Map.of("FC", 1000.0, "EF", 2.5, "OF", 0.98));
 * </pre>
 *
 * Holds no state besides the summation index configuration, so one instance
 * can be shared between threads.
 */
public final class FormulaEngine {

    private static final Logger LOG = LoggerFactory.getLogger(FormulaEngine.class);

    private final SummationBlockEvaluator summation;

    public FormulaEngine() {
        this(new SummationBlockEvaluator());
    }

    public FormulaEngine(SummationBlockEvaluator summation) {
        this.summation = Objects.requireNonNull(summation, "Summation evaluator cannot be null");
    }

    // ==================== Core Operations ====================

    public String normalize(String text) {
        return NotationNormalizer.normalize(text);
    }

    public Expression parse(String canonicalText) {
        return FormulaParser.parse(canonicalText);
    }

    public Set<String> extract(Expression tree) {
        return VariableExtractor.extract(tree);
    }

    public double evaluate(Expression tree, Map<String, Double> bindings) {
        return ScalarEvaluator.evaluate(tree, bindings);
    }

    public double evaluateSum(String template, List<Map<String, Double>> indexedBindings) {
        return summation.evaluateSum(template, indexedBindings);
    }

    public SummationBlockEvaluator summation() {
        return summation;
    }

    // ==================== Formula Text Conveniences ====================

    /**
     * Normalizes and parses formula text as typed by a user.
     */
    public Expression compile(String formulaText) {
        return parse(normalize(formulaText));
    }

    /**
     * Variables a formula needs values for.
     */
    public Set<String> variablesOf(String formulaText) {
        return extract(compile(formulaText));
    }

    /**
     * Normalizes, parses and evaluates formula text in one step.
     */
    public double evaluate(String formulaText, Map<String, Double> bindings) {
        double result = evaluate(compile(formulaText), bindings);
        LOG.debug("Formula evaluated: '{}' = {}", formulaText, result);
        return result;
    }

    /**
     * Checks whether formula text parses. Never throws.
     */
    public FormulaValidation validate(String formulaText) {
        try {
            compile(formulaText);
            return FormulaValidation.ok();
        } catch (FormulaParseException e) {
            LOG.debug("Formula rejected: {}", e.getMessage());
            return FormulaValidation.invalid(e.getMessage());
        }
    }
}
