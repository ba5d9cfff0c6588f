package org.ghgcalc.engine.evaluation;

import org.ghgcalc.formula.FormulaEvaluationException;
import org.ghgcalc.formula.FormulaException;
import org.ghgcalc.formula.FormulaParser;
import org.ghgcalc.formula.NotationNormalizer;
import org.ghgcalc.formula.ast.Expression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Evaluates a summation block: Σ template_i for i = 1..n.
 *
 * The template refers to indexed variables through a marker, {@code _j} by
 * default. For term {@code i} every occurrence of the marker is replaced by
 * {@code _i} ({@code FC_j * EF_j} becomes {@code FC_2 * EF_2} for the second
 * term), the result is normalized, parsed and evaluated against the i-th
 * binding set, and the term values are added up.
 *
 * Substitution is plain text templating over a single index. The first failing
 * term aborts the whole sum.
 */
public final class SummationBlockEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(SummationBlockEvaluator.class);

    public static final String DEFAULT_INDEX_SYMBOL = "j";

    private static final Pattern INDEX_SYMBOL = Pattern.compile("[\\p{L}\\p{N}]+");

    private final String marker;

    public SummationBlockEvaluator() {
        this(DEFAULT_INDEX_SYMBOL);
    }

    /**
     * @param indexSymbol the index name used in templates, e.g. {@code k} for {@code FC_k}
     */
    public SummationBlockEvaluator(String indexSymbol) {
        Objects.requireNonNull(indexSymbol, "Index symbol cannot be null");
        if (!INDEX_SYMBOL.matcher(indexSymbol).matches()) {
            throw new IllegalArgumentException("Index symbol must be letters or digits: '" + indexSymbol + "'");
        }
        this.marker = "_" + indexSymbol;
    }

    /**
     * The literal substring replaced by each term's index.
     */
    public String marker() {
        return marker;
    }

    /**
     * Substitutes a concrete 1-based index into the template.
     */
    public String substitute(String template, int index) {
        return template.replace(marker, "_" + index);
    }

    /**
     * Sums the template over the indexed binding sets.
     *
     * @param template        formula template containing the marker
     * @param indexedBindings one binding set per term; list position i-1 binds term i
     * @return the sum of all term values
     * @throws FormulaException from the first failing term, attributed to its index
     */
    public double evaluateSum(String template, List<Map<String, Double>> indexedBindings) {
        Objects.requireNonNull(template, "Template cannot be null");
        Objects.requireNonNull(indexedBindings, "Indexed bindings cannot be null");
        if (indexedBindings.isEmpty()) {
            throw new FormulaEvaluationException("Summation block has no terms: '" + template + "'");
        }

        double total = 0.0;
        for (int i = 1; i <= indexedBindings.size(); i++) {
            String termText = substitute(template, i);
            double termValue;
            try {
                Expression term = FormulaParser.parse(NotationNormalizer.normalize(termText));
                termValue = ScalarEvaluator.evaluate(term, indexedBindings.get(i - 1));
            } catch (FormulaException e) {
                throw e.atTerm(i);
            }
            total += termValue;
            if (!Double.isFinite(total)) {
                throw new FormulaEvaluationException("Running total is not a finite number").atTerm(i);
            }
            LOG.debug("Sum block term {}: {} = {}", i, termText, termValue);
        }

        LOG.info("Sum block total: {} (n={}) = {}", template, indexedBindings.size(), total);
        return total;
    }

    /**
     * Lists, per term, the variable names a caller has to bind, e.g. for
     * {@code FC_j * EF_j} and 2 terms: {@code [[FC_1, EF_1], [FC_2, EF_2]]}.
     *
     * @throws org.ghgcalc.formula.FormulaParseException if a substituted term does not parse
     */
    public List<Set<String>> indexedVariableNames(String template, int count) {
        Objects.requireNonNull(template, "Template cannot be null");
        if (count < 0) {
            throw new IllegalArgumentException("Term count cannot be negative: " + count);
        }
        List<Set<String>> names = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            try {
                String termText = NotationNormalizer.normalize(substitute(template, i));
                names.add(VariableExtractor.extract(FormulaParser.parse(termText)));
            } catch (FormulaException e) {
                throw e.atTerm(i);
            }
        }
        return List.copyOf(names);
    }
}
