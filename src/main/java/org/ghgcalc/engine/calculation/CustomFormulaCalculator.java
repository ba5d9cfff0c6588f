package org.ghgcalc.engine.calculation;

import org.ghgcalc.engine.FormulaEngine;
import org.ghgcalc.formula.FormulaEvaluationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Runs a custom formula calculation: every summation block is evaluated first
 * and its total bound under the block's name, then the main formula is
 * evaluated against the plain variables plus those totals.
 *
 * <pre>
 * E_total = Sum_Block_1 + C_const * 3.66
 * Sum_Block_1 = Σ FC_j * EF_j * OF_j
 * </pre>
 */
public final class CustomFormulaCalculator {

    private static final Logger LOG = LoggerFactory.getLogger(CustomFormulaCalculator.class);

    private static final Pattern IDENTIFIER = Pattern.compile("[\\p{L}_][\\p{L}\\p{N}_]*");

    private final FormulaEngine engine;
    private final Clock clock;

    public CustomFormulaCalculator() {
        this(new FormulaEngine(), Clock.systemUTC());
    }

    public CustomFormulaCalculator(FormulaEngine engine, Clock clock) {
        this.engine = Objects.requireNonNull(engine, "Engine cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    /**
     * Variables of the main formula that are not summation block names, i.e.
     * the ones a caller supplies directly.
     */
    public Set<String> simpleVariables(String formula, Collection<String> blockNames) {
        Set<String> names = new LinkedHashSet<>(engine.variablesOf(formula));
        names.removeAll(blockNames);
        return names;
    }

    /**
     * @throws org.ghgcalc.formula.FormulaException if a block or the main formula fails
     */
    public CalculationReport calculate(CalculationRequest request) {
        Objects.requireNonNull(request, "Request cannot be null");

        Map<String, Double> variables = new LinkedHashMap<>(request.simpleVariables());
        List<CalculationReport.BlockResult> blockResults = new ArrayList<>();

        for (SumBlock block : request.sumBlocks()) {
            validateBlock(block, variables);
            double total = engine.evaluateSum(block.template(), block.rows());
            variables.put(block.name(), total);
            blockResults.add(new CalculationReport.BlockResult(block.name(), block.template(), block.rows(), total));
        }

        double result = engine.evaluate(request.formula(), variables);
        LOG.info("Calculation successful: '{}' = {} ({} sum blocks)", request.formula(), result, blockResults.size());

        return new CalculationReport(request.formula(), clock.instant(), request.simpleVariables(), blockResults,
                result);
    }

    private static void validateBlock(SumBlock block, Map<String, Double> boundSoFar) {
        if (!IDENTIFIER.matcher(block.name()).matches()) {
            throw new FormulaEvaluationException("Sum block name is not a valid identifier: '" + block.name() + "'");
        }
        if (boundSoFar.containsKey(block.name())) {
            throw new FormulaEvaluationException(
                    "Sum block name '" + block.name() + "' clashes with another variable or block");
        }
        if (block.template().isBlank()) {
            throw new FormulaEvaluationException("Expression is empty for " + block.name());
        }
        if (block.rows().isEmpty()) {
            throw new FormulaEvaluationException("No items given for " + block.name());
        }
    }
}
