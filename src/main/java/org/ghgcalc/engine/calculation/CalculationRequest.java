package org.ghgcalc.engine.calculation;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A custom formula together with its plain inputs and summation blocks.
 *
 * @param formula         main formula, may reference block names as variables
 * @param simpleVariables values of the main formula's plain variables
 * @param sumBlocks       blocks evaluated before the main formula, in order
 */
public record CalculationRequest(String formula, Map<String, Double> simpleVariables, List<SumBlock> sumBlocks) {

    public CalculationRequest {
        Objects.requireNonNull(formula, "Formula cannot be null");
        simpleVariables = simpleVariables == null ? Map.of() : Map.copyOf(simpleVariables);
        sumBlocks = sumBlocks == null ? List.of() : List.copyOf(sumBlocks);
    }

    public static CalculationRequest of(String formula, Map<String, Double> simpleVariables) {
        return new CalculationRequest(formula, simpleVariables, List.of());
    }
}
