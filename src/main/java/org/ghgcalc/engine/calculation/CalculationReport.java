package org.ghgcalc.engine.calculation;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Details of a finished custom calculation, enough to show or export how the
 * result was obtained.
 */
public record CalculationReport(
        String formula,
        Instant timestamp,
        Map<String, Double> simpleVariables,
        List<BlockResult> sumBlocks,
        double result) {

    public CalculationReport {
        simpleVariables = Map.copyOf(simpleVariables);
        sumBlocks = List.copyOf(sumBlocks);
    }

    /**
     * @param name      block name
     * @param template  block template as given
     * @param items     binding set of each term
     * @param sumResult block total
     */
    public record BlockResult(String name, String template, List<Map<String, Double>> items, double sumResult) {
        public BlockResult {
            items = List.copyOf(items);
        }
    }
}
