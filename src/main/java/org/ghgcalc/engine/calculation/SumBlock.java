package org.ghgcalc.engine.calculation;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A named summation block. Its total is bound under {@code name} when the
 * main formula is evaluated.
 *
 * @param name     identifier the main formula uses, e.g. {@code Sum_Block_1}
 * @param template indexed expression, e.g. {@code FC_j * EF_j * OF_j}
 * @param rows     one binding set per term, in index order
 */
public record SumBlock(String name, String template, List<Map<String, Double>> rows) {

    public static final String NAME_PREFIX = "Sum_Block_";

    public SumBlock {
        Objects.requireNonNull(name, "Block name cannot be null");
        Objects.requireNonNull(template, "Block template cannot be null");
        Objects.requireNonNull(rows, "Block rows cannot be null");
        rows = rows.stream().map(Map::copyOf).toList();
    }

    /**
     * Block named after its position, following the {@code Sum_Block_<n>} convention.
     */
    public static SumBlock numbered(int number, String template, List<Map<String, Double>> rows) {
        return new SumBlock(NAME_PREFIX + number, template, rows);
    }
}
