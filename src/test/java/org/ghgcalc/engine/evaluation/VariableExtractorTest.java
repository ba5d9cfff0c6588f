package org.ghgcalc.engine.evaluation;

import org.ghgcalc.formula.FormulaParser;
import org.ghgcalc.formula.NotationNormalizer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("VariableExtractor Tests")
class VariableExtractorTest {

    private static Set<String> extract(String formula) {
        return VariableExtractor.extract(FormulaParser.parse(NotationNormalizer.normalize(formula)));
    }

    @Test
    @DisplayName("Indexed emission variables")
    void testIndexedNames() {
        assertEquals(Set.of("FC_j_y", "EF_CO2_j_y"), extract("FC_j_y * EF_CO2_j_y"));
    }

    @Test
    @DisplayName("Left-hand side is not a variable")
    void testAssignmentTarget() {
        assertEquals(Set.of("FC_1", "EF_CO2", "Sum_Block_1", "k_factor"),
                extract("E = FC_1 * EF_CO2 + Sum_Block_1 * k_factor"));
    }

    @Test
    @DisplayName("Repeated names appear once, in order of first use")
    void testDistinct() {
        Set<String> names = extract("b * a + a ** 2 - b / c");
        assertEquals(List.of("b", "a", "c"), List.copyOf(names));
    }

    @Test
    @DisplayName("Functions and constants are excluded")
    void testFunctionsAndConstantsExcluded() {
        assertEquals(Set.of("r", "h"), extract("pi * sqrt(r) ** 2 * h + exp(e) + log(abs(r))"));
    }

    @Test
    @DisplayName("LaTeX subscripts are extracted as flat names")
    void testLatexSubscripts() {
        assertEquals(Set.of("M_CO2", "C_i"), extract("\\frac{M_{CO2}}{C_{i}} \\cdot 2"));
    }

    @Test
    @DisplayName("Constant formula has no variables")
    void testNoVariables() {
        assertTrue(extract("2 * pi").isEmpty());
    }

    @Test
    @DisplayName("Result is unmodifiable")
    void testUnmodifiable() {
        Set<String> names = extract("a + b");
        assertThrows(UnsupportedOperationException.class, () -> names.add("c"));
    }
}
