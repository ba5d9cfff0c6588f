package org.ghgcalc.formula;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("NotationNormalizer Tests")
class NotationNormalizerTest {

    @Test
    @DisplayName("Assignment keeps the right-hand side")
    void testAssignment() {
        assertEquals("FC * EF * OF", NotationNormalizer.normalize("E = FC * EF * OF"));
        assertEquals("FC_y * EF_CO2_y * OF_y", NotationNormalizer.normalize("E_CO2_y = FC_y * EF_CO2_y * OF_y"));
    }

    @Test
    @DisplayName("Only the first equals sign splits")
    void testFirstEqualsOnly() {
        assertEquals("b = c", NotationNormalizer.normalize("a = b = c"));
    }

    @Test
    @DisplayName("Multiplication and division macros")
    void testOperatorMacros() {
        assertEquals("a * b * c", NotationNormalizer.normalize("a \\times b \\cdot c"));
        assertEquals("a / b", NotationNormalizer.normalize("a \\div b"));
    }

    @Test
    @DisplayName("Fractions and roots")
    void testFracAndSqrt() {
        assertEquals("(a+b)/(c)", NotationNormalizer.normalize("\\frac{a+b}{c}"));
        assertEquals("sqrt(x)", NotationNormalizer.normalize("\\sqrt{x}"));
        assertEquals("sqrt((a)/(b))", NotationNormalizer.normalize("\\sqrt{\\frac{a}{b}}"));
    }

    @Test
    @DisplayName("Braced subscripts collapse into flat identifiers")
    void testSubscripts() {
        assertEquals("EF_CO2 * FC_y", NotationNormalizer.normalize("EF_{CO2} * FC_{y}"));
        assertEquals("x_i,j", NotationNormalizer.normalize("x_{i,j}"));
    }

    @Test
    @DisplayName("Subscript inside a fraction")
    void testSubscriptInsideFraction() {
        assertEquals("(x_1)/(y)", NotationNormalizer.normalize("\\frac{x_{1}}{y}"));
    }

    @Test
    @DisplayName("Unmatched patterns are left untouched")
    void testUntouched() {
        assertEquals("a ** 2 + b", NotationNormalizer.normalize("a ** 2 + b"));
        assertEquals("\\alpha{x} + \\frac{a}", NotationNormalizer.normalize("\\alpha{x} + \\frac{a}"));
        assertEquals("x_{}", NotationNormalizer.normalize("x_{}"));
    }

    @Test
    @DisplayName("Null and blank input")
    void testNullAndBlank() {
        assertEquals("", NotationNormalizer.normalize(null));
        assertEquals("", NotationNormalizer.normalize("   "));
        assertEquals("", NotationNormalizer.normalize("E ="));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "E = FC \\times EF",
            "\\frac{\\sqrt{a_{1}}}{b}",
            "\\sqrt{x_{i}} \\cdot y",
            "  a + b  ",
            "a ** ** b",
            "\\frac{a}{b_{j}}",
            "x_{{1}}"
    })
    @DisplayName("Normalizing is idempotent")
    void testIdempotent(String text) {
        String once = NotationNormalizer.normalize(text);
        assertEquals(once, NotationNormalizer.normalize(once));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "FC * EF * OF",
            "\\frac{a}{b} + c_{2}",
            "sqrt(x) \\times 3"
    })
    @DisplayName("A named formula normalizes like its expression")
    void testNamePrefixIgnored(String expression) {
        assertEquals(NotationNormalizer.normalize(expression), NotationNormalizer.normalize("R = " + expression));
    }
}
