package com.cognia.eda.interpret;

import com.cognia.eda.exception.InvalidInputShapeException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DistributionInterpreter Tests")
class DistributionInterpreterTest {

    private final DistributionInterpreter interpreter = new DistributionInterpreter();

    private ShapeInterpretation single(double skewness, double kurtosis) {
        return interpreter.interpret(List.of(new ColumnShapeStats("x", skewness, kurtosis))).get(0);
    }

    @ParameterizedTest(name = "skew={0}, kurt={1}")
    @CsvSource({
            "0.0, 0.0, approximately symmetric, moderate tails",
            "1.2, 2.5, right-skewed, heavy tails",
            "-0.8, -1.5, left-skewed, light tails",
            "0.49, 0.99, approximately symmetric, moderate tails",
            "-0.49, -0.99, approximately symmetric, moderate tails",
            "0.5, 1.0, right-skewed, heavy tails",
            "-0.5, -1.0, left-skewed, light tails"
    })
    @DisplayName("Should classify skewness and kurtosis independently")
    void testClassification(double skewness, double kurtosis, String skewLabel, String kurtLabel) {
        String narrative = single(skewness, kurtosis).getNarrative();
        assertTrue(narrative.contains(skewLabel), narrative);
        assertTrue(narrative.contains(kurtLabel), narrative);
    }

    @Test
    @DisplayName("Skewness of exactly 0.5 is not symmetric")
    void testSkewBoundary() {
        assertFalse(single(0.5, 0.0).getNarrative().contains("approximately symmetric"));
    }

    @Test
    @DisplayName("Narrative is the skew sentence followed by the kurtosis sentence")
    void testNarrativeOrder() {
        assertEquals("The distribution is right-skewed, indicating the presence of higher-value outliers. "
                        + "The distribution has light tails, suggesting fewer extreme values.",
                single(2.0, -3.0).getNarrative());
    }

    @Test
    @DisplayName("Should round output to three decimals but classify on raw values")
    void testRounding() {
        ShapeInterpretation result = single(0.4996, 0.99951);

        assertEquals(0.5, result.getSkewness());
        assertEquals(1.0, result.getKurtosis());
        assertTrue(result.getNarrative().contains("approximately symmetric"));
        assertTrue(result.getNarrative().contains("moderate tails"));
    }

    @Test
    @DisplayName("Undefined statistics get their own narrative")
    void testNaN() {
        ShapeInterpretation result = single(Double.NaN, Double.NaN);

        assertTrue(result.getNarrative().contains("Skewness is undefined"));
        assertTrue(result.getNarrative().contains("Kurtosis is undefined"));
        assertFalse(result.getNarrative().contains("left-skewed"));
        assertFalse(result.getNarrative().contains("light tails"));
        assertTrue(Double.isNaN(result.getSkewness()));
    }

    @Test
    @DisplayName("Infinite statistics are undefined too")
    void testInfinite() {
        ShapeInterpretation result = single(Double.POSITIVE_INFINITY, 0.2);
        assertTrue(result.getNarrative().startsWith("Skewness is undefined"));
        assertTrue(result.getNarrative().contains("moderate tails"));
    }

    @Test
    @DisplayName("Empty input gives empty output")
    void testEmpty() {
        assertTrue(interpreter.interpret(List.of()).isEmpty());
    }

    @Test
    @DisplayName("Output keeps input order")
    void testOrder() {
        List<ShapeInterpretation> results = interpreter.interpret(List.of(
                new ColumnShapeStats("z", 0.0, 0.0),
                new ColumnShapeStats("a", 1.0, 1.0),
                new ColumnShapeStats("m", -1.0, -1.0)));

        assertEquals(List.of("z", "a", "m"), results.stream().map(ShapeInterpretation::getColumn).toList());
    }

    @Test
    @DisplayName("Should reject a column listed twice")
    void testDuplicateColumn() {
        List<ColumnShapeStats> stats = List.of(
                new ColumnShapeStats("x", 0.0, 0.0),
                new ColumnShapeStats("x", 1.0, 1.0));
        assertThrows(InvalidInputShapeException.class, () -> interpreter.interpret(stats));
    }

    @Test
    @DisplayName("Should reject missing or blank column names")
    void testMissingColumn() {
        assertThrows(InvalidInputShapeException.class,
                () -> interpreter.interpret(List.of(new ColumnShapeStats(" ", 0.0, 0.0))));
        assertThrows(InvalidInputShapeException.class,
                () -> interpreter.interpret(Arrays.asList((ColumnShapeStats) null)));
    }

    @Test
    @DisplayName("Repeated runs give identical results")
    void testIdempotent() {
        List<ColumnShapeStats> stats = List.of(
                new ColumnShapeStats("a", 0.7, -2.0),
                new ColumnShapeStats("b", Double.NaN, 0.1));
        assertEquals(interpreter.interpret(stats), interpreter.interpret(stats));
    }

    @Test
    @DisplayName("Rule lists cover every finite value")
    void testRulesExhaustive() {
        for (double value : new double[]{-1e9, -1.0, -0.5, -0.1, 0.0, 0.1, 0.5, 1.0, 1e9}) {
            assertDoesNotThrow(() -> ShapeRule.firstMatch(DistributionInterpreter.SKEWNESS_RULES, value));
            assertDoesNotThrow(() -> ShapeRule.firstMatch(DistributionInterpreter.KURTOSIS_RULES, value));
        }
    }
}
