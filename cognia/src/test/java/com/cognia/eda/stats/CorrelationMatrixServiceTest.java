package com.cognia.eda.stats;

import com.cognia.eda.correlation.FeatureMatrix;
import com.cognia.eda.dataset.Dataset;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CorrelationMatrixService Tests")
class CorrelationMatrixServiceTest {

    private static final double EPS = 1e-9;

    private final CorrelationMatrixService service = new CorrelationMatrixService();

    @Test
    @DisplayName("Should correlate numeric columns only, in column order")
    void testCompute() {
        Dataset dataset = Dataset.fromRows(List.of("x", "label", "up", "down"), List.of(
                new String[]{"1", "a", "2", "10"},
                new String[]{"2", "b", "4", "8"},
                new String[]{"3", "c", "6", "6"},
                new String[]{"4", "d", "8", "4"}));

        FeatureMatrix matrix = service.compute(dataset);

        assertEquals(List.of("x", "up", "down"), matrix.getFeatures());
        assertEquals(1.0, matrix.get("x", "x"));
        assertEquals(1.0, matrix.get("x", "up"), EPS);
        assertEquals(-1.0, matrix.get("x", "down"), EPS);
        assertEquals(matrix.get(1, 2), matrix.get(2, 1));
    }

    @Test
    @DisplayName("Should use only rows where both cells are present")
    void testPairwiseComplete() {
        Dataset dataset = Dataset.fromRows(List.of("a", "b"), List.of(
                new String[]{"1", "1"},
                new String[]{"2", ""},
                new String[]{"3", "3"},
                new String[]{"100", ""},
                new String[]{"5", "5"}));

        assertEquals(1.0, service.compute(dataset).get("a", "b"), EPS);
    }

    @Test
    @DisplayName("Constant column and too few rows give undefined coefficients")
    void testUndefined() {
        Dataset constant = Dataset.fromRows(List.of("a", "b"), List.of(
                new String[]{"1", "7"},
                new String[]{"2", "7"},
                new String[]{"3", "7"}));
        assertTrue(Double.isNaN(service.compute(constant).get("a", "b")));

        Dataset sparse = Dataset.fromRows(List.of("a", "b"), List.of(
                new String[]{"1", ""},
                new String[]{"", "2"},
                new String[]{"3", "4"}));
        assertTrue(Double.isNaN(service.compute(sparse).get("a", "b")));
    }

    @Test
    @DisplayName("No numeric columns gives an empty matrix")
    void testNoNumericColumns() {
        Dataset dataset = Dataset.fromRows(List.of("name"), List.<String[]>of(new String[]{"x"}));
        assertEquals(0, service.compute(dataset).size());
    }
}
