package com.cognia.eda.dataset;

import com.cognia.eda.exception.DatasetLoadException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Dataset Tests")
class DatasetTest {

    private static Dataset sample() {
        return Dataset.fromRows(List.of("age", "city", "score"), List.of(
                new String[]{"30", "Paris", "1.5"},
                new String[]{"41", "Rome", "NA"},
                new String[]{"30", "Paris", "1.5"},
                new String[]{"", "Paris", "2"}));
    }

    @Test
    @DisplayName("Should infer numeric and categorical columns")
    void testTypeInference() {
        Dataset dataset = sample();

        assertEquals(List.of("age", "score"),
                dataset.numericColumns().stream().map(DatasetColumn::getName).toList());
        assertEquals(List.of("city"),
                dataset.categoricalColumns().stream().map(DatasetColumn::getName).toList());
    }

    @Test
    @DisplayName("Should treat missing markers as missing cells")
    void testMissingMarkers() {
        DatasetColumn score = sample().column("score").orElseThrow();

        assertEquals(1, score.missingCount());
        assertArrayEquals(new double[]{1.5, 1.5, 2.0}, score.numericValues());
        assertTrue(Double.isNaN(score.numericValueAt(1)));
    }

    @Test
    @DisplayName("Column with only missing cells is categorical")
    void testAllMissing() {
        Dataset dataset = Dataset.fromRows(List.of("empty"), List.<String[]>of(new String[]{""}, new String[]{"null"}));
        assertEquals(ColumnType.CATEGORICAL, dataset.getColumns().get(0).getType());
    }

    @Test
    @DisplayName("Should not accept Java-only number literals")
    void testJavaLiterals() {
        Dataset dataset = Dataset.fromRows(List.of("code"), List.<String[]>of(new String[]{"1d"}, new String[]{"2"}));
        assertEquals(ColumnType.CATEGORICAL, dataset.getColumns().get(0).getType());
    }

    @ParameterizedTest
    @ValueSource(strings = {"0x1p3", "0X10p0", "0x1.8p1"})
    @DisplayName("Should not accept hexadecimal floating-point literals")
    void testHexLiterals(String literal) {
        Dataset dataset = Dataset.fromRows(List.of("code"), List.<String[]>of(new String[]{literal}, new String[]{"2"}));
        assertEquals(ColumnType.CATEGORICAL, dataset.getColumns().get(0).getType());
    }

    @Test
    @DisplayName("Should type a column with infinite values as numeric")
    void testInfinity() {
        Dataset dataset = Dataset.fromRows(List.of("v"),
                List.<String[]>of(new String[]{"1"}, new String[]{"-Infinity"}, new String[]{"Infinity"}));
        assertEquals(ColumnType.NUMERIC, dataset.getColumns().get(0).getType());
    }

    @Test
    @DisplayName("Should pad short rows with missing cells")
    void testShortRows() {
        Dataset dataset = Dataset.fromRows(List.of("a", "b"), List.<String[]>of(new String[]{"1"}, new String[]{"2", "3"}));

        assertEquals(2, dataset.getRowCount());
        assertEquals(1, dataset.column("b").orElseThrow().missingCount());
    }

    @Test
    @DisplayName("Should count duplicate rows")
    void testDuplicates() {
        assertEquals(1, sample().duplicateRowCount());
    }

    @Test
    @DisplayName("Should count distinct numbers rather than distinct text")
    void testUniqueNumeric() {
        Dataset dataset = Dataset.fromRows(List.of("n"), List.<String[]>of(new String[]{"1"}, new String[]{"1.0"}, new String[]{"2"}));
        assertEquals(2, dataset.getColumns().get(0).uniqueCount());
    }

    @Test
    @DisplayName("Should order value counts by frequency then first appearance")
    void testTopValueCounts() {
        DatasetColumn city = Dataset.fromRows(List.of("city"), List.<String[]>of(
                new String[]{"Rome"}, new String[]{"Oslo"}, new String[]{"Paris"},
                new String[]{"Paris"}, new String[]{"Oslo"}, new String[]{""})).getColumns().get(0);

        Map<String, Long> counts = city.topValueCounts(2);

        assertEquals(List.of("Oslo", "Paris"), List.copyOf(counts.keySet()));
        assertEquals(2L, counts.get("Oslo"));
    }

    @Test
    @DisplayName("Should reject duplicate header names and a missing header")
    void testInvalidHeader() {
        assertThrows(DatasetLoadException.class, () -> Dataset.fromRows(List.of("a", "a"), List.of()));
        assertThrows(DatasetLoadException.class, () -> Dataset.fromRows(List.of(), List.of()));
    }
}
