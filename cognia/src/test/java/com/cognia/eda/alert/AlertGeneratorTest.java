package com.cognia.eda.alert;

import com.cognia.eda.config.CogniaProperties;
import com.cognia.eda.dataset.Dataset;
import com.cognia.eda.stats.ColumnSummary;
import com.cognia.eda.stats.MissingValueSummary;
import com.cognia.eda.stats.OutlierSummary;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AlertGenerator Tests")
class AlertGeneratorTest {

    private final AlertGenerator generator = new AlertGenerator(new CogniaProperties());

    private static ColumnSummary withSkew(String column, double skewness) {
        return ColumnSummary.builder().column(column).count(10).skewness(skewness).kurtosis(0.0).build();
    }

    @Test
    @DisplayName("Clean data raises no alerts")
    void testNoAlerts() {
        Dataset dataset = Dataset.fromRows(List.of("a"), List.of(new String[]{"1"}, new String[]{"2"}));
        List<String> alerts = generator.generate(dataset,
                List.of(withSkew("a", 0.1)),
                List.of(new OutlierSummary("a", 1, 2, 0, 3, 0, 0.0)),
                List.of(new MissingValueSummary("a", 0, 0.0)));

        assertTrue(alerts.isEmpty(), alerts.toString());
    }

    @Test
    @DisplayName("Should warn about missing values, outliers, skew, constants and duplicates in order")
    void testAlerts() {
        Dataset dataset = Dataset.fromRows(List.of("a", "k"), List.of(
                new String[]{"1", "x"},
                new String[]{"1", "x"},
                new String[]{"", "x"}));

        List<String> alerts = generator.generate(dataset,
                List.of(withSkew("a", 2.5), withSkew("b", Double.NaN)),
                List.of(new OutlierSummary("a", 1, 2, 0, 3, 1, 33.33)),
                List.of(new MissingValueSummary("a", 1, 33.33)));

        assertEquals(List.of(
                "Column 'a' has 33.33% missing values",
                "Column 'a' has 1 outliers (33.33% of values)",
                "Column 'a' is highly skewed (skewness 2.5)",
                "Column 'a' has a constant value",
                "Column 'k' has a constant value",
                "Dataset contains 1 duplicate rows"), alerts);
    }

    @Test
    @DisplayName("Should warn about high-cardinality categorical columns")
    void testHighCardinality() {
        List<String[]> rows = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            rows.add(new String[]{"user" + i});
        }
        Dataset dataset = Dataset.fromRows(List.of("user"), rows);

        List<String> alerts = generator.generate(dataset, List.of(), List.of(), List.of());

        assertEquals(List.of("Column 'user' has high cardinality (12 unique values)"), alerts);
    }
}
