package com.cognia.eda.alert;

import com.cognia.eda.config.CogniaProperties;
import com.cognia.eda.dataset.Dataset;
import com.cognia.eda.dataset.DatasetColumn;
import com.cognia.eda.stats.ColumnSummary;
import com.cognia.eda.stats.MissingValueSummary;
import com.cognia.eda.stats.OutlierSummary;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Data-quality warnings for the report, in a fixed order: missing values, outliers,
 * skew, constant columns, high cardinality, duplicates.
 */
@Component
@RequiredArgsConstructor
public class AlertGenerator {

    private final CogniaProperties properties;

    public List<String> generate(Dataset dataset,
                                 List<ColumnSummary> statistics,
                                 List<OutlierSummary> outliers,
                                 List<MissingValueSummary> missing) {
        DecimalFormat df = new DecimalFormat("0.##", DecimalFormatSymbols.getInstance(Locale.ROOT));
        List<String> alerts = new ArrayList<>();

        for (MissingValueSummary summary : missing) {
            if (summary.getMissingPercent() > properties.getAlerts().getMissingPercentThreshold()) {
                alerts.add(String.format("Column '%s' has %s%% missing values",
                        summary.getColumn(), df.format(summary.getMissingPercent())));
            }
        }

        for (OutlierSummary summary : outliers) {
            if (summary.getOutlierPercent() > properties.getAlerts().getOutlierPercentThreshold()) {
                alerts.add(String.format("Column '%s' has %d outliers (%s%% of values)",
                        summary.getColumn(), summary.getOutlierCount(), df.format(summary.getOutlierPercent())));
            }
        }

        for (ColumnSummary summary : statistics) {
            double skewness = summary.getSkewness();
            if (Double.isFinite(skewness) && Math.abs(skewness) > properties.getAlerts().getSkewnessThreshold()) {
                alerts.add(String.format("Column '%s' is highly skewed (skewness %s)",
                        summary.getColumn(), df.format(skewness)));
            }
        }

        for (DatasetColumn column : dataset.getColumns()) {
            if (column.nonMissingCount() > 0 && column.uniqueCount() == 1) {
                alerts.add(String.format("Column '%s' has a constant value", column.getName()));
            }
        }

        int rows = dataset.getRowCount();
        if (rows > properties.getAlerts().getHighCardinalityMinRows()) {
            for (DatasetColumn column : dataset.categoricalColumns()) {
                double ratio = (double) column.uniqueCount() / rows;
                if (ratio > properties.getAlerts().getHighCardinalityRatio()) {
                    alerts.add(String.format("Column '%s' has high cardinality (%d unique values)",
                            column.getName(), column.uniqueCount()));
                }
            }
        }

        long duplicates = dataset.duplicateRowCount();
        if (duplicates > 0) {
            alerts.add(String.format("Dataset contains %d duplicate rows", duplicates));
        }
        return alerts;
    }
}
