package com.cognia.eda.stats;

import com.cognia.eda.dataset.Dataset;
import com.cognia.eda.dataset.DatasetColumn;
import com.cognia.eda.interpret.ColumnShapeStats;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Descriptive statistics of the numeric columns, ignoring missing cells.
 */
@Service
public class SummaryStatisticsService {

    public List<ColumnSummary> describe(Dataset dataset) {
        List<ColumnSummary> results = new ArrayList<>();
        for (DatasetColumn column : dataset.numericColumns()) {
            double[] values = column.numericValues();
            if (values.length == 0) {
                continue;
            }
            results.add(calculateStatistics(column.getName(), values));
        }
        return results;
    }

    /**
     * Skewness needs three values and kurtosis four; below that, or when the column
     * has no spread, both are reported as NaN.
     */
    public ColumnSummary calculateStatistics(String columnName, double[] values) {
        DescriptiveStatistics stats = Percentiles.linear(values);
        double std = stats.getStandardDeviation();
        boolean constant = stats.getN() > 1 && std == 0.0;

        return ColumnSummary.builder()
                .column(columnName)
                .count(stats.getN())
                .mean(stats.getMean())
                .std(stats.getN() > 1 ? std : Double.NaN)
                .min(stats.getMin())
                .q25(stats.getPercentile(25))
                .median(stats.getPercentile(50))
                .q75(stats.getPercentile(75))
                .max(stats.getMax())
                .skewness(constant ? Double.NaN : stats.getSkewness())
                .kurtosis(constant ? Double.NaN : stats.getKurtosis())
                .build();
    }

    public List<ColumnShapeStats> shapeStats(List<ColumnSummary> summaries) {
        return summaries.stream()
                .map(summary -> new ColumnShapeStats(summary.getColumn(), summary.getSkewness(), summary.getKurtosis()))
                .collect(Collectors.toList());
    }
}
