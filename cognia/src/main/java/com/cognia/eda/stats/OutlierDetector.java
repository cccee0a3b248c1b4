package com.cognia.eda.stats;

import com.cognia.eda.dataset.Dataset;
import com.cognia.eda.dataset.DatasetColumn;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.util.Precision;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Flags values outside the Tukey fences {@code [Q1 - 1.5 IQR, Q3 + 1.5 IQR]}.
 */
@Service
public class OutlierDetector {

    static final double FENCE_FACTOR = 1.5;

    public List<OutlierSummary> detect(Dataset dataset) {
        List<OutlierSummary> results = new ArrayList<>();
        for (DatasetColumn column : dataset.numericColumns()) {
            double[] values = column.numericValues();
            if (values.length == 0) {
                continue;
            }
            results.add(analyzeOutliers(column.getName(), values));
        }
        return results;
    }

    public OutlierSummary analyzeOutliers(String columnName, double[] values) {
        DescriptiveStatistics stats = Percentiles.linear(values);
        double q1 = stats.getPercentile(25);
        double q3 = stats.getPercentile(75);
        double iqr = q3 - q1;
        double lowerBound = q1 - FENCE_FACTOR * iqr;
        double upperBound = q3 + FENCE_FACTOR * iqr;

        long outliers = Arrays.stream(values)
                .filter(value -> value < lowerBound || value > upperBound)
                .count();
        double percent = Precision.round(100.0 * outliers / values.length, 2);
        return new OutlierSummary(columnName, q1, q3, lowerBound, upperBound, outliers, percent);
    }
}
