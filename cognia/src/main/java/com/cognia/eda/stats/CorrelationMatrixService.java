package com.cognia.eda.stats;

import com.cognia.eda.correlation.FeatureMatrix;
import com.cognia.eda.dataset.Dataset;
import com.cognia.eda.dataset.DatasetColumn;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Pearson correlation between every pair of numeric columns, each pair computed over
 * the rows where both cells are present.
 */
@Service
public class CorrelationMatrixService {

    public FeatureMatrix compute(Dataset dataset) {
        List<DatasetColumn> numeric = dataset.numericColumns();
        List<String> names = numeric.stream().map(DatasetColumn::getName).collect(Collectors.toList());
        int n = numeric.size();
        double[][] grid = new double[n][n];

        for (int i = 0; i < n; i++) {
            grid[i][i] = 1.0;
            for (int j = i + 1; j < n; j++) {
                double correlation = calculatePearsonCorrelation(numeric.get(i), numeric.get(j));
                grid[i][j] = correlation;
                grid[j][i] = correlation;
            }
        }
        return FeatureMatrix.of(names, grid);
    }

    private double calculatePearsonCorrelation(DatasetColumn first, DatasetColumn second) {
        int rows = first.size();
        double[] array1 = new double[rows];
        double[] array2 = new double[rows];
        int complete = 0;
        for (int row = 0; row < rows; row++) {
            if (first.isMissing(row) || second.isMissing(row)) {
                continue;
            }
            array1[complete] = first.numericValueAt(row);
            array2[complete] = second.numericValueAt(row);
            complete++;
        }
        if (complete < 2) {
            return Double.NaN;
        }
        double[] x = Arrays.copyOf(array1, complete);
        double[] y = Arrays.copyOf(array2, complete);
        double correlation = new PearsonsCorrelation().correlation(x, y);
        // guard against rounding just past the unit interval
        return Double.isNaN(correlation) ? correlation : Math.max(-1.0, Math.min(1.0, correlation));
    }
}
