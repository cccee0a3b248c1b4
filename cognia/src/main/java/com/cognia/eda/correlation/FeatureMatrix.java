package com.cognia.eda.correlation;

import com.cognia.eda.exception.InvalidInputShapeException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Square, symmetric grid of correlation coefficients between numeric features.
 * Features are addressed by their position in a fixed canonical order, which is the
 * order the names were supplied in. A NaN coefficient marks a pair whose correlation
 * is undefined (constant column, too few complete rows).
 */
public final class FeatureMatrix {

    static final double SYMMETRY_TOLERANCE = 1e-9;

    private final List<String> features;
    private final Map<String, Integer> indexByName;
    private final double[][] values;

    private FeatureMatrix(List<String> features, double[][] values) {
        this.features = Collections.unmodifiableList(new ArrayList<>(features));
        this.indexByName = new HashMap<>();
        for (int i = 0; i < features.size(); i++) {
            if (indexByName.put(features.get(i), i) != null) {
                throw new InvalidInputShapeException("Duplicate feature name: " + features.get(i));
            }
        }
        this.values = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            this.values[i] = values[i].clone();
        }
    }

    public static FeatureMatrix of(List<String> features, double[][] grid) {
        if (features == null || grid == null) {
            throw new InvalidInputShapeException("Feature names and grid are required");
        }
        int n = features.size();
        if (grid.length != n) {
            throw new InvalidInputShapeException(
                    "Grid has " + grid.length + " rows but " + n + " features were named");
        }
        for (int i = 0; i < n; i++) {
            if (grid[i] == null || grid[i].length != n) {
                throw new InvalidInputShapeException("Row " + i + " of the grid is not of length " + n);
            }
        }
        for (int i = 0; i < n; i++) {
            if (grid[i][i] != 1.0) {
                throw new InvalidInputShapeException(
                        "Self-correlation of " + features.get(i) + " must be 1.0 but was " + grid[i][i]);
            }
            for (int j = i + 1; j < n; j++) {
                double upper = grid[i][j];
                double lower = grid[j][i];
                boolean bothNaN = Double.isNaN(upper) && Double.isNaN(lower);
                if (!bothNaN && !(Math.abs(upper - lower) <= SYMMETRY_TOLERANCE)) {
                    throw new InvalidInputShapeException(
                            "Grid is not symmetric at (" + features.get(i) + ", " + features.get(j) + "): "
                                    + upper + " vs " + lower);
                }
                if (Math.abs(upper) > 1.0 || Math.abs(lower) > 1.0) {
                    throw new InvalidInputShapeException(
                            "Coefficient for (" + features.get(i) + ", " + features.get(j) + ") is outside [-1, 1]: "
                                    + upper);
                }
            }
        }
        return new FeatureMatrix(features, grid);
    }

    /**
     * Builds a matrix from a nested name-to-name mapping. The iteration order of the
     * outer map fixes the canonical feature order, so pass a {@link LinkedHashMap}
     * when the order matters.
     */
    public static FeatureMatrix fromNested(Map<String, ? extends Map<String, Double>> nested) {
        if (nested == null) {
            throw new InvalidInputShapeException("Correlation mapping is required");
        }
        List<String> names = new ArrayList<>(nested.keySet());
        double[][] grid = new double[names.size()][names.size()];
        for (int i = 0; i < names.size(); i++) {
            Map<String, Double> row = nested.get(names.get(i));
            if (row == null || row.size() != names.size()) {
                throw new InvalidInputShapeException("Row " + names.get(i) + " does not cover every feature");
            }
            for (int j = 0; j < names.size(); j++) {
                Double value = row.get(names.get(j));
                if (value == null) {
                    throw new InvalidInputShapeException(
                            "Missing coefficient for (" + names.get(i) + ", " + names.get(j) + ")");
                }
                grid[i][j] = value;
            }
        }
        return of(names, grid);
    }

    public static FeatureMatrix empty() {
        return new FeatureMatrix(List.of(), new double[0][0]);
    }

    public int size() {
        return features.size();
    }

    public List<String> getFeatures() {
        return features;
    }

    public String featureName(int index) {
        return features.get(index);
    }

    public double get(int row, int column) {
        return values[row][column];
    }

    public double get(String row, String column) {
        Integer i = indexByName.get(row);
        Integer j = indexByName.get(column);
        if (i == null || j == null) {
            throw new IllegalArgumentException("Unknown feature: " + (i == null ? row : column));
        }
        return values[i][j];
    }

    /**
     * Returns a copy of the grid in canonical feature order.
     */
    public double[][] toGrid() {
        double[][] copy = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            copy[i] = values[i].clone();
        }
        return copy;
    }

    public Map<String, Map<String, Double>> toNested() {
        Map<String, Map<String, Double>> nested = new LinkedHashMap<>();
        for (int i = 0; i < features.size(); i++) {
            Map<String, Double> row = new LinkedHashMap<>();
            for (int j = 0; j < features.size(); j++) {
                row.put(features.get(j), values[i][j]);
            }
            nested.put(features.get(i), row);
        }
        return nested;
    }
}
