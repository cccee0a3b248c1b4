package com.cognia.eda.chart;

import com.cognia.eda.exception.ChartRenderingException;

import java.util.List;

/**
 * Draws charts from plain labels and numbers. Implementations own every pixel
 * decision; callers only supply ordered labels and values.
 */
public interface ChartRenderer {

    /**
     * @param labels feature names, used for both axes in the given order
     * @param grid   square grid, {@code grid[row][column]}, values in [-1, 1] or NaN
     */
    ChartImage heatmap(List<String> labels, double[][] grid, String title) throws ChartRenderingException;

    ChartImage histogram(String column, double[] values, int bins) throws ChartRenderingException;

    ChartImage barChart(String column, List<String> labels, List<Long> counts) throws ChartRenderingException;
}
