package com.cognia.eda.chart;

import com.cognia.eda.config.CogniaProperties;
import com.cognia.eda.dataset.Dataset;
import com.cognia.eda.dataset.DatasetColumn;
import com.cognia.eda.exception.ChartRenderingException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-column charts for the report explorers: a histogram for every numeric column
 * and a bar chart of the most frequent values for every categorical one. A column
 * whose chart fails to render is logged and left out.
 */
@Service
@RequiredArgsConstructor
public class ChartService {

    private static final Logger logger = LoggerFactory.getLogger(ChartService.class);

    private final ChartRenderer chartRenderer;
    private final CogniaProperties properties;

    public Map<String, ChartImage> numericCharts(Dataset dataset) {
        Map<String, ChartImage> charts = new LinkedHashMap<>();
        for (DatasetColumn column : dataset.numericColumns()) {
            // histogram bins need finite bounds
            double[] values = Arrays.stream(column.numericValues()).filter(Double::isFinite).toArray();
            if (values.length == 0) {
                logger.debug("No finite values to chart for column {}", column.getName());
                continue;
            }
            try {
                charts.put(column.getName(), chartRenderer.histogram(column.getName(), values, properties.getCharts().getHistogramBins()));
            } catch (ChartRenderingException e) {
                logger.warn("Skipping histogram for column {}: {}", column.getName(), e.getMessage());
            }
        }
        return charts;
    }

    public Map<String, ChartImage> categoricalCharts(Dataset dataset) {
        Map<String, ChartImage> charts = new LinkedHashMap<>();
        for (DatasetColumn column : dataset.categoricalColumns()) {
            Map<String, Long> counts = column.topValueCounts(properties.getCharts().getTopCategories());
            if (counts.isEmpty()) {
                continue;
            }
            try {
                charts.put(column.getName(), chartRenderer.barChart(
                        column.getName(), new ArrayList<>(counts.keySet()), new ArrayList<>(counts.values())));
            } catch (ChartRenderingException e) {
                logger.warn("Skipping category chart for column {}: {}", column.getName(), e.getMessage());
            }
        }
        return charts;
    }
}
