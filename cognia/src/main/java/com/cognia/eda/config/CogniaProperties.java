package com.cognia.eda.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tunables for a report run, bound from the {@code cognia.*} keys of application.yml.
 * Field defaults apply when a key is absent.
 */
@Data
@ConfigurationProperties(prefix = "cognia")
public class CogniaProperties {

    private Correlation correlation = new Correlation();
    private Report report = new Report();
    private Charts charts = new Charts();
    private Alerts alerts = new Alerts();

    @Data
    public static class Correlation {
        /** Minimum absolute coefficient for a pair to appear in the top pairs table. */
        private double threshold = 0.6;
        private int topN = 10;
        /** Above this many numeric features the heatmap is replaced by the top pairs table. */
        private int fullHeatmapMaxFeatures = 10;
    }

    @Data
    public static class Report {
        private String outputFile = "cognia_eda_report.html";
        private boolean showFullCorrelation = false;
    }

    @Data
    public static class Charts {
        private int histogramBins = 30;
        private int topCategories = 10;
        private int width = 700;
        private int height = 400;
        private int heatmapWidth = 800;
        private int heatmapHeight = 600;
    }

    @Data
    public static class Alerts {
        private double missingPercentThreshold = 20.0;
        private double outlierPercentThreshold = 5.0;
        private double skewnessThreshold = 1.0;
        private double highCardinalityRatio = 0.9;
        private int highCardinalityMinRows = 10;
    }
}
