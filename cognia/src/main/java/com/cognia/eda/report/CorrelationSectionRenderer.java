package com.cognia.eda.report;

import com.cognia.eda.chart.ChartImage;
import com.cognia.eda.config.CogniaProperties;
import com.cognia.eda.correlation.CorrelationPair;
import com.cognia.eda.correlation.CorrelationRanker;
import com.cognia.eda.correlation.FeatureMatrix;
import com.cognia.eda.correlation.RankedPairList;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Correlation part of the report. Small matrices are shown whole as a heatmap;
 * wider ones get the top pairs table, with the heatmap folded away on request.
 */
@Component
@RequiredArgsConstructor
public class CorrelationSectionRenderer {

    static final List<String> PAIR_HEADERS = List.of("feature_1", "feature_2", "correlation");

    private final CorrelationRanker correlationRanker;
    private final HtmlTableRenderer tableRenderer;
    private final CogniaProperties properties;

    public String render(FeatureMatrix matrix, boolean showFullCorrelation) {
        StringBuilder html = new StringBuilder();

        CogniaProperties.Correlation settings = properties.getCorrelation();
        if (matrix.size() > settings.getFullHeatmapMaxFeatures()) {
            RankedPairList pairs = correlationRanker.rankPairs(matrix, settings.getThreshold(), settings.getTopN());
            html.append("<h3>Top Correlated Feature Pairs</h3>\n");
            html.append(tableRenderer.render(PAIR_HEADERS, toRows(pairs)));

            if (showFullCorrelation) {
                Optional<ChartImage> heatmap = correlationRanker.renderHeatmap(matrix);
                heatmap.ifPresent(image -> html
                        .append("\n<details style=\"margin-top:25px;\">\n")
                        .append("<summary style=\"cursor:pointer;font-weight:600;\">")
                        .append("Show Full Correlation Heatmap (Advanced)</summary>\n")
                        .append("<img src=\"").append(image.toDataUri()).append("\" />\n")
                        .append("</details>\n"));
            }
        } else {
            correlationRanker.renderHeatmap(matrix)
                    .ifPresent(image -> html.append("<img src=\"").append(image.toDataUri()).append("\" />\n"));
        }
        return html.toString();
    }

    private static List<List<Object>> toRows(RankedPairList pairs) {
        return pairs.getPairs().stream()
                .map(CorrelationSectionRenderer::toRow)
                .collect(Collectors.toList());
    }

    private static List<Object> toRow(CorrelationPair pair) {
        return List.of(pair.getFeatureA(), pair.getFeatureB(), pair.getStrength());
    }
}
