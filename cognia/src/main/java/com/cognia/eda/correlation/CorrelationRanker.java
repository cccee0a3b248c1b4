package com.cognia.eda.correlation;

import com.cognia.eda.chart.ChartImage;
import com.cognia.eda.chart.ChartRenderer;
import com.cognia.eda.exception.ChartRenderingException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Extracts the unique feature pairs of a correlation matrix and ranks them by
 * absolute strength. Holds no state besides the drawing collaborator, so one
 * instance can serve any number of concurrent analyses.
 */
@Component
@RequiredArgsConstructor
public class CorrelationRanker {

    private static final Logger logger = LoggerFactory.getLogger(CorrelationRanker.class);

    public static final double DEFAULT_THRESHOLD = 0.6;
    public static final int DEFAULT_TOP_N = 10;
    public static final String HEATMAP_TITLE = "Full Correlation Heatmap";

    private final ChartRenderer chartRenderer;

    public RankedPairList rankPairs(FeatureMatrix matrix) {
        return rankPairs(matrix, DEFAULT_THRESHOLD, DEFAULT_TOP_N);
    }

    /**
     * Ranks the strictly-upper-triangle pairs of {@code matrix}.
     *
     * @param threshold minimum strength kept, in [0, 1]
     * @param topN      maximum number of pairs returned, applied after the threshold
     */
    public RankedPairList rankPairs(FeatureMatrix matrix, double threshold, int topN) {
        if (matrix == null) {
            throw new IllegalArgumentException("Correlation matrix is required");
        }
        if (!(threshold >= 0.0 && threshold <= 1.0)) {
            throw new IllegalArgumentException("Threshold must be within [0, 1] but was " + threshold);
        }
        if (topN < 0) {
            throw new IllegalArgumentException("topN must not be negative but was " + topN);
        }

        List<CorrelationPair> pairs = new ArrayList<>();
        int n = matrix.size();
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                double coefficient = matrix.get(i, j);
                // undefined coefficients never reach any threshold
                if (Double.isNaN(coefficient)) {
                    continue;
                }
                pairs.add(new CorrelationPair(matrix.featureName(i), matrix.featureName(j), Math.abs(coefficient)));
            }
        }

        // sorted() is stable on an ordered stream, so ties keep matrix order
        List<CorrelationPair> ranked = pairs.stream()
                .sorted(Comparator.comparingDouble(CorrelationPair::getStrength).reversed())
                .filter(pair -> pair.getStrength() >= threshold)
                .limit(topN)
                .collect(Collectors.toList());
        return new RankedPairList(ranked);
    }

    /**
     * Draws the entire matrix as a heatmap. Returns empty when there is nothing to
     * draw or the drawing collaborator fails.
     */
    public Optional<ChartImage> renderHeatmap(FeatureMatrix matrix) {
        if (matrix == null || matrix.size() == 0) {
            return Optional.empty();
        }
        try {
            return Optional.of(chartRenderer.heatmap(matrix.getFeatures(), matrix.toGrid(), HEATMAP_TITLE));
        } catch (ChartRenderingException e) {
            logger.warn("Could not render correlation heatmap for {} features: {}", matrix.size(), e.getMessage());
            return Optional.empty();
        }
    }
}
