package com.cognia.eda.stats;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

final class Percentiles {

    private Percentiles() {
    }

    /**
     * Statistics whose percentiles interpolate linearly between order statistics,
     * the same estimator spreadsheet and dataframe tools use by default.
     */
    static DescriptiveStatistics linear(double[] values) {
        DescriptiveStatistics stats = new DescriptiveStatistics(values);
        stats.setPercentileImpl(new Percentile().withEstimationType(Percentile.EstimationType.R_7));
        return stats;
    }
}
