package com.cognia.eda.stats;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ColumnSummary {
    String column;
    long count;
    double mean;
    double std;
    double min;
    double q25;
    double median;
    double q75;
    double max;
    double skewness;
    double kurtosis;
}
