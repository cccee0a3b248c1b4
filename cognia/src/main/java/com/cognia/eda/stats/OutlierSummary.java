package com.cognia.eda.stats;

import lombok.Value;

/**
 * IQR fences of one numeric column and how many values fall outside them.
 */
@Value
public class OutlierSummary {
    String column;
    double q1;
    double q3;
    double lowerBound;
    double upperBound;
    long outlierCount;
    double outlierPercent;
}
