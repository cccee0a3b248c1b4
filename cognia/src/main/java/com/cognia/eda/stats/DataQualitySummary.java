package com.cognia.eda.stats;

import lombok.Value;

@Value
public class DataQualitySummary {
    long duplicateRecords;
    double duplicatePercent;
    int numericCount;
    int categoricalCount;
}
