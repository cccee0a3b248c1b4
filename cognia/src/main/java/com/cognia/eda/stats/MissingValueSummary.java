package com.cognia.eda.stats;

import lombok.Value;

@Value
public class MissingValueSummary {
    String column;
    long missingCount;
    double missingPercent;
}
