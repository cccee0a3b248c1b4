package com.cognia.eda.stats;

import lombok.Value;

@Value
public class ColumnOverview {
    String column;
    String type;
    long nonMissing;
    long unique;
}
