package com.cognia.eda.interpret;

import lombok.Value;

/**
 * Skewness and excess kurtosis of one numeric column. Either value may be NaN when
 * the column has too few values or no variance.
 */
@Value
public class ColumnShapeStats {
    String column;
    double skewness;
    double kurtosis;
}
