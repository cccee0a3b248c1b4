package com.cognia.eda.interpret;

import lombok.Value;

/**
 * Display record for one column: statistics rounded to three decimals plus the
 * narrative derived from the unrounded values.
 */
@Value
public class ShapeInterpretation {
    String column;
    double skewness;
    double kurtosis;
    String narrative;
}
