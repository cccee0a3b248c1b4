package com.cognia.eda.correlation;

import lombok.Value;

/**
 * One unordered feature pair and the absolute value of its correlation.
 * {@code featureA} precedes {@code featureB} in the matrix's feature order.
 */
@Value
public class CorrelationPair {
    String featureA;
    String featureB;
    double strength;
}
