package com.cognia.eda.chart;

import lombok.Value;

import java.util.Base64;

/**
 * Encoded chart image, embedded in the report as a data URI.
 */
@Value
public class ChartImage {
    String mimeType;
    String base64;

    public static ChartImage png(byte[] bytes) {
        return new ChartImage("image/png", Base64.getEncoder().encodeToString(bytes));
    }

    public String toDataUri() {
        return "data:" + mimeType + ";base64," + base64;
    }
}
