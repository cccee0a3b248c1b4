package com.cognia.eda.exception;

/**
 * A chart could not be drawn or encoded. Callers drop the chart from the report
 * instead of failing the whole run.
 */
public class ChartRenderingException extends RuntimeException {

    public ChartRenderingException(String message, Throwable cause) {
        super(message, cause);
    }

    public ChartRenderingException(String message) {
        super(message);
    }
}
