package com.cognia.eda.exception;

/**
 * Raised when an analysis input is structurally invalid: a correlation grid that is
 * not square or not symmetric, or shape statistics that reference a column
 * inconsistently. Degenerate but well-formed inputs (empty, single column) never
 * raise this.
 */
public class InvalidInputShapeException extends IllegalArgumentException {

    public InvalidInputShapeException(String message) {
        super(message);
    }
}
