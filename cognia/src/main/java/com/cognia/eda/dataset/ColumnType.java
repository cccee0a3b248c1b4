package com.cognia.eda.dataset;

public enum ColumnType {
    NUMERIC("numeric"),
    CATEGORICAL("categorical");

    private final String label;

    ColumnType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
