package com.cognia.eda.dataset;

import com.cognia.eda.exception.DatasetLoadException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * In-memory table with named, typed columns in file order.
 */
public class Dataset {

    private static final Set<String> MISSING_MARKERS = Set.of("", "na", "n/a", "nan", "null", "none");

    private final List<DatasetColumn> columns;
    private final int rowCount;

    public Dataset(List<DatasetColumn> columns) {
        this.columns = List.copyOf(columns);
        this.rowCount = columns.isEmpty() ? 0 : columns.get(0).size();
        for (DatasetColumn column : columns) {
            if (column.size() != rowCount) {
                throw new DatasetLoadException("Column " + column.getName() + " has " + column.size()
                        + " values but the dataset has " + rowCount + " rows");
            }
        }
    }

    /**
     * Builds a dataset from a header and raw text rows. Short rows are padded with
     * missing cells and extra cells are ignored. A column is numeric when it has at
     * least one value and every value parses as a number.
     */
    public static Dataset fromRows(List<String> header, List<String[]> rows) {
        if (header == null || header.isEmpty()) {
            throw new DatasetLoadException("Dataset has no header row");
        }
        Set<String> seen = new HashSet<>();
        for (String name : header) {
            if (!seen.add(name)) {
                throw new DatasetLoadException("Duplicate column name in header: " + name);
            }
        }

        List<DatasetColumn> columns = new ArrayList<>();
        for (int c = 0; c < header.size(); c++) {
            List<String> values = new ArrayList<>(rows.size());
            for (String[] row : rows) {
                values.add(c < row.length ? normalize(row[c]) : null);
            }
            columns.add(new DatasetColumn(header.get(c), inferType(values), values));
        }
        return new Dataset(columns);
    }

    static String normalize(String cell) {
        if (cell == null) {
            return null;
        }
        String trimmed = cell.trim();
        return MISSING_MARKERS.contains(trimmed.toLowerCase(Locale.ROOT)) ? null : trimmed;
    }

    static ColumnType inferType(List<String> values) {
        boolean anyValue = false;
        for (String value : values) {
            if (value == null) {
                continue;
            }
            anyValue = true;
            if (!isNumber(value)) {
                return ColumnType.CATEGORICAL;
            }
        }
        return anyValue ? ColumnType.NUMERIC : ColumnType.CATEGORICAL;
    }

    private static boolean isNumber(String value) {
        try {
            Double.parseDouble(value);
            // reject Java-only literal forms such as "1d" or "0x1p3"
            if (value.indexOf('x') >= 0 || value.indexOf('X') >= 0) {
                return false;
            }
            char last = value.charAt(value.length() - 1);
            return Character.isDigit(last) || last == '.' || value.endsWith("Infinity");
        } catch (NumberFormatException e) {
            return false;
        }
    }

    public List<DatasetColumn> getColumns() {
        return columns;
    }

    public int getRowCount() {
        return rowCount;
    }

    public int getColumnCount() {
        return columns.size();
    }

    public List<String> columnNames() {
        return columns.stream().map(DatasetColumn::getName).collect(Collectors.toList());
    }

    public Optional<DatasetColumn> column(String name) {
        return columns.stream().filter(column -> column.getName().equals(name)).findFirst();
    }

    public List<DatasetColumn> numericColumns() {
        return columns.stream().filter(DatasetColumn::isNumeric).collect(Collectors.toList());
    }

    public List<DatasetColumn> categoricalColumns() {
        return columns.stream().filter(column -> !column.isNumeric()).collect(Collectors.toList());
    }

    /**
     * Rows identical to an earlier row in every column, missing cells included.
     */
    public long duplicateRowCount() {
        Set<List<String>> seen = new HashSet<>();
        long duplicates = 0;
        for (int row = 0; row < rowCount; row++) {
            List<String> key = new ArrayList<>(columns.size());
            for (DatasetColumn column : columns) {
                key.add(column.getValues().get(row));
            }
            if (!seen.add(Collections.unmodifiableList(key))) {
                duplicates++;
            }
        }
        return duplicates;
    }

    @Override
    public String toString() {
        return "Dataset[" + rowCount + " rows, " + columns.size() + " columns]";
    }
}
