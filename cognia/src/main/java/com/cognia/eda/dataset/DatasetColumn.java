package com.cognia.eda.dataset;

import lombok.Value;

import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * One column of a {@link Dataset}. Cell values are kept as trimmed text with
 * {@code null} marking a missing cell; numeric columns parse them on demand.
 */
@Value
public class DatasetColumn {
    String name;
    ColumnType type;
    List<String> values;

    public DatasetColumn(String name, ColumnType type, List<String> values) {
        this.name = name;
        this.type = type;
        this.values = Collections.unmodifiableList(values);
    }

    public boolean isNumeric() {
        return type == ColumnType.NUMERIC;
    }

    public int size() {
        return values.size();
    }

    public boolean isMissing(int row) {
        return values.get(row) == null;
    }

    /**
     * Parsed value at {@code row}, NaN for a missing cell.
     */
    public double numericValueAt(int row) {
        String value = values.get(row);
        return value == null ? Double.NaN : Double.parseDouble(value);
    }

    /**
     * Non-missing values in row order.
     */
    public double[] numericValues() {
        if (!isNumeric()) {
            throw new IllegalStateException("Column " + name + " is not numeric");
        }
        return values.stream()
                .filter(Objects::nonNull)
                .mapToDouble(Double::parseDouble)
                .toArray();
    }

    public long missingCount() {
        return values.stream().filter(Objects::isNull).count();
    }

    public long nonMissingCount() {
        return values.size() - missingCount();
    }

    public long uniqueCount() {
        if (isNumeric()) {
            // "1" and "1.0" are the same number
            return values.stream().filter(Objects::nonNull).map(Double::parseDouble).distinct().count();
        }
        Set<String> distinct = values.stream().filter(Objects::nonNull).collect(Collectors.toCollection(LinkedHashSet::new));
        return distinct.size();
    }

    /**
     * Most frequent non-missing values, highest count first; equal counts keep first
     * appearance order.
     */
    public Map<String, Long> topValueCounts(int limit) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (String value : values) {
            if (value != null) {
                counts.merge(value, 1L, Long::sum);
            }
        }
        Map<String, Integer> firstSeen = new HashMap<>();
        int position = 0;
        for (String key : counts.keySet()) {
            firstSeen.put(key, position++);
        }
        return counts.entrySet().stream()
                .sorted(Comparator.<Map.Entry<String, Long>>comparingLong(Map.Entry::getValue).reversed()
                        .thenComparing(entry -> firstSeen.get(entry.getKey())))
                .limit(limit)
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue, (a, b) -> a, LinkedHashMap::new));
    }
}
