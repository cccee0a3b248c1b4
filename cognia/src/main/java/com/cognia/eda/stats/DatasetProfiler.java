package com.cognia.eda.stats;

import com.cognia.eda.dataset.Dataset;
import com.cognia.eda.dataset.DatasetColumn;
import org.apache.commons.math3.util.Precision;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

@Service
public class DatasetProfiler {

    public DatasetOverview overview(Dataset dataset) {
        List<ColumnOverview> columns = dataset.getColumns().stream()
                .map(DatasetProfiler::describeColumn)
                .collect(Collectors.toList());
        return new DatasetOverview(dataset.getRowCount(), dataset.getColumnCount(), columns);
    }

    public DataQualitySummary dataQuality(Dataset dataset) {
        long duplicates = dataset.duplicateRowCount();
        double percent = dataset.getRowCount() == 0
                ? 0.0
                : Precision.round(100.0 * duplicates / dataset.getRowCount(), 2);
        return new DataQualitySummary(
                duplicates,
                percent,
                dataset.numericColumns().size(),
                dataset.categoricalColumns().size());
    }

    private static ColumnOverview describeColumn(DatasetColumn column) {
        return new ColumnOverview(
                column.getName(),
                column.getType().getLabel(),
                column.nonMissingCount(),
                column.uniqueCount());
    }
}
