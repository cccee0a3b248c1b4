package com.cognia.eda.stats;

import com.cognia.eda.dataset.Dataset;
import com.cognia.eda.dataset.DatasetColumn;
import org.apache.commons.math3.util.Precision;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
public class MissingValueAnalyzer {

    public List<MissingValueSummary> analyze(Dataset dataset) {
        List<MissingValueSummary> results = new ArrayList<>();
        int rows = dataset.getRowCount();
        for (DatasetColumn column : dataset.getColumns()) {
            long missing = column.missingCount();
            double percent = rows == 0 ? 0.0 : Precision.round(100.0 * missing / rows, 2);
            results.add(new MissingValueSummary(column.getName(), missing, percent));
        }
        return results;
    }
}
