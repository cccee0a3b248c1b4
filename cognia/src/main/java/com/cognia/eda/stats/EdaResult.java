package com.cognia.eda.stats;

import com.cognia.eda.interpret.ShapeInterpretation;
import lombok.Value;

import java.util.List;

/**
 * Everything the quick analysis pass produces for one dataset.
 */
@Value
public class EdaResult {
    DatasetOverview overview;
    List<MissingValueSummary> missing;
    List<ColumnSummary> statistics;
    List<OutlierSummary> outliers;
    List<ShapeInterpretation> interpretation;
}
