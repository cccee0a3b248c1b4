package com.cognia.eda.stats;

import lombok.Value;

import java.util.List;

@Value
public class DatasetOverview {
    int rows;
    int columns;
    List<ColumnOverview> columnOverview;
}
