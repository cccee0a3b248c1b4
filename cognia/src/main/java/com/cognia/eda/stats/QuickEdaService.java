package com.cognia.eda.stats;

import com.cognia.eda.dataset.Dataset;
import com.cognia.eda.interpret.DistributionInterpreter;
import com.cognia.eda.interpret.ShapeInterpretation;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * One pass over a dataset producing overview, missing values, summary statistics,
 * outliers and distribution interpretation.
 */
@Service
@RequiredArgsConstructor
public class QuickEdaService {

    private static final Logger logger = LoggerFactory.getLogger(QuickEdaService.class);

    private final DatasetProfiler datasetProfiler;
    private final MissingValueAnalyzer missingValueAnalyzer;
    private final SummaryStatisticsService summaryStatisticsService;
    private final OutlierDetector outlierDetector;
    private final DistributionInterpreter distributionInterpreter;

    public EdaResult analyze(Dataset dataset) {
        DatasetOverview overview = datasetProfiler.overview(dataset);
        List<MissingValueSummary> missing = missingValueAnalyzer.analyze(dataset);
        List<ColumnSummary> statistics = summaryStatisticsService.describe(dataset);
        List<OutlierSummary> outliers = outlierDetector.detect(dataset);
        List<ShapeInterpretation> interpretation =
                distributionInterpreter.interpret(summaryStatisticsService.shapeStats(statistics));

        logger.info("Analysed {} rows: {} numeric and {} categorical columns",
                overview.getRows(), dataset.numericColumns().size(), dataset.categoricalColumns().size());
        return new EdaResult(overview, missing, statistics, outliers, interpretation);
    }
}
