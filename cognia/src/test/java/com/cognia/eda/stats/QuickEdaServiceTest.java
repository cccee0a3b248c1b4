package com.cognia.eda.stats;

import com.cognia.eda.dataset.Dataset;
import com.cognia.eda.interpret.DistributionInterpreter;
import com.cognia.eda.interpret.ShapeInterpretation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("QuickEdaService Tests")
class QuickEdaServiceTest {

    private final QuickEdaService service = new QuickEdaService(
            new DatasetProfiler(),
            new MissingValueAnalyzer(),
            new SummaryStatisticsService(),
            new OutlierDetector(),
            new DistributionInterpreter());

    @Test
    @DisplayName("Should bundle every analysis for the dataset")
    void testAnalyze() {
        Dataset dataset = Dataset.fromRows(List.of("amount", "flat", "kind"), List.of(
                new String[]{"1", "5", "a"},
                new String[]{"1", "5", "b"},
                new String[]{"2", "5", "a"},
                new String[]{"2", "5", "a"},
                new String[]{"3", "5", "c"},
                new String[]{"30", "5", "a"}));

        EdaResult result = service.analyze(dataset);

        assertEquals(6, result.getOverview().getRows());
        assertEquals(3, result.getMissing().size());
        assertEquals(2, result.getStatistics().size());
        assertEquals(2, result.getOutliers().size());

        List<ShapeInterpretation> interpretation = result.getInterpretation();
        assertEquals("amount", interpretation.get(0).getColumn());
        assertTrue(interpretation.get(0).getNarrative().contains("right-skewed"));
        assertTrue(interpretation.get(1).getNarrative().contains("undefined"));
    }

    @Test
    @DisplayName("Dataset without numeric columns yields empty statistics")
    void testNoNumeric() {
        Dataset dataset = Dataset.fromRows(List.of("kind"), List.<String[]>of(new String[]{"a"}));
        EdaResult result = service.analyze(dataset);

        assertTrue(result.getStatistics().isEmpty());
        assertTrue(result.getInterpretation().isEmpty());
    }
}
