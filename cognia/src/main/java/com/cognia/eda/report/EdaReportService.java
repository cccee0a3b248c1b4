package com.cognia.eda.report;

import com.cognia.eda.alert.AlertGenerator;
import com.cognia.eda.chart.ChartImage;
import com.cognia.eda.chart.ChartService;
import com.cognia.eda.correlation.FeatureMatrix;
import com.cognia.eda.dataset.Dataset;
import com.cognia.eda.exception.ReportGenerationException;
import com.cognia.eda.interpret.ShapeInterpretation;
import com.cognia.eda.stats.ColumnSummary;
import com.cognia.eda.stats.CorrelationMatrixService;
import com.cognia.eda.stats.DataQualitySummary;
import com.cognia.eda.stats.DatasetOverview;
import com.cognia.eda.stats.DatasetProfiler;
import com.cognia.eda.stats.EdaResult;
import com.cognia.eda.stats.MissingValueSummary;
import com.cognia.eda.stats.OutlierSummary;
import com.cognia.eda.stats.QuickEdaService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Assembles the self-contained HTML report: statistics tables, chart explorers,
 * correlation analysis and data-quality alerts.
 */
@Service
@RequiredArgsConstructor
public class EdaReportService {

    private static final Logger logger = LoggerFactory.getLogger(EdaReportService.class);

    private static final DateTimeFormatter GENERATED_FORMAT =
            DateTimeFormatter.ofPattern("dd MMM yyyy, HH:mm", Locale.ENGLISH);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final QuickEdaService quickEdaService;
    private final DatasetProfiler datasetProfiler;
    private final CorrelationMatrixService correlationMatrixService;
    private final AlertGenerator alertGenerator;
    private final ChartService chartService;
    private final CorrelationSectionRenderer correlationSectionRenderer;
    private final HtmlTableRenderer tableRenderer;
    private final Clock clock;

    public Path generate(Dataset dataset, Path outputFile, boolean showFullCorrelation) {
        String html = render(dataset, showFullCorrelation);
        try {
            Path parent = outputFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(outputFile, html, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ReportGenerationException("Could not write report to " + outputFile, e);
        }
        logger.info("EDA report written to {}", outputFile.toAbsolutePath());
        return outputFile;
    }

    public String render(Dataset dataset, boolean showFullCorrelation) {
        EdaResult result = quickEdaService.analyze(dataset);
        DataQualitySummary dq = datasetProfiler.dataQuality(dataset);
        List<String> alerts = alertGenerator.generate(
                dataset, result.getStatistics(), result.getOutliers(), result.getMissing());
        Map<String, ChartImage> catCharts = chartService.categoricalCharts(dataset);
        Map<String, ChartImage> numCharts = chartService.numericCharts(dataset);
        FeatureMatrix matrix = correlationMatrixService.compute(dataset);
        String correlationSection = correlationSectionRenderer.render(matrix, showFullCorrelation);

        DatasetOverview overview = result.getOverview();
        StringBuilder html = new StringBuilder();
        html.append("<html>\n<head>\n<meta charset=\"utf-8\">\n<title>Cognia EDA Report</title>\n")
                .append(ReportStyles.STYLESHEET)
                .append("</head>\n<body>\n")
                .append("<h1>Cognia - Exploratory Data Analysis Report</h1>\n");

        html.append("<div class=\"info-box\">\n")
                .append("<b>Generated:</b> ").append(LocalDateTime.now(clock).format(GENERATED_FORMAT)).append(" <br>\n")
                .append("<b>Total Rows:</b> ").append(overview.getRows()).append(" |\n")
                .append("<b>Total Columns:</b> ").append(overview.getColumns()).append("\n")
                .append("</div>\n");

        section(html, "1. Dataset Overview",
                overviewTable(overview)
                        + "\n<p><b>Duplicate Records:</b> " + dq.getDuplicateRecords()
                        + " (" + HtmlTableRenderer.formatValue(dq.getDuplicatePercent()) + "%)</p>"
                        + "\n<p><b>Numeric Columns:</b> " + dq.getNumericCount() + "</p>"
                        + "\n<p><b>Categorical Columns:</b> " + dq.getCategoricalCount() + "</p>");
        section(html, "2. Missing Value Analysis", missingTable(result.getMissing()));
        section(html, "3. Statistical Summary", statisticsTable(result.getStatistics()));
        section(html, "4. Distribution Interpretation", interpretationTable(result.getInterpretation()));
        section(html, "5. Outlier Analysis", outlierTable(result.getOutliers()));
        section(html, "6. Categorical Column Explorer", explorer("catImg", "catCharts", catCharts));
        section(html, "7. Numeric Column Explorer", explorer("numImg", "numCharts", numCharts));
        section(html, "Correlation Analysis", correlationSection);
        section(html, "Alerts &amp; Warnings", alertsHtml(alerts));

        html.append("<script>\n")
                .append("const catCharts = ").append(chartsJson(catCharts)).append(";\n")
                .append("const numCharts = ").append(chartsJson(numCharts)).append(";\n")
                .append("</script>\n")
                .append("<p style=\"text-align:center;color:gray;\">Generated by <b>Cognia</b></p>\n")
                .append("</body>\n</html>\n");
        return html.toString();
    }

    private static void section(StringBuilder html, String title, String body) {
        html.append("<div class=\"section\">\n<h2>").append(title).append("</h2>\n")
                .append(body).append("\n</div>\n");
    }

    private String overviewTable(DatasetOverview overview) {
        List<List<Object>> rows = overview.getColumnOverview().stream()
                .map(column -> List.<Object>of(column.getColumn(), column.getType(), column.getNonMissing(), column.getUnique()))
                .collect(Collectors.toList());
        return tableRenderer.render(List.of("column", "type", "non_missing", "unique"), rows);
    }

    private String missingTable(List<MissingValueSummary> missing) {
        List<List<Object>> rows = missing.stream()
                .map(m -> List.<Object>of(m.getColumn(), m.getMissingCount(), m.getMissingPercent()))
                .collect(Collectors.toList());
        return tableRenderer.render(List.of("column", "missing_count", "missing_percent"), rows);
    }

    private String statisticsTable(List<ColumnSummary> statistics) {
        List<List<Object>> rows = statistics.stream()
                .map(s -> List.<Object>of(s.getColumn(), s.getCount(), s.getMean(), s.getStd(), s.getMin(),
                        s.getQ25(), s.getMedian(), s.getQ75(), s.getMax(), s.getSkewness(), s.getKurtosis()))
                .collect(Collectors.toList());
        return tableRenderer.render(List.of("column", "count", "mean", "std", "min", "25%", "50%", "75%", "max",
                "skewness", "kurtosis"), rows);
    }

    private String interpretationTable(List<ShapeInterpretation> interpretation) {
        List<List<Object>> rows = interpretation.stream()
                .map(i -> List.<Object>of(i.getColumn(), i.getSkewness(), i.getKurtosis(), i.getNarrative()))
                .collect(Collectors.toList());
        return tableRenderer.render(List.of("column", "skewness", "kurtosis", "interpretation"), rows);
    }

    private String outlierTable(List<OutlierSummary> outliers) {
        List<List<Object>> rows = outliers.stream()
                .map(o -> List.<Object>of(o.getColumn(), o.getLowerBound(), o.getUpperBound(), o.getOutlierCount(),
                        o.getOutlierPercent()))
                .collect(Collectors.toList());
        return tableRenderer.render(List.of("column", "lower_bound", "upper_bound", "outlier_count", "outlier_percent"),
                rows);
    }

    private static String explorer(String imageId, String chartsVariable, Map<String, ChartImage> charts) {
        if (charts.isEmpty()) {
            return HtmlTableRenderer.NO_DATA;
        }
        StringBuilder html = new StringBuilder();
        html.append("<div style=\"text-align:center;\">\n")
                .append("<select onchange=\"document.getElementById('").append(imageId)
                .append("').src = ").append(chartsVariable).append("[this.value]\">\n");
        for (String column : charts.keySet()) {
            String escaped = HtmlTableRenderer.escapeHtml(column);
            html.append("<option value=\"").append(escaped).append("\">").append(escaped).append("</option>\n");
        }
        String first = charts.values().iterator().next().toDataUri();
        html.append("</select>\n</div>\n")
                .append("<img id=\"").append(imageId).append("\" src=\"").append(first).append("\" />");
        return html.toString();
    }

    private static String alertsHtml(List<String> alerts) {
        if (alerts.isEmpty()) {
            return "<p style=\"color:green;font-weight:600;\">No major data quality issues detected</p>";
        }
        return alerts.stream()
                .map(alert -> "<p style=\"color:#b71c1c;font-weight:600;\">" + HtmlTableRenderer.escapeHtml(alert) + "</p>")
                .collect(Collectors.joining("\n"));
    }

    private static String chartsJson(Map<String, ChartImage> charts) {
        Map<String, String> uris = new LinkedHashMap<>();
        charts.forEach((column, image) -> uris.put(column, image.toDataUri()));
        try {
            // keep a column name from closing the script element
            return MAPPER.writeValueAsString(uris).replace("</", "<\\/");
        } catch (JsonProcessingException e) {
            throw new ReportGenerationException("Could not serialise chart map", e);
        }
    }
}
