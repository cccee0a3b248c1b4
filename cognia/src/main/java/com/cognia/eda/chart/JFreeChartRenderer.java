package com.cognia.eda.chart;

import com.cognia.eda.config.CogniaProperties;
import com.cognia.eda.exception.ChartRenderingException;
import lombok.RequiredArgsConstructor;
import org.jfree.chart.ChartFactory;
import org.jfree.chart.ChartUtils;
import org.jfree.chart.JFreeChart;
import org.jfree.chart.axis.CategoryAxis;
import org.jfree.chart.axis.CategoryLabelPositions;
import org.jfree.chart.axis.NumberAxis;
import org.jfree.chart.axis.SymbolAxis;
import org.jfree.chart.block.BlockBorder;
import org.jfree.chart.labels.StandardCategoryItemLabelGenerator;
import org.jfree.chart.plot.CategoryPlot;
import org.jfree.chart.plot.XYPlot;
import org.jfree.chart.renderer.LookupPaintScale;
import org.jfree.chart.renderer.PaintScale;
import org.jfree.chart.renderer.category.BarRenderer;
import org.jfree.chart.renderer.category.StandardBarPainter;
import org.jfree.chart.renderer.xy.StandardXYBarPainter;
import org.jfree.chart.renderer.xy.XYBarRenderer;
import org.jfree.chart.renderer.xy.XYBlockRenderer;
import org.jfree.chart.title.PaintScaleLegend;
import org.jfree.chart.ui.RectangleEdge;
import org.jfree.data.category.DefaultCategoryDataset;
import org.jfree.data.statistics.HistogramDataset;
import org.jfree.data.statistics.HistogramType;
import org.jfree.data.xy.DefaultXYZDataset;
import org.springframework.stereotype.Component;

import java.awt.Color;
import java.awt.Font;
import java.awt.Paint;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;

@Component
@RequiredArgsConstructor
public class JFreeChartRenderer implements ChartRenderer {

    private static final Color HISTOGRAM_COLOR = new Color(0x4C72B0);
    static final Color UNDEFINED_CELL_COLOR = Color.WHITE;
    private static final int SCALE_STEPS = 40;

    // qualitative palette, one colour per category bar
    private static final Color[] CATEGORY_PALETTE = {
            new Color(0x8DD3C7), new Color(0xFFFFB3), new Color(0xBEBADA), new Color(0xFB8072),
            new Color(0x80B1D3), new Color(0xFDB462), new Color(0xB3DE69), new Color(0xFCCDE5),
            new Color(0xD9D9D9), new Color(0xBC80BD), new Color(0xCCEBC5), new Color(0xFFED6F)
    };

    private final CogniaProperties properties;

    @Override
    public ChartImage heatmap(List<String> labels, double[][] grid, String title) {
        int n = labels.size();
        if (n == 0) {
            throw new ChartRenderingException("Heatmap needs at least one feature");
        }

        double[] xs = new double[n * n];
        double[] ys = new double[n * n];
        double[] zs = new double[n * n];
        int k = 0;
        for (int row = 0; row < n; row++) {
            for (int column = 0; column < n; column++) {
                xs[k] = column;
                ys[k] = row;
                zs[k] = grid[row][column];
                k++;
            }
        }
        DefaultXYZDataset dataset = new DefaultXYZDataset();
        dataset.addSeries("correlation", new double[][]{xs, ys, zs});

        String[] symbols = labels.toArray(new String[0]);
        SymbolAxis xAxis = new SymbolAxis(null, symbols);
        xAxis.setVerticalTickLabels(true);
        SymbolAxis yAxis = new SymbolAxis(null, symbols);
        // first feature on top, as in a printed matrix
        yAxis.setInverted(true);

        PaintScale scale = coolWarmScale();
        XYBlockRenderer renderer = new XYBlockRenderer();
        renderer.setPaintScale(scale);

        XYPlot plot = new XYPlot(dataset, xAxis, yAxis, renderer);
        plot.setDomainGridlinesVisible(false);
        plot.setRangeGridlinesVisible(false);

        JFreeChart chart = new JFreeChart(title, JFreeChart.DEFAULT_TITLE_FONT, plot, false);
        NumberAxis legendAxis = new NumberAxis();
        legendAxis.setRange(-1.0, 1.0);
        PaintScaleLegend legend = new PaintScaleLegend(scale, legendAxis);
        legend.setPosition(RectangleEdge.RIGHT);
        legend.setMargin(4, 4, 4, 4);
        legend.setFrame(new BlockBorder(Color.GRAY));
        chart.addSubtitle(legend);
        chart.setBackgroundPaint(Color.WHITE);

        return encode(chart, properties.getCharts().getHeatmapWidth(), properties.getCharts().getHeatmapHeight());
    }

    @Override
    public ChartImage histogram(String column, double[] values, int bins) {
        if (values.length == 0) {
            throw new ChartRenderingException("No values to draw for " + column);
        }
        HistogramDataset dataset = new HistogramDataset();
        dataset.setType(HistogramType.FREQUENCY);
        try {
            dataset.addSeries("Frequency", values, bins);
        } catch (IllegalArgumentException e) {
            throw new ChartRenderingException("Cannot bin values of " + column + ": " + e.getMessage(), e);
        }

        JFreeChart histogram = ChartFactory.createHistogram(
                column + " - Distribution",
                column,
                "Frequency",
                dataset
        );
        histogram.removeLegend();
        XYBarRenderer renderer = (XYBarRenderer) histogram.getXYPlot().getRenderer();
        renderer.setBarPainter(new StandardXYBarPainter());
        renderer.setShadowVisible(false);
        renderer.setSeriesPaint(0, HISTOGRAM_COLOR);
        renderer.setDrawBarOutline(true);
        renderer.setSeriesOutlinePaint(0, Color.BLACK);

        return encode(histogram, properties.getCharts().getWidth(), properties.getCharts().getHeight());
    }

    @Override
    public ChartImage barChart(String column, List<String> labels, List<Long> counts) {
        if (labels.isEmpty()) {
            throw new ChartRenderingException("No categories to draw for " + column);
        }
        if (labels.size() != counts.size()) {
            throw new ChartRenderingException(
                    "Bar chart for " + column + " has " + labels.size() + " labels but " + counts.size() + " counts");
        }
        DefaultCategoryDataset dataset = new DefaultCategoryDataset();
        for (int i = 0; i < labels.size(); i++) {
            dataset.addValue(counts.get(i), "Count", labels.get(i));
        }

        JFreeChart chart = ChartFactory.createBarChart(
                column + " - Category Distribution",
                null,
                "Count",
                dataset
        );
        chart.removeLegend();
        CategoryPlot plot = chart.getCategoryPlot();
        plot.setRenderer(new PaletteBarRenderer());
        BarRenderer renderer = (BarRenderer) plot.getRenderer();
        renderer.setBarPainter(new StandardBarPainter());
        renderer.setShadowVisible(false);
        renderer.setDefaultItemLabelGenerator(new StandardCategoryItemLabelGenerator());
        renderer.setDefaultItemLabelsVisible(true);
        renderer.setDefaultItemLabelFont(new Font(Font.SANS_SERIF, Font.BOLD, 9));

        CategoryAxis domainAxis = plot.getDomainAxis();
        domainAxis.setCategoryLabelPositions(CategoryLabelPositions.UP_45);
        // headroom so the count labels stay inside the plot
        plot.getRangeAxis().setUpperMargin(0.15);

        return encode(chart, properties.getCharts().getWidth(), properties.getCharts().getHeight());
    }

    static PaintScale coolWarmScale() {
        LookupPaintScale scale = new LookupPaintScale(-1.0, 1.0, UNDEFINED_CELL_COLOR);
        Color cool = new Color(0x3B4CC0);
        Color neutral = new Color(0xDDDDDD);
        Color warm = new Color(0xB40426);
        for (int step = 0; step <= SCALE_STEPS; step++) {
            double value = -1.0 + 2.0 * step / SCALE_STEPS;
            Color paint = value < 0
                    ? blend(cool, neutral, value + 1.0)
                    : blend(neutral, warm, value);
            scale.add(value, paint);
        }
        return new UndefinedAwarePaintScale(scale);
    }

    private static Color blend(Color from, Color to, double fraction) {
        double f = Math.max(0.0, Math.min(1.0, fraction));
        return new Color(
                (int) Math.round(from.getRed() + (to.getRed() - from.getRed()) * f),
                (int) Math.round(from.getGreen() + (to.getGreen() - from.getGreen()) * f),
                (int) Math.round(from.getBlue() + (to.getBlue() - from.getBlue()) * f));
    }

    private static ChartImage encode(JFreeChart chart, int width, int height) {
        try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            ChartUtils.writeChartAsPNG(out, chart, width, height);
            return ChartImage.png(out.toByteArray());
        } catch (IOException e) {
            throw new ChartRenderingException("Could not encode chart '" + chart.getTitle().getText() + "'", e);
        }
    }

    /**
     * Leaves undefined coefficients blank instead of giving them a scale colour.
     */
    private static class UndefinedAwarePaintScale implements PaintScale {
        private final PaintScale delegate;

        UndefinedAwarePaintScale(PaintScale delegate) {
            this.delegate = delegate;
        }

        @Override
        public double getLowerBound() {
            return delegate.getLowerBound();
        }

        @Override
        public double getUpperBound() {
            return delegate.getUpperBound();
        }

        @Override
        public Paint getPaint(double value) {
            return Double.isNaN(value) ? UNDEFINED_CELL_COLOR : delegate.getPaint(value);
        }
    }

    private static class PaletteBarRenderer extends BarRenderer {
        @Override
        public Paint getItemPaint(int row, int column) {
            return CATEGORY_PALETTE[column % CATEGORY_PALETTE.length];
        }
    }
}
