package com.cognia.eda.interpret;

import com.cognia.eda.exception.InvalidInputShapeException;
import org.apache.commons.math3.util.Precision;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns skewness and kurtosis into plain-language sentences. Each statistic is
 * classified by its own ordered rule list; the first matching rule wins, so the
 * undefined-value rule has to stay on top.
 */
@Component
public class DistributionInterpreter {

    static final int DISPLAY_SCALE = 3;

    public static final List<ShapeRule> SKEWNESS_RULES = List.of(
            new ShapeRule("undefined", value -> !Double.isFinite(value),
                    "Skewness is undefined due to insufficient data."),
            new ShapeRule("symmetric", value -> Math.abs(value) < 0.5,
                    "The distribution is approximately symmetric."),
            new ShapeRule("right-skewed", value -> value > 0,
                    "The distribution is right-skewed, indicating the presence of higher-value outliers."),
            new ShapeRule("left-skewed", value -> value < 0,
                    "The distribution is left-skewed, indicating the presence of lower-value outliers.")
    );

    public static final List<ShapeRule> KURTOSIS_RULES = List.of(
            new ShapeRule("undefined", value -> !Double.isFinite(value),
                    "Kurtosis is undefined due to insufficient data."),
            new ShapeRule("moderate", value -> Math.abs(value) < 1,
                    "The distribution has moderate tails, similar to a normal distribution."),
            new ShapeRule("heavy", value -> value > 0,
                    "The distribution has heavy tails, suggesting a higher likelihood of extreme values."),
            new ShapeRule("light", value -> value < 0,
                    "The distribution has light tails, suggesting fewer extreme values.")
    );

    public List<ShapeInterpretation> interpret(List<ColumnShapeStats> stats) {
        if (stats == null) {
            throw new InvalidInputShapeException("Shape statistics are required");
        }
        List<ShapeInterpretation> interpretations = new ArrayList<>(stats.size());
        Set<String> columns = new HashSet<>();
        for (ColumnShapeStats columnStats : stats) {
            if (columnStats == null || columnStats.getColumn() == null || columnStats.getColumn().isBlank()) {
                throw new InvalidInputShapeException("Shape statistics must name their column");
            }
            if (!columns.add(columnStats.getColumn())) {
                throw new InvalidInputShapeException(
                        "Column " + columnStats.getColumn() + " appears more than once");
            }
            interpretations.add(interpret(columnStats));
        }
        return interpretations;
    }

    public ShapeInterpretation interpret(ColumnShapeStats columnStats) {
        String skewText = ShapeRule.firstMatch(SKEWNESS_RULES, columnStats.getSkewness());
        String kurtText = ShapeRule.firstMatch(KURTOSIS_RULES, columnStats.getKurtosis());
        return new ShapeInterpretation(
                columnStats.getColumn(),
                Precision.round(columnStats.getSkewness(), DISPLAY_SCALE),
                Precision.round(columnStats.getKurtosis(), DISPLAY_SCALE),
                skewText + " " + kurtText);
    }
}
