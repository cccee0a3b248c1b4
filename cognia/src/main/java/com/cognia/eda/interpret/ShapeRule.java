package com.cognia.eda.interpret;

import lombok.Value;

import java.util.List;
import java.util.function.DoublePredicate;

/**
 * A predicate on a shape statistic paired with the sentence it produces.
 */
@Value
public class ShapeRule {
    String name;
    DoublePredicate predicate;
    String sentence;

    public boolean matches(double value) {
        return predicate.test(value);
    }

    /**
     * Sentence of the first rule in {@code rules} that matches {@code value}.
     */
    public static String firstMatch(List<ShapeRule> rules, double value) {
        for (ShapeRule rule : rules) {
            if (rule.matches(value)) {
                return rule.getSentence();
            }
        }
        throw new IllegalStateException("No rule matches value " + value);
    }
}
