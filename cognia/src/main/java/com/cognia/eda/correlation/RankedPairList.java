package com.cognia.eda.correlation;

import lombok.Value;

import java.util.List;

/**
 * Correlation pairs ordered by strength, strongest first, already filtered by the
 * threshold and truncated to the requested count.
 */
@Value
public class RankedPairList {
    List<CorrelationPair> pairs;

    public RankedPairList(List<CorrelationPair> pairs) {
        this.pairs = List.copyOf(pairs);
    }

    public static RankedPairList empty() {
        return new RankedPairList(List.of());
    }

    public int size() {
        return pairs.size();
    }

    public boolean isEmpty() {
        return pairs.isEmpty();
    }
}
