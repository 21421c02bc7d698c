package com.bookreader.nlp.strategy;

import com.bookreader.nlp.core.CompleteDescription;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Output of one strategy run, before enrichment.
 */
public record StrategyResult(
    List<CompleteDescription> descriptions,
    List<String> processorsUsed,
    Map<String, Double> qualityMetrics,
    List<String> recommendations
) {

    public StrategyResult {
        descriptions = List.copyOf(descriptions);
        processorsUsed = List.copyOf(processorsUsed);
        qualityMetrics = Map.copyOf(qualityMetrics);
        recommendations = List.copyOf(recommendations);
    }

    public static StrategyResult empty() {
        return new StrategyResult(List.of(), List.of(), Map.of(), List.of());
    }

    public StrategyResult withRecommendation(String recommendation) {
        List<String> all = new ArrayList<>(recommendations.size() + 1);
        all.add(recommendation);
        all.addAll(recommendations);
        return new StrategyResult(descriptions, processorsUsed, qualityMetrics, all);
    }
}
