package com.bookreader.nlp.voting;

import com.bookreader.nlp.core.DescriptionGroup;
import com.bookreader.nlp.core.RawDescription;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups raw descriptions that denote the same text.
 *
 * <p>Two descriptions match when they share a type and their spans overlap by more than
 * {@code overlapRatio} of the shorter one. Matching is closed transitively, so the grouping
 * does not depend on input order and grouping an already-merged list changes nothing.</p>
 */
public class DescriptionMerger {

    private static final Comparator<RawDescription> INPUT_ORDER =
        Comparator.comparingInt((RawDescription d) -> d.span().start())
            .thenComparingInt(d -> d.span().end())
            .thenComparing(RawDescription::sourceProcessor)
            .thenComparing(RawDescription::text);

    private final double overlapRatio;

    public DescriptionMerger(double overlapRatio) {
        if (overlapRatio < 0.0 || overlapRatio > 1.0) {
            throw new IllegalArgumentException("overlapRatio must be in [0.0, 1.0], got: " + overlapRatio);
        }
        this.overlapRatio = overlapRatio;
    }

    /**
     * Partitions descriptions into groups, ordered by the earliest member's offset.
     */
    @NotNull
    public List<DescriptionGroup> group(@NotNull List<RawDescription> descriptions) {
        List<RawDescription> sorted = new ArrayList<>(descriptions);
        sorted.sort(INPUT_ORDER);

        int n = sorted.size();
        int[] parent = new int[n];
        for (int i = 0; i < n; i++) {
            parent[i] = i;
        }
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                if (matches(sorted.get(i), sorted.get(j))) {
                    union(parent, i, j);
                }
            }
        }

        Map<Integer, List<RawDescription>> components = new LinkedHashMap<>();
        for (int i = 0; i < n; i++) {
            components.computeIfAbsent(find(parent, i), k -> new ArrayList<>()).add(sorted.get(i));
        }
        return components.values().stream()
            .map(DescriptionGroup::new)
            .toList();
    }

    public double getOverlapRatio() {
        return overlapRatio;
    }

    private boolean matches(RawDescription a, RawDescription b) {
        return a.descriptionType() == b.descriptionType()
            && a.span().overlapsMoreThan(b.span(), overlapRatio);
    }

    private static int find(int[] parent, int i) {
        while (parent[i] != i) {
            parent[i] = parent[parent[i]];
            i = parent[i];
        }
        return i;
    }

    private static void union(int[] parent, int a, int b) {
        int rootA = find(parent, a);
        int rootB = find(parent, b);
        if (rootA != rootB) {
            parent[Math.max(rootA, rootB)] = Math.min(rootA, rootB);
        }
    }
}
