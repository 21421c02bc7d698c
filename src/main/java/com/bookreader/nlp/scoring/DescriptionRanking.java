package com.bookreader.nlp.scoring;

import com.bookreader.nlp.core.CompleteDescription;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Result ordering: descending overall score, then type priority
 * (LOCATION &gt; CHARACTER &gt; ATMOSPHERE &gt; OBJECT &gt; ACTION), then position in the chapter.
 */
public final class DescriptionRanking {

    public static final Comparator<CompleteDescription> ORDER =
        Comparator.comparingDouble(CompleteDescription::overallScore).reversed()
            .thenComparingInt(d -> d.descriptionType().rank())
            .thenComparingInt(CompleteDescription::chapterOffset)
            .thenComparing(CompleteDescription::text);

    private DescriptionRanking() {
    }

    @NotNull
    public static List<CompleteDescription> sort(@NotNull List<CompleteDescription> descriptions) {
        List<CompleteDescription> sorted = new ArrayList<>(descriptions);
        sorted.sort(ORDER);
        return sorted;
    }

    /**
     * Picks up to {@code budget} non-overlapping candidates for image generation, best first.
     */
    @NotNull
    public static List<CompleteDescription> selectForIllustration(
        @NotNull List<CompleteDescription> descriptions,
        int budget
    ) {
        if (budget <= 0) {
            return List.of();
        }
        List<CompleteDescription> selected = new ArrayList<>();
        for (CompleteDescription candidate : sort(descriptions)) {
            boolean overlaps = selected.stream()
                .anyMatch(chosen -> chosen.span().overlapWith(candidate.span()) > 0);
            if (!overlaps) {
                selected.add(candidate);
                if (selected.size() == budget) {
                    break;
                }
            }
        }
        return selected;
    }
}
