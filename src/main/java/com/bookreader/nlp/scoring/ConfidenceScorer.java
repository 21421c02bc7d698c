package com.bookreader.nlp.scoring;

import com.bookreader.nlp.core.CompleteDescription;
import com.bookreader.nlp.core.ConfidenceBreakdown;
import com.bookreader.nlp.core.DescriptionGroup;
import com.bookreader.nlp.core.EntityTag;
import com.bookreader.nlp.core.RawDescription;
import com.bookreader.nlp.core.ScoringWeights;
import com.bookreader.nlp.text.RussianLexicon;
import com.bookreader.nlp.text.RussianTextAnalyzer;
import com.bookreader.nlp.text.Token;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Multi-factor confidence scorer.
 *
 * <p>The overall score is the weighted mean of the four breakdown factors and depends on
 * nothing else, so it can be recomputed from a stored breakdown:</p>
 * <pre>{@code
 * overall = (wL*lexical + wS*structural + wE*entityDensity + wT*typePriority) / (wL + wS + wE + wT)
 * }</pre>
 */
public class ConfidenceScorer {

    private static final Logger LOG = LoggerFactory.getLogger(ConfidenceScorer.class);

    /** Share of descriptive words at which the lexical signal saturates. */
    static final double LEXICAL_SATURATION = 0.3;

    /** Entities per 100 words at which the density signal saturates. */
    static final double ENTITY_DENSITY_SATURATION = 25.0;

    private final RussianTextAnalyzer analyzer;
    private final RussianLexicon lexicon;
    private final ScoringWeights weights;
    private final double minOverallScore;

    public ConfidenceScorer(
        @NotNull RussianTextAnalyzer analyzer,
        @NotNull RussianLexicon lexicon,
        @NotNull ScoringWeights weights,
        double minOverallScore
    ) {
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer must not be null");
        this.lexicon = Objects.requireNonNull(lexicon, "lexicon must not be null");
        this.weights = Objects.requireNonNull(weights, "weights must not be null");
        this.minOverallScore = minOverallScore;
    }

    /**
     * Scores a merged group and builds the candidate returned to the caller.
     *
     * @param group             overlapping raw descriptions
     * @param consensusStrength share of active extractors in the group
     */
    @NotNull
    public CompleteDescription score(@NotNull DescriptionGroup group, double consensusStrength) {
        RawDescription representative = group.representative();
        List<EntityTag> entities = group.entities();
        ConfidenceBreakdown breakdown = breakdown(representative.text(), group.structuralSignal(),
            entities.size(), group);
        double overall = overallScore(breakdown);
        if (LOG.isDebugEnabled()) {
            LOG.debug("Scored {} at [{}, {}): {} overall={}", group.type(), representative.span().start(),
                representative.span().end(), breakdown.toLogString(), String.format(Locale.ROOT, "%.3f", overall));
        }

        return new CompleteDescription(
            representative.text(),
            group.type(),
            representative.span().start(),
            representative.span().end(),
            breakdown,
            overall,
            Math.max(0.0, Math.min(1.0, consensusStrength)),
            group.processors(),
            entities,
            representative.wordCount(),
            Map.of()
        );
    }

    /**
     * Weighted mean of the breakdown factors. Pure function of its argument.
     */
    public double overallScore(@NotNull ConfidenceBreakdown breakdown) {
        double weightSum = weights.lexical() + weights.structural() + weights.entityDensity() + weights.typePriority();
        double sum = weights.lexical() * breakdown.lexical()
            + weights.structural() * breakdown.structural()
            + weights.entityDensity() * breakdown.entityDensity()
            + weights.typePriority() * breakdown.typePriority();
        return Math.max(0.0, Math.min(1.0, sum / weightSum));
    }

    /**
     * Whether a candidate survives the minimum-score filter.
     */
    public boolean passes(@NotNull CompleteDescription description) {
        return description.overallScore() >= minOverallScore;
    }

    public double getMinOverallScore() {
        return minOverallScore;
    }

    @NotNull
    public ScoringWeights getWeights() {
        return weights;
    }

    private ConfidenceBreakdown breakdown(String text, double structural, int entityCount, DescriptionGroup group) {
        List<Token> tokens = analyzer.tokenize(text, 0);
        int words = Math.max(1, tokens.size());

        long descriptive = tokens.stream()
            .filter(t -> lexicon.isDescriptive(t) || lexicon.isAdjective(t))
            .count();
        double lexical = Math.min(1.0, ((double) descriptive / words) / LEXICAL_SATURATION);

        double perHundredWords = entityCount * 100.0 / words;
        double entityDensity = Math.min(1.0, perHundredWords / ENTITY_DENSITY_SATURATION);

        return new ConfidenceBreakdown(
            lexical,
            Math.max(0.0, Math.min(1.0, structural)),
            entityDensity,
            group.type().typePriority()
        );
    }
}
