package com.bookreader.nlp.text;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jetbrains.annotations.NotNull;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Measures how hard a chapter is to process, for adaptive strategy selection.
 */
@ApplicationScoped
public class TextComplexityAnalyzer {

    private static final Pattern WORD = Pattern.compile("[\\p{L}\\p{N}]+(?:-[\\p{L}\\p{N}]+)*");
    private static final double WORD_LENGTH_SATURATION = 10.0;
    private static final double SENTENCE_LENGTH_SATURATION = 20.0;

    /**
     * Measured text features.
     *
     * @param length            characters
     * @param wordCount         words
     * @param sentenceCount     terminal punctuation groups, at least 1 for non-blank text
     * @param avgWordLength     characters per word
     * @param avgSentenceLength words per sentence
     * @param hasPersonNames    whether person-name patterns were found
     * @param hasLocationNames  whether place-name patterns were found
     * @param complexity        score in [0.0, 1.0]
     */
    public record TextProfile(
        int length,
        int wordCount,
        int sentenceCount,
        double avgWordLength,
        double avgSentenceLength,
        boolean hasPersonNames,
        boolean hasLocationNames,
        double complexity
    ) {
    }

    private final ProperNameFinder nameFinder;

    @Inject
    public TextComplexityAnalyzer(ProperNameFinder nameFinder) {
        this.nameFinder = nameFinder;
    }

    @NotNull
    public TextProfile profile(@NotNull String text) {
        int words = 0;
        int letters = 0;
        Matcher matcher = WORD.matcher(text);
        while (matcher.find()) {
            words++;
            letters += matcher.end() - matcher.start();
        }
        int sentences = SentenceSplitter.countSentences(text);
        double avgWordLength = words == 0 ? 0.0 : (double) letters / words;
        double avgSentenceLength = sentences == 0 ? 0.0 : (double) words / sentences;

        return new TextProfile(
            text.length(),
            words,
            sentences,
            avgWordLength,
            avgSentenceLength,
            nameFinder.containsPersonNames(text),
            nameFinder.containsLocationNames(text),
            complexity(avgWordLength, avgSentenceLength)
        );
    }

    /**
     * Mean of the saturated average word length (10 chars) and sentence length (20 words).
     */
    public static double complexity(double avgWordLength, double avgSentenceLength) {
        double wordFactor = Math.min(1.0, avgWordLength / WORD_LENGTH_SATURATION);
        double sentenceFactor = Math.min(1.0, avgSentenceLength / SENTENCE_LENGTH_SATURATION);
        return (wordFactor + sentenceFactor) / 2.0;
    }
}
