package com.bookreader.nlp.segment;

import com.bookreader.nlp.core.EngineSettings;
import com.bookreader.nlp.core.Paragraph;
import com.bookreader.nlp.core.ParagraphType;
import com.bookreader.nlp.core.PhraseKind;
import com.bookreader.nlp.text.RussianTextAnalyzer;
import com.bookreader.nlp.text.Token;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits chapter text into typed, scored paragraphs.
 *
 * <h2>Rules:</h2>
 * <ul>
 *   <li>Blank lines separate paragraphs; whitespace-only spans are dropped</li>
 *   <li>A line opening with a dialogue dash starts a new paragraph</li>
 *   <li>Offsets point into the text passed to {@link #segment(String)}</li>
 *   <li>Phrase patterns are collected for DESCRIPTION and MIXED paragraphs only</li>
 * </ul>
 *
 * <p>Phrase extraction is best effort: if its backend fails, the failure is logged once
 * and paragraphs are returned without phrases.</p>
 */
@ApplicationScoped
public class ParagraphSegmenter {

    private static final Logger LOG = LoggerFactory.getLogger(ParagraphSegmenter.class);

    private static final Pattern BLANK_LINE = Pattern.compile("\\n[ \\t\\x0B\\f\\r]*\\n");
    private static final Pattern DIALOGUE_OPENER = Pattern.compile("^[ \\t]*[—–]");

    private final RussianTextAnalyzer analyzer;
    private final ParagraphClassifier classifier;
    private final PhraseExtractor phraseExtractor;
    private final EngineSettings.Segmentation settings;
    private final AtomicBoolean phraseFailureLogged = new AtomicBoolean(false);

    @Inject
    public ParagraphSegmenter(
        RussianTextAnalyzer analyzer,
        ParagraphClassifier classifier,
        PhraseExtractor phraseExtractor,
        EngineSettings settings
    ) {
        this.analyzer = analyzer;
        this.classifier = classifier;
        this.phraseExtractor = phraseExtractor;
        this.settings = settings.segmentation();
    }

    /**
     * Segments chapter text.
     *
     * @param chapterText chapter text, may be empty
     * @return paragraphs in text order; empty for blank input
     */
    @NotNull
    public List<Paragraph> segment(@NotNull String chapterText) {
        if (chapterText == null) {
            throw new IllegalArgumentException("chapterText cannot be null");
        }
        List<Paragraph> paragraphs = new ArrayList<>();
        for (int[] block : blocks(chapterText)) {
            for (int[] span : dialogueSplit(chapterText, block[0], block[1])) {
                int start = span[0];
                int end = span[1];
                while (start < end && Character.isWhitespace(chapterText.charAt(start))) {
                    start++;
                }
                while (end > start && Character.isWhitespace(chapterText.charAt(end - 1))) {
                    end--;
                }
                if (end > start) {
                    paragraphs.add(build(paragraphs.size(), chapterText.substring(start, end), start));
                }
            }
        }
        LOG.debug("Segmented {} characters into {} paragraphs", chapterText.length(), paragraphs.size());
        return paragraphs;
    }

    @NotNull
    public SegmentStatistics statistics(@NotNull List<Paragraph> paragraphs) {
        Map<ParagraphType, Integer> counts = new EnumMap<>(ParagraphType.class);
        for (ParagraphType type : ParagraphType.values()) {
            counts.put(type, 0);
        }
        double descriptiveness = 0.0;
        double length = 0.0;
        int descriptive = 0;
        for (Paragraph paragraph : paragraphs) {
            counts.merge(paragraph.type(), 1, Integer::sum);
            descriptiveness += paragraph.descriptivenessScore();
            length += paragraph.text().length();
            if (paragraph.type().isDescriptive()) {
                descriptive++;
            }
        }
        int total = paragraphs.size();
        return new SegmentStatistics(
            total,
            counts,
            total == 0 ? 0.0 : descriptiveness / total,
            total == 0 ? 0.0 : length / total,
            descriptive
        );
    }

    private Paragraph build(int index, String text, int startOffset) {
        List<Token> tokens = analyzer.tokenize(text, startOffset);
        ParagraphClassifier.Classification classification = classifier.classify(text, tokens, startOffset);
        Map<PhraseKind, List<String>> phrases = classification.type().isDescriptive()
            ? phrases(text)
            : Map.of();
        return new Paragraph(
            index,
            text,
            startOffset,
            startOffset + text.length(),
            classification.type(),
            classification.descriptivenessScore(),
            phrases
        );
    }

    private Map<PhraseKind, List<String>> phrases(String text) {
        if (!settings.phraseExtractionEnabled()) {
            return Map.of();
        }
        if (!phraseExtractor.isAvailable()) {
            if (phraseFailureLogged.compareAndSet(false, true)) {
                LOG.warn("Phrase extractor '{}' is unavailable, paragraphs will carry no phrases",
                    phraseExtractor.getName());
            }
            return Map.of();
        }
        String window = text.length() > settings.phraseMaxChars()
            ? text.substring(0, settings.phraseMaxChars())
            : text;
        try {
            return phraseExtractor.extract(window);
        } catch (RuntimeException e) {
            if (phraseFailureLogged.compareAndSet(false, true)) {
                LOG.warn("Phrase extraction with '{}' failed, continuing without phrases: {}",
                    phraseExtractor.getName(), e.getMessage(), e);
            } else {
                LOG.debug("Phrase extraction failed again: {}", e.getMessage());
            }
            return Map.of();
        }
    }

    private static List<int[]> blocks(String text) {
        List<int[]> blocks = new ArrayList<>();
        Matcher matcher = BLANK_LINE.matcher(text);
        int start = 0;
        while (matcher.find()) {
            blocks.add(new int[]{start, matcher.start()});
            start = matcher.end();
        }
        blocks.add(new int[]{start, text.length()});
        return blocks;
    }

    private static List<int[]> dialogueSplit(String text, int start, int end) {
        List<int[]> spans = new ArrayList<>();
        int spanStart = start;
        int lineStart = start;
        while (lineStart < end) {
            int newline = text.indexOf('\n', lineStart);
            int lineEnd = newline < 0 || newline >= end ? end : newline;
            String line = text.substring(lineStart, lineEnd);
            if (lineStart > spanStart && DIALOGUE_OPENER.matcher(line).find()) {
                spans.add(new int[]{spanStart, lineStart});
                spanStart = lineStart;
            }
            lineStart = lineEnd + 1;
        }
        spans.add(new int[]{spanStart, end});
        return spans;
    }
}
