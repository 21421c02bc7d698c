package com.bookreader.nlp.segment;

import com.bookreader.nlp.core.EngineSettings;
import com.bookreader.nlp.core.Paragraph;
import com.bookreader.nlp.core.ParagraphType;
import com.bookreader.nlp.core.TextSpan;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds descriptions that run over several consecutive paragraphs.
 *
 * <h2>Rules:</h2>
 * <ul>
 *   <li>A run starts at a DESCRIPTION or MIXED paragraph with descriptiveness of at least 0.5</li>
 *   <li>It grows over at most {@code lookahead} following paragraphs while each one stays coherent
 *       with the run and the summed length stays within {@code maxChars}</li>
 *   <li>Dialogue, a stop word or a quoted/dashed opening ends the run</li>
 *   <li>A run is kept when it is at least {@code minChars} long, reads coherently, has clean
 *       edges and contains a strongly descriptive paragraph</li>
 * </ul>
 *
 * <p>Paragraphs claimed by a kept run are not reused. Runs are returned longest first.</p>
 */
public class DescriptionBoundaryDetector {

    private static final Logger LOG = LoggerFactory.getLogger(DescriptionBoundaryDetector.class);

    static final double START_DESCRIPTIVENESS = 0.5;
    static final double NARRATIVE_DESCRIPTIVENESS = 0.4;
    static final double MIN_OVERALL_COHERENCE = 0.4;
    static final double MIN_BOUNDARY_CONFIDENCE = 0.5;
    static final double STRONG_DESCRIPTIVENESS = 0.6;

    private static final int FLAGS =
        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS;

    private static final Pattern CONTINUATION = Pattern.compile(
        "^\\s*(также|кроме того|вдобавок|рядом|неподал[её]ку|вокруг|повсюду|дальше|далее|впереди"
            + "|позади|слева|справа|над|под|за|там|здесь|и|а)\\b", FLAGS);

    private static final Pattern STOP = Pattern.compile(
        "\\b(вдруг|внезапно|неожиданно|сказал|сказала|спросил|спросила|ответил|ответила"
            + "|крикнул|крикнула|прошептал|прошептала)\\b", FLAGS);

    private static final Pattern PRONOUN = Pattern.compile(
        "^\\s*(он|она|оно|они|его|её|ее|их|этот|эта|это|эти|тот|та|то|те)\\b", FLAGS);

    private static final Pattern COLOR = Pattern.compile(
        "\\b(красн|син|зел[её]н|ж[её]лт|бел|ч[её]рн|сер|голуб|коричнев|золот|серебрист|багров|ал|розов"
            + "|фиолетов|пурпурн|рыж|лилов|изумрудн)(ый|ий|ой|ая|яя|ое|ее|ые|ие|ого|его|ому|ему|ым|им|ом|ем"
            + "|ую|юю|ых|их|ыми|ими)\\b", FLAGS);

    private final EngineSettings.Boundaries settings;

    public DescriptionBoundaryDetector(@NotNull EngineSettings.Boundaries settings) {
        this.settings = settings;
    }

    /**
     * Detects multi-paragraph runs.
     *
     * @param paragraphs chapter paragraphs in text order, all types
     * @return accepted runs, longest first; empty when detection is disabled
     */
    @NotNull
    public List<DescriptionBoundary> detect(@NotNull List<Paragraph> paragraphs) {
        if (!settings.enabled() || paragraphs.isEmpty()) {
            return List.of();
        }
        boolean[] used = new boolean[paragraphs.size()];
        List<DescriptionBoundary> found = new ArrayList<>();
        for (int i = 0; i < paragraphs.size(); i++) {
            Paragraph start = paragraphs.get(i);
            if (used[i] || !start.type().isDescriptive()
                || start.descriptivenessScore() < START_DESCRIPTIVENESS) {
                continue;
            }
            DescriptionBoundary boundary = extend(paragraphs, i, used);
            if (boundary != null && isValid(boundary, paragraphs)) {
                found.add(boundary);
                for (int j = boundary.startIndex(); j <= boundary.endIndex(); j++) {
                    used[j] = true;
                }
            }
        }
        found.sort(Comparator.comparingInt(DescriptionBoundary::charLength).reversed());
        LOG.debug("Detected {} multi-paragraph runs over {} paragraphs", found.size(), paragraphs.size());
        return found;
    }

    private DescriptionBoundary extend(List<Paragraph> paragraphs, int startIndex, boolean[] used) {
        Paragraph first = paragraphs.get(startIndex);
        int length = first.text().length();
        int end = startIndex;
        Set<String> colors = colors(first.text());
        List<Double> coherences = new ArrayList<>();

        int limit = Math.min(startIndex + settings.lookahead(), paragraphs.size() - 1);
        for (int i = startIndex + 1; i <= limit; i++) {
            Paragraph next = paragraphs.get(i);
            if (used[i]
                || length + next.text().length() > settings.maxChars()
                || next.type() == ParagraphType.DIALOGUE
                || hasStopSignal(next.text())) {
                break;
            }
            double coherence = coherence(paragraphs.get(end), next, colors);
            if (coherence < settings.minCoherence()) {
                break;
            }
            if (next.type() == ParagraphType.NARRATIVE && next.descriptivenessScore() < NARRATIVE_DESCRIPTIVENESS) {
                break;
            }
            coherences.add(coherence);
            colors.addAll(colors(next.text()));
            length += next.text().length();
            end = i;
        }
        if (length < settings.minChars()) {
            return null;
        }

        double descriptiveness = 0.0;
        for (int i = startIndex; i <= end; i++) {
            descriptiveness += paragraphs.get(i).descriptivenessScore();
        }
        double overall = coherences.isEmpty()
            ? 1.0
            : coherences.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        return new DescriptionBoundary(
            startIndex,
            end,
            new TextSpan(first.startOffset(), paragraphs.get(end).endOffset()),
            length,
            overall,
            boundaryConfidence(paragraphs, startIndex, end),
            descriptiveness / (end - startIndex + 1)
        );
    }

    /**
     * Coherence of {@code next} with a run ending at {@code last}, in [0.0, 1.0].
     */
    double coherence(Paragraph last, Paragraph next, Set<String> runColors) {
        double score = 0.0;
        if (CONTINUATION.matcher(next.text()).find()) {
            score += 0.4;
        }
        if (last.type() == next.type()) {
            score += 0.2;
        } else if (last.type().isDescriptive() && next.type().isDescriptive()) {
            score += 0.15;
        }
        Set<String> shared = colors(next.text());
        shared.retainAll(runColors);
        if (!shared.isEmpty()) {
            score += 0.2;
        }
        if (PRONOUN.matcher(next.text()).find()) {
            score += 0.2;
        }
        return Math.min(score, 1.0);
    }

    private double boundaryConfidence(List<Paragraph> paragraphs, int startIndex, int endIndex) {
        Paragraph start = paragraphs.get(startIndex);
        double score = 0.3 * start.descriptivenessScore();

        if (endIndex + 1 < paragraphs.size()) {
            Paragraph after = paragraphs.get(endIndex + 1);
            if (after.type() == ParagraphType.DIALOGUE || hasStopSignal(after.text())) {
                score += 0.3;
            }
        } else {
            score += 0.3;
        }

        String startText = start.text().strip();
        String endText = paragraphs.get(endIndex).text().strip();
        if (!startText.isEmpty() && Character.isUpperCase(startText.charAt(0))) {
            score += 0.1;
        }
        if (endText.endsWith(".") || endText.endsWith("!") || endText.endsWith("?")) {
            score += 0.1;
        }

        double weakest = 1.0;
        for (int i = startIndex; i <= endIndex; i++) {
            weakest = Math.min(weakest, paragraphs.get(i).descriptivenessScore());
        }
        if (weakest >= 0.3) {
            score += 0.2;
        } else if (weakest >= 0.2) {
            score += 0.1;
        }
        return Math.min(score, 1.0);
    }

    private boolean isValid(DescriptionBoundary boundary, List<Paragraph> paragraphs) {
        if (boundary.charLength() < settings.minChars() || boundary.charLength() > settings.maxChars()) {
            return false;
        }
        if (boundary.coherence() < MIN_OVERALL_COHERENCE
            || boundary.boundaryConfidence() < MIN_BOUNDARY_CONFIDENCE) {
            return false;
        }
        for (int i = boundary.startIndex(); i <= boundary.endIndex(); i++) {
            if (paragraphs.get(i).descriptivenessScore() > STRONG_DESCRIPTIVENESS) {
                return true;
            }
        }
        return false;
    }

    static boolean hasStopSignal(String text) {
        String stripped = text.strip();
        return stripped.startsWith("—") || stripped.startsWith("–") || stripped.startsWith("«")
            || STOP.matcher(text).find();
    }

    static Set<String> colors(String text) {
        Set<String> found = new HashSet<>();
        Matcher matcher = COLOR.matcher(text);
        while (matcher.find()) {
            found.add(matcher.group().toLowerCase(Locale.ROOT));
        }
        return found;
    }
}
