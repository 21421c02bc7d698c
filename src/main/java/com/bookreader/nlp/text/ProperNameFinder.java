package com.bookreader.nlp.text;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Heuristic recognizer of Russian person and place names.
 *
 * <p>Uses capitalization outside sentence starts, a first-name list, surname suffixes
 * and toponym cues ("город", "река", ...). Consecutive capitalized words form one name.</p>
 */
@ApplicationScoped
public class ProperNameFinder {

    public static final String PERSON = "PER";
    public static final String LOCATION = "LOC";

    private static final Pattern SURNAME = Pattern.compile(
        "[А-ЯЁ][а-яё]{2,}(ов|ев|ёв|ин|ын|ский|цкий|ова|ева|ина|ына|ская|цкая|ович|евич|овна|евна)(а|у|ым|ой|е)?");
    private static final Set<String> PLACE_PREPOSITIONS = Set.of("в", "во", "на", "из", "над", "под", "к", "у", "около", "возле");
    private static final String SENTENCE_BOUNDARIES = ".!?…«\"—–:";

    /**
     * A recognized name with chapter offsets.
     */
    public record NameMatch(String text, String label, int start, int end, double confidence) {
    }

    private final RussianTextAnalyzer analyzer;
    private final RussianLexicon lexicon;

    @Inject
    public ProperNameFinder(RussianTextAnalyzer analyzer, RussianLexicon lexicon) {
        this.analyzer = analyzer;
        this.lexicon = lexicon;
    }

    @NotNull
    public List<NameMatch> find(@NotNull String text, int baseOffset) {
        List<Token> tokens = analyzer.tokenize(text, baseOffset);
        List<NameMatch> matches = new ArrayList<>();

        int i = 0;
        while (i < tokens.size()) {
            Token token = tokens.get(i);
            if (!token.isCapitalized() || !Character.isLetter(token.surface().charAt(0))) {
                i++;
                continue;
            }
            int groupEnd = i;
            while (groupEnd + 1 < tokens.size()
                && tokens.get(groupEnd + 1).isCapitalized()
                && onlyWhitespaceBetween(text, baseOffset, tokens.get(groupEnd), tokens.get(groupEnd + 1))) {
                groupEnd++;
            }

            Token previous = i > 0 ? tokens.get(i - 1) : null;
            NameMatch match = classify(text, baseOffset, tokens.subList(i, groupEnd + 1), previous);
            if (match != null) {
                matches.add(match);
            }
            i = groupEnd + 1;
        }
        return matches;
    }

    public boolean containsPersonNames(@NotNull String text) {
        return find(text, 0).stream().anyMatch(m -> PERSON.equals(m.label()) && m.confidence() >= 0.7);
    }

    public boolean containsLocationNames(@NotNull String text) {
        return find(text, 0).stream().anyMatch(m -> LOCATION.equals(m.label()));
    }

    private NameMatch classify(String text, int baseOffset, List<Token> group, Token previous) {
        Token first = group.get(0);
        Token last = group.get(group.size() - 1);
        boolean sentenceInitial = isSentenceInitial(text, first.start() - baseOffset);
        boolean firstName = group.stream().anyMatch(t -> lexicon.isFirstName(t.surface()));
        boolean surname = group.stream().anyMatch(t -> SURNAME.matcher(t.surface()).matches());

        String label;
        double confidence;
        if (firstName) {
            label = PERSON;
            confidence = 0.85;
        } else if (previous != null && lexicon.isToponymCue(previous) && adjacent(previous, first)) {
            label = LOCATION;
            confidence = 0.8;
        } else if (surname && !sentenceInitial) {
            label = PERSON;
            confidence = 0.75;
        } else if (sentenceInitial) {
            return null;
        } else if (previous != null && PLACE_PREPOSITIONS.contains(previous.lower())) {
            label = LOCATION;
            confidence = 0.65;
        } else {
            label = PERSON;
            confidence = 0.55;
        }
        if (group.size() > 1) {
            confidence = Math.min(0.95, confidence + 0.05);
        }
        String name = text.substring(first.start() - baseOffset, last.end() - baseOffset);
        return new NameMatch(name, label, first.start(), last.end(), confidence);
    }

    private static boolean adjacent(Token previous, Token next) {
        return next.start() - previous.end() <= 2;
    }

    private static boolean onlyWhitespaceBetween(String text, int baseOffset, Token left, Token right) {
        for (int p = left.end() - baseOffset; p < right.start() - baseOffset; p++) {
            if (!Character.isWhitespace(text.charAt(p))) {
                return false;
            }
        }
        return true;
    }

    private static boolean isSentenceInitial(String text, int position) {
        int p = position - 1;
        while (p >= 0 && Character.isWhitespace(text.charAt(p))) {
            p--;
        }
        return p < 0 || SENTENCE_BOUNDARIES.indexOf(text.charAt(p)) >= 0;
    }
}
