package com.bookreader.nlp.segment;

import com.bookreader.nlp.core.PhraseKind;
import com.bookreader.nlp.text.RussianLexicon;
import com.bookreader.nlp.text.RussianTextAnalyzer;
import com.bookreader.nlp.text.Token;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Phrase extractor working on adjacent tokens within a clause.
 *
 * <p>Patterns: adjective+noun, adjective+adjective+noun and noun+preposition+(adjective)+noun.
 * Tokens separated by anything but whitespace do not form a phrase.</p>
 */
@ApplicationScoped
public class PatternPhraseExtractor implements PhraseExtractor {

    private final RussianTextAnalyzer analyzer;
    private final RussianLexicon lexicon;

    @Inject
    public PatternPhraseExtractor(RussianTextAnalyzer analyzer, RussianLexicon lexicon) {
        this.analyzer = analyzer;
        this.lexicon = lexicon;
    }

    @Override
    @NotNull
    public Map<PhraseKind, List<String>> extract(@NotNull String text) {
        List<Token> tokens = analyzer.tokenize(text, 0);
        Map<PhraseKind, Set<String>> found = new EnumMap<>(PhraseKind.class);
        for (PhraseKind kind : PhraseKind.values()) {
            found.put(kind, new LinkedHashSet<>());
        }

        for (int i = 0; i < tokens.size(); i++) {
            Token current = tokens.get(i);
            Token next = at(tokens, i + 1);
            Token third = at(tokens, i + 2);
            Token fourth = at(tokens, i + 3);

            if (lexicon.isAdjective(current) && joined(text, current, next)) {
                if (lexicon.isNoun(next)) {
                    found.get(PhraseKind.ADJ_NOUN).add(phrase(text, current, next));
                } else if (lexicon.isAdjective(next) && joined(text, next, third) && lexicon.isNoun(third)) {
                    found.get(PhraseKind.ADJ_ADJ_NOUN).add(phrase(text, current, third));
                }
            }

            if (isContentNoun(current) && joined(text, current, next) && lexicon.isPreposition(next)
                && joined(text, next, third)) {
                if (isContentNoun(third)) {
                    found.get(PhraseKind.NOUN_PREP_NOUN).add(phrase(text, current, third));
                } else if (lexicon.isAdjective(third) && joined(text, third, fourth) && isContentNoun(fourth)) {
                    found.get(PhraseKind.NOUN_PREP_NOUN).add(phrase(text, current, fourth));
                }
            }
        }

        Map<PhraseKind, List<String>> result = new EnumMap<>(PhraseKind.class);
        found.forEach((kind, phrases) -> {
            if (!phrases.isEmpty()) {
                result.put(kind, phrases.stream().limit(kind.limit()).toList());
            }
        });
        return Collections.unmodifiableMap(result);
    }

    @Override
    @NotNull
    public String getName() {
        return "pattern";
    }

    private boolean isContentNoun(Token token) {
        return token != null && lexicon.isNoun(token) && !token.isCapitalized();
    }

    private static Token at(List<Token> tokens, int index) {
        return index < tokens.size() ? tokens.get(index) : null;
    }

    private static boolean joined(String text, Token left, Token right) {
        if (left == null || right == null) {
            return false;
        }
        for (int p = left.end(); p < right.start(); p++) {
            if (!Character.isWhitespace(text.charAt(p))) {
                return false;
            }
        }
        return true;
    }

    private static String phrase(String text, Token first, Token last) {
        return text.substring(first.start(), last.end());
    }
}
