package com.bookreader.nlp.segment;

import com.bookreader.nlp.core.DescriptionType;
import com.bookreader.nlp.core.ParagraphType;
import com.bookreader.nlp.text.RussianLexicon;
import com.bookreader.nlp.text.Token;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Assigns a {@link ParagraphType} and a descriptiveness score to paragraph text.
 *
 * <p>Three signals in [0,1] compete: description (lexicon and adjective hits), narrative
 * (verbs of action) and dialogue (share of characters inside speech). Description and narrative
 * only count words outside speech.</p>
 */
@ApplicationScoped
public class ParagraphClassifier {

    static final double TIE_RATIO = 0.9;
    static final double MIXED_RATIO = 0.6;

    private static final Pattern QUOTED_SPEECH = Pattern.compile("[«\"“][^»\"”]+[»\"”]");
    private static final Pattern DASH_SPEECH = Pattern.compile("(?m)^\\s*[—–]\\s*\\S.*$");
    private static final double ACTION_SATURATION = 4.0;

    /**
     * Classification outcome with the underlying signals.
     */
    public record Classification(
        ParagraphType type,
        double descriptionSignal,
        double narrativeSignal,
        double dialogueSignal,
        double descriptivenessScore
    ) {
    }

    private final RussianLexicon lexicon;

    @Inject
    public ParagraphClassifier(RussianLexicon lexicon) {
        this.lexicon = lexicon;
    }

    /**
     * @param text       paragraph text
     * @param tokens     tokens of {@code text}
     * @param baseOffset chapter offset of {@code text}, used to relate token offsets to the text
     */
    @NotNull
    public Classification classify(@NotNull String text, @NotNull List<Token> tokens, int baseOffset) {
        boolean[] speech = speechMask(text);
        double dialogueSignal = text.isEmpty() ? 0.0 : (double) count(speech) / text.length();

        int narrationWords = 0;
        int narrationActions = 0;
        for (Token token : tokens) {
            int position = token.start() - baseOffset;
            if (position >= 0 && position < speech.length && speech[position]) {
                continue;
            }
            narrationWords++;
            if (lexicon.isAction(token)) {
                narrationActions++;
            }
        }

        double descriptiveness = descriptiveness(tokens);
        double descriptionSignal = narrationWords == 0 ? 0.0 : descriptiveness(narrationTokens(tokens, speech, baseOffset));
        double narrativeSignal = narrationWords == 0
            ? 0.0
            : Math.min(1.0, ACTION_SATURATION * narrationActions / narrationWords);

        ParagraphType type = decide(descriptionSignal, narrativeSignal, dialogueSignal);
        return new Classification(type, descriptionSignal, narrativeSignal, dialogueSignal, descriptiveness);
    }

    /**
     * Weighted sum of the lexicon hit rate and the adjective ratio, clamped to [0,1].
     */
    public double descriptiveness(@NotNull List<Token> tokens) {
        if (tokens.isEmpty()) {
            return 0.0;
        }
        int lexiconHits = 0;
        int adjectives = 0;
        for (Token token : tokens) {
            if (lexicon.isDescriptive(token) || isDescriptiveNoun(token)) {
                lexiconHits++;
            }
            if (lexicon.isAdjective(token)) {
                adjectives++;
            }
        }
        double lexiconRate = (double) lexiconHits / tokens.size();
        double adjectiveRatio = (double) adjectives / tokens.size();
        double score = 0.6 * Math.min(1.0, 2.0 * lexiconRate) + 0.4 * Math.min(1.0, 3.0 * adjectiveRatio);
        return Math.max(0.0, Math.min(1.0, score));
    }

    static ParagraphType decide(double description, double narrative, double dialogue) {
        double[] signals = {description, narrative, dialogue};
        ParagraphType[] types = {ParagraphType.DESCRIPTION, ParagraphType.NARRATIVE, ParagraphType.DIALOGUE};

        int top = 0;
        for (int i = 1; i < signals.length; i++) {
            if (signals[i] > signals[top]) {
                top = i;
            }
        }
        if (signals[top] <= 0.0) {
            return ParagraphType.NARRATIVE;
        }
        double runnerUp = 0.0;
        for (int i = 0; i < signals.length; i++) {
            if (i != top) {
                runnerUp = Math.max(runnerUp, signals[i]);
            }
        }

        if (runnerUp >= TIE_RATIO * signals[top]) {
            // signals are ordered by preference, the first one within the tie band wins
            for (int i = 0; i < signals.length; i++) {
                if (signals[i] >= TIE_RATIO * signals[top]) {
                    return types[i];
                }
            }
        }
        if (runnerUp >= MIXED_RATIO * signals[top]) {
            return ParagraphType.MIXED;
        }
        return types[top];
    }

    private boolean isDescriptiveNoun(Token token) {
        return lexicon.typeOf(token)
            .filter(type -> type != DescriptionType.ACTION)
            .isPresent();
    }

    private static List<Token> narrationTokens(List<Token> tokens, boolean[] speech, int baseOffset) {
        return tokens.stream()
            .filter(t -> {
                int position = t.start() - baseOffset;
                return position < 0 || position >= speech.length || !speech[position];
            })
            .toList();
    }

    private static boolean[] speechMask(String text) {
        boolean[] mask = new boolean[text.length()];
        mark(mask, DASH_SPEECH.matcher(text));
        mark(mask, QUOTED_SPEECH.matcher(text));
        return mask;
    }

    private static void mark(boolean[] mask, Matcher matcher) {
        while (matcher.find()) {
            for (int i = matcher.start(); i < matcher.end(); i++) {
                mask[i] = true;
            }
        }
    }

    private static int count(boolean[] mask) {
        int n = 0;
        for (boolean b : mask) {
            if (b) {
                n++;
            }
        }
        return n;
    }
}
