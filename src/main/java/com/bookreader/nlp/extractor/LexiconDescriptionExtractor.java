package com.bookreader.nlp.extractor;

import com.bookreader.nlp.core.DescriptionType;
import com.bookreader.nlp.core.EntityTag;
import com.bookreader.nlp.core.Paragraph;
import com.bookreader.nlp.core.ProcessorConfig;
import com.bookreader.nlp.core.RawDescription;
import com.bookreader.nlp.text.RussianLexicon;
import com.bookreader.nlp.text.RussianTextAnalyzer;
import com.bookreader.nlp.text.Sentence;
import com.bookreader.nlp.text.SentenceSplitter;
import com.bookreader.nlp.text.Token;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Gazetteer extractor: types sentences by stemmed lexicon hits.
 *
 * <p>A sentence becomes a candidate when it contains at least one typed gazetteer word; its type
 * is the most frequent hinted type, ties resolved by illustration priority. Action-only sentences
 * are proposed as ACTION with a reduced base confidence. Phrase patterns found by the segmenter
 * inside the sentence raise its confidence by up to {@value #PHRASE_BONUS}.</p>
 */
public class LexiconDescriptionExtractor extends AbstractDescriptionExtractor {

    public static final String NAME = "lexicon";

    private static final double BASE_CONFIDENCE = 0.4;
    private static final double ACTION_BASE_CONFIDENCE = 0.25;
    static final double PHRASE_BONUS = 0.1;

    private final RussianTextAnalyzer analyzer;
    private final RussianLexicon lexicon;

    public LexiconDescriptionExtractor(
        @NotNull ProcessorConfig config,
        @NotNull RussianTextAnalyzer analyzer,
        @NotNull RussianLexicon lexicon
    ) {
        super(NAME, config);
        this.analyzer = analyzer;
        this.lexicon = lexicon;
    }

    @Override
    protected void loadBackend() {
        // warm up the Snowball stemmer so the first paragraph does not pay for it
        analyzer.tokenize("Высокий темный замок.", 0);
    }

    @Override
    @NotNull
    protected List<RawDescription> propose(@NotNull Paragraph paragraph) {
        List<RawDescription> candidates = new ArrayList<>();
        for (Sentence sentence : SentenceSplitter.split(paragraph.text(), paragraph.startOffset())) {
            analyze(paragraph, sentence).ifPresent(candidates::add);
        }
        return joinAdjacent(candidates, paragraph);
    }

    private Optional<RawDescription> analyze(Paragraph paragraph, Sentence sentence) {
        List<Token> tokens = analyzer.tokenize(sentence.text(), sentence.start());
        if (tokens.isEmpty()) {
            return Optional.empty();
        }

        Map<DescriptionType, Integer> hits = new EnumMap<>(DescriptionType.class);
        List<EntityTag> tags = new ArrayList<>();
        int descriptive = 0;
        for (Token token : tokens) {
            Optional<DescriptionType> type = lexicon.typeOf(token);
            if (type.isPresent()) {
                hits.merge(type.get(), 1, Integer::sum);
                tags.add(new EntityTag(token.surface(), "LEX_" + type.get().name(), token.start(), token.end()));
            }
            if (lexicon.isDescriptive(token)) {
                descriptive++;
            }
        }
        if (hits.isEmpty()) {
            return Optional.empty();
        }

        DescriptionType type = dominantType(hits);
        int typedHits = hits.get(type);
        double descriptiveRate = (double) descriptive / tokens.size();
        double base = type == DescriptionType.ACTION ? ACTION_BASE_CONFIDENCE : BASE_CONFIDENCE;
        double confidence = base
            + 0.3 * Math.min(1.0, typedHits / 3.0)
            + 0.3 * Math.min(1.0, descriptiveRate * 3.0)
            + PHRASE_BONUS * Math.min(1.0, phraseHits(paragraph, sentence) / 2.0);

        return Optional.of(candidate(paragraph, sentence.text(), sentence.start(), sentence.end(),
            type, tags, confidence));
    }

    private static int phraseHits(Paragraph paragraph, Sentence sentence) {
        int hits = 0;
        for (List<String> phrases : paragraph.extractedPhrases().values()) {
            for (String phrase : phrases) {
                if (sentence.text().contains(phrase)) {
                    hits++;
                }
            }
        }
        return hits;
    }

    /**
     * Most frequent non-action type; ACTION only when nothing else was hit.
     */
    static DescriptionType dominantType(Map<DescriptionType, Integer> hits) {
        DescriptionType best = null;
        int bestCount = 0;
        for (DescriptionType type : DescriptionType.values()) {
            if (type == DescriptionType.ACTION) {
                continue;
            }
            int count = hits.getOrDefault(type, 0);
            if (count > bestCount) {
                best = type;
                bestCount = count;
            }
        }
        return best != null ? best : DescriptionType.ACTION;
    }
}
