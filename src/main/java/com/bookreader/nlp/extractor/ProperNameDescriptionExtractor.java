package com.bookreader.nlp.extractor;

import com.bookreader.nlp.core.DescriptionType;
import com.bookreader.nlp.core.EntityTag;
import com.bookreader.nlp.core.Paragraph;
import com.bookreader.nlp.core.ProcessorConfig;
import com.bookreader.nlp.core.RawDescription;
import com.bookreader.nlp.text.ProperNameFinder;
import com.bookreader.nlp.text.ProperNameFinder.NameMatch;
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

/**
 * Named-entity extractor for Russian prose built on {@link ProperNameFinder}.
 *
 * <p>Sentences mentioning people become CHARACTER candidates and sentences mentioning places
 * become LOCATION candidates. Confidence combines the best name confidence with the sentence's
 * descriptive density and length.</p>
 */
public class ProperNameDescriptionExtractor extends AbstractDescriptionExtractor {

    public static final String NAME = "names";

    private static final int FULL_SENTENCE_WORDS = 8;

    private final RussianTextAnalyzer analyzer;
    private final RussianLexicon lexicon;
    private final ProperNameFinder nameFinder;

    public ProperNameDescriptionExtractor(
        @NotNull ProcessorConfig config,
        @NotNull RussianTextAnalyzer analyzer,
        @NotNull RussianLexicon lexicon,
        @NotNull ProperNameFinder nameFinder
    ) {
        super(NAME, config);
        this.analyzer = analyzer;
        this.lexicon = lexicon;
        this.nameFinder = nameFinder;
    }

    @Override
    protected void loadBackend() {
        nameFinder.find("Иван Петров приехал в город Тверь.", 0);
    }

    @Override
    @NotNull
    protected List<RawDescription> propose(@NotNull Paragraph paragraph) {
        List<RawDescription> candidates = new ArrayList<>();
        for (Sentence sentence : SentenceSplitter.split(paragraph.text(), paragraph.startOffset())) {
            List<NameMatch> names = nameFinder.find(sentence.text(), sentence.start());
            if (names.isEmpty()) {
                continue;
            }

            Map<DescriptionType, Integer> votes = new EnumMap<>(DescriptionType.class);
            List<EntityTag> tags = new ArrayList<>();
            double bestName = 0.0;
            for (NameMatch name : names) {
                EntityTypeMapper.fromLabel(name.label())
                    .ifPresent(type -> votes.merge(type, 1, Integer::sum));
                tags.add(new EntityTag(name.text(), name.label(), name.start(), name.end()));
                bestName = Math.max(bestName, name.confidence());
            }
            if (votes.isEmpty()) {
                continue;
            }
            int places = votes.getOrDefault(DescriptionType.LOCATION, 0);
            DescriptionType type = places > 0 && places >= votes.getOrDefault(DescriptionType.CHARACTER, 0)
                ? DescriptionType.LOCATION
                : DescriptionType.CHARACTER;

            candidates.add(candidate(paragraph, sentence.text(), sentence.start(), sentence.end(),
                type, tags, confidence(sentence, bestName)));
        }
        return joinAdjacent(candidates, paragraph);
    }

    private double confidence(Sentence sentence, double bestName) {
        List<Token> tokens = analyzer.tokenize(sentence.text(), sentence.start());
        long descriptive = tokens.stream().filter(lexicon::isDescriptive).count();
        double descriptiveFactor = Math.min(1.0, descriptive / 3.0);
        double lengthFactor = Math.min(1.0, (double) tokens.size() / FULL_SENTENCE_WORDS);
        return 0.5 * bestName + 0.3 * descriptiveFactor + 0.2 * lengthFactor;
    }
}
