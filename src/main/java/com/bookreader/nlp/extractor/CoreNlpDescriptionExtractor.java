package com.bookreader.nlp.extractor;

import com.bookreader.nlp.core.DescriptionType;
import com.bookreader.nlp.core.EntityTag;
import com.bookreader.nlp.core.Paragraph;
import com.bookreader.nlp.core.ProcessorConfig;
import com.bookreader.nlp.core.RawDescription;
import edu.stanford.nlp.pipeline.CoreDocument;
import edu.stanford.nlp.pipeline.CoreEntityMention;
import edu.stanford.nlp.pipeline.CoreSentence;
import edu.stanford.nlp.pipeline.StanfordCoreNLP;
import edu.stanford.nlp.util.Pair;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

/**
 * Stanford CoreNLP named-entity extractor.
 *
 * <p>The pipeline is built lazily on first use. CoreNLP models are not bundled; when they are
 * missing from the classpath, loading fails and the registry leaves this extractor out.
 * The {@code model} setting names a CoreNLP language ({@code english}, {@code german}, ...) or a
 * properties file on the classpath.</p>
 */
public class CoreNlpDescriptionExtractor extends AbstractDescriptionExtractor {

    public static final String NAME = "corenlp";

    private static final String ANNOTATORS = "tokenize,ssplit,pos,lemma,ner";
    private static final double DEFAULT_MENTION_CONFIDENCE = 0.7;

    private volatile StanfordCoreNLP pipeline;

    public CoreNlpDescriptionExtractor(@NotNull ProcessorConfig config) {
        super(NAME, config);
    }

    @Override
    protected void loadBackend() {
        Properties props = new Properties();
        getConfig().model().ifPresent(model -> {
            if (model.endsWith(".properties")) {
                props.setProperty("props", model);
            } else {
                props.setProperty("tokenize.language", model);
            }
        });
        props.setProperty("annotators", ANNOTATORS);
        props.setProperty("ner.applyFineGrained", "false");
        props.setProperty("ner.useSUTime", "false");
        props.setProperty("ner.applyNumericClassifiers", "false");
        props.setProperty("threads", "1");
        logger.debug("Creating CoreNLP pipeline with annotators {}", ANNOTATORS);
        pipeline = new StanfordCoreNLP(props);
    }

    @Override
    @NotNull
    protected List<RawDescription> propose(@NotNull Paragraph paragraph) {
        CoreDocument document = new CoreDocument(paragraph.text());
        pipeline.annotate(document);

        List<RawDescription> candidates = new ArrayList<>();
        for (CoreSentence sentence : document.sentences()) {
            Map<DescriptionType, Integer> votes = new EnumMap<>(DescriptionType.class);
            List<EntityTag> tags = new ArrayList<>();
            double confidence = 0.0;

            for (CoreEntityMention mention : sentence.entityMentions()) {
                Optional<DescriptionType> type = EntityTypeMapper.resolve(mention.entityType(), mention.text());
                if (type.isEmpty()) {
                    continue;
                }
                votes.merge(type.get(), 1, Integer::sum);
                Pair<Integer, Integer> offsets = mention.charOffsets();
                tags.add(new EntityTag(mention.text(), mention.entityType(),
                    paragraph.startOffset() + offsets.first(), paragraph.startOffset() + offsets.second()));
                confidence = Math.max(confidence, mentionConfidence(mention));
            }
            if (votes.isEmpty()) {
                continue;
            }

            Pair<Integer, Integer> span = sentence.charOffsets();
            candidates.add(candidate(
                paragraph,
                sentence.text(),
                paragraph.startOffset() + span.first(),
                paragraph.startOffset() + span.second(),
                LexiconDescriptionExtractor.dominantType(votes),
                tags,
                confidence
            ));
        }
        return joinAdjacent(candidates, paragraph);
    }

    private static double mentionConfidence(CoreEntityMention mention) {
        Map<String, Double> confidences = mention.entityTypeConfidences();
        if (confidences == null || confidences.isEmpty()) {
            return DEFAULT_MENTION_CONFIDENCE;
        }
        return confidences.values().stream()
            .mapToDouble(Double::doubleValue)
            .max()
            .orElse(DEFAULT_MENTION_CONFIDENCE);
    }
}
