package com.bookreader.nlp.strategy;

import com.bookreader.nlp.core.CancellationToken;
import com.bookreader.nlp.core.Paragraph;
import com.bookreader.nlp.core.ParagraphType;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Input of one strategy run.
 *
 * @param chapterId          caller's chapter identifier, used for logging only
 * @param text               normalized chapter text
 * @param paragraphs         segmented paragraphs, all types
 * @param requestedProcessor extractor explicitly asked for by the caller
 * @param processors         subset of active extractors to involve; empty means all
 * @param token              caller's cancellation signal
 */
public record ExtractionJob(
    String chapterId,
    String text,
    List<Paragraph> paragraphs,
    Optional<String> requestedProcessor,
    List<String> processors,
    CancellationToken token
) {

    public ExtractionJob {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(token, "token must not be null");
        paragraphs = List.copyOf(paragraphs);
        requestedProcessor = requestedProcessor == null ? Optional.empty() : requestedProcessor;
        processors = processors == null ? List.of() : List.copyOf(processors);
    }

    /**
     * Paragraphs worth sending to extractors: everything except pure dialogue.
     */
    public List<Paragraph> eligibleParagraphs() {
        return paragraphs.stream()
            .filter(p -> p.type() != ParagraphType.DIALOGUE)
            .toList();
    }

    public ExtractionJob withProcessors(List<String> subset) {
        return new ExtractionJob(chapterId, text, paragraphs, requestedProcessor, subset, token);
    }
}
