package com.bookreader.nlp.enrich;

import com.bookreader.nlp.core.CancellationToken;
import com.bookreader.nlp.core.CompleteDescription;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Enriches candidates at or above the score gate, one at a time.
 *
 * <p>A failure on one candidate is logged and leaves that candidate's metadata empty; the rest
 * of the batch goes on. Order and scores are never changed.</p>
 */
public class EnrichmentStage {

    private static final Logger LOG = LoggerFactory.getLogger(EnrichmentStage.class);

    private final Optional<DescriptionEnricher> enricher;
    private final double scoreGate;

    public EnrichmentStage(@NotNull Optional<DescriptionEnricher> enricher, double scoreGate) {
        this.enricher = enricher;
        this.scoreGate = scoreGate;
    }

    @NotNull
    public List<CompleteDescription> apply(
        @NotNull List<CompleteDescription> descriptions,
        @NotNull CancellationToken token
    ) {
        if (enricher.isEmpty() || descriptions.isEmpty()) {
            return descriptions;
        }
        DescriptionEnricher active = enricher.get();
        List<CompleteDescription> result = new ArrayList<>(descriptions.size());
        int enriched = 0;
        int failed = 0;
        for (CompleteDescription description : descriptions) {
            token.throwIfCancelled();
            if (description.overallScore() < scoreGate) {
                result.add(description);
                continue;
            }
            try {
                Map<String, Object> metadata = active.enrich(description);
                result.add(description.withEnrichment(metadata));
                enriched++;
            } catch (EnrichmentException e) {
                failed++;
                LOG.warn("Enrichment failed for {} description at offset {}: {}",
                    description.descriptionType(), description.chapterOffset(), e.getMessage());
                result.add(description);
            } catch (RuntimeException e) {
                failed++;
                LOG.warn("Enricher '{}' threw unexpectedly for offset {}",
                    active.getName(), description.chapterOffset(), e);
                result.add(description);
            }
        }
        LOG.debug("Enrichment done: enriched={}, failed={}, gate={}", enriched, failed, scoreGate);
        return result;
    }
}
