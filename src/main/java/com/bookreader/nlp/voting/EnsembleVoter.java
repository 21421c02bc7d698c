package com.bookreader.nlp.voting;

import com.bookreader.nlp.core.CompleteDescription;
import com.bookreader.nlp.core.DescriptionGroup;
import com.bookreader.nlp.core.EngineSettings;
import com.bookreader.nlp.core.ProcessorConfig;
import com.bookreader.nlp.core.RawDescription;
import com.bookreader.nlp.scoring.ConfidenceScorer;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Weighted consensus across extractors.
 *
 * <p>A group is accepted when either</p>
 * <ul>
 *   <li>its strongest member's confidence times that extractor's weight exceeds the acceptance floor, or</li>
 *   <li>the share of active extractors that proposed it reaches the voting threshold.</li>
 * </ul>
 * <p>Every extractor that was asked counts as active, including ones that timed out or returned
 * nothing. With a single active extractor every group has full consensus.</p>
 */
public class EnsembleVoter {

    private static final Logger LOG = LoggerFactory.getLogger(EnsembleVoter.class);

    private final DescriptionMerger merger;
    private final ConfidenceScorer scorer;
    private final EngineSettings.Ensemble settings;

    public EnsembleVoter(
        @NotNull DescriptionMerger merger,
        @NotNull ConfidenceScorer scorer,
        @NotNull EngineSettings.Ensemble settings
    ) {
        this.merger = Objects.requireNonNull(merger, "merger must not be null");
        this.scorer = Objects.requireNonNull(scorer, "scorer must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    /**
     * @param perProcessor raw output keyed by extractor name, one entry per active extractor
     * @param configs      extractor configs, for weights
     */
    @NotNull
    public VoteOutcome vote(
        @NotNull Map<String, List<RawDescription>> perProcessor,
        @NotNull Map<String, ProcessorConfig> configs
    ) {
        int active = perProcessor.size();
        if (active == 0) {
            return new VoteOutcome(List.of(), 0, 0);
        }

        List<RawDescription> all = perProcessor.values().stream()
            .flatMap(List::stream)
            .toList();
        List<DescriptionGroup> groups = merger.group(all);

        List<CompleteDescription> accepted = new ArrayList<>();
        int rejected = 0;
        for (DescriptionGroup group : groups) {
            double consensus = (double) group.processors().size() / active;
            if (accepts(group, consensus, configs)) {
                accepted.add(scorer.score(group, consensus));
            } else {
                rejected++;
                LOG.trace("Group rejected by vote: type={}, processors={}, consensus={}",
                    group.type(), group.processors(), consensus);
            }
        }

        LOG.debug("Ensemble vote: active={}, groups={}, accepted={}, rejected={}",
            active, groups.size(), accepted.size(), rejected);
        return new VoteOutcome(accepted, rejected, active);
    }

    boolean accepts(DescriptionGroup group, double consensus, Map<String, ProcessorConfig> configs) {
        RawDescription strongest = group.strongest();
        double weight = weightOf(strongest.sourceProcessor(), configs);
        if (strongest.processorConfidence() * weight > settings.acceptanceFloor()) {
            return true;
        }
        return consensus >= settings.votingThreshold();
    }

    private static double weightOf(String processor, Map<String, ProcessorConfig> configs) {
        ProcessorConfig config = configs.get(processor);
        return config == null ? ProcessorConfig.DEFAULT_WEIGHT : config.weight();
    }
}
