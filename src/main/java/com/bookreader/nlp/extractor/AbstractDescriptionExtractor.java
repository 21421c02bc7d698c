package com.bookreader.nlp.extractor;

import com.bookreader.nlp.core.DescriptionType;
import com.bookreader.nlp.core.EntityTag;
import com.bookreader.nlp.core.Paragraph;
import com.bookreader.nlp.core.ProcessorConfig;
import com.bookreader.nlp.core.RawDescription;
import com.bookreader.nlp.core.TextSpan;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Base class for extractors: memoized two-phase loading and processor-config filtering.
 *
 * <p>Subclasses implement {@link #loadBackend()} and {@link #propose(Paragraph)}; this class
 * applies length, word-count and confidence thresholds to whatever they propose.</p>
 */
public abstract class AbstractDescriptionExtractor implements DescriptionExtractor {

    protected static final Logger logger = LoggerFactory.getLogger(AbstractDescriptionExtractor.class);

    private final String name;
    private final ProcessorConfig config;
    private final Object loadLock = new Object();
    private volatile boolean loaded;
    private volatile RuntimeException loadFailure;

    protected AbstractDescriptionExtractor(@NotNull String name, @NotNull ProcessorConfig config) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /**
     * Loads models or other expensive state. Called at most once.
     */
    protected abstract void loadBackend() throws Exception;

    /**
     * Proposes unfiltered candidates for a paragraph.
     */
    @NotNull
    protected abstract List<RawDescription> propose(@NotNull Paragraph paragraph);

    @Override
    @NotNull
    public String getName() {
        return name;
    }

    @Override
    @NotNull
    public ProcessorConfig getConfig() {
        return config;
    }

    @Override
    public final void ensureLoaded() {
        if (loaded) {
            return;
        }
        synchronized (loadLock) {
            if (loaded) {
                return;
            }
            if (loadFailure != null) {
                throw loadFailure;
            }
            long start = System.currentTimeMillis();
            try {
                loadBackend();
                loaded = true;
                logger.info("Extractor '{}' loaded in {}ms", name, System.currentTimeMillis() - start);
            } catch (Exception | LinkageError e) {
                loadFailure = new ExtractorUnavailableException(name, String.valueOf(e.getMessage()), e);
                throw loadFailure;
            }
        }
    }

    @Override
    public boolean isLoaded() {
        return loaded;
    }

    @Override
    @NotNull
    public Optional<String> getLoadError() {
        RuntimeException failure = loadFailure;
        return failure == null ? Optional.empty() : Optional.of(failure.getMessage());
    }

    @Override
    @NotNull
    public final List<RawDescription> extract(@NotNull Paragraph paragraph) {
        Objects.requireNonNull(paragraph, "paragraph must not be null");
        ensureLoaded();
        List<RawDescription> proposed = propose(paragraph);
        List<RawDescription> accepted = new ArrayList<>(proposed.size());
        for (RawDescription candidate : proposed) {
            if (accepts(candidate)) {
                accepted.add(candidate);
            }
        }
        if (logger.isTraceEnabled()) {
            logger.trace("Extractor '{}' paragraph {}: proposed={}, accepted={}",
                name, paragraph.index(), proposed.size(), accepted.size());
        }
        return accepted;
    }

    /**
     * Applies the processor thresholds.
     */
    protected boolean accepts(RawDescription candidate) {
        int length = candidate.text().length();
        return length >= config.minDescriptionLength()
            && length <= config.maxDescriptionLength()
            && candidate.wordCount() >= config.minWordCount()
            && candidate.processorConfidence() >= config.confidenceThreshold();
    }

    /**
     * Joins consecutive candidates of the same type that are separated only by whitespace
     * in the paragraph text. The joined candidate keeps the highest confidence.
     */
    @NotNull
    protected List<RawDescription> joinAdjacent(@NotNull List<RawDescription> candidates, @NotNull Paragraph paragraph) {
        List<RawDescription> joined = new ArrayList<>();
        for (RawDescription candidate : candidates) {
            if (!joined.isEmpty()) {
                RawDescription last = joined.get(joined.size() - 1);
                if (last.descriptionType() == candidate.descriptionType()
                    && whitespaceBetween(paragraph, last.span().end(), candidate.span().start())) {
                    joined.set(joined.size() - 1, join(last, candidate, paragraph));
                    continue;
                }
            }
            joined.add(candidate);
        }
        return joined;
    }

    protected RawDescription candidate(
        Paragraph paragraph,
        String text,
        int start,
        int end,
        DescriptionType type,
        List<EntityTag> tags,
        double confidence
    ) {
        return new RawDescription(
            text,
            new TextSpan(start, end),
            type,
            tags,
            name,
            clamp(confidence),
            paragraph.index(),
            paragraph.descriptivenessScore()
        );
    }

    protected static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    private RawDescription join(RawDescription left, RawDescription right, Paragraph paragraph) {
        int start = left.span().start();
        int end = right.span().end();
        String text = paragraph.text().substring(start - paragraph.startOffset(), end - paragraph.startOffset());
        List<EntityTag> tags = new ArrayList<>(left.entityTags());
        tags.addAll(right.entityTags());
        return candidate(paragraph, text, start, end, left.descriptionType(), tags,
            Math.max(left.processorConfidence(), right.processorConfidence()));
    }

    private static boolean whitespaceBetween(Paragraph paragraph, int from, int to) {
        if (to < from) {
            return false;
        }
        String text = paragraph.text();
        for (int p = from - paragraph.startOffset(); p < to - paragraph.startOffset(); p++) {
            if (!Character.isWhitespace(text.charAt(p))) {
                return false;
            }
        }
        return true;
    }
}
