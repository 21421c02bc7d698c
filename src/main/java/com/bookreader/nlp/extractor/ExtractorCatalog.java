package com.bookreader.nlp.extractor;

import com.bookreader.nlp.core.ProcessorConfig;
import com.bookreader.nlp.text.ProperNameFinder;
import com.bookreader.nlp.text.RussianLexicon;
import com.bookreader.nlp.text.RussianTextAnalyzer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jetbrains.annotations.NotNull;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of named extractor constructors.
 *
 * <p>The set of backends is open: new adapters are added with {@link #register}.</p>
 */
@ApplicationScoped
public class ExtractorCatalog {

    private final Map<String, ExtractorConstructor> constructors = new ConcurrentHashMap<>();

    /**
     * Creates an empty catalog.
     */
    public ExtractorCatalog() {
    }

    @Inject
    public ExtractorCatalog(RussianTextAnalyzer analyzer, RussianLexicon lexicon, ProperNameFinder nameFinder) {
        register(LexiconDescriptionExtractor.NAME,
            config -> new LexiconDescriptionExtractor(config, analyzer, lexicon));
        register(ProperNameDescriptionExtractor.NAME,
            config -> new ProperNameDescriptionExtractor(config, analyzer, lexicon, nameFinder));
        register(CoreNlpDescriptionExtractor.NAME, CoreNlpDescriptionExtractor::new);
    }

    public ExtractorCatalog register(@NotNull String name, @NotNull ExtractorConstructor constructor) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(constructor, "constructor must not be null");
        constructors.put(name, constructor);
        return this;
    }

    @NotNull
    public Optional<DescriptionExtractor> create(@NotNull String name, @NotNull ProcessorConfig config) {
        ExtractorConstructor constructor = constructors.get(name);
        return constructor == null ? Optional.empty() : Optional.of(constructor.create(config));
    }

    public boolean contains(@NotNull String name) {
        return constructors.containsKey(name);
    }

    @NotNull
    public Set<String> names() {
        return new TreeSet<>(constructors.keySet());
    }
}
