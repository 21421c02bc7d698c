package com.bookreader.nlp.registry;

import com.bookreader.nlp.core.ProcessorConfig;
import com.bookreader.nlp.extractor.DescriptionExtractor;
import com.bookreader.nlp.extractor.ExtractorCatalog;
import com.bookreader.nlp.extractor.ExtractorUnavailableException;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Owns the lifecycle of the configured extractors.
 *
 * <p>{@link #initialize(Map)} builds every enabled extractor through the catalog and loads it.
 * Failures are logged and the extractor is left out; the engine works with as few as one
 * active extractor. Active extractors are exposed in name order.</p>
 */
public class ProcessorRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(ProcessorRegistry.class);

    private final ExtractorCatalog catalog;
    private volatile Map<String, DescriptionExtractor> active = Map.of();
    private volatile Map<String, ProcessorConfig> configs = Map.of();
    private volatile List<ProcessorStatus> statuses = List.of();

    public ProcessorRegistry(@NotNull ExtractorCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
    }

    /**
     * Builds and loads enabled extractors.
     *
     * @param processorConfigs configs keyed by extractor name
     * @return this registry
     */
    @NotNull
    public synchronized ProcessorRegistry initialize(@NotNull Map<String, ProcessorConfig> processorConfigs) {
        Map<String, ProcessorConfig> sorted = new TreeMap<>(processorConfigs);
        Map<String, DescriptionExtractor> loaded = new LinkedHashMap<>();
        List<ProcessorStatus> report = new ArrayList<>();

        sorted.forEach((name, config) -> {
            if (!config.enabled()) {
                LOG.debug("Processor '{}' disabled by configuration", name);
                report.add(new ProcessorStatus(name, false, false, config.weight(), null));
                return;
            }
            Optional<DescriptionExtractor> created;
            try {
                created = catalog.create(name, config);
            } catch (RuntimeException e) {
                LOG.warn("Processor '{}' could not be constructed: {}", name, e.getMessage(), e);
                report.add(new ProcessorStatus(name, true, false, config.weight(), e.getMessage()));
                return;
            }
            if (created.isEmpty()) {
                LOG.warn("Processor '{}' is configured but no extractor is registered under that name. Known: {}",
                    name, catalog.names());
                report.add(new ProcessorStatus(name, true, false, config.weight(), "unknown extractor"));
                return;
            }
            DescriptionExtractor extractor = created.get();
            try {
                extractor.ensureLoaded();
                loaded.put(name, extractor);
                report.add(new ProcessorStatus(name, true, true, config.weight(), null));
            } catch (ExtractorUnavailableException e) {
                LOG.warn("Processor '{}' unavailable, leaving it out of the active set: {}", name, e.getMessage());
                report.add(new ProcessorStatus(name, true, false, config.weight(), e.getMessage()));
            }
        });

        this.configs = Collections.unmodifiableMap(sorted);
        this.active = Collections.unmodifiableMap(loaded);
        this.statuses = List.copyOf(report);
        LOG.info("Processor registry initialized: active={}, configured={}", loaded.keySet(), sorted.keySet());
        return this;
    }

    @NotNull
    public Map<String, DescriptionExtractor> getActiveProcessors() {
        return active;
    }

    @NotNull
    public Optional<ProcessorConfig> getProcessorConfig(@NotNull String name) {
        return Optional.ofNullable(configs.get(name));
    }

    @NotNull
    public Map<String, ProcessorConfig> getProcessorConfigs() {
        return configs;
    }

    @NotNull
    public List<ProcessorStatus> getStatus() {
        return statuses;
    }
}
