package com.bookreader.nlp.registry;

import com.bookreader.nlp.core.EngineSettings;
import com.bookreader.nlp.core.ProcessingMode;
import com.bookreader.nlp.core.ProcessorConfig;
import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ProcessorConfigLoaderTest {

    private static DescriptionEngineConfig config(Map<String, String> properties) {
        SmallRyeConfig config = new SmallRyeConfigBuilder()
            .withSources(new PropertiesConfigSource(properties, "test", 100))
            .withMapping(DescriptionEngineConfig.class)
            .build();
        return config.getConfigMapping(DescriptionEngineConfig.class);
    }

    @Test
    @DisplayName("defaults should match the built-in engine settings")
    void defaults() {
        EngineSettings settings = ProcessorConfigLoader.toSettings(config(Map.of()));

        assertEquals(EngineSettings.defaults(), settings);
    }

    @Test
    @DisplayName("built-in extractors should get their calibrated configs")
    void builtInConfigs() {
        Map<String, ProcessorConfig> configs = ProcessorConfigLoader.toProcessorConfigs(config(Map.of()));

        assertEquals(ProcessorConfigLoader.BUILT_IN_DEFAULTS, configs);
        assertFalse(configs.get("corenlp").enabled());
        assertEquals(1.2, configs.get("names").weight());
        assertEquals(40, configs.get("names").minDescriptionLength());
        assertEquals(8, configs.get("names").minWordCount());
    }

    @Test
    @DisplayName("multi-paragraph run limits should be read from properties")
    void boundaryLimits() {
        EngineSettings settings = ProcessorConfigLoader.toSettings(config(Map.of(
            "bookreader.nlp.boundary.lookahead", "5",
            "bookreader.nlp.boundary.min-chars", "300",
            "bookreader.nlp.boundary.max-chars", "2000")));

        assertEquals(new EngineSettings.Boundaries(true, 5, 300, 2000, 0.3), settings.boundaries());
    }

    @Test
    @DisplayName("properties should override single fields and add new extractors")
    void overrides() {
        Map<String, ProcessorConfig> configs = ProcessorConfigLoader.toProcessorConfigs(config(Map.of(
            "bookreader.nlp.processors.names.weight", "2.0",
            "bookreader.nlp.processors.corenlp.enabled", "true",
            "bookreader.nlp.processors.corenlp.model", "german",
            "bookreader.nlp.processors.custom.confidence-threshold", "0.7")));

        ProcessorConfig names = configs.get("names");
        assertEquals(2.0, names.weight());
        assertEquals(0.4, names.confidenceThreshold());
        assertTrue(configs.get("corenlp").enabled());
        assertEquals(Optional.of("german"), configs.get("corenlp").model());

        ProcessorConfig custom = configs.get("custom");
        assertEquals(0.7, custom.confidenceThreshold());
        assertEquals(ProcessorConfig.DEFAULT_MIN_WORDS, custom.minWordCount());
        assertEquals(4, configs.size());
    }

    @Test
    @DisplayName("an unknown mode should fall back to ensemble")
    void unknownMode() {
        EngineSettings settings = ProcessorConfigLoader.toSettings(config(Map.of("bookreader.nlp.mode", "turbo")));

        assertEquals(ProcessingMode.ENSEMBLE, settings.defaultMode());
    }

    @Test
    @DisplayName("a known mode is read case-insensitively")
    void knownMode() {
        EngineSettings settings = ProcessorConfigLoader.toSettings(config(Map.of("bookreader.nlp.mode", "Adaptive")));

        assertEquals(ProcessingMode.ADAPTIVE, settings.defaultMode());
    }

    @Test
    @DisplayName("weights that do not sum to one should be rejected")
    void badWeights() {
        DescriptionEngineConfig config = config(Map.of("bookreader.nlp.scoring.weight.lexical", "0.9"));

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> ProcessorConfigLoader.toSettings(config));
        assertTrue(e.getMessage().contains("must sum to 1.0"));
    }
}
