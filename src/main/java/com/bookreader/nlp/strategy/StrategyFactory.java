package com.bookreader.nlp.strategy;

import com.bookreader.nlp.core.ProcessingMode;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * One cached strategy instance per processing mode.
 */
public final class StrategyFactory {

    private final Map<ProcessingMode, ProcessingStrategy> strategies;

    public StrategyFactory() {
        Map<ProcessingMode, ProcessingStrategy> byMode = new EnumMap<>(ProcessingMode.class);
        register(byMode, new SingleStrategy());
        register(byMode, new ParallelStrategy());
        register(byMode, new SequentialStrategy());
        register(byMode, new EnsembleStrategy());
        register(byMode, new AdaptiveStrategy());
        this.strategies = Collections.unmodifiableMap(byMode);
    }

    @NotNull
    public ProcessingStrategy get(@NotNull ProcessingMode mode) {
        ProcessingStrategy strategy = strategies.get(mode);
        if (strategy == null) {
            throw new IllegalArgumentException("No strategy registered for mode " + mode);
        }
        return strategy;
    }

    private static void register(Map<ProcessingMode, ProcessingStrategy> byMode, ProcessingStrategy strategy) {
        byMode.put(strategy.getMode(), strategy);
    }
}
