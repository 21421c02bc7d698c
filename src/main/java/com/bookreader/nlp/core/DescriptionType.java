package com.bookreader.nlp.core;

import org.jetbrains.annotations.NotNull;

import java.util.Locale;
import java.util.Optional;

/**
 * Category of a description candidate.
 *
 * <p>Declaration order is the illustration priority used as a tie-break:
 * LOCATION &gt; CHARACTER &gt; ATMOSPHERE &gt; OBJECT &gt; ACTION.</p>
 */
public enum DescriptionType {

    LOCATION(1.0, 75),
    CHARACTER(0.9, 60),
    ATMOSPHERE(0.7, 45),
    OBJECT(0.6, 40),
    ACTION(0.4, 30);

    private final double typePriority;
    private final int basePriority;

    DescriptionType(double typePriority, int basePriority) {
        this.typePriority = typePriority;
        this.basePriority = basePriority;
    }

    /**
     * Static type-priority signal in [0,1] fed into the confidence breakdown.
     */
    public double typePriority() {
        return typePriority;
    }

    /**
     * Legacy 0-100 base priority used for image-generation budgeting.
     */
    public int basePriority() {
        return basePriority;
    }

    /**
     * Rank for tie-breaking; lower is more valuable.
     */
    public int rank() {
        return ordinal();
    }

    @NotNull
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @NotNull
    public static Optional<DescriptionType> fromString(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
