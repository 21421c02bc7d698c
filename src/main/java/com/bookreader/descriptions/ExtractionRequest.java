package com.bookreader.descriptions;

import com.bookreader.exception.InvalidExtractionRequestException;
import com.bookreader.nlp.core.ProcessingMode;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

/**
 * Body of {@code POST /descriptions/extract}.
 *
 * @param chapterId optional caller identifier, echoed back
 * @param text      chapter text
 * @param processor extractor for single mode
 * @param mode      processing mode name; configured default when absent
 * @param illustrationBudget when set, keep only this many non-overlapping candidates, best first
 */
public record ExtractionRequest(
    @Size(max = 128, message = "chapterId must be at most 128 characters")
    String chapterId,

    @NotNull(message = "text is required")
    @Size(max = 2_000_000, message = "text must be at most 2000000 characters")
    String text,

    String processor,

    String mode,

    @Positive(message = "illustrationBudget must be positive")
    Integer illustrationBudget
) {

    /**
     * Parses {@link #mode()}.
     *
     * @return the mode, or {@code null} when not given
     * @throws InvalidExtractionRequestException if the name is not a known mode
     */
    public ProcessingMode getProcessingMode() {
        if (mode == null || mode.isBlank()) {
            return null;
        }
        ProcessingMode parsed = ProcessingMode.fromString(mode, null);
        if (parsed == null) {
            throw new InvalidExtractionRequestException("mode", "unknown processing mode '" + mode + "'");
        }
        return parsed;
    }
}
