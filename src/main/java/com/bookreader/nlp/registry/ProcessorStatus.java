package com.bookreader.nlp.registry;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Startup state of one configured extractor.
 *
 * @param name    extractor name
 * @param enabled whether configuration enabled it
 * @param active  whether it loaded and is in the active set
 * @param weight  voting weight
 * @param error   load failure message, null when none
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProcessorStatus(String name, boolean enabled, boolean active, double weight, String error) {
}
