package com.bookreader.nlp.text;

/**
 * A sentence with chapter offsets.
 */
public record Sentence(String text, int start, int end) {
}
