package com.bookreader.nlp.text;

/**
 * A word token with its original surface form, lowercase form, Snowball stem and offsets.
 */
public record Token(String surface, String lower, String stem, int start, int end) {

    public boolean isCapitalized() {
        return !surface.isEmpty() && Character.isUpperCase(surface.charAt(0));
    }

    public int length() {
        return end - start;
    }
}
