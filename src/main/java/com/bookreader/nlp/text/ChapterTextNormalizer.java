package com.bookreader.nlp.text;

/**
 * Cleans chapter text coming from the book parser before segmentation.
 * Blank lines are kept because they mark paragraph boundaries.
 */
public final class ChapterTextNormalizer {

    private ChapterTextNormalizer() {
    }

    public static String normalize(final String text) {
        if (text == null) {
            throw new IllegalArgumentException("Text cannot be null");
        }

        return text.replace("\r\n", "\n")
                   .replace('\r', '\n')
                   .replaceAll("<[^>]+>", "")
                   .replaceAll("(?m)^#{1,6}\\s+", "")
                   .replaceAll("_{2,}", "")
                   .replace('\u00A0', ' ')
                   .replaceAll("[ \\t\\x0B\\f]+", " ")
                   .replaceAll("(?m)^ +", "")
                   .replaceAll("(?m) +$", "")
                   .replaceAll("\\n{3,}", "\n\n")
                   .trim();
    }
}
