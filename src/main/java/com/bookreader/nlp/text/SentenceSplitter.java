package com.bookreader.nlp.text;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class SentenceSplitter {

    private static final Pattern SENTENCE = Pattern.compile("[^.!?…]+(?:[.!?…]+[»\"”]?|$)");
    private static final Pattern TERMINATOR = Pattern.compile("[.!?…]+");

    private SentenceSplitter() {
    }

    /**
     * Splits text into sentences on terminal punctuation, trimming whitespace.
     *
     * @param text       text to split
     * @param baseOffset offset of {@code text} inside the chapter
     * @return sentences in order, offsets relative to the chapter
     */
    public static List<Sentence> split(final String text, final int baseOffset) {
        if (text == null) {
            throw new IllegalArgumentException("Text cannot be null");
        }
        List<Sentence> sentences = new ArrayList<>();
        Matcher matcher = SENTENCE.matcher(text);
        while (matcher.find()) {
            int start = matcher.start();
            int end = matcher.end();
            while (start < end && Character.isWhitespace(text.charAt(start))) {
                start++;
            }
            while (end > start && Character.isWhitespace(text.charAt(end - 1))) {
                end--;
            }
            if (end > start) {
                sentences.add(new Sentence(text.substring(start, end), baseOffset + start, baseOffset + end));
            }
        }
        return sentences;
    }

    /**
     * Counts terminal punctuation groups, at least one for non-blank text.
     */
    public static int countSentences(final String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        Matcher matcher = TERMINATOR.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return Math.max(1, count);
    }
}
