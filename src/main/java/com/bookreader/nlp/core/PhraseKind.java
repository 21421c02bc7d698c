package com.bookreader.nlp.core;

/**
 * Syntactic phrase patterns collected for descriptive paragraphs.
 */
public enum PhraseKind {

    ADJ_NOUN("adj_noun", 20),
    ADJ_ADJ_NOUN("adj_adj_noun", 10),
    NOUN_PREP_NOUN("noun_prep_noun", 15);

    private final String key;
    private final int limit;

    PhraseKind(String key, int limit) {
        this.key = key;
        this.limit = limit;
    }

    public String key() {
        return key;
    }

    /**
     * Maximum number of phrases kept for this pattern, in text order.
     */
    public int limit() {
        return limit;
    }
}
