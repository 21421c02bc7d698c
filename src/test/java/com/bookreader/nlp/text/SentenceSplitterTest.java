package com.bookreader.nlp.text;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SentenceSplitterTest {

    @Test
    @DisplayName("should split on terminal punctuation with chapter offsets")
    void splits() {
        List<Sentence> sentences = SentenceSplitter.split("Первое предложение. Второе! Третье?", 10);

        assertEquals(3, sentences.size());
        assertEquals(new Sentence("Первое предложение.", 10, 29), sentences.get(0));
        assertEquals(new Sentence("Второе!", 30, 37), sentences.get(1));
        assertEquals("Третье?", sentences.get(2).text());
    }

    @Test
    @DisplayName("should keep a closing quote with its sentence and a trailing fragment")
    void quotesAndFragments() {
        List<Sentence> sentences = SentenceSplitter.split("Он сказал: «Иди!» И ушел", 0);

        assertEquals(List.of("Он сказал: «Иди!»", "И ушел"),
            sentences.stream().map(Sentence::text).toList());
    }

    @Test
    @DisplayName("should count punctuation groups, at least one for non-blank text")
    void countSentences() {
        assertEquals(0, SentenceSplitter.countSentences("  "));
        assertEquals(1, SentenceSplitter.countSentences("без точки"));
        assertEquals(2, SentenceSplitter.countSentences("Раз. Два... Три"));
        assertEquals(3, SentenceSplitter.countSentences("Раз! Два?! Три…"));
    }
}
