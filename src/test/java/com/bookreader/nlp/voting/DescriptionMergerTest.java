package com.bookreader.nlp.voting;

import com.bookreader.nlp.core.DescriptionGroup;
import com.bookreader.nlp.core.DescriptionType;
import com.bookreader.nlp.core.RawDescription;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static com.bookreader.nlp.EngineFixtures.raw;
import static org.junit.jupiter.api.Assertions.*;

class DescriptionMergerTest {

    private final DescriptionMerger merger = new DescriptionMerger(0.5);

    @Test
    @DisplayName("should merge same-type descriptions that overlap by more than the ratio")
    void mergesOverlapping() {
        RawDescription sentence = raw("Старый маг стоял у окна.", 10, DescriptionType.CHARACTER, "lexicon", 0.7);
        RawDescription phrase = raw("Старый маг", 10, DescriptionType.CHARACTER, "names", 0.6);

        List<DescriptionGroup> groups = merger.group(List.of(sentence, phrase));

        assertEquals(1, groups.size());
        assertEquals(List.of("lexicon", "names"), groups.get(0).processors());
        assertEquals("Старый маг стоял у окна.", groups.get(0).representative().text());
        assertEquals(sentence, groups.get(0).strongest());
    }

    @Test
    @DisplayName("should keep overlapping descriptions of different types apart")
    void differentTypesStayApart() {
        RawDescription location = raw("темный замок на холме", 0, DescriptionType.LOCATION, "lexicon", 0.8);
        RawDescription atmosphere = raw("темный замок на холме", 0, DescriptionType.ATMOSPHERE, "names", 0.8);

        assertEquals(2, merger.group(List.of(location, atmosphere)).size());
    }

    @Test
    @DisplayName("should not merge spans whose overlap is at most the ratio")
    void smallOverlapStaysApart() {
        // overlap of 5 characters against a shorter span of 10
        RawDescription first = raw("0123456789", 0, DescriptionType.OBJECT, "a", 0.5);
        RawDescription second = raw("abcdefghij", 5, DescriptionType.OBJECT, "b", 0.5);

        assertEquals(2, merger.group(List.of(first, second)).size());
    }

    @Test
    @DisplayName("should close matches transitively")
    void transitive() {
        RawDescription a = raw("aaaaaaaaaa", 0, DescriptionType.OBJECT, "a", 0.5);
        RawDescription b = raw("bbbbbbbbbb", 4, DescriptionType.OBJECT, "b", 0.5);
        RawDescription c = raw("cccccccccc", 8, DescriptionType.OBJECT, "c", 0.5);

        List<DescriptionGroup> groups = merger.group(List.of(c, a, b));

        assertEquals(1, groups.size());
        assertEquals(3, groups.get(0).members().size());
    }

    @Test
    @DisplayName("should produce the same groups regardless of input order")
    void orderIndependent() {
        List<RawDescription> input = new ArrayList<>(List.of(
            raw("Высокий темный замок", 0, DescriptionType.LOCATION, "lexicon", 0.9),
            raw("темный замок", 8, DescriptionType.LOCATION, "names", 0.5),
            raw("Старый маг", 50, DescriptionType.CHARACTER, "names", 0.6),
            raw("Старый маг стоял", 50, DescriptionType.CHARACTER, "lexicon", 0.7),
            raw("густой туман", 90, DescriptionType.ATMOSPHERE, "lexicon", 0.4)
        ));
        List<DescriptionGroup> expected = merger.group(input);

        Collections.shuffle(input, new Random(42));
        List<DescriptionGroup> actual = merger.group(input);

        assertEquals(expected, actual);
        assertEquals(3, actual.size());
    }

    @Test
    @DisplayName("grouping the representatives again changes nothing")
    void idempotent() {
        List<RawDescription> input = List.of(
            raw("Высокий темный замок", 0, DescriptionType.LOCATION, "lexicon", 0.9),
            raw("темный замок", 8, DescriptionType.LOCATION, "names", 0.5),
            raw("Старый маг", 50, DescriptionType.CHARACTER, "names", 0.6)
        );
        List<RawDescription> representatives = merger.group(input).stream()
            .map(DescriptionGroup::representative)
            .toList();

        List<DescriptionGroup> again = merger.group(representatives);

        assertEquals(representatives.size(), again.size());
        assertTrue(again.stream().allMatch(g -> g.members().size() == 1));
    }

    @Test
    @DisplayName("should return no groups for no input")
    void emptyInput() {
        assertTrue(merger.group(List.of()).isEmpty());
    }

    @Test
    @DisplayName("should reject an overlap ratio outside [0, 1]")
    void invalidRatio() {
        assertThrows(IllegalArgumentException.class, () -> new DescriptionMerger(1.5));
        assertThrows(IllegalArgumentException.class, () -> new DescriptionMerger(-0.1));
    }
}
