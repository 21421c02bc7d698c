package com.bookreader.nlp.scoring;

import com.bookreader.nlp.core.CompleteDescription;
import com.bookreader.nlp.core.ConfidenceBreakdown;
import com.bookreader.nlp.core.DescriptionType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DescriptionRankingTest {

    private static CompleteDescription description(String text, DescriptionType type, int offset, double score) {
        return new CompleteDescription(text, type, offset, offset + text.length(),
            new ConfidenceBreakdown(score, score, score, score), score, 1.0,
            List.of("lexicon"), List.of(), text.split("\\s+").length, Map.of());
    }

    @Test
    @DisplayName("should order by score, then type priority, then position")
    void ordering() {
        CompleteDescription action = description("он побежал вниз", DescriptionType.ACTION, 0, 0.7);
        CompleteDescription location = description("темный замок", DescriptionType.LOCATION, 100, 0.7);
        CompleteDescription best = description("старый маг", DescriptionType.CHARACTER, 50, 0.9);
        CompleteDescription laterLocation = description("густой лес", DescriptionType.LOCATION, 200, 0.7);

        List<CompleteDescription> sorted = DescriptionRanking.sort(List.of(action, laterLocation, location, best));

        assertEquals(List.of(best, location, laterLocation, action), sorted);
    }

    @Test
    @DisplayName("should not modify the input list")
    void copiesInput() {
        List<CompleteDescription> input = List.of(
            description("b", DescriptionType.OBJECT, 0, 0.4),
            description("a", DescriptionType.OBJECT, 5, 0.9));

        DescriptionRanking.sort(input);

        assertEquals("b", input.get(0).text());
    }

    @Test
    @DisplayName("illustration selection should skip overlapping candidates and respect the budget")
    void selectForIllustration() {
        CompleteDescription castle = description("Высокий темный замок", DescriptionType.LOCATION, 0, 0.9);
        CompleteDescription castlePart = description("темный замок", DescriptionType.ATMOSPHERE, 8, 0.8);
        CompleteDescription mage = description("старый маг", DescriptionType.CHARACTER, 40, 0.7);
        CompleteDescription door = description("тяжелая дверь", DescriptionType.OBJECT, 80, 0.6);

        List<CompleteDescription> all = List.of(door, castlePart, mage, castle);

        assertEquals(List.of(castle, mage), DescriptionRanking.selectForIllustration(all, 2));
        assertEquals(List.of(castle, mage, door), DescriptionRanking.selectForIllustration(all, 10));
        assertTrue(DescriptionRanking.selectForIllustration(all, 0).isEmpty());
    }
}
