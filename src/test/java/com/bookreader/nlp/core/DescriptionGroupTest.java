package com.bookreader.nlp.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.bookreader.nlp.EngineFixtures.raw;
import static org.junit.jupiter.api.Assertions.*;

class DescriptionGroupTest {

    @Test
    @DisplayName("representative should be the longest member and strongest the most confident")
    void representativeAndStrongest() {
        RawDescription longer = raw("Старый маг стоял у окна.", 0, DescriptionType.CHARACTER, "lexicon", 0.5);
        RawDescription confident = raw("Старый маг", 0, DescriptionType.CHARACTER, "names", 0.9);

        DescriptionGroup group = new DescriptionGroup(List.of(confident, longer));

        assertEquals(longer, group.representative());
        assertEquals(confident, group.strongest());
        assertEquals(List.of("lexicon", "names"), group.processors());
        assertEquals(DescriptionType.CHARACTER, group.type());
    }

    @Test
    @DisplayName("entities should be distinct and inside the representative span")
    void entities() {
        List<EntityTag> tags = List.of(
            new EntityTag("маг", "LEX_CHARACTER", 7, 10),
            new EntityTag("окна", "LEX_OBJECT", 19, 23));
        RawDescription first = raw("Старый маг стоял у окна.", 0, DescriptionType.CHARACTER, "lexicon", 0.5, tags);
        RawDescription second = raw("Старый маг", 0, DescriptionType.CHARACTER, "names", 0.9,
            List.of(new EntityTag("маг", "PER", 7, 10), new EntityTag("Москва", "LOC", 40, 46)));

        List<EntityTag> entities = new DescriptionGroup(List.of(first, second)).entities();

        assertEquals(2, entities.size());
        assertEquals(7, entities.get(0).start());
        assertEquals(19, entities.get(1).start());
    }

    @Test
    @DisplayName("should reject an empty group")
    void emptyGroup() {
        assertThrows(IllegalArgumentException.class, () -> new DescriptionGroup(List.of()));
    }
}
