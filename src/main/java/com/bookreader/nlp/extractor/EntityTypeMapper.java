package com.bookreader.nlp.extractor;

import com.bookreader.nlp.core.DescriptionType;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Maps backend entity labels onto {@link DescriptionType}.
 */
public final class EntityTypeMapper {

    private static final Map<String, DescriptionType> LABELS = Map.ofEntries(
        Map.entry("PER", DescriptionType.CHARACTER),
        Map.entry("PERSON", DescriptionType.CHARACTER),
        Map.entry("LOC", DescriptionType.LOCATION),
        Map.entry("LOCATION", DescriptionType.LOCATION),
        Map.entry("GPE", DescriptionType.LOCATION),
        Map.entry("FAC", DescriptionType.LOCATION),
        Map.entry("CITY", DescriptionType.LOCATION),
        Map.entry("COUNTRY", DescriptionType.LOCATION),
        Map.entry("STATE_OR_PROVINCE", DescriptionType.LOCATION),
        Map.entry("ORG", DescriptionType.OBJECT),
        Map.entry("ORGANIZATION", DescriptionType.OBJECT),
        Map.entry("MISC", DescriptionType.OBJECT)
    );

    // keyword fallback for labels the table does not know, checked in this order
    private static final List<Map.Entry<DescriptionType, List<String>>> KEYWORDS = List.of(
        Map.entry(DescriptionType.LOCATION, List.of("замок", "город", "лес", "дом", "комнат", "улиц", "гор", "рек")),
        Map.entry(DescriptionType.CHARACTER, List.of("человек", "мужчин", "женщин", "старик", "девушк", "маг")),
        Map.entry(DescriptionType.ATMOSPHERE, List.of("туман", "тишин", "мрак", "свет", "тен", "воздух")),
        Map.entry(DescriptionType.OBJECT, List.of("меч", "книг", "кольц", "посох", "плащ"))
    );

    private EntityTypeMapper() {
    }

    @NotNull
    public static Optional<DescriptionType> fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        String key = label.trim().toUpperCase(Locale.ROOT);
        if (key.startsWith("B-") || key.startsWith("I-")) {
            key = key.substring(2);
        }
        return Optional.ofNullable(LABELS.get(key));
    }

    /**
     * Label mapping with a keyword fallback on the entity text.
     */
    @NotNull
    public static Optional<DescriptionType> resolve(String label, String text) {
        Optional<DescriptionType> mapped = fromLabel(label);
        if (mapped.isPresent() || text == null) {
            return mapped;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (Map.Entry<DescriptionType, List<String>> entry : KEYWORDS) {
            if (entry.getValue().stream().anyMatch(lower::contains)) {
                return Optional.of(entry.getKey());
            }
        }
        return Optional.empty();
    }
}
