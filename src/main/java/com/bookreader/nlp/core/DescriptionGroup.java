package com.bookreader.nlp.core;

import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Raw descriptions from one or more extractors that denote the same underlying span.
 */
public record DescriptionGroup(List<RawDescription> members) {

    private static final Comparator<RawDescription> LONGEST_FIRST =
        Comparator.comparingInt((RawDescription d) -> d.text().length()).reversed()
            .thenComparing(Comparator.comparingDouble(RawDescription::processorConfidence).reversed())
            .thenComparingInt(d -> d.span().start())
            .thenComparing(RawDescription::sourceProcessor);

    private static final Comparator<RawDescription> STRONGEST_FIRST =
        Comparator.comparingDouble(RawDescription::processorConfidence).reversed()
            .thenComparing(Comparator.comparingInt((RawDescription d) -> d.text().length()).reversed())
            .thenComparing(RawDescription::sourceProcessor)
            .thenComparingInt(d -> d.span().start());

    public DescriptionGroup {
        Objects.requireNonNull(members, "members must not be null");
        if (members.isEmpty()) {
            throw new IllegalArgumentException("a group needs at least one member");
        }
        members = List.copyOf(members);
    }

    public static DescriptionGroup of(RawDescription description) {
        return new DescriptionGroup(List.of(description));
    }

    /**
     * Member whose text survives the merge: the longest one.
     */
    public RawDescription representative() {
        return members.stream().min(LONGEST_FIRST).orElseThrow();
    }

    /**
     * Member with the highest extractor confidence.
     */
    public RawDescription strongest() {
        return members.stream().min(STRONGEST_FIRST).orElseThrow();
    }

    public DescriptionType type() {
        return members.get(0).descriptionType();
    }

    /**
     * Distinct contributing extractors, in name order.
     */
    public List<String> processors() {
        return members.stream()
            .map(RawDescription::sourceProcessor)
            .distinct()
            .sorted()
            .toList();
    }

    public double structuralSignal() {
        return members.stream().mapToDouble(RawDescription::paragraphScore).max().orElse(0.0);
    }

    /**
     * Distinct entity tags lying inside the representative span.
     */
    public List<EntityTag> entities() {
        TextSpan span = representative().span();
        return members.stream()
            .flatMap(m -> m.entityTags().stream())
            .filter(t -> t.start() >= span.start() && t.end() <= span.end())
            .filter(distinctBy())
            .sorted(Comparator.comparingInt(EntityTag::start).thenComparing(EntityTag::label))
            .toList();
    }

    private static Predicate<EntityTag> distinctBy() {
        Set<String> seen = new HashSet<>();
        return tag -> seen.add(tag.start() + ":" + tag.end());
    }
}
