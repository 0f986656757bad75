package com.climbassessment.common.scoring;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Monotonic {@code (minimumOverallScore, grade)} table. The lowest minimum
 * must be 0 so that every score in [0, 100] resolves to exactly one grade.
 */
public final class GradeTable {

    public record Entry(double minimum, String grade) {}

    private final List<Entry> entries;

    public GradeTable(List<Entry> entries) {
        if (entries == null || entries.isEmpty()) {
            throw new IllegalArgumentException("grade table must not be empty");
        }
        List<Entry> sorted = new ArrayList<>(entries);
        sorted.sort(Comparator.comparingDouble(Entry::minimum).reversed());
        if (sorted.get(sorted.size() - 1).minimum() != 0.0) {
            throw new IllegalArgumentException("lowest grade minimum must be 0");
        }
        this.entries = List.copyOf(sorted);
    }

    public static GradeTable defaults() {
        return new GradeTable(List.of(
            new Entry(85, "7b+"),
            new Entry(80, "7a–7b"),
            new Entry(75, "6c–7a"),
            new Entry(68, "6b–6c"),
            new Entry(60, "6a–6b"),
            new Entry(50, "5c–6a"),
            new Entry(40, "5b–5c"),
            new Entry(30, "5a–5b"),
            new Entry(0, "below 5a")));
    }

    public String grade(double overallScore) {
        double score = ScoreFunctions.clampScore(overallScore);
        for (Entry entry : entries) {
            if (entry.minimum() <= score) {
                return entry.grade();
            }
        }
        return entries.get(entries.size() - 1).grade();
    }

    public List<Entry> entries() {
        return entries;
    }
}
