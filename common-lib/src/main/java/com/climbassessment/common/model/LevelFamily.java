package com.climbassessment.common.model;

import java.util.List;

/**
 * Ordered bucket sets shared by groups of categories, worst level first.
 * The last level of each family is its top bucket.
 */
public enum LevelFamily {
    GENERIC(List.of(Level.POOR, Level.MEDIUM, Level.GOOD, Level.EXCELLENT)),
    EXHAUSTION(List.of(Level.CRITICAL, Level.HIGH, Level.MODERATE, Level.LOW)),
    LOAD(List.of(Level.CRITICAL, Level.OVERLOADED, Level.ACCEPTABLE, Level.OPTIMAL));

    private final List<Level> levels;

    LevelFamily(List<Level> levels) {
        this.levels = levels;
    }

    public List<Level> levels() { return levels; }

    public Level topLevel() { return levels.get(levels.size() - 1); }

    public boolean contains(Level level) { return levels.contains(level); }

    /** Position of {@code level} within the family; higher is better. */
    public int rank(Level level) {
        int rank = levels.indexOf(level);
        if (rank < 0) {
            throw new IllegalArgumentException(level + " is not part of " + this);
        }
        return rank;
    }
}
