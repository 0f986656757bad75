package com.climbassessment.common.scoring;

import com.climbassessment.common.model.Level;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Ordered {@code (threshold, level)} table of one category.
 *
 * <p>Lookup walks the thresholds from highest to lowest and returns the first
 * level whose threshold is {@code <= score}, so a boundary value belongs to the
 * higher bucket. The lowest threshold must be 0, which makes the lookup total
 * over [0, 100].
 */
public final class BucketTable {

    public record Bucket(double threshold, Level level) {}

    private final List<Bucket> buckets;

    public BucketTable(List<Bucket> buckets) {
        if (buckets == null || buckets.isEmpty()) {
            throw new IllegalArgumentException("bucket table must not be empty");
        }
        List<Bucket> sorted = new ArrayList<>(buckets);
        sorted.sort(Comparator.comparingDouble(Bucket::threshold).reversed());
        if (sorted.get(sorted.size() - 1).threshold() != 0.0) {
            throw new IllegalArgumentException("lowest bucket threshold must be 0");
        }
        this.buckets = List.copyOf(sorted);
    }

    /** {@code poor / medium / good / excellent} at 45 / 60 / 75. */
    public static BucketTable generic() {
        return new BucketTable(List.of(
            new Bucket(75, Level.EXCELLENT),
            new Bucket(60, Level.GOOD),
            new Bucket(45, Level.MEDIUM),
            new Bucket(0, Level.POOR)));
    }

    /** Exhaustion score buckets {@code low / moderate / high / critical} at 70 / 50 / 30. */
    public static BucketTable exhaustion() {
        return new BucketTable(List.of(
            new Bucket(70, Level.LOW),
            new Bucket(50, Level.MODERATE),
            new Bucket(30, Level.HIGH),
            new Bucket(0, Level.CRITICAL)));
    }

    public Level lookup(double score) {
        for (Bucket bucket : buckets) {
            if (score >= bucket.threshold()) {
                return bucket.level();
            }
        }
        return buckets.get(buckets.size() - 1).level();
    }

    /** Buckets, highest threshold first. */
    public List<Bucket> buckets() {
        return buckets;
    }
}
