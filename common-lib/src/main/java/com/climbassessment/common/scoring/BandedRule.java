package com.climbassessment.common.scoring;

import com.climbassessment.common.model.Level;
import com.climbassessment.common.model.RawSignal;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Rule that buckets the <em>raw</em> value directly and assigns each band a
 * fixed score. Bands are ordered by upper bound; a raw value exactly on a
 * bound belongs to the lower-raw (better) band. The last band must be open-ended.
 *
 * <pre>
 *   raw ≤ 40 → optimal,    95
 *   raw ≤ 50 → acceptable, 75
 *   raw ≤ 65 → overloaded, 50
 *   else     → critical,   25
 * </pre>
 */
public final class BandedRule implements NormalizationRule {

    public record Band(double upTo, Level level, double score) {}

    private final List<Band> bands;

    public BandedRule(List<Band> bands) {
        if (bands == null || bands.isEmpty()) {
            throw new IllegalArgumentException("banded rule needs at least one band");
        }
        List<Band> sorted = new ArrayList<>(bands);
        sorted.sort(Comparator.comparingDouble(Band::upTo));
        if (sorted.get(sorted.size() - 1).upTo() != Double.POSITIVE_INFINITY) {
            throw new IllegalArgumentException("last band must be open-ended");
        }
        this.bands = List.copyOf(sorted);
    }

    public static BandedRule armLoad() {
        return new BandedRule(List.of(
            new Band(40, Level.OPTIMAL, 95),
            new Band(50, Level.ACCEPTABLE, 75),
            new Band(65, Level.OVERLOADED, 50),
            new Band(Double.POSITIVE_INFINITY, Level.CRITICAL, 25)));
    }

    @Override
    public Normalized normalize(RawSignal signal) {
        double raw = signal.value();
        for (Band band : bands) {
            if (raw <= band.upTo()) {
                return new Normalized(band.score(), band.level());
            }
        }
        Band last = bands.get(bands.size() - 1);
        return new Normalized(last.score(), last.level());
    }
}
