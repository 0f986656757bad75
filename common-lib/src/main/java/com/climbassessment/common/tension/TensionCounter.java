package com.climbassessment.common.tension;

/**
 * Rising-edge counter with extremum tracking for one region/kind/side.
 * A measurement that is unavailable leaves the over/under state untouched, so
 * a short tracking gap does not split one crossing into two.
 */
final class TensionCounter {

    private final boolean tracksMinimum;
    private boolean over;
    private int count;
    private double extremum;

    TensionCounter(boolean tracksMinimum) {
        this.tracksMinimum = tracksMinimum;
        this.extremum = tracksMinimum ? Double.POSITIVE_INFINITY : Double.NEGATIVE_INFINITY;
    }

    void update(boolean crossed, double value) {
        if (crossed) {
            if (!over) {
                count++;
            }
            extremum = tracksMinimum ? Math.min(extremum, value) : Math.max(extremum, value);
        }
        over = crossed;
    }

    int count() { return count; }

    double extremum() { return extremum; }
}
