package com.climbassessment.common.scoring;

import com.climbassessment.common.extractor.ExtractionOutcome;
import com.climbassessment.common.model.MetricCategory;
import com.climbassessment.common.model.MetricResult;
import com.climbassessment.common.model.TechniqueProfile;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scores every extracted category, aggregates the technique categories and
 * estimates the grade. With no scored technique category the profile is
 * {@value TechniqueProfile#INDETERMINATE}.
 */
public final class TechniqueProfileScorer {

    private final ScoringConfig config;
    private final CategoryScorer categoryScorer;
    private final WeightedScoreAggregator aggregator;

    public TechniqueProfileScorer(ScoringConfig config) {
        this.config = config;
        this.categoryScorer = new CategoryScorer(config);
        this.aggregator = new WeightedScoreAggregator(config.weights());
    }

    public TechniqueProfile score(ExtractionOutcome outcome) {
        Map<MetricCategory, MetricResult> results = new EnumMap<>(MetricCategory.class);
        outcome.signals().forEach((category, signal) -> results.put(category, categoryScorer.score(signal)));

        AggregateScore aggregate = aggregator.aggregate(results);
        String grade = aggregate.overall() == null
            ? TechniqueProfile.INDETERMINATE
            : config.gradeTable().grade(aggregate.overall());

        Map<String, MetricResult> metrics = new LinkedHashMap<>();
        results.forEach((category, result) -> metrics.put(category.id(), result));
        List<String> insufficient = new ArrayList<>();
        outcome.insufficient().forEach(category -> insufficient.add(category.id()));

        return new TechniqueProfile(metrics, aggregate.overall(), grade, aggregate.weights(), insufficient);
    }
}
