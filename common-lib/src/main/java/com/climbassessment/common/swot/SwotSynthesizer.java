package com.climbassessment.common.swot;

import com.climbassessment.common.model.DescentEvent;
import com.climbassessment.common.model.Level;
import com.climbassessment.common.model.MetricCategory;
import com.climbassessment.common.model.MetricResult;
import com.climbassessment.common.model.SwotItem;
import com.climbassessment.common.model.SwotReport;
import com.climbassessment.common.model.TechniqueProfile;
import com.climbassessment.common.model.TensionEvent;
import com.climbassessment.common.template.PlaceholderRenderer;
import com.climbassessment.common.template.TemplateSet;
import com.climbassessment.common.template.TextField;
import com.climbassessment.common.template.ThreatTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Deterministic SWOT synthesis from a scored profile, the session's tension
 * events and the template set.
 *
 * <h3>Order of application</h3>
 * <ol>
 *   <li><strong>Strengths</strong>: categories in their family's top level
 *       with a strength text; score descending.</li>
 *   <li><strong>Weaknesses</strong>: categories below the weakness cut-off
 *       with a weakness text; score ascending.</li>
 *   <li><strong>Opportunities</strong>: for each weakness in order, the
 *       category's opportunity rule when all its inputs are present.</li>
 *   <li><strong>Threats</strong>: every threat rule that fires; severity descending.</li>
 * </ol>
 * Equal sort keys keep category (or rule) order, so identical inputs always
 * yield an identical report. Each list is capped by {@link SwotLimits}.
 */
public final class SwotSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(SwotSynthesizer.class);

    private final TemplateSet templates;
    private final SwotLimits limits;
    private final Map<MetricCategory, OpportunityRule> opportunityRules;
    private final List<ThreatRule> threatRules;
    private final PlaceholderRenderer renderer = new PlaceholderRenderer();

    public SwotSynthesizer(TemplateSet templates, SwotLimits limits,
                           List<OpportunityRule> opportunityRules, List<ThreatRule> threatRules) {
        this.templates = templates;
        this.limits = limits;
        Map<MetricCategory, OpportunityRule> byCategory = new EnumMap<>(MetricCategory.class);
        for (OpportunityRule rule : opportunityRules) {
            byCategory.put(rule.category(), rule);
        }
        this.opportunityRules = byCategory;
        this.threatRules = List.copyOf(threatRules);
    }

    public static SwotSynthesizer standard(TemplateSet templates, SwotLimits limits) {
        return new SwotSynthesizer(templates, limits, OpportunityRules.standard(), ThreatRules.standard());
    }

    public SwotReport synthesize(TechniqueProfile profile, List<TensionEvent> tensionEvents) {
        return synthesize(profile, tensionEvents, List.of());
    }

    public SwotReport synthesize(TechniqueProfile profile, List<TensionEvent> tensionEvents,
                                 List<DescentEvent> descents) {
        List<Scored> scored = scoredCategories(profile);

        List<Scored> weaknesses = weaknesses(scored);
        return new SwotReport(
            strengths(scored),
            weaknesses.stream().map(Scored::item).toList(),
            opportunities(weaknesses),
            threats(new ThreatInputs(tensionEvents, descents, profile)));
    }

    // ── Strengths & weaknesses ─────────────────────────────────────

    private List<SwotItem> strengths(List<Scored> scored) {
        List<SwotItem> strengths = new ArrayList<>();
        scored.stream()
            .filter(s -> s.result().level() == s.category().family().topLevel())
            .sorted(Comparator.comparingDouble((Scored s) -> s.result().score()).reversed())
            .forEach(s -> metricText(s, TextField.STRENGTH)
                .ifPresent(text -> strengths.add(new SwotItem(s.category().id(), s.result().score(), text))));
        return cap(strengths, limits.maxStrengths());
    }

    private List<Scored> weaknesses(List<Scored> scored) {
        List<Scored> weaknesses = new ArrayList<>();
        scored.stream()
            .filter(s -> s.result().score() < limits.weaknessCutoff())
            .sorted(Comparator.comparingDouble((Scored s) -> s.result().score()))
            .forEach(s -> metricText(s, TextField.WEAKNESS)
                .ifPresent(text -> weaknesses.add(s.withItem(new SwotItem(s.category().id(), s.result().score(), text)))));
        return cap(weaknesses, limits.maxWeaknesses());
    }

    private Optional<String> metricText(Scored scored, TextField field) {
        Level level = scored.result().level();
        return templates.metricText(scored.category(), level, field)
            .map(template -> renderer.render(
                scored.category().id() + "." + level.key() + "." + field.key(),
                template,
                scored.result().raw()));
    }

    // ── Opportunities ──────────────────────────────────────────────

    private List<SwotItem> opportunities(List<Scored> weaknesses) {
        List<SwotItem> opportunities = new ArrayList<>();
        for (Scored weakness : weaknesses) {
            OpportunityRule rule = opportunityRules.get(weakness.category());
            if (rule == null) continue;

            Map<String, Double> raw = weakness.result().raw();
            if (!raw.keySet().containsAll(rule.requiredInputs())) {
                log.debug("[SwotSynthesizer] Opportunity skipped, missing inputs rule={} required={} available={}",
                    rule.id(), rule.requiredInputs(), raw.keySet());
                continue;
            }
            Optional<String> template = templates.opportunityText(rule.id());
            if (template.isEmpty()) {
                log.warn("[SwotSynthesizer] No opportunity text for rule={}", rule.id());
                continue;
            }

            Map<String, Object> values = new LinkedHashMap<>(raw);
            values.putAll(rule.calculate(raw));
            String text = renderer.render("opportunities." + rule.id(), template.get(), values);
            opportunities.add(new SwotItem(rule.id(), weakness.result().score(), text));
        }
        return cap(opportunities, limits.maxOpportunities());
    }

    // ── Threats ────────────────────────────────────────────────────

    private List<SwotItem> threats(ThreatInputs inputs) {
        List<SwotItem> threats = new ArrayList<>();
        for (ThreatRule rule : threatRules) {
            Optional<ThreatTemplate> template = templates.threat(rule.id());
            if (template.isEmpty()) {
                log.warn("[SwotSynthesizer] No threat template for rule={}", rule.id());
                continue;
            }
            double threshold = template.get().threshold() != null
                ? template.get().threshold()
                : rule.defaultThreshold();

            rule.evaluate(inputs, threshold).ifPresent(finding -> {
                Map<String, Object> values = new LinkedHashMap<>(finding.values());
                values.put("side", template.get().sideLabel(finding.side()));
                String text = renderer.render("threats." + rule.id(), template.get().text(), values);
                threats.add(new SwotItem(rule.id(), finding.severity(), text));
            });
        }
        threats.sort(Comparator.comparingDouble(SwotItem::value).reversed());
        return cap(threats, limits.maxThreats());
    }

    // ── Helpers ────────────────────────────────────────────────────

    private static List<Scored> scoredCategories(TechniqueProfile profile) {
        List<Scored> scored = new ArrayList<>();
        for (MetricCategory category : MetricCategory.values()) {
            MetricResult result = profile.metric(category);
            if (result != null) {
                scored.add(new Scored(category, result, null));
            }
        }
        return scored;
    }

    private static <T> List<T> cap(List<T> items, int max) {
        return items.size() <= max ? List.copyOf(items) : List.copyOf(items.subList(0, max));
    }

    private record Scored(MetricCategory category, MetricResult result, SwotItem item) {
        Scored withItem(SwotItem rendered) {
            return new Scored(category, result, rendered);
        }
    }
}
