package com.climbassessment.common.template;

import com.climbassessment.common.model.Level;
import com.climbassessment.common.model.MetricCategory;
import com.climbassessment.common.model.Side;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Loads a YAML template document into a validated {@link TemplateSet}.
 *
 * <h3>Document layout</h3>
 * <pre>
 * metrics:
 *   hip_position:
 *     excellent: { strength: "..." }
 *     poor:      { weakness: "..." }
 * opportunities:
 *   hip_position: { text: "..." }
 * threats:
 *   shoulder: { text: "...", threshold: 3, sides: { left: "...", right: "...", none: "..." } }
 * </pre>
 *
 * <h3>Fallback</h3>
 * <ul>
 *   <li>Absent or unparseable document → the full {@link DefaultTemplates} set.</li>
 *   <li>Missing or invalid entry → the default for that metric or rule only;
 *       sibling entries are unaffected.</li>
 *   <li>Unknown keys are ignored.</li>
 * </ul>
 * Every fallback is logged as a warning; nothing is thrown.
 */
public final class TemplateResolver {

    private static final Logger log = LoggerFactory.getLogger(TemplateResolver.class);

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    public TemplateSet defaults() {
        return DefaultTemplates.get();
    }

    public TemplateSet resolve(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            log.warn("[TemplateResolver] Template document not found, using defaults path={}", path);
            return defaults();
        }
        try (InputStream in = Files.newInputStream(path)) {
            return resolve(in, path.toString());
        } catch (IOException e) {
            log.warn("[TemplateResolver] Template document unreadable, using defaults path={} err={}", path, e.toString());
            return defaults();
        }
    }

    /**
     * @param in     YAML document; {@code null} means no document
     * @param origin document name for log output
     */
    public TemplateSet resolve(InputStream in, String origin) {
        if (in == null) {
            log.warn("[TemplateResolver] Template document not found, using defaults origin={}", origin);
            return defaults();
        }
        JsonNode root;
        try {
            root = yamlMapper.readTree(in);
        } catch (IOException e) {
            log.warn("[TemplateResolver] Template document unparseable, using defaults origin={} err={}", origin, e.toString());
            return defaults();
        }
        if (root == null || !root.isObject()) {
            log.warn("[TemplateResolver] Template document is not a mapping, using defaults origin={}", origin);
            return defaults();
        }

        TemplateSet resolved = new TemplateSet(
            resolveMetrics(root.path("metrics")),
            resolveOpportunities(root.path("opportunities")),
            resolveThreats(root.path("threats")));
        log.info("[TemplateResolver] Templates loaded origin={} metrics={} opportunities={} threats={}",
            origin, resolved.metrics().size(), resolved.opportunities().size(), resolved.threats().size());
        return resolved;
    }

    // ── Metrics ────────────────────────────────────────────────────

    private Map<MetricCategory, MetricTemplates> resolveMetrics(JsonNode section) {
        Map<MetricCategory, MetricTemplates> metrics = new EnumMap<>(MetricCategory.class);
        for (MetricCategory category : MetricCategory.values()) {
            JsonNode entry = section.path(category.id());
            Optional<MetricTemplates> parsed = parseMetric(category, entry);
            if (parsed.isPresent()) {
                metrics.put(category, parsed.get());
            } else {
                warnFallback("metrics", category.id(), entry.isMissingNode() ? "missing" : "invalid structure");
                metrics.put(category, DefaultTemplates.metric(category));
            }
        }
        return metrics;
    }

    private Optional<MetricTemplates> parseMetric(MetricCategory category, JsonNode entry) {
        if (!entry.isObject()) {
            return Optional.empty();
        }
        Map<Level, LevelTexts> levels = new EnumMap<>(Level.class);
        for (Level level : category.family().levels()) {
            JsonNode levelNode = entry.path(level.key());
            if (!levelNode.isObject()) {
                return Optional.empty();
            }
            LevelTexts texts = new LevelTexts(
                text(levelNode, TextField.STRENGTH.key()),
                text(levelNode, TextField.WEAKNESS.key()));
            if (!texts.hasAnyText()) {
                return Optional.empty();
            }
            levels.put(level, texts);
        }
        return Optional.of(new MetricTemplates(levels));
    }

    // ── Rules ──────────────────────────────────────────────────────

    private Map<String, String> resolveOpportunities(JsonNode section) {
        Map<String, String> opportunities = new LinkedHashMap<>();
        for (String ruleId : DefaultTemplates.get().opportunities().keySet()) {
            JsonNode entry = section.path(ruleId);
            String text = entry.isObject() ? text(entry, "text") : null;
            if (text != null) {
                opportunities.put(ruleId, text);
            } else {
                warnFallback("opportunities", ruleId, entry.isMissingNode() ? "missing" : "no text");
                opportunities.put(ruleId, DefaultTemplates.opportunity(ruleId));
            }
        }
        return opportunities;
    }

    private Map<String, ThreatTemplate> resolveThreats(JsonNode section) {
        Map<String, ThreatTemplate> threats = new LinkedHashMap<>();
        for (String ruleId : DefaultTemplates.get().threats().keySet()) {
            JsonNode entry = section.path(ruleId);
            Optional<ThreatTemplate> parsed = parseThreat(entry);
            if (parsed.isPresent()) {
                threats.put(ruleId, parsed.get());
            } else {
                warnFallback("threats", ruleId, entry.isMissingNode() ? "missing" : "invalid structure");
                threats.put(ruleId, DefaultTemplates.threat(ruleId));
            }
        }
        return threats;
    }

    private Optional<ThreatTemplate> parseThreat(JsonNode entry) {
        if (!entry.isObject()) {
            return Optional.empty();
        }
        String text = text(entry, "text");
        if (text == null) {
            return Optional.empty();
        }
        Double threshold = null;
        JsonNode thresholdNode = entry.get("threshold");
        if (thresholdNode != null && !thresholdNode.isNull()) {
            if (!thresholdNode.isNumber()) {
                return Optional.empty();
            }
            threshold = thresholdNode.asDouble();
        }
        Map<Side, String> sideLabels = new EnumMap<>(Side.class);
        JsonNode sides = entry.path("sides");
        if (sides.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = sides.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                Side side = sideFor(field.getKey());
                if (side != null && field.getValue().isTextual()) {
                    sideLabels.put(side, field.getValue().asText());
                }
            }
        }
        return Optional.of(new ThreatTemplate(text, threshold, sideLabels));
    }

    // ── Helpers ────────────────────────────────────────────────────

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            return null;
        }
        return value.asText();
    }

    private static Side sideFor(String key) {
        return switch (key) {
            case "left"  -> Side.LEFT;
            case "right" -> Side.RIGHT;
            case "none"  -> Side.NONE;
            default      -> null;
        };
    }

    private static void warnFallback(String section, String key, String reason) {
        log.warn("[TemplateResolver] Template entry unusable, using default section={} key={} reason={}",
            section, key, reason);
    }
}
