package com.climbassessment.common.template;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Substitutes {@code {name}} placeholders. Numbers render as integers when
 * whole and with one decimal otherwise; other values via {@code toString()}.
 *
 * <p>If any placeholder has no value the literal template is returned
 * unrendered and a warning is logged; rendering never throws.
 */
public final class PlaceholderRenderer {

    private static final Logger log = LoggerFactory.getLogger(PlaceholderRenderer.class);

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z_][A-Za-z0-9_]*)}");

    /**
     * @param key      identifies the template in log output ({@code hip_position.poor.weakness}, ...)
     * @param template text with placeholders
     * @param values   placeholder values
     */
    public String render(String key, String template, Map<String, ?> values) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1);
            Object value = values.get(name);
            if (value == null) {
                log.warn("[PlaceholderRenderer] Missing placeholder, returning unrendered template key={} placeholder={}",
                    key, name);
                return template;
            }
            matcher.appendReplacement(out, Matcher.quoteReplacement(format(value)));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    static String format(Object value) {
        if (value instanceof Number number) {
            double d = number.doubleValue();
            if (d == Math.rint(d) && !Double.isInfinite(d)) {
                return Long.toString((long) d);
            }
            return String.format(Locale.ROOT, "%.1f", d);
        }
        return value.toString();
    }
}
