package com.helmet.corpus.generator;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pattern-based reader of the health-economic values stated in a sentence. Each known field has
 * an ordered list of patterns; the first pattern that matches wins and its first group is the value.
 */
@Component
public class HealthEconomicFieldExtractor {

    private static final String AMOUNT = "\\d[\\d,]*(?:\\.\\d+)?";
    private static final String VERBS =
        "reduced|increased|improved|lowered|decreased|saved|yielded|dominated|resulted|provided|showed|led|was|is|were|are";

    private static final Map<String, List<Pattern>> PATTERNS = new LinkedHashMap<>();

    static {
        PATTERNS.put("treatment", List.of(
            Pattern.compile("^\\s*(?:The\\s+)?([A-Z][\\w-]*(?:\\s+(?:[A-Z0-9][\\w-]*|plus|\\+))*?)\\s+(?:" + VERBS + ")\\b"),
            Pattern.compile("(?i:treatment|therapy|therapies) with ([A-Z][\\w-]*(?:\\s+[A-Z0-9][\\w-]*)*)")
        ));
        PATTERNS.put("cost", List.of(
            Pattern.compile("((?:US)?[$€£]\\s?" + AMOUNT + "(?:\\s?(?:million|billion|[kKmM]\\b))?)"),
            Pattern.compile("(" + AMOUNT + "\\s?(?:USD|EUR|GBP)\\b)")
        ));
        PATTERNS.put("qaly", List.of(
            Pattern.compile("(\\d+(?:\\.\\d+)?)\\s+(?:incremental\\s+)?QALYs?\\b"),
            Pattern.compile("QALYs?\\b[^.\\d$€£]{0,40}?(\\d+(?:\\.\\d+)?)")
        ));
        PATTERNS.put("icer", List.of(
            Pattern.compile("(?:ICER|incremental cost-effectiveness ratio)[^.\\d$€£]{0,40}?((?:[$€£]\\s?)?" + AMOUNT + ")")
        ));
        PATTERNS.put("perspective", List.of(
            Pattern.compile("(?:from\\s+(?:the|a|an)\\s+)?([A-Za-z][\\w-]*(?:\\s+[A-Za-z][\\w-]*)?)\\s+perspective\\b")
        ));
        PATTERNS.put("time_horizon", List.of(
            Pattern.compile("(\\d+[-\\s](?:year|month|week|day)s?|lifetime)\\s+(?:time\\s+)?horizon\\b"),
            Pattern.compile("horizon of (\\d+\\s+(?:years?|months?|weeks?|days?))")
        ));
    }

    /**
     * Values found for the requested fields, in request order. Fields without a match, or without
     * a known pattern, are left out.
     */
    public Map<String, String> extract(String text, List<String> fields) {
        Map<String, String> values = new LinkedHashMap<>();
        if (text == null || text.isBlank()) {
            return values;
        }
        for (String field : fields) {
            find(text, field).ifPresent(value -> values.put(field, value));
        }
        return values;
    }

    public Optional<String> find(String text, String field) {
        for (Pattern pattern : PATTERNS.getOrDefault(field, List.of())) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                return Optional.of(matcher.group(1).trim());
            }
        }
        return Optional.empty();
    }
}
