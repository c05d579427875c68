package com.modelrouter.service;

import com.modelrouter.model.routing.ComplexityScore;
import com.modelrouter.model.routing.RoutingRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Estimates how demanding a prompt is, from its text alone.
 * <p>
 * The score is a weighted sum of content features clamped to [0,1]; an explicit hint from
 * the caller is averaged in. No I/O, and no input makes it fail: anything it cannot read is
 * treated as the simplest possible request.
 */
@Component
@Slf4j
public class ComplexityClassifier {

    static final double LENGTH_WEIGHT = 0.35;
    static final double CODE_WEIGHT = 0.25;
    static final double STRUCTURED_WEIGHT = 0.15;
    static final double REASONING_WEIGHT = 0.25;
    static final double SIMPLE_PENALTY = 0.15;

    private static final int LENGTH_SATURATION_WORDS = 200;
    private static final int SHORT_PROMPT_WORDS = 12;
    private static final int REASONING_SATURATION_HITS = 2;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Pattern CODE_MARKERS = Pattern.compile(
            "```|\\bdef\\s+\\w+\\s*\\(|\\bclass\\s+[A-Z]\\w*|\\bfunction\\s+\\w+\\s*\\(|"
                    + "\\bpublic\\s+static\\b|#include\\s*<|\\bimport\\s+[\\w.]+;|"
                    + "(?i:\\bselect\\b.+\\bfrom\\b)|\\{[^{}]*;[^{}]*}");

    private static final Pattern STRUCTURED_MARKERS = Pattern.compile(
            "\\b(json|yaml|xml|csv|table|schema)\\b", Pattern.CASE_INSENSITIVE);

    private static final List<String> REASONING_KEYWORDS = List.of(
            "analyze", "analyse", "design", "develop", "implement", "architecture",
            "algorithm", "optimiz", "integration", "framework", "strategy", "technical",
            "production", "database", "refactor", "prove", "trade-off");

    private static final List<String> SIMPLE_KEYWORDS = List.of(
            "hello", "hi", "hey", "what is", "how to", "quick", "simple", "basic", "thanks");

    public ComplexityScore score(RoutingRequest request) {
        if (request == null || request.getPrompt() == null || request.getPrompt().isBlank()) {
            return ComplexityScore.minimum();
        }
        try {
            return compute(request.getPrompt(), request.getComplexityHint());
        } catch (RuntimeException e) {
            log.warn("Classification degraded for request {}, using minimum score", request.getId(), e);
            return ComplexityScore.minimum();
        }
    }

    private ComplexityScore compute(String prompt, Double hint) {
        String lower = prompt.toLowerCase(Locale.ROOT);
        int words = WHITESPACE.split(prompt.trim()).length;

        Map<String, Double> breakdown = new LinkedHashMap<>();
        breakdown.put("length", Math.min(1.0, (double) words / LENGTH_SATURATION_WORDS) * LENGTH_WEIGHT);
        breakdown.put("code", CODE_MARKERS.matcher(prompt).find() ? CODE_WEIGHT : 0.0);
        breakdown.put("structured_output", STRUCTURED_MARKERS.matcher(prompt).find() ? STRUCTURED_WEIGHT : 0.0);

        long reasoningHits = REASONING_KEYWORDS.stream().filter(lower::contains).count();
        breakdown.put("reasoning",
                Math.min(1.0, (double) reasoningHits / REASONING_SATURATION_HITS) * REASONING_WEIGHT);

        boolean simpleIntent = words <= SHORT_PROMPT_WORDS && containsSimpleKeyword(lower);
        breakdown.put("simple_intent", simpleIntent ? -SIMPLE_PENALTY : 0.0);

        double content = clamp(breakdown.values().stream().mapToDouble(Double::doubleValue).sum());

        double value = content;
        if (hint != null) {
            if (Double.isFinite(hint) && hint >= ComplexityScore.MIN && hint <= ComplexityScore.MAX) {
                breakdown.put("hint", hint);
                value = (content + hint) / 2.0;
            } else {
                log.debug("Ignoring out-of-range complexity hint {}", hint);
            }
        }
        return new ComplexityScore(value, Collections.unmodifiableMap(breakdown), false);
    }

    // whole words only: "hi" must not match "this"
    private static boolean containsSimpleKeyword(String lower) {
        String padded = " " + lower.replaceAll("[^a-z0-9 ]", " ") + " ";
        return SIMPLE_KEYWORDS.stream().anyMatch(k -> padded.contains(" " + k + " "));
    }

    private static double clamp(double value) {
        return Math.max(ComplexityScore.MIN, Math.min(ComplexityScore.MAX, value));
    }
}
