package com.modelrouter.service;

import com.modelrouter.config.RouterProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

@Component
@RequiredArgsConstructor
public class ResponseTextCleaner {

    static final String EMPTY_PLACEHOLDER = "Completed.";

    private static final List<Pattern> FILLER_PATTERNS = List.of(
            "I understand[^.!?]*[.!]",
            "I'm sorry[^.!?]*[.!]",
            "I hope[^.!?]*[.!]",
            "Please let me know[^.!?]*[.!]",
            "Thank you[^.!?]*[.!]",
            "I appreciate[^.!?]*[.!]",
            "I'm happy[^.!?]*[.!]",
            "I'd be glad[^.!?]*[.!]",
            "Feel free[^.!?]*[.!]",
            "Don't hesitate[^.!?]*[.!]"
    ).stream().map(p -> Pattern.compile(p, Pattern.CASE_INSENSITIVE)).toList();

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final RouterProperties properties;

    public String clean(String text) {
        if (!properties.getResponse().isCleanFiller()) {
            return text;
        }
        String cleaned = text != null ? text : "";
        for (Pattern pattern : FILLER_PATTERNS) {
            cleaned = pattern.matcher(cleaned).replaceAll("");
        }
        cleaned = WHITESPACE.matcher(cleaned).replaceAll(" ").trim();
        return cleaned.isEmpty() ? EMPTY_PLACEHOLDER : cleaned;
    }
}
