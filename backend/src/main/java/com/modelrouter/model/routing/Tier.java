package com.modelrouter.model.routing;

import com.fasterxml.jackson.annotation.JsonValue;
import com.modelrouter.exception.InvalidTierException;

import java.util.Locale;

public enum Tier {
    BASIC("basic"),
    PREMIUM("premium"),
    ENTERPRISE("enterprise");

    private final String code;

    Tier(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static Tier parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidTierException(raw);
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (Tier tier : values()) {
            if (tier.code.equals(normalized)) {
                return tier;
            }
        }
        throw new InvalidTierException(raw);
    }
}
