package com.modelrouter.exception;

import lombok.Getter;

@Getter
public class InvalidTierException extends RoutingException {

    private final String tier;

    public InvalidTierException(String tier) {
        super(ErrorKind.INVALID_TIER, "Unknown customer tier: " + tier);
        this.tier = tier;
    }
}
