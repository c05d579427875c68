package com.modelrouter.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.modelrouter.exception.ErrorKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;

@Getter
@Builder
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GenerationResult {

    public static final String STATUS_SUCCESS = "success";
    public static final String STATUS_ERROR = "error";

    private final String status;
    private final String text;

    @JsonProperty("model_used")
    private final String modelUsed;

    @JsonProperty("latency_ms")
    private final Long latencyMs;

    private final BigDecimal cost;

    @JsonProperty("error_kind")
    private final ErrorKind errorKind;

    private final String message;

    public static GenerationResult success(String text, String modelUsed, long latencyMs, BigDecimal cost) {
        return GenerationResult.builder()
                .status(STATUS_SUCCESS)
                .text(text)
                .modelUsed(modelUsed)
                .latencyMs(latencyMs)
                .cost(cost)
                .build();
    }

    public static GenerationResult error(ErrorKind kind, String message) {
        return GenerationResult.builder()
                .status(STATUS_ERROR)
                .errorKind(kind)
                .message(message)
                .build();
    }

    @JsonIgnore
    public boolean isSuccess() {
        return STATUS_SUCCESS.equals(status);
    }
}
