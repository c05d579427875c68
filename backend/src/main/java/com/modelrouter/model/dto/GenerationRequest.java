package com.modelrouter.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenerationRequest {

    public static final int MAX_PROMPT_LENGTH = 100000;

    @NotBlank(message = "Prompt is required")
    @Size(max = MAX_PROMPT_LENGTH, message = "Prompt too long")
    private String prompt;

    /** Validated by the gateway, which answers an unknown tier with an InvalidTier result. */
    @JsonProperty("customer_tier")
    private String customerTier;

    @JsonProperty("complexity_hint")
    private Double complexityHint;
}
