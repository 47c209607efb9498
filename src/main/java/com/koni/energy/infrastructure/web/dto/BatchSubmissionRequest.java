package com.koni.energy.infrastructure.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Request body for manually announcing a batch to the pipeline.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class BatchSubmissionRequest {

    @NotBlank(message = "batch_locator is required")
    @JsonProperty("batch_locator")
    private String batchLocator;
}
