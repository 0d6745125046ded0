package com.flamingo.ai.tabbacklog.agent.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import java.util.List;

/**
 * Structured output from {@link com.flamingo.ai.tabbacklog.agent.TabEnrichmentAgent}. Tags and
 * projects are not bounded here: over-long lists are clamped after validation, not rejected.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EnrichmentOutput(
    @NotBlank @Size(min = 10, max = 500) String summary,
    @JsonProperty("content_type")
        @NotBlank
        @Pattern(regexp = "(?i)article|video|paper|code_repo|reference|misc")
        String contentType,
    List<String> tags,
    List<String> projects,
    @JsonProperty("est_read_min") @Min(1) @Max(600) Integer estReadMinutes,
    @Pattern(regexp = "(?i)high|medium|low") String priority) {}
