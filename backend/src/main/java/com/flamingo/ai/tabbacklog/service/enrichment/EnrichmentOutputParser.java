package com.flamingo.ai.tabbacklog.service.enrichment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.tabbacklog.agent.dto.EnrichmentOutput;
import com.flamingo.ai.tabbacklog.exception.EnrichmentValidationException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.util.Comparator;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Parses raw model replies into {@link EnrichmentOutput} and checks them against its schema. */
@Component
@RequiredArgsConstructor
public class EnrichmentOutputParser {

  private final ObjectMapper objectMapper;
  private final Validator validator;

  /**
   * Parses and validates one reply.
   *
   * @throws EnrichmentValidationException if the reply is empty, not JSON, or violates the schema
   */
  public EnrichmentOutput parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new EnrichmentValidationException("Model returned an empty response", raw);
    }

    EnrichmentOutput output;
    try {
      output = objectMapper.readValue(stripCodeFence(raw), EnrichmentOutput.class);
    } catch (JsonProcessingException e) {
      throw new EnrichmentValidationException(
          "Model output is not valid JSON: " + e.getOriginalMessage(), raw, e);
    }
    if (output == null) {
      throw new EnrichmentValidationException("Model output is not a JSON object", raw);
    }
    if (output.summary() != null) {
      output =
          new EnrichmentOutput(
              output.summary().trim(),
              output.contentType(),
              output.tags(),
              output.projects(),
              output.estReadMinutes(),
              output.priority());
    }

    Set<ConstraintViolation<EnrichmentOutput>> violations = validator.validate(output);
    if (!violations.isEmpty()) {
      String message =
          violations.stream()
              .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
              .map(v -> v.getPropertyPath() + " " + v.getMessage())
              .collect(Collectors.joining("; "));
      throw new EnrichmentValidationException("Model output failed validation: " + message, raw);
    }
    return output;
  }

  /** Removes a surrounding markdown code fence, which some models add despite JSON mode. */
  static String stripCodeFence(String raw) {
    String text = raw.trim();
    if (!text.startsWith("```")) {
      return text;
    }
    int firstNewline = text.indexOf('\n');
    if (firstNewline < 0) {
      return text;
    }
    text = text.substring(firstNewline + 1);
    if (text.endsWith("```")) {
      text = text.substring(0, text.length() - 3);
    }
    return text.trim();
  }
}
