package com.flamingo.ai.tabbacklog.api.dto.response;

import com.flamingo.ai.tabbacklog.domain.entity.ExtractedContent;
import com.flamingo.ai.tabbacklog.service.extraction.model.ParsedPage;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for extracted page content. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParsedPageResponse {

  private String siteKind;
  private String title;
  private String textFull;
  private int wordCount;
  private Integer videoSeconds;
  private Map<String, Object> metadata;

  public static ParsedPageResponse fromPage(ParsedPage page) {
    return ParsedPageResponse.builder()
        .siteKind(page.siteKind())
        .title(page.title())
        .textFull(page.textFull())
        .wordCount(page.wordCount())
        .videoSeconds(page.videoSeconds())
        .metadata(page.metadata())
        .build();
  }

  public static ParsedPageResponse fromEntity(ExtractedContent content) {
    return ParsedPageResponse.builder()
        .siteKind(content.getSiteKind())
        .title(content.getTitle())
        .textFull(content.getTextFull())
        .wordCount(content.getWordCount())
        .videoSeconds(content.getVideoSeconds())
        .metadata(content.getMetadata())
        .build();
  }
}
