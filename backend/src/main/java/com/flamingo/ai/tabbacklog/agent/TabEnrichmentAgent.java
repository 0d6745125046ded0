package com.flamingo.ai.tabbacklog.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * Structured-output predictor that classifies and summarises one saved tab.
 *
 * <p>The reply is a JSON object matching {@link
 * com.flamingo.ai.tabbacklog.agent.dto.EnrichmentOutput}; it is returned as text and validated by
 * the caller.
 */
public interface TabEnrichmentAgent {

  @SystemMessage(
      """
        You analyze web content a user saved for later and produce metadata to organize it.
        Return ONLY a JSON object with these fields:

        "summary": a brief 2-3 sentence summary of the content (10-500 characters).
        "content_type": exactly one of "article", "video", "paper", "code_repo", "reference",
           "misc".
        "tags": 3-5 relevant tags starting with # (for example "#tutorial", "#longread",
           "#video").
        "projects": related project categories chosen from "argumentation_on_the_web",
           "democratic_economic_planning", "other_research", "personal", "work".
        "est_read_min": estimated reading or watching time in whole minutes (1-600), or null.
        "priority": "high", "medium" or "low" based on how important the content looks, or null.
        """)
  @UserMessage(
      """
        URL: {{url}}
        Title: {{title}}
        Site kind: {{siteKind}}
        Word count: {{wordCount}}
        Video seconds: {{videoSeconds}}

        Content:
        {{text}}
        """)
  String enrich(
      @V("url") String url,
      @V("title") String title,
      @V("siteKind") String siteKind,
      @V("text") String text,
      @V("wordCount") int wordCount,
      @V("videoSeconds") int videoSeconds);
}
