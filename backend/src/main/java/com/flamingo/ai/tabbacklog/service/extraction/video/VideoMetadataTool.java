package com.flamingo.ai.tabbacklog.service.extraction.video;

import com.fasterxml.jackson.databind.JsonNode;

/** Source of structured metadata for a video URL. */
public interface VideoMetadataTool {

  /**
   * Looks up metadata for one video.
   *
   * @return the metadata as a JSON object, never null
   * @throws VideoMetadataException on any failure, including timeouts and output that is not a
   *     JSON object
   */
  JsonNode fetch(String url);
}
