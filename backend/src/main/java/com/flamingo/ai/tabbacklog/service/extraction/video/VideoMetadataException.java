package com.flamingo.ai.tabbacklog.service.extraction.video;

/** Thrown when the video metadata tool fails, times out or prints something that is not JSON. */
public class VideoMetadataException extends RuntimeException {

  public VideoMetadataException(String message) {
    super(message);
  }

  public VideoMetadataException(String message, Throwable cause) {
    super(message, cause);
  }
}
