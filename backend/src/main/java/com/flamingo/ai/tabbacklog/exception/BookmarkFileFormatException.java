package com.flamingo.ai.tabbacklog.exception;

/** Thrown when a bookmark export cannot be read as a bookmark file. Fatal to the import run. */
public class BookmarkFileFormatException extends RuntimeException {

  public BookmarkFileFormatException(String message) {
    super(message);
  }

  public BookmarkFileFormatException(String message, Throwable cause) {
    super(message, cause);
  }
}
