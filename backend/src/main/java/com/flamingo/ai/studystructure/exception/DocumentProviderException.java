package com.flamingo.ai.studystructure.exception;

/**
 * Thrown when the underlying document cannot be read: the bytes do not form a loadable document, or
 * a page, the outline or the metadata cannot be retrieved.
 *
 * <p>Extraction never retries or wraps this exception; it reaches the caller as raised.
 */
public class DocumentProviderException extends RuntimeException {

  private final int pageNumber;
  private final String userMessage;

  public DocumentProviderException(String message) {
    this(message, null, -1);
  }

  public DocumentProviderException(String message, Throwable cause) {
    this(message, cause, -1);
  }

  public DocumentProviderException(String message, Throwable cause, int pageNumber) {
    super(message, cause);
    this.pageNumber = pageNumber;
    this.userMessage = "Failed to read document";
  }

  /** Returns the 1-based page being read when the failure happened, or -1 if not page-specific. */
  public int getPageNumber() {
    return pageNumber;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
