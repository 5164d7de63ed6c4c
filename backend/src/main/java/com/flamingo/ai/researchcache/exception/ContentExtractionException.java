package com.flamingo.ai.researchcache.exception;

/** Exception thrown when text extraction from an attachment fails. */
public class ContentExtractionException extends RuntimeException {

  private final String attachmentKey;
  private final String userMessage;

  public ContentExtractionException(String attachmentKey, String message) {
    super(message);
    this.attachmentKey = attachmentKey;
    this.userMessage = "Failed to extract text from attachment";
  }

  public ContentExtractionException(String attachmentKey, String message, Throwable cause) {
    super(message, cause);
    this.attachmentKey = attachmentKey;
    this.userMessage = "Failed to extract text from attachment";
  }

  public String getAttachmentKey() {
    return attachmentKey;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
