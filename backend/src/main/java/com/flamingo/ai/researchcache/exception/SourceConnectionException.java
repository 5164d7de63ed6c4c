package com.flamingo.ai.researchcache.exception;

/** Exception thrown when the remote source API cannot be reached. Aborts the current sync pass. */
public class SourceConnectionException extends RuntimeException {

  private final String userMessage;

  public SourceConnectionException(String message) {
    super(message);
    this.userMessage = "Remote library is unreachable. Check the connection and retry the sync.";
  }

  public SourceConnectionException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "Remote library is unreachable. Check the connection and retry the sync.";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
