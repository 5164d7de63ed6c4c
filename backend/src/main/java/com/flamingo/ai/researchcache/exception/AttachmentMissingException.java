package com.flamingo.ai.researchcache.exception;

import java.nio.file.Path;

/**
 * Exception thrown when attachment metadata points at a blob file that is no longer on disk.
 *
 * <p>Callers treat this as a cache miss and re-download, never as corruption.
 */
public class AttachmentMissingException extends RuntimeException {

  private final String attachmentKey;
  private final transient Path expectedPath;

  public AttachmentMissingException(String attachmentKey, Path expectedPath) {
    super("Attachment " + attachmentKey + " is not available locally at " + expectedPath);
    this.attachmentKey = attachmentKey;
    this.expectedPath = expectedPath;
  }

  public String getAttachmentKey() {
    return attachmentKey;
  }

  public Path getExpectedPath() {
    return expectedPath;
  }
}
