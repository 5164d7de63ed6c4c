package com.flamingo.ai.researchcache.source;

/**
 * A child record of an item: either an attachment or a note.
 *
 * @param linkMode how an attachment is stored remotely; {@code linked_url} attachments have no
 *     bytes to download
 * @param note note body (HTML) for notes, otherwise {@code null}
 */
public record RemoteChild(
    String key,
    String itemType,
    long version,
    String title,
    String filename,
    String contentType,
    String linkMode,
    String note) {

  public static final String LINK_MODE_URL = "linked_url";

  public boolean isAttachment() {
    return RemoteItem.TYPE_ATTACHMENT.equals(itemType);
  }

  public boolean isNote() {
    return RemoteItem.TYPE_NOTE.equals(itemType);
  }

  public boolean hasDownloadableFile() {
    return isAttachment() && !LINK_MODE_URL.equals(linkMode);
  }
}
