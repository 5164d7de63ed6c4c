package com.flamingo.ai.researchcache.source;

import java.util.List;
import java.util.Map;

/**
 * A top-level item as returned by the remote library.
 *
 * @param metadata full remote record, kept opaque
 * @param collections keys of every collection the item belongs to
 * @param note note body for items of type {@code note}, otherwise {@code null}
 */
public record RemoteItem(
    String key,
    long version,
    String itemType,
    String title,
    String date,
    String url,
    Map<String, Object> metadata,
    List<String> collections,
    String note) {

  public static final String TYPE_NOTE = "note";
  public static final String TYPE_ATTACHMENT = "attachment";

  public boolean isNote() {
    return TYPE_NOTE.equals(itemType);
  }

  public boolean isAttachment() {
    return TYPE_ATTACHMENT.equals(itemType);
  }
}
