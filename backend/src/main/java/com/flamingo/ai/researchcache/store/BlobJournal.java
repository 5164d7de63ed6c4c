package com.flamingo.ai.researchcache.store;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Blob replacements made by the running transaction. They are kept when it commits and undone,
 * newest first, when it or one of its savepoints rolls back.
 */
final class BlobJournal {

  private final Deque<AttachmentFileStore.BlobReplacement> entries = new ArrayDeque<>();

  int size() {
    return entries.size();
  }

  void record(AttachmentFileStore.BlobReplacement replacement) {
    entries.addLast(replacement);
  }

  void rollbackTo(int mark) {
    while (entries.size() > mark) {
      entries.pollLast().undo();
    }
  }

  void commit() {
    entries.forEach(AttachmentFileStore.BlobReplacement::commit);
    entries.clear();
  }
}
