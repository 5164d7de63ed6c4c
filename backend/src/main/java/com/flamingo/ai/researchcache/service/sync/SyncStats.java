package com.flamingo.ai.researchcache.service.sync;

import lombok.Getter;
import lombok.ToString;

/** Counters of one sync pass. Partial when {@link #isAborted()} is set. */
@Getter
@ToString
public class SyncStats {

  private final String collectionKey;
  private final SyncMode mode;
  private int collectionsSynced;
  private int itemsSynced;
  private int attachmentsDownloaded;
  private int attachmentsSkipped;
  private int contentExtracted;
  private int notesSynced;
  private int orphansRemoved;
  private int skipped;
  private int errors;
  private boolean aborted;

  public SyncStats(String collectionKey, SyncMode mode) {
    this.collectionKey = collectionKey;
    this.mode = mode;
  }

  /** Records successfully written (collections, items and notes). */
  public int processed() {
    return collectionsSynced + itemsSynced + notesSynced;
  }

  void collectionSynced() {
    collectionsSynced++;
  }

  void itemSynced() {
    itemsSynced++;
  }

  void attachmentDownloaded() {
    attachmentsDownloaded++;
  }

  void attachmentSkipped() {
    attachmentsSkipped++;
  }

  void contentExtracted() {
    contentExtracted++;
  }

  void noteSynced() {
    notesSynced++;
  }

  void orphansRemoved(int count) {
    orphansRemoved += count;
  }

  void skipped() {
    skipped++;
  }

  void error() {
    errors++;
  }

  void abort() {
    aborted = true;
  }
}
