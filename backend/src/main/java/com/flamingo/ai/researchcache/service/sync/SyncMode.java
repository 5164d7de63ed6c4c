package com.flamingo.ai.researchcache.service.sync;

/** How much of the remote library a sync pass re-transfers. */
public enum SyncMode {
  /** Re-fetch all metadata and re-download every attachment. */
  FULL,
  /**
   * Re-fetch all metadata; keep attachment bytes whose remote version is unchanged and whose blob
   * file is still on disk.
   */
  INCREMENTAL
}
