package com.flamingo.ai.researchcache.domain.enums;

/** Local availability of an attachment's bytes. */
public enum FileStatus {
  /** Blob file present at the recorded path. */
  AVAILABLE,
  /** Never downloaded, no local path recorded. */
  NOT_DOWNLOADED,
  /** A local path is recorded but the file is gone. Treated as a cache miss. */
  MISSING
}
