package com.flamingo.ai.researchcache.store;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/** SHA-256 digests rendered as lowercase hex, used to detect changed attachments and text. */
public final class ContentHashes {

  private ContentHashes() {}

  public static String sha256Hex(byte[] bytes) {
    return HexFormat.of().formatHex(digest().digest(bytes));
  }

  public static String sha256Hex(String text) {
    return sha256Hex(text.getBytes(StandardCharsets.UTF_8));
  }

  private static MessageDigest digest() {
    try {
      return MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException e) {
      // every JRE ships SHA-256
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
