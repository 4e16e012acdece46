package com.gentoro.onerag.utility;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class StringUtility {
  private static final Pattern FENCED_BLOCK =
      Pattern.compile("(?s)```(?:[a-zA-Z0-9_-]+)?\\s*(.+?)\\s*```");

  private StringUtility() {}

  /**
   * Strips a surrounding markdown code fence (with or without a language tag). Text without a fence
   * is returned trimmed.
   */
  public static String stripCodeFence(String text) {
    if (text == null) return "";
    String trimmed = text.trim();
    Matcher matcher = FENCED_BLOCK.matcher(trimmed);
    if (matcher.find()) {
      return matcher.group(1).trim();
    }
    return trimmed;
  }

  /** First {@code maxChars} characters of {@code text}; never null. */
  public static String truncate(String text, int maxChars) {
    if (text == null) return "";
    return text.length() <= maxChars ? text : text.substring(0, maxChars);
  }

  public static String sha256Hex(String text) {
    return sha256Hex(text.getBytes(StandardCharsets.UTF_8));
  }

  public static String sha256Hex(byte[] bytes) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(bytes));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 algorithm not available", e);
    }
  }

  /** Whitespace-delimited word count, used as a cheap token approximation. */
  public static int wordCount(String text) {
    if (text == null) return 0;
    String trimmed = text.trim();
    return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
  }
}
