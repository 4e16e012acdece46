package com.gentoro.onerag.utility;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class StringUtilityTest {

  @Test
  @DisplayName("code fences are stripped with or without a language tag")
  void stripCodeFence() {
    assertEquals("{\"a\": 1}", StringUtility.stripCodeFence("```json\n{\"a\": 1}\n```"));
    assertEquals("{\"a\": 1}", StringUtility.stripCodeFence("```\n{\"a\": 1}\n```"));
    assertEquals("plain", StringUtility.stripCodeFence("  plain \n"));
    assertEquals("", StringUtility.stripCodeFence(null));
  }

  @Test
  @DisplayName("sha256 matches the known digest of the empty string")
  void sha256() {
    assertEquals(
        "e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855",
        StringUtility.sha256Hex(""));
    assertEquals(StringUtility.sha256Hex("abc"), StringUtility.sha256Hex("abc".getBytes()));
  }

  @Test
  @DisplayName("truncate and word count tolerate null")
  void truncateAndCount() {
    assertEquals("abc", StringUtility.truncate("abcdef", 3));
    assertEquals("ab", StringUtility.truncate("ab", 3));
    assertEquals("", StringUtility.truncate(null, 3));
    assertEquals(3, StringUtility.wordCount("  one two\tthree "));
    assertEquals(0, StringUtility.wordCount("   "));
    assertEquals(0, StringUtility.wordCount(null));
  }
}
