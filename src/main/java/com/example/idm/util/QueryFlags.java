package com.example.idm.util;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * Decoding and encoding of legacy query-string style boolean flags.
 * Callers historically pass {@code forceLogin=yes}; the core works with plain booleans.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class QueryFlags {

  public static final String YES = "yes";

  /**
   * Decode a flag value. {@code Boolean.TRUE} and the literal {@code "yes"} are true,
   * as is {@code "true"}; everything else, including {@code null}, is false.
   */
  public static boolean decode(Object value) {
    if (value instanceof Boolean flag) {
      return flag;
    }
    if (value instanceof String text) {
      return YES.equalsIgnoreCase(text.trim()) || "true".equalsIgnoreCase(text.trim());
    }
    return false;
  }

  /**
   * Encode a flag for a query string: {@code "yes"} when set, otherwise {@code null} so the
   * parameter is omitted.
   */
  public static String encode(boolean flag) {
    return flag ? YES : null;
  }
}
