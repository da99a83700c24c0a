package com.wxradar.common.location;

/**
 * Syntactic checks for ICAO location codes.
 *
 * <p>A valid code is exactly four characters: an uppercase ASCII letter followed by three
 * uppercase ASCII letters or digits ({@code [A-Z][A-Z0-9]{3}}).
 */
public final class LocationCodes {
  public static final int LENGTH = 4;

  private LocationCodes() {}

  /**
   * Checks a string against the ICAO location code shape.
   *
   * @param code candidate code, may be {@code null}
   * @return {@code true} when every character matches the pattern
   */
  public static boolean isValid(String code) {
    if (code == null || code.length() != LENGTH) {
      return false;
    }
    if (!isUpperLetter(code.charAt(0))) {
      return false;
    }
    for (int i = 1; i < LENGTH; i++) {
      char c = code.charAt(i);
      if (!isUpperLetter(c) && !isDigit(c)) {
        return false;
      }
    }
    return true;
  }

  private static boolean isUpperLetter(char c) {
    return c >= 'A' && c <= 'Z';
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }
}
