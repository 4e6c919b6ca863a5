package com.mk.fx.qa.loadster.utils;

import java.time.Duration;

public final class LoadUtils {

  private LoadUtils() {
    // Utility class, no instantiation
  }

  /**
   * Parses {@code 500ms}, {@code 5s}, {@code 2m} or {@code 1h}. A bare number is taken as seconds.
   *
   * @throws IllegalArgumentException if the value is blank, malformed or out of range
   */
  public static Duration parseDuration(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Duration must not be blank");
    }
    String trimmed = value.trim().toLowerCase();
    try {
      if (trimmed.endsWith("ms")) {
        long ms = Long.parseLong(trimmed.substring(0, trimmed.length() - 2).trim());
        return Duration.ofMillis(ms);
      }
      char unit = trimmed.charAt(trimmed.length() - 1);
      if (Character.isDigit(unit)) {
        return Duration.ofSeconds(Long.parseLong(trimmed));
      }
      long amount = Long.parseLong(trimmed.substring(0, trimmed.length() - 1).trim());
      return switch (unit) {
        case 's' -> Duration.ofSeconds(amount);
        case 'm' -> Duration.ofMinutes(amount);
        case 'h' -> Duration.ofHours(amount);
        default -> throw new IllegalArgumentException("Unrecognised duration unit in " + value);
      };
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid duration: " + value, e);
    } catch (ArithmeticException e) {
      throw new IllegalArgumentException("Duration out of range: " + value, e);
    }
  }
}
