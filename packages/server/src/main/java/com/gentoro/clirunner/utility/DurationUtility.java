package com.gentoro.clirunner.utility;

import com.gentoro.clirunner.exception.ConfigException;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.commons.configuration2.Configuration;

/**
 * Parses human-friendly durations such as {@code 500ms}, {@code 15s}, {@code 30m}, {@code 2h} or
 * {@code 1d}, as well as ISO-8601 durations ({@code PT30M}). A bare number is read as seconds.
 */
public final class DurationUtility {
  private static final Pattern SIMPLE = Pattern.compile("(\\d+)\\s*(ms|s|m|h|d)?");

  private DurationUtility() {}

  public static Duration parse(String text) {
    if (text == null || text.isBlank()) {
      throw new ConfigException("Duration value is empty");
    }
    String value = text.trim().toLowerCase(Locale.ROOT);
    if (value.startsWith("p")) {
      try {
        return Duration.parse(value.toUpperCase(Locale.ROOT));
      } catch (DateTimeParseException e) {
        throw new ConfigException("Invalid ISO-8601 duration: " + text, e);
      }
    }
    Matcher m = SIMPLE.matcher(value);
    if (!m.matches()) {
      throw new ConfigException("Invalid duration: " + text);
    }
    long amount = Long.parseLong(m.group(1));
    String unit = m.group(2) == null ? "s" : m.group(2);
    return switch (unit) {
      case "ms" -> Duration.ofMillis(amount);
      case "m" -> Duration.ofMinutes(amount);
      case "h" -> Duration.ofHours(amount);
      case "d" -> Duration.ofDays(amount);
      default -> Duration.ofSeconds(amount);
    };
  }

  /**
   * Read {@code key} as a strictly positive duration.
   *
   * @return {@code fallback} when the key is not set
   * @throws ConfigException when the value is malformed, zero or negative
   */
  public static Duration getPositive(Configuration config, String key, Duration fallback) {
    String raw = config.getString(key, null);
    if (raw == null) {
      return fallback;
    }
    Duration value = parse(raw);
    if (value.isZero() || value.isNegative()) {
      throw new ConfigException(key + " must be a positive duration, got: " + raw);
    }
    return value;
  }

  /** Render a duration using the largest unit that represents it exactly. */
  public static String format(Duration duration) {
    long millis = duration.toMillis();
    if (millis % 3_600_000 == 0 && millis > 0) return (millis / 3_600_000) + "h";
    if (millis % 60_000 == 0 && millis > 0) return (millis / 60_000) + "m";
    if (millis % 1000 == 0) return (millis / 1000) + "s";
    return millis + "ms";
  }
}
