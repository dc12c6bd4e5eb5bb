package com.gentoro.clirunner.utility;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.clirunner.exception.ConfigException;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class DurationUtilityTest {

  @Test
  void parsesShortForms() {
    assertEquals(Duration.ofMillis(500), DurationUtility.parse("500ms"));
    assertEquals(Duration.ofSeconds(15), DurationUtility.parse("15s"));
    assertEquals(Duration.ofMinutes(30), DurationUtility.parse("30m"));
    assertEquals(Duration.ofHours(2), DurationUtility.parse("2h"));
    assertEquals(Duration.ofDays(1), DurationUtility.parse("1d"));
    assertEquals(Duration.ofSeconds(45), DurationUtility.parse("45"));
    assertEquals(Duration.ofMinutes(5), DurationUtility.parse(" 5 M "));
  }

  @Test
  void parsesIso8601() {
    assertEquals(Duration.ofMinutes(30), DurationUtility.parse("PT30M"));
    assertEquals(Duration.ofSeconds(90), DurationUtility.parse("pt1m30s"));
  }

  @Test
  void rejectsGarbage() {
    assertThrows(ConfigException.class, () -> DurationUtility.parse(null));
    assertThrows(ConfigException.class, () -> DurationUtility.parse(""));
    assertThrows(ConfigException.class, () -> DurationUtility.parse("soon"));
    assertThrows(ConfigException.class, () -> DurationUtility.parse("-5s"));
    assertThrows(ConfigException.class, () -> DurationUtility.parse("PTX"));
  }

  @Test
  void formatsWithLargestExactUnit() {
    assertEquals("30m", DurationUtility.format(Duration.ofMinutes(30)));
    assertEquals("2h", DurationUtility.format(Duration.ofHours(2)));
    assertEquals("90s", DurationUtility.format(Duration.ofSeconds(90)));
    assertEquals("250ms", DurationUtility.format(Duration.ofMillis(250)));
    assertEquals("0s", DurationUtility.format(Duration.ZERO));
  }
}
