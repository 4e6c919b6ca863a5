package com.mk.fx.qa.loadster.utils;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class LoadUtilsTest {

  @Test
  void parseDuration_supportsUnits() {
    assertEquals(Duration.ofMillis(250), LoadUtils.parseDuration("250ms"));
    assertEquals(Duration.ofSeconds(5), LoadUtils.parseDuration("5s"));
    assertEquals(Duration.ofMinutes(2), LoadUtils.parseDuration("2m"));
    assertEquals(Duration.ofHours(1), LoadUtils.parseDuration("1H"));
  }

  @Test
  void parseDuration_bareNumberIsSeconds() {
    assertEquals(Duration.ofSeconds(30), LoadUtils.parseDuration(" 30 "));
  }

  @Test
  void parseDuration_rejectsMalformed() {
    assertThrows(IllegalArgumentException.class, () -> LoadUtils.parseDuration(null));
    assertThrows(IllegalArgumentException.class, () -> LoadUtils.parseDuration(" "));
    assertThrows(IllegalArgumentException.class, () -> LoadUtils.parseDuration("fast"));
    assertThrows(IllegalArgumentException.class, () -> LoadUtils.parseDuration("5d"));
    assertThrows(IllegalArgumentException.class, () -> LoadUtils.parseDuration("ms"));
  }

  @Test
  void parseDuration_outOfRange_isIllegalArgument() {
    assertThrows(IllegalArgumentException.class, () -> LoadUtils.parseDuration("9999999999999999h"));
    assertThrows(IllegalArgumentException.class, () -> LoadUtils.parseDuration("99999999999999999999"));
  }
}
