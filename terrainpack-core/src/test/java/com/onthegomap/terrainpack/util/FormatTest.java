package com.onthegomap.terrainpack.util;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class FormatTest {

  @ParameterizedTest
  @CsvSource({
    "0, 0B",
    "999, 999B",
    "1000, 1.0kB",
    "1234, 1.2kB",
    "12345, 12kB",
    "34000000, 34MB",
    "-1, -",
  })
  void testStorage(long bytes, String expected) {
    assertEquals(expected, Format.storage(bytes));
  }

  @ParameterizedTest
  @CsvSource({
    "7, 7",
    "1500, 1.5k",
    "63245, 63k",
    "2000000000, 2.0B",
  })
  void testCount(long value, String expected) {
    assertEquals(expected, Format.count(value));
  }

  @ParameterizedTest
  @CsvSource({
    "400, 0.4s",
    "12000, 12s",
    "62000, 1m2s",
    "3723000, 1h2m3s",
    "3600000, 1h0m0s",
  })
  void testDuration(long millis, String expected) {
    assertEquals(expected, Format.duration(Duration.ofMillis(millis)));
  }

  @ParameterizedTest
  @CsvSource({
    "abc, 5, 'abc  '",
    "abcdef, 3, abcdef",
  })
  void testPadRight(String text, int width, String expected) {
    assertEquals(expected, Format.padRight(text, width));
  }
}
