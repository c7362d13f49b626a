package com.onthegomap.terrainpack.util;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class ParseTest {

  @ParameterizedTest
  @CsvSource(value = {
    "null, null",
    "12, 12",
    "12 m, 12",
    "1.5km, 1500",
    "10 ft, 3.048",
    "2 MI, 3218.688",
    "1 nmi, 1852",
    "12 in, 0.3048",
    "12 furlongs, null",
    "abc, null",
  }, nullValues = "null")
  void testMeters(String input, Double expected) {
    Double actual = Parse.meters(input);
    if (expected == null) {
      assertNull(actual);
    } else {
      assertEquals(expected, actual, 1e-6);
    }
  }

  @ParameterizedTest
  @CsvSource(value = {
    "null, null",
    "3, 3",
    "3;4, 3",
    "-2, -2",
    "two, null",
  }, nullValues = "null")
  void testLeadingInteger(String input, Integer expected) {
    assertEquals(expected, Parse.leadingInteger(input));
  }

  @ParameterizedTest
  @CsvSource(value = {
    "null, null",
    "1.5, 1.5",
    " 2 , 2",
    "1.5m, null",
  }, nullValues = "null")
  void testDecimal(String input, Double expected) {
    assertEquals(expected, Parse.decimal(input));
  }

  @Test
  void testFeetAndInches() {
    assertEquals(15 * 0.3048 + 3 * 0.0254, Parse.meters("15'3\""), 1e-9);
    assertEquals(6 * 0.3048, Parse.meters("6'"), 1e-9);
    assertEquals(6 * 0.3048 + 0.0254, Parse.meters("6 ft 1 in"), 1e-9);
  }
}
