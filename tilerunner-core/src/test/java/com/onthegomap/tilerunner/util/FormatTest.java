package com.onthegomap.tilerunner.util;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.time.Duration;
import java.util.Locale;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class FormatTest {

  @ParameterizedTest
  @CsvSource(value = {
    "'',10,<empty>",
    "'  ',10,<empty>",
    "short,10,short",
    "0123456789abc,3,...abc",
    "'  padded  ',6,padded",
  })
  void testTail(String input, int max, String expected) {
    assertEquals(expected, Format.tail(input, max));
  }

  @ParameterizedTest
  @CsvSource({
    "0,0%",
    "0.254,25%",
    "1,100%",
  })
  void testPercent(double value, String expected) {
    assertEquals(expected, Format.forLocale(Locale.US).percent(value));
  }

  @ParameterizedTest
  @CsvSource({
    "0,0",
    "1.24,1.2",
    "1234.56,'1,234.6'",
  })
  void testDecimal(double value, String expected) {
    assertEquals(expected, Format.forLocale(Locale.US).decimal(value));
  }

  @ParameterizedTest
  @CsvSource({
    "1,1s",
    "59,59s",
    "60,1m",
    "61,1m1s",
    "3601,1h1s",
  })
  void testDuration(long seconds, String expected) {
    assertEquals(expected, Format.forLocale(Locale.US).duration(Duration.ofSeconds(seconds)));
  }
}
