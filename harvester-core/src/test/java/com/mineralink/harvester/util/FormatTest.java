package com.mineralink.harvester.util;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.Locale;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.locationtech.jts.geom.Envelope;

class FormatTest {

  @ParameterizedTest
  @CsvSource({
    "0, 0",
    "1, 1",
    "-82.8, -82.8",
    "37.0, 37",
    "40, 40",
    "0.00001, 0.00001",
    "-1.0E-7, -0.0000001",
    "1.0E10, 10000000000",
  })
  void testPlain(double value, String expected) {
    assertEquals(expected, Format.plain(value));
  }

  @Test
  void testEnvelope() {
    assertEquals("-82.8,37,-77.7,40.6", Format.envelope(new Envelope(-82.8, -77.7, 37.0, 40.6)));
  }

  @ParameterizedTest
  @CsvSource({
    "a,0,a",
    "a,2,'a '",
    "ab,3,'ab '",
    "abc,3,abc",
  })
  void testPadRight(String in, int size, String out) {
    assertEquals(out, Format.padRight(in, size));
  }

  @ParameterizedTest
  @CsvSource({
    "0,0s,en",
    "0.1,0.1s,en",
    "0.1,'0,1s',it",
    "59,59s,en",
    "61.1,1m1s,en",
    "3601,1h1s,en",
  })
  void testDuration(double seconds, String out, Locale locale) {
    assertEquals(out, Format.forLocale(locale).duration(Duration.ofNanos((long) (seconds * 1_000_000_000L))));
  }
}
