package com.mineralink.harvester.util;

import java.math.BigDecimal;
import java.text.NumberFormat;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;
import java.util.stream.DoubleStream;
import org.apache.commons.lang3.StringUtils;
import org.locationtech.jts.geom.Envelope;

/**
 * Utilities for formatting values as strings.
 */
public class Format {

  public static final Locale DEFAULT_LOCALE = Locale.getDefault(Locale.Category.FORMAT);

  private static final ConcurrentMap<Locale, Format> instances = new ConcurrentHashMap<>();

  // `NumberFormat` instances are not thread safe, so we need to wrap them inside a `ThreadLocal`.
  @SuppressWarnings("java:S5164")
  private final ThreadLocal<NumberFormat> nf;

  private Format(Locale locale) {
    nf = ThreadLocal.withInitial(() -> {
      var f = NumberFormat.getNumberInstance(locale);
      f.setMaximumFractionDigits(1);
      return f;
    });
  }

  public static Format forLocale(Locale locale) {
    return instances.computeIfAbsent(locale, Format::new);
  }

  public static Format defaultInstance() {
    return forLocale(DEFAULT_LOCALE);
  }

  /**
   * Returns {@code value} in plain decimal notation, without exponent, the way map-service query parameters expect
   * them (i.e. {@code 0.00001} instead of {@code 1.0E-5}).
   */
  public static String plain(double value) {
    return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
  }

  /** Returns {@code xmin,ymin,xmax,ymax} for an envelope in plain decimal notation. */
  public static String envelope(Envelope envelope) {
    return DoubleStream.of(envelope.getMinX(), envelope.getMinY(), envelope.getMaxX(), envelope.getMaxY())
      .mapToObj(Format::plain)
      .collect(Collectors.joining(","));
  }

  /** Returns {@code str} followed by spaces up to {@code size} characters. */
  public static String padRight(String str, int size) {
    return StringUtils.rightPad(str, size);
  }

  /** Returns a number formatted with 1 decimal point. */
  public String decimal(double value) {
    return nf.get().format(value);
  }

  /** Returns a duration formatted like "1h2m" or "2m3s". */
  public String duration(Duration duration) {
    double seconds = duration.toNanos() * 1d / Duration.ofSeconds(1).toNanos();
    if (seconds < 1) {
      return decimal(seconds) + "s";
    }
    return Duration.ofSeconds(Math.round(seconds)).toString().replace("PT", "").toLowerCase(Locale.ROOT);
  }
}
