package com.onthegomap.tilerunner.util;

import java.text.NumberFormat;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Utilities for formatting values as strings.
 */
public class Format {

  public static final Locale DEFAULT_LOCALE = Locale.getDefault(Locale.Category.FORMAT);

  private static final ConcurrentMap<Locale, Format> instances = new ConcurrentHashMap<>();

  // `NumberFormat` instances are not thread safe, so we need to wrap them inside a `ThreadLocal`.
  @SuppressWarnings("java:S5164")
  private final ThreadLocal<NumberFormat> pf;
  @SuppressWarnings("java:S5164")
  private final ThreadLocal<NumberFormat> nf;

  private Format(Locale locale) {
    pf = ThreadLocal.withInitial(() -> {
      var f = NumberFormat.getPercentInstance(locale);
      f.setMaximumFractionDigits(0);
      return f;
    });
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
   * Returns the last {@code maxChars} characters of {@code text}, prefixed with {@code "..."} when something was cut
   * off, or {@code "<empty>"} for blank text.
   */
  public static String tail(String text, int maxChars) {
    if (text == null || text.isBlank()) {
      return "<empty>";
    }
    String stripped = text.strip();
    return stripped.length() <= maxChars ? stripped : "..." + stripped.substring(stripped.length() - maxChars);
  }

  /** Returns 0.0-1.0 as a "0%" - "100%" with no decimal points. */
  public String percent(double value) {
    return pf.get().format(value);
  }

  /** Returns a number formatted with 1 decimal point. */
  public String decimal(double value) {
    return nf.get().format(value);
  }

  /** Returns a duration formatted like "1h2m" or "2m3s". */
  public String duration(Duration duration) {
    Duration simplified;
    double seconds = duration.toNanos() * 1d / Duration.ofSeconds(1).toNanos();
    if (seconds < 1) {
      return decimal(seconds) + "s";
    } else {
      simplified = Duration.ofSeconds(Math.round(seconds));
    }
    return simplified.toString().replace("PT", "").toLowerCase(Locale.ROOT);
  }
}
