package com.onthegomap.tilerunner.merge;

import com.onthegomap.tilerunner.geojson.GeoJsonFeature;
import java.util.Objects;

/**
 * Decides which fragments from different tiles belong to the same real-world feature and get dissolved together.
 * <p>
 * Returning {@code null} from {@link #identity(GeoJsonFeature)} means the feature has no identity and is never merged
 * with anything else.
 */
@FunctionalInterface
public interface DissolveStrategy {

  Object identity(GeoJsonFeature feature);

  /** Every fragment is dissolved with every other one it touches, like dissolving on a constant column. */
  static DissolveStrategy all() {
    return new Named("all", feature -> Boolean.TRUE);
  }

  /** Fragments with the same value of {@code attribute} are dissolved together. */
  static DissolveStrategy byAttribute(String attribute) {
    return new Named("by " + attribute, feature -> normalize(feature.getTag(attribute)));
  }

  /**
   * Fragments are grouped by {@code primary}, falling back to {@code fallback} when the primary attribute is missing,
   * for example {@code b_cat ?? a_cat} when comparing two datasets.
   */
  static DissolveStrategy coalesce(String primary, String fallback) {
    return new Named(primary + " ?? " + fallback, feature -> {
      Object value = normalize(feature.getTag(primary));
      return value != null ? value : normalize(feature.getTag(fallback));
    });
  }

  // 3 and 3.0 read from different tiles must be the same identity
  private static Object normalize(Object value) {
    if (value instanceof Number number) {
      double d = number.doubleValue();
      return d == Math.rint(d) && !Double.isInfinite(d) ? (Object) (long) d : (Object) d;
    } else if (value instanceof String string && string.isBlank()) {
      return null;
    }
    return value;
  }

  /** A strategy with a readable name for logs. */
  record Named(String name, DissolveStrategy delegate) implements DissolveStrategy {

    public Named {
      Objects.requireNonNull(delegate);
    }

    @Override
    public Object identity(GeoJsonFeature feature) {
      return delegate.identity(feature);
    }

    @Override
    public String toString() {
      return name;
    }
  }
}
