package com.onthegomap.tilerunner.geojson;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.locationtech.jts.geom.Geometry;

/**
 * One feature of a tile output or a merged layer: a geometry plus its attributes.
 * <p>
 * Attribute order is preserved so every output keeps a stable column order.
 */
public record GeoJsonFeature(Geometry geometry, Map<String, Object> tags) {

  public GeoJsonFeature {
    tags = Collections.unmodifiableMap(new LinkedHashMap<>(tags));
  }

  public Object getTag(String key) {
    return tags.get(key);
  }

  public boolean hasTag(String key) {
    return tags.get(key) != null;
  }

  /** Returns a copy of this feature with {@code key} set to {@code value}. */
  public GeoJsonFeature withTag(String key, Object value) {
    Map<String, Object> copy = new LinkedHashMap<>(tags);
    copy.put(key, value);
    return new GeoJsonFeature(geometry, copy);
  }

  public GeoJsonFeature withGeometry(Geometry newGeometry) {
    return new GeoJsonFeature(newGeometry, tags);
  }

  /** Returns the numeric value of {@code key}, or {@link Double#NaN} if missing or not a number. */
  public double getDouble(String key) {
    Object value = tags.get(key);
    if (value instanceof Number number) {
      return number.doubleValue();
    } else if (value instanceof String string) {
      try {
        return Double.parseDouble(string.strip());
      } catch (NumberFormatException e) {
        return Double.NaN;
      }
    }
    return Double.NaN;
  }
}
