package com.onthegomap.tilerunner.addons;

import com.onthegomap.tilerunner.geojson.GeoJsonFeature;
import com.onthegomap.tilerunner.merge.MergedLayer;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;

/** Utilities to trim the attribute table of a merged layer. */
final class LayerAttributes {

  private LayerAttributes() {}

  /** Returns {@code layer} with only the attributes named in {@code keep}, in their original order. */
  static MergedLayer keepOnly(MergedLayer layer, Collection<String> keep) {
    return retain(layer, keep::contains);
  }

  /** Returns {@code layer} without the attributes named in {@code drop}. */
  static MergedLayer drop(MergedLayer layer, Collection<String> drop) {
    return retain(layer, key -> !drop.contains(key));
  }

  /** Returns {@code layer} with attribute {@code from} renamed to {@code to}, keeping its position. */
  static MergedLayer rename(MergedLayer layer, String from, String to) {
    return new MergedLayer(layer.name(), layer.features().stream().map(feature -> {
      Map<String, Object> tags = new LinkedHashMap<>();
      feature.tags().forEach((key, value) -> tags.put(from.equals(key) ? to : key, value));
      return new GeoJsonFeature(feature.geometry(), tags);
    }).toList(), layer.sourceCount());
  }

  private static MergedLayer retain(MergedLayer layer, Predicate<String> predicate) {
    return new MergedLayer(layer.name(), layer.features().stream().map(feature -> {
      Map<String, Object> tags = new LinkedHashMap<>();
      feature.tags().forEach((key, value) -> {
        if (predicate.test(key)) {
          tags.put(key, value);
        }
      });
      return new GeoJsonFeature(feature.geometry(), tags);
    }).toList(), layer.sourceCount());
  }
}
