package com.onthegomap.tilerunner.merge;

import com.onthegomap.tilerunner.geojson.GeoJsonFeature;
import java.util.List;

/**
 * The merged features of one output.
 *
 * @param sourceCount number of tile outputs that were merged into this layer
 */
public record MergedLayer(String name, List<GeoJsonFeature> features, int sourceCount) {

  public MergedLayer {
    features = List.copyOf(features);
  }

  public static MergedLayer empty(String name) {
    return new MergedLayer(name, List.of(), 0);
  }

  public int size() {
    return features.size();
  }
}
