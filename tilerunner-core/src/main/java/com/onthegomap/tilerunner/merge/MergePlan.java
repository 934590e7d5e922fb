package com.onthegomap.tilerunner.merge;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Which worker outputs get merged and how, keyed by output name in the order the layers are written.
 *
 * @param layers  vector outputs merged by the {@link MergeEngine}
 * @param rasters raster outputs patched together by the {@link RasterPatcher}, worker output name to the name of the
 *                patched raster
 */
public record MergePlan(Map<String, MergeSpec> layers, Map<String, String> rasters, SymmetricComparison comparison) {

  public MergePlan {
    layers = Collections.unmodifiableMap(new LinkedHashMap<>(layers));
    rasters = Collections.unmodifiableMap(new LinkedHashMap<>(rasters));
    for (String output : rasters.keySet()) {
      if (layers.containsKey(output)) {
        throw new IllegalArgumentException("output " + output + " cannot be both a vector layer and a raster");
      }
    }
  }

  public MergePlan(Map<String, MergeSpec> layers, SymmetricComparison comparison) {
    this(layers, Map.of(), comparison);
  }

  public static MergePlan of(String outputName, MergeSpec spec) {
    return new MergePlan(Map.of(outputName, spec), null);
  }

  public static MergePlan of(Map<String, MergeSpec> layers) {
    return new MergePlan(layers, null);
  }

  /** Returns a plan for a comparison between two datasets whose category outputs get specs from {@code specs}. */
  public static MergePlan comparison(SymmetricComparison comparison, Map<String, MergeSpec> specs) {
    return new MergePlan(specs, comparison);
  }

  /** Returns a plan that patches the raster {@code outputName} of every tile into one raster called {@code name}. */
  public static MergePlan raster(String outputName, String name) {
    return new MergePlan(Map.of(), Map.of(outputName, name), null);
  }

  public boolean isComparison() {
    return comparison != null;
  }

  /** Returns the names of every file the plan writes, vector layers first. */
  public Map<String, String> outputNames() {
    Map<String, String> names = new LinkedHashMap<>();
    layers.forEach((output, spec) -> names.put(output, spec.outputName() == null ? output : spec.outputName()));
    names.putAll(rasters);
    return names;
  }
}
