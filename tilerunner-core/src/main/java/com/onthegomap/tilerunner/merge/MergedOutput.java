package com.onthegomap.tilerunner.merge;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Every merged layer of a run, keyed by layer name. */
public record MergedOutput(Map<String, MergedLayer> layers) {

  public MergedOutput {
    layers = Collections.unmodifiableMap(new LinkedHashMap<>(layers));
  }

  /** Returns true if no tile contributed to any layer. */
  public boolean isEmpty() {
    return layers.values().stream().allMatch(layer -> layer.sourceCount() == 0);
  }

  public MergedLayer layer(String name) {
    return layers.get(name);
  }
}
