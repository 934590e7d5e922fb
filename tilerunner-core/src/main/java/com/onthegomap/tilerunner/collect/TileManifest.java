package com.onthegomap.tilerunner.collect;

import com.onthegomap.tilerunner.worker.JobResult;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Every job result of a run, ordered by tile id.
 */
public record TileManifest(List<JobResult> results) {

  public TileManifest {
    List<JobResult> sorted = new ArrayList<>(results);
    sorted.sort(Comparator.comparingInt(JobResult::tileId));
    for (int i = 1; i < sorted.size(); i++) {
      if (sorted.get(i).tileId() == sorted.get(i - 1).tileId()) {
        throw new IllegalArgumentException("more than one result for tile " + sorted.get(i).tileId());
      }
    }
    results = List.copyOf(sorted);
  }

  /** One tile's file for a named output. */
  public record Source(int tileId, Path path) {}

  public List<JobResult> successes() {
    return results.stream().filter(JobResult::isSuccess).toList();
  }

  public List<JobResult> skips() {
    return results.stream().filter(JobResult::isSkipped).toList();
  }

  public List<JobResult> failures() {
    return results.stream().filter(JobResult::isFailed).toList();
  }

  /** Returns the names of every output any successful tile produced. */
  public List<String> outputNames() {
    TreeSet<String> names = new TreeSet<>();
    for (JobResult result : successes()) {
      names.addAll(result.outputs().keySet());
    }
    return List.copyOf(names);
  }

  /** Returns the files holding {@code outputName}, in tile id order. */
  public List<Source> sources(String outputName) {
    List<Source> sources = new ArrayList<>();
    for (JobResult result : successes()) {
      Path path = result.outputs().get(outputName);
      if (path != null) {
        sources.add(new Source(result.tileId(), path));
      }
    }
    return sources;
  }

  /** Returns the attributes reported by every successful tile, in tile id order. */
  public List<Map<String, Object>> attributes() {
    List<Map<String, Object>> all = new ArrayList<>();
    for (JobResult result : successes()) {
      all.addAll(result.attributes());
    }
    return all;
  }
}
