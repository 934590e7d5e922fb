package com.onthegomap.tilerunner;

import com.onthegomap.tilerunner.budget.ResourceBudget;
import com.onthegomap.tilerunner.collect.TileManifest;
import com.onthegomap.tilerunner.grid.TileGrid;
import com.onthegomap.tilerunner.merge.MergedOutput;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Summary of a finished run.
 *
 * @param written         layer or raster name to the file it was written to
 * @param peakConcurrency most jobs that were running at the same time
 */
public record RunResult(
  Outcome outcome,
  TileGrid grid,
  ResourceBudget budget,
  TileManifest manifest,
  MergedOutput output,
  Map<String, Path> written,
  int peakConcurrency
) {

  /** How a run ended when it did not throw. */
  public enum Outcome {
    /** Every tile either succeeded or had nothing to process, and the merged layers were written. */
    SUCCESS(0),
    /** Every tile was skipped, so there was nothing to merge. */
    NO_QUALIFYING_OUTPUT(0),
    /** Some tiles failed; whatever succeeded was merged and written. */
    COMPLETED_WITH_FAILURES(1);

    private final int exitCode;

    Outcome(int exitCode) {
      this.exitCode = exitCode;
    }
  }

  public RunResult {
    written = Collections.unmodifiableMap(new LinkedHashMap<>(written));
  }

  public int exitCode() {
    return outcome.exitCode;
  }

  public List<Integer> skippedTiles() {
    return manifest.skips().stream().map(result -> result.tileId()).toList();
  }

  public List<Integer> failedTiles() {
    return manifest.failures().stream().map(result -> result.tileId()).toList();
  }
}
