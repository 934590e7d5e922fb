package com.onthegomap.tilerunner.worker;

import com.onthegomap.tilerunner.util.Exceptions;
import java.util.List;
import java.util.stream.Collectors;

/** Every tile that failed in a run, reported together once all in-flight jobs have settled. */
public class TileFailuresException extends Exceptions.FatalTileRunnerException {

  private final transient List<JobResult> failures;
  private final List<Integer> notRun;

  public TileFailuresException(List<JobResult> failures, List<Integer> notRun) {
    super(describe(failures, notRun));
    this.failures = List.copyOf(failures);
    this.notRun = List.copyOf(notRun);
  }

  private static String describe(List<JobResult> failures, List<Integer> notRun) {
    String message = failures.size() + (failures.size() == 1 ? " tile" : " tiles") + " failed: " + failures.stream()
      .map(failure -> "tile " + failure.tileId() + " (" + failure.errorDetail().lines().findFirst().orElse("") + ")")
      .collect(Collectors.joining(", "));
    if (!notRun.isEmpty()) {
      message += "; tiles not run: " + notRun;
    }
    return message;
  }

  public List<JobResult> failures() {
    return failures;
  }

  /** Tile ids of the jobs that were never dispatched because the run stopped early. */
  public List<Integer> notRun() {
    return notRun;
  }

  public List<Integer> failedTileIds() {
    return failures.stream().map(JobResult::tileId).toList();
  }
}
