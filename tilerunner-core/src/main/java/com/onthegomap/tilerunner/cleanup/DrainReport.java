package com.onthegomap.tilerunner.cleanup;

import java.util.List;

/**
 * Outcome of {@link CleanupRegistry#drainAll()}.
 *
 * @param released       resources removed by the drain
 * @param alreadyRemoved resources that were released early or had disappeared on their own
 * @param failures       resources that could not be removed
 */
public record DrainReport(int released, int alreadyRemoved, List<Failure> failures) {

  public static final DrainReport NOTHING = new DrainReport(0, 0, List.of());

  public DrainReport {
    failures = List.copyOf(failures);
  }

  public boolean isClean() {
    return failures.isEmpty();
  }

  /** A resource that could not be released and the error it raised. */
  public record Failure(String description, Exception error) {}
}
