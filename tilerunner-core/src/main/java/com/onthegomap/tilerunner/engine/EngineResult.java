package com.onthegomap.tilerunner.engine;

import java.time.Duration;

/**
 * Exit status and the complete captured output of one engine call.
 *
 * @param timedOut true if the call was killed for running longer than the worker timeout
 */
public record EngineResult(int exitCode, String stdout, String stderr, Duration elapsed, boolean timedOut) {

  public EngineResult {
    stdout = stdout == null ? "" : stdout;
    stderr = stderr == null ? "" : stderr;
  }

  public static EngineResult success(String stdout, Duration elapsed) {
    return new EngineResult(0, stdout, "", elapsed, false);
  }

  public static EngineResult failure(int exitCode, String stderr, Duration elapsed) {
    return new EngineResult(exitCode, "", stderr, elapsed, false);
  }

  public boolean isSuccess() {
    return exitCode == 0 && !timedOut;
  }

  /** Returns stdout followed by stderr. */
  public String combinedOutput() {
    if (stderr.isEmpty()) {
      return stdout;
    } else if (stdout.isEmpty()) {
      return stderr;
    }
    return stdout + (stdout.endsWith("\n") ? "" : "\n") + stderr;
  }
}
