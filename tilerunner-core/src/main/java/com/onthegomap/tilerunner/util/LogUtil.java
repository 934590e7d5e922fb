package com.onthegomap.tilerunner.util;

import java.util.function.Supplier;
import java.util.regex.Pattern;
import org.slf4j.MDC;

/**
 * Wrapper for SLF4j {@link MDC} log utility to prepend {@code [stage]} to log output.
 */
public class LogUtil {

  private LogUtil() {}

  private static final String STAGE_KEY = "stage";

  /** Prepends {@code [stage]} to all subsequent logs from this thread. */
  public static void setStage(String stage) {
    MDC.put(STAGE_KEY, "[%s] ".formatted(stage));
  }

  /** Removes {@code [stage]} from subsequent logs from this thread. */
  public static void clearStage() {
    MDC.remove(STAGE_KEY);
  }

  /** Returns the current {@code [stage]} value prepended to log for this thread. */
  public static String getStage() {
    // strip out the "[stage] " wrapper
    String stage = MDC.get(STAGE_KEY);
    return stage == null ? null : stage.substring(1, stage.length() - 2);
  }

  /** Prepends {@code [parent:child]} to all subsequent logs from this thread. */
  public static void setStage(String parent, String child) {
    if (parent == null) {
      setStage(child);
    } else {
      setStage(parent + ":" + child.replaceFirst("^" + Pattern.quote(parent) + "_?", ""));
    }
  }

  /** Runs {@code task} with {@code [parent:child]} prepended to logs, restoring the previous stage afterwards. */
  public static <T> T withStage(String child, Supplier<T> task) {
    String previous = getStage();
    setStage(previous, child);
    try {
      return task.get();
    } finally {
      if (previous == null) {
        clearStage();
      } else {
        setStage(previous);
      }
    }
  }
}
