package com.onthegomap.tilerunner.cleanup;

import com.onthegomap.tilerunner.util.FileUtils;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Something created during a run that must not outlive it: a temporary directory, a staged file, a workspace.
 */
public interface TransientResource {

  /** Human-readable name used in cleanup logs. */
  String description();

  /**
   * Removes the resource.
   *
   * @return {@code false} if it was already gone
   * @throws IOException if it exists but could not be removed
   */
  boolean release() throws IOException;

  /** Returns a resource that recursively deletes {@code path}. */
  static TransientResource ofPath(Path path) {
    return of(path.toString(), () -> FileUtils.deleteRecursivelyOrThrow(path));
  }

  /** Returns a resource that runs {@code action} when released. */
  static TransientResource of(String description, Action action) {
    return new TransientResource() {
      @Override
      public String description() {
        return description;
      }

      @Override
      public boolean release() throws IOException {
        return action.release();
      }

      @Override
      public String toString() {
        return "TransientResource[" + description + "]";
      }
    };
  }

  /** A release action that may fail with an {@link IOException}. */
  @FunctionalInterface
  interface Action {
    boolean release() throws IOException;
  }
}
