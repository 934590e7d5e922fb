package com.onthegomap.tilerunner.workspace;

import java.nio.file.Path;

/**
 * Private working directory of one job plus a read-only pointer to the inputs every job shares.
 *
 * @param name       unique name for the run, {@code tile_<id>_<runToken>}
 * @param directory  where the job writes all intermediate and output artifacts
 * @param inputStore shared inputs, never written to by a job
 */
public record Workspace(String name, int tileId, String runToken, Path directory, Path inputStore) {

  public static String name(int tileId, String runToken) {
    return "tile_" + tileId + "_" + runToken;
  }

  /** Returns {@code relative} resolved inside this workspace. */
  public Path resolve(String relative) {
    return directory.resolve(relative);
  }
}
