package com.onthegomap.tilerunner.merge;

import com.onthegomap.tilerunner.collect.TileManifest;
import com.onthegomap.tilerunner.engine.Engine;
import com.onthegomap.tilerunner.engine.EngineCommand;
import com.onthegomap.tilerunner.engine.EngineResult;
import com.onthegomap.tilerunner.util.FileUtils;
import com.onthegomap.tilerunner.workspace.Workspace;
import com.onthegomap.tilerunner.workspace.WorkspaceContext;
import com.onthegomap.tilerunner.workspace.WorkspaceIsolationManager;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Joins the raster output of every successful tile into one raster.
 * <p>
 * Rasters cannot be read by the JVM, so several tiles are patched by the engine's {@value #PATCH} operation in a
 * workspace of their own, given in tile id order so the first tile wins where tiles overlap. A single tile is copied
 * as is and no tile gives no raster.
 */
public class RasterPatcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(RasterPatcher.class);
  public static final String PATCH = "r.patch";
  /** Tile ids start at 1, so the merge workspace cannot collide with a tile. */
  static final int MERGE_WORKSPACE_ID = 0;

  private final Engine engine;
  private final WorkspaceIsolationManager workspaces;

  public RasterPatcher(Engine engine, WorkspaceIsolationManager workspaces) {
    this.engine = engine;
    this.workspaces = workspaces;
  }

  /** Returns where the raster called {@code name} is written in {@code outputDir}. */
  public static Path rasterPath(Path outputDir, String name) {
    return outputDir.resolve(name + ".tif");
  }

  /**
   * Writes the rasters in {@code sources} to {@code <outputDir>/<name>.tif}.
   *
   * @return the written file, or empty if there were no sources
   * @throws IllegalStateException if the engine fails to patch the rasters
   */
  public Optional<Path> patch(String name, List<TileManifest.Source> sources, Path outputDir) {
    Path output = rasterPath(outputDir, name);
    if (sources.isEmpty()) {
      LOGGER.warn("No tile produced raster {}", name);
      return Optional.empty();
    }
    FileUtils.createParentDirectories(output);
    if (sources.size() == 1) {
      try {
        Files.copy(sources.get(0).path(), output, StandardCopyOption.REPLACE_EXISTING);
      } catch (IOException e) {
        throw new UncheckedIOException("Unable to copy " + sources.get(0).path() + " to " + output, e);
      }
      LOGGER.info("Copied raster of tile {} to {}", sources.get(0).tileId(), output);
      return Optional.of(output);
    }

    EngineCommand command = EngineCommand.of(PATCH)
      .with("input", sources.stream().map(source -> source.path().toAbsolutePath().toString())
        .collect(Collectors.joining(",")))
      .with("output", output.toAbsolutePath());
    Workspace workspace = workspaces.acquire(MERGE_WORKSPACE_ID);
    try {
      WorkspaceContext context = workspaces.enter(workspace);
      EngineResult result = engine.execute(command, context);
      WorkspaceIsolationManager.verify(context, workspace);
      if (!result.isSuccess()) {
        throw new IllegalStateException("Unable to patch " + sources.size() + " rasters into " + output + ": " +
          result.combinedOutput().strip());
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to run " + PATCH + " for " + output, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while patching " + output, e);
    } finally {
      workspaces.release(workspace);
    }
    if (!Files.isRegularFile(output)) {
      throw new IllegalStateException(PATCH + " reported success but did not write " + output);
    }
    LOGGER.info("Patched rasters of {} tiles into {}", sources.size(), output);
    return Optional.of(output);
  }
}
