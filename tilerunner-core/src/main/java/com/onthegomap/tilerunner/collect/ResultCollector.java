package com.onthegomap.tilerunner.collect;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.onthegomap.tilerunner.engine.EngineResult;
import com.onthegomap.tilerunner.util.FileUtils;
import com.onthegomap.tilerunner.util.Format;
import com.onthegomap.tilerunner.worker.Job;
import com.onthegomap.tilerunner.worker.JobResult;
import com.onthegomap.tilerunner.workspace.IsolationException;
import com.onthegomap.tilerunner.workspace.Workspace;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Classifies what a worker left behind as success, skipped or failed.
 * <p>
 * The worker reports through a {@link CompletionRecord}: the {@value CompletionRecord#FILE_NAME} file in its workspace
 * when present, otherwise the last {@value CompletionRecord#MARKER} line of its output. Anything that cannot be
 * understood is a failure that quotes what the worker printed, never an exception that stops the run. Outputs of
 * successful tiles are moved into the staging directory so the workspace can be released right away.
 */
public class ResultCollector {

  private static final Logger LOGGER = LoggerFactory.getLogger(ResultCollector.class);
  static final int MAX_QUOTED_CHARS = 2_000;

  private final Path stagingDir;

  /**
   * @param stagingDir directory that outlives workspaces and receives the outputs of successful tiles
   */
  public ResultCollector(Path stagingDir) {
    this.stagingDir = stagingDir;
  }

  /**
   * Returns the result of {@code job} from its engine result and the contents of its workspace.
   *
   * @throws IsolationException if the worker reports that it ran in another named workspace
   */
  public JobResult collect(Job job, EngineResult engineResult, Workspace workspace) {
    int tileId = job.tileId();
    String log = engineResult.combinedOutput();

    if (!engineResult.isSuccess()) {
      String output = engineResult.stderr().isBlank() ? engineResult.stdout() : engineResult.stderr();
      return JobResult.failed(tileId, (engineResult.timedOut() ? "timed out" : "exit code " +
        engineResult.exitCode()) + " running " + job.command() + "\n" + Format.tail(output, MAX_QUOTED_CHARS), log);
    }

    String json;
    String origin;
    try {
      json = CompletionRecord.readFile(workspace.directory());
      origin = CompletionRecord.FILE_NAME;
    } catch (IOException e) {
      return JobResult.failed(tileId, "unable to read " + CompletionRecord.FILE_NAME + ": " + e, log);
    }
    if (json == null) {
      json = CompletionRecord.findMarker(log);
      origin = CompletionRecord.MARKER + " line";
    }
    if (json == null) {
      return JobResult.failed(tileId, "worker finished without reporting a result, output was: " +
        Format.tail(log, MAX_QUOTED_CHARS), log);
    }

    CompletionRecord record;
    try {
      record = CompletionRecord.parse(json);
    } catch (JsonProcessingException e) {
      return JobResult.failed(tileId, "unparseable " + origin + ": " + Format.tail(json, MAX_QUOTED_CHARS), log);
    }

    if (record.workspace() == null) {
      return JobResult.failed(tileId, origin + " does not name its workspace: " + Format.tail(json, MAX_QUOTED_CHARS),
        log);
    } else if (!workspace.name().equals(record.workspace())) {
      throw new IsolationException("Tile " + tileId + " reported a result for workspace " + record.workspace() +
        " but ran in " + workspace.name());
    }

    if (CompletionRecord.SKIPPED.equals(record.status())) {
      LOGGER.warn("Tile {} skipped: {}", tileId, record.message() == null ? "no qualifying data" : record.message());
      return JobResult.skipped(tileId, log);
    } else if (!CompletionRecord.SUCCESS.equals(record.status())) {
      return JobResult.failed(tileId, "unknown status '" + record.status() + "' in " + origin, log);
    }

    Map<String, Path> staged = new LinkedHashMap<>();
    Path workspaceDir = workspace.directory().toAbsolutePath().normalize();
    for (var entry : record.outputs().entrySet()) {
      String name = entry.getKey();
      Path output = workspaceDir.resolve(entry.getValue()).normalize();
      if (!output.startsWith(workspaceDir)) {
        return JobResult.failed(tileId, "output " + name + " at " + entry.getValue() + " is outside the workspace",
          log);
      }
      if (!Files.exists(output)) {
        return JobResult.failed(tileId, "output " + name + " missing, expected it at " + output, log);
      }
      Path target = stagingDir.resolve("tile_" + tileId).resolve(name).resolve(output.getFileName());
      try {
        FileUtils.move(output, target);
      } catch (UncheckedIOException e) {
        return JobResult.failed(tileId, "unable to stage output " + name + ": " + e.getCause(), log);
      }
      staged.put(name, target);
    }
    LOGGER.debug("Tile {} finished with outputs {}", tileId, staged.keySet());
    return JobResult.success(tileId, staged, record.attributes(), log);
  }

  /** Returns the manifest of {@code results} and writes the log of each tile to the debug log in tile order. */
  public TileManifest manifest(List<JobResult> results) {
    TileManifest manifest = new TileManifest(results);
    if (LOGGER.isDebugEnabled()) {
      for (JobResult result : manifest.results()) {
        if (!result.log().isBlank()) {
          LOGGER.debug("Output of tile {}:\n{}", result.tileId(), result.log().stripTrailing());
        }
      }
    }
    LOGGER.info("{} tiles succeeded, {} skipped, {} failed", manifest.successes().size(), manifest.skips().size(),
      manifest.failures().size());
    return manifest;
  }
}
