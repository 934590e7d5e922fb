package com.onthegomap.tilerunner;

import com.onthegomap.tilerunner.budget.HostResources;
import com.onthegomap.tilerunner.budget.ResourceBudget;
import com.onthegomap.tilerunner.budget.ResourceBudgetPlanner;
import com.onthegomap.tilerunner.cleanup.CleanupRegistry;
import com.onthegomap.tilerunner.cleanup.DrainReport;
import com.onthegomap.tilerunner.cleanup.TransientResource;
import com.onthegomap.tilerunner.collect.ResultCollector;
import com.onthegomap.tilerunner.collect.TileManifest;
import com.onthegomap.tilerunner.config.Arguments;
import com.onthegomap.tilerunner.config.TileRunnerConfig;
import com.onthegomap.tilerunner.engine.Engine;
import com.onthegomap.tilerunner.engine.EngineResult;
import com.onthegomap.tilerunner.engine.ProcessEngine;
import com.onthegomap.tilerunner.geojson.GeoJson;
import com.onthegomap.tilerunner.grid.TileGrid;
import com.onthegomap.tilerunner.grid.TileGridBuilder;
import com.onthegomap.tilerunner.merge.MergeEngine;
import com.onthegomap.tilerunner.merge.MergePlan;
import com.onthegomap.tilerunner.merge.MergedLayer;
import com.onthegomap.tilerunner.merge.MergedOutput;
import com.onthegomap.tilerunner.merge.RasterPatcher;
import com.onthegomap.tilerunner.util.FileUtils;
import com.onthegomap.tilerunner.util.Format;
import com.onthegomap.tilerunner.util.LogUtil;
import com.onthegomap.tilerunner.worker.Job;
import com.onthegomap.tilerunner.worker.JobResult;
import com.onthegomap.tilerunner.worker.WorkerScheduler;
import com.onthegomap.tilerunner.workspace.Workspace;
import com.onthegomap.tilerunner.workspace.WorkspaceContext;
import com.onthegomap.tilerunner.workspace.WorkspaceIsolationManager;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * High-level driver that runs a {@link TiledAnalysis} end to end.
 * <p>
 * To run an analysis:
 *
 * <pre>{@code
 * TileRunner.create(arguments)
 *   .run(new MyAnalysis(...), Path.of("data", "output"));
 * }</pre>
 * <p>
 * A run plans the resource budget, builds the tile grid, runs one worker per tile in its own workspace, collects the
 * results, merges the outputs of successful tiles and writes one GeoJSON file per merged layer and one GeoTIFF per
 * patched raster. Temporary files are removed when the run ends however it ends. A {@code TileRunner} can only run
 * once.
 */
public class TileRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(TileRunner.class);

  private final TileRunnerConfig config;
  private final CleanupRegistry cleanup;
  private Engine engine;
  private HostResources host = HostResources.system();

  private TileRunner(TileRunnerConfig config, CleanupRegistry cleanup) {
    this.config = config;
    this.cleanup = cleanup;
    this.engine = new ProcessEngine(config.engineLauncher(), config.workerTimeout());
  }

  /** Returns a new runner configured from {@code arguments}. */
  public static TileRunner create(Arguments arguments) {
    return create(TileRunnerConfig.from(arguments));
  }

  public static TileRunner create(TileRunnerConfig config) {
    return new TileRunner(config, new CleanupRegistry().installShutdownHook());
  }

  /** Returns a runner that drains {@code cleanup} at the end instead of its own registry. */
  public static TileRunner create(TileRunnerConfig config, CleanupRegistry cleanup) {
    return new TileRunner(config, cleanup);
  }

  /** Sets the engine that runs worker commands, by default a {@link ProcessEngine}. */
  public TileRunner setEngine(Engine engine) {
    this.engine = engine;
    return this;
  }

  /** Sets the host resources the budget is planned against, by default those of this machine. */
  public TileRunner setHostResources(HostResources host) {
    this.host = host;
    return this;
  }

  public TileRunnerConfig config() {
    return config;
  }

  public CleanupRegistry cleanup() {
    return cleanup;
  }

  /**
   * Runs {@code analysis} and writes each merged layer to {@code <outputDir>/<layer>.geojson} and each raster to
   * {@code <outputDir>/<raster>.tif}.
   *
   * @throws IllegalArgumentException if the configuration is invalid, before any worker starts
   * @throws com.onthegomap.tilerunner.grid.NoOverlappingDataException if no tile overlaps the input data
   * @throws com.onthegomap.tilerunner.worker.TileFailuresException if a tile fails with the fail-fast policy
   * @throws com.onthegomap.tilerunner.workspace.IsolationException if workspace isolation is broken
   */
  public RunResult run(TiledAnalysis analysis, Path outputDir) {
    long start = System.nanoTime();
    LogUtil.setStage(analysis.name());
    try {
      checkOutputs(analysis, outputDir);
      ResourceBudget budget = new ResourceBudgetPlanner(host).plan(config.nprocs(), config.memoryMb());
      TileGrid grid = analysis.gridFile()
        .map(file -> TileGridBuilder.fromGridFile(file, analysis.areaOfInterest(), analysis.coverage()))
        .orElseGet(() -> TileGridBuilder.build(analysis.areaOfInterest(), config.tileSize(), analysis.coverage()));
      budget = budget.limitToJobs(grid.tileCount());
      LOGGER.info("Processing {} tiles with {} workers and {}MB memory each", grid.tileCount(), budget.workerCount(),
        budget.memoryPerWorkerMb());

      String runToken = WorkspaceIsolationManager.newRunToken();
      Path runDir = config.tmpDir().resolve("run_" + runToken);
      cleanup.register(TransientResource.ofPath(runDir));
      FileUtils.createDirectory(runDir);
      var workspaces = new WorkspaceIsolationManager(runDir.resolve("workspaces"), runToken, config.inputStore(),
        cleanup);
      var collector = new ResultCollector(runDir.resolve("staging"));

      final ResourceBudget jobBudget = budget;
      List<Job> jobs = grid.tiles().stream().map(tile -> new Job(tile, analysis.command(tile, jobBudget))).toList();
      var scheduler = new WorkerScheduler(analysis.name(), budget.workerCount(), config.failurePolicy());
      var report = scheduler.run(jobs, job -> runJob(job, workspaces, collector));
      TileManifest manifest = collector.manifest(report.results());

      if (!manifest.skips().isEmpty()) {
        LOGGER.warn("Tiles {} had no qualifying data and were skipped",
          manifest.skips().stream().map(JobResult::tileId).toList());
      }
      RunResult.Outcome outcome = manifest.failures().isEmpty() ? RunResult.Outcome.SUCCESS :
        RunResult.Outcome.COMPLETED_WITH_FAILURES;

      MergedOutput merged = new MergedOutput(Map.of());
      Map<String, Path> written = new LinkedHashMap<>();
      if (manifest.successes().isEmpty()) {
        LOGGER.warn("No qualifying output across all {} tiles, nothing to merge", grid.tileCount());
        if (outcome == RunResult.Outcome.SUCCESS) {
          outcome = RunResult.Outcome.NO_QUALIFYING_OUTPUT;
        }
      } else {
        MergePlan plan = analysis.mergePlan();
        merged = LogUtil.withStage("merge",
          () -> analysis.postProcess(new MergeEngine().mergeAll(manifest, plan), manifest));
        Map<String, Path> rasters = LogUtil.withStage("merge",
          () -> patchRasters(plan, manifest, new RasterPatcher(engine, workspaces), outputDir));
        if (merged.isEmpty() && rasters.isEmpty()) {
          LOGGER.warn("No qualifying output across all {} tiles", grid.tileCount());
          if (outcome == RunResult.Outcome.SUCCESS) {
            outcome = RunResult.Outcome.NO_QUALIFYING_OUTPUT;
          }
        } else {
          if (!merged.isEmpty()) {
            written.putAll(write(merged, outputDir));
          }
          written.putAll(rasters);
        }
      }
      LOGGER.info("Finished in {}: {}", Format.defaultInstance().duration(Duration.ofNanos(System.nanoTime() - start)),
        outcome);
      return new RunResult(outcome, grid, budget, manifest, merged, written, report.peakConcurrency());
    } finally {
      DrainReport drained = cleanup.drainAll();
      if (!drained.isClean()) {
        LOGGER.error("Temporary files left behind: {}", drained.failures());
      }
      LogUtil.clearStage();
    }
  }

  private JobResult runJob(Job job, WorkspaceIsolationManager workspaces, ResultCollector collector)
    throws Exception {
    Workspace workspace = workspaces.acquire(job.tileId());
    job.assignWorkspace(workspace);
    try {
      WorkspaceContext context = workspaces.enter(workspace);
      EngineResult result = engine.execute(job.command(), context);
      WorkspaceIsolationManager.verify(context, workspace);
      return collector.collect(job, result, workspace);
    } finally {
      workspaces.release(workspace);
    }
  }

  private void checkOutputs(TiledAnalysis analysis, Path outputDir) {
    if (config.force()) {
      return;
    }
    MergePlan plan = analysis.mergePlan();
    for (var entry : plan.outputNames().entrySet()) {
      Path output = plan.rasters().containsKey(entry.getKey()) ? RasterPatcher.rasterPath(outputDir, entry.getValue()) :
        outputPath(outputDir, entry.getValue());
      if (Files.exists(output)) {
        throw new IllegalArgumentException(output + " already exists, use --force to overwrite");
      }
    }
  }

  private static Map<String, Path> write(MergedOutput merged, Path outputDir) {
    Map<String, Path> written = new LinkedHashMap<>();
    for (MergedLayer layer : merged.layers().values()) {
      Path output = outputPath(outputDir, layer.name());
      GeoJson.write(output, layer.features());
      LOGGER.info("Wrote {} features to {}", layer.size(), output);
      written.put(layer.name(), output);
    }
    return written;
  }

  private static Map<String, Path> patchRasters(MergePlan plan, TileManifest manifest, RasterPatcher patcher,
    Path outputDir) {
    Map<String, Path> written = new LinkedHashMap<>();
    plan.rasters().forEach((output, name) -> patcher.patch(name, manifest.sources(output), outputDir)
      .ifPresent(path -> written.put(name, path)));
    return written;
  }

  static Path outputPath(Path outputDir, String layerName) {
    return outputDir.resolve(layerName + ".geojson");
  }
}
