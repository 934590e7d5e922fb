package com.onthegomap.tilerunner.config;

import com.onthegomap.tilerunner.worker.FailurePolicy;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Holder for common parameters used by every tiled analysis.
 *
 * @param workerTimeout maximum run time of one worker, or {@link Duration#ZERO} for no limit
 */
public record TileRunnerConfig(
  Arguments arguments,
  int nprocs,
  int memoryMb,
  double tileSize,
  Path tmpDir,
  Path inputStore,
  FailurePolicy failurePolicy,
  Duration workerTimeout,
  List<String> engineLauncher,
  boolean force
) {

  public static final int ALL_CORES_BUT_ONE = -2;
  public static final int DEFAULT_MEMORY_MB = 300;
  public static final double DEFAULT_TILE_SIZE = 1000;

  public TileRunnerConfig {
    if (tileSize <= 0) {
      throw new IllegalArgumentException("tile_size must be positive, got " + tileSize);
    }
    if (workerTimeout.isNegative()) {
      throw new IllegalArgumentException("worker_timeout must not be negative, got " + workerTimeout);
    }
    engineLauncher = List.copyOf(engineLauncher);
  }

  public static TileRunnerConfig defaults() {
    return from(Arguments.of());
  }

  public static TileRunnerConfig from(Arguments arguments) {
    Path tmpDir = arguments.file("tmpdir|tmp", "temp directory for workspaces and staged outputs",
      Path.of("data", "tmp"));
    return new TileRunnerConfig(
      arguments,
      arguments.getInteger("nprocs", "number of parallel workers, -2 for all cores but one", ALL_CORES_BUT_ONE),
      arguments.getInteger("memory", "memory in MB shared by all workers", DEFAULT_MEMORY_MB),
      arguments.getDouble("tile_size", "edge length of one tile in map units", DEFAULT_TILE_SIZE),
      tmpDir,
      arguments.file("input_store", "read-only store of inputs shared by all workers", tmpDir.resolve("inputs")),
      arguments.getObject("failure_policy", "fail_fast or collect_all", FailurePolicy.FAIL_FAST,
        value -> FailurePolicy.valueOf(value.strip().toUpperCase(Locale.ROOT))),
      arguments.getDuration("worker_timeout", "maximum time one worker may run, 0s to disable", "0s"),
      arguments.getList("engine", "command prefix used to launch engine operations", List.of("grass", "--exec")),
      arguments.getBoolean("force", "overwrite existing outputs", false)
    );
  }

  public boolean hasWorkerTimeout() {
    return !workerTimeout.isZero();
  }
}
