package com.onthegomap.tilerunner.budget;

import com.onthegomap.tilerunner.config.TileRunnerConfig;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.concurrent.ThreadSafe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a requested number of workers and a memory budget into a {@link ResourceBudget} the host can actually satisfy.
 * <p>
 * Requests are clamped instead of rejected: every adjustment is logged at warning level and kept in
 * {@link ResourceBudget#warnings()}. Only a budget that can never run anything is an error.
 */
@ThreadSafe
public class ResourceBudgetPlanner {

  private static final Logger LOGGER = LoggerFactory.getLogger(ResourceBudgetPlanner.class);

  private final HostResources host;

  public ResourceBudgetPlanner(HostResources host) {
    this.host = host;
  }

  /**
   * Returns the budget for {@code requestedWorkers} parallel workers sharing {@code requestedMemoryMb}.
   *
   * @param requestedWorkers number of workers, or {@link TileRunnerConfig#ALL_CORES_BUT_ONE}
   * @param requestedMemoryMb memory in MB for all workers together
   * @throws IllegalArgumentException if the memory request is not positive or the host has no free memory
   */
  public ResourceBudget plan(int requestedWorkers, long requestedMemoryMb) {
    if (requestedMemoryMb <= 0) {
      throw new IllegalArgumentException("memory must be a positive number of MB, got " + requestedMemoryMb);
    }
    long freeMemory = host.freeMemoryMb();
    if (freeMemory <= 0) {
      throw new IllegalArgumentException("No free memory available on " + host + " to run workers");
    }
    List<String> warnings = new ArrayList<>();
    int cpus = Math.max(1, host.availableProcessors());

    int workers;
    if (requestedWorkers == TileRunnerConfig.ALL_CORES_BUT_ONE) {
      workers = Math.max(1, cpus - 1);
    } else if (requestedWorkers <= 0) {
      workers = 1;
      warn(warnings, "nprocs=%d is not a valid number of workers (use %d for all cores but one), using 1"
        .formatted(requestedWorkers, TileRunnerConfig.ALL_CORES_BUT_ONE));
    } else if (requestedWorkers > cpus) {
      workers = cpus;
      warn(warnings, "Requested %d workers but only %d CPUs are available, using %d"
        .formatted(requestedWorkers, cpus, cpus));
    } else {
      workers = requestedWorkers;
    }

    long totalMemory = requestedMemoryMb;
    if (totalMemory > freeMemory) {
      warn(warnings, "Requested %dMB of memory but only %dMB are free, using %dMB"
        .formatted(requestedMemoryMb, freeMemory, freeMemory));
      totalMemory = freeMemory;
    }

    if (totalMemory < workers) {
      warn(warnings, "%dMB of memory is not enough for %d workers, using %d workers with 1MB each"
        .formatted(totalMemory, workers, totalMemory));
      workers = (int) totalMemory;
    }

    return new ResourceBudget(workers, totalMemory / workers, totalMemory, warnings);
  }

  private static void warn(List<String> warnings, String message) {
    LOGGER.warn(message);
    warnings.add(message);
  }
}
