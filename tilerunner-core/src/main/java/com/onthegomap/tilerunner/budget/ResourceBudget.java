package com.onthegomap.tilerunner.budget;

import java.util.List;

/**
 * The number of concurrent workers and the memory each of them may use.
 *
 * @param workerCount       maximum number of jobs running at the same time, at least 1
 * @param memoryPerWorkerMb memory handed to each worker, at least 1
 * @param totalMemoryMb     memory shared by all workers after clamping to what the host has free
 * @param warnings          every adjustment made while planning, in the order it happened
 */
public record ResourceBudget(int workerCount, long memoryPerWorkerMb, long totalMemoryMb, List<String> warnings) {

  public ResourceBudget {
    if (workerCount < 1) {
      throw new IllegalArgumentException("workerCount must be at least 1, got " + workerCount);
    }
    if (memoryPerWorkerMb < 1) {
      throw new IllegalArgumentException("memoryPerWorkerMb must be at least 1, got " + memoryPerWorkerMb);
    }
    warnings = List.copyOf(warnings);
  }

  /**
   * Returns a budget that never runs more workers than there are {@code jobs}, giving the memory of the idle workers to
   * the remaining ones.
   */
  public ResourceBudget limitToJobs(int jobs) {
    int workers = Math.max(1, Math.min(workerCount, jobs));
    if (workers == workerCount) {
      return this;
    }
    return new ResourceBudget(workers, Math.max(1, totalMemoryMb / workers), totalMemoryMb, warnings);
  }
}
