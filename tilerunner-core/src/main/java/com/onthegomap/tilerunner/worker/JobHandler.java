package com.onthegomap.tilerunner.worker;

/** Runs one job to completion on a worker thread and classifies how it ended. */
@FunctionalInterface
public interface JobHandler {

  /**
   * Processes {@code job}.
   * <p>
   * Any exception is turned into a {@link JobStatus#FAILED} result, except
   * {@link com.onthegomap.tilerunner.workspace.IsolationException} which stops the whole run.
   */
  JobResult run(Job job) throws Exception;
}
