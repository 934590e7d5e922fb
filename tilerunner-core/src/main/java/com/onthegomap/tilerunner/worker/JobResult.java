package com.onthegomap.tilerunner.worker;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Classified outcome of one job.
 *
 * @param outputs     output name to the staged file holding it, only for {@link JobStatus#SUCCESS}
 * @param attributes  per-feature or per-tile attributes the worker reported alongside its outputs
 * @param log         everything the worker printed
 * @param errorDetail why the job failed, only for {@link JobStatus#FAILED}
 */
public record JobResult(
  int tileId,
  JobStatus status,
  Map<String, Path> outputs,
  List<Map<String, Object>> attributes,
  String log,
  String errorDetail
) {

  public JobResult {
    outputs = new TreeMap<>(outputs);
    attributes = List.copyOf(attributes);
    log = log == null ? "" : log;
    if (status != JobStatus.SUCCESS && !outputs.isEmpty()) {
      throw new IllegalArgumentException("only successful jobs have outputs, tile " + tileId + " is " + status);
    }
    if ((status == JobStatus.FAILED) != (errorDetail != null)) {
      throw new IllegalArgumentException("error detail must be present exactly when a job failed, tile " + tileId);
    }
  }

  public static JobResult success(int tileId, Map<String, Path> outputs, List<Map<String, Object>> attributes,
    String log) {
    return new JobResult(tileId, JobStatus.SUCCESS, outputs, attributes, log, null);
  }

  public static JobResult skipped(int tileId, String log) {
    return new JobResult(tileId, JobStatus.SKIPPED_NO_DATA, Map.of(), List.of(), log, null);
  }

  public static JobResult failed(int tileId, String errorDetail, String log) {
    return new JobResult(tileId, JobStatus.FAILED, Map.of(), List.of(), log, errorDetail);
  }

  public boolean isSuccess() {
    return status == JobStatus.SUCCESS;
  }

  public boolean isSkipped() {
    return status == JobStatus.SKIPPED_NO_DATA;
  }

  public boolean isFailed() {
    return status == JobStatus.FAILED;
  }
}
