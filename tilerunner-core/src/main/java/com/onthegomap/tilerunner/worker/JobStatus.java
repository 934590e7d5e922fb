package com.onthegomap.tilerunner.worker;

/** How a finished job ended. */
public enum JobStatus {
  /** The worker wrote its outputs. */
  SUCCESS,
  /** The tile legitimately contains nothing to extract, for example no potential buildings. */
  SKIPPED_NO_DATA,
  /** The worker crashed, exited non-zero, or did not report a usable result. */
  FAILED
}
