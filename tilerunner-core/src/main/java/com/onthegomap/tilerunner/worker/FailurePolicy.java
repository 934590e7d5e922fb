package com.onthegomap.tilerunner.worker;

/** What the scheduler does with the remaining jobs once one job has failed. */
public enum FailurePolicy {
  /** Stop dispatching new jobs, let in-flight ones finish, then abort the run. */
  FAIL_FAST,
  /** Run every job, report all failures together and merge whatever succeeded. */
  COLLECT_ALL
}
