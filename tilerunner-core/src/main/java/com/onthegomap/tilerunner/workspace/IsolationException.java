package com.onthegomap.tilerunner.workspace;

import com.onthegomap.tilerunner.util.Exceptions;

/**
 * Thrown when a workspace is not exclusively owned by the job using it: a name collision, a leftover directory from
 * an earlier run, or an engine call that would run under another workspace's identity.
 * <p>
 * Always fatal for the whole run.
 */
public class IsolationException extends Exceptions.FatalTileRunnerException {

  public IsolationException(String message) {
    super(message);
  }

  public IsolationException(String message, Throwable cause) {
    super(message, cause);
  }
}
