package com.onthegomap.tilerunner.workspace;

/**
 * Handle for the workspace an engine call runs in, obtained from {@link WorkspaceIsolationManager#enter(Workspace)}.
 * <p>
 * Passed explicitly into every engine call so there is no process-wide "current workspace".
 */
public record WorkspaceContext(Workspace workspace) {

  public String name() {
    return workspace.name();
  }
}
