package com.onthegomap.tilerunner.engine;

import com.onthegomap.tilerunner.workspace.WorkspaceContext;
import java.io.IOException;

/**
 * The external geoprocessing engine, invoked as a black box.
 * <p>
 * Implementations must run {@code command} inside the workspace of {@code context} and return its exit status together
 * with everything it printed.
 */
@FunctionalInterface
public interface Engine {

  EngineResult execute(EngineCommand command, WorkspaceContext context) throws IOException, InterruptedException;
}
