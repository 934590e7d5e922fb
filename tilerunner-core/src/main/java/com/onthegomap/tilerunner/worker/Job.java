package com.onthegomap.tilerunner.worker;

import com.onthegomap.tilerunner.engine.EngineCommand;
import com.onthegomap.tilerunner.grid.Tile;
import com.onthegomap.tilerunner.workspace.IsolationException;
import com.onthegomap.tilerunner.workspace.Workspace;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One tile plus the engine command that processes it.
 * <p>
 * Moves from {@link State#QUEUED} to {@link State#RUNNING} to {@link State#COMPLETED} exactly once, and owns at most
 * one workspace for its whole life.
 */
public class Job {

  /** Lifecycle of a job inside the scheduler. */
  public enum State {
    QUEUED,
    RUNNING,
    COMPLETED
  }

  private final Tile tile;
  private final EngineCommand command;
  private final AtomicReference<State> state = new AtomicReference<>(State.QUEUED);
  private final AtomicReference<Workspace> workspace = new AtomicReference<>();
  private volatile JobResult result;

  public Job(Tile tile, EngineCommand command) {
    this.tile = tile;
    this.command = command;
  }

  public Tile tile() {
    return tile;
  }

  public int tileId() {
    return tile.id();
  }

  public EngineCommand command() {
    return command;
  }

  public State state() {
    return state.get();
  }

  /** Returns the result once the job has completed, otherwise {@code null}. */
  public JobResult result() {
    return result;
  }

  public Workspace workspace() {
    return workspace.get();
  }

  /**
   * Binds {@code assigned} to this job.
   *
   * @throws IsolationException if the job already has a workspace
   */
  public void assignWorkspace(Workspace assigned) {
    if (!workspace.compareAndSet(null, assigned)) {
      throw new IsolationException("Job for tile " + tile.id() + " already owns workspace " + workspace.get().name() +
        ", refusing to also bind " + assigned.name());
    }
  }

  void start() {
    if (!state.compareAndSet(State.QUEUED, State.RUNNING)) {
      throw new IllegalStateException("Job for tile " + tile.id() + " cannot start from state " + state.get());
    }
  }

  void complete(JobResult jobResult) {
    if (jobResult.tileId() != tile.id()) {
      throw new IllegalArgumentException("Result for tile " + jobResult.tileId() + " reported by job for " + tile.id());
    }
    this.result = jobResult;
    if (!state.compareAndSet(State.RUNNING, State.COMPLETED)) {
      throw new IllegalStateException("Job for tile " + tile.id() + " cannot complete from state " + state.get());
    }
  }

  @Override
  public String toString() {
    return "Job{tile=" + tile.id() + ", state=" + state.get() + ", command=" + command + "}";
  }
}
