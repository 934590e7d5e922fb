package com.onthegomap.tilerunner.cleanup;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import javax.annotation.concurrent.ThreadSafe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Run-wide list of {@link TransientResource transient resources} that get removed in one pass when the run ends.
 * <p>
 * Entries are never removed from the list. {@link #release(TransientResource)} removes a resource early and only marks
 * its entry, so {@link #drainAll()} sees every registration and skips the ones that are already gone. The drain runs
 * exactly once, in reverse registration order, whether the run succeeds, fails or the JVM shuts down.
 */
@ThreadSafe
public class CleanupRegistry {

  private static final Logger LOGGER = LoggerFactory.getLogger(CleanupRegistry.class);

  private final List<Entry> entries = new ArrayList<>();
  private final AtomicBoolean drained = new AtomicBoolean(false);

  private static class Entry {
    private final TransientResource resource;
    private boolean removed = false;

    private Entry(TransientResource resource) {
      this.resource = resource;
    }
  }

  /**
   * Adds {@code resource} to the list drained at the end of the run.
   *
   * @throws IllegalStateException if the registry has already been drained
   */
  public <T extends TransientResource> T register(T resource) {
    synchronized (entries) {
      if (drained.get()) {
        throw new IllegalStateException("Cannot register " + resource.description() + " after cleanup ran");
      }
      entries.add(new Entry(resource));
    }
    LOGGER.trace("Registered {}", resource.description());
    return resource;
  }

  /**
   * Removes {@code resource} now instead of at the end of the run.
   * <p>
   * A failure is logged and the resource stays pending so the final drain tries again.
   *
   * @return {@code true} if the resource is gone after this call
   */
  public boolean release(TransientResource resource) {
    Entry entry = find(resource);
    if (entry == null) {
      throw new IllegalArgumentException(resource.description() + " was never registered");
    }
    synchronized (entry) {
      if (entry.removed) {
        return true;
      }
      try {
        entry.resource.release();
        entry.removed = true;
        return true;
      } catch (Exception e) {
        LOGGER.warn("Unable to release {} early, will retry during cleanup: {}", resource.description(), e.toString());
        return false;
      }
    }
  }

  /** Returns the number of registered resources that have not been removed yet. */
  public int pending() {
    synchronized (entries) {
      int result = 0;
      for (Entry entry : entries) {
        synchronized (entry) {
          if (!entry.removed) {
            result++;
          }
        }
      }
      return result;
    }
  }

  public boolean isDrained() {
    return drained.get();
  }

  /**
   * Removes every pending resource in reverse registration order.
   * <p>
   * Resources that are already gone are skipped. A resource that fails to release does not stop the drain: the error
   * is logged and reported in the result. Only the first call does anything, later ones return
   * {@link DrainReport#NOTHING}.
   */
  public DrainReport drainAll() {
    List<Entry> toDrain;
    synchronized (entries) {
      if (!drained.compareAndSet(false, true)) {
        return DrainReport.NOTHING;
      }
      toDrain = new ArrayList<>(entries);
    }
    int released = 0;
    int alreadyRemoved = 0;
    List<DrainReport.Failure> failures = new ArrayList<>();
    for (int i = toDrain.size() - 1; i >= 0; i--) {
      Entry entry = toDrain.get(i);
      synchronized (entry) {
        if (entry.removed) {
          alreadyRemoved++;
          continue;
        }
        try {
          if (entry.resource.release()) {
            released++;
          } else {
            alreadyRemoved++;
          }
          entry.removed = true;
        } catch (Exception e) {
          LOGGER.error("Failed to clean up {}", entry.resource.description(), e);
          failures.add(new DrainReport.Failure(entry.resource.description(), e));
        }
      }
    }
    if (!failures.isEmpty()) {
      LOGGER.error("{} of {} temporary resources could not be removed", failures.size(), toDrain.size());
    } else {
      LOGGER.debug("Cleaned up {} temporary resources ({} already removed)", released, alreadyRemoved);
    }
    return new DrainReport(released, alreadyRemoved, failures);
  }

  /** Drains this registry when the JVM exits, for runs that are killed before they finish normally. */
  public CleanupRegistry installShutdownHook() {
    Runtime.getRuntime().addShutdownHook(new Thread(this::drainAll, "tilerunner-cleanup"));
    return this;
  }

  private Entry find(TransientResource resource) {
    synchronized (entries) {
      for (Entry entry : entries) {
        if (entry.resource == resource) {
          return entry;
        }
      }
      return null;
    }
  }
}
