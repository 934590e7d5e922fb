package com.onthegomap.tilerunner.worker;

import static com.onthegomap.tilerunner.util.Exceptions.throwFatalException;

import com.onthegomap.tilerunner.util.LogUtil;
import com.onthegomap.tilerunner.workspace.IsolationException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs queued jobs on a fixed pool of {@code workerCount} threads.
 * <p>
 * Each thread takes the next queued job, runs it to completion and only then takes another one, so no more than
 * {@code workerCount} jobs are ever running. The calling thread only blocks in {@link #run(List, JobHandler)} until
 * every dispatched job has finished. Results are returned ordered by tile id regardless of completion order.
 * <p>
 * With {@link FailurePolicy#FAIL_FAST} the first failure stops dispatching, lets jobs already running finish and then
 * throws a {@link TileFailuresException} listing every failure. With {@link FailurePolicy#COLLECT_ALL} every job runs
 * and failures are logged together at the end. An {@link IsolationException} always stops dispatching and is rethrown
 * once running jobs settle.
 */
public class WorkerScheduler {

  private static final Logger LOGGER = LoggerFactory.getLogger(WorkerScheduler.class);

  private final String prefix;
  private final int workerCount;
  private final FailurePolicy policy;
  private final AtomicInteger running = new AtomicInteger(0);
  private final AtomicInteger peakRunning = new AtomicInteger(0);

  /**
   * @param prefix      name for worker threads and log stages
   * @param workerCount maximum number of jobs running at the same time
   * @param policy      what to do with remaining jobs after one fails
   */
  public WorkerScheduler(String prefix, int workerCount, FailurePolicy policy) {
    if (workerCount < 1) {
      throw new IllegalArgumentException("workerCount must be at least 1, got " + workerCount);
    }
    this.prefix = prefix;
    this.workerCount = workerCount;
    this.policy = policy;
  }

  /** Outcome of a scheduler run. */
  public record Report(List<JobResult> results, List<Integer> notRun, int peakConcurrency) {

    public Report {
      results = List.copyOf(results);
      notRun = List.copyOf(notRun);
    }

    public List<JobResult> failures() {
      return results.stream().filter(JobResult::isFailed).toList();
    }

    public boolean hasFailures() {
      return results.stream().anyMatch(JobResult::isFailed);
    }
  }

  /**
   * Runs {@code jobs} and blocks until all dispatched jobs are complete.
   *
   * @throws TileFailuresException if a job failed under {@link FailurePolicy#FAIL_FAST}
   * @throws IsolationException    if any job detected a workspace isolation problem
   */
  public Report run(List<Job> jobs, JobHandler handler) {
    Queue<Job> queue = new ConcurrentLinkedQueue<>(jobs);
    Map<Integer, JobResult> results = new ConcurrentHashMap<>();
    AtomicBoolean stop = new AtomicBoolean(false);
    AtomicReference<IsolationException> isolationFailure = new AtomicReference<>();
    String parentStage = LogUtil.getStage();
    int threads = Math.max(1, Math.min(workerCount, jobs.size()));
    LOGGER.info("Running {} jobs on {} workers", jobs.size(), threads);

    var es = Executors.newFixedThreadPool(threads, new NamedThreadFactory(prefix));
    List<CompletableFuture<?>> futures = new ArrayList<>();
    for (int i = 0; i < threads; i++) {
      futures.add(CompletableFuture.runAsync(() -> {
        Job job;
        while (!stop.get() && (job = queue.poll()) != null) {
          JobResult result = runOne(job, handler, parentStage, stop, isolationFailure);
          if (results.putIfAbsent(job.tileId(), result) != null) {
            throw new IllegalStateException("tile " + job.tileId() + " was scheduled twice");
          }
        }
      }, es));
    }
    es.shutdown();
    try {
      CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).get();
    } catch (ExecutionException e) {
      throwFatalException(e.getCause());
    } catch (InterruptedException e) {
      throwFatalException(e);
    }

    List<Integer> notRun = new ArrayList<>();
    for (Job job : queue) {
      notRun.add(job.tileId());
    }
    notRun.sort(Comparator.naturalOrder());
    List<JobResult> ordered = new ArrayList<>(results.values());
    ordered.sort(Comparator.comparingInt(JobResult::tileId));
    Report report = new Report(ordered, notRun, peakRunning.get());

    if (isolationFailure.get() != null) {
      throw isolationFailure.get();
    }
    if (report.hasFailures()) {
      for (JobResult failure : report.failures()) {
        LOGGER.error("Tile {} failed: {}", failure.tileId(), failure.errorDetail());
      }
      if (!notRun.isEmpty()) {
        LOGGER.warn("{} tiles were not run after the first failure: {}", notRun.size(), notRun);
      }
      if (policy == FailurePolicy.FAIL_FAST) {
        throw new TileFailuresException(report.failures(), notRun);
      }
    }
    return report;
  }

  private JobResult runOne(Job job, JobHandler handler, String parentStage, AtomicBoolean stop,
    AtomicReference<IsolationException> isolationFailure) {
    LogUtil.setStage(parentStage, "tile_" + job.tileId());
    job.start();
    peakRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
    JobResult result;
    try {
      result = handler.run(job);
      if (result == null) {
        result = JobResult.failed(job.tileId(), "worker returned no result for " + job.command(), "");
      }
    } catch (IsolationException e) {
      LOGGER.error("Workspace isolation broken, stopping the run", e);
      isolationFailure.compareAndSet(null, e);
      stop.set(true);
      result = JobResult.failed(job.tileId(), e.getMessage(), "");
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      result = JobResult.failed(job.tileId(), "interrupted while running " + job.command(), "");
    } catch (Exception e) {
      LOGGER.debug("Job failed with exception", e);
      result = JobResult.failed(job.tileId(), e + "\ncommand: " + job.command(), "");
    } finally {
      running.decrementAndGet();
    }
    if (result.isFailed() && policy == FailurePolicy.FAIL_FAST && !stop.getAndSet(true)) {
      LOGGER.warn("Tile {} failed, not starting any more tiles", job.tileId());
    }
    job.complete(result);
    LogUtil.setStage(parentStage, prefix);
    return result;
  }

  public int peakConcurrency() {
    return peakRunning.get();
  }

  /** A thread factory that prepends {@code name-} to all thread names. */
  private static class NamedThreadFactory implements ThreadFactory {

    private final ThreadGroup group;
    private final AtomicInteger threadNumber = new AtomicInteger(1);
    private final String namePrefix;

    private NamedThreadFactory(String name) {
      group = Thread.currentThread().getThreadGroup();
      namePrefix = name + "-";
    }

    @Override
    public Thread newThread(Runnable r) {
      Thread t = new Thread(group, r, namePrefix + threadNumber.getAndIncrement(), 0);
      if (!t.isDaemon()) {
        t.setDaemon(true);
      }
      if (t.getPriority() != Thread.NORM_PRIORITY) {
        t.setPriority(Thread.NORM_PRIORITY);
      }
      return t;
    }
  }
}
