package com.onthegomap.tilerunner.engine;

import com.onthegomap.tilerunner.workspace.WorkspaceContext;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs each engine operation as a child process: {@code <launcher...> <operation> key=value... -flags}.
 * <p>
 * The process starts in the workspace directory and finds its identity in the {@code TILERUNNER_WORKSPACE},
 * {@code TILERUNNER_WORKSPACE_DIR} and {@code TILERUNNER_INPUT_STORE} environment variables. Output is redirected to
 * files in the workspace and read back in full once the process exits.
 */
public class ProcessEngine implements Engine {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProcessEngine.class);
  public static final String WORKSPACE_ENV = "TILERUNNER_WORKSPACE";
  public static final String WORKSPACE_DIR_ENV = "TILERUNNER_WORKSPACE_DIR";
  public static final String INPUT_STORE_ENV = "TILERUNNER_INPUT_STORE";
  static final String STDOUT_FILE = "engine-stdout.log";
  static final String STDERR_FILE = "engine-stderr.log";

  private final List<String> launcher;
  private final Duration timeout;
  private final Map<String, String> environment;

  /**
   * @param launcher command prefix, for example {@code ["grass", "--exec"]}, empty to run operations directly
   * @param timeout  maximum run time of one call, {@link Duration#ZERO} for no limit
   */
  public ProcessEngine(List<String> launcher, Duration timeout, Map<String, String> environment) {
    this.launcher = List.copyOf(launcher);
    this.timeout = timeout;
    this.environment = Map.copyOf(environment);
  }

  public ProcessEngine(List<String> launcher, Duration timeout) {
    this(launcher, timeout, Map.of());
  }

  @Override
  public EngineResult execute(EngineCommand command, WorkspaceContext context)
    throws IOException, InterruptedException {
    var workspace = context.workspace();
    List<String> args = new ArrayList<>(launcher);
    args.addAll(command.toArgs());
    Path stdout = workspace.resolve(STDOUT_FILE);
    Path stderr = workspace.resolve(STDERR_FILE);

    ProcessBuilder builder = new ProcessBuilder(args)
      .directory(workspace.directory().toFile())
      .redirectOutput(stdout.toFile())
      .redirectError(stderr.toFile());
    var env = builder.environment();
    env.putAll(environment);
    env.put(WORKSPACE_ENV, workspace.name());
    env.put(WORKSPACE_DIR_ENV, workspace.directory().toAbsolutePath().toString());
    env.put(INPUT_STORE_ENV, workspace.inputStore().toAbsolutePath().toString());

    LOGGER.debug("Running {}", args);
    long start = System.nanoTime();
    Process process = builder.start();
    boolean timedOut = false;
    try {
      if (timeout.isZero()) {
        process.waitFor();
      } else if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
        LOGGER.warn("{} did not finish within {}, killing it", command.operation(), timeout);
        timedOut = true;
        process.destroyForcibly();
        process.waitFor();
      }
    } catch (InterruptedException e) {
      process.destroyForcibly();
      throw e;
    }
    Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
    String err = read(stderr);
    if (timedOut) {
      err = err + (err.isEmpty() || err.endsWith("\n") ? "" : "\n") + "killed after exceeding worker timeout of " +
        timeout;
    }
    return new EngineResult(process.exitValue(), read(stdout), err, elapsed, timedOut);
  }

  private static String read(Path path) throws IOException {
    return Files.exists(path) ? new String(Files.readAllBytes(path), StandardCharsets.UTF_8) : "";
  }
}
