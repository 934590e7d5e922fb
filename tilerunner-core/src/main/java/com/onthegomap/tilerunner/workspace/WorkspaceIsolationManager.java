package com.onthegomap.tilerunner.workspace;

import com.onthegomap.tilerunner.cleanup.CleanupRegistry;
import com.onthegomap.tilerunner.cleanup.TransientResource;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import javax.annotation.concurrent.ThreadSafe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates and removes the {@link Workspace} of each job so that concurrent jobs never share state.
 * <p>
 * Isolation relies on unique names rather than locks: every workspace is named after its tile and a token unique to
 * the run, and creating one whose directory already exists fails instead of reusing it. Each workspace directory holds
 * a stamp file with its name which {@link #enter(Workspace)} checks before any engine call runs inside it.
 */
@ThreadSafe
public class WorkspaceIsolationManager {

  private static final Logger LOGGER = LoggerFactory.getLogger(WorkspaceIsolationManager.class);
  static final String STAMP_FILE = ".tilerunner-workspace";

  private final Path root;
  private final String runToken;
  private final Path inputStore;
  private final CleanupRegistry cleanup;
  private final Map<String, TransientResource> active = new ConcurrentHashMap<>();

  public WorkspaceIsolationManager(Path root, String runToken, Path inputStore, CleanupRegistry cleanup) {
    this.root = root;
    this.runToken = runToken;
    this.inputStore = inputStore;
    this.cleanup = cleanup;
  }

  /** Returns a new random token to tell the workspaces of this run apart from those of any other run. */
  public static String newRunToken() {
    return UUID.randomUUID().toString().replace("-", "").substring(0, 12);
  }

  public String runToken() {
    return runToken;
  }

  /**
   * Creates the workspace for {@code tileId}.
   *
   * @throws IsolationException if the workspace already exists in this run or on disk
   */
  public Workspace acquire(int tileId) {
    String name = Workspace.name(tileId, runToken);
    Path directory = root.resolve(name);
    Workspace workspace = new Workspace(name, tileId, runToken, directory, inputStore);
    TransientResource resource = TransientResource.ofPath(directory);
    if (active.putIfAbsent(name, resource) != null) {
      throw new IsolationException("Workspace " + name + " is already in use by another job");
    }
    try {
      Files.createDirectories(root);
      Files.createDirectory(directory);
    } catch (FileAlreadyExistsException e) {
      active.remove(name);
      throw new IsolationException("Workspace " + directory + " already exists, it may be left over from a crashed " +
        "run and must be removed by hand", e);
    } catch (IOException e) {
      active.remove(name);
      throw new IsolationException("Unable to create workspace " + directory, e);
    }
    // register before writing anything so a partially created workspace still gets removed
    cleanup.register(resource);
    try {
      Files.writeString(directory.resolve(STAMP_FILE), name, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new IsolationException("Unable to write identity stamp into " + directory, e);
    }
    LOGGER.debug("Acquired workspace {}", name);
    return workspace;
  }

  /**
   * Switches into {@code workspace} and checks that the directory really belongs to it.
   *
   * @throws IsolationException if the stamp is missing or names another workspace
   */
  public WorkspaceContext enter(Workspace workspace) {
    if (!active.containsKey(workspace.name())) {
      throw new IsolationException("Workspace " + workspace.name() + " was not acquired or was already released");
    }
    String stamp;
    try {
      stamp = Files.readString(workspace.directory().resolve(STAMP_FILE), StandardCharsets.UTF_8).strip();
    } catch (IOException e) {
      throw new IsolationException("Unable to verify workspace " + workspace.name() + ": identity stamp unreadable", e);
    }
    WorkspaceContext context = new WorkspaceContext(workspace);
    if (!stamp.equals(workspace.name())) {
      throw new IsolationException(
        "Workspace directory " + workspace.directory() + " belongs to " + stamp + ", expected " + workspace.name());
    }
    verify(context, workspace);
    return context;
  }

  /**
   * Fails if {@code context} is not the handle of {@code expected}.
   *
   * @throws IsolationException on mismatch
   */
  public static void verify(WorkspaceContext context, Workspace expected) {
    if (context == null || !context.workspace().equals(expected)) {
      throw new IsolationException("Active workspace " + (context == null ? null : context.name()) +
        " does not match expected workspace " + expected.name());
    }
  }

  /**
   * Removes everything inside {@code workspace}. Safe to call more than once and on workspaces a failed job left half
   * built; a directory that cannot be removed now stays registered for the final cleanup.
   */
  public void release(Workspace workspace) {
    TransientResource resource = active.remove(workspace.name());
    if (resource == null) {
      LOGGER.trace("Workspace {} already released", workspace.name());
      return;
    }
    if (cleanup.release(resource)) {
      LOGGER.debug("Released workspace {}", workspace.name());
    }
  }

  /** Returns the number of workspaces acquired and not yet released. */
  public int activeCount() {
    return active.size();
  }
}
