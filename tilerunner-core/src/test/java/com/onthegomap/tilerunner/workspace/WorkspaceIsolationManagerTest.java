package com.onthegomap.tilerunner.workspace;

import static org.junit.jupiter.api.Assertions.*;

import com.onthegomap.tilerunner.cleanup.CleanupRegistry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class WorkspaceIsolationManagerTest {

  @TempDir
  Path tmp;
  private final CleanupRegistry cleanup = new CleanupRegistry();
  private WorkspaceIsolationManager manager;

  @BeforeEach
  void setup() {
    manager = new WorkspaceIsolationManager(tmp.resolve("workspaces"), "abc123", tmp.resolve("inputs"), cleanup);
  }

  @Test
  void testAcquireEnterRelease() throws IOException {
    Workspace workspace = manager.acquire(7);
    assertEquals("tile_7_abc123", workspace.name());
    assertEquals(7, workspace.tileId());
    assertEquals(tmp.resolve("inputs"), workspace.inputStore());
    assertTrue(Files.isDirectory(workspace.directory()));
    assertEquals(1, manager.activeCount());

    WorkspaceContext context = manager.enter(workspace);
    assertEquals("tile_7_abc123", context.name());
    Files.writeString(workspace.resolve("output.geojson"), "{}");

    manager.release(workspace);
    assertFalse(Files.exists(workspace.directory()));
    assertEquals(0, manager.activeCount());
    manager.release(workspace);
    assertEquals(0, cleanup.pending());
  }

  @Test
  void testSameTileTwiceFails() {
    manager.acquire(1);
    assertThrows(IsolationException.class, () -> manager.acquire(1));
    assertEquals(1, manager.activeCount());
  }

  @Test
  void testLeftoverDirectoryFails() throws IOException {
    Files.createDirectories(tmp.resolve("workspaces").resolve("tile_3_abc123"));
    var error = assertThrows(IsolationException.class, () -> manager.acquire(3));
    assertTrue(error.getMessage().contains("already exists"), error.getMessage());
    assertTrue(Files.exists(tmp.resolve("workspaces").resolve("tile_3_abc123")));
  }

  @Test
  void testTamperedStampFails() throws IOException {
    Workspace workspace = manager.acquire(2);
    Files.writeString(workspace.resolve(WorkspaceIsolationManager.STAMP_FILE), "tile_5_abc123");
    assertThrows(IsolationException.class, () -> manager.enter(workspace));
  }

  @Test
  void testEnterAfterReleaseFails() {
    Workspace workspace = manager.acquire(2);
    manager.release(workspace);
    assertThrows(IsolationException.class, () -> manager.enter(workspace));
  }

  @Test
  void testVerifyMismatch() {
    Workspace a = manager.acquire(1);
    Workspace b = manager.acquire(2);
    WorkspaceContext context = manager.enter(a);
    WorkspaceIsolationManager.verify(context, a);
    assertThrows(IsolationException.class, () -> WorkspaceIsolationManager.verify(context, b));
    assertThrows(IsolationException.class, () -> WorkspaceIsolationManager.verify(null, b));
  }

  @Test
  void testUnreleasedWorkspacesRemovedByCleanup() {
    Workspace a = manager.acquire(1);
    Workspace b = manager.acquire(2);
    cleanup.drainAll();
    assertFalse(Files.exists(a.directory()));
    assertFalse(Files.exists(b.directory()));
  }

  @Test
  void testConcurrentAcquireGivesDistinctWorkspaces() {
    Set<Path> directories = ConcurrentHashMap.newKeySet();
    IntStream.rangeClosed(1, 50).parallel().forEach(id -> {
      Workspace workspace = manager.acquire(id);
      manager.enter(workspace);
      directories.add(workspace.directory());
    });
    assertEquals(50, directories.size());
    assertEquals(50, manager.activeCount());
  }

  @Test
  void testRunTokensDiffer() {
    Set<String> tokens = new HashSet<>();
    for (int i = 0; i < 100; i++) {
      tokens.add(WorkspaceIsolationManager.newRunToken());
    }
    assertEquals(100, tokens.size());
    assertEquals(12, List.copyOf(tokens).get(0).length());
  }
}
