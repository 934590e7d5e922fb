package com.onthegomap.tilerunner.util;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;

/**
 * Convenience methods for working with files on disk.
 */
public class FileUtils {

  private FileUtils() {}

  /**
   * Deletes a file or directory tree, reporting failures to the caller instead of logging them.
   *
   * @return {@code false} if there was nothing to delete
   * @throws IOException if something under {@code path} could not be removed
   */
  public static boolean deleteRecursivelyOrThrow(Path path) throws IOException {
    if (!Files.exists(path)) {
      return false;
    }
    if (Files.isDirectory(path)) {
      try (var walker = Files.walk(path)) {
        for (Path child : walker.sorted(Comparator.reverseOrder()).toList()) {
          Files.deleteIfExists(child);
        }
      } catch (NoSuchFileException e) {
        // removed concurrently
      }
    } else {
      Files.deleteIfExists(path);
    }
    return true;
  }

  /**
   * Moves a file, replacing anything at {@code to}.
   *
   * @throws UncheckedIOException if an error occurs
   */
  public static void move(Path from, Path to) {
    try {
      createParentDirectories(to);
      Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  /**
   * Ensures a directory and all parent directories exists.
   *
   * @throws IllegalStateException if an error occurs
   */
  public static void createDirectory(Path path) {
    try {
      Files.createDirectories(path);
    } catch (IOException e) {
      throw new IllegalStateException("Unable to create directories " + path, e);
    }
  }

  /**
   * Ensures all parent directories of each path in {@code paths} exist.
   *
   * @throws IllegalStateException if an error occurs
   */
  public static void createParentDirectories(Path... paths) {
    for (var path : paths) {
      try {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null && !Files.exists(parent)) {
          Files.createDirectories(parent);
        }
      } catch (IOException e) {
        throw new IllegalStateException("Unable to create parent directories " + path, e);
      }
    }
  }
}
