package ca.gc.cra.logmerge.validation;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.List;

/**
 * Path validation for merge sources and destinations.
 *
 * @since 0.1.0
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Parses a user-supplied path, rejecting null bytes and control characters.
   *
   * @throws IllegalArgumentException if the path is blank or malformed
   */
  public static Path parse(String name, String raw) {
    String value = Strings.requireNonBlank(name, raw);
    try {
      return Path.of(value).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + value, ex);
    }
  }

  /**
   * Ensures {@code path} is an existing, readable regular file.
   *
   * @throws IllegalArgumentException otherwise
   */
  public static Path validateReadableFile(Path path) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    if (!Files.isRegularFile(path)) {
      throw new IllegalArgumentException("source is not a regular file: " + path);
    }
    if (!Files.isReadable(path)) {
      throw new IllegalArgumentException("source is not readable: " + path);
    }
    return path;
  }

  /**
   * Ensures {@code path} can be created or truncated as the merge destination.
   *
   * @param path destination file
   * @param allowOverwrite whether an existing file may be replaced
   * @throws IllegalArgumentException when the destination is a directory, exists without
   *     {@code allowOverwrite}, or its nearest existing ancestor is not a writable directory
   */
  public static Path validateWritableFile(Path path, boolean allowOverwrite) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    if (Files.exists(path, LinkOption.NOFOLLOW_LINKS)) {
      if (Files.isDirectory(path)) {
        throw new IllegalArgumentException("destination is a directory: " + path);
      }
      if (!allowOverwrite) {
        throw new IllegalArgumentException(
            "destination " + path + " already exists; re-run with --allow-overwrite to replace it");
      }
      if (!Files.isWritable(path)) {
        throw new IllegalArgumentException("destination is not writable: " + path);
      }
      return path;
    }
    Path ancestor = path.getParent();
    while (ancestor != null && !Files.exists(ancestor)) {
      ancestor = ancestor.getParent();
    }
    if (ancestor == null || !Files.isDirectory(ancestor) || !Files.isWritable(ancestor)) {
      throw new IllegalArgumentException("destination directory is not writable: " + path.getParent());
    }
    return path;
  }

  /**
   * Rejects a destination that is also one of the sources.
   *
   * @throws IllegalArgumentException when {@code destination} equals a source
   */
  public static void requireDistinct(Path destination, List<Path> sources) {
    for (Path source : sources) {
      if (source.equals(destination)) {
        throw new IllegalArgumentException("destination must not be one of the sources: " + destination);
      }
    }
  }
}
