package ca.gc.cra.premis.validation;

import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation utilities for document import and export.
 * <p><strong>Why:</strong> Fails fast with a readable message before the XML adapters open streams.</p>
 * <p><strong>Role:</strong> Domain support utilities executed by document adapters.</p>
 * <p><strong>Thread-safety:</strong> Stateless methods; filesystem state may change between checks.</p>
 * <p><strong>Observability:</strong> Emits no metrics or logs; callers surface validation exceptions.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates that a path names an existing, readable regular file.
   *
   * @param path candidate document location; must not be {@code null}
   * @return absolute normalized path
   * @throws IllegalArgumentException if the path is missing, not a regular file, or unreadable
   */
  public static Path requireReadableFile(Path path) {
    Path normalized = normalize(path);
    if (!Files.exists(normalized)) {
      throw new IllegalArgumentException("file does not exist: " + normalized);
    }
    if (!Files.isRegularFile(normalized)) {
      throw new IllegalArgumentException("path is not a regular file: " + normalized);
    }
    if (!Files.isReadable(normalized)) {
      throw new IllegalArgumentException("file is not readable: " + normalized);
    }
    return normalized;
  }

  /**
   * Validates that a file may be written at the given location.
   *
   * <p>The parent directory must exist and be writable; an existing target must be a writable regular file.</p>
   *
   * @param path candidate output file; must not be {@code null}
   * @return absolute normalized path
   * @throws IllegalArgumentException if the file cannot be created or replaced
   */
  public static Path requireWritableFile(Path path) {
    Path normalized = normalize(path);
    if (Files.exists(normalized, LinkOption.NOFOLLOW_LINKS)) {
      if (Files.isDirectory(normalized)) {
        throw new IllegalArgumentException("path is a directory: " + normalized);
      }
      if (!Files.isWritable(normalized)) {
        throw new IllegalArgumentException("file is not writable: " + normalized);
      }
      return normalized;
    }
    Path parent = normalized.getParent();
    if (parent == null) {
      throw new IllegalArgumentException("path has no parent to validate: " + normalized);
    }
    if (!Files.isDirectory(parent)) {
      throw new IllegalArgumentException("parent is not a directory: " + parent);
    }
    if (!Files.isWritable(parent)) {
      throw new IllegalArgumentException("parent directory is not writable: " + parent);
    }
    return normalized;
  }

  private static Path normalize(Path path) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    String raw = path.toString();
    if (raw.indexOf('\0') >= 0) {
      throw new IllegalArgumentException("path must not contain null bytes");
    }
    for (int i = 0; i < raw.length(); i++) {
      if (Character.isISOControl(raw.charAt(i))) {
        throw new IllegalArgumentException("path must not contain control characters");
      }
    }
    return path.toAbsolutePath().normalize();
  }
}
