package com.cario.contimg.app.service;

import com.cario.contimg.app.error.ErrorKind;
import com.cario.contimg.app.error.PipelineException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Confines storage paths to a root directory.
 *
 * <p>A path is accepted only if it has no {@code ..} component and its fully resolved form (all
 * symlinks followed) lies strictly below the resolved root. Anything else fails closed with {@link
 * ErrorKind#PATH_VALIDATION}.
 */
public class PathGuard {

  private final Path root;

  public PathGuard(Path root) {
    this.root = root.toAbsolutePath().normalize();
  }

  public Path getRoot() {
    return root;
  }

  /** Validates an existing file or directory and returns its resolved location. */
  public Path requireExistingInside(String candidate) {
    Path lexical = lexicallyInside(candidate);
    if (!Files.exists(lexical, LinkOption.NOFOLLOW_LINKS)) {
      throw new PipelineException(ErrorKind.STORAGE_FAILURE, "Path does not exist: " + lexical);
    }
    Path real;
    try {
      real = lexical.toRealPath();
    } catch (IOException e) {
      // dangling symlink or unreadable component
      throw new PipelineException(
          ErrorKind.PATH_VALIDATION, "Path cannot be resolved: " + lexical, e);
    }
    requireBelowRoot(real, candidate);
    return real;
  }

  /**
   * Creates the parent of {@code candidate} on demand and checks that it resolves inside the root.
   * Says nothing about whether {@code candidate} itself exists.
   */
  public Path requireParentInside(Path candidate) {
    Path lexical = lexicallyInside(candidate.toString());
    Path parent = lexical.getParent();
    try {
      Files.createDirectories(parent);
      Path realParent = parent.toRealPath();
      requireBelowOrAtRoot(realParent, candidate.toString());
    } catch (IOException e) {
      throw new PipelineException(
          ErrorKind.STORAGE_FAILURE,
          "Cannot prepare directory " + parent + ": " + e.getMessage(),
          e);
    }
    return lexical;
  }

  /** True if the path would pass {@link #requireExistingInside} without touching the disk. */
  public boolean isLexicallyInside(String candidate) {
    try {
      lexicallyInside(candidate);
      return true;
    } catch (PipelineException e) {
      return false;
    }
  }

  private Path lexicallyInside(String candidate) {
    if (candidate == null || candidate.isBlank()) {
      throw new PipelineException(ErrorKind.PATH_VALIDATION, "Path is empty");
    }
    Path raw;
    try {
      raw = Paths.get(candidate);
    } catch (InvalidPathException e) {
      throw new PipelineException(ErrorKind.PATH_VALIDATION, "Invalid path: " + candidate, e);
    }
    for (Path part : raw) {
      if ("..".equals(part.toString())) {
        throw new PipelineException(
            ErrorKind.PATH_VALIDATION, "Path contains a traversal component: " + candidate);
      }
    }
    Path absolute = raw.isAbsolute() ? raw.normalize() : root.resolve(raw).normalize();
    if (!absolute.startsWith(root) || absolute.equals(root)) {
      throw new PipelineException(
          ErrorKind.PATH_VALIDATION, "Path " + candidate + " is outside root " + root);
    }
    return absolute;
  }

  private void requireBelowRoot(Path real, String candidate) {
    Path realRoot = realRoot();
    if (!real.startsWith(realRoot) || real.equals(realRoot)) {
      throw new PipelineException(
          ErrorKind.PATH_VALIDATION,
          "Path " + candidate + " resolves to " + real + " outside root " + realRoot);
    }
  }

  private void requireBelowOrAtRoot(Path real, String candidate) {
    Path realRoot = realRoot();
    if (!real.startsWith(realRoot)) {
      throw new PipelineException(
          ErrorKind.PATH_VALIDATION,
          "Path " + candidate + " resolves to " + real + " outside root " + realRoot);
    }
  }

  private Path realRoot() {
    try {
      return root.toRealPath();
    } catch (IOException e) {
      throw new PipelineException(
          ErrorKind.STORAGE_FAILURE, "Storage root is not accessible: " + root, e);
    }
  }
}
