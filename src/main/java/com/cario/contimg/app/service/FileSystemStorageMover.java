package com.cario.contimg.app.service;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.stream.Stream;
import lombok.extern.log4j.Log4j2;
import org.apache.commons.io.FileUtils;

/**
 * Renames within a filesystem; falls back to copy-and-delete when staging and production live on
 * different devices. Only an empty reserved placeholder is ever replaced.
 */
@Log4j2
public class FileSystemStorageMover implements StorageMover {

  @Override
  public void move(Path source, Path destination) throws IOException {
    requireEmptyPlaceholder(destination);
    try {
      Files.move(source, destination, StandardCopyOption.ATOMIC_MOVE);
      log.debug("storage.move rename src={} dest={}", source, destination);
    } catch (AtomicMoveNotSupportedException e) {
      log.info("storage.move cross-device copy src={} dest={}", source, destination);
      Files.delete(destination);
      // commons-io refuses an existing destination, so a name taken meanwhile fails here
      if (Files.isDirectory(source)) {
        FileUtils.moveDirectory(source.toFile(), destination.toFile());
      } else {
        FileUtils.moveFile(source.toFile(), destination.toFile());
      }
    }
  }

  /** True for an empty regular file or an empty directory, never for a symlink. */
  static boolean isEmptyPlaceholder(Path path) throws IOException {
    if (Files.isSymbolicLink(path)) {
      return false;
    }
    if (Files.isDirectory(path, LinkOption.NOFOLLOW_LINKS)) {
      try (Stream<Path> entries = Files.list(path)) {
        return entries.findAny().isEmpty();
      }
    }
    return Files.isRegularFile(path, LinkOption.NOFOLLOW_LINKS) && Files.size(path) == 0;
  }

  private static void requireEmptyPlaceholder(Path destination) throws IOException {
    if (!Files.exists(destination, LinkOption.NOFOLLOW_LINKS)) {
      throw new NoSuchFileException(destination.toString(), null, "destination not reserved");
    }
    if (!isEmptyPlaceholder(destination)) {
      throw new FileAlreadyExistsException(
          destination.toString(), null, "destination holds data, refusing to replace it");
    }
  }
}
