package com.cario.contimg.app.service;

import java.io.IOException;
import java.nio.file.Path;

/** Moves a product (file or directory tree) from staging to production storage. */
public interface StorageMover {

  /**
   * @param destination a name the caller has already reserved: an empty file, or an empty
   *     directory when {@code source} is a directory. Implementations replace that placeholder and
   *     nothing else.
   * @throws java.nio.file.FileAlreadyExistsException if {@code destination} holds data
   */
  void move(Path source, Path destination) throws IOException;
}
