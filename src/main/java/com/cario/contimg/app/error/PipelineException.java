package com.cario.contimg.app.error;

import java.util.Objects;

/** Unchecked failure carrying an {@link ErrorKind}. */
public class PipelineException extends RuntimeException {

  private final ErrorKind kind;

  public PipelineException(ErrorKind kind, String message) {
    super(message);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public PipelineException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public ErrorKind getKind() {
    return kind;
  }

  public static PipelineException notFound(String what, String id) {
    return new PipelineException(ErrorKind.NOT_FOUND, what + " not found: " + id);
  }

  @Override
  public String toString() {
    return "PipelineException[" + kind + "]: " + getMessage();
  }
}
