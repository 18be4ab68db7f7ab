package com.cario.contimg.app.error;

/**
 * Closed set of failure kinds raised by the orchestrator.
 *
 * <p>Callers switch on the kind to decide between "already done", "retry later" and "stop and
 * surface to an operator" instead of inspecting exception messages.
 */
public enum ErrorKind {
  /** Identical ingest unit is already queued and not yet grouped. */
  DUPLICATE_UNIT(Severity.BENIGN),
  /** A product with the same data id is already registered. */
  DUPLICATE_DATA_ID(Severity.BENIGN),
  /** Another caller claimed at least one of the units first. */
  PARTIAL_CLAIM(Severity.TRANSIENT),
  NOT_FOUND(Severity.FATAL),
  /** A staging or production path resolves outside its root. */
  PATH_VALIDATION(Severity.FATAL),
  WORKER_UNAVAILABLE(Severity.TRANSIENT),
  TIMEOUT_EXCEEDED(Severity.TRANSIENT),
  /** Requested state change is not allowed from the current state. */
  INVALID_TRANSITION(Severity.FATAL),
  STORAGE_FAILURE(Severity.TRANSIENT),
  /** External tool ran but exited non-zero. */
  TOOL_FAILURE(Severity.TRANSIENT);

  /** How a caller is expected to react. */
  public enum Severity {
    BENIGN,
    TRANSIENT,
    FATAL
  }

  private final Severity severity;

  ErrorKind(Severity severity) {
    this.severity = severity;
  }

  public Severity severity() {
    return severity;
  }

  public boolean isBenign() {
    return severity == Severity.BENIGN;
  }

  public boolean isRetryable() {
    return severity == Severity.TRANSIENT;
  }
}
