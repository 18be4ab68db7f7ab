package com.cario.contimg.app.model;

/** What a single publish attempt did. */
public enum PublishOutcome {
  PUBLISHED,
  /** Another caller holds the row in {@code publishing}; nothing was done. */
  ALREADY_IN_PROGRESS,
  ALREADY_PUBLISHED,
  /** Attempt failed and the row went back to staging for a later retry. */
  RETRY_PENDING,
  /** Attempt failed and the attempt budget is used up; manual intervention required. */
  FAILED,
  /** Row is failed or otherwise not publishable without an operator reset. */
  NOT_ELIGIBLE,
  NOT_FOUND;

  public boolean isNoOp() {
    return this == ALREADY_IN_PROGRESS || this == ALREADY_PUBLISHED || this == NOT_ELIGIBLE;
  }
}
