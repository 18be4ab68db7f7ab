package com.cario.contimg.app.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Quality assessment verdict recorded by the QA stage. */
public enum QaStatus {
  PENDING("pending"),
  PASSED("passed"),
  FAILED("failed"),
  WARNING("warning");

  private final String value;

  QaStatus(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static QaStatus fromValue(String value) {
    for (QaStatus candidate : values()) {
      if (candidate.value.equalsIgnoreCase(value)) {
        return candidate;
      }
    }
    throw new IllegalArgumentException("Unknown QaStatus: " + value);
  }
}
