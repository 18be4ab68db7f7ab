package com.cario.contimg.app.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Lifecycle of a processing group: formed, processing, complete or failed. */
public enum GroupStatus {
  FORMED("formed"),
  PROCESSING("processing"),
  COMPLETE("complete"),
  FAILED("failed");

  private final String value;

  GroupStatus(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static GroupStatus fromValue(String value) {
    for (GroupStatus candidate : values()) {
      if (candidate.value.equalsIgnoreCase(value)) {
        return candidate;
      }
    }
    throw new IllegalArgumentException("Unknown GroupStatus: " + value);
  }
}
