package com.cario.contimg.app.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Processing stage of a raw ingest unit. */
public enum IngestStage {
  ARRIVED("arrived"),
  GROUPED("grouped");

  private final String value;

  IngestStage(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static IngestStage fromValue(String value) {
    for (IngestStage candidate : values()) {
      if (candidate.value.equalsIgnoreCase(value)) {
        return candidate;
      }
    }
    throw new IllegalArgumentException("Unknown IngestStage: " + value);
  }
}
