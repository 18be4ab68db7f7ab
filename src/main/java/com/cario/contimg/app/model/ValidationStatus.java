package com.cario.contimg.app.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Validation verdict recorded when a product is finalized. */
public enum ValidationStatus {
  PENDING("pending"),
  VALIDATED("validated"),
  INVALID("invalid");

  private final String value;

  ValidationStatus(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static ValidationStatus fromValue(String value) {
    for (ValidationStatus candidate : values()) {
      if (candidate.value.equalsIgnoreCase(value)) {
        return candidate;
      }
    }
    throw new IllegalArgumentException("Unknown ValidationStatus: " + value);
  }
}
