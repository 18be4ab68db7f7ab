package com.cario.contimg.app.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Publish status of a registry row. */
public enum ProductStatus {
  STAGING("staging"),
  PUBLISHING("publishing"),
  PUBLISHED("published"),
  FAILED("failed");

  private final String value;

  ProductStatus(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static ProductStatus fromValue(String value) {
    for (ProductStatus candidate : values()) {
      if (candidate.value.equalsIgnoreCase(value)) {
        return candidate;
      }
    }
    throw new IllegalArgumentException("Unknown ProductStatus: " + value);
  }
}
