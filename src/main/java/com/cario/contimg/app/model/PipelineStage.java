package com.cario.contimg.app.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Processing stages a product moves through, in pipeline order. */
public enum PipelineStage {
  CONVERTED("converted"),
  CALIBRATED("calibrated"),
  IMAGED("imaged"),
  COMBINED("combined");

  private final String value;

  PipelineStage(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  /** True when moving from this stage to {@code next} does not go backwards. */
  public boolean canAdvanceTo(PipelineStage next) {
    return next.ordinal() >= ordinal();
  }

  /** Stage a freshly registered product of the given type starts in. */
  public static PipelineStage initialFor(ProductType type) {
    switch (type) {
      case CALIBRATED_SET:
        return CALIBRATED;
      case IMAGE:
        return IMAGED;
      case COMBINED_PRODUCT:
        return COMBINED;
      case CONVERTED_SET:
      default:
        return CONVERTED;
    }
  }

  @JsonCreator
  public static PipelineStage fromValue(String value) {
    for (PipelineStage candidate : values()) {
      if (candidate.value.equalsIgnoreCase(value)) {
        return candidate;
      }
    }
    throw new IllegalArgumentException("Unknown PipelineStage: " + value);
  }
}
