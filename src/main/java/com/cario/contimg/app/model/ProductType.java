package com.cario.contimg.app.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of derived artifact tracked by the registry.
 *
 * <p>{@link #publishDirectory()} is the sub-directory of the production root a published product
 * of this type lands in. Science types need a passed QA verdict before they auto-publish.
 */
public enum ProductType {
  CONVERTED_SET("converted-set", "converted", false),
  CALIBRATED_SET("calibrated-set", "calibrated", true),
  IMAGE("image", "images", true),
  COMBINED_PRODUCT("combined-product", "combined", true);

  private final String value;
  private final String publishDirectory;
  private final boolean science;

  ProductType(String value, String publishDirectory, boolean science) {
    this.value = value;
    this.publishDirectory = publishDirectory;
    this.science = science;
  }

  @JsonValue
  public String value() {
    return value;
  }

  public String publishDirectory() {
    return publishDirectory;
  }

  public boolean isScience() {
    return science;
  }

  @JsonCreator
  public static ProductType fromValue(String value) {
    for (ProductType candidate : values()) {
      if (candidate.value.equalsIgnoreCase(value)) {
        return candidate;
      }
    }
    throw new IllegalArgumentException("Unknown ProductType: " + value);
  }
}
