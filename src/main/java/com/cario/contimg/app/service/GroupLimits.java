package com.cario.contimg.app.service;

import com.cario.contimg.app.config.PipelineProperties;
import java.time.Duration;

/** Size and time bounds a group must satisfy. */
public record GroupLimits(int groupSize, int minMembers, Duration maxSpan, Duration maxGap) {

  public GroupLimits {
    if (groupSize < 1) {
      throw new IllegalArgumentException("groupSize must be positive: " + groupSize);
    }
    if (minMembers < 1 || minMembers > groupSize) {
      throw new IllegalArgumentException(
          "minMembers must be in [1, " + groupSize + "]: " + minMembers);
    }
  }

  public static GroupLimits from(PipelineProperties.Grouping grouping) {
    return new GroupLimits(
        grouping.getGroupSize(),
        grouping.effectiveMinMembers(),
        grouping.effectiveMaxSpan(),
        grouping.getMaxGap());
  }
}
