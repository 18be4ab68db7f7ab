package com.cario.contimg.app.model;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Outcome of evaluating the auto-publish criteria for one product. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AutoPublishCheck {

  private String dataId;

  private boolean enabled;

  private boolean criteriaMet;

  /** Machine-readable reasons the criteria are not met, e.g. {@code not_validated}. */
  private List<String> reasons;
}
