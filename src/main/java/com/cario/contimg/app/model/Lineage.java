package com.cario.contimg.app.model;

import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Parents and children of a product, keyed by relationship type. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Lineage {

  private String dataId;

  private Map<String, List<String>> parents;

  private Map<String, List<String>> children;
}
