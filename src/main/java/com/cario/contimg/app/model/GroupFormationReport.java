package com.cario.contimg.app.model;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/** What one group formation scan did. */
@Data
public class GroupFormationReport {

  private final String scanId;

  private final List<ProcessingGroup> formed = new ArrayList<>();

  /** Member hashes skipped because a non-failed group with the same members exists. */
  private final List<String> duplicates = new ArrayList<>();

  /** Human-readable reasons for candidates excluded this scan. */
  private final List<String> exclusions = new ArrayList<>();

  private int candidates;

  /** Units left waiting because not enough members were available yet. */
  private int deferred;

  private int claimConflicts;

  /** True when another scan was running and this one did nothing. */
  private boolean skipped;
}
