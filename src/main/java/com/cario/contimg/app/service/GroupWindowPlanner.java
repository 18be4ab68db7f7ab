package com.cario.contimg.app.service;

import com.cario.contimg.app.model.IngestUnit;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits time-ordered candidates into contiguous windows that respect {@link GroupLimits}.
 *
 * <p>Pure: no I/O and no clock, so it is exercised directly by tests.
 */
public class GroupWindowPlanner {

  /** Windows to form, units excluded with a reason, and units left for a later scan. */
  public record Plan(List<List<IngestUnit>> windows, List<String> exclusions, int deferred) {}

  public Plan plan(List<IngestUnit> candidates, GroupLimits limits) {
    List<List<IngestUnit>> windows = new ArrayList<>();
    List<String> exclusions = new ArrayList<>();
    int deferred = 0;

    int i = 0;
    int n = candidates.size();
    while (i < n) {
      List<IngestUnit> window = new ArrayList<>();
      window.add(candidates.get(i));
      int j = i + 1;
      String violation = null;
      boolean gapViolation = false;

      while (j < n && window.size() < limits.groupSize()) {
        IngestUnit next = candidates.get(j);
        Duration gap = between(candidates.get(j - 1), next);
        Duration span = between(window.get(0), next);
        if (gap.compareTo(limits.maxGap()) > 0) {
          violation = "gap " + gap + " before " + next.getPath() + " exceeds " + limits.maxGap();
          gapViolation = true;
          break;
        }
        if (span.compareTo(limits.maxSpan()) > 0) {
          violation = "span " + span + " to " + next.getPath() + " exceeds " + limits.maxSpan();
          break;
        }
        window.add(next);
        j++;
      }

      if (window.size() == limits.groupSize()) {
        windows.add(window);
        i = j;
      } else if (violation == null) {
        // ran out of candidates: form a short group only when allowed, otherwise wait
        if (window.size() >= limits.minMembers()) {
          windows.add(window);
        } else {
          deferred += window.size();
        }
        i = n;
      } else if (window.size() >= limits.minMembers()) {
        windows.add(window);
        i = j;
      } else if (gapViolation) {
        // nothing before the gap can share a window with anything after it
        for (IngestUnit u : window) {
          exclusions.add(u.getPath() + ": " + violation);
        }
        i = j;
      } else {
        exclusions.add(window.get(0).getPath() + ": " + violation);
        i = i + 1;
      }
    }
    return new Plan(windows, exclusions, deferred);
  }

  static Duration between(IngestUnit from, IngestUnit to) {
    return Duration.between(from.getAcquiredAt(), to.getAcquiredAt());
  }
}
