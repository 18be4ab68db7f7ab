package com.cario.contimg.app.service;

import com.cario.contimg.app.model.IngestUnit;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** Checks a candidate member list against {@link GroupLimits} before it is persisted. */
public class GroupValidator {

  private final boolean verifyFilesExist;

  public GroupValidator(boolean verifyFilesExist) {
    this.verifyFilesExist = verifyFilesExist;
  }

  /** @return violations, empty when the members may form a group */
  public List<String> validate(List<IngestUnit> members, GroupLimits limits) {
    List<String> violations = new ArrayList<>();
    if (members.isEmpty()) {
      violations.add("no members");
      return violations;
    }
    if (members.size() < limits.minMembers()) {
      violations.add("members " + members.size() + " < min " + limits.minMembers());
    }
    if (members.size() > limits.groupSize()) {
      violations.add("members " + members.size() + " > size " + limits.groupSize());
    }
    Set<String> paths = new HashSet<>();
    for (int k = 0; k < members.size(); k++) {
      IngestUnit unit = members.get(k);
      if (!paths.add(unit.getPath())) {
        violations.add("duplicate path " + unit.getPath());
      }
      if (k > 0) {
        Duration gap = GroupWindowPlanner.between(members.get(k - 1), unit);
        if (gap.isNegative()) {
          violations.add("members not in acquisition order at " + unit.getPath());
        } else if (gap.compareTo(limits.maxGap()) > 0) {
          violations.add("gap " + gap + " before " + unit.getPath() + " > " + limits.maxGap());
        }
      }
      if (verifyFilesExist && !Files.exists(Paths.get(unit.getPath()))) {
        violations.add("missing file " + unit.getPath());
      }
    }
    Duration span = span(members);
    if (span.compareTo(limits.maxSpan()) > 0) {
      violations.add("span " + span + " > " + limits.maxSpan());
    }
    return violations;
  }

  /** Summary stored with a formed group. */
  public String notes(List<IngestUnit> members, GroupLimits limits) {
    Duration largestGap = Duration.ZERO;
    for (int k = 1; k < members.size(); k++) {
      Duration gap = GroupWindowPlanner.between(members.get(k - 1), members.get(k));
      if (gap.compareTo(largestGap) > 0) {
        largestGap = gap;
      }
    }
    return "members="
        + members.size()
        + "/"
        + limits.groupSize()
        + " span="
        + span(members)
        + "<="
        + limits.maxSpan()
        + " maxGap="
        + largestGap
        + "<="
        + limits.maxGap()
        + (verifyFilesExist ? " files=present" : "");
  }

  static Duration span(List<IngestUnit> members) {
    return GroupWindowPlanner.between(members.get(0), members.get(members.size() - 1));
  }
}
