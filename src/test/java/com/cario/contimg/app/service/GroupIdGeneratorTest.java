package com.cario.contimg.app.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class GroupIdGeneratorTest {

  @Test
  void memberHashIgnoresOrder() {
    String a = GroupIdGenerator.memberHash(List.of("/in/a", "/in/b", "/in/c"));
    String b = GroupIdGenerator.memberHash(List.of("/in/c", "/in/a", "/in/b"));

    assertEquals(a, b);
    assertEquals(64, a.length());
    assertNotEquals(a, GroupIdGenerator.memberHash(List.of("/in/a", "/in/b")));
  }

  @Test
  void idsAreUniqueEvenWhenClockStandsStill() {
    Clock frozen = Clock.fixed(Instant.parse("2025-10-02T00:00:00Z"), ZoneOffset.UTC);
    GroupIdGenerator generator = new GroupIdGenerator(frozen);
    String hash = GroupIdGenerator.memberHash(List.of("/in/a"));

    Set<String> ids = new HashSet<>();
    for (int i = 0; i < 1000; i++) {
      ids.add(generator.newGroupId(hash));
    }

    assertEquals(1000, ids.size());
  }

  @Test
  void idCarriesContentPrefix() {
    GroupIdGenerator generator = new GroupIdGenerator(Clock.systemUTC());
    String hash = GroupIdGenerator.memberHash(List.of("/in/a", "/in/b"));

    String id = generator.newGroupId(hash);

    assertTrue(id.startsWith("grp-"));
    assertEquals(hash.substring(0, 16), GroupIdGenerator.contentPart(id));
  }
}
