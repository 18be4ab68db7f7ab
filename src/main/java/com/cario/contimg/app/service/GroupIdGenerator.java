package com.cario.contimg.app.service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.HexFormat;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Builds group identifiers: {@code grp-<content>-<nanos>-<instance>}.
 *
 * <p>The content part is derived from the member paths, the nanos part is strictly increasing
 * within this process even when the clock does not advance, and the instance part separates
 * processes sharing one database.
 */
public class GroupIdGenerator {

  static final String PREFIX = "grp-";
  static final int CONTENT_CHARS = 16;

  private final Clock clock;
  private final AtomicLong lastNanos = new AtomicLong();
  private final String instanceToken;

  public GroupIdGenerator(Clock clock) {
    this.clock = clock;
    byte[] token = new byte[3];
    new SecureRandom().nextBytes(token);
    this.instanceToken = HexFormat.of().formatHex(token);
  }

  /** SHA-256 (hex) over the sorted member paths joined by newlines. Order-insensitive. */
  public static String memberHash(Collection<String> paths) {
    List<String> sorted = paths.stream().sorted().collect(Collectors.toList());
    try {
      MessageDigest md = MessageDigest.getInstance("SHA-256");
      byte[] digest = md.digest(String.join("\n", sorted).getBytes(StandardCharsets.UTF_8));
      return HexFormat.of().formatHex(digest);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  public String newGroupId(String memberHash) {
    return PREFIX
        + memberHash.substring(0, CONTENT_CHARS)
        + "-"
        + nextNanos()
        + "-"
        + instanceToken;
  }

  /** The content part of an id produced by {@link #newGroupId}. */
  public static String contentPart(String groupId) {
    return groupId.substring(PREFIX.length(), PREFIX.length() + CONTENT_CHARS);
  }

  private long nextNanos() {
    Instant now = clock.instant();
    long nanos = now.getEpochSecond() * 1_000_000_000L + now.getNano();
    return lastNanos.updateAndGet(prev -> Math.max(prev + 1, nanos));
  }
}
