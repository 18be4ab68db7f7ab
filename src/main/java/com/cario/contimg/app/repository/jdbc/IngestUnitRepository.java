package com.cario.contimg.app.repository.jdbc;

import com.cario.contimg.app.model.GroupStatus;
import com.cario.contimg.app.model.IngestStage;
import com.cario.contimg.app.model.IngestUnit;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;

/** JDBC access to the append-only {@code ingest_units} table. Callers own the transaction. */
public class IngestUnitRepository {

  private static final String COLUMNS =
      "id, path, acquired_at, stage, claimed_by, group_id, received_at, updated_at";

  private static final RowMapper<IngestUnit> ROW_MAPPER = IngestUnitRepository::mapRow;

  private final JdbcTemplate jdbc;
  private final NamedParameterJdbcTemplate named;

  public IngestUnitRepository(JdbcTemplate jdbc) {
    this.jdbc = jdbc;
    this.named = new NamedParameterJdbcTemplate(jdbc);
  }

  /**
   * Inserts a new unit in {@link IngestStage#ARRIVED}.
   *
   * @throws org.springframework.dao.DuplicateKeyException if (path, acquiredAt) already exists
   */
  public IngestUnit insert(String path, Instant acquiredAt, Instant now) {
    KeyHolder keys = new GeneratedKeyHolder();
    jdbc.update(
        con -> {
          PreparedStatement ps =
              con.prepareStatement(
                  "INSERT INTO ingest_units (path, acquired_at, stage, received_at, updated_at)"
                      + " VALUES (?, ?, ?, ?, ?)",
                  new String[] {"ID"});
          ps.setString(1, path);
          ps.setLong(2, acquiredAt.toEpochMilli());
          ps.setString(3, IngestStage.ARRIVED.value());
          ps.setLong(4, now.toEpochMilli());
          ps.setLong(5, now.toEpochMilli());
          return ps;
        },
        keys);
    Number id = keys.getKey();
    return IngestUnit.builder()
        .id(id == null ? null : id.longValue())
        .path(path)
        .acquiredAt(acquiredAt)
        .stage(IngestStage.ARRIVED)
        .receivedAt(now)
        .updatedAt(now)
        .build();
  }

  public Optional<IngestUnit> findByPathAndAcquiredAt(String path, Instant acquiredAt) {
    List<IngestUnit> rows =
        jdbc.query(
            "SELECT " + COLUMNS + " FROM ingest_units WHERE path = ? AND acquired_at = ?",
            ROW_MAPPER,
            path,
            acquiredAt.toEpochMilli());
    return rows.stream().findFirst();
  }

  public List<IngestUnit> findByIds(Collection<Long> ids) {
    if (ids.isEmpty()) {
      return List.of();
    }
    return named.query(
        "SELECT " + COLUMNS + " FROM ingest_units WHERE id IN (:ids) ORDER BY acquired_at, id",
        new MapSqlParameterSource("ids", ids),
        ROW_MAPPER);
  }

  /** Units at {@code stage} acquired at or after {@code notBefore} (null = all), oldest first. */
  public List<IngestUnit> findByStage(IngestStage stage, Instant notBefore) {
    long lower = notBefore == null ? Long.MIN_VALUE : notBefore.toEpochMilli();
    return jdbc.query(
        "SELECT "
            + COLUMNS
            + " FROM ingest_units WHERE stage = ? AND acquired_at >= ?"
            + " ORDER BY acquired_at, id",
        ROW_MAPPER,
        stage.value(),
        lower);
  }

  public List<IngestUnit> findByGroupId(String groupId) {
    return jdbc.query(
        "SELECT " + COLUMNS + " FROM ingest_units WHERE group_id = ? ORDER BY acquired_at, id",
        ROW_MAPPER,
        groupId);
  }

  /**
   * Moves the given units to {@link IngestStage#GROUPED}, but only those still unclaimed. With
   * {@code fromFailedGroups}, units whose current group has failed are claimable too.
   *
   * @return number of rows actually claimed; less than {@code ids.size()} means another caller won
   *     at least one of them
   */
  public int claimForGroup(
      Collection<Long> ids,
      String groupId,
      String claimedBy,
      Instant now,
      boolean fromFailedGroups) {
    if (ids.isEmpty()) {
      return 0;
    }
    MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("ids", ids)
            .addValue("groupId", groupId)
            .addValue("claimedBy", claimedBy)
            .addValue("grouped", IngestStage.GROUPED.value())
            .addValue("arrived", IngestStage.ARRIVED.value())
            .addValue("failed", GroupStatus.FAILED.value())
            .addValue("now", now.toEpochMilli());
    String claimable = "(claimed_by IS NULL AND stage = :arrived)";
    if (fromFailedGroups) {
      claimable =
          "("
              + claimable
              + " OR (stage = :grouped AND group_id IN"
              + " (SELECT g.group_id FROM processing_groups g WHERE g.status = :failed)))";
    }
    return named.update(
        "UPDATE ingest_units SET stage = :grouped, group_id = :groupId, claimed_by = :claimedBy,"
            + " updated_at = :now"
            + " WHERE id IN (:ids) AND "
            + claimable,
        params);
  }

  public Map<IngestStage, Long> countByStage() {
    Map<IngestStage, Long> counts = new LinkedHashMap<>();
    for (IngestStage stage : IngestStage.values()) {
      counts.put(stage, 0L);
    }
    jdbc.query(
        "SELECT stage, COUNT(*) AS cnt FROM ingest_units GROUP BY stage",
        rs -> {
          counts.put(IngestStage.fromValue(rs.getString("stage")), rs.getLong("cnt"));
        });
    return counts;
  }

  public long count() {
    Long n = jdbc.queryForObject("SELECT COUNT(*) FROM ingest_units", Long.class);
    return n == null ? 0 : n;
  }

  private static IngestUnit mapRow(ResultSet rs, int rowNum) throws SQLException {
    return IngestUnit.builder()
        .id(rs.getLong("id"))
        .path(rs.getString("path"))
        .acquiredAt(Instant.ofEpochMilli(rs.getLong("acquired_at")))
        .stage(IngestStage.fromValue(rs.getString("stage")))
        .claimedBy(rs.getString("claimed_by"))
        .groupId(rs.getString("group_id"))
        .receivedAt(Instant.ofEpochMilli(rs.getLong("received_at")))
        .updatedAt(Instant.ofEpochMilli(rs.getLong("updated_at")))
        .build();
  }
}
