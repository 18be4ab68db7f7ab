package com.cario.contimg.app.repository.jdbc;

import com.cario.contimg.app.model.GroupStatus;
import com.cario.contimg.app.model.IngestUnit;
import com.cario.contimg.app.model.ProcessingGroup;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

/** JDBC access to {@code processing_groups} and their ordered {@code group_members}. */
public class GroupRepository {

  private static final String COLUMNS =
      "group_id, member_hash, member_count, first_acquired_at, last_acquired_at, span_millis,"
          + " formed_at, status, status_reason, validation_notes, updated_at";

  private static final RowMapper<ProcessingGroup> ROW_MAPPER = GroupRepository::mapRow;

  private final JdbcTemplate jdbc;

  public GroupRepository(JdbcTemplate jdbc) {
    this.jdbc = jdbc;
  }

  /** Inserts the group row and one member row per unit, in the given order. */
  public void insert(ProcessingGroup group, List<IngestUnit> members) {
    jdbc.update(
        "INSERT INTO processing_groups (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
        group.getGroupId(),
        group.getMemberHash(),
        members.size(),
        group.getFirstAcquiredAt().toEpochMilli(),
        group.getLastAcquiredAt().toEpochMilli(),
        group.getSpanMillis(),
        group.getFormedAt().toEpochMilli(),
        group.getStatus().value(),
        group.getStatusReason(),
        group.getValidationNotes(),
        group.getFormedAt().toEpochMilli());

    List<Object[]> rows = new ArrayList<>(members.size());
    for (int i = 0; i < members.size(); i++) {
      IngestUnit unit = members.get(i);
      rows.add(
          new Object[] {
            group.getGroupId(), i, unit.getId(), unit.getPath(), unit.getAcquiredAt().toEpochMilli()
          });
    }
    jdbc.batchUpdate(
        "INSERT INTO group_members (group_id, member_index, unit_id, path, acquired_at)"
            + " VALUES (?, ?, ?, ?, ?)",
        rows);
  }

  public Optional<ProcessingGroup> findById(String groupId) {
    return first(
        jdbc.query(
            "SELECT " + COLUMNS + " FROM processing_groups WHERE group_id = ?",
            ROW_MAPPER,
            groupId));
  }

  /** Same as {@link #findById} but locks the row until the surrounding transaction ends. */
  public Optional<ProcessingGroup> findByIdForUpdate(String groupId) {
    return first(
        jdbc.query(
            "SELECT " + COLUMNS + " FROM processing_groups WHERE group_id = ? FOR UPDATE",
            ROW_MAPPER,
            groupId));
  }

  /** Any group with exactly this member set whose status is not failed. */
  public Optional<String> findActiveIdByMemberHash(String memberHash) {
    List<String> ids =
        jdbc.queryForList(
            "SELECT group_id FROM processing_groups WHERE member_hash = ? AND status <> ?"
                + " ORDER BY formed_at",
            String.class,
            memberHash,
            GroupStatus.FAILED.value());
    return ids.stream().findFirst();
  }

  public long countActiveByMemberHash(String memberHash) {
    Long n =
        jdbc.queryForObject(
            "SELECT COUNT(*) FROM processing_groups WHERE member_hash = ? AND status <> ?",
            Long.class,
            memberHash,
            GroupStatus.FAILED.value());
    return n == null ? 0 : n;
  }

  public List<String> findMemberPaths(String groupId) {
    return jdbc.queryForList(
        "SELECT path FROM group_members WHERE group_id = ? ORDER BY member_index",
        String.class,
        groupId);
  }

  public List<ProcessingGroup> findByStatus(GroupStatus status, int limit) {
    return jdbc.query(
        "SELECT " + COLUMNS + " FROM processing_groups WHERE status = ? ORDER BY formed_at LIMIT ?",
        ROW_MAPPER,
        status.value(),
        limit);
  }

  public int updateStatus(String groupId, GroupStatus status, String reason, Instant now) {
    return jdbc.update(
        "UPDATE processing_groups SET status = ?, status_reason = ?, updated_at = ?"
            + " WHERE group_id = ?",
        status.value(),
        reason,
        now.toEpochMilli(),
        groupId);
  }

  private static <T> Optional<T> first(List<T> rows) {
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  private static ProcessingGroup mapRow(ResultSet rs, int rowNum) throws SQLException {
    return ProcessingGroup.builder()
        .groupId(rs.getString("group_id"))
        .memberHash(rs.getString("member_hash"))
        .firstAcquiredAt(Instant.ofEpochMilli(rs.getLong("first_acquired_at")))
        .lastAcquiredAt(Instant.ofEpochMilli(rs.getLong("last_acquired_at")))
        .spanMillis(rs.getLong("span_millis"))
        .formedAt(Instant.ofEpochMilli(rs.getLong("formed_at")))
        .status(GroupStatus.fromValue(rs.getString("status")))
        .statusReason(rs.getString("status_reason"))
        .validationNotes(rs.getString("validation_notes"))
        .updatedAt(Instant.ofEpochMilli(rs.getLong("updated_at")))
        .build();
  }
}
