package com.cario.contimg.app.repository.jdbc;

import com.cario.contimg.app.model.PipelineStage;
import com.cario.contimg.app.model.Product;
import com.cario.contimg.app.model.ProductFilter;
import com.cario.contimg.app.model.ProductStatus;
import com.cario.contimg.app.model.ProductType;
import com.cario.contimg.app.model.QaStatus;
import com.cario.contimg.app.model.ValidationStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.extern.log4j.Log4j2;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

/**
 * JDBC access to the {@code products} registry and its lineage edges.
 *
 * <p>Methods suffixed {@code ForUpdate} take a row lock and must run inside a transaction.
 */
@Log4j2
public class ProductRepository {

  private static final String COLUMNS =
      "id, data_id, data_type, stage, staging_path, published_path, status, group_id,"
          + " parent_data_id, qa_status, validation_status, finalized, metadata_json, created_at,"
          + " updated_at, published_at, publish_attempts, publish_error, publishing_started_at,"
          + " publish_mode, auto_publish";

  private static final TypeReference<LinkedHashMap<String, Object>> METADATA_TYPE =
      new TypeReference<>() {};

  private final JdbcTemplate jdbc;
  private final NamedParameterJdbcTemplate named;
  private final ObjectMapper om;
  private final RowMapper<Product> rowMapper = this::mapRow;

  public ProductRepository(JdbcTemplate jdbc, ObjectMapper om) {
    this.jdbc = jdbc;
    this.named = new NamedParameterJdbcTemplate(jdbc);
    this.om = om;
  }

  /**
   * @throws DuplicateKeyException if the data id is already registered
   */
  public void insert(Product p) {
    named.update(
        "INSERT INTO products (data_id, data_type, stage, staging_path, published_path, status,"
            + " group_id, parent_data_id, qa_status, validation_status, finalized, metadata_json,"
            + " created_at, updated_at, published_at, publish_attempts, publish_error,"
            + " publishing_started_at, publish_mode, auto_publish)"
            + " VALUES (:dataId, :dataType, :stage, :stagingPath, :publishedPath, :status,"
            + " :groupId, :parentDataId, :qaStatus, :validationStatus, :finalized, :metadataJson,"
            + " :createdAt, :updatedAt, :publishedAt, :publishAttempts, :publishError,"
            + " :publishingStartedAt, :publishMode, :autoPublish)",
        params(p));
  }

  /**
   * Writes every mutable column of the row identified by {@code dataId}. Metadata read back as
   * unreadable is kept as stored.
   */
  public int update(Product p) {
    return named.update(
        "UPDATE products SET stage = :stage, staging_path = :stagingPath,"
            + " published_path = :publishedPath, status = :status, group_id = :groupId,"
            + " parent_data_id = :parentDataId, qa_status = :qaStatus,"
            + " validation_status = :validationStatus, finalized = :finalized,"
            + " metadata_json = CASE WHEN :keepMetadata THEN metadata_json ELSE :metadataJson END,"
            + " updated_at = :updatedAt,"
            + " published_at = :publishedAt, publish_attempts = :publishAttempts,"
            + " publish_error = :publishError, publishing_started_at = :publishingStartedAt,"
            + " publish_mode = :publishMode, auto_publish = :autoPublish"
            + " WHERE data_id = :dataId",
        params(p));
  }

  public Optional<Product> findByDataId(String dataId) {
    return first(
        jdbc.query("SELECT " + COLUMNS + " FROM products WHERE data_id = ?", rowMapper, dataId));
  }

  public Optional<Product> findByDataIdForUpdate(String dataId) {
    return first(
        jdbc.query(
            "SELECT " + COLUMNS + " FROM products WHERE data_id = ? FOR UPDATE",
            rowMapper,
            dataId));
  }

  /**
   * Flips a staging row to publishing. The status predicate makes this safe even if two callers
   * got past the row lock with stale reads.
   *
   * @return true if this caller performed the transition
   */
  public boolean markPublishing(String dataId, Instant now) {
    int n =
        jdbc.update(
            "UPDATE products SET status = ?, publishing_started_at = ?, updated_at = ?"
                + " WHERE data_id = ? AND status = ?",
            ProductStatus.PUBLISHING.value(),
            now.toEpochMilli(),
            now.toEpochMilli(),
            dataId,
            ProductStatus.STAGING.value());
    return n == 1;
  }

  public List<Product> list(ProductFilter filter) {
    StringBuilder sql = new StringBuilder("SELECT " + COLUMNS + " FROM products WHERE 1 = 1");
    MapSqlParameterSource params = new MapSqlParameterSource();
    if (filter.getStatus() != null) {
      sql.append(" AND status = :status");
      params.addValue("status", filter.getStatus().value());
    }
    if (filter.getDataType() != null) {
      sql.append(" AND data_type = :dataType");
      params.addValue("dataType", filter.getDataType().value());
    }
    if (filter.getStage() != null) {
      sql.append(" AND stage = :stage");
      params.addValue("stage", filter.getStage().value());
    }
    if (filter.getGroupId() != null) {
      sql.append(" AND group_id = :groupId");
      params.addValue("groupId", filter.getGroupId());
    }
    if (filter.getParentDataId() != null) {
      sql.append(" AND parent_data_id = :parentDataId");
      params.addValue("parentDataId", filter.getParentDataId());
    }
    sql.append(" ORDER BY created_at, id LIMIT :limit");
    params.addValue("limit", filter.getLimit() > 0 ? filter.getLimit() : Integer.MAX_VALUE);
    return named.query(sql.toString(), params, rowMapper);
  }

  /**
   * Staging rows that meet the auto-publish criteria and still have attempts left, oldest first.
   */
  public List<Product> findPublishCandidates(int maxAttempts, int limit) {
    List<String> nonScience =
        Stream.of(ProductType.values())
            .filter(t -> !t.isScience())
            .map(ProductType::value)
            .collect(Collectors.toList());
    MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("staging", ProductStatus.STAGING.value())
            .addValue("validated", ValidationStatus.VALIDATED.value())
            .addValue("passed", QaStatus.PASSED.value())
            .addValue("nonScience", nonScience)
            .addValue("maxAttempts", maxAttempts)
            .addValue("limit", limit);
    return named.query(
        "SELECT "
            + COLUMNS
            + " FROM products WHERE status = :staging AND auto_publish = TRUE AND finalized = TRUE"
            + " AND validation_status = :validated"
            + " AND (data_type IN (:nonScience) OR qa_status = :passed)"
            + " AND publish_attempts < :maxAttempts"
            + " ORDER BY created_at, id LIMIT :limit",
        params,
        rowMapper);
  }

  public List<Product> findPublishingStartedBefore(Instant cutoff) {
    return jdbc.query(
        "SELECT "
            + COLUMNS
            + " FROM products WHERE status = ?"
            + " AND (publishing_started_at IS NULL OR publishing_started_at < ?)"
            + " ORDER BY publishing_started_at",
        rowMapper,
        ProductStatus.PUBLISHING.value(),
        cutoff.toEpochMilli());
  }

  public List<Product> findStagingCreatedBefore(Instant cutoff, int limit) {
    return jdbc.query(
        "SELECT "
            + COLUMNS
            + " FROM products WHERE status = ? AND created_at < ? ORDER BY created_at LIMIT ?",
        rowMapper,
        ProductStatus.STAGING.value(),
        cutoff.toEpochMilli(),
        limit);
  }

  public Map<ProductStatus, Long> countByStatus() {
    Map<ProductStatus, Long> counts = new LinkedHashMap<>();
    for (ProductStatus status : ProductStatus.values()) {
      counts.put(status, 0L);
    }
    jdbc.query(
        "SELECT status, COUNT(*) AS cnt FROM products GROUP BY status",
        rs -> {
          counts.put(ProductStatus.fromValue(rs.getString("status")), rs.getLong("cnt"));
        });
    return counts;
  }

  // -------- Lineage --------

  /** Records a derivation edge; an identical edge already present is left as is. */
  public boolean link(String parentDataId, String childDataId, String type, Instant now) {
    try {
      jdbc.update(
          "INSERT INTO product_relationships"
              + " (parent_data_id, child_data_id, relationship_type, created_at)"
              + " VALUES (?, ?, ?, ?)",
          parentDataId,
          childDataId,
          type,
          now.toEpochMilli());
      return true;
    } catch (DuplicateKeyException e) {
      log.debug(
          "registry.link exists parent={} child={} type={}", parentDataId, childDataId, type);
      return false;
    }
  }

  /** {relationshipType -> parent ids} for the given child. */
  public Map<String, List<String>> findParents(String childDataId) {
    return edges(
        "SELECT relationship_type, parent_data_id AS other FROM product_relationships"
            + " WHERE child_data_id = ? ORDER BY id",
        childDataId);
  }

  /** {relationshipType -> child ids} for the given parent. */
  public Map<String, List<String>> findChildren(String parentDataId) {
    return edges(
        "SELECT relationship_type, child_data_id AS other FROM product_relationships"
            + " WHERE parent_data_id = ? ORDER BY id",
        parentDataId);
  }

  private Map<String, List<String>> edges(String sql, String dataId) {
    Map<String, List<String>> out = new LinkedHashMap<>();
    jdbc.query(
        sql,
        rs -> {
          out.computeIfAbsent(rs.getString("relationship_type"), k -> new ArrayList<>())
              .add(rs.getString("other"));
        },
        dataId);
    return out;
  }

  // -------- Internals --------

  private MapSqlParameterSource params(Product p) {
    return new MapSqlParameterSource()
        .addValue("dataId", p.getDataId())
        .addValue("dataType", p.getDataType().value())
        .addValue("stage", p.getStage().value())
        .addValue("stagingPath", p.getStagingPath())
        .addValue("publishedPath", p.getPublishedPath())
        .addValue("status", p.getStatus().value())
        .addValue("groupId", p.getGroupId())
        .addValue("parentDataId", p.getParentDataId())
        .addValue("qaStatus", p.getQaStatus().value())
        .addValue("validationStatus", p.getValidationStatus().value())
        .addValue("finalized", p.isFinalized())
        .addValue("metadataJson", writeMetadata(p.getMetadata()))
        .addValue("keepMetadata", p.isMetadataUnreadable())
        .addValue("createdAt", millis(p.getCreatedAt()))
        .addValue("updatedAt", millis(p.getUpdatedAt()))
        .addValue("publishedAt", millis(p.getPublishedAt()))
        .addValue("publishAttempts", p.getPublishAttempts())
        .addValue("publishError", p.getPublishError())
        .addValue("publishingStartedAt", millis(p.getPublishingStartedAt()))
        .addValue("publishMode", p.getPublishMode())
        .addValue("autoPublish", p.isAutoPublish());
  }

  private Product mapRow(ResultSet rs, int rowNum) throws SQLException {
    String dataId = rs.getString("data_id");
    Map<String, Object> metadata = readMetadata(dataId, rs.getString("metadata_json"));
    return Product.builder()
        .id(rs.getLong("id"))
        .dataId(dataId)
        .dataType(ProductType.fromValue(rs.getString("data_type")))
        .stage(PipelineStage.fromValue(rs.getString("stage")))
        .stagingPath(rs.getString("staging_path"))
        .publishedPath(rs.getString("published_path"))
        .status(ProductStatus.fromValue(rs.getString("status")))
        .groupId(rs.getString("group_id"))
        .parentDataId(rs.getString("parent_data_id"))
        .qaStatus(QaStatus.fromValue(rs.getString("qa_status")))
        .validationStatus(ValidationStatus.fromValue(rs.getString("validation_status")))
        .finalized(rs.getBoolean("finalized"))
        .metadata(metadata == null ? new LinkedHashMap<>() : metadata)
        .metadataUnreadable(metadata == null)
        .createdAt(instant(rs, "created_at"))
        .updatedAt(instant(rs, "updated_at"))
        .publishedAt(instant(rs, "published_at"))
        .publishAttempts(rs.getInt("publish_attempts"))
        .publishError(rs.getString("publish_error"))
        .publishingStartedAt(instant(rs, "publishing_started_at"))
        .publishMode(rs.getString("publish_mode"))
        .autoPublish(rs.getBoolean("auto_publish"))
        .build();
  }

  private String writeMetadata(Map<String, Object> metadata) {
    if (metadata == null || metadata.isEmpty()) {
      return null;
    }
    try {
      return om.writeValueAsString(metadata);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException(
          "Product metadata is not serialisable: " + e.getMessage(), e);
    }
  }

  /** Null when the stored JSON cannot be parsed. */
  private Map<String, Object> readMetadata(String dataId, String json) {
    if (json == null || json.isBlank()) {
      return new LinkedHashMap<>();
    }
    try {
      return om.readValue(json, METADATA_TYPE);
    } catch (JsonProcessingException e) {
      log.warn(
          "registry.metadata-unreadable dataId={} msg={}", dataId, e.getOriginalMessage());
      return null;
    }
  }

  private static Instant instant(ResultSet rs, String column) throws SQLException {
    long v = rs.getLong(column);
    return rs.wasNull() ? null : Instant.ofEpochMilli(v);
  }

  private static Long millis(Instant t) {
    return t == null ? null : t.toEpochMilli();
  }

  private static <T> Optional<T> first(List<T> rows) {
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }
}
