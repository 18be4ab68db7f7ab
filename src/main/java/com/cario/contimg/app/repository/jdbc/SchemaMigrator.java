package com.cario.contimg.app.repository.jdbc;

import java.util.ArrayList;
import java.util.List;
import lombok.extern.log4j.Log4j2;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Creates the orchestrator tables and adds columns introduced after the first release.
 *
 * <p>Every change is additive: missing tables and indexes are created, missing columns are added
 * with a default so rows written by older versions read back with safe values. No column is ever
 * dropped or renamed here.
 */
@Log4j2
public class SchemaMigrator {

  /** A column added after the base table shipped. */
  record AdditiveColumn(String table, String column, String definition) {}

  static final List<String> BASE_TABLES =
      List.of(
          """
          CREATE TABLE IF NOT EXISTS ingest_units (
            id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
            path VARCHAR(1024) NOT NULL,
            acquired_at BIGINT NOT NULL,
            stage VARCHAR(16) NOT NULL,
            claimed_by VARCHAR(128),
            group_id VARCHAR(128),
            received_at BIGINT NOT NULL,
            updated_at BIGINT NOT NULL,
            CONSTRAINT uq_ingest_units_path_ts UNIQUE (path, acquired_at)
          )
          """,
          """
          CREATE TABLE IF NOT EXISTS processing_groups (
            group_id VARCHAR(128) PRIMARY KEY,
            member_hash VARCHAR(64) NOT NULL,
            member_count INT NOT NULL,
            first_acquired_at BIGINT NOT NULL,
            last_acquired_at BIGINT NOT NULL,
            span_millis BIGINT NOT NULL,
            formed_at BIGINT NOT NULL,
            status VARCHAR(16) NOT NULL,
            status_reason VARCHAR(1024),
            validation_notes VARCHAR(1024),
            updated_at BIGINT NOT NULL
          )
          """,
          """
          CREATE TABLE IF NOT EXISTS group_members (
            group_id VARCHAR(128) NOT NULL,
            member_index INT NOT NULL,
            unit_id BIGINT,
            path VARCHAR(1024) NOT NULL,
            acquired_at BIGINT NOT NULL,
            PRIMARY KEY (group_id, member_index)
          )
          """,
          """
          CREATE TABLE IF NOT EXISTS products (
            id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
            data_id VARCHAR(255) NOT NULL,
            data_type VARCHAR(32) NOT NULL,
            stage VARCHAR(32) NOT NULL,
            staging_path VARCHAR(2048) NOT NULL,
            published_path VARCHAR(2048),
            status VARCHAR(16) NOT NULL,
            group_id VARCHAR(128),
            parent_data_id VARCHAR(255),
            qa_status VARCHAR(16) DEFAULT 'pending' NOT NULL,
            validation_status VARCHAR(16) DEFAULT 'pending' NOT NULL,
            finalized BOOLEAN DEFAULT FALSE NOT NULL,
            metadata_json CLOB,
            created_at BIGINT NOT NULL,
            updated_at BIGINT NOT NULL,
            published_at BIGINT,
            CONSTRAINT uq_products_data_id UNIQUE (data_id)
          )
          """,
          """
          CREATE TABLE IF NOT EXISTS product_relationships (
            id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
            parent_data_id VARCHAR(255) NOT NULL,
            child_data_id VARCHAR(255) NOT NULL,
            relationship_type VARCHAR(64) NOT NULL,
            created_at BIGINT NOT NULL,
            CONSTRAINT uq_product_relationships
              UNIQUE (parent_data_id, child_data_id, relationship_type)
          )
          """);

  static final List<AdditiveColumn> ADDITIVE_COLUMNS =
      List.of(
          new AdditiveColumn("products", "publish_attempts", "INT DEFAULT 0 NOT NULL"),
          new AdditiveColumn("products", "publish_error", "VARCHAR(1024)"),
          new AdditiveColumn("products", "publishing_started_at", "BIGINT"),
          new AdditiveColumn("products", "publish_mode", "VARCHAR(16)"),
          new AdditiveColumn("products", "auto_publish", "BOOLEAN DEFAULT TRUE NOT NULL"));

  static final List<String> INDEXES =
      List.of(
          "CREATE INDEX IF NOT EXISTS idx_ingest_units_stage ON ingest_units(stage, acquired_at)",
          "CREATE INDEX IF NOT EXISTS idx_groups_member_hash ON processing_groups(member_hash)",
          "CREATE INDEX IF NOT EXISTS idx_groups_status ON processing_groups(status)",
          "CREATE INDEX IF NOT EXISTS idx_products_status ON products(status)",
          "CREATE INDEX IF NOT EXISTS idx_products_type_status ON products(data_type, status)",
          "CREATE INDEX IF NOT EXISTS idx_products_group ON products(group_id)",
          "CREATE INDEX IF NOT EXISTS idx_relationships_parent"
              + " ON product_relationships(parent_data_id)",
          "CREATE INDEX IF NOT EXISTS idx_relationships_child"
              + " ON product_relationships(child_data_id)");

  private final JdbcTemplate jdbc;

  public SchemaMigrator(JdbcTemplate jdbc) {
    this.jdbc = jdbc;
  }

  /**
   * Brings the schema up to date. Safe to call repeatedly.
   *
   * @return the columns added by this call, as {@code table.column}
   */
  public synchronized List<String> migrate() {
    BASE_TABLES.forEach(jdbc::execute);

    List<String> added = new ArrayList<>();
    for (AdditiveColumn c : ADDITIVE_COLUMNS) {
      if (!columnExists(c.table(), c.column())) {
        jdbc.execute(
            "ALTER TABLE " + c.table() + " ADD COLUMN " + c.column() + " " + c.definition());
        added.add(c.table() + "." + c.column());
        log.info("schema.column.added table={} column={}", c.table(), c.column());
      }
    }

    INDEXES.forEach(jdbc::execute);
    log.info("schema.migrate ok tables={} addedColumns={}", BASE_TABLES.size(), added);
    return added;
  }

  boolean columnExists(String table, String column) {
    Integer count =
        jdbc.queryForObject(
            "SELECT COUNT(*) FROM INFORMATION_SCHEMA.COLUMNS"
                + " WHERE UPPER(TABLE_NAME) = ? AND UPPER(COLUMN_NAME) = ?",
            Integer.class,
            table.toUpperCase(),
            column.toUpperCase());
    return count != null && count > 0;
  }
}
