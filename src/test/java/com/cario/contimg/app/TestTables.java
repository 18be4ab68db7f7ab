package com.cario.contimg.app;

import org.springframework.jdbc.core.JdbcTemplate;

/** Empties every orchestrator table between tests sharing one in-memory database. */
public final class TestTables {

  private TestTables() {}

  public static void clear(JdbcTemplate jdbc) {
    jdbc.update("DELETE FROM product_relationships");
    jdbc.update("DELETE FROM products");
    jdbc.update("DELETE FROM group_members");
    jdbc.update("DELETE FROM processing_groups");
    jdbc.update("DELETE FROM ingest_units");
  }
}
