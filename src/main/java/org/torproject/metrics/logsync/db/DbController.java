/* Copyright 2024 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.logsync.db;

import org.torproject.metrics.logsync.sources.SourceDefinition;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Tables of a single source.
 *
 * <p>Rows are first loaded into a staging table per application and date
 * (or "latest" for sources without date). Once a date is archived, its
 * staging table is moved into the archive table. A merge table named like
 * the source spans the archive table and all staging tables.</p>
 */
public class DbController {

  private static final Logger logger = LoggerFactory.getLogger(
      DbController.class);

  /** Suffix of staging tables of sources without date dimension. */
  public static final String LATEST_SUFFIX = "latest";

  static final String ARCHIVE_SUFFIX = "archive";

  private final ClickHouseClient client;

  private final SourceDefinition definition;

  public DbController(ClickHouseClient client, SourceDefinition definition) {
    this.client = client;
    this.definition = definition;
  }

  /** Create database, archive table, and merge table if they do not exist. */
  public void prepare() throws IOException {
    String database = this.client.getDatabase();
    this.client.execute("CREATE DATABASE IF NOT EXISTS " + database);
    StringBuilder columns = new StringBuilder();
    for (Map.Entry<String, String> e : this.definition
        .getProcessingDefinition().getFieldTypes().entrySet()) {
      if (columns.length() > 0) {
        columns.append(", ");
      }
      columns.append('`').append(e.getKey()).append("` ").append(e.getValue());
    }
    String dateField = this.definition.getDateField();
    String engine = null == dateField
        ? "MergeTree() ORDER BY (" + SourceDefinition.APP_ID_FIELD + ")"
        : "MergeTree() PARTITION BY toYYYYMM(" + dateField + ") ORDER BY ("
            + SourceDefinition.APP_ID_FIELD + ", " + dateField + ")";
    this.client.execute("CREATE TABLE IF NOT EXISTS "
        + this.table(ARCHIVE_SUFFIX) + " (" + columns + ") ENGINE = "
        + engine);
    this.client.execute("CREATE TABLE IF NOT EXISTS " + database + ".`"
        + this.definition.getTableName() + "` AS " + this.table(ARCHIVE_SUFFIX)
        + " ENGINE = Merge(" + database + ", '^"
        + this.definition.getTableName() + "_')");
  }

  /** Drop the given staging table and create it empty. */
  public void recreateTable(String tableSuffix) throws IOException {
    this.client.execute("DROP TABLE IF EXISTS " + this.table(tableSuffix));
    this.client.execute("CREATE TABLE " + this.table(tableSuffix) + " AS "
        + this.table(ARCHIVE_SUFFIX));
  }

  /** Append rows to the given staging table. */
  public void insertData(List<Map<String, Object>> rows, String tableSuffix)
      throws IOException {
    this.client.insert(this.tableName(tableSuffix), rows);
  }

  /**
   * Move the contents of the given staging table into the archive, or do
   * nothing if there is no such staging table.
   */
  public void archiveTable(String tableSuffix) throws IOException {
    if (!this.exists(tableSuffix)) {
      logger.warn("Not archiving {}, because it does not exist.",
          this.table(tableSuffix));
      return;
    }
    this.client.execute("INSERT INTO " + this.table(ARCHIVE_SUFFIX)
        + " SELECT * FROM " + this.table(tableSuffix));
    this.client.execute("DROP TABLE IF EXISTS " + this.table(tableSuffix));
  }

  /** Returns whether the given staging table exists. */
  boolean exists(String tableSuffix) throws IOException {
    return "1".equals(this.client.query("EXISTS TABLE "
        + this.table(tableSuffix)).trim());
  }

  String tableName(String tableSuffix) {
    return this.definition.getTableName() + "_"
        + tableSuffix.replaceAll("[^A-Za-z0-9_]", "_");
  }

  private String table(String tableSuffix) {
    return this.client.getDatabase() + ".`" + this.tableName(tableSuffix)
        + "`";
  }
}
