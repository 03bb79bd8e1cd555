/* Copyright 2024 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.logsync.db;

import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * ClickHouse client that records statements and keeps inserted rows per
 * table instead of talking to a server.
 */
public class RecordingClickHouseClient extends ClickHouseClient {

  private static final Pattern TABLE = Pattern.compile("`([^`]+)`");

  private final List<String> statements = new ArrayList<>();

  private final Map<String, List<Map<String, Object>>> tables
      = new LinkedHashMap<>();

  private final Set<String> existing = new HashSet<>();

  private String failingPrefix;

  public RecordingClickHouseClient() throws MalformedURLException {
    super(new URL("http://localhost:8123"), null, null, "mobile");
  }

  /** Let all statements starting with the given prefix fail. */
  public void failOn(String prefix) {
    this.failingPrefix = prefix;
  }

  public List<String> getStatements() {
    return this.statements;
  }

  /** Returns the rows inserted since the table was last dropped. */
  public List<Map<String, Object>> getRows(String table) {
    List<Map<String, Object>> rows = this.tables.get(table);
    return null == rows ? new ArrayList<>() : rows;
  }

  /** Returns whether the table was created or written and not dropped. */
  public boolean exists(String table) {
    return this.existing.contains(table);
  }

  @Override
  public void execute(String query) throws IOException {
    this.record(query);
    List<String> names = tableNames(query);
    if (query.startsWith("CREATE TABLE")) {
      this.existing.add(names.get(0));
    } else if (query.startsWith("DROP TABLE")) {
      this.existing.remove(names.get(0));
      this.tables.remove(names.get(0));
    } else if (query.startsWith("INSERT INTO") && query.contains(" SELECT ")) {
      if (!this.existing.contains(names.get(1))) {
        throw new ClickHouseException("Table " + names.get(1)
            + " doesn't exist.");
      }
      this.tables.computeIfAbsent(names.get(0), t -> new ArrayList<>())
          .addAll(this.getRows(names.get(1)));
    }
  }

  @Override
  public String query(String query) throws IOException {
    this.record(query);
    if (query.startsWith("EXISTS TABLE")) {
      return this.existing.contains(tableNames(query).get(0)) ? "1\n" : "0\n";
    }
    return "";
  }

  @Override
  public void insert(String table, List<Map<String, Object>> rows) {
    this.statements.add("INSERT INTO " + table);
    this.existing.add(table);
    this.tables.computeIfAbsent(table, t -> new ArrayList<>()).addAll(rows);
  }

  private void record(String query) throws ClickHouseException {
    if (null != this.failingPrefix && query.startsWith(this.failingPrefix)) {
      throw new ClickHouseException("Failing on purpose: " + query);
    }
    this.statements.add(query);
  }

  private static List<String> tableNames(String query) {
    List<String> names = new ArrayList<>();
    Matcher matcher = TABLE.matcher(query);
    while (matcher.find()) {
      names.add(matcher.group(1));
    }
    return names;
  }
}
