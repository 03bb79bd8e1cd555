/* Copyright 2024 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.logsync.db;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.URL;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Minimal client for the HTTP interface of ClickHouse.
 */
public class ClickHouseClient {

  private static final Logger logger = LoggerFactory.getLogger(
      ClickHouseClient.class);

  private static final ObjectMapper objectMapper = new ObjectMapper();

  private final URL host;

  private final String user;

  private final String password;

  private final String database;

  /**
   * Initialize the client.
   *
   * @param host Base URL of the ClickHouse HTTP interface.
   * @param user User name, or {@code null} for the default user.
   * @param password Password, or {@code null}.
   * @param database Database holding all tables.
   */
  public ClickHouseClient(URL host, String user, String password,
      String database) {
    this.host = host;
    this.user = user;
    this.password = password;
    this.database = database;
  }

  public String getDatabase() {
    return this.database;
  }

  /** Execute a statement that returns no data we care about. */
  public void execute(String query) throws IOException {
    logger.debug("Executing: {}", query);
    this.post(this.host, query.getBytes(StandardCharsets.UTF_8));
  }

  /** Execute a statement and return its result in the default format. */
  public String query(String query) throws IOException {
    logger.debug("Querying: {}", query);
    return this.post(this.host, query.getBytes(StandardCharsets.UTF_8));
  }

  /** Insert the given rows into the given table of our database. */
  public void insert(String table, List<Map<String, Object>> rows)
      throws IOException {
    if (rows.isEmpty()) {
      return;
    }
    String query = "INSERT INTO " + this.database + ".`" + table
        + "` FORMAT JSONEachRow";
    logger.debug("Inserting {} rows into {}.", rows.size(), table);
    ByteArrayOutputStream body = new ByteArrayOutputStream();
    for (Map<String, Object> row : rows) {
      body.write(objectMapper.writeValueAsBytes(row));
      body.write('\n');
    }
    URL url = new URL(this.host.toString().replaceAll("/+$", "")
        + "/?query=" + URLEncoder.encode(query, "UTF-8"));
    this.post(url, body.toByteArray());
  }

  private String post(URL url, byte[] body) throws IOException {
    HttpURLConnection huc = this.openConnection(url);
    huc.setRequestMethod("POST");
    huc.setDoOutput(true);
    if (null != this.user) {
      huc.setRequestProperty("X-ClickHouse-User", this.user);
    }
    if (null != this.password) {
      huc.setRequestProperty("X-ClickHouse-Key", this.password);
    }
    try (OutputStream out = new BufferedOutputStream(huc.getOutputStream())) {
      out.write(body);
    }
    int response = huc.getResponseCode();
    if (HttpURLConnection.HTTP_OK != response) {
      throw new ClickHouseException("ClickHouse answered " + response + ": "
          + readBody(huc.getErrorStream()));
    }
    return readBody(huc.getInputStream());
  }

  private static String readBody(InputStream stream) throws IOException {
    if (null == stream) {
      return "";
    }
    ByteArrayOutputStream body = new ByteArrayOutputStream();
    try (InputStream in = new BufferedInputStream(stream)) {
      int len;
      byte[] data = new byte[1024];
      while ((len = in.read(data, 0, 1024)) >= 0) {
        body.write(data, 0, len);
      }
    }
    return new String(body.toByteArray(), StandardCharsets.UTF_8);
  }

  /** Open a connection to the given URL; overridden by tests. */
  protected HttpURLConnection openConnection(URL url) throws IOException {
    return (HttpURLConnection) url.openConnection();
  }
}
