/* Copyright 2024 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.logsync.logsapi;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UnsupportedEncodingException;
import java.net.HttpURLConnection;
import java.net.URL;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Client for exporting rows from the Logs API.
 *
 * <p>Each part of an export is requested separately. While the API is still
 * preparing an export (202) or asks us to slow down (429), the same request is
 * repeated after a pause. Rows of a part are handed out in chunks of at most
 * the configured number of rows.</p>
 */
public class LogsApiClient implements LogsSource {

  private static final Logger logger = LoggerFactory.getLogger(
      LogsApiClient.class);

  private static final String EXPORT_PATH = "/logs/v1/export/";

  private static final int HTTP_TOO_MANY_REQUESTS = 429;

  private static final DateTimeFormatter dateTimeFormatter
      = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

  private static final ObjectMapper objectMapper = new ObjectMapper();

  private static final TypeReference<LinkedHashMap<String, Object>> ROW_TYPE
      = new TypeReference<LinkedHashMap<String, Object>>() {};

  private final URL host;

  private final String token;

  private final int chunkRows;

  private final Duration retryWait;

  /**
   * Initialize the client.
   *
   * @param host Base URL of the Logs API.
   * @param token OAuth token.
   * @param chunkRows Maximum number of rows per batch handed out.
   * @param retryWait Pause before repeating a request that is not ready yet.
   */
  public LogsApiClient(URL host, String token, int chunkRows,
      Duration retryWait) {
    this.host = host;
    this.token = token;
    this.chunkRows = chunkRows;
    this.retryWait = retryWait;
  }

  @Override
  public void pull(PullRequest request, BatchHandler handler)
      throws IOException {
    for (int partNumber = 0; partNumber < request.getPartsCount();
        partNumber++) {
      URL url = this.exportUrl(request, partNumber);
      logger.debug("Requesting part {} of {} of {} for {}.", partNumber + 1,
          request.getPartsCount(), request.getSource(), request.getAppId());
      this.downloadPart(url, request.getPartsCount(), handler);
    }
  }

  /** Build the export URL for the given part of a request. */
  URL exportUrl(PullRequest request, int partNumber) throws IOException {
    StringBuilder sb = new StringBuilder();
    sb.append(this.host.toString().replaceAll("/+$", ""))
        .append(EXPORT_PATH).append(request.getSource()).append(".json")
        .append("?application_id=").append(encode(request.getAppId()))
        .append("&fields=").append(encode(String.join(",",
            request.getFields())));
    if (null != request.getSince()) {
      sb.append("&date_since=")
          .append(encode(dateTimeFormatter.format(request.getSince())));
    }
    if (null != request.getUntil()) {
      sb.append("&date_until=")
          .append(encode(dateTimeFormatter.format(request.getUntil())));
    }
    if (null != request.getDateDimension()) {
      sb.append("&date_dimension=").append(encode(request.getDateDimension()));
    }
    if (null != request.getEventName() && !request.getEventName().isEmpty()) {
      sb.append("&event_name=").append(encode(request.getEventName()));
    }
    sb.append("&parts_count=").append(request.getPartsCount())
        .append("&part_number=").append(partNumber);
    return new URL(sb.toString());
  }

  private static String encode(String value)
      throws UnsupportedEncodingException {
    return URLEncoder.encode(value, "UTF-8");
  }

  private void downloadPart(URL url, int partsCount, BatchHandler handler)
      throws IOException {
    while (true) {
      HttpURLConnection huc = this.openConnection(url);
      huc.setRequestMethod("GET");
      huc.setRequestProperty("Authorization", "OAuth " + this.token);
      huc.setReadTimeout(600_000);
      huc.connect();
      int response = huc.getResponseCode();
      if (HttpURLConnection.HTTP_OK == response) {
        try (InputStream in = new BufferedInputStream(huc.getInputStream())) {
          this.readRows(in, handler);
        }
        return;
      } else if (HttpURLConnection.HTTP_ACCEPTED == response
          || HTTP_TOO_MANY_REQUESTS == response) {
        logger.debug("Logs API answered {}; retrying in {}.", response,
            this.retryWait);
        huc.disconnect();
        try {
          this.sleep(this.retryWait);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          throw new IOException("Interrupted while waiting for the Logs API.",
              e);
        }
      } else {
        String body = readBody(huc);
        if (HttpURLConnection.HTTP_BAD_REQUEST == response
            && isPartsCountError(body)) {
          throw new LogsApiPartsCountException("Logs API rejected parts count "
              + partsCount + ": " + body, response, partsCount);
        }
        throw new LogsApiException("Logs API request failed with " + response
            + ": " + body, response);
      }
    }
  }

  /** Stream the rows of a {@code {"data": [...]}} document in chunks. */
  private void readRows(InputStream in, BatchHandler handler)
      throws IOException {
    try (JsonParser parser = objectMapper.getFactory().createParser(in)) {
      if (parser.nextToken() != JsonToken.START_OBJECT) {
        throw new IOException("Logs API response is not a JSON object.");
      }
      List<Map<String, Object>> chunk = new ArrayList<>();
      while (parser.nextToken() == JsonToken.FIELD_NAME) {
        String field = parser.getCurrentName();
        JsonToken value = parser.nextToken();
        if (!"data".equals(field) || value != JsonToken.START_ARRAY) {
          parser.skipChildren();
          continue;
        }
        while (parser.nextToken() == JsonToken.START_OBJECT) {
          chunk.add(parser.readValueAs(ROW_TYPE));
          if (chunk.size() >= this.chunkRows) {
            handler.handle(chunk);
            chunk = new ArrayList<>();
          }
        }
      }
      if (!chunk.isEmpty()) {
        handler.handle(chunk);
      }
    }
  }

  static boolean isPartsCountError(String body) {
    String lowerCaseBody = body.toLowerCase();
    return lowerCaseBody.contains("parts_count")
        || lowerCaseBody.contains("more parts");
  }

  private static String readBody(HttpURLConnection huc) throws IOException {
    InputStream errorStream = huc.getErrorStream();
    if (null == errorStream) {
      return "";
    }
    ByteArrayOutputStream body = new ByteArrayOutputStream();
    try (InputStream in = new BufferedInputStream(errorStream)) {
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

  /** Sleep for the given time; overridden by tests. */
  protected void sleep(Duration duration) throws InterruptedException {
    Thread.sleep(duration.toMillis());
  }
}
