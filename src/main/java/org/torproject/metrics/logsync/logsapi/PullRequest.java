/* Copyright 2024 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.logsync.logsapi;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;

/** Parameters of a single export from the Logs API. */
public final class PullRequest {

  /** Date dimension selecting rows by the time events were created. */
  public static final String DATE_DIMENSION_DEFAULT = "default";

  private final String appId;

  private final String source;

  private final List<String> fields;

  private final LocalDateTime since;

  private final LocalDateTime until;

  private final String dateDimension;

  private final String eventName;

  private final int partsCount;

  /**
   * Create a pull request.
   *
   * @param appId Application id.
   * @param source Logs API source name.
   * @param fields Fields to export.
   * @param since Start of the time range, or {@code null} for no range.
   * @param until End of the time range, or {@code null} for no range.
   * @param dateDimension Date dimension of the time range.
   * @param eventName Event name to filter by, or {@code null}.
   * @param partsCount Number of parts to split the export into.
   */
  public PullRequest(String appId, String source, List<String> fields,
      LocalDateTime since, LocalDateTime until, String dateDimension,
      String eventName, int partsCount) {
    this.appId = appId;
    this.source = source;
    this.fields = Collections.unmodifiableList(fields);
    this.since = since;
    this.until = until;
    this.dateDimension = dateDimension;
    this.eventName = eventName;
    this.partsCount = partsCount;
  }

  public String getAppId() {
    return this.appId;
  }

  public String getSource() {
    return this.source;
  }

  public List<String> getFields() {
    return this.fields;
  }

  public LocalDateTime getSince() {
    return this.since;
  }

  public LocalDateTime getUntil() {
    return this.until;
  }

  public String getDateDimension() {
    return this.dateDimension;
  }

  public String getEventName() {
    return this.eventName;
  }

  public int getPartsCount() {
    return this.partsCount;
  }
}
