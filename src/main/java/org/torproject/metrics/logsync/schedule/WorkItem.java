/* Copyright 2024 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.logsync.schedule;

import java.time.LocalDate;
import java.util.Objects;

/**
 * One unit of scheduled work for a single source, application, event, and
 * date, which only lives for the duration of a cycle.
 */
public final class WorkItem {

  private final String source;

  private final String eventName;

  private final String appId;

  private final LocalDate date;

  private final WorkItemKind kind;

  /**
   * Create a work item.
   *
   * @param source Name of the Logs API source to load or archive.
   * @param eventName Event name, or {@code null} for date-ignored loads.
   * @param appId Application id.
   * @param date Date to load or archive, or {@code null} for date-ignored
   *     loads.
   * @param kind What to do.
   */
  public WorkItem(String source, String eventName, String appId,
      LocalDate date, WorkItemKind kind) {
    this.source = Objects.requireNonNull(source);
    this.eventName = eventName;
    this.appId = Objects.requireNonNull(appId);
    this.date = date;
    this.kind = Objects.requireNonNull(kind);
  }

  public String getSource() {
    return this.source;
  }

  public String getEventName() {
    return this.eventName;
  }

  public String getAppId() {
    return this.appId;
  }

  public LocalDate getDate() {
    return this.date;
  }

  public WorkItemKind getKind() {
    return this.kind;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof WorkItem)) {
      return false;
    }
    WorkItem that = (WorkItem) other;
    return this.source.equals(that.source)
        && Objects.equals(this.eventName, that.eventName)
        && this.appId.equals(that.appId)
        && Objects.equals(this.date, that.date)
        && this.kind == that.kind;
  }

  @Override
  public int hashCode() {
    return Objects.hash(this.source, this.eventName, this.appId, this.date,
        this.kind);
  }

  @Override
  public String toString() {
    return this.kind + " " + this.source + " " + this.appId + " "
        + (null == this.date ? "latest" : this.date)
        + (null == this.eventName ? "" : " \"" + this.eventName + "\"");
  }
}
