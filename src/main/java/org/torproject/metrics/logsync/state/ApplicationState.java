/* Copyright 2024 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.logsync.state;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Per-event, per-date update history of one application.
 *
 * <p>Entries are only ever added or moved forward; an archived date stays
 * archived.</p>
 */
public class ApplicationState {

  private final String appId;

  private final Map<String, SortedMap<LocalDate, DateState>> dateUpdates
      = new LinkedHashMap<>();

  public ApplicationState(String appId) {
    this.appId = appId;
  }

  public String getAppId() {
    return this.appId;
  }

  /** Returns a read-only view of all events and their dates. */
  public Map<String, SortedMap<LocalDate, DateState>> getDateUpdates() {
    return Collections.unmodifiableMap(this.dateUpdates);
  }

  /** Returns the state of the given date, or {@code null} if never loaded. */
  public DateState getDateState(String eventName, LocalDate date) {
    SortedMap<LocalDate, DateState> dates = this.dateUpdates.get(eventName);
    return null == dates ? null : dates.get(date);
  }

  /** Returns whether the given date was archived for the given event. */
  public boolean isArchived(String eventName, LocalDate date) {
    DateState dateState = this.getDateState(eventName, date);
    return null != dateState && dateState.isArchived();
  }

  /**
   * Records that the given date was loaded at the given time.
   *
   * @return {@code false} if the date is archived and was left unchanged.
   */
  public boolean markUpdated(String eventName, LocalDate date,
      LocalDateTime loadedAt) {
    if (this.isArchived(eventName, date)) {
      return false;
    }
    this.dates(eventName).put(date, DateState.loadedAt(loadedAt));
    return true;
  }

  /** Records that the given date is archived for the given event. */
  public void markArchived(String eventName, LocalDate date) {
    this.dates(eventName).put(date, DateState.ARCHIVED);
  }

  private SortedMap<LocalDate, DateState> dates(String eventName) {
    return this.dateUpdates.computeIfAbsent(eventName, e -> new TreeMap<>());
  }

  /** Returns a deep copy of this state. */
  public ApplicationState copy() {
    ApplicationState copy = new ApplicationState(this.appId);
    for (Map.Entry<String, SortedMap<LocalDate, DateState>> e
        : this.dateUpdates.entrySet()) {
      copy.dateUpdates.put(e.getKey(), new TreeMap<>(e.getValue()));
    }
    return copy;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof ApplicationState)) {
      return false;
    }
    ApplicationState that = (ApplicationState) other;
    return this.appId.equals(that.appId)
        && this.dateUpdates.equals(that.dateUpdates);
  }

  @Override
  public int hashCode() {
    return 31 * this.appId.hashCode() + this.dateUpdates.hashCode();
  }
}
