/* Copyright 2024 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.logsync.schedule;

import org.torproject.metrics.logsync.state.ApplicationState;
import org.torproject.metrics.logsync.state.GlobalState;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Change to the scheduling state that goes along with a planned work item:
 * either a date was loaded at a given time, or a date got archived.
 */
public final class StateDelta {

  private final String appId;

  private final String eventName;

  private final LocalDate date;

  /** Load time, or {@code null} for archiving the date. */
  private final LocalDateTime loadedAt;

  private StateDelta(String appId, String eventName, LocalDate date,
      LocalDateTime loadedAt) {
    this.appId = appId;
    this.eventName = eventName;
    this.date = date;
    this.loadedAt = loadedAt;
  }

  /** Records that the given date was loaded at the given time. */
  public static StateDelta touch(String appId, String eventName,
      LocalDate date, LocalDateTime loadedAt) {
    return new StateDelta(appId, eventName, date,
        Objects.requireNonNull(loadedAt));
  }

  /** Records that the given date is archived. */
  public static StateDelta archive(String appId, String eventName,
      LocalDate date) {
    return new StateDelta(appId, eventName, date, null);
  }

  public boolean isArchive() {
    return null == this.loadedAt;
  }

  /** Applies this change to the given state. */
  public void applyTo(GlobalState state) {
    ApplicationState applicationState
        = state.getOrCreateApplicationState(this.appId);
    if (this.isArchive()) {
      applicationState.markArchived(this.eventName, this.date);
    } else {
      applicationState.markUpdated(this.eventName, this.date, this.loadedAt);
    }
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof StateDelta)) {
      return false;
    }
    StateDelta that = (StateDelta) other;
    return this.appId.equals(that.appId)
        && Objects.equals(this.eventName, that.eventName)
        && this.date.equals(that.date)
        && Objects.equals(this.loadedAt, that.loadedAt);
  }

  @Override
  public int hashCode() {
    return Objects.hash(this.appId, this.eventName, this.date, this.loadedAt);
  }

  @Override
  public String toString() {
    return (this.isArchive() ? "archive " : "touch at " + this.loadedAt + " ")
        + this.appId + " " + this.date + " \"" + this.eventName + "\"";
  }
}
