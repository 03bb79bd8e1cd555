/* Copyright 2024 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.logsync.state;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Update state of a single date of a single event: either loaded at a given
 * time or archived for good.
 *
 * <p>Dates that were never loaded have no {@code DateState} at all.</p>
 */
public final class DateState {

  /** State of a date that will never be loaded again. */
  public static final DateState ARCHIVED = new DateState(null);

  private final LocalDateTime loadedAt;

  private DateState(LocalDateTime loadedAt) {
    this.loadedAt = loadedAt;
  }

  /** Returns the state of a date that was last loaded at the given time. */
  public static DateState loadedAt(LocalDateTime loadedAt) {
    return new DateState(Objects.requireNonNull(loadedAt));
  }

  public boolean isArchived() {
    return null == this.loadedAt;
  }

  /**
   * Returns the time of the last load.
   *
   * @throws IllegalStateException if this date is archived.
   */
  public LocalDateTime getLoadedAt() {
    if (this.isArchived()) {
      throw new IllegalStateException("Archived dates have no load time.");
    }
    return this.loadedAt;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof DateState)) {
      return false;
    }
    return Objects.equals(this.loadedAt, ((DateState) other).loadedAt);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(this.loadedAt);
  }

  @Override
  public String toString() {
    return this.isArchived() ? "archived" : "loaded at " + this.loadedAt;
  }
}
