/* Copyright 2024 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.logsync.state;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * All scheduling state: when the last cycle completed and the update history
 * of every tracked application.
 */
public class GlobalState {

  private LocalDateTime lastCycleCompletedAt;

  private final Map<String, ApplicationState> applicationStates
      = new LinkedHashMap<>();

  /** Returns the completion time of the last cycle, or {@code null}. */
  public LocalDateTime getLastCycleCompletedAt() {
    return this.lastCycleCompletedAt;
  }

  public void setLastCycleCompletedAt(LocalDateTime lastCycleCompletedAt) {
    this.lastCycleCompletedAt = lastCycleCompletedAt;
  }

  public Collection<ApplicationState> getApplicationStates() {
    return Collections.unmodifiableCollection(
        this.applicationStates.values());
  }

  /** Returns the state of the given application, or {@code null}. */
  public ApplicationState getApplicationState(String appId) {
    return this.applicationStates.get(appId);
  }

  /** Returns the state of the given application, creating it if needed. */
  public ApplicationState getOrCreateApplicationState(String appId) {
    return this.applicationStates.computeIfAbsent(appId,
        ApplicationState::new);
  }

  /** Adds or replaces the state of an application. */
  public void putApplicationState(ApplicationState applicationState) {
    this.applicationStates.put(applicationState.getAppId(), applicationState);
  }

  /** Returns a deep copy of this state. */
  public GlobalState copy() {
    GlobalState copy = new GlobalState();
    copy.lastCycleCompletedAt = this.lastCycleCompletedAt;
    for (ApplicationState applicationState
        : new ArrayList<>(this.applicationStates.values())) {
      copy.putApplicationState(applicationState.copy());
    }
    return copy;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof GlobalState)) {
      return false;
    }
    GlobalState that = (GlobalState) other;
    return Objects.equals(this.lastCycleCompletedAt,
        that.lastCycleCompletedAt)
        && this.applicationStates.equals(that.applicationStates);
  }

  @Override
  public int hashCode() {
    return Objects.hash(this.lastCycleCompletedAt, this.applicationStates);
  }
}
