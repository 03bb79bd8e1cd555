/* Copyright 2024 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.logsync.state;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Root node of the state file.
 */
@JsonPropertyOrder({ "last_cycle_completed_at", "app_id_states" })
class StateNode {

  /**
   * Timestamp when the last cycle completed, or {@code null} before the first
   * cycle.
   */
  @JsonProperty("last_cycle_completed_at")
  String lastCycleCompletedAt;

  /**
   * Update history of all tracked applications.
   */
  @JsonProperty("app_id_states")
  List<ApplicationNode> appIdStates;
}
