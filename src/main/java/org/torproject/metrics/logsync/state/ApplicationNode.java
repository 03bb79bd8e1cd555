/* Copyright 2024 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.logsync.state;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Map;

/**
 * Application node in the state file, mapping event names to dates
 * ({@code yyyy-MM-dd}) to load timestamps.
 */
@JsonPropertyOrder({ "app_id", "date_updates" })
class ApplicationNode {

  @JsonProperty("app_id")
  String appId;

  @JsonProperty("date_updates")
  Map<String, Map<String, String>> dateUpdates;
}
