/* Copyright 2024 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.logsync.sources;

import org.torproject.metrics.logsync.conf.ConfigurationException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Definitions of all Logs API sources that are loaded, looked up by source
 * name.
 */
public class SourcesCollection {

  private static final String DATE_TIME = "DateTime";

  private static final String STRING = "String";

  private static final String UINT8 = "UInt8";

  private static final String UINT64 = "UInt64";

  /** All sources known to this software. */
  static final List<SourceDefinition> BUILT_IN = Collections.unmodifiableList(
      Arrays.asList(
          SourceDefinition.builder("installations")
              .field("application_id", UINT64)
              .field("appmetrica_device_id", UINT64)
              .field("install_datetime", DATE_TIME)
              .field("install_timestamp", UINT64)
              .field("install_receive_datetime", DATE_TIME)
              .field("is_reinstallation", UINT8)
              .field("tracker_name", STRING)
              .field("publisher_name", STRING)
              .field("os_name", STRING)
              .field("device_model", STRING)
              .field("city", STRING)
              .field("country_iso_code", STRING)
              .dateFrom("install_date", "install_datetime")
              .build(),
          SourceDefinition.builder("clicks")
              .field("application_id", UINT64)
              .field("click_id", STRING)
              .field("click_datetime", DATE_TIME)
              .field("click_timestamp", UINT64)
              .field("tracker_name", STRING)
              .field("publisher_name", STRING)
              .field("os_name", STRING)
              .field("country_iso_code", STRING)
              .dateFrom("click_date", "click_datetime")
              .build(),
          SourceDefinition.builder("events")
              .field("application_id", UINT64)
              .field("appmetrica_device_id", UINT64)
              .field("event_name", STRING)
              .field("event_json", STRING)
              .field("event_datetime", DATE_TIME)
              .field("event_timestamp", UINT64)
              .field("event_receive_datetime", DATE_TIME)
              .field("session_id", UINT64)
              .field("os_name", STRING)
              .field("os_version", STRING)
              .field("device_model", STRING)
              .field("app_version_name", STRING)
              .field("connection_type", STRING)
              .field("city", STRING)
              .field("country_iso_code", STRING)
              .dateFrom("event_date", "event_datetime")
              .build(),
          SourceDefinition.builder("sessions_starts")
              .field("application_id", UINT64)
              .field("appmetrica_device_id", UINT64)
              .field("session_id", UINT64)
              .field("session_start_datetime", DATE_TIME)
              .field("session_start_timestamp", UINT64)
              .field("os_name", STRING)
              .field("app_version_name", STRING)
              .field("country_iso_code", STRING)
              .dateFrom("session_start_date", "session_start_datetime")
              .build(),
          SourceDefinition.builder("crashes")
              .field("application_id", UINT64)
              .field("appmetrica_device_id", UINT64)
              .field("crash", STRING)
              .field("crash_group_id", UINT64)
              .field("crash_datetime", DATE_TIME)
              .field("crash_timestamp", UINT64)
              .field("os_name", STRING)
              .field("app_version_name", STRING)
              .dateFrom("crash_date", "crash_datetime")
              .build(),
          SourceDefinition.builder("errors")
              .field("application_id", UINT64)
              .field("appmetrica_device_id", UINT64)
              .field("error", STRING)
              .field("error_id", STRING)
              .field("error_datetime", DATE_TIME)
              .field("error_timestamp", UINT64)
              .field("os_name", STRING)
              .field("app_version_name", STRING)
              .dateFrom("error_date", "error_datetime")
              .build(),
          SourceDefinition.builder("push_tokens")
              .field("application_id", UINT64)
              .field("appmetrica_device_id", UINT64)
              .field("token", STRING)
              .field("token_datetime", DATE_TIME)
              .field("token_timestamp", UINT64)
              .field("os_name", STRING)
              .dateFrom("token_date", "token_datetime")
              .build(),
          SourceDefinition.builder("profiles")
              .field("profile_id", STRING)
              .field("appmetrica_device_id", UINT64)
              .field("appmetrica_first_session_date", STRING)
              .field("appmetrica_last_start_date", STRING)
              .field("appmetrica_sessions", UINT64)
              .field("appmetrica_crashes", UINT64)
              .field("appmetrica_errors", UINT64)
              .field("appmetrica_push_opens", UINT64)
              .field("os_name", STRING)
              .field("os_version", STRING)
              .field("device_model", STRING)
              .field("app_version_name", STRING)
              .field("city", STRING)
              .field("country_iso_code", STRING)
              .build()));

  private final Map<String, SourceDefinition> definitions
      = new LinkedHashMap<>();

  /**
   * Initialize the collection with the given built-in sources, or with all of
   * them if no names are given.
   *
   * @throws ConfigurationException if a source name is unknown.
   */
  public SourcesCollection(String... sourceNames)
      throws ConfigurationException {
    this(BUILT_IN, sourceNames);
  }

  SourcesCollection(List<SourceDefinition> available, String... sourceNames)
      throws ConfigurationException {
    Map<String, SourceDefinition> byName = new LinkedHashMap<>();
    for (SourceDefinition definition : available) {
      byName.put(definition.getName(), definition);
    }
    if (0 == sourceNames.length) {
      this.definitions.putAll(byName);
      return;
    }
    for (String sourceName : sourceNames) {
      SourceDefinition definition = byName.get(sourceName);
      if (null == definition) {
        throw new ConfigurationException("Unknown source: " + sourceName
            + ". Known sources are " + byName.keySet() + ".");
      }
      this.definitions.put(sourceName, definition);
    }
  }

  public List<SourceDefinition> getDefinitions() {
    return new ArrayList<>(this.definitions.values());
  }

  /**
   * Returns the definition of the given source.
   *
   * @throws IllegalArgumentException if the source is not loaded.
   */
  public SourceDefinition getDefinition(String sourceName) {
    SourceDefinition definition = this.definitions.get(sourceName);
    if (null == definition) {
      throw new IllegalArgumentException("Source not loaded: " + sourceName);
    }
    return definition;
  }

  public LoadingDefinition loadingDefinition(String sourceName) {
    return this.getDefinition(sourceName).getLoadingDefinition();
  }

  public ProcessingDefinition processingDefinition(String sourceName) {
    return this.getDefinition(sourceName).getProcessingDefinition();
  }

  /** Returns names of sources that are loaded date by date. */
  public List<String> dateRequiredSources() {
    List<SourceDefinition> dateRequired = new ArrayList<>();
    for (SourceDefinition definition : this.definitions.values()) {
      if (definition.isDateRequired()) {
        dateRequired.add(definition);
      }
    }
    return SourceDefinition.names(dateRequired);
  }

  /**
   * Returns names of date-required sources that are loaded separately for
   * each event name.
   */
  public List<String> eventFilteredSources() {
    List<SourceDefinition> eventFiltered = new ArrayList<>();
    for (SourceDefinition definition : this.definitions.values()) {
      if (definition.isDateRequired() && definition.isEventFiltered()) {
        eventFiltered.add(definition);
      }
    }
    return SourceDefinition.names(eventFiltered);
  }

  /** Returns names of sources without date dimension. */
  public List<String> dateIgnoredSources() {
    List<SourceDefinition> dateIgnored = new ArrayList<>();
    for (SourceDefinition definition : this.definitions.values()) {
      if (!definition.isDateRequired()) {
        dateIgnored.add(definition);
      }
    }
    return SourceDefinition.names(dateIgnored);
  }
}
