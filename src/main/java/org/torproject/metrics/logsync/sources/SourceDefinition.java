/* Copyright 2024 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.logsync.sources;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything there is to know about one Logs API source: the fields to
 * request, the table to write to, and whether it is loaded date by date.
 */
public class SourceDefinition {

  /** Column holding the application id of every row. */
  public static final String APP_ID_FIELD = "app_id";

  /** Column holding the time of loading a row, in seconds since the epoch. */
  public static final String LOAD_DATETIME_FIELD = "load_datetime";

  /** Logs API field that export requests can be filtered by. */
  public static final String EVENT_NAME_FIELD = "event_name";

  private final String name;

  private final String tableName;

  private final String dateField;

  private final LoadingDefinition loadingDefinition;

  private final ProcessingDefinition processingDefinition;

  private SourceDefinition(Builder builder) {
    this.name = builder.name;
    this.tableName = builder.tableName;
    this.dateField = builder.dateField;
    this.loadingDefinition = new LoadingDefinition(builder.name,
        new ArrayList<>(builder.apiFields.keySet()));
    Map<String, String> fieldTypes = new LinkedHashMap<>(builder.apiFields);
    fieldTypes.put(APP_ID_FIELD, "String");
    fieldTypes.put(LOAD_DATETIME_FIELD, "UInt64");
    fieldTypes.putAll(builder.derivedFields);
    this.processingDefinition = new ProcessingDefinition(fieldTypes,
        builder.converters);
  }

  public String getName() {
    return this.name;
  }

  public String getTableName() {
    return this.tableName;
  }

  /**
   * Returns the date column used for partitioning, or {@code null} if this
   * source has no date dimension.
   */
  public String getDateField() {
    return this.dateField;
  }

  /** Returns whether this source is loaded date by date. */
  public boolean isDateRequired() {
    return null != this.dateField;
  }

  /**
   * Returns whether exports of this source contain an event name and are
   * therefore pulled and staged once per configured event name.
   */
  public boolean isEventFiltered() {
    return this.loadingDefinition.getFields().contains(EVENT_NAME_FIELD);
  }

  public LoadingDefinition getLoadingDefinition() {
    return this.loadingDefinition;
  }

  public ProcessingDefinition getProcessingDefinition() {
    return this.processingDefinition;
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  /** Builder for source definitions. */
  public static class Builder {

    private final String name;

    private String tableName;

    private String dateField;

    private final Map<String, String> apiFields = new LinkedHashMap<>();

    private final Map<String, String> derivedFields = new LinkedHashMap<>();

    private final Map<String, FieldConverter> converters
        = new LinkedHashMap<>();

    private Builder(String name) {
      this.name = name;
      this.tableName = name;
    }

    public Builder table(String tableName) {
      this.tableName = tableName;
      return this;
    }

    /** Adds a field requested from the Logs API. */
    public Builder field(String field, String type) {
      this.apiFields.put(field, type);
      return this;
    }

    /** Adds a field computed from other fields of the same row. */
    public Builder derived(String field, String type,
        FieldConverter converter) {
      this.derivedFields.put(field, type);
      this.converters.put(field, converter);
      return this;
    }

    /**
     * Adds a {@code Date} field derived from a date-time field and makes this
     * a date-required source partitioned by that date.
     */
    public Builder dateFrom(String dateField, String dateTimeField) {
      this.dateField = dateField;
      return this.derived(dateField, "Date",
          new DateFromDateTime(dateTimeField));
    }

    public SourceDefinition build() {
      return new SourceDefinition(this);
    }
  }

  @Override
  public String toString() {
    return this.name;
  }

  static List<String> names(List<SourceDefinition> definitions) {
    List<String> names = new ArrayList<>();
    for (SourceDefinition definition : definitions) {
      names.add(definition.getName());
    }
    return names;
  }
}
