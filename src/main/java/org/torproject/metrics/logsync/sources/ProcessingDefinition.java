/* Copyright 2024 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.logsync.sources;

import java.util.Collections;
import java.util.Map;

/**
 * How to turn rows returned by the Logs API into rows of the destination
 * table: database types of all columns and converters for derived columns.
 */
public class ProcessingDefinition {

  private final Map<String, String> fieldTypes;

  private final Map<String, FieldConverter> fieldConverters;

  public ProcessingDefinition(Map<String, String> fieldTypes,
      Map<String, FieldConverter> fieldConverters) {
    this.fieldTypes = Collections.unmodifiableMap(fieldTypes);
    this.fieldConverters = Collections.unmodifiableMap(fieldConverters);
  }

  /** Returns database types of all columns in table order. */
  public Map<String, String> getFieldTypes() {
    return this.fieldTypes;
  }

  /** Returns converters of derived columns in application order. */
  public Map<String, FieldConverter> getFieldConverters() {
    return this.fieldConverters;
  }
}
