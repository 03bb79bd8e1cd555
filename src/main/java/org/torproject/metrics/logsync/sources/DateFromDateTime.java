/* Copyright 2024 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.logsync.sources;

import java.util.Map;

/**
 * Derive a {@code yyyy-MM-dd} date from a {@code yyyy-MM-dd HH:mm:ss}
 * date-time field, keeping the time zone of the application.
 */
public class DateFromDateTime implements FieldConverter {

  private static final String EMPTY_DATE = "1970-01-01";

  private final String dateTimeField;

  public DateFromDateTime(String dateTimeField) {
    this.dateTimeField = dateTimeField;
  }

  @Override
  public Object convert(Map<String, Object> row) {
    Object value = row.get(this.dateTimeField);
    if (null == value || value.toString().length() < EMPTY_DATE.length()) {
      return EMPTY_DATE;
    }
    return value.toString().substring(0, EMPTY_DATE.length());
  }
}
