/* Copyright 2024 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.logsync.sources;

import java.util.Map;

/** Derive the value of a field from the other fields of the same row. */
@FunctionalInterface
public interface FieldConverter {

  Object convert(Map<String, Object> row);
}
