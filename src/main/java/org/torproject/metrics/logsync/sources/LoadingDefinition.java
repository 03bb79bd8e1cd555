/* Copyright 2024 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.logsync.sources;

import java.util.Collections;
import java.util.List;

/** Which fields to request from which Logs API source. */
public class LoadingDefinition {

  private final String sourceName;

  private final List<String> fields;

  public LoadingDefinition(String sourceName, List<String> fields) {
    this.sourceName = sourceName;
    this.fields = Collections.unmodifiableList(fields);
  }

  public String getSourceName() {
    return this.sourceName;
  }

  public List<String> getFields() {
    return this.fields;
  }
}
