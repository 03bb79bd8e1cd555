/* Copyright 2024 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.logsync.logsapi;

/**
 * Thrown if the Logs API refuses to export the requested data in as few parts
 * as requested.
 */
public class LogsApiPartsCountException extends LogsApiException {

  private final int partsCount;

  public LogsApiPartsCountException(String msg, int responseCode,
      int partsCount) {
    super(msg, responseCode);
    this.partsCount = partsCount;
  }

  /** Returns the parts count that was rejected. */
  public int getPartsCount() {
    return this.partsCount;
  }
}
