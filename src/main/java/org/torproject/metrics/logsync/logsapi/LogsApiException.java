/* Copyright 2024 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.logsync.logsapi;

import java.io.IOException;

/** Thrown if the Logs API answers a request with an error. */
public class LogsApiException extends IOException {

  private final int responseCode;

  public LogsApiException(String msg, int responseCode) {
    super(msg);
    this.responseCode = responseCode;
  }

  /** Returns the HTTP response code of the failed request. */
  public int getResponseCode() {
    return this.responseCode;
  }
}
