/* Copyright 2024 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.logsync.db;

import java.io.IOException;

/** Thrown if ClickHouse rejects a statement. */
public class ClickHouseException extends IOException {

  public ClickHouseException(String msg) {
    super(msg);
  }

}
