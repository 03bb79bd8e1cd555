/* Copyright 2024 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.logsync.state;

/** Thrown if the scheduling state cannot be read or written. */
public class StateStoreException extends RuntimeException {

  public StateStoreException(String msg, Throwable cause) {
    super(msg, cause);
  }

}
