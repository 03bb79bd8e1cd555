/* Copyright 2024 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.logsync.updater;

import java.io.IOException;

/** Thrown if data cannot be loaded even when split into many parts. */
public class UpdateException extends IOException {

  public UpdateException(String msg, Throwable cause) {
    super(msg, cause);
  }

}
