/* Copyright 2024 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.logsync.logsapi;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/** Receives rows pulled from the Logs API, one batch at a time. */
@FunctionalInterface
public interface BatchHandler {

  void handle(List<Map<String, Object>> rows) throws IOException;
}
