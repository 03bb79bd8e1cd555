/* Copyright 2024 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.logsync.logsapi;

import java.io.IOException;

/** Source of rows for a pull request. */
public interface LogsSource {

  /**
   * Pull all rows matching the given request and hand them to the given
   * handler in batches, part by part.
   *
   * @throws LogsApiPartsCountException if the request needs to be split into
   *     more parts.
   * @throws IOException if pulling or handling rows fails.
   */
  void pull(PullRequest request, BatchHandler handler) throws IOException;
}
