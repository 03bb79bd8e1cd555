/* Copyright 2024 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.logsync.state;

/**
 * Durable storage of the scheduling state, read and written as a whole.
 *
 * <p>Implementations throw {@link StateStoreException} if the state cannot
 * be read or written.</p>
 */
public interface StateStore {

  /** Returns the stored state, or an empty state if nothing was stored. */
  GlobalState load();

  /** Replaces the stored state with the given one. */
  void save(GlobalState state);
}
