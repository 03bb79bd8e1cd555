/* Copyright 2024 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.logsync.schedule;

/** What to do with the data of a work item. */
public enum WorkItemKind {

  /** Load the data of a single date into its staging table. */
  LOAD,

  /** Move the staging table of a single date into the archive. */
  ARCHIVE,

  /** Load data that has no date dimension into the "latest" table. */
  LOAD_DATE_IGNORED
}
