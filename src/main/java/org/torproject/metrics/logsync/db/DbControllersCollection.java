/* Copyright 2024 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.logsync.db;

import org.torproject.metrics.logsync.sources.SourceDefinition;
import org.torproject.metrics.logsync.sources.SourcesCollection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/** One {@link DbController} per loaded source. */
public class DbControllersCollection {

  private static final Logger logger = LoggerFactory.getLogger(
      DbControllersCollection.class);

  private final Map<String, DbController> dbControllers
      = new LinkedHashMap<>();

  /** Initialize controllers for all sources of the given collection. */
  public DbControllersCollection(ClickHouseClient client,
      SourcesCollection sourcesCollection) {
    for (SourceDefinition definition : sourcesCollection.getDefinitions()) {
      this.dbControllers.put(definition.getName(),
          new DbController(client, definition));
    }
  }

  /** Create missing tables of all sources. */
  public void prepare() throws IOException {
    for (Map.Entry<String, DbController> e : this.dbControllers.entrySet()) {
      logger.info("Preparing tables of {}.", e.getKey());
      e.getValue().prepare();
    }
  }

  /**
   * Returns the controller of the given source.
   *
   * @throws IllegalArgumentException if the source is not loaded.
   */
  public DbController dbController(String source) {
    DbController dbController = this.dbControllers.get(source);
    if (null == dbController) {
      throw new IllegalArgumentException("No tables for source " + source);
    }
    return dbController;
  }
}
