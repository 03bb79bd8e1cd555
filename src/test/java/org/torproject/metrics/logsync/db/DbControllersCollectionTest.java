/* Copyright 2024 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.logsync.db;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;

import org.torproject.metrics.logsync.sources.SourcesCollection;

import org.junit.Test;

public class DbControllersCollectionTest {

  @Test
  public void testPrepareAllSources() throws Exception {
    RecordingClickHouseClient client = new RecordingClickHouseClient();
    DbControllersCollection collection = new DbControllersCollection(client,
        new SourcesCollection("installations", "profiles"));
    collection.prepare();
    assertEquals(6, client.getStatements().size());
    assertEquals("CREATE TABLE IF NOT EXISTS mobile.`profiles` AS "
        + "mobile.`profiles_archive` ENGINE = Merge(mobile, '^profiles_')",
        client.getStatements().get(5));
    assertNotNull(collection.dbController("installations"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnknownSource() throws Exception {
    new DbControllersCollection(new RecordingClickHouseClient(),
        new SourcesCollection("installations")).dbController("clicks");
  }
}
