/* Copyright 2024 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.logsync.sources;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.torproject.metrics.logsync.conf.ConfigurationException;

import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class SourcesCollectionTest {

  @Test
  public void testAllBuiltInSources() throws Exception {
    SourcesCollection sources = new SourcesCollection();
    assertEquals(Arrays.asList("installations", "clicks", "events",
        "sessions_starts", "crashes", "errors", "push_tokens"),
        sources.dateRequiredSources());
    assertEquals(Collections.singletonList("profiles"),
        sources.dateIgnoredSources());
  }

  @Test
  public void testConfiguredSourcesKeepTheirOrder() throws Exception {
    SourcesCollection sources = new SourcesCollection("profiles", "events",
        "installations");
    assertEquals(Arrays.asList("events", "installations"),
        sources.dateRequiredSources());
    assertEquals(3, sources.getDefinitions().size());
  }

  @Test
  public void testOnlyEventsAreFilteredByEventName() throws Exception {
    SourcesCollection sources = new SourcesCollection();
    assertEquals(Collections.singletonList("events"),
        sources.eventFilteredSources());
    assertTrue(sources.getDefinition("events").isEventFiltered());
    assertFalse(sources.getDefinition("installations").isEventFiltered());
  }

  @Test(expected = ConfigurationException.class)
  public void testUnknownSource() throws Exception {
    new SourcesCollection("events", "purchases");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testSourceNotLoaded() throws Exception {
    new SourcesCollection("events").loadingDefinition("clicks");
  }

  @Test
  public void testDefinitions() throws Exception {
    SourcesCollection sources = new SourcesCollection();
    for (SourceDefinition definition : sources.getDefinitions()) {
      Map<String, String> fieldTypes
          = definition.getProcessingDefinition().getFieldTypes();
      List<String> fields = definition.getLoadingDefinition().getFields();
      assertEquals(definition.getName(),
          definition.getLoadingDefinition().getSourceName());
      assertEquals("String", fieldTypes.get(SourceDefinition.APP_ID_FIELD));
      assertEquals("UInt64",
          fieldTypes.get(SourceDefinition.LOAD_DATETIME_FIELD));
      assertFalse(fields.contains(SourceDefinition.APP_ID_FIELD));
      if (definition.isDateRequired()) {
        assertEquals("Date", fieldTypes.get(definition.getDateField()));
        assertFalse(fields.contains(definition.getDateField()));
        assertTrue(definition.getProcessingDefinition().getFieldConverters()
            .containsKey(definition.getDateField()));
      }
    }
  }

  @Test
  public void testCustomDefinitions() throws Exception {
    SourceDefinition purchases = SourceDefinition.builder("purchases")
        .table("revenue")
        .field("purchase_datetime", "DateTime")
        .dateFrom("purchase_date", "purchase_datetime")
        .build();
    SourcesCollection sources = new SourcesCollection(
        Collections.singletonList(purchases), "purchases");
    assertEquals("revenue", sources.getDefinition("purchases").getTableName());
    assertEquals(Collections.singletonList("purchases"),
        sources.dateRequiredSources());
  }

  @Test
  public void testDateFromDateTime() {
    DateFromDateTime converter = new DateFromDateTime("event_datetime");
    Map<String, Object> row = new HashMap<>();
    assertEquals("1970-01-01", converter.convert(row));
    row.put("event_datetime", "");
    assertEquals("1970-01-01", converter.convert(row));
    row.put("event_datetime", "2024-01-10 08:15:00");
    assertEquals("2024-01-10", converter.convert(row));
  }
}
