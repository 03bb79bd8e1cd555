/* Copyright 2024 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.logsync.updater;

import org.torproject.metrics.logsync.db.DbController;
import org.torproject.metrics.logsync.logsapi.LogsApiPartsCountException;
import org.torproject.metrics.logsync.logsapi.LogsSource;
import org.torproject.metrics.logsync.logsapi.PullRequest;
import org.torproject.metrics.logsync.sources.FieldConverter;
import org.torproject.metrics.logsync.sources.LoadingDefinition;
import org.torproject.metrics.logsync.sources.ProcessingDefinition;
import org.torproject.metrics.logsync.sources.SourceDefinition;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Load the data of one source, application, and date (or of no date) into a
 * freshly created staging table.
 *
 * <p>A request starts out as a single part. Whenever the Logs API finds the
 * parts too large, the staging table is recreated and the whole request is
 * repeated with twice as many parts.</p>
 */
public class Updater {

  private static final Logger logger = LoggerFactory.getLogger(Updater.class);

  private final LogsSource logsSource;

  private final int maxPartsCount;

  private final Clock clock;

  /**
   * Initialize the updater.
   *
   * @param logsSource Where to pull rows from.
   * @param maxPartsCount Largest number of parts to split a request into.
   * @param clock Clock for the {@code load_datetime} column.
   */
  public Updater(LogsSource logsSource, int maxPartsCount, Clock clock) {
    this.logsSource = logsSource;
    this.maxPartsCount = maxPartsCount;
    this.clock = clock;
  }

  /**
   * Replace the contents of the given staging table with freshly pulled rows.
   *
   * @param appId Application id.
   * @param date Date to load, or {@code null} to load data without date.
   * @param eventName Event name to filter by, or {@code null}.
   * @param tableSuffix Suffix of the staging table.
   * @param dbController Tables of the source.
   * @param processingDefinition How to process pulled rows.
   * @param loadingDefinition What to pull.
   * @throws UpdateException if the Logs API still rejects the request at
   *     the largest parts count.
   * @throws IOException if pulling or writing fails.
   */
  public void update(String appId, LocalDate date, String eventName,
      String tableSuffix, DbController dbController,
      ProcessingDefinition processingDefinition,
      LoadingDefinition loadingDefinition) throws IOException {
    LocalDateTime since = null;
    LocalDateTime until = null;
    if (null != date) {
      since = LocalDateTime.of(date, LocalTime.MIN);
      until = LocalDateTime.of(date, LocalTime.MAX);
    }
    int partsCount = 1;
    while (true) {
      PullRequest request = new PullRequest(appId,
          loadingDefinition.getSourceName(), loadingDefinition.getFields(),
          since, until, PullRequest.DATE_DIMENSION_DEFAULT, eventName,
          partsCount);
      try {
        this.tryUpdate(request, tableSuffix, dbController,
            processingDefinition);
        return;
      } catch (LogsApiPartsCountException e) {
        if (partsCount >= this.maxPartsCount) {
          throw new UpdateException("Giving up loading "
              + loadingDefinition.getSourceName() + " into " + tableSuffix
              + " after the Logs API rejected " + partsCount + " parts.", e);
        }
        partsCount = Math.min(partsCount * 2, this.maxPartsCount);
        logger.info("Too much data in {} for {}; retrying with {} parts.",
            loadingDefinition.getSourceName(), tableSuffix, partsCount);
      }
    }
  }

  private void tryUpdate(PullRequest request, String tableSuffix,
      DbController dbController, ProcessingDefinition processingDefinition)
      throws IOException {
    dbController.recreateTable(tableSuffix);
    this.logsSource.pull(request, rows -> {
      logger.debug("Processing chunk of {} rows.", rows.size());
      dbController.insertData(this.processData(request.getAppId(), rows,
          processingDefinition), tableSuffix);
    });
  }

  List<Map<String, Object>> processData(String appId,
      List<Map<String, Object>> rows,
      ProcessingDefinition processingDefinition) {
    long loadDatetime = this.clock.instant().getEpochSecond();
    List<Map<String, Object>> processed = new ArrayList<>(rows.size());
    for (Map<String, Object> row : rows) {
      Map<String, Object> copy = new LinkedHashMap<>(row);
      ensureTypes(copy, processingDefinition.getFieldTypes());
      copy.put(SourceDefinition.APP_ID_FIELD, appId);
      copy.put(SourceDefinition.LOAD_DATETIME_FIELD, loadDatetime);
      for (Map.Entry<String, FieldConverter> e
          : processingDefinition.getFieldConverters().entrySet()) {
        copy.put(e.getKey(), e.getValue().convert(copy));
      }
      processed.add(copy);
    }
    return processed;
  }

  /** Turn values of integer columns into numbers, and missing ones into 0. */
  static void ensureTypes(Map<String, Object> row,
      Map<String, String> fieldTypes) {
    for (Map.Entry<String, String> e : fieldTypes.entrySet()) {
      if (!e.getValue().contains("Int") || !row.containsKey(e.getKey())) {
        continue;
      }
      Object value = row.get(e.getKey());
      if (value instanceof Number) {
        continue;
      }
      if (null == value || value.toString().trim().isEmpty()) {
        row.put(e.getKey(), 0L);
        continue;
      }
      String string = value.toString().trim();
      try {
        row.put(e.getKey(), Long.parseLong(string));
      } catch (NumberFormatException nfe) {
        row.put(e.getKey(), new BigDecimal(string).toBigInteger());
      }
    }
  }
}
