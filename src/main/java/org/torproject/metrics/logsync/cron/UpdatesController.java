/* Copyright 2024 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.logsync.cron;

import org.torproject.metrics.logsync.db.DbController;
import org.torproject.metrics.logsync.db.DbControllersCollection;
import org.torproject.metrics.logsync.schedule.Scheduler;
import org.torproject.metrics.logsync.schedule.WorkItem;
import org.torproject.metrics.logsync.sources.LoadingDefinition;
import org.torproject.metrics.logsync.sources.ProcessingDefinition;
import org.torproject.metrics.logsync.sources.SourcesCollection;
import org.torproject.metrics.logsync.state.StateStoreException;
import org.torproject.metrics.logsync.updater.Updater;

import org.apache.commons.codec.digest.DigestUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.time.format.DateTimeFormatter;

/**
 * Run cycles by executing the work items produced by the scheduler, one
 * after the other.
 */
public class UpdatesController {

  private static final Logger logger = LoggerFactory.getLogger(
      UpdatesController.class);

  private static final DateTimeFormatter suffixDateFormatter
      = DateTimeFormatter.ofPattern("yyyyMMdd");

  private final Scheduler scheduler;

  private final Updater updater;

  private final SourcesCollection sourcesCollection;

  private final DbControllersCollection dbControllersCollection;

  private volatile boolean stopped = false;

  /** Initialize the controller with its collaborators. */
  public UpdatesController(Scheduler scheduler, Updater updater,
      SourcesCollection sourcesCollection,
      DbControllersCollection dbControllersCollection) {
    this.scheduler = scheduler;
    this.updater = updater;
    this.sourcesCollection = sourcesCollection;
    this.dbControllersCollection = dbControllersCollection;
  }

  /** Create the database objects of all enabled sources. */
  public void prepare() throws IOException {
    this.dbControllersCollection.prepare();
  }

  /**
   * Run one cycle until all work items are executed, the first one fails, or
   * a stop is requested.
   *
   * @return {@code true} if all work items of the cycle were executed.
   */
  public boolean run() {
    logger.info("Starting updating cycle.");
    try {
      for (WorkItem workItem : this.scheduler.produceCycle()) {
        this.update(workItem);
        if (this.stopped) {
          logger.info("Stop requested; leaving the cycle unfinished.");
          return false;
        }
      }
      logger.info("Finished updating cycle.");
      return true;
    } catch (StateStoreException e) {
      logger.error("Cannot persist scheduling state; aborting cycle.", e);
    } catch (Exception e) { // Catching all to keep the process alive.
      logger.warn("Updating cycle failed: {}", e.getMessage(), e);
    }
    return false;
  }

  /**
   * Run cycles until a stop is requested, or only one cycle if
   * {@code runOnce} is set. After a failed cycle, wait for the given time
   * before starting the next one.
   *
   * @param runOnce Whether to return after the first cycle.
   * @param failedCycleWait Time to wait after a failed cycle.
   */
  public void runLoop(boolean runOnce, Duration failedCycleWait) {
    while (true) {
      boolean completed = this.run();
      if (runOnce || this.stopped) {
        return;
      }
      if (!completed) {
        logger.warn("Updating cycle did not complete; waiting {} before the "
            + "next cycle.", failedCycleWait);
        try {
          this.sleep(failedCycleWait);
        } catch (InterruptedException e) {
          logger.info("Interrupted while waiting for the next cycle.");
          Thread.currentThread().interrupt();
          return;
        }
        if (this.stopped) {
          return;
        }
      }
    }
  }

  /** Sleep for the given time; overridden by tests. */
  protected void sleep(Duration duration) throws InterruptedException {
    Thread.sleep(duration.toMillis());
  }

  /** Request that the current cycle ends after the running work item. */
  public void stop() {
    this.stopped = true;
  }

  public boolean isStopped() {
    return this.stopped;
  }

  void update(WorkItem workItem) throws IOException {
    String source = workItem.getSource();
    boolean eventFiltered
        = this.sourcesCollection.getDefinition(source).isEventFiltered();
    String eventName = eventFiltered ? workItem.getEventName() : null;
    String tableSuffix = tableSuffix(workItem, eventFiltered);
    LoadingDefinition loadingDefinition
        = this.sourcesCollection.loadingDefinition(source);
    ProcessingDefinition processingDefinition
        = this.sourcesCollection.processingDefinition(source);
    DbController dbController
        = this.dbControllersCollection.dbController(source);
    switch (workItem.getKind()) {
      case LOAD:
      case LOAD_DATE_IGNORED:
        logger.info("Loading \"{}\" \"{}\" into \"{}\" of \"{}\" for \"{}\".",
            null == workItem.getDate() ? "latest" : workItem.getDate(),
            eventName, tableSuffix, source, workItem.getAppId());
        this.updater.update(workItem.getAppId(), workItem.getDate(),
            eventName, tableSuffix, dbController,
            processingDefinition, loadingDefinition);
        break;
      case ARCHIVE:
        logger.info("Archiving \"{}\" of \"{}\" for \"{}\".",
            workItem.getDate(), source, workItem.getAppId());
        dbController.archiveTable(tableSuffix);
        break;
      default:
        throw new IllegalArgumentException("Unknown work item kind: "
            + workItem.getKind());
    }
  }

  /**
   * Returns the staging table suffix of a work item: application id, date,
   * and a short digest of the event name, or "latest" instead of the date.
   * The digest is only appended for sources filtered by event name.
   */
  static String tableSuffix(WorkItem workItem, boolean eventFiltered) {
    if (null == workItem.getDate()) {
      return workItem.getAppId() + "_" + DbController.LATEST_SUFFIX;
    }
    String suffix = workItem.getAppId() + "_"
        + suffixDateFormatter.format(workItem.getDate());
    if (eventFiltered && null != workItem.getEventName()) {
      suffix += "_" + DigestUtils.sha1Hex(workItem.getEventName())
          .substring(0, 8);
    }
    return suffix;
  }
}
