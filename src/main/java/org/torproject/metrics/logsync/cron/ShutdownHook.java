/* Copyright 2016--2024 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.logsync.cron;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Stops the updating loop on shutdown and waits for the running work item to
 * complete.
 */
public final class ShutdownHook extends Thread {

  private static final Logger logger
      = LoggerFactory.getLogger(ShutdownHook.class);

  private final UpdatesController controller;

  private final Thread loopThread;

  private final long gracePeriodMinutes;

  /** Names the shutdown thread for debugging purposes. */
  public ShutdownHook(UpdatesController controller, Thread loopThread,
      long gracePeriodMinutes) {
    super("LogSync-ShutdownThread");
    this.controller = controller;
    this.loopThread = loopThread;
    this.gracePeriodMinutes = gracePeriodMinutes;
  }

  @Override
  public void run() {
    logger.info("Shutdown in progress ... ");
    this.controller.stop();
    /* Wakes the loop up if it is waiting for the next cycle. */
    this.loopThread.interrupt();
    try {
      logger.info("Waiting at most {} minutes for the running work item to "
          + "finish ... ", this.gracePeriodMinutes);
      this.loopThread.join(TimeUnit.MINUTES.toMillis(this.gracePeriodMinutes));
    } catch (InterruptedException e) {
      logger.warn("Interrupted while waiting for the updating loop.");
      Thread.currentThread().interrupt();
    }
    if (this.loopThread.isAlive()) {
      logger.error("Updating loop did not finish in time.");
    }
    logger.info("Shutdown finished. Exiting.");
  }
}
