/* Copyright 2024 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.logsync.cron;

import static org.junit.Assert.assertFalse;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import org.junit.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

public class ShutdownHookTest {

  @Test(timeout = 10_000L)
  public void testStopsAndWakesUpLoop() throws Exception {
    UpdatesController controller = mock(UpdatesController.class);
    CountDownLatch sleeping = new CountDownLatch(1);
    Thread loop = new Thread(() -> {
      sleeping.countDown();
      try {
        Thread.sleep(TimeUnit.HOURS.toMillis(1L));
      } catch (InterruptedException e) {
        /* Woken up by the shutdown hook. */
      }
    });
    loop.start();
    sleeping.await();
    new ShutdownHook(controller, loop, 1L).run();
    verify(controller).stop();
    assertFalse(loop.isAlive());
  }
}
