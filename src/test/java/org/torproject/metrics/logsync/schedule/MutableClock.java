/* Copyright 2024 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.logsync.schedule;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

/** Clock in UTC that only moves when told to. */
public class MutableClock extends Clock {

  private Instant instant;

  public MutableClock(LocalDateTime now) {
    this.instant = now.toInstant(ZoneOffset.UTC);
  }

  public void advance(Duration duration) {
    this.instant = this.instant.plus(duration);
  }

  @Override
  public ZoneId getZone() {
    return ZoneOffset.UTC;
  }

  @Override
  public Clock withZone(ZoneId zone) {
    throw new UnsupportedOperationException();
  }

  @Override
  public Instant instant() {
    return this.instant;
  }
}
