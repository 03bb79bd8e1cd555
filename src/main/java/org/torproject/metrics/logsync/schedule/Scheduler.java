/* Copyright 2024 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.logsync.schedule;

import org.torproject.metrics.logsync.state.GlobalState;
import org.torproject.metrics.logsync.state.StateStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Produce the work items of a cycle and keep the scheduling state up to date
 * while they are consumed.
 *
 * <p>Nothing happens before the first item is requested. Then the scheduler
 * loads the state, waits until the update interval since the last completed
 * cycle has passed, and plans the cycle. Each state change is applied and
 * persisted right before the item it belongs to is handed out. After the last
 * item, the cycle is recorded as completed.</p>
 */
public class Scheduler {

  private static final Logger logger = LoggerFactory.getLogger(
      Scheduler.class);

  private final StateStore stateStore;

  private final CyclePlanner planner;

  private final Clock clock;

  /** Initialize a scheduler using the system clock. */
  public Scheduler(StateStore stateStore, CyclePlanner planner) {
    this(stateStore, planner, Clock.systemDefaultZone());
  }

  /** Initialize a scheduler using the given clock. */
  public Scheduler(StateStore stateStore, CyclePlanner planner, Clock clock) {
    this.stateStore = stateStore;
    this.planner = planner;
    this.clock = clock;
  }

  /**
   * Returns the work items of the next cycle. Every iterator obtained from
   * the returned {@code Iterable} runs a cycle of its own.
   */
  public Iterable<WorkItem> produceCycle() {
    return CycleIterator::new;
  }

  /**
   * Returns how long to wait before starting the next cycle, or
   * {@code Duration.ZERO} if it may start right away.
   */
  Duration waitTime(GlobalState state, LocalDateTime now) {
    if (null == state.getLastCycleCompletedAt()) {
      return Duration.ZERO;
    }
    Duration waitTime = Duration.between(now,
        state.getLastCycleCompletedAt().plus(this.planner.getUpdateInterval()));
    return waitTime.isNegative() ? Duration.ZERO : waitTime;
  }

  /** Sleep for the given time; overridden by tests. */
  protected void sleep(Duration duration) throws InterruptedException {
    Thread.sleep(duration.toMillis());
  }

  private LocalDateTime now() {
    return LocalDateTime.now(this.clock);
  }

  private class CycleIterator implements Iterator<WorkItem> {

    private GlobalState state;

    private Iterator<PlannedStep> steps;

    private PlannedStep pending;

    private boolean completed;

    private void start() {
      this.state = stateStore.load();
      Duration waitTime = waitTime(this.state, now());
      if (!waitTime.isZero()) {
        logger.info("Sleeping for {} before starting the next cycle.",
            waitTime);
        try {
          sleep(waitTime);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          throw new IllegalStateException("Interrupted while waiting for the "
              + "next cycle.", e);
        }
      }
      LocalDateTime cycleStart = now();
      logger.info("Starting cycle at {}.", cycleStart);
      this.steps = planner.plan(this.state, cycleStart).iterator();
    }

    @Override
    public boolean hasNext() {
      if (null == this.steps) {
        this.start();
      }
      while (null == this.pending && this.steps.hasNext()) {
        PlannedStep step = this.steps.next();
        if (null == step.getWorkItem()) {
          this.commit(step.getStateDelta());
        } else {
          this.pending = step;
        }
      }
      if (null == this.pending && !this.completed) {
        this.completed = true;
        this.state.setLastCycleCompletedAt(now());
        stateStore.save(this.state);
        logger.info("Cycle completed at {}.",
            this.state.getLastCycleCompletedAt());
      }
      return null != this.pending;
    }

    @Override
    public WorkItem next() {
      if (!this.hasNext()) {
        throw new NoSuchElementException();
      }
      PlannedStep step = this.pending;
      this.pending = null;
      this.commit(step.getStateDelta());
      return step.getWorkItem();
    }

    private void commit(StateDelta stateDelta) {
      if (null == stateDelta) {
        return;
      }
      logger.debug("Recording {}.", stateDelta);
      stateDelta.applyTo(this.state);
      stateStore.save(this.state);
    }
  }
}
