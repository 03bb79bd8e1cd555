/* Copyright 2024 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.logsync.schedule;

/**
 * Work item of a cycle plan together with the state change to commit before
 * the item is executed.
 *
 * <p>Either part may be missing: dates of an application without any
 * date-required source are still recorded, and date-ignored loads need no
 * bookkeeping.</p>
 */
public final class PlannedStep {

  private final WorkItem workItem;

  private final StateDelta stateDelta;

  PlannedStep(WorkItem workItem, StateDelta stateDelta) {
    this.workItem = workItem;
    this.stateDelta = stateDelta;
  }

  /** Returns the work item, or {@code null} for a bookkeeping-only step. */
  public WorkItem getWorkItem() {
    return this.workItem;
  }

  /** Returns the state change, or {@code null} if there is none. */
  public StateDelta getStateDelta() {
    return this.stateDelta;
  }

  @Override
  public String toString() {
    return this.workItem + " / " + this.stateDelta;
  }
}
