/* Copyright 2024 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.logsync.schedule;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.torproject.metrics.logsync.state.ApplicationState;
import org.torproject.metrics.logsync.state.DateState;
import org.torproject.metrics.logsync.state.GlobalState;

import org.junit.Test;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class CyclePlannerTest {

  private static final List<String> SOURCES
      = Arrays.asList("installations", "events");

  private static final LocalDate JAN_08 = LocalDate.of(2024, 1, 8);

  private static final LocalDate JAN_09 = LocalDate.of(2024, 1, 9);

  private static final LocalDate JAN_10 = LocalDate.of(2024, 1, 10);

  private static CyclePlanner planner(List<String> dateRequired,
      List<String> dateIgnored, int updateLimitDays, int freshLimitDays) {
    return new CyclePlanner(Collections.singletonList("1111"),
        Collections.singletonList("open"), dateRequired, dateIgnored,
        updateLimitDays, Duration.ofHours(12), Duration.ofDays(freshLimitDays));
  }

  private static List<WorkItem> items(List<PlannedStep> steps) {
    List<WorkItem> items = new ArrayList<>();
    for (PlannedStep step : steps) {
      if (null != step.getWorkItem()) {
        items.add(step.getWorkItem());
      }
    }
    return items;
  }

  private static GlobalState apply(GlobalState state,
      List<PlannedStep> steps) {
    for (PlannedStep step : steps) {
      if (null != step.getStateDelta()) {
        step.getStateDelta().applyTo(state);
      }
    }
    return state;
  }

  private static WorkItem load(String source, LocalDate date) {
    return new WorkItem(source, "open", "1111", date, WorkItemKind.LOAD);
  }

  private static WorkItem archive(String source, LocalDate date) {
    return new WorkItem(source, "open", "1111", date, WorkItemKind.ARCHIVE);
  }

  @Test
  public void testFirstRunLoadsWholeWindow() {
    CyclePlanner planner = planner(SOURCES, Collections.emptyList(), 2, 3);
    LocalDateTime cycleStart = LocalDateTime.of(2024, 1, 10, 0, 0);
    List<WorkItem> items = items(planner.plan(new GlobalState(), cycleStart));
    assertEquals(Arrays.asList(
        load("installations", JAN_08), load("events", JAN_08),
        load("installations", JAN_09), load("events", JAN_09),
        load("installations", JAN_10), load("events", JAN_10)), items);
  }

  @Test
  public void testTouchRidesOnFirstLoadOfEachDate() {
    CyclePlanner planner = planner(SOURCES, Collections.emptyList(), 0, 3);
    LocalDateTime cycleStart = LocalDateTime.of(2024, 1, 10, 0, 0);
    List<PlannedStep> steps = planner.plan(new GlobalState(), cycleStart);
    assertEquals(2, steps.size());
    assertEquals(StateDelta.touch("1111", "open", JAN_10, cycleStart),
        steps.get(0).getStateDelta());
    assertNull(steps.get(1).getStateDelta());
  }

  @Test
  public void testPlanLeavesStateUnchanged() {
    CyclePlanner planner = planner(SOURCES, Collections.emptyList(), 2, 3);
    GlobalState state = new GlobalState();
    planner.plan(state, LocalDateTime.of(2024, 1, 10, 0, 0));
    assertTrue(state.getApplicationStates().isEmpty());
  }

  @Test
  public void testRerunWithinIntervalLoadsNothing() {
    CyclePlanner planner = planner(SOURCES, Collections.emptyList(), 2, 3);
    LocalDateTime firstStart = LocalDateTime.of(2024, 1, 10, 0, 0);
    GlobalState state = apply(new GlobalState(),
        planner.plan(new GlobalState(), firstStart));
    List<PlannedStep> steps = planner.plan(state, firstStart.plusHours(6));
    assertTrue(steps.isEmpty());
  }

  @Test
  public void testRerunAfterIntervalReloadsWindow() {
    CyclePlanner planner = planner(SOURCES, Collections.emptyList(), 2, 3);
    LocalDateTime firstStart = LocalDateTime.of(2024, 1, 10, 0, 0);
    GlobalState state = apply(new GlobalState(),
        planner.plan(new GlobalState(), firstStart));
    List<WorkItem> items = items(planner.plan(state,
        firstStart.plusHours(12)));
    assertEquals(6, items.size());
    for (WorkItem item : items) {
      assertEquals(WorkItemKind.LOAD, item.getKind());
    }
  }

  @Test
  public void testMovedWindowLoadsNewDatesOnly() {
    CyclePlanner planner = planner(SOURCES, Collections.emptyList(), 2, 3);
    GlobalState state = apply(new GlobalState(), planner.plan(
        new GlobalState(), LocalDateTime.of(2024, 1, 10, 0, 0)));
    List<WorkItem> items = items(planner.plan(state,
        LocalDateTime.of(2024, 1, 14, 0, 0)));
    assertEquals(Arrays.asList(
        load("installations", LocalDate.of(2024, 1, 12)),
        load("events", LocalDate.of(2024, 1, 12)),
        load("installations", LocalDate.of(2024, 1, 13)),
        load("events", LocalDate.of(2024, 1, 13)),
        load("installations", LocalDate.of(2024, 1, 14)),
        load("events", LocalDate.of(2024, 1, 14))), items);
  }

  @Test
  public void testLateLoadIsFollowedByArchive() {
    CyclePlanner planner = planner(SOURCES, Collections.emptyList(), 4, 3);
    LocalDateTime cycleStart = LocalDateTime.of(2024, 1, 10, 0, 0);
    List<PlannedStep> steps = planner.plan(new GlobalState(), cycleStart);
    LocalDate jan06 = LocalDate.of(2024, 1, 6);
    List<WorkItem> items = items(steps);
    assertEquals(Arrays.asList(
        load("installations", jan06), load("events", jan06),
        archive("installations", jan06), archive("events", jan06)),
        items.subList(0, 4));
    assertEquals(4 + 2 * 4, items.size());
    GlobalState state = apply(new GlobalState(), steps);
    ApplicationState app = state.getApplicationState("1111");
    assertTrue(app.isArchived("open", jan06));
    assertFalse(app.isArchived("open", LocalDate.of(2024, 1, 7)));
    assertEquals(DateState.loadedAt(cycleStart),
        app.getDateState("open", JAN_10));
  }

  @Test
  public void testReloadOfFreshDateArchivesAgainstCycleStart() {
    CyclePlanner planner = planner(SOURCES, Collections.emptyList(), 4, 3);
    LocalDate jan06 = LocalDate.of(2024, 1, 6);
    LocalDateTime previousLoad = LocalDateTime.of(2024, 1, 7, 0, 0);
    GlobalState state = new GlobalState();
    state.getOrCreateApplicationState("1111").markUpdated("open", jan06,
        previousLoad);
    assertTrue(planner.isFresh(jan06, previousLoad));
    LocalDateTime cycleStart = LocalDateTime.of(2024, 1, 10, 0, 0);
    List<PlannedStep> steps = planner.plan(state, cycleStart);
    assertEquals(Arrays.asList(
        load("installations", jan06), load("events", jan06),
        archive("installations", jan06), archive("events", jan06)),
        items(steps).subList(0, 4));
    assertEquals(StateDelta.touch("1111", "open", jan06, cycleStart),
        steps.get(0).getStateDelta());
    assertEquals(StateDelta.archive("1111", "open", jan06),
        steps.get(2).getStateDelta());
  }

  @Test
  public void testSourcesWithoutEventNameFollowFirstEvent() {
    CyclePlanner planner = new CyclePlanner(Collections.singletonList("1111"),
        Arrays.asList("open", "close"), SOURCES,
        Collections.singletonList("events"), Collections.emptyList(), 4,
        Duration.ofHours(12), Duration.ofDays(3));
    LocalDateTime cycleStart = LocalDateTime.of(2024, 1, 10, 0, 0);
    LocalDate jan06 = LocalDate.of(2024, 1, 6);
    List<PlannedStep> steps = planner.plan(new GlobalState(), cycleStart);
    List<WorkItem> items = items(steps);
    assertEquals(12 + 6, items.size());
    int installations = 0;
    for (WorkItem item : items) {
      if ("installations".equals(item.getSource())) {
        assertEquals("open", item.getEventName());
        installations++;
      }
    }
    assertEquals(6, installations);
    assertEquals(Arrays.asList(
        new WorkItem("events", "close", "1111", jan06, WorkItemKind.LOAD),
        new WorkItem("events", "close", "1111", jan06,
            WorkItemKind.ARCHIVE)), items.subList(12, 14));
    GlobalState state = apply(new GlobalState(), steps);
    ApplicationState app = state.getApplicationState("1111");
    assertTrue(app.isArchived("close", jan06));
    assertEquals(DateState.loadedAt(cycleStart),
        app.getDateState("close", JAN_10));
  }

  @Test
  public void testFreshLimitBoundary() {
    CyclePlanner planner = planner(SOURCES, Collections.emptyList(), 2, 3);
    LocalDateTime endOfDay = CyclePlanner.endOfDay(JAN_08);
    assertTrue(planner.isFresh(JAN_08, endOfDay.plusDays(3).minusNanos(1)));
    assertFalse(planner.isFresh(JAN_08, endOfDay.plusDays(3)));
  }

  @Test
  public void testSweepArchivesDatesLoadedLate() {
    CyclePlanner planner = planner(SOURCES, Collections.emptyList(), 2, 3);
    GlobalState state = new GlobalState();
    ApplicationState app = state.getOrCreateApplicationState("1111");
    LocalDate jan01 = LocalDate.of(2024, 1, 1);
    LocalDate jan02 = LocalDate.of(2024, 1, 2);
    app.markUpdated("open", jan01, LocalDateTime.of(2024, 1, 6, 0, 0));
    app.markUpdated("open", jan02, LocalDateTime.of(2024, 1, 3, 0, 0));
    LocalDateTime cycleStart = LocalDateTime.of(2024, 1, 10, 0, 0);
    List<PlannedStep> steps = planner.plan(state, cycleStart);
    List<WorkItem> items = items(steps);
    assertEquals(Arrays.asList(archive("installations", jan01),
        archive("events", jan01)), items.subList(0, 2));
    assertEquals(StateDelta.archive("1111", "open", jan01),
        steps.get(0).getStateDelta());
    assertEquals(2 + 6, items.size());
    apply(state, steps);
    assertTrue(app.isArchived("open", jan01));
    assertFalse(app.isArchived("open", jan02));
  }

  @Test
  public void testArchivedDatesAreNeverReloaded() {
    CyclePlanner planner = planner(SOURCES, Collections.emptyList(), 2, 3);
    GlobalState state = new GlobalState();
    state.getOrCreateApplicationState("1111").markArchived("open", JAN_09);
    List<WorkItem> items = items(planner.plan(state,
        LocalDateTime.of(2024, 1, 10, 0, 0)));
    assertEquals(4, items.size());
    for (WorkItem item : items) {
      assertFalse(JAN_09.equals(item.getDate()));
    }
  }

  @Test
  public void testDateIgnoredSourcesOncePerApplication() {
    CyclePlanner planner = new CyclePlanner(Arrays.asList("1111", "2222"),
        Collections.emptyList(), SOURCES, Collections.singletonList("profiles"),
        2, Duration.ofHours(12), Duration.ofDays(3));
    GlobalState state = new GlobalState();
    LocalDateTime cycleStart = LocalDateTime.of(2024, 1, 10, 0, 0);
    List<PlannedStep> steps = planner.plan(state, cycleStart);
    assertEquals(Arrays.asList(
        new WorkItem("profiles", null, "1111", null,
            WorkItemKind.LOAD_DATE_IGNORED),
        new WorkItem("profiles", null, "2222", null,
            WorkItemKind.LOAD_DATE_IGNORED)), items(steps));
    assertNull(steps.get(0).getStateDelta());
    apply(state, steps);
    assertEquals(2, items(planner.plan(state, cycleStart)).size());
  }

  @Test
  public void testEventsAreProcessedInConfiguredOrder() {
    CyclePlanner planner = new CyclePlanner(Collections.singletonList("1111"),
        Arrays.asList("open", "close"),
        Collections.singletonList("events"), Collections.emptyList(),
        0, Duration.ofHours(12), Duration.ofDays(3));
    List<WorkItem> items = items(planner.plan(new GlobalState(),
        LocalDateTime.of(2024, 1, 10, 0, 0)));
    assertEquals(2, items.size());
    assertEquals("open", items.get(0).getEventName());
    assertEquals("close", items.get(1).getEventName());
  }

  @Test
  public void testBookkeepingWithoutDateRequiredSources() {
    CyclePlanner planner = planner(Collections.emptyList(),
        Collections.emptyList(), 4, 3);
    LocalDateTime cycleStart = LocalDateTime.of(2024, 1, 10, 0, 0);
    List<PlannedStep> steps = planner.plan(new GlobalState(), cycleStart);
    assertTrue(items(steps).isEmpty());
    assertEquals(5 + 1, steps.size());
    GlobalState state = apply(new GlobalState(), steps);
    ApplicationState app = state.getApplicationState("1111");
    assertTrue(app.isArchived("open", LocalDate.of(2024, 1, 6)));
    assertEquals(DateState.loadedAt(cycleStart),
        app.getDateState("open", JAN_10));
  }
}
