/* Copyright 2024 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.logsync.schedule;

import org.torproject.metrics.logsync.state.ApplicationState;
import org.torproject.metrics.logsync.state.DateState;
import org.torproject.metrics.logsync.state.GlobalState;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Decide which dates of which applications and events need to be loaded or
 * archived in a cycle.
 *
 * <p>Planning works on a copy of the given state and never modifies it. The
 * returned steps are ordered per application: first archive items for dates
 * that turned out to be old enough during earlier cycles, then load (and
 * possibly archive) items for each event and each date of the update window
 * in ascending date order, and finally loads of date-ignored sources.</p>
 */
public class CyclePlanner {

  private static final Logger logger = LoggerFactory.getLogger(
      CyclePlanner.class);

  private final List<String> appIds;

  private final List<String> eventNames;

  private final List<String> dateRequiredSources;

  private final List<String> eventFilteredSources;

  private final List<String> dateIgnoredSources;

  private final int updateLimitDays;

  private final Duration updateInterval;

  private final Duration freshLimit;

  /**
   * Initialize the planner.
   *
   * @param appIds Application ids in the order they are processed.
   * @param eventNames Event names to load dates for; may be empty.
   * @param dateRequiredSources Sources loaded date by date.
   * @param eventFilteredSources Date-required sources that are loaded once
   *     per event name; all other date-required sources are only loaded
   *     together with the first event name.
   * @param dateIgnoredSources Sources reloaded as a whole in every cycle.
   * @param updateLimitDays Number of days before today that are kept up to
   *     date.
   * @param updateInterval Minimum time between two loads of the same date.
   * @param freshLimit Time after the end of a date after which its data is
   *     not expected to change anymore.
   */
  public CyclePlanner(List<String> appIds, List<String> eventNames,
      List<String> dateRequiredSources, List<String> eventFilteredSources,
      List<String> dateIgnoredSources, int updateLimitDays,
      Duration updateInterval, Duration freshLimit) {
    this.appIds = new ArrayList<>(appIds);
    this.eventNames = new ArrayList<>(eventNames);
    this.dateRequiredSources = new ArrayList<>(dateRequiredSources);
    this.eventFilteredSources = new ArrayList<>();
    for (String source : dateRequiredSources) {
      if (eventFilteredSources.contains(source)) {
        this.eventFilteredSources.add(source);
      }
    }
    this.dateIgnoredSources = new ArrayList<>(dateIgnoredSources);
    this.updateLimitDays = updateLimitDays;
    this.updateInterval = updateInterval;
    this.freshLimit = freshLimit;
  }

  /**
   * Initialize a planner that loads all date-required sources once per
   * event name.
   */
  public CyclePlanner(List<String> appIds, List<String> eventNames,
      List<String> dateRequiredSources, List<String> dateIgnoredSources,
      int updateLimitDays, Duration updateInterval, Duration freshLimit) {
    this(appIds, eventNames, dateRequiredSources, dateRequiredSources,
        dateIgnoredSources, updateLimitDays, updateInterval, freshLimit);
  }

  public Duration getUpdateInterval() {
    return this.updateInterval;
  }

  /**
   * Plan a cycle starting at the given time.
   *
   * @param state Current state, left unchanged.
   * @param cycleStart Start of the cycle, used as load time of all dates
   *     loaded in this cycle.
   * @return Steps in execution order.
   */
  public List<PlannedStep> plan(GlobalState state, LocalDateTime cycleStart) {
    GlobalState working = state.copy();
    List<PlannedStep> steps = new ArrayList<>();
    LocalDate dateTo = cycleStart.toLocalDate();
    LocalDate dateFrom = dateTo.minusDays(this.updateLimitDays);
    for (String appId : this.appIds) {
      ApplicationState applicationState
          = working.getOrCreateApplicationState(appId);
      this.archiveOldDates(applicationState, steps);
      for (String eventName : this.eventNames) {
        logger.debug("Planning event \"{}\" of {} from {} to {}.", eventName,
            appId, dateFrom, dateTo);
        for (LocalDate date = dateFrom; !date.isAfter(dateTo);
            date = date.plusDays(1L)) {
          this.updateDate(applicationState, eventName, date, cycleStart,
              steps);
        }
      }
      for (String source : this.dateIgnoredSources) {
        steps.add(new PlannedStep(new WorkItem(source, null, appId, null,
            WorkItemKind.LOAD_DATE_IGNORED), null));
      }
    }
    return Collections.unmodifiableList(steps);
  }

  /** Archive dates whose last load happened long enough after their end. */
  private void archiveOldDates(ApplicationState applicationState,
      List<PlannedStep> steps) {
    Map<String, SortedMap<LocalDate, DateState>> dateUpdates
        = new LinkedHashMap<>();
    for (Map.Entry<String, SortedMap<LocalDate, DateState>> e
        : applicationState.getDateUpdates().entrySet()) {
      dateUpdates.put(e.getKey(), new TreeMap<>(e.getValue()));
    }
    for (Map.Entry<String, SortedMap<LocalDate, DateState>> event
        : dateUpdates.entrySet()) {
      for (Map.Entry<LocalDate, DateState> date
          : event.getValue().entrySet()) {
        if (date.getValue().isArchived()) {
          continue;
        }
        if (!this.isFresh(date.getKey(), date.getValue().getLoadedAt())) {
          this.archive(applicationState, event.getKey(), date.getKey(),
              steps);
        }
      }
    }
  }

  /** Load the given date unless it was loaded recently, and archive it if
   * this load is late enough. */
  private void updateDate(ApplicationState applicationState, String eventName,
      LocalDate date, LocalDateTime cycleStart, List<PlannedStep> steps) {
    DateState dateState = applicationState.getDateState(eventName, date);
    if (null != dateState) {
      if (dateState.isArchived()) {
        return;
      }
      if (Duration.between(dateState.getLoadedAt(), cycleStart)
          .compareTo(this.updateInterval) < 0) {
        return;
      }
    }
    String appId = applicationState.getAppId();
    this.addSteps(this.sourcesOf(eventName), eventName, appId, date,
        WorkItemKind.LOAD,
        StateDelta.touch(appId, eventName, date, cycleStart), steps);
    applicationState.markUpdated(eventName, date, cycleStart);
    if (!this.isFresh(date, cycleStart)) {
      this.archive(applicationState, eventName, date, steps);
    }
  }

  private void archive(ApplicationState applicationState, String eventName,
      LocalDate date, List<PlannedStep> steps) {
    String appId = applicationState.getAppId();
    this.addSteps(this.sourcesOf(eventName), eventName, appId, date,
        WorkItemKind.ARCHIVE, StateDelta.archive(appId, eventName, date),
        steps);
    applicationState.markArchived(eventName, date);
  }

  /**
   * Returns the sources to load for the given event name. Sources without
   * event names share one staging table per date, which is filled while
   * processing the first event name.
   */
  private List<String> sourcesOf(String eventName) {
    if (!this.eventNames.isEmpty()
        && this.eventNames.get(0).equals(eventName)) {
      return this.dateRequiredSources;
    }
    return this.eventFilteredSources;
  }

  /** Add one step per source, attaching the state change to the first one. */
  private void addSteps(List<String> sources, String eventName, String appId,
      LocalDate date, WorkItemKind kind, StateDelta stateDelta,
      List<PlannedStep> steps) {
    if (sources.isEmpty()) {
      steps.add(new PlannedStep(null, stateDelta));
      return;
    }
    StateDelta pending = stateDelta;
    for (String source : sources) {
      steps.add(new PlannedStep(
          new WorkItem(source, eventName, appId, date, kind), pending));
      pending = null;
    }
  }

  /**
   * Returns whether data of the given date loaded at the given time may still
   * change.
   */
  boolean isFresh(LocalDate date, LocalDateTime loadedAt) {
    return Duration.between(endOfDay(date), loadedAt)
        .compareTo(this.freshLimit) < 0;
  }

  static LocalDateTime endOfDay(LocalDate date) {
    return LocalDateTime.of(date, LocalTime.MAX);
  }
}
