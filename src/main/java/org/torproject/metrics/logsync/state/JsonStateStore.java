/* Copyright 2024 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.logsync.state;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SortedMap;

/**
 * Store the scheduling state in a JSON file.
 *
 * <p>The file is always rewritten as a whole: the new state goes to a hidden
 * temporary file next to the state file, which then replaces the state file.
 * Archived dates are written as the timestamp {@code 3000-01-01T00:00:00}.</p>
 */
public class JsonStateStore implements StateStore {

  private static final Logger logger = LoggerFactory.getLogger(
      JsonStateStore.class);

  /** Timestamp written for archived dates. */
  static final LocalDateTime ARCHIVED_TIMESTAMP
      = LocalDateTime.of(3000, 1, 1, 0, 0);

  private static final DateTimeFormatter dateTimeFormatter
      = DateTimeFormatter.ISO_LOCAL_DATE_TIME;

  private static final DateTimeFormatter dateFormatter
      = DateTimeFormatter.ISO_LOCAL_DATE;

  private static ObjectMapper objectMapper = new ObjectMapper()
      .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
      .setSerializationInclusion(JsonInclude.Include.NON_NULL)
      .setVisibility(PropertyAccessor.ALL, JsonAutoDetect.Visibility.NONE)
      .setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY)
      .enable(SerializationFeature.INDENT_OUTPUT);

  private final Path stateFile;

  public JsonStateStore(Path stateFile) {
    this.stateFile = stateFile;
  }

  @Override
  public GlobalState load() {
    if (!Files.exists(this.stateFile)) {
      logger.info("No state file at {}; starting with an empty state.",
          this.stateFile);
      return new GlobalState();
    }
    try (InputStream is = Files.newInputStream(this.stateFile)) {
      return fromNode(objectMapper.readValue(is, StateNode.class));
    } catch (IOException | DateTimeParseException e) {
      throw new StateStoreException("Cannot read state file "
          + this.stateFile + ". Reason: " + e.getMessage(), e);
    }
  }

  @Override
  public void save(GlobalState state) {
    Path tmpFile = this.stateFile.resolveSibling(
        "." + this.stateFile.getFileName() + ".tmp");
    try {
      if (null != this.stateFile.getParent()) {
        Files.createDirectories(this.stateFile.getParent());
      }
      try (OutputStream os = Files.newOutputStream(tmpFile)) {
        objectMapper.writeValue(os, toNode(state));
      }
      Files.move(tmpFile, this.stateFile, StandardCopyOption.REPLACE_EXISTING,
          StandardCopyOption.ATOMIC_MOVE);
    } catch (IOException e) {
      throw new StateStoreException("Cannot write state file "
          + this.stateFile + ". Reason: " + e.getMessage(), e);
    }
  }

  static StateNode toNode(GlobalState state) {
    StateNode stateNode = new StateNode();
    if (null != state.getLastCycleCompletedAt()) {
      stateNode.lastCycleCompletedAt
          = dateTimeFormatter.format(state.getLastCycleCompletedAt());
    }
    stateNode.appIdStates = new ArrayList<>();
    for (ApplicationState applicationState : state.getApplicationStates()) {
      ApplicationNode applicationNode = new ApplicationNode();
      applicationNode.appId = applicationState.getAppId();
      applicationNode.dateUpdates = new LinkedHashMap<>();
      for (Map.Entry<String, SortedMap<LocalDate, DateState>> event
          : applicationState.getDateUpdates().entrySet()) {
        Map<String, String> dates = new LinkedHashMap<>();
        for (Map.Entry<LocalDate, DateState> date
            : event.getValue().entrySet()) {
          LocalDateTime timestamp = date.getValue().isArchived()
              ? ARCHIVED_TIMESTAMP : date.getValue().getLoadedAt();
          dates.put(dateFormatter.format(date.getKey()),
              dateTimeFormatter.format(timestamp));
        }
        applicationNode.dateUpdates.put(event.getKey(), dates);
      }
      stateNode.appIdStates.add(applicationNode);
    }
    return stateNode;
  }

  static GlobalState fromNode(StateNode stateNode) {
    GlobalState state = new GlobalState();
    if (null != stateNode.lastCycleCompletedAt) {
      state.setLastCycleCompletedAt(LocalDateTime.parse(
          stateNode.lastCycleCompletedAt, dateTimeFormatter));
    }
    if (null == stateNode.appIdStates) {
      return state;
    }
    for (ApplicationNode applicationNode : stateNode.appIdStates) {
      ApplicationState applicationState
          = state.getOrCreateApplicationState(applicationNode.appId);
      if (null == applicationNode.dateUpdates) {
        continue;
      }
      for (Map.Entry<String, Map<String, String>> event
          : applicationNode.dateUpdates.entrySet()) {
        for (Map.Entry<String, String> date : event.getValue().entrySet()) {
          LocalDate day = LocalDate.parse(date.getKey(), dateFormatter);
          LocalDateTime timestamp = LocalDateTime.parse(date.getValue(),
              dateTimeFormatter);
          if (timestamp.equals(ARCHIVED_TIMESTAMP)) {
            applicationState.markArchived(event.getKey(), day);
          } else {
            applicationState.markUpdated(event.getKey(), day, timestamp);
          }
        }
      }
    }
    return state;
  }
}
