/* Copyright 2016--2024 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.logsync.conf;

import java.net.URL;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;

/**
 * Enum containing all the properties keys of the configuration.
 * Specifies the key type.
 */
public enum Key {

  ShutdownGraceWaitMinutes(Long.class),
  RunOnce(Boolean.class),
  FailedCycleWaitMinutes(Long.class),
  Token(String.class),
  AppIds(String[].class),
  Sources(String[].class),
  EventNames(String[].class),
  UpdateLimitDays(Integer.class),
  UpdateIntervalHours(Integer.class),
  FreshLimitDays(Integer.class),
  RequestChunkRows(Integer.class),
  MaxPartsCount(Integer.class),
  StateFilePath(Path.class),
  LogsApiHost(URL.class),
  LogsApiRetrySeconds(Integer.class),
  ClickHouseHost(URL.class),
  ClickHouseUser(String.class),
  ClickHousePassword(String.class),
  ClickHouseDatabase(String.class);

  private Class clazz;
  private static Set<String> keys;

  /**
   * Instantiate a new {@code Key} using the given class for the key value.
   *
   * @param clazz Class of key value.
   */
  Key(Class clazz) {
    this.clazz = clazz;
  }

  public Class keyClass() {
    return clazz;
  }

  /** Verifies, if the given string corresponds to an enum value. */
  public static boolean has(String someKey) {
    if (null == keys) {
      keys = new HashSet<>();
      for (Key key : values()) {
        keys.add(key.name());
      }
    }
    return keys.contains(someKey);
  }

}
