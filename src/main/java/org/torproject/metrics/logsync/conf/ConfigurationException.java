/* Copyright 2016--2024 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.logsync.conf;

/**
 * Thrown if the configuration file cannot be read, lacks a required property,
 * or holds a value that does not match the type of its {@link Key}.
 */
public class ConfigurationException extends Exception {

  public ConfigurationException(String msg) {
    super(msg);
  }

  public ConfigurationException(String msg, Exception ex) {
    super(msg, ex);
  }

}
