/* Copyright 2016--2024 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.logsync;

import org.torproject.metrics.logsync.conf.Configuration;
import org.torproject.metrics.logsync.conf.ConfigurationException;
import org.torproject.metrics.logsync.conf.Key;
import org.torproject.metrics.logsync.cron.ShutdownHook;
import org.torproject.metrics.logsync.cron.UpdatesController;
import org.torproject.metrics.logsync.db.ClickHouseClient;
import org.torproject.metrics.logsync.db.DbControllersCollection;
import org.torproject.metrics.logsync.logsapi.LogsApiClient;
import org.torproject.metrics.logsync.schedule.CyclePlanner;
import org.torproject.metrics.logsync.schedule.Scheduler;
import org.torproject.metrics.logsync.sources.SourcesCollection;
import org.torproject.metrics.logsync.state.JsonStateStore;
import org.torproject.metrics.logsync.updater.Updater;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;

/**
 * Main class for starting a LogSync instance.
 * <br>
 * Run without arguments in order to read the usage information, i.e.
 * <br>
 * <code>java -jar logsync.jar</code>
 */
public class Main {

  private static final Logger logger = LoggerFactory.getLogger(Main.class);

  public static final String CONF_FILE = "logsync.properties";

  /**
   * One argument is optional: the path of the configuration file.
   * See class description {@link Main}.
   */
  public static void main(String[] args) throws Exception {
    Path confPath;
    if (null == args || args.length == 0) {
      confPath = Paths.get(CONF_FILE);
    } else if (args.length == 1) {
      confPath = Paths.get(args[0]);
    } else {
      printUsage("LogSync takes at most one argument.");
      return;
    }
    if (!Files.exists(confPath) || Files.size(confPath) < 1) {
      writeDefaultConfig(confPath);
      return;
    }
    Configuration conf = new Configuration();
    try {
      conf.loadAndCheckConfiguration(confPath);
    } catch (ConfigurationException ce) {
      printUsage(ce.getMessage());
      return;
    }
    UpdatesController controller = createController(conf);
    controller.prepare();
    Runtime.getRuntime().addShutdownHook(new ShutdownHook(controller,
        Thread.currentThread(), conf.getLong(Key.ShutdownGraceWaitMinutes)));
    controller.runLoop(conf.getBool(Key.RunOnce),
        Duration.ofMinutes(conf.getLong(Key.FailedCycleWaitMinutes)));
    logger.info("Updating loop ended.");
  }

  /** Build all collaborators of the updating loop from the configuration. */
  static UpdatesController createController(Configuration conf)
      throws ConfigurationException {
    SourcesCollection sourcesCollection
        = new SourcesCollection(conf.getStringArray(Key.Sources));
    CyclePlanner planner = new CyclePlanner(
        Arrays.asList(conf.getStringArray(Key.AppIds)),
        Arrays.asList(conf.getStringArray(Key.EventNames)),
        sourcesCollection.dateRequiredSources(),
        sourcesCollection.eventFilteredSources(),
        sourcesCollection.dateIgnoredSources(),
        conf.getInt(Key.UpdateLimitDays),
        Duration.ofHours(conf.getInt(Key.UpdateIntervalHours)),
        Duration.ofDays(conf.getInt(Key.FreshLimitDays)));
    Scheduler scheduler = new Scheduler(
        new JsonStateStore(conf.getPath(Key.StateFilePath)), planner);
    LogsApiClient logsApiClient = new LogsApiClient(
        conf.getUrl(Key.LogsApiHost), conf.getProperty(Key.Token.name()),
        conf.getInt(Key.RequestChunkRows),
        Duration.ofSeconds(conf.getInt(Key.LogsApiRetrySeconds)));
    Updater updater = new Updater(logsApiClient,
        conf.getInt(Key.MaxPartsCount), Clock.systemDefaultZone());
    ClickHouseClient clickHouseClient = new ClickHouseClient(
        conf.getUrl(Key.ClickHouseHost),
        emptyToNull(conf.getProperty(Key.ClickHouseUser.name())),
        emptyToNull(conf.getProperty(Key.ClickHousePassword.name())),
        conf.getProperty(Key.ClickHouseDatabase.name(), "mobile").trim());
    logger.info("Synchronizing {} sources for applications {}.",
        sourcesCollection.getDefinitions().size(),
        Arrays.toString(conf.getStringArray(Key.AppIds)));
    return new UpdatesController(scheduler, updater, sourcesCollection,
        new DbControllersCollection(clickHouseClient, sourcesCollection));
  }

  private static String emptyToNull(String value) {
    return null == value || value.trim().isEmpty() ? null : value.trim();
  }

  private static void printUsage(String msg) {
    final String usage = "Usage:\njava -jar logsync.jar [path/to/configFile]";
    System.out.println(msg + "\n" + usage);
  }

  private static void writeDefaultConfig(Path confPath) {
    try (InputStream in = Main.class.getClassLoader()
        .getResourceAsStream(CONF_FILE)) {
      Files.copy(in, confPath, StandardCopyOption.REPLACE_EXISTING);
      printUsage("Could not find config file. In the default "
          + "configuration, we are not using any Logs API token. Please "
          + "edit " + confPath + " and set Token and AppIds.");
    } catch (IOException e) {
      throw new RuntimeException("Cannot write default configuration: "
          + e.getMessage(), e);
    }
  }
}
