package com.mineralink.harvester;

import com.mineralink.harvester.config.Arguments;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main entry-point for the executable jar.
 * <p>
 * Takes {@code key=value} or {@code --key value} arguments, {@code -Dharvester.key=value} JVM properties,
 * {@code HARVESTER_KEY} environment variables, or a {@code config=<file.properties>} file. Exits with status 1 only when
 * no layer produced usable data, so a run that salvaged some layers still counts as a success.
 */
public class HarvesterMain {

  private static final Logger LOGGER = LoggerFactory.getLogger(HarvesterMain.class);

  private HarvesterMain() {}

  public static void main(String[] args) {
    int status = run(Arguments.fromArgsOrConfigFile(args));
    if (status != 0) {
      System.exit(status);
    }
  }

  /** Runs a harvest and returns the process exit status. */
  static int run(Arguments arguments) {
    try {
      Harvester.create(arguments).run();
      return 0;
    } catch (NoUsableDataException e) {
      LOGGER.error("{}: {}", e.kind(), e.getMessage());
      return 1;
    }
  }
}
