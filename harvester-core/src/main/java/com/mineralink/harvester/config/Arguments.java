package com.mineralink.harvester.config;

import com.mineralink.harvester.stats.Stats;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Collection;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Harvest settings as {@code key=value} pairs from the command line, JVM properties, environment variables or a
 * properties file.
 * <p>
 * Keys are matched ignoring case and treating {@code .}, {@code -} and {@code _} alike, so {@code http_timeout},
 * {@code --http-timeout}, {@code -Dharvester.http.timeout} and {@code HARVESTER_HTTP_TIMEOUT} all set the same
 * value.
 * <p>
 * A setting that was renamed can be read as {@code "new_key|old_key"}: the old key is still honored, with a warning.
 */
public class Arguments {

  private static final Logger LOGGER = LoggerFactory.getLogger(Arguments.class);

  /** Looks up a normalized key, returns {@code null} when it is not set. */
  private final UnaryOperator<String> lookup;

  private Arguments(UnaryOperator<String> lookup) {
    this.lookup = lookup;
  }

  /** Returns settings from JVM system properties starting with {@code harvester.}, like {@code -Dharvester.grid=3}. */
  public static Arguments fromJvmProperties() {
    return fromJvmProperties(System::getProperty, () -> System.getProperties().stringPropertyNames());
  }

  static Arguments fromJvmProperties(UnaryOperator<String> getter, Supplier<? extends Collection<String>> names) {
    return fromPrefixed(getter, names, "harvester.");
  }

  /** Returns settings from environment variables starting with {@code HARVESTER_}, like {@code HARVESTER_GRID=3}. */
  public static Arguments fromEnvironment() {
    return fromEnvironment(System::getenv, () -> System.getenv().keySet());
  }

  static Arguments fromEnvironment(UnaryOperator<String> getter, Supplier<? extends Collection<String>> names) {
    return fromPrefixed(getter, names, "HARVESTER_");
  }

  /** Returns settings from a {@link Properties} object. */
  public static Arguments from(Properties properties) {
    Map<String, String> map = new HashMap<>();
    for (String name : properties.stringPropertyNames()) {
      map.put(name, properties.getProperty(name));
    }
    return of(map);
  }

  /**
   * Returns settings from command-line arguments: {@code key=value}, {@code --key value}, or a bare {@code --key} for
   * {@code key=true}.
   */
  public static Arguments fromArgs(String... args) {
    Map<String, String> parsed = new HashMap<>();
    for (int i = 0; i < args.length; i++) {
      String arg = args[i].strip();
      int eq = arg.indexOf('=');
      String key = (eq < 0 ? arg : arg.substring(0, eq)).replaceFirst("^-+", "");
      if (eq >= 0) {
        parsed.put(key, arg.substring(eq + 1));
      } else if (arg.startsWith("-") && i + 1 < args.length && !args[i + 1].strip().startsWith("-")) {
        parsed.put(key, args[++i].strip());
      } else {
        parsed.put(key, "true");
      }
    }
    return of(parsed);
  }

  /**
   * Returns settings from a {@code .properties} file.
   *
   * @throws IllegalArgumentException if the file cannot be read
   */
  public static Arguments fromConfigFile(Path path) {
    Properties properties = new Properties();
    try (var reader = Files.newBufferedReader(path)) {
      properties.load(reader);
    } catch (IOException e) {
      throw new IllegalArgumentException("Unable to load config file: " + path, e);
    }
    return from(properties);
  }

  /**
   * Returns the settings a run was started with. Command-line arguments win over JVM properties, which win over
   * environment variables, which win over the {@code config=<file.properties>} file named by any of them.
   */
  public static Arguments fromArgsOrConfigFile(String... args) {
    Arguments direct = fromArgs(args)
      .orElse(fromJvmProperties())
      .orElse(fromEnvironment());
    Path configFile = direct.file("config", "path to a properties file with more settings", null);
    return configFile == null ? direct : direct.orElse(fromConfigFile(configFile));
  }

  public static Arguments of(Map<String, String> map) {
    Map<String, String> normalized = new HashMap<>();
    map.forEach((key, value) -> normalized.put(normalize(key), value));
    return new Arguments(normalized::get);
  }

  /** Shorthand for {@link #of(Map)} from alternating keys and values. */
  public static Arguments of(Object... keysAndValues) {
    Map<String, String> map = new HashMap<>();
    for (int i = 0; i < keysAndValues.length; i += 2) {
      map.put(keysAndValues[i].toString(), keysAndValues[i + 1].toString());
    }
    return of(map);
  }

  private static String normalize(String key) {
    return key.strip().replaceAll("[._-]", "_").toLowerCase(Locale.ROOT);
  }

  /** Matches the names that start with {@code prefix} (ignoring case) by the normalized rest of the name. */
  private static Arguments fromPrefixed(UnaryOperator<String> getter, Supplier<? extends Collection<String>> names,
    String prefix) {
    return new Arguments(key -> {
      for (String name : names.get()) {
        if (name.length() > prefix.length() && name.regionMatches(true, 0, prefix, 0, prefix.length()) &&
          normalize(name.substring(prefix.length())).equals(key)) {
          return getter.apply(name);
        }
      }
      return null;
    });
  }

  /** Returns settings that come from this, or from {@code other} for keys this does not set. */
  public Arguments orElse(Arguments other) {
    return new Arguments(key -> {
      String value = lookup.apply(key);
      return value != null ? value : other.lookup.apply(key);
    });
  }

  private String get(String key) {
    String[] names = key.split("\\|");
    for (int i = 0; i < names.length; i++) {
      String value = lookup.apply(normalize(names[i]));
      if (value != null) {
        if (i > 0) {
          LOGGER.warn("Argument '{}' is deprecated, use '{}'", names[i].strip(), names[0].strip());
        }
        return value.strip();
      }
    }
    return null;
  }

  private String get(String key, String defaultValue) {
    String value = get(key);
    return value == null ? defaultValue : value;
  }

  private static <T> T logged(String key, String description, T value) {
    LOGGER.debug("argument: {}={} ({})", key.split("\\|")[0], value, description);
    return value;
  }

  public String getString(String key, String description, String defaultValue) {
    return logged(key, description, get(key, defaultValue));
  }

  /** Returns {@code key} as a path, or {@code defaultValue} if it is not set. */
  public Path file(String key, String description, Path defaultValue) {
    String value = get(key);
    return logged(key, description, value == null ? defaultValue : Path.of(value));
  }

  /** Returns true if {@code key} is {@code true} in any case, false for any other value. */
  public boolean getBoolean(String key, String description, boolean defaultValue) {
    return logged(key, description, "true".equalsIgnoreCase(get(key, Boolean.toString(defaultValue))));
  }

  /**
   * Returns {@code key} as an integer.
   *
   * @throws NumberFormatException if the value is not an integer
   */
  public int getInteger(String key, String description, int defaultValue) {
    return logged(key, description, Integer.parseInt(get(key, Integer.toString(defaultValue))));
  }

  /**
   * Returns {@code key} as a double.
   *
   * @throws NumberFormatException if the value is not a number
   */
  public double getDouble(String key, String description, double defaultValue) {
    return logged(key, description, Double.parseDouble(get(key, Double.toString(defaultValue))));
  }

  /**
   * Returns {@code key} as a duration like {@code 45s}, {@code 5m} or {@code 1h30m}.
   *
   * @throws DateTimeParseException if the value is not a duration
   */
  public Duration getDuration(String key, String description, String defaultValue) {
    return logged(key, description, Duration.parse("PT" + get(key, defaultValue)));
  }

  /** Returns the collector the run reports its counters and timers through. */
  public Stats getStats() {
    return Stats.inMemory();
  }
}
