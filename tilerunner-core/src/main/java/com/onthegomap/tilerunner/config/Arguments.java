package com.onthegomap.tilerunner.config;

import com.google.common.collect.HashMultiset;
import com.google.common.collect.Multiset;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.function.Function;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;
import org.locationtech.jts.geom.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Key/value settings of a run, read from the command line, JVM properties, environmental variables or a properties
 * file.
 * <p>
 * Keys are matched ignoring case and separators, so {@code "TILE_SIZE"}, {@code "tile-size"} and {@code "tile.size"}
 * all read the same value. A key like {@code "tmpdir|tmp"} reads {@code tmpdir} and falls back to the deprecated
 * {@code tmp}, logging a warning when the old name is used.
 */
public class Arguments {

  private static final Logger LOGGER = LoggerFactory.getLogger(Arguments.class);

  private final UnaryOperator<String> lookup;

  private Arguments(UnaryOperator<String> lookup) {
    this.lookup = lookup;
  }

  /** Returns arguments from JVM properties prefixed with {@code tilerunner.}, like {@code -Dtilerunner.nprocs=4}. */
  public static Arguments fromJvmProperties() {
    return fromJvmProperties(System::getProperty);
  }

  static Arguments fromJvmProperties(UnaryOperator<String> getter) {
    return new Arguments(key -> getter.apply("tilerunner." + key.replace('_', '.')));
  }

  /** Returns arguments from environmental variables prefixed with {@code TILERUNNER_}. */
  public static Arguments fromEnvironment() {
    return fromEnvironment(System::getenv);
  }

  static Arguments fromEnvironment(UnaryOperator<String> getter) {
    return new Arguments(key -> getter.apply("TILERUNNER_" + key.toUpperCase(Locale.ROOT)));
  }

  /**
   * Returns arguments from a command line where each setting is {@code key=value}, {@code --key value} or a bare
   * {@code --flag} that means {@code flag=true}.
   */
  public static Arguments fromArgs(String... args) {
    Map<String, String> parsed = new HashMap<>();
    int i = 0;
    while (i < args.length) {
      String arg = args[i++].strip();
      int equals = arg.indexOf('=');
      if (equals >= 0) {
        parsed.put(arg.substring(0, equals).replaceFirst("^-+", ""), arg.substring(equals + 1));
      } else if (arg.startsWith("-") && i < args.length && !args[i].strip().startsWith("-")) {
        parsed.put(arg.replaceFirst("^-+", ""), args[i++].strip());
      } else {
        parsed.put(arg.replaceFirst("^-+", ""), "true");
      }
    }
    return of(parsed);
  }

  /** Returns arguments from a {@code .properties} file. */
  public static Arguments fromConfigFile(Path path) {
    Properties properties = new Properties();
    try (var reader = Files.newBufferedReader(path)) {
      properties.load(reader);
    } catch (IOException e) {
      throw new IllegalArgumentException("Unable to load config file: " + path, e);
    }
    Map<String, String> map = new HashMap<>();
    for (String key : properties.stringPropertyNames()) {
      map.put(key, properties.getProperty(key));
    }
    return of(map);
  }

  /**
   * Returns arguments from every source, in this order of priority:
   * <ol>
   * <li>command line: {@code key=value}</li>
   * <li>JVM properties: {@code -Dtilerunner.key=value}</li>
   * <li>environment: {@code TILERUNNER_KEY=value}</li>
   * <li>the properties file named by a {@code config} argument from any of the above</li>
   * </ol>
   */
  public static Arguments fromArgsOrConfigFile(String... args) {
    Arguments arguments = fromArgs(args)
      .orElse(fromJvmProperties())
      .orElse(fromEnvironment());
    Path configFile = arguments.file("config", "path to config file", null);
    return configFile == null ? arguments : arguments.orElse(fromConfigFile(configFile));
  }

  private static String normalize(String key) {
    return key.strip().replaceAll("[.-]", "_").toLowerCase(Locale.ROOT);
  }

  public static Arguments of(Map<String, String> map) {
    Map<String, String> normalized = new HashMap<>();
    map.forEach((key, value) -> normalized.put(normalize(key), value));
    return new Arguments(normalized::get);
  }

  /** Shorthand for {@link #of(Map)} from alternating keys and values. */
  public static Arguments of(Object... args) {
    Map<String, String> map = new HashMap<>();
    for (int i = 0; i < args.length; i += 2) {
      map.put(args[i].toString(), args[i + 1].toString());
    }
    return of(map);
  }

  private String get(String key) {
    String[] names = key.split("\\|");
    for (int i = 0; i < names.length; i++) {
      String value = lookup.apply(normalize(names[i]));
      if (value != null) {
        if (i > 0) {
          LOGGER.warn("Argument '{}' is deprecated, use '{}'", names[i].strip(), names[0].strip());
        }
        return value.trim();
      }
    }
    return null;
  }

  private String get(String key, String defaultValue) {
    String value = get(key);
    return value == null ? defaultValue : value;
  }

  private String getRequired(String key, String description) {
    String value = get(key);
    if (value == null) {
      throw new IllegalArgumentException("Missing required parameter: " + key + " (" + description + ")");
    }
    return value;
  }

  /** Returns arguments that read from {@code this} first and from {@code other} for keys {@code this} lacks. */
  public Arguments orElse(Arguments other) {
    return new Arguments(key -> {
      String value = lookup.apply(key);
      return value != null ? value : other.lookup.apply(key);
    });
  }

  /** Returns true if {@code key} was provided by any source. */
  public boolean has(String key) {
    return get(key) != null;
  }

  protected void logArgValue(String key, String description, Object result) {
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug("argument: {}={} ({})", key.replaceFirst("\\|.*$", ""), result, description);
    }
  }

  /**
   * Returns the {@code minx,miny,maxx,maxy} extent in {@code key}, in map units of the input data, or null if missing.
   *
   * @throws IllegalArgumentException if the value does not have 4 coordinates
   */
  public Envelope bounds(String key, String description) {
    String value = get(key);
    Envelope result = null;
    if (value != null) {
      double[] coords = Stream.of(value.split("[\\s,]+")).mapToDouble(Double::parseDouble).toArray();
      if (coords.length != 4) {
        throw new IllegalArgumentException("bounds must have 4 coordinates, got: " + value);
      }
      result = new Envelope(coords[0], coords[2], coords[1], coords[3]);
    }
    logArgValue(key, description, result);
    return result;
  }

  public String getString(String key, String description, String defaultValue) {
    String value = get(key, defaultValue);
    logArgValue(key, description, value);
    return value;
  }

  /** @throws IllegalArgumentException if {@code key} is missing */
  public String getString(String key, String description) {
    String value = getRequired(key, description);
    logArgValue(key, description, value);
    return value;
  }

  public Path file(String key, String description, Path defaultValue) {
    String value = get(key);
    Path file = value == null ? defaultValue : Path.of(value);
    logArgValue(key, description, file);
    return file;
  }

  /** @throws IllegalArgumentException if {@code key} is missing */
  public Path file(String key, String description) {
    Path file = Path.of(getRequired(key, description));
    logArgValue(key, description, file);
    return file;
  }

  /** @throws IllegalArgumentException if {@code key} is missing or names a file that does not exist */
  public Path inputFile(String key, String description) {
    Path path = file(key, description);
    if (!Files.exists(path)) {
      throw new IllegalArgumentException(path + " does not exist");
    }
    return path;
  }

  /** Returns true only if {@code key} is {@code "true"}, ignoring case. */
  public boolean getBoolean(String key, String description, boolean defaultValue) {
    boolean value = "true".equalsIgnoreCase(get(key, Boolean.toString(defaultValue)));
    logArgValue(key, description, value);
    return value;
  }

  /** Returns the comma-separated values of {@code key} without blanks. */
  public List<String> getList(String key, String description, List<String> defaultValue) {
    String value = get(key);
    List<String> result = value == null ? defaultValue : Stream.of(value.split(","))
      .map(String::strip)
      .filter(item -> !item.isEmpty())
      .toList();
    logArgValue(key, description, result);
    return result;
  }

  /** @throws NumberFormatException if the value is not an integer */
  public int getInteger(String key, String description, int defaultValue) {
    String value = get(key);
    int result = value == null ? defaultValue : Integer.parseInt(value);
    logArgValue(key, description, result);
    return result;
  }

  /** @throws NumberFormatException if the value is not a number */
  public double getDouble(String key, String description, double defaultValue) {
    String value = get(key);
    double result = value == null ? defaultValue : Double.parseDouble(value);
    logArgValue(key, description, result);
    return result;
  }

  /**
   * Returns the number in {@code key}, or {@code null} if it was not provided.
   *
   * @throws NumberFormatException if the value is not a number
   */
  public Double getDoubleObject(String key, String description) {
    String value = get(key);
    Double result = value == null ? null : Double.parseDouble(value);
    logArgValue(key, description, result);
    return result;
  }

  /**
   * Returns a duration written like {@code "10s"}, {@code "90m"} or {@code "1h30m"}.
   *
   * @throws DateTimeParseException if the value is not a duration
   */
  public Duration getDuration(String key, String description, String defaultValue) {
    Duration result = Duration.parse("PT" + get(key, defaultValue));
    logArgValue(key, description, result.get(ChronoUnit.SECONDS) + " seconds");
    return result;
  }

  /** Returns {@code key} converted by {@code converter}, or {@code defaultValue} if it was not provided. */
  public <T> T getObject(String key, String description, T defaultValue, Function<String, T> converter) {
    String value = get(key);
    T result = value == null ? defaultValue : converter.apply(value);
    logArgValue(key, description, result);
    return result;
  }

  /**
   * Returns a view of these arguments that logs each value the first time it is read, for settings that are read by
   * both an addon and the runner.
   */
  public Arguments withExactlyOnceLogging() {
    Multiset<String> logged = HashMultiset.create();
    return new Arguments(lookup) {
      @Override
      protected void logArgValue(String key, String description, Object result) {
        if (logged.add(key, 1) == 0) {
          super.logArgValue(key, description, result);
        }
      }
    };
  }
}
