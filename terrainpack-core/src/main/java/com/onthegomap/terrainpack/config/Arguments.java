package com.onthegomap.terrainpack.config;

import com.onthegomap.terrainpack.geo.BoundingBox;
import com.onthegomap.terrainpack.stats.Stats;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.TreeMap;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Key/value arguments for an export job, read from the command-line, JVM properties, environmental variables or a
 * properties file.
 * <p>
 * Lookups are case-and-separator-insensitive, so {@code "MAX_NODES_PER_REQUEST"} matches
 * {@code "max-nodes-per-request"} and {@code "max_nodes_per_request"}. A key like {@code "new_flag|old_flag"} reads
 * {@code new_flag} and falls back to the deprecated {@code old_flag}.
 */
public class Arguments {

  private static final Logger LOGGER = LoggerFactory.getLogger(Arguments.class);

  private final UnaryOperator<String> provider;

  private Arguments(UnaryOperator<String> provider) {
    this.provider = provider;
  }

  /** Returns arguments from JVM system properties like {@code -Dterrainpack.key=value}. */
  public static Arguments fromJvmProperties() {
    return fromPrefixed(System::getProperty, "terrainpack", ".", false);
  }

  /** Returns arguments from environmental variables like {@code TERRAINPACK_KEY}. */
  public static Arguments fromEnvironment() {
    return fromEnvironment(System::getenv);
  }

  static Arguments fromEnvironment(UnaryOperator<String> getter) {
    return fromPrefixed(getter, "TERRAINPACK", "_", true);
  }

  /**
   * Returns arguments parsed from command-line arguments: {@code key=value}, {@code --key value} or {@code --key} for
   * {@code key=true}.
   */
  public static Arguments fromArgs(String... args) {
    Map<String, String> parsed = new HashMap<>();
    for (int i = 0; i < args.length; i++) {
      String arg = args[i].strip();
      String[] kv = arg.split("=", 2);
      String key = kv[0].replaceAll("^[\\s-]+", "");
      if (kv.length == 2) {
        parsed.put(key, kv[1]);
      } else if (arg.startsWith("-") && i < args.length - 1 && !args[i + 1].strip().startsWith("-")) {
        parsed.put(key, args[++i].strip());
      } else {
        parsed.put(key, "true");
      }
    }
    return of(parsed);
  }

  /** Returns arguments loaded from a {@code .properties} file. */
  public static Arguments fromConfigFile(Path path) {
    Properties properties = new Properties();
    try (var reader = Files.newBufferedReader(path)) {
      properties.load(reader);
    } catch (IOException e) {
      throw new IllegalArgumentException("Unable to load config file: " + path, e);
    }
    Map<String, String> map = new HashMap<>();
    for (String name : properties.stringPropertyNames()) {
      map.put(name, properties.getProperty(name));
    }
    return of(map);
  }

  /**
   * Returns arguments from the command-line, then JVM properties, then environmental variables, then the properties
   * file named by a {@code config} argument from any of those.
   */
  public static Arguments fromArgsOrConfigFile(String... args) {
    Arguments fromArgsOrEnv = fromArgs(args)
      .orElse(fromJvmProperties())
      .orElse(fromEnvironment());
    Path configFile = fromArgsOrEnv.file("config", "path to config file", null);
    return configFile == null ? fromArgsOrEnv : fromArgsOrEnv.orElse(fromConfigFile(configFile));
  }

  private static String normalize(String key, String separator, boolean upperCase) {
    String result = key.replaceAll("[._-]", separator);
    return upperCase ? result.toUpperCase(Locale.ROOT) : result.toLowerCase(Locale.ROOT);
  }

  private static String normalize(String key) {
    return normalize(key, "_", false);
  }

  public static Arguments of(Map<String, String> map) {
    Map<String, String> updated = new LinkedHashMap<>();
    for (var entry : map.entrySet()) {
      updated.put(normalize(entry.getKey()), entry.getValue());
    }
    return new Arguments(updated::get);
  }

  /** Shorthand for {@link #of(Map)} which constructs the map from a list of key/value pairs. */
  public static Arguments of(Object... args) {
    Map<String, String> map = new TreeMap<>();
    for (int i = 0; i < args.length; i += 2) {
      map.put(args[i].toString(), args[i + 1].toString());
    }
    return of(map);
  }

  private static Arguments fromPrefixed(UnaryOperator<String> provider, String prefix, String separator,
    boolean upperCase) {
    return new Arguments(key -> provider.apply(normalize(prefix + separator + key, separator, upperCase)));
  }

  private String get(String key) {
    String[] options = key.split("\\|");
    for (int i = 0; i < options.length; i++) {
      String option = options[i].strip();
      String value = provider.apply(normalize(option));
      if (value != null) {
        if (i != 0) {
          LOGGER.warn("Argument '{}' is deprecated", option);
        }
        return value.trim();
      }
    }
    return null;
  }

  /** Returns arguments that check {@code this} first and fall back to {@code other}. */
  public Arguments orElse(Arguments other) {
    return new Arguments(key -> {
      String ourResult = get(key);
      return ourResult != null ? ourResult : other.get(key);
    });
  }

  private String getArg(String key, String defaultValue) {
    String value = get(key);
    return value == null ? defaultValue : value;
  }

  private String getRequiredArg(String key, String description) {
    String value = get(key);
    if (value == null) {
      throw new IllegalArgumentException("Missing required parameter: " + key + " (" + description + ")");
    }
    return value;
  }

  private void logArgValue(String key, String description, Object result) {
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug("argument: {}={} ({})", key.replaceFirst("\\|.*$", ""), result, description);
    }
  }

  /**
   * Returns the {@link BoundingBox} in {@code key} formatted as {@code minLon,minLat,maxLon,maxLat}, or null if
   * missing.
   *
   * @throws ValidationException if the value is not a valid bounding box
   */
  public BoundingBox bounds(String key, String description) {
    String input = get(key);
    BoundingBox result = input == null ? null : BoundingBox.parse(input);
    logArgValue(key, description, result);
    return result;
  }

  public String getString(String key, String description, String defaultValue) {
    String value = getArg(key, defaultValue);
    logArgValue(key, description, value);
    return value;
  }

  public String getString(String key, String description) {
    String value = getRequiredArg(key, description);
    logArgValue(key, description, value);
    return value;
  }

  /** Returns a {@link Path} from {@code key} or {@code defaultValue} if the argument is not set. */
  public Path file(String key, String description, Path defaultValue) {
    String value = get(key);
    Path file = value == null ? defaultValue : Path.of(value);
    logArgValue(key, description, file);
    return file;
  }

  /**
   * Returns a {@link Path} from a required {@code key} that must exist.
   *
   * @throws IllegalArgumentException if the file does not exist or if the parameter is not provided.
   */
  public Path inputFile(String key, String description) {
    Path path = Path.of(getRequiredArg(key, description));
    logArgValue(key, description, path);
    if (!Files.exists(path)) {
      throw new IllegalArgumentException(path + " does not exist");
    }
    return path;
  }

  /** Returns {@code true} if {@code key} is {@code "true"}, {@code false} for anything else. */
  public boolean getBoolean(String key, String description, boolean defaultValue) {
    boolean value = "true".equalsIgnoreCase(getArg(key, Boolean.toString(defaultValue)));
    logArgValue(key, description, value);
    return value;
  }

  /** Returns the comma-separated values of {@code key}. */
  public List<String> getList(String key, String description, List<String> defaultValue) {
    String value = getArg(key, String.join(",", defaultValue));
    var results = Stream.of(value.split(","))
      .map(String::trim)
      .filter(c -> !c.isBlank()).toList();
    logArgValue(key, description, results);
    return results;
  }

  /**
   * Returns the number of threads from {@link Runtime#availableProcessors()} unless overridden by the {@code threads}
   * argument.
   */
  public int threads() {
    String value = getArg("threads", Integer.toString(Runtime.getRuntime().availableProcessors()));
    int threads = Math.max(1, Integer.parseInt(value));
    logArgValue("threads", "num threads", threads);
    return threads;
  }

  /** Returns an in-memory {@link Stats} collector for the job. */
  public Stats getStats() {
    return Stats.inMemory();
  }

  /**
   * Returns an argument as integer.
   *
   * @throws NumberFormatException if the argument cannot be parsed as an integer
   */
  public int getInteger(String key, String description, int defaultValue) {
    int parsed = Integer.parseInt(getArg(key, Integer.toString(defaultValue)));
    logArgValue(key, description, parsed);
    return parsed;
  }

  /**
   * Returns an argument as long.
   *
   * @throws NumberFormatException if the argument cannot be parsed as a long
   */
  public long getLong(String key, String description, long defaultValue) {
    long parsed = Long.parseLong(getArg(key, Long.toString(defaultValue)));
    logArgValue(key, description, parsed);
    return parsed;
  }

  /**
   * Returns an argument as double.
   *
   * @throws NumberFormatException if the argument cannot be parsed as a double
   */
  public double getDouble(String key, String description, double defaultValue) {
    double parsed = Double.parseDouble(getArg(key, Double.toString(defaultValue)));
    logArgValue(key, description, parsed);
    return parsed;
  }

  /**
   * Returns an argument as a {@link Duration} like "500ms", "10s", "1m30s".
   *
   * @throws java.time.format.DateTimeParseException if the argument cannot be parsed as a duration
   */
  public Duration getDuration(String key, String description, String defaultValue) {
    String value = getArg(key, defaultValue).toUpperCase(Locale.ROOT);
    Duration parsed = value.endsWith("MS") ?
      Duration.ofMillis(Long.parseLong(value.substring(0, value.length() - 2))) :
      Duration.parse("PT" + value);
    logArgValue(key, description, parsed.get(ChronoUnit.SECONDS) + " seconds");
    return parsed;
  }
}
