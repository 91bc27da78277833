package org.redlist.maps.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Map rendering options read from one or more layered sources: command-line arguments, {@code redlist.*} JVM
 * properties, {@code REDLIST_*} environment variables and a properties file.
 * <p>
 * Keys ignore case and treat {@code .}, {@code -} and {@code _} alike, so {@code --edge-width}, {@code edge_width}
 * and {@code REDLIST_EDGE_WIDTH} name the same option. A key written as {@code "ee_project|google_cloud_project"}
 * reads the first name from any layer before trying the renamed one.
 */
public class Arguments {

  private static final Logger LOGGER = LoggerFactory.getLogger(Arguments.class);

  /** One layer of options, keyed by {@link #canonical(String)} names. */
  private interface Layer {

    String lookup(String canonicalKey);

    Collection<String> keys();
  }

  private final List<Layer> layers;

  private Arguments(List<Layer> layers) {
    this.layers = List.copyOf(layers);
  }

  private static Arguments single(Layer layer) {
    return new Arguments(List.of(layer));
  }

  static String canonical(String key) {
    return key.strip().replaceAll("[._-]", "_").toLowerCase(Locale.ROOT);
  }

  private static Layer mapLayer(Map<String, String> values) {
    Map<String, String> canonical = new HashMap<>();
    values.forEach((key, value) -> canonical.put(canonical(key), value));
    return new Layer() {
      @Override
      public String lookup(String canonicalKey) {
        return canonical.get(canonicalKey);
      }

      @Override
      public Collection<String> keys() {
        return canonical.keySet();
      }
    };
  }

  /** Reads {@code <prefix><separator><key>} entries from {@code getter}, for example {@code REDLIST_DPI}. */
  private static Layer prefixedLayer(UnaryOperator<String> getter, Supplier<? extends Collection<String>> rawKeys,
    String prefix, String separator, boolean upperCase) {
    String head = prefix + separator;
    return new Layer() {
      @Override
      public String lookup(String canonicalKey) {
        String value = getter.apply(external(canonicalKey.replace("_", separator)));
        return value != null ? value : getter.apply(external(canonicalKey));
      }

      private String external(String key) {
        String name = head + key;
        return upperCase ? name.toUpperCase(Locale.ROOT) : name;
      }

      @Override
      public Collection<String> keys() {
        return rawKeys.get().stream()
          .filter(raw -> raw.regionMatches(true, 0, head, 0, head.length()) && raw.length() > head.length())
          .map(raw -> canonical(raw.substring(head.length())))
          .toList();
      }
    };
  }

  public static Arguments of(Map<String, String> map) {
    return single(mapLayer(map));
  }

  /** Builds arguments from alternating keys and values. */
  public static Arguments of(Object... keysAndValues) {
    Map<String, String> map = new HashMap<>();
    for (int i = 0; i + 1 < keysAndValues.length; i += 2) {
      map.put(keysAndValues[i].toString(), keysAndValues[i + 1].toString());
    }
    return of(map);
  }

  public static Arguments from(Properties properties) {
    Map<String, String> map = new HashMap<>();
    for (String name : properties.stringPropertyNames()) {
      map.put(name, properties.getProperty(name));
    }
    return of(map);
  }

  /**
   * Parses {@code key=value}, {@code --key value} and bare {@code --flag} arguments. A flag followed by another
   * {@code -} argument, or by nothing, is {@code true}.
   */
  public static Arguments fromArgs(String... args) {
    Map<String, String> parsed = new HashMap<>();
    int i = 0;
    while (i < args.length) {
      String arg = args[i++].strip();
      int equals = arg.indexOf('=');
      if (equals >= 0) {
        parsed.put(stripDashes(arg.substring(0, equals)), arg.substring(equals + 1));
      } else if (arg.startsWith("-") && i < args.length && !args[i].strip().startsWith("-")) {
        parsed.put(stripDashes(arg), args[i++].strip());
      } else {
        parsed.put(stripDashes(arg), "true");
      }
    }
    return of(parsed);
  }

  private static String stripDashes(String key) {
    return key.replaceAll("^[\\s-]+", "");
  }

  /**
   * Loads a {@code .properties} file.
   *
   * @throws IllegalArgumentException if the file cannot be read
   */
  public static Arguments fromConfigFile(Path path) {
    Properties properties = new Properties();
    try (Reader reader = Files.newBufferedReader(path)) {
      properties.load(reader);
    } catch (IOException e) {
      throw new IllegalArgumentException("Unable to load config file: " + path, e);
    }
    return from(properties);
  }

  /** Options from {@code -Dredlist.key=value} JVM properties. */
  public static Arguments fromJvmProperties() {
    return fromJvmProperties(System::getProperty, () -> System.getProperties().stringPropertyNames());
  }

  static Arguments fromJvmProperties(UnaryOperator<String> getter, Supplier<? extends Collection<String>> keys) {
    return single(prefixedLayer(getter, keys, "redlist", ".", false));
  }

  /** Options from {@code REDLIST_KEY=value} environment variables. */
  public static Arguments fromEnvironment() {
    return fromEnvironment(System::getenv, () -> System.getenv().keySet());
  }

  static Arguments fromEnvironment(UnaryOperator<String> getter, Supplier<Set<String>> keys) {
    return single(prefixedLayer(getter, keys, "REDLIST", "_", true));
  }

  /** Command-line arguments first, then JVM properties, then environment variables. */
  public static Arguments fromEnvOrArgs(String... args) {
    return fromArgs(args).orElse(fromJvmProperties()).orElse(fromEnvironment());
  }

  /**
   * Like {@link #fromEnvOrArgs(String...)}, falling back to the properties file named by a {@code config} option
   * when one is given.
   */
  public static Arguments fromArgsOrConfigFile(String... args) {
    Arguments arguments = fromEnvOrArgs(args);
    Path configFile = arguments.file("config", "path to config file", null);
    return configFile == null ? arguments : arguments.orElse(fromConfigFile(configFile));
  }

  /** Returns arguments that read from {@code this} first and then from {@code fallback}. */
  public Arguments orElse(Arguments fallback) {
    List<Layer> combined = new ArrayList<>(layers);
    combined.addAll(fallback.layers);
    return new Arguments(combined);
  }

  private String raw(String key) {
    String[] names = key.split("\\|");
    for (int i = 0; i < names.length; i++) {
      String name = canonical(names[i]);
      for (Layer layer : layers) {
        String value = layer.lookup(name);
        if (value != null) {
          if (i > 0) {
            LOGGER.warn("Argument '{}' is deprecated, use '{}'", names[i].strip(), names[0].strip());
          }
          return value.strip();
        }
      }
    }
    return null;
  }

  private <T> T read(String key, String description, String defaultValue, Function<String, T> parser) {
    String value = raw(key);
    T result = parser.apply(value == null ? defaultValue : value);
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug("argument: {}={} ({})", key.replaceFirst("\\|.*$", ""), result, description);
    }
    return result;
  }

  public boolean has(String key) {
    return raw(key) != null;
  }

  public String getString(String key, String description, String defaultValue) {
    return read(key, description, defaultValue, Function.identity());
  }

  /**
   * Returns a required string option.
   *
   * @throws IllegalArgumentException if no layer sets {@code key}
   */
  public String getString(String key, String description) {
    if (!has(key)) {
      throw new IllegalArgumentException("Missing required parameter: " + key + " (" + description + ")");
    }
    return getString(key, description, null);
  }

  public Path file(String key, String description, Path defaultValue) {
    return read(key, description, null, value -> value == null ? defaultValue : Path.of(value));
  }

  /**
   * Like {@link #file(String, String, Path)} but the file must exist.
   *
   * @throws IllegalArgumentException if the resolved path does not exist
   */
  public Path inputFile(String key, String description, Path defaultValue) {
    Path path = file(key, description, defaultValue);
    if (path != null && !Files.exists(path)) {
      throw new IllegalArgumentException(path + " does not exist");
    }
    return path;
  }

  /** Only {@code "true"}, in any case, is true. */
  public boolean getBoolean(String key, String description, boolean defaultValue) {
    return read(key, description, Boolean.toString(defaultValue), "true"::equalsIgnoreCase);
  }

  /** Returns the non-blank comma-separated entries of {@code key}. */
  public List<String> getList(String key, String description, List<String> defaultValue) {
    return read(key, description, String.join(",", defaultValue), value -> Stream.of(value.split(","))
      .map(String::strip)
      .filter(item -> !item.isEmpty())
      .toList());
  }

  /** @throws NumberFormatException if the value is not an integer */
  public int getInteger(String key, String description, int defaultValue) {
    return read(key, description, Integer.toString(defaultValue), Integer::parseInt);
  }

  /** @throws NumberFormatException if the value is not a number */
  public double getDouble(String key, String description, double defaultValue) {
    return read(key, description, Double.toString(defaultValue), Double::parseDouble);
  }

  /**
   * Parses durations like {@code 10s}, {@code 90m} or {@code 1h30m}.
   *
   * @throws DateTimeParseException if the value is not a duration
   */
  public Duration getDuration(String key, String description, String defaultValue) {
    return read(key, description, defaultValue, value -> Duration.parse("PT" + value));
  }

  /** Returns every option any layer sets, resolved with the same precedence as the getters. */
  public Map<String, String> toMap() {
    Map<String, String> result = new HashMap<>();
    for (int i = layers.size() - 1; i >= 0; i--) {
      Layer layer = layers.get(i);
      for (String key : layer.keys()) {
        String value = layer.lookup(key);
        if (value != null) {
          result.put(key, value.strip());
        }
      }
    }
    return result;
  }
}
