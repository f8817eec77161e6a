package com.onthegomap.zen.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Key/value settings read from JVM properties, environmental variables, command-line style arguments, a properties
 * file, or an in-memory map.
 * <p>
 * Lookups are case-and-separator-insensitive, so {@code "PRESERVE_BRANCHES"} matches {@code "preserve-branches"} and
 * {@code "preserve.branches"}. A key of the form {@code "new_flag|old_flag"} reads {@code new_flag} and falls back to
 * the deprecated {@code old_flag}.
 */
public class Arguments {

  private static final Logger LOGGER = LoggerFactory.getLogger(Arguments.class);

  /** Returns the raw value of a normalized key, or null. */
  private final UnaryOperator<String> lookup;
  /** Returns the normalized keys this instance has values for. */
  private final Supplier<? extends Collection<String>> names;
  private boolean silent = false;

  private Arguments(UnaryOperator<String> lookup, Supplier<? extends Collection<String>> names) {
    this.lookup = lookup;
    this.names = names;
  }

  /**
   * Returns arguments from JVM system properties prefixed with {@code zen.}
   * <p>
   * For example to set {@code preserve_branches=true}: {@code java -Dzen.preserve.branches=true ...}
   */
  public static Arguments fromJvmProperties() {
    return fromJvmProperties(System::getProperty, () -> System.getProperties().stringPropertyNames());
  }

  static Arguments fromJvmProperties(UnaryOperator<String> getter, Supplier<? extends Collection<String>> keys) {
    return prefixed(getter, keys, "zen.", key -> key.replace('_', '.'));
  }

  /**
   * Returns arguments parsed from environmental variables prefixed with {@code ZEN_}
   * <p>
   * For example to set {@code preserve_branches=true}: {@code ZEN_PRESERVE_BRANCHES=true java ...}
   */
  public static Arguments fromEnvironment() {
    return fromEnvironment(System::getenv, () -> System.getenv().keySet());
  }

  static Arguments fromEnvironment(UnaryOperator<String> getter, Supplier<Set<String>> keys) {
    return prefixed(getter, keys, "ZEN_", key -> key.toUpperCase(Locale.ROOT));
  }

  /** Returns arguments from JVM properties, falling back to environmental variables. */
  public static Arguments fromJvmPropertiesOrEnvironment() {
    return fromJvmProperties().orElse(fromEnvironment());
  }

  /** Returns arguments parsed from a {@link Properties} object. */
  public static Arguments from(Properties properties) {
    Map<String, String> values = new LinkedHashMap<>();
    for (String name : properties.stringPropertyNames()) {
      values.put(name, properties.getProperty(name));
    }
    return of(values);
  }

  /**
   * Returns arguments provided from a properties file.
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
   * Returns arguments parsed from {@code key=value}, {@code --key value} or {@code --key} (meaning {@code key=true})
   * strings.
   */
  public static Arguments fromArgs(String... args) {
    Map<String, String> parsed = new LinkedHashMap<>();
    int i = 0;
    while (i < args.length) {
      String arg = args[i++].strip();
      int equals = arg.indexOf('=');
      String key = (equals < 0 ? arg : arg.substring(0, equals)).replaceFirst("^-+", "");
      if (equals >= 0) {
        parsed.put(key, arg.substring(equals + 1));
      } else if (arg.startsWith("-") && i < args.length && !args[i].strip().startsWith("-")) {
        parsed.put(key, args[i++].strip());
      } else {
        parsed.put(key, "true");
      }
    }
    return of(parsed);
  }

  public static Arguments of(Map<String, String> map) {
    Map<String, String> normalized = new LinkedHashMap<>();
    map.forEach((key, value) -> normalized.put(normalize(key), value));
    return new Arguments(normalized::get, normalized::keySet);
  }

  /** Shorthand for {@link #of(Map)} which constructs the map from a list of key/value pairs. */
  public static Arguments of(Object... args) {
    Map<String, String> map = new TreeMap<>();
    for (int i = 0; i + 1 < args.length; i += 2) {
      map.put(args[i].toString(), args[i + 1].toString());
    }
    return of(map);
  }

  /** Lower-cases {@code key} and replaces {@code .} and {@code -} with {@code _}. */
  static String normalize(String key) {
    return key.strip().replaceAll("[.-]", "_").toLowerCase(Locale.ROOT);
  }

  /**
   * Returns arguments over a source where each normalized key is stored as {@code prefix} followed by
   * {@code toSourceKey} of the key.
   */
  private static Arguments prefixed(UnaryOperator<String> getter, Supplier<? extends Collection<String>> keys,
    String prefix, UnaryOperator<String> toSourceKey) {
    int length = prefix.length();
    return new Arguments(
      key -> getter.apply(prefix + toSourceKey.apply(key)),
      () -> keys.get().stream()
        .filter(key -> key.regionMatches(true, 0, prefix, 0, length))
        .map(key -> normalize(key.substring(length)))
        .toList()
    );
  }

  /** Returns the value of the first alternative in {@code key} that has one, warning if it is not the first. */
  private String get(String key) {
    String[] alternatives = key.split("\\|");
    for (int i = 0; i < alternatives.length; i++) {
      String value = lookup.apply(normalize(alternatives[i]));
      if (value != null) {
        if (i > 0) {
          LOGGER.warn("Argument '{}' is deprecated, use '{}'", alternatives[i].strip(), alternatives[0].strip());
        }
        return value.strip();
      }
    }
    return null;
  }

  /** Returns arguments that read from {@code this} first, then from {@code other}. */
  public Arguments orElse(Arguments other) {
    Arguments result = new Arguments(
      key -> {
        String value = get(key);
        return value != null ? value : other.get(key);
      },
      () -> {
        Set<String> all = new LinkedHashSet<>(names.get());
        all.addAll(other.names.get());
        return all;
      }
    );
    result.silent = silent;
    return result;
  }

  /** Returns a new arguments instance where the value for {@code key} defaults to {@code value}. */
  public Arguments withDefault(Object key, Object value) {
    return orElse(of(key.toString().replaceFirst("^-+", ""), value));
  }

  /** Stop logging argument values when they are read and return this instance. */
  public Arguments silence() {
    this.silent = true;
    return this;
  }

  public boolean silenced() {
    return silent;
  }

  private <T> T read(String key, String description, T defaultValue, Function<String, T> parser) {
    String raw = get(key);
    T value = raw == null ? defaultValue : parser.apply(raw);
    if (!silent) {
      LOGGER.debug("argument: {}={} ({})", key.split("\\|")[0], value, description);
    }
    return value;
  }

  public String getString(String key, String description, String defaultValue) {
    return read(key, description, defaultValue, Function.identity());
  }

  /** Returns a boolean parsed from {@code key} argument where {@code "true"} is true and anything else is false. */
  public boolean getBoolean(String key, String description, boolean defaultValue) {
    return read(key, description, defaultValue, "true"::equalsIgnoreCase);
  }

  /**
   * Returns an argument as integer.
   *
   * @throws NumberFormatException if the argument cannot be parsed as an integer
   */
  public int getInteger(String key, String description, int defaultValue) {
    return read(key, description, defaultValue, Integer::parseInt);
  }

  /** Returns every argument provided, by normalized key. */
  public Map<String, String> toMap() {
    Map<String, String> result = new TreeMap<>();
    for (String key : names.get()) {
      String value = get(key);
      if (value != null) {
        result.put(key, value);
      }
    }
    return result;
  }

  @Override
  public String toString() {
    return "Arguments" + Arrays.toString(names.get().toArray());
  }
}
