package io.github.jsontree.schema;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/// Built-in formats for the `format` keyword.
///
/// This is the process-wide format registry: each constant compiles its
/// pattern once during class initialization and the name lookup table is
/// immutable afterwards, so lookups need no locking. A format check
/// matches the whole string, so a trailing line terminator is rejected.
public enum Format {
  DATE_TIME("date-time",
      "^\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}(?:\\.\\d+)?(?:Z|[+-]\\d{2}:\\d{2})?$"),
  DATE("date", "^\\d{4}-\\d{2}-\\d{2}$"),
  TIME("time", "^\\d{2}:\\d{2}:\\d{2}(?:\\.\\d+)?$"),
  EMAIL("email", "^[^@\\s]+@[^@\\s.]+(?:\\.[^@\\s.]+)+$"),
  HOSTNAME("hostname",
      "^(?=.{1,255}$)[A-Za-z0-9](?:[A-Za-z0-9-]{0,61}[A-Za-z0-9])?"
          + "(?:\\.[A-Za-z0-9](?:[A-Za-z0-9-]{0,61}[A-Za-z0-9])?)*\\.?$"),
  IPV4("ipv4", "^(?:(?:25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)\\.){3}(?:25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)$"),
  IPV6("ipv6", "^(?:"
      + "(?:[0-9A-Fa-f]{1,4}:){7}[0-9A-Fa-f]{1,4}"
      + "|(?:[0-9A-Fa-f]{1,4}:){1,7}:"
      + "|(?:[0-9A-Fa-f]{1,4}:){1,6}:[0-9A-Fa-f]{1,4}"
      + "|(?:[0-9A-Fa-f]{1,4}:){1,5}(?::[0-9A-Fa-f]{1,4}){1,2}"
      + "|(?:[0-9A-Fa-f]{1,4}:){1,4}(?::[0-9A-Fa-f]{1,4}){1,3}"
      + "|(?:[0-9A-Fa-f]{1,4}:){1,3}(?::[0-9A-Fa-f]{1,4}){1,4}"
      + "|(?:[0-9A-Fa-f]{1,4}:){1,2}(?::[0-9A-Fa-f]{1,4}){1,5}"
      + "|[0-9A-Fa-f]{1,4}:(?::[0-9A-Fa-f]{1,4}){1,6}"
      + "|:(?:(?::[0-9A-Fa-f]{1,4}){1,7}|:)"
      + ")$"),
  URI("uri", "^[A-Za-z][A-Za-z0-9+.-]*:[^\\s]+$"),
  UUID("uuid", "^[0-9A-Fa-f]{8}-[0-9A-Fa-f]{4}-[0-9A-Fa-f]{4}-[0-9A-Fa-f]{4}-[0-9A-Fa-f]{12}$");

  private static final Map<String, Format> REGISTRY = Arrays.stream(values())
      .collect(Collectors.toUnmodifiableMap(Format::formatName, Function.identity()));

  private final String formatName;
  private final Pattern pattern;

  Format(String formatName, String regex) {
    this.formatName = formatName;
    this.pattern = Pattern.compile(regex);
  }

  /// {@return the name used with the `format` keyword, e.g. `date-time`}
  public String formatName() {
    return formatName;
  }

  public Pattern pattern() {
    return pattern;
  }

  /// Test if the string value matches the format
  /// @param s the string to test
  /// @return true if the string matches the format, false otherwise
  public boolean test(String s) {
    return pattern.matcher(s).matches();
  }

  /// Get format by its schema name (case-sensitive).
  public static Optional<Format> byName(String name) {
    return Optional.ofNullable(REGISTRY.get(name));
  }
}
