package io.github.jsontree;

/// Signals JSON text that could not be turned into a [JsonValue].
public final class JsonParseException extends RuntimeException {

  private final long line;
  private final long column;

  public JsonParseException(String message, long line, long column, Throwable cause) {
    super(message, cause);
    this.line = line;
    this.column = column;
  }

  /// {@return the 1-based line of the failure, or -1 if unknown}
  public long line() {
    return line;
  }

  /// {@return the 1-based column of the failure, or -1 if unknown}
  public long column() {
    return column;
  }
}
