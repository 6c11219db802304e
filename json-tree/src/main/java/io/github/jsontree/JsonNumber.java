package io.github.jsontree;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;

/// A JSON number held at full decimal precision.
///
/// Two numbers are equal when they represent the same numeric value, so
/// `1`, `1.0` and `1E0` are equal and share a hash code.
public record JsonNumber(BigDecimal value) implements JsonValue {

  public JsonNumber {
    Objects.requireNonNull(value, "value");
  }

  public static JsonNumber of(long value) {
    return new JsonNumber(BigDecimal.valueOf(value));
  }

  /// Creates a number from a finite `double` using its shortest decimal form.
  ///
  /// @throws IllegalArgumentException if the value is NaN or infinite
  public static JsonNumber of(double value) {
    if (!Double.isFinite(value)) {
      throw new IllegalArgumentException("Not a valid JSON number: " + value);
    }
    return new JsonNumber(new BigDecimal(Double.toString(value)));
  }

  public static JsonNumber of(BigInteger value) {
    return new JsonNumber(new BigDecimal(value));
  }

  /// Creates a number from its JSON text, e.g. `"-1.5e3"`.
  ///
  /// @throws IllegalArgumentException if the text is not a decimal number
  public static JsonNumber of(String text) {
    Objects.requireNonNull(text, "text");
    try {
      return new JsonNumber(new BigDecimal(text));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Not a JSON number: " + text, e);
    }
  }

  /// {@return true if this number has no fractional part}
  public boolean isIntegral() {
    return value.signum() == 0 || value.stripTrailingZeros().scale() <= 0;
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof JsonNumber other && value.compareTo(other.value) == 0;
  }

  @Override
  public int hashCode() {
    return value.signum() == 0 ? 0 : value.stripTrailingZeros().hashCode();
  }

  @Override
  public String toString() {
    return value.toString();
  }
}
