package io.github.jsontree.schema;

import io.github.jsontree.JsonNumber;
import io.github.jsontree.JsonValue;

import java.math.BigDecimal;
import java.math.BigInteger;

import static io.github.jsontree.schema.SchemaLogging.LOG;

/// Number schema with range and divisibility constraints.
///
/// All comparisons are exact `BigDecimal` arithmetic.
record NumberKeywords(
    BigDecimal minimum,
    BigDecimal maximum,
    boolean exclusiveMinimum,
    boolean exclusiveMaximum,
    BigDecimal divisibleBy
) implements KeywordValidator {

  @Override
  public boolean appliesTo(JsonValue instance) {
    return instance instanceof JsonNumber;
  }

  @Override
  public void validate(ValidationFrame frame, NodeScope scope) {
    BigDecimal value = ((JsonNumber) frame.instance()).value();

    if (minimum != null) {
      int comparison = value.compareTo(minimum);
      LOG.finest(() -> "NumberKeywords.validate: value=" + value + " minimum=" + minimum + " comparison=" + comparison);
      if (exclusiveMinimum ? comparison <= 0 : comparison < 0) {
        scope.fail(Keyword.MINIMUM, "Below minimum: " + value + ", expected "
            + (exclusiveMinimum ? "more than " : "at least ") + minimum);
      }
    }

    if (maximum != null) {
      int comparison = value.compareTo(maximum);
      if (exclusiveMaximum ? comparison >= 0 : comparison > 0) {
        scope.fail(Keyword.MAXIMUM, "Above maximum: " + value + ", expected "
            + (exclusiveMaximum ? "less than " : "at most ") + maximum);
      }
    }

    if (divisibleBy != null && !isMultipleOf(value, divisibleBy)) {
      scope.fail(Keyword.DIVISIBLE_BY, "Not divisible by " + divisibleBy + ": " + value);
    }
  }

  /// Exact divisibility test that never expands the exponent of either side.
  ///
  /// With `value = a * 10^p` and `divisor = b * 10^q`, both are scaled down
  /// by `10^min(p, q)`. Only one side keeps a power of ten, and that power is
  /// either reduced modulo `b` or bounded by the digit count of `a`.
  ///
  /// @param value   the instance number
  /// @param divisor a positive divisor
  /// @return true when `value / divisor` is an integer
  static boolean isMultipleOf(BigDecimal value, BigDecimal divisor) {
    if (value.signum() == 0) {
      return true;
    }
    BigInteger a = value.unscaledValue();
    BigInteger b = divisor.unscaledValue().abs();
    long p = -(long) value.scale();
    long q = -(long) divisor.scale();

    if (p >= q) {
      // a * 10^(p - q) must be a multiple of b
      BigInteger shift = BigInteger.valueOf(p - q);
      return a.mod(b).multiply(BigInteger.TEN.modPow(shift, b)).mod(b).signum() == 0;
    }

    // a must be a multiple of b * 10^(q - p); a nonzero a is shorter than that power
    long k = q - p;
    if (k >= value.precision()) {
      return false;
    }
    return a.mod(b.multiply(BigInteger.TEN.pow((int) k))).signum() == 0;
  }
}
