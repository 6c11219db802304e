package io.github.jsontree.schema;

import io.github.jsontree.JsonString;
import io.github.jsontree.JsonValue;

import java.util.regex.Pattern;

/// String schema with length, pattern, and format constraints.
///
/// Lengths count Unicode code points. The exclusive flags are the node's
/// `exclusiveMinimum` / `exclusiveMaximum` and turn the length bounds strict.
record StringKeywords(
    Integer minLength,
    Integer maxLength,
    boolean exclusiveMinimum,
    boolean exclusiveMaximum,
    Pattern pattern,
    Format format
) implements KeywordValidator {

  @Override
  public boolean appliesTo(JsonValue instance) {
    return instance instanceof JsonString;
  }

  @Override
  public void validate(ValidationFrame frame, NodeScope scope) {
    String value = ((JsonString) frame.instance()).value();
    int length = value.codePointCount(0, value.length());

    if (minLength != null && (exclusiveMinimum ? length <= minLength : length < minLength)) {
      scope.fail(Keyword.MIN_LENGTH, "String too short: length " + length + ", expected "
          + (exclusiveMinimum ? "more than " : "at least ") + minLength);
    }
    if (maxLength != null && (exclusiveMaximum ? length >= maxLength : length > maxLength)) {
      scope.fail(Keyword.MAX_LENGTH, "String too long: length " + length + ", expected "
          + (exclusiveMaximum ? "fewer than " : "at most ") + maxLength);
    }

    // unanchored matching - uses find() instead of matches()
    if (pattern != null && !pattern.matcher(value).find()) {
      scope.fail(Keyword.PATTERN, "Pattern mismatch: does not match " + pattern.pattern());
    }

    if (format != null && scope.options().assertFormats() && !format.test(value)) {
      scope.fail(Keyword.FORMAT, "Invalid format '" + format.formatName() + "'");
    }
  }
}
