package io.github.jsontree.schema;

import java.util.Objects;

/// One failed keyword check.
///
/// @param path where in the instance the failure occurred
/// @param keyword the keyword whose check failed
/// @param message a human readable description
public record ValidationError(InstancePath path, Keyword keyword, String message) {

  public ValidationError {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(keyword, "keyword");
    Objects.requireNonNull(message, "message");
  }

  @Override
  public String toString() {
    return (path.isRoot() ? "<root>" : path.toString()) + ": " + keyword + ": " + message;
  }
}
