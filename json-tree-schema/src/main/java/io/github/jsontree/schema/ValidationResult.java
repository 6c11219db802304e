package io.github.jsontree.schema;

import java.util.List;

/// The outcome of one `validate` call: every violation found, in order.
///
/// The error list is unmodifiable and owned by the caller.
public record ValidationResult(boolean valid, List<ValidationError> errors) {

  private static final ValidationResult SUCCESS = new ValidationResult(true, List.of());

  public ValidationResult {
    errors = List.copyOf(errors);
    if (valid != errors.isEmpty()) {
      throw new IllegalArgumentException("valid must be true exactly when there are no errors");
    }
  }

  public static ValidationResult success() {
    return SUCCESS;
  }

  public static ValidationResult failure(List<ValidationError> errors) {
    return new ValidationResult(false, errors);
  }

  static ValidationResult of(List<ValidationError> errors) {
    return errors.isEmpty() ? success() : failure(errors);
  }
}
