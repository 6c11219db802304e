package io.github.jsontree.schema;

import io.github.jsontree.JsonValue;

import java.util.List;

/// Enum membership by deep equality
record EnumKeyword(List<JsonValue> allowedValues) implements KeywordValidator {

  EnumKeyword {
    allowedValues = List.copyOf(allowedValues);
  }

  @Override
  public void validate(ValidationFrame frame, NodeScope scope) {
    if (!allowedValues.contains(frame.instance())) {
      scope.fail(Keyword.ENUM, "Not in enum: " + frame.instance() + " is not one of " + allowedValues);
    }
  }
}
