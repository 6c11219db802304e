package io.github.jsontree.schema;

import io.github.jsontree.JsonValue;

import java.util.ArrayList;
import java.util.List;

/// Collects the outcome of evaluating one frame: the errors found at the
/// node itself and the child frames it schedules.
final class NodeScope {
  private final Evaluator evaluator;
  private final ValidationFrame frame;
  private final List<ValidationError> errors = new ArrayList<>();
  private final List<ValidationFrame> children = new ArrayList<>();

  NodeScope(Evaluator evaluator, ValidationFrame frame) {
    this.evaluator = evaluator;
    this.frame = frame;
  }

  void fail(Keyword keyword, String message) {
    fail(frame.path(), keyword, message);
  }

  void fail(InstancePath path, Keyword keyword, String message) {
    errors.add(new ValidationError(path, keyword, message));
  }

  /// Schedules `instance` to be checked against `schema`; its errors join the main result.
  void descend(InstancePath path, SchemaNode schema, JsonValue instance) {
    children.add(new ValidationFrame(path, schema, instance));
  }

  /// Evaluates the current instance against `schema` in isolation.
  ///
  /// @return the errors of that branch, which do not join the main result
  List<ValidationError> branch(SchemaNode schema) {
    return evaluator.run(new ValidationFrame(frame.path(), schema, frame.instance()));
  }

  ValidatorOptions options() {
    return evaluator.options();
  }

  List<ValidationError> errors() {
    return errors;
  }

  List<ValidationFrame> children() {
    return children;
  }
}
