package io.github.jsontree.schema;

import io.github.jsontree.JsonNull;
import io.github.jsontree.JsonValue;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import static io.github.jsontree.schema.SchemaLogging.LOG;

/// Walks instance and compiled schema together using an explicit work stack.
///
/// Each popped frame runs the null/required short-circuit and then the
/// node's keyword pipeline. Errors found at the node are appended at once;
/// the child frames it schedules are pushed in reverse so that they are
/// evaluated in declaration order, giving a pre-order listing of errors.
final class Evaluator {
  private static final int WARNING_THRESHOLD = 10_000;

  private final ValidatorOptions options;

  Evaluator(ValidatorOptions options) {
    this.options = options;
  }

  ValidatorOptions options() {
    return options;
  }

  List<ValidationError> run(ValidationFrame root) {
    List<ValidationError> errors = new ArrayList<>();
    Deque<ValidationFrame> stack = new ArrayDeque<>();
    stack.push(root);

    int iterationCount = 0;
    while (!stack.isEmpty()) {
      iterationCount++;
      if (iterationCount % WARNING_THRESHOLD == 0) {
        StructuredLog.fine(LOG, "validate.progress", "processed", iterationCount, "pending", stack.size());
      }

      ValidationFrame frame = stack.pop();
      LOG.finest(() -> "POP " + frame.path() + "   schema=" + frame.schema().pointer());
      NodeScope scope = new NodeScope(this, frame);
      evaluate(frame, scope);
      errors.addAll(scope.errors());

      List<ValidationFrame> children = scope.children();
      for (int i = children.size() - 1; i >= 0; i--) {
        stack.push(children.get(i));
      }
    }
    return errors;
  }

  private void evaluate(ValidationFrame frame, NodeScope scope) {
    SchemaNode schema = frame.schema();
    JsonValue instance = frame.instance();

    // null passes every constraint unless required, or unless the type itself asks for null
    if (instance instanceof JsonNull && !schema.admitsNull()) {
      if (schema.required()) {
        scope.fail(Keyword.REQUIRED, "Required value is missing or null");
      }
      return;
    }

    for (KeywordValidator validator : schema.pipeline()) {
      if (validator.appliesTo(instance)) {
        validator.validate(frame, scope);
      }
    }
  }
}
