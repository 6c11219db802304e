package io.github.jsontree.schema;

import io.github.jsontree.JsonValue;

import java.util.List;

/// `type` and `disallow`: the instance must match one of `allowed` (when
/// declared) and none of `disallowed`.
record TypeKeyword(List<JsonType> allowed, List<JsonType> disallowed) implements KeywordValidator {

  TypeKeyword {
    allowed = List.copyOf(allowed);
    disallowed = List.copyOf(disallowed);
  }

  @Override
  public void validate(ValidationFrame frame, NodeScope scope) {
    JsonValue instance = frame.instance();

    if (!allowed.isEmpty() && allowed.stream().noneMatch(type -> type.matches(instance))) {
      String expected = allowed.size() == 1 ? allowed.get(0).toString() : "one of " + allowed;
      scope.fail(Keyword.TYPE, "Expected " + expected + ", found " + JsonType.describe(instance));
    }

    for (JsonType type : disallowed) {
      if (type.matches(instance)) {
        scope.fail(Keyword.DISALLOW, "Type " + type + " is disallowed");
        break;
      }
    }
  }
}
