package io.github.jsontree.schema;

import java.util.List;

import static io.github.jsontree.schema.SchemaLogging.LOG;

/// Composition operators: `allOf`, `extends`, `anyOf`, `oneOf` and `not`.
///
/// Each list is `null` when its keyword is absent. `allOf` and `extends`
/// contribute the errors of every sub-schema to the main result; `anyOf`,
/// `oneOf` and `not` evaluate isolated branches and report a single
/// summary error.
record CompositionKeywords(
    List<SchemaNode> allOf,
    List<SchemaNode> extendsSchemas,
    List<SchemaNode> anyOf,
    List<SchemaNode> oneOf,
    List<SchemaNode> not
) implements KeywordValidator {

  CompositionKeywords {
    allOf = copyOrNull(allOf);
    extendsSchemas = copyOrNull(extendsSchemas);
    anyOf = copyOrNull(anyOf);
    oneOf = copyOrNull(oneOf);
    not = copyOrNull(not);
  }

  private static List<SchemaNode> copyOrNull(List<SchemaNode> schemas) {
    return schemas == null ? null : List.copyOf(schemas);
  }

  @Override
  public void validate(ValidationFrame frame, NodeScope scope) {
    if (allOf != null) {
      allOf.forEach(schema -> scope.descend(frame.path(), schema, frame.instance()));
    }
    if (extendsSchemas != null) {
      extendsSchemas.forEach(schema -> scope.descend(frame.path(), schema, frame.instance()));
    }

    if (anyOf != null) {
      boolean anyValid = false;
      for (SchemaNode schema : anyOf) {
        LOG.finest(() -> "anyOf BRANCH: " + schema.pointer());
        if (scope.branch(schema).isEmpty()) {
          anyValid = true;
          break;
        }
      }
      if (!anyValid) {
        scope.fail(Keyword.ANY_OF, "Value does not match any of the " + anyOf.size() + " anyOf alternatives");
      }
    }

    if (oneOf != null) {
      int validCount = 0;
      for (SchemaNode schema : oneOf) {
        LOG.finest(() -> "oneOf BRANCH: " + schema.pointer());
        if (scope.branch(schema).isEmpty()) {
          validCount++;
        }
      }
      if (validCount == 0) {
        scope.fail(Keyword.ONE_OF, "Value matches none of the " + oneOf.size() + " oneOf alternatives, expected exactly one");
      } else if (validCount > 1) {
        scope.fail(Keyword.ONE_OF, "Value matches " + validCount + " of the " + oneOf.size()
            + " oneOf alternatives, expected exactly one");
      }
    }

    if (not != null) {
      boolean matched = true;
      for (SchemaNode schema : not) {
        if (!scope.branch(schema).isEmpty()) {
          matched = false;
          break;
        }
      }
      if (matched) {
        scope.fail(Keyword.NOT, "Schema should not match");
      }
    }
  }
}
