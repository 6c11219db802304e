package io.github.jsontree.schema;

import io.github.jsontree.JsonValue;

/// A validator for one keyword or keyword family of a schema node.
///
/// Implementations are immutable records built by [SchemaCompiler]. They
/// report failures and schedule child frames through the [NodeScope];
/// they never recurse directly.
sealed interface KeywordValidator
    permits TypeKeyword, EnumKeyword, StringKeywords, NumberKeywords,
    ObjectKeywords, ArrayKeywords, CompositionKeywords {

  /// Kind gate: keywords for other kinds of value pass vacuously.
  default boolean appliesTo(JsonValue instance) {
    return true;
  }

  void validate(ValidationFrame frame, NodeScope scope);
}
