package io.github.jsontree.schema;

import java.util.List;

/// One compiled schema object.
///
/// @param pointer JSON Pointer of this node inside the root schema, e.g. `#/properties/a`
/// @param required `required: true` was declared
/// @param admitsNull the declared `type` names `null`, which disables the null short-circuit
/// @param pipeline the keyword validators of this node in evaluation order
record SchemaNode(String pointer, boolean required, boolean admitsNull, List<KeywordValidator> pipeline) {

  SchemaNode {
    pipeline = List.copyOf(pipeline);
  }
}
