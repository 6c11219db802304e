package io.github.jsontree.schema;

import io.github.jsontree.JsonValue;

/// Validation frame for stack-based processing
record ValidationFrame(InstancePath path, SchemaNode schema, JsonValue instance) {
}
