package io.github.jsontree.schema;

import java.util.List;

/// The value of one `dependencies` entry.
sealed interface Dependency permits Dependency.OnProperties, Dependency.OnSchema {

  /// The named properties must also be present.
  record OnProperties(List<String> names) implements Dependency {
    public OnProperties {
      names = List.copyOf(names);
    }
  }

  /// The whole object must also satisfy the schema.
  record OnSchema(SchemaNode schema) implements Dependency {
  }
}
