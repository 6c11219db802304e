package io.github.jsontree.schema;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/// How residual object members or array elements are treated by
/// `additionalProperties` and `additionalItems`.
sealed interface AdditionalPolicy
    permits AdditionalPolicy.Allowed, AdditionalPolicy.Denied, AdditionalPolicy.AllowList, AdditionalPolicy.Constrained {

  Allowed ALLOW = new Allowed();
  Denied DENY = new Denied();

  /// `true`: anything goes
  record Allowed() implements AdditionalPolicy {
  }

  /// `false`: every residual entry is an error
  record Denied() implements AdditionalPolicy {
  }

  /// A list of names: residual member names must be in the list
  record AllowList(Set<String> names) implements AdditionalPolicy {
    public AllowList {
      names = Collections.unmodifiableSet(new LinkedHashSet<>(names));
    }
  }

  /// A sub-schema every residual entry must satisfy
  record Constrained(SchemaNode schema) implements AdditionalPolicy {
  }
}
