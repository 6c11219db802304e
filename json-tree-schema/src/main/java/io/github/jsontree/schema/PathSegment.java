package io.github.jsontree.schema;

import java.util.Objects;

/// One step into an instance: an object member name or an array index.
public sealed interface PathSegment permits PathSegment.Name, PathSegment.Index {

  static PathSegment name(String name) {
    return new Name(name);
  }

  static PathSegment index(int index) {
    return new Index(index);
  }

  /// An object member name.
  record Name(String name) implements PathSegment {
    public Name {
      Objects.requireNonNull(name, "name");
    }

    @Override
    public String toString() {
      return name;
    }
  }

  /// A zero-based array index.
  record Index(int index) implements PathSegment {
    public Index {
      if (index < 0) {
        throw new IllegalArgumentException("index must be >= 0: " + index);
      }
    }

    @Override
    public String toString() {
      return Integer.toString(index);
    }
  }
}
