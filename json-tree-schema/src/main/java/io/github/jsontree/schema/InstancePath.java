package io.github.jsontree.schema;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// The location of a value inside the validated instance.
///
/// Paths are immutable; [#append] returns a new path. `toString()` renders
/// the dotted form used in messages, `user.tags[1]`, with the root as the
/// empty string.
public record InstancePath(List<PathSegment> segments) {

  public static final InstancePath ROOT = new InstancePath(List.of());

  public InstancePath {
    segments = List.copyOf(segments);
  }

  public static InstancePath of(Object... segments) {
    InstancePath path = ROOT;
    for (Object segment : segments) {
      if (segment instanceof Integer index) {
        path = path.append(index);
      } else if (segment instanceof String name) {
        path = path.append(name);
      } else {
        throw new IllegalArgumentException("Path segments must be String or Integer: " + segment);
      }
    }
    return path;
  }

  public InstancePath append(String name) {
    return append(PathSegment.name(name));
  }

  public InstancePath append(int index) {
    return append(PathSegment.index(index));
  }

  public InstancePath append(PathSegment segment) {
    Objects.requireNonNull(segment, "segment");
    List<PathSegment> extended = new ArrayList<>(segments.size() + 1);
    extended.addAll(segments);
    extended.add(segment);
    return new InstancePath(extended);
  }

  public boolean isRoot() {
    return segments.isEmpty();
  }

  /// {@return this path as an RFC 6901 JSON Pointer, `""` for the root}
  public String toJsonPointer() {
    StringBuilder sb = new StringBuilder();
    for (PathSegment segment : segments) {
      sb.append('/').append(segment.toString().replace("~", "~0").replace("/", "~1"));
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (PathSegment segment : segments) {
      if (segment instanceof PathSegment.Index index) {
        sb.append('[').append(index.index()).append(']');
      } else {
        if (sb.length() > 0) {
          sb.append('.');
        }
        sb.append(segment);
      }
    }
    return sb.toString();
  }
}
