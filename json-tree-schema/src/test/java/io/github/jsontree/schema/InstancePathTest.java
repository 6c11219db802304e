package io.github.jsontree.schema;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InstancePathTest {

  @Test
  void rootRendersEmpty() {
    assertThat(InstancePath.ROOT.isRoot()).isTrue();
    assertThat(InstancePath.ROOT.toString()).isEmpty();
    assertThat(InstancePath.ROOT.toJsonPointer()).isEmpty();
  }

  @Test
  void namesAndIndicesRenderDotted() {
    InstancePath path = InstancePath.ROOT.append("user").append("tags").append(1);
    assertThat(path.toString()).isEqualTo("user.tags[1]");
    assertThat(path).isEqualTo(InstancePath.of("user", "tags", 1));
    assertThat(InstancePath.of(0, "a", 2, 3).toString()).isEqualTo("[0].a[2][3]");
  }

  @Test
  void jsonPointerEscapesSpecialCharacters() {
    assertThat(InstancePath.of("a/b", "c~d", 0).toJsonPointer()).isEqualTo("/a~1b/c~0d/0");
  }

  @Test
  void appendLeavesOriginalUntouched() {
    InstancePath base = InstancePath.of("a");
    InstancePath child = base.append("b");
    assertThat(base.segments()).hasSize(1);
    assertThat(child.segments()).containsExactly(PathSegment.name("a"), PathSegment.name("b"));
  }

  @Test
  void invalidSegmentsAreRejected() {
    assertThatThrownBy(() -> PathSegment.index(-1)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> InstancePath.of(1.5)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void errorToStringShowsRootMarker() {
    var error = new ValidationError(InstancePath.ROOT, Keyword.TYPE, "Expected string, found integer");
    assertThat(error.toString()).isEqualTo("<root>: type: Expected string, found integer");
  }

  @Test
  void keywordsResolveBySchemaSpelling() {
    assertThat(Keyword.byName("additionalProperties")).contains(Keyword.ADDITIONAL_PROPERTIES);
    assertThat(Keyword.byName("extends")).contains(Keyword.EXTENDS);
    assertThat(Keyword.byName("AdditionalProperties")).isEmpty();
    for (Keyword keyword : Keyword.values()) {
      assertThat(Keyword.byName(keyword.jsonName())).contains(keyword);
    }
  }
}
