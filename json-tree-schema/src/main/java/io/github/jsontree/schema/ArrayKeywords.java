package io.github.jsontree.schema;

import io.github.jsontree.JsonArray;
import io.github.jsontree.JsonValue;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/// Array schema with item validation and constraints.
///
/// At most one of `items` (one schema for every element) and `tupleItems`
/// (positional schemas) is set. `additionalItems` governs the elements past
/// the end of `tupleItems` and is ignored otherwise.
record ArrayKeywords(
    SchemaNode items,
    List<SchemaNode> tupleItems,
    AdditionalPolicy additionalItems,
    Integer minItems,
    Integer maxItems,
    boolean exclusiveMinimum,
    boolean exclusiveMaximum,
    boolean uniqueItems
) implements KeywordValidator {

  ArrayKeywords {
    if (items != null && tupleItems != null) {
      throw new IllegalArgumentException("items and tupleItems are mutually exclusive");
    }
    tupleItems = tupleItems == null ? null : List.copyOf(tupleItems);
  }

  @Override
  public boolean appliesTo(JsonValue instance) {
    return instance instanceof JsonArray;
  }

  @Override
  public void validate(ValidationFrame frame, NodeScope scope) {
    List<JsonValue> elements = ((JsonArray) frame.instance()).elements();
    InstancePath path = frame.path();
    int itemCount = elements.size();

    if (minItems != null && (exclusiveMinimum ? itemCount <= minItems : itemCount < minItems)) {
      scope.fail(Keyword.MIN_ITEMS, "Too few items: " + itemCount + ", expected "
          + (exclusiveMinimum ? "more than " : "at least ") + minItems);
    }
    if (maxItems != null && (exclusiveMaximum ? itemCount >= maxItems : itemCount > maxItems)) {
      scope.fail(Keyword.MAX_ITEMS, "Too many items: " + itemCount + ", expected "
          + (exclusiveMaximum ? "fewer than " : "at most ") + maxItems);
    }

    if (uniqueItems) {
      // JsonValue equality is structural and its hash codes agree with it
      Map<JsonValue, Integer> firstSeen = new HashMap<>();
      for (int i = 0; i < itemCount; i++) {
        Integer first = firstSeen.putIfAbsent(elements.get(i), i);
        if (first != null) {
          scope.fail(Keyword.UNIQUE_ITEMS, "Array items must be unique: item " + i + " duplicates item " + first);
        }
      }
    }

    if (items != null) {
      for (int i = 0; i < itemCount; i++) {
        scope.descend(path.append(i), items, elements.get(i));
      }
    } else if (tupleItems != null) {
      for (int i = 0; i < itemCount; i++) {
        InstancePath itemPath = path.append(i);
        if (i < tupleItems.size()) {
          scope.descend(itemPath, tupleItems.get(i), elements.get(i));
        } else if (additionalItems instanceof AdditionalPolicy.Denied) {
          scope.fail(itemPath, Keyword.ADDITIONAL_ITEMS,
              "Additional item not allowed: only " + tupleItems.size() + " item(s) are declared");
        } else if (additionalItems instanceof AdditionalPolicy.Constrained constrained) {
          scope.descend(itemPath, constrained.schema(), elements.get(i));
        }
      }
    }
  }
}
