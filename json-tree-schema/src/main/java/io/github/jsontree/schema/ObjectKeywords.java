package io.github.jsontree.schema;

import io.github.jsontree.JsonNull;
import io.github.jsontree.JsonObject;
import io.github.jsontree.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/// Object schema: properties, pattern properties, additional properties,
/// dependencies, required names and member count.
record ObjectKeywords(
    Map<String, SchemaNode> properties,
    List<PatternProperty> patternProperties,
    AdditionalPolicy additionalProperties,
    List<String> requiredNames,
    Map<String, Dependency> dependencies,
    Integer minProperties,
    Integer maxProperties
) implements KeywordValidator {

  /// A `patternProperties` entry
  record PatternProperty(Pattern pattern, SchemaNode schema) {
  }

  ObjectKeywords {
    // declaration order drives the order of child frames, so keep it
    properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    patternProperties = List.copyOf(patternProperties);
    requiredNames = List.copyOf(requiredNames);
    dependencies = Collections.unmodifiableMap(new LinkedHashMap<>(dependencies));
  }

  @Override
  public boolean appliesTo(JsonValue instance) {
    return instance instanceof JsonObject;
  }

  @Override
  public void validate(ValidationFrame frame, NodeScope scope) {
    Map<String, JsonValue> members = ((JsonObject) frame.instance()).members();
    InstancePath path = frame.path();

    int count = members.size();
    if (minProperties != null && count < minProperties) {
      scope.fail(Keyword.MIN_PROPERTIES, "Too few properties: " + count + ", expected at least " + minProperties);
    }
    if (maxProperties != null && count > maxProperties) {
      scope.fail(Keyword.MAX_PROPERTIES, "Too many properties: " + count + ", expected at most " + maxProperties);
    }

    for (String name : requiredNames) {
      // a declared property that is itself required reports the miss
      SchemaNode declared = properties.get(name);
      boolean selfReported = declared != null && declared.required() && !declared.admitsNull();
      if (!members.containsKey(name) && !selfReported) {
        scope.fail(path.append(name), Keyword.REQUIRED, "Missing required property: " + name);
      }
    }

    // absent members are checked as null so the child's required flag decides
    properties.forEach((name, schema) ->
        scope.descend(path.append(name), schema, members.getOrDefault(name, JsonNull.of())));

    for (var entry : members.entrySet()) {
      String name = entry.getKey();
      JsonValue value = entry.getValue();
      boolean covered = properties.containsKey(name);

      for (PatternProperty patternProperty : patternProperties) {
        if (patternProperty.pattern().matcher(name).find()) {
          scope.descend(path.append(name), patternProperty.schema(), value);
          covered = true;
        }
      }

      if (!covered) {
        additional(scope, path.append(name), name, value);
      }
    }

    dependencies.forEach((trigger, dependency) -> {
      if (!members.containsKey(trigger)) {
        return;
      }
      if (dependency instanceof Dependency.OnProperties onProperties) {
        for (String name : onProperties.names()) {
          if (!members.containsKey(name)) {
            scope.fail(Keyword.DEPENDENCIES, "Property '" + trigger + "' requires property '" + name + "'");
          }
        }
      } else if (dependency instanceof Dependency.OnSchema onSchema) {
        scope.descend(path, onSchema.schema(), frame.instance());
      }
    });
  }

  private void additional(NodeScope scope, InstancePath memberPath, String name, JsonValue value) {
    if (additionalProperties instanceof AdditionalPolicy.Denied) {
      scope.fail(memberPath, Keyword.ADDITIONAL_PROPERTIES, "Additional property not allowed: " + name);
    } else if (additionalProperties instanceof AdditionalPolicy.AllowList allowList) {
      if (!allowList.names().contains(name)) {
        scope.fail(memberPath, Keyword.ADDITIONAL_PROPERTIES,
            "Additional property not allowed: " + name + " is not one of " + allowList.names());
      }
    } else if (additionalProperties instanceof AdditionalPolicy.Constrained constrained) {
      scope.descend(memberPath, constrained.schema(), value);
    }
  }
}
