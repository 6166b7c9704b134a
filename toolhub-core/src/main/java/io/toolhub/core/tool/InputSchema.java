package io.toolhub.core.tool;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Structural description of the arguments a tool accepts.
///
/// Mirrors the JSON Schema object servers publish for each tool: a top-level type,
/// the named properties and the required subset of them.
///
/// ### Contracts
/// - **Postcondition**: `properties` and `required` are unmodifiable copies
/// - Names in `required` may be missing from `properties`; lookups tolerate it
///
/// @param type schema type, usually `object`, not null
/// @param properties property name to property schema, not null (may be empty)
/// @param required names of required properties, not null (may be empty)
public record InputSchema(String type, Map<String, Object> properties, List<String> required) {

    private static final String OBJECT = "object";

    public InputSchema {
        type = type != null ? type : OBJECT;
        properties = properties != null ? copyOrdered(properties) : Map.of();
        required = required != null ? List.copyOf(required) : List.of();
    }

    /// Returns the schema used when a server publishes none.
    ///
    /// @return object schema without properties, never null
    public static InputSchema empty() {
        return new InputSchema(OBJECT, Map.of(), List.of());
    }

    /// Builds a schema from the raw JSON Schema map a server returned.
    ///
    /// Non-string entries of `required` and a non-map `properties` value are dropped.
    ///
    /// @param schema raw schema, may be null
    /// @return normalized schema, never null
    @SuppressWarnings("unchecked")
    public static InputSchema fromMap(Map<String, Object> schema) {
        if (schema == null || schema.isEmpty()) {
            return empty();
        }
        Object type = schema.get("type");
        Object properties = schema.get("properties");
        Map<String, Object> props =
                properties instanceof Map ? (Map<String, Object>) properties : Map.of();
        return new InputSchema(
                type != null ? type.toString() : OBJECT, props, extractRequired(schema));
    }

    /// Converts this schema back to its JSON Schema map form.
    ///
    /// @return new map with `type`, `properties` and `required`, never null
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("type", type);
        map.put("properties", properties);
        map.put("required", required);
        return map;
    }

    /// Returns whether the named property is required.
    ///
    /// @param name property name, not null
    /// @return true if listed in `required`
    public boolean isRequired(String name) {
        return required.contains(name);
    }

    /// Flattens the properties into parameter descriptors.
    ///
    /// Properties whose schema is not an object are skipped. A missing `type` defaults
    /// to `string`, a missing `description` to the empty string.
    ///
    /// @return parameter list in property order, never null
    @SuppressWarnings("unchecked")
    public List<Parameter> parameters() {
        List<Parameter> params = new ArrayList<>(properties.size());
        for (Map.Entry<String, Object> entry : properties.entrySet()) {
            if (!(entry.getValue() instanceof Map)) {
                continue;
            }
            Map<String, Object> paramSchema = (Map<String, Object>) entry.getValue();
            params.add(
                    new Parameter(
                            entry.getKey(),
                            getString(paramSchema, "type", "string"),
                            getString(paramSchema, "description", ""),
                            isRequired(entry.getKey()),
                            paramSchema.get("default")));
        }
        return List.copyOf(params);
    }

    private static List<String> extractRequired(Map<String, Object> schema) {
        Object required = schema.get("required");
        if (required instanceof List) {
            return ((List<?>) required)
                    .stream().filter(String.class::isInstance).map(String.class::cast).toList();
        }
        return List.of();
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static Map<String, Object> copyOrdered(Map<String, Object> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach(
                (key, value) -> {
                    if (key != null && value != null) {
                        copy.put(key, value);
                    }
                });
        return Collections.unmodifiableMap(copy);
    }

    /// Flattened view of one property.
    ///
    /// @param name property name, not null
    /// @param type property type (string, number, boolean, object, array), not null
    /// @param description human-readable description, not null
    /// @param required whether the property must be provided
    /// @param defaultValue default value, may be null
    public record Parameter(
            String name, String type, String description, boolean required, Object defaultValue) {

        public Parameter {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(type, "type must not be null");
            Objects.requireNonNull(description, "description must not be null");
        }
    }
}
