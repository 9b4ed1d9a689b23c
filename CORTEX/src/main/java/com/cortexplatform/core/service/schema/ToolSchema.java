package com.cortexplatform.core.service.schema;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Argument schema of a tool, a small subset of JSON Schema: typed top-level properties,
 * required properties, enumerations and the {@code additionalProperties} switch.
 */
public final class ToolSchema {

    public enum JsonType {
        STRING("string"),
        INTEGER("integer"),
        NUMBER("number"),
        BOOLEAN("boolean"),
        OBJECT("object"),
        ARRAY("array");

        private final String jsonName;

        JsonType(String jsonName) {
            this.jsonName = jsonName;
        }

        public String jsonName() {
            return jsonName;
        }

        boolean accepts(Object value) {
            return switch (this) {
                case STRING -> value instanceof CharSequence;
                case INTEGER -> isIntegral(value);
                case NUMBER -> value instanceof Number;
                case BOOLEAN -> value instanceof Boolean;
                case OBJECT -> value instanceof Map;
                case ARRAY -> value instanceof Collection || (value != null && value.getClass().isArray());
            };
        }

        private static boolean isIntegral(Object value) {
            if (value instanceof Integer || value instanceof Long || value instanceof Short
                    || value instanceof Byte || value instanceof BigInteger) {
                return true;
            }
            if (value instanceof Double d) {
                return !d.isInfinite() && d == Math.rint(d);
            }
            if (value instanceof BigDecimal bd) {
                return bd.stripTrailingZeros().scale() <= 0;
            }
            return false;
        }
    }

    private record Property(JsonType type, String description, List<Object> allowedValues) {
    }

    private static final ToolSchema EMPTY = builder().build();

    private final Map<String, Property> properties;
    private final Set<String> required;
    private final boolean additionalProperties;

    private ToolSchema(Builder builder) {
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(builder.properties));
        this.required = Collections.unmodifiableSet(new LinkedHashSet<>(builder.required));
        this.additionalProperties = builder.additionalProperties;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Schema for tools without arguments: accepts only an empty argument map.
     */
    public static ToolSchema empty() {
        return EMPTY;
    }

    /**
     * Check arguments against this schema. A {@code null} value counts as absent.
     *
     * @param arguments the arguments to check
     * @return human-readable violations, empty when the arguments are valid
     */
    public List<String> validate(Map<String, Object> arguments) {
        Map<String, Object> args = arguments != null ? arguments : Map.of();
        List<String> violations = new ArrayList<>();

        for (String name : required) {
            if (args.get(name) == null) {
                violations.add("missing required property '" + name + "'");
            }
        }

        for (Map.Entry<String, Object> entry : args.entrySet()) {
            String name = entry.getKey();
            Object value = entry.getValue();
            Property property = properties.get(name);
            if (property == null) {
                if (!additionalProperties) {
                    violations.add("unexpected property '" + name + "'");
                }
                continue;
            }
            if (value == null) {
                continue;
            }
            if (!property.type().accepts(value)) {
                violations.add("property '" + name + "' must be of type " + property.type().jsonName());
            } else if (!property.allowedValues().isEmpty() && !property.allowedValues().contains(value)) {
                violations.add("property '" + name + "' must be one of " + property.allowedValues());
            }
        }
        return violations;
    }

    /**
     * Render as a JSON Schema document.
     */
    public Map<String, Object> toJsonSchema() {
        Map<String, Object> props = new LinkedHashMap<>();
        properties.forEach((name, property) -> {
            Map<String, Object> p = new LinkedHashMap<>();
            p.put("type", property.type().jsonName());
            if (property.description() != null) {
                p.put("description", property.description());
            }
            if (!property.allowedValues().isEmpty()) {
                p.put("enum", property.allowedValues());
            }
            props.put(name, p);
        });

        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", props);
        schema.put("required", List.copyOf(required));
        schema.put("additionalProperties", additionalProperties);
        return schema;
    }

    public static final class Builder {

        private final Map<String, Property> properties = new LinkedHashMap<>();
        private final Set<String> required = new LinkedHashSet<>();
        private boolean additionalProperties = false;

        private Builder() {
        }

        public Builder property(String name, JsonType type, String description) {
            properties.put(name, new Property(type, description, List.of()));
            return this;
        }

        public Builder required(String name, JsonType type, String description) {
            property(name, type, description);
            required.add(name);
            return this;
        }

        public Builder enumProperty(String name, String description, boolean isRequired, String... values) {
            properties.put(name, new Property(JsonType.STRING, description, List.of((Object[]) values)));
            if (isRequired) {
                required.add(name);
            }
            return this;
        }

        public Builder additionalProperties(boolean allowed) {
            this.additionalProperties = allowed;
            return this;
        }

        public ToolSchema build() {
            return new ToolSchema(this);
        }
    }
}
