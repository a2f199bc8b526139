package com.vigil.service.core.bridge;

import com.vigil.model.ObjectKind;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compiled configuration object as handed over by the configuration compiler.
 *
 * @param template abstract items are only inherited from, never activated
 * @param parents names of items of the same type whose attributes are inherited, in order
 * @param location source location used in validation messages
 */
public record ConfigItem(
        String type,
        String name,
        boolean template,
        List<String> parents,
        List<ConfigExpression> expressions,
        String location) {

    public ConfigItem {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("ConfigItem.type must be provided");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("ConfigItem.name must be provided");
        }
        parents = parents == null ? List.of() : List.copyOf(parents);
        expressions = expressions == null ? List.of() : List.copyOf(expressions);
    }

    /** {@code null} for types this engine does not materialize. */
    public ObjectKind kind() {
        return ObjectKind.fromTypeName(type);
    }

    public static ConfigItem of(String type, String name, Map<String, Object> properties) {
        return builder(type, name).properties(properties).build();
    }

    public static Builder builder(String type, String name) {
        return new Builder(type, name);
    }

    public static final class Builder {
        private final String type;
        private final String name;
        private boolean template;
        private final List<String> parents = new ArrayList<>();
        private final List<ConfigExpression> expressions = new ArrayList<>();
        private String location;

        private Builder(String type, String name) {
            this.type = type;
            this.name = name;
        }

        public Builder template(boolean template) {
            this.template = template;
            return this;
        }

        public Builder parent(String parent) {
            parents.add(parent);
            return this;
        }

        public Builder set(String key, Object value) {
            expressions.add(ConfigExpression.set(key, value));
            return this;
        }

        public Builder plus(String key, Object value) {
            expressions.add(ConfigExpression.plus(key, value));
            return this;
        }

        public Builder properties(Map<String, Object> properties) {
            if (properties != null) {
                new LinkedHashMap<>(properties).forEach(this::set);
            }
            return this;
        }

        public Builder location(String location) {
            this.location = location;
            return this;
        }

        public ConfigItem build() {
            return new ConfigItem(type, name, template, parents, expressions, location);
        }
    }
}
