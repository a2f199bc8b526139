package com.vigil.service.core.bridge;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

/** Committed config items, templates included, keyed by type and name. */
@Component
public class ConfigItemStore {

    private final ConcurrentMap<Key, ConfigItem> items = new ConcurrentHashMap<>();

    public void put(ConfigItem item) {
        items.put(Key.of(item.type(), item.name()), item);
    }

    public Optional<ConfigItem> find(String type, String name) {
        if (type == null || name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(items.get(Key.of(type, name)));
    }

    public boolean exists(String type, String name) {
        return find(type, name).isPresent();
    }

    public Optional<ConfigItem> remove(String type, String name) {
        return Optional.ofNullable(items.remove(Key.of(type, name)));
    }

    public int size() {
        return items.size();
    }

    /**
     * Evaluates {@code item} into its effective attributes: parents first (recursively, in declaration
     * order), then the item's own expressions.
     *
     * @throws InvalidConfigurationException when a parent does not exist or parents form a cycle
     */
    public Map<String, Object> evaluate(ConfigItem item) {
        return evaluate(item, new LinkedHashSet<>());
    }

    private Map<String, Object> evaluate(ConfigItem item, Set<String> visiting) {
        if (!visiting.add(item.name())) {
            throw new InvalidConfigurationException(
                    "Inheritance cycle for " + item.type() + " '" + item.name() + "'", item.location());
        }
        Map<String, Object> result = new LinkedHashMap<>();
        for (String parentName : item.parents()) {
            ConfigItem parent = find(item.type(), parentName)
                    .orElseThrow(() -> new InvalidConfigurationException(
                            "Parent object '" + parentName + "' of " + item.type() + " '" + item.name()
                                    + "' does not exist.",
                            item.location()));
            result.putAll(evaluate(parent, visiting));
        }
        for (ConfigExpression expression : item.expressions()) {
            if (expression.key() == null) {
                continue;
            }
            switch (expression.operator()) {
                case SET -> result.put(expression.key(), expression.value());
                case PLUS -> result.put(expression.key(), merge(result.get(expression.key()), expression.value()));
            }
        }
        visiting.remove(item.name());
        return result;
    }

    @SuppressWarnings("unchecked")
    static Object merge(Object inherited, Object value) {
        if (inherited == null) {
            return value;
        }
        if (value == null) {
            return inherited;
        }
        if (inherited instanceof Map<?, ?> base && value instanceof Map<?, ?> add) {
            Map<Object, Object> merged = new LinkedHashMap<>((Map<Object, Object>) base);
            merged.putAll((Map<Object, Object>) add);
            return merged;
        }
        if (inherited instanceof Collection<?> base && value instanceof Collection<?> add) {
            Set<Object> merged = new LinkedHashSet<>(base);
            merged.addAll(add);
            return new ArrayList<>(merged);
        }
        return value;
    }

    private record Key(String type, String name) {
        static Key of(String type, String name) {
            return new Key(type.toLowerCase(Locale.ROOT), name);
        }
    }
}
