package com.vigil.service.core.bridge;

import com.vigil.model.ObjectKind;
import com.vigil.service.core.model.Attributes;
import com.vigil.service.core.registry.EntityRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Validation hook for attribute maps that reference services: inline service declarations of hosts,
 * and any other attribute the compiler routes here.
 *
 * <p>Each entry references a service by its scalar value, by the {@code service} key of a map value,
 * or by its own key when the map has none. Every reference that resolves to no service produces one
 * error for the compiler; compilation continues.
 */
@Component
public class ServiceDescriptionValidator {

    private final ConfigItemStore store;
    private final EntityRegistry registry;
    private final ConfigErrorReporter reporter;

    public ServiceDescriptionValidator(ConfigItemStore store, EntityRegistry registry, ConfigErrorReporter reporter) {
        this.store = store;
        this.registry = registry;
        this.reporter = reporter;
    }

    /**
     * Entry point for ad-hoc calls from the compiler's expression evaluator: {@code (location, attrs)}.
     *
     * @throws InvalidConfigurationException when an argument is missing or the second is not a map
     */
    @SuppressWarnings("unchecked")
    public List<ConfigValidationError> validate(List<?> arguments) {
        if (arguments == null || arguments.isEmpty()) {
            throw new InvalidConfigurationException("Missing argument: Location must be specified.");
        }
        if (arguments.size() < 2) {
            throw new InvalidConfigurationException("Missing argument: Attribute dictionary must be specified.");
        }
        String location = String.valueOf(arguments.get(0));
        Object attrs = arguments.get(1);
        if (attrs != null && !(attrs instanceof Map<?, ?>)) {
            throw new InvalidConfigurationException("Attribute dictionary must be a dictionary.", location);
        }
        return validateServiceDictionary(location, (Map<String, Object>) attrs);
    }

    public List<ConfigValidationError> validateServiceDictionary(String location, Map<String, Object> attrs) {
        if (attrs == null || attrs.isEmpty()) {
            return List.of();
        }
        List<ConfigValidationError> errors = new ArrayList<>();
        for (Map.Entry<String, Object> entry : attrs.entrySet()) {
            String name = referencedName(entry.getKey(), entry.getValue());
            if (name == null) {
                continue;
            }
            if (!serviceExists(name)) {
                ConfigValidationError error = new ConfigValidationError(
                        location, "Validation failed for " + location + ": Service '" + name + "' not found.", false);
                reporter.report(error);
                errors.add(error);
            }
        }
        return errors;
    }

    private static String referencedName(String key, Object value) {
        if (ConfigChangeBridge.isScalar(value)) {
            return String.valueOf(value);
        }
        if (value instanceof Map<?, ?> map) {
            Object service = map.get(Attributes.SERVICE);
            return service != null ? String.valueOf(service) : key;
        }
        return null;
    }

    private boolean serviceExists(String name) {
        return store.exists(ObjectKind.SERVICE.typeName(), name) || registry.serviceExists(name);
    }
}
