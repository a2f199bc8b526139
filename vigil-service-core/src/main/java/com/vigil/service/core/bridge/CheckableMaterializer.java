package com.vigil.service.core.bridge;

import com.vigil.model.ObjectKind;
import com.vigil.service.core.model.Attributes;
import com.vigil.service.core.model.Checkable;
import com.vigil.service.core.model.Host;
import com.vigil.service.core.model.Service;
import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Converts evaluated config attributes into entity state. Attributes missing from the map are reset to
 * their defaults, so re-applying a new commit replaces the previous one completely.
 */
@Component
public class CheckableMaterializer {

    public Checkable create(ObjectKind kind, String name, Map<String, Object> properties, String location) {
        Checkable checkable = switch (kind) {
            case HOST -> new Host(name);
            case SERVICE -> new Service(name, requireHostName(name, properties, location));
        };
        apply(checkable, properties, location);
        return checkable;
    }

    public void apply(Checkable checkable, Map<String, Object> properties, String location) {
        Map<String, Object> props = properties == null ? Map.of() : properties;

        checkable.setMacros(toMap(props.get(Attributes.MACROS)));
        checkable.setCheckInterval(toDuration(props.get(Attributes.CHECK_INTERVAL), Attributes.CHECK_INTERVAL, location));
        checkable.setRetryInterval(toDuration(props.get(Attributes.RETRY_INTERVAL), Attributes.RETRY_INTERVAL, location));
        checkable.setCheckers(toNames(props.get(Attributes.CHECKERS)));
        checkable.setHostDependencies(toDependencies(props.get(Attributes.HOST_DEPENDENCIES)));
        checkable.setServiceDependencies(toDependencies(props.get(Attributes.SERVICE_DEPENDENCIES)));
        Object enableFlapping = props.get(Attributes.ENABLE_FLAPPING);
        checkable.setEnableFlapping(enableFlapping == null || toBoolean(enableFlapping));
        checkable.setFlappingThresholdLow(
                toDouble(props.get(Attributes.FLAPPING_THRESHOLD_LOW), Attributes.FLAPPING_THRESHOLD_LOW, location));
        checkable.setFlappingThresholdHigh(
                toDouble(props.get(Attributes.FLAPPING_THRESHOLD_HIGH), Attributes.FLAPPING_THRESHOLD_HIGH, location));

        if (checkable instanceof Host host) {
            host.setAlias(toStringValue(props.get(Attributes.ALIAS)));
            host.setGroups(toNames(props.get(Attributes.HOST_GROUPS)));
            host.setHostCheck(toStringValue(props.get(Attributes.HOST_CHECK)));
            host.setHostChecks(toNames(props.get(Attributes.HOST_CHECKS)));
            host.setServiceDescriptions(toMap(props.get(Attributes.SERVICES)));
        } else if (checkable instanceof Service service) {
            String hostName = requireHostName(service.getName(), props, location);
            if (!hostName.equals(service.getHostName())) {
                service.setHostName(hostName);
            }
            service.setAlias(toStringValue(props.get(Attributes.ALIAS)));
            service.setGroups(toNames(props.get(Attributes.SERVICE_GROUPS)));
        }
    }

    private static String requireHostName(String serviceName, Map<String, Object> props, String location) {
        String hostName = props == null ? null : toStringValue(props.get(Attributes.HOST_NAME));
        if (hostName == null || hostName.isBlank()) {
            throw new InvalidConfigurationException(
                    "Service '" + serviceName + "' must declare " + Attributes.HOST_NAME, location);
        }
        return hostName;
    }

    static String toStringValue(Object value) {
        return value == null ? null : String.valueOf(value);
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> toMap(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            ((Map<Object, Object>) map).forEach((k, v) -> {
                if (k != null) {
                    copy.put(String.valueOf(k), v);
                }
            });
            return copy;
        }
        return Map.of();
    }

    /** Names from a scalar, a collection, or the values of a map. */
    static Set<String> toNames(Object value) {
        Set<String> names = new LinkedHashSet<>();
        if (value == null) {
            return names;
        }
        Collection<?> source;
        if (value instanceof Map<?, ?> map) {
            source = map.values();
        } else if (value instanceof Collection<?> collection) {
            source = collection;
        } else {
            source = Set.of(value);
        }
        for (Object element : source) {
            if (element != null) {
                names.add(String.valueOf(element));
            }
        }
        return names;
    }

    /** Dependency maps are keyed by the referenced name; a collection declares names without metadata. */
    @SuppressWarnings("unchecked")
    static Map<String, Map<String, Object>> toDependencies(Object value) {
        Map<String, Map<String, Object>> dependencies = new LinkedHashMap<>();
        if (value instanceof Map<?, ?> map) {
            ((Map<Object, Object>) map).forEach((k, v) -> {
                if (k != null) {
                    dependencies.put(String.valueOf(k), toMap(v));
                }
            });
        } else if (value instanceof Collection<?> collection) {
            for (Object element : collection) {
                if (element != null) {
                    dependencies.put(String.valueOf(element), Map.of());
                }
            }
        }
        return dependencies;
    }

    /** Numbers are seconds; strings are ISO-8601 durations or seconds. */
    static Duration toDuration(Object value, String attribute, String location) {
        if (value == null) {
            return null;
        }
        if (value instanceof Duration duration) {
            return duration;
        }
        if (value instanceof Number number) {
            return Duration.ofMillis(Math.round(number.doubleValue() * 1000.0));
        }
        String text = String.valueOf(value).trim();
        try {
            if (text.startsWith("P") || text.startsWith("p")) {
                return Duration.parse(text);
            }
            return Duration.ofMillis(Math.round(Double.parseDouble(text) * 1000.0));
        } catch (RuntimeException ex) {
            throw new InvalidConfigurationException("Invalid duration for " + attribute + ": '" + text + "'", location);
        }
    }

    static Double toDouble(Object value, String attribute, String location) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        String text = String.valueOf(value).trim();
        try {
            return Double.valueOf(text);
        } catch (NumberFormatException ex) {
            throw new InvalidConfigurationException("Invalid number for " + attribute + ": '" + text + "'", location);
        }
    }

    static boolean toBoolean(Object value) {
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof Number number) {
            return number.intValue() != 0;
        }
        return Boolean.parseBoolean(String.valueOf(value).trim());
    }
}
