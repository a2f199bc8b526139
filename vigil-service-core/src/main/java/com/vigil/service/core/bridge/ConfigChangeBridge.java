package com.vigil.service.core.bridge;

import com.vigil.model.ObjectKind;
import com.vigil.service.core.bridge.ConfigObjectActivator.PreparedItem;
import com.vigil.service.core.cache.CommentCache;
import com.vigil.service.core.cache.DowntimeCache;
import com.vigil.service.core.cache.HostGroupMembersCache;
import com.vigil.service.core.cache.ServiceCache;
import com.vigil.service.core.model.Attributes;
import com.vigil.service.core.model.Checkable;
import com.vigil.service.core.model.Host;
import com.vigil.service.core.registry.EntityRegistry;
import com.vigil.service.core.registry.EntityRegistryListener;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Keeps derived objects and caches consistent with configuration changes.
 *
 * <p>On host commit the host's inline service declarations are turned into convenience services. The
 * new generation is evaluated and committed first, then services of the previous generation missing
 * from it are unregistered, then the new name set is stored on the host. A declaration that fails to
 * evaluate is reported to the {@link ConfigErrorReporter} and the previous generation stays in place.
 */
@Slf4j
@Service
public class ConfigChangeBridge implements EntityRegistryListener {

    /** Attributes copied from the host, then from a per-service override map, onto each service. */
    private static final List<String> MERGED_ATTRIBUTES = List.of(Attributes.MACROS, Attributes.SERVICE_GROUPS);

    private static final List<String> REPLACED_ATTRIBUTES =
            List.of(Attributes.CHECK_INTERVAL, Attributes.RETRY_INTERVAL, Attributes.CHECKERS);

    private final EntityRegistry registry;
    private final ConfigItemStore store;
    private final ConfigObjectActivator activator;
    private final ServiceCache serviceCache;
    private final HostGroupMembersCache hostGroupMembersCache;
    private final DowntimeCache downtimeCache;
    private final CommentCache commentCache;
    private final ConfigErrorReporter errorReporter;
    private final ReentrantLock commitLock = new ReentrantLock();

    public ConfigChangeBridge(
            EntityRegistry registry,
            ConfigItemStore store,
            ConfigObjectActivator activator,
            ServiceCache serviceCache,
            HostGroupMembersCache hostGroupMembersCache,
            DowntimeCache downtimeCache,
            CommentCache commentCache,
            ConfigErrorReporter errorReporter) {
        this.registry = registry;
        this.store = store;
        this.activator = activator;
        this.serviceCache = serviceCache;
        this.hostGroupMembersCache = hostGroupMembersCache;
        this.downtimeCache = downtimeCache;
        this.commentCache = commentCache;
        this.errorReporter = errorReporter;
        registry.addListener(this);
    }

    @EventListener
    public void onObjectCommitted(ObjectCommittedEvent event) {
        if (event.kind() != ObjectKind.HOST) {
            return;
        }
        // templates have no entity
        Optional<Host> maybeHost = registry.findHost(event.name());
        if (maybeHost.isEmpty()) {
            return;
        }
        Host host = maybeHost.get();

        commitLock.lock();
        try {
            // removed while waiting for the lock
            if (!registry.isRegistered(host)) {
                log.debug("Host '{}' no longer registered, skipping convenience services", host.getName());
                return;
            }

            List<PreparedItem> prepared = new ArrayList<>();
            try {
                for (ConfigItem item : buildConvenienceServices(host, event.location())) {
                    prepared.add(activator.prepare(item));
                }
            } catch (InvalidConfigurationException e) {
                errorReporter.report(new ConfigValidationError(
                        e.location() == null ? event.location() : e.location(), e.reason(), false));
                log.warn(
                        "Host '{}' keeps its previous {} convenience services: {}",
                        host.getName(),
                        host.getConvenienceServices().size(),
                        e.getMessage());
                return;
            }

            Map<String, PreparedItem> newServices = new LinkedHashMap<>();
            for (PreparedItem item : prepared) {
                activator.activate(item);
                newServices.put(item.item().name(), item);
            }

            int removed = 0;
            for (String oldService : host.getConvenienceServices()) {
                if (!newServices.containsKey(oldService)) {
                    activator.unregister(ObjectKind.SERVICE.typeName(), oldService);
                    removed++;
                }
            }

            host.setConvenienceServices(newServices.keySet());
            log.info(
                    "Host '{}' committed: {} convenience services active, {} removed",
                    host.getName(),
                    newServices.size(),
                    removed);
        } finally {
            commitLock.unlock();
        }
    }

    @EventListener
    public void onObjectRemoved(ObjectRemovedEvent event) {
        if (event.kind() == ObjectKind.HOST && event.object() instanceof Host host) {
            removeConvenienceServices(host);
        }
    }

    /** Catches services a commit registered after the removal event but before the host left the registry. */
    @Override
    public void onUnregistered(Checkable checkable) {
        if (checkable instanceof Host host) {
            removeConvenienceServices(host);
        }
    }

    private void removeConvenienceServices(Host host) {
        commitLock.lock();
        try {
            Set<String> services = host.getConvenienceServices();
            if (services.isEmpty()) {
                return;
            }
            for (String service : services) {
                activator.unregister(ObjectKind.SERVICE.typeName(), service);
            }
            host.setConvenienceServices(Set.of());
            log.info("Host '{}' removed together with {} convenience services", host.getName(), services.size());
        } finally {
            commitLock.unlock();
        }
    }

    @Override
    public void onAttributeChanged(Checkable checkable, String attribute) {
        switch (attribute) {
            case Attributes.HOST_GROUPS -> hostGroupMembersCache.invalidate();
            case Attributes.HOST_NAME -> serviceCache.invalidate();
            case Attributes.DOWNTIMES -> downtimeCache.invalidate();
            case Attributes.COMMENTS -> commentCache.invalidate();
            default -> {}
        }
    }

    /**
     * One service item per inline declaration of {@code host}, named {@code "<host>-<key>"}.
     *
     * @throws InvalidConfigurationException when a declaration is neither a scalar template reference
     *     nor a map
     */
    List<ConfigItem> buildConvenienceServices(Host host, String location) {
        Map<String, Object> descriptions = host.getServiceDescriptions();
        if (descriptions.isEmpty()) {
            return List.of();
        }
        Map<String, Object> hostAttributes = hostAttributes(host);

        List<ConfigItem> items = new ArrayList<>();
        for (Map.Entry<String, Object> entry : descriptions.entrySet()) {
            String shortName = entry.getKey();
            Object description = entry.getValue();

            ConfigItem.Builder builder = ConfigItem.builder(ObjectKind.SERVICE.typeName(), host.getName() + "-" + shortName)
                    .location(location)
                    .set(Attributes.HOST_NAME, host.getName())
                    .set(Attributes.ALIAS, shortName);

            copyServiceAttributes(hostAttributes, builder);

            if (isScalar(description)) {
                builder.parent(String.valueOf(description));
            } else if (description instanceof Map<?, ?> map) {
                Map<String, Object> service = CheckableMaterializer.toMap(map);
                Object parent = service.get(Attributes.SERVICE);
                builder.parent(parent == null || String.valueOf(parent).isEmpty() ? shortName : String.valueOf(parent));
                copyServiceAttributes(service, builder);
            } else {
                throw new InvalidConfigurationException(
                        "Service description must be either a string or a dictionary.", location);
            }
            items.add(builder.build());
        }
        return items;
    }

    private Map<String, Object> hostAttributes(Host host) {
        return store.evaluate(store.find(ObjectKind.HOST.typeName(), host.getName())
                .orElseThrow(() -> new IllegalStateException("No config item for " + host)));
    }

    private static void copyServiceAttributes(Map<String, Object> source, ConfigItem.Builder builder) {
        for (String attribute : MERGED_ATTRIBUTES) {
            Object value = source.get(attribute);
            if (value != null) {
                builder.plus(attribute, value);
            }
        }
        for (String attribute : REPLACED_ATTRIBUTES) {
            Object value = source.get(attribute);
            if (value != null) {
                builder.set(attribute, value);
            }
        }
    }

    static boolean isScalar(Object value) {
        return value instanceof String || value instanceof Number || value instanceof Boolean;
    }
}
