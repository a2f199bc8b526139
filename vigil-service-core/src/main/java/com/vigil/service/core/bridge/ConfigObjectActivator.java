package com.vigil.service.core.bridge;

import com.vigil.model.ObjectKind;
import com.vigil.service.core.model.Checkable;
import com.vigil.service.core.registry.EntityRegistry;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Turns committed config items into registered entities and announces commits and removals.
 *
 * <p>Commit is split in two phases so callers can evaluate a whole batch before touching the registry:
 * {@link #prepare(ConfigItem)} only evaluates, {@link #activate(PreparedItem)} stores and registers.
 */
@Slf4j
@Service
public class ConfigObjectActivator {

    private final ConfigItemStore store;
    private final EntityRegistry registry;
    private final CheckableMaterializer materializer;
    private final ApplicationEventPublisher publisher;

    public ConfigObjectActivator(
            ConfigItemStore store,
            EntityRegistry registry,
            CheckableMaterializer materializer,
            ApplicationEventPublisher publisher) {
        this.store = store;
        this.registry = registry;
        this.materializer = materializer;
        this.publisher = publisher;
    }

    public Optional<Checkable> commit(ConfigItem item) {
        return activate(prepare(item));
    }

    /**
     * Evaluates inheritance and materializes a detached candidate entity, without side effects.
     *
     * @throws InvalidConfigurationException when the item cannot be materialized
     */
    public PreparedItem prepare(ConfigItem item) {
        Map<String, Object> properties = store.evaluate(item);
        ObjectKind kind = item.kind();
        Checkable candidate = kind == null || item.template()
                ? null
                : materializer.create(kind, item.name(), properties, item.location());
        return new PreparedItem(item, properties, candidate);
    }

    public Optional<Checkable> activate(PreparedItem prepared) {
        ConfigItem item = prepared.item();
        Checkable checkable = prepared.candidate();
        if (checkable != null) {
            Optional<Checkable> existing = registry.find(checkable.kind(), item.name());
            if (existing.isPresent()) {
                checkable = existing.get();
                materializer.apply(checkable, prepared.properties(), item.location());
            }
        }
        store.put(item);
        if (checkable != null && !registry.isRegistered(checkable)) {
            registry.register(checkable);
        }
        publisher.publishEvent(new ObjectCommittedEvent(item.type(), item.name(), item.location()));
        return Optional.ofNullable(checkable);
    }

    /**
     * Removes the item. Removal handlers run while the entity is still registered, so derived objects
     * are gone before its name becomes reusable.
     */
    public Optional<Checkable> unregister(String type, String name) {
        ObjectKind kind = ObjectKind.fromTypeName(type);
        Checkable object = kind == null ? null : registry.find(kind, name).orElse(null);
        publisher.publishEvent(new ObjectRemovedEvent(type, name, object));
        store.remove(type, name);
        if (object == null) {
            return Optional.empty();
        }
        return registry.unregister(kind, name);
    }

    /** @param candidate detached entity for a first registration, {@code null} for templates */
    public record PreparedItem(ConfigItem item, Map<String, Object> properties, Checkable candidate) {}
}
