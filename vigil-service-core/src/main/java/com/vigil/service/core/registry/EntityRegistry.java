package com.vigil.service.core.registry;

import com.vigil.model.ObjectKind;
import com.vigil.service.core.model.Checkable;
import com.vigil.service.core.model.CheckableChangeListener;
import com.vigil.service.core.model.Host;
import com.vigil.service.core.model.Service;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Process-wide table of hosts and services keyed by name.
 *
 * <p>Lookups are lock-free. Register and unregister are serialized per variant and notify every
 * {@link EntityRegistryListener} while still holding that variant's lock, so a completed mutation is
 * never followed by a read of a cache that has not been invalidated.
 */
@Slf4j
@Component
public class EntityRegistry implements CheckableChangeListener {

    private final Map<ObjectKind, ConcurrentMap<String, Checkable>> objects = new EnumMap<>(ObjectKind.class);
    private final Map<ObjectKind, ReentrantLock> locks = new EnumMap<>(ObjectKind.class);
    private final List<EntityRegistryListener> listeners = new CopyOnWriteArrayList<>();

    public EntityRegistry() {
        for (ObjectKind kind : ObjectKind.values()) {
            objects.put(kind, new ConcurrentHashMap<>());
            locks.put(kind, new ReentrantLock());
        }
    }

    public void addListener(EntityRegistryListener listener) {
        listeners.add(listener);
    }

    public boolean exists(ObjectKind kind, String name) {
        return name != null && objects.get(kind).containsKey(name);
    }

    public Optional<Checkable> find(ObjectKind kind, String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(objects.get(kind).get(name));
    }

    /** @throws EntityNotFoundException when no entity of that variant carries {@code name} */
    public Checkable getByName(ObjectKind kind, String name) {
        return find(kind, name).orElseThrow(() -> new EntityNotFoundException(kind, name));
    }

    public boolean hostExists(String name) {
        return exists(ObjectKind.HOST, name);
    }

    public boolean serviceExists(String name) {
        return exists(ObjectKind.SERVICE, name);
    }

    public Host getHost(String name) {
        return (Host) getByName(ObjectKind.HOST, name);
    }

    public Service getService(String name) {
        return (Service) getByName(ObjectKind.SERVICE, name);
    }

    public Optional<Host> findHost(String name) {
        return find(ObjectKind.HOST, name).map(Host.class::cast);
    }

    public Optional<Service> findService(String name) {
        return find(ObjectKind.SERVICE, name).map(Service.class::cast);
    }

    /** Current entities of one variant. Weakly consistent with concurrent mutations. */
    public List<Checkable> getAll(ObjectKind kind) {
        return List.copyOf(objects.get(kind).values());
    }

    /** Point-in-time copy taken under the variant lock: no mutation is half applied in it. */
    public List<Checkable> snapshot(ObjectKind kind) {
        ReentrantLock lock = locks.get(kind);
        lock.lock();
        try {
            return List.copyOf(objects.get(kind).values());
        } finally {
            lock.unlock();
        }
    }

    public List<Host> hosts() {
        return snapshot(ObjectKind.HOST).stream().map(Host.class::cast).toList();
    }

    public List<Service> services() {
        return snapshot(ObjectKind.SERVICE).stream().map(Service.class::cast).toList();
    }

    /** True when {@code checkable} is the instance currently registered under its name. */
    public boolean isRegistered(Checkable checkable) {
        return checkable != null && objects.get(checkable.kind()).get(checkable.getName()) == checkable;
    }

    /**
     * @throws IllegalStateException when another entity of the same variant already uses the name
     */
    public void register(Checkable checkable) {
        ObjectKind kind = checkable.kind();
        ReentrantLock lock = locks.get(kind);
        lock.lock();
        try {
            Checkable existing = objects.get(kind).putIfAbsent(checkable.getName(), checkable);
            if (existing == checkable) {
                return;
            }
            if (existing != null) {
                throw new IllegalStateException(
                        kind.typeName() + " '" + checkable.getName() + "' is already registered.");
            }
            checkable.attach(this);
            for (EntityRegistryListener listener : listeners) {
                listener.onRegistered(checkable);
            }
            log.debug("Registered {}", checkable);
        } finally {
            lock.unlock();
        }
    }

    /** Removes the entity and runs cleanup hooks. Returns the removed entity, or empty if absent. */
    public Optional<Checkable> unregister(ObjectKind kind, String name) {
        ReentrantLock lock = locks.get(kind);
        lock.lock();
        try {
            Checkable removed = objects.get(kind).remove(name);
            if (removed == null) {
                return Optional.empty();
            }
            removed.detach();
            for (EntityRegistryListener listener : listeners) {
                listener.onUnregistered(removed);
            }
            log.debug("Unregistered {}", removed);
            return Optional.of(removed);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void onAttributeChanged(Checkable checkable, String attribute) {
        for (EntityRegistryListener listener : listeners) {
            listener.onAttributeChanged(checkable, attribute);
        }
    }
}
