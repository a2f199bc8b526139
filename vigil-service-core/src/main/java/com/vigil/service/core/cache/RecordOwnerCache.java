package com.vigil.service.core.cache;

import com.vigil.model.ObjectKind;
import com.vigil.service.core.model.Checkable;
import com.vigil.service.core.registry.EntityRegistry;
import com.vigil.service.core.registry.EntityRegistryListener;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** Record id (downtime, comment) to the entity owning it, across hosts and services. */
public abstract class RecordOwnerCache extends InvalidatingCache<Map<String, RecordOwnerCache.Owner>>
        implements EntityRegistryListener {

    private final EntityRegistry registry;

    protected RecordOwnerCache(EntityRegistry registry) {
        this.registry = registry;
        registry.addListener(this);
    }

    protected abstract Set<String> recordIds(Checkable checkable);

    public Optional<Checkable> findOwner(String recordId) {
        Owner owner = current().get(recordId);
        if (owner == null) {
            return Optional.empty();
        }
        return registry.find(owner.kind(), owner.name());
    }

    public int size() {
        return current().size();
    }

    @Override
    protected Map<String, Owner> build() {
        Map<String, Owner> owners = new HashMap<>();
        for (ObjectKind kind : ObjectKind.values()) {
            for (Checkable checkable : registry.snapshot(kind)) {
                for (String id : recordIds(checkable)) {
                    owners.put(id, new Owner(kind, checkable.getName()));
                }
            }
        }
        return Map.copyOf(owners);
    }

    @Override
    public void onRegistered(Checkable checkable) {
        invalidate();
    }

    @Override
    public void onUnregistered(Checkable checkable) {
        invalidate();
    }

    public record Owner(ObjectKind kind, String name) {}
}
