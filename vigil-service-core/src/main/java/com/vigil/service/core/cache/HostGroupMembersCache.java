package com.vigil.service.core.cache;

import com.vigil.model.ObjectKind;
import com.vigil.service.core.model.Checkable;
import com.vigil.service.core.model.Host;
import com.vigil.service.core.registry.EntityRegistry;
import com.vigil.service.core.registry.EntityRegistryListener;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.springframework.stereotype.Component;

/** Host group name to member host names. */
@Component
public class HostGroupMembersCache extends InvalidatingCache<Map<String, Set<String>>>
        implements EntityRegistryListener {

    private final EntityRegistry registry;

    public HostGroupMembersCache(EntityRegistry registry) {
        this.registry = registry;
        registry.addListener(this);
    }

    public Set<Host> getMembers(String groupName) {
        Set<String> names = current().getOrDefault(groupName, Set.of());
        Set<Host> members = new LinkedHashSet<>();
        for (String name : names) {
            registry.findHost(name).ifPresent(members::add);
        }
        return Set.copyOf(members);
    }

    public Set<String> getGroupNames() {
        return current().keySet();
    }

    @Override
    protected Map<String, Set<String>> build() {
        Map<String, Set<String>> members = new HashMap<>();
        for (Checkable host : registry.snapshot(ObjectKind.HOST)) {
            for (String group : host.getGroups()) {
                members.computeIfAbsent(group, k -> new TreeSet<>()).add(host.getName());
            }
        }
        Map<String, Set<String>> frozen = new HashMap<>();
        members.forEach((group, names) -> frozen.put(group, Set.copyOf(names)));
        return Map.copyOf(frozen);
    }

    @Override
    public void onRegistered(Checkable checkable) {
        if (checkable.kind() == ObjectKind.HOST) {
            invalidate();
        }
    }

    @Override
    public void onUnregistered(Checkable checkable) {
        if (checkable.kind() == ObjectKind.HOST) {
            invalidate();
        }
    }
}
