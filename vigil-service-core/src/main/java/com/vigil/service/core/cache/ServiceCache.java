package com.vigil.service.core.cache;

import com.vigil.model.ObjectKind;
import com.vigil.service.core.model.Checkable;
import com.vigil.service.core.model.Service;
import com.vigil.service.core.registry.EntityRegistry;
import com.vigil.service.core.registry.EntityRegistryListener;
import java.lang.ref.WeakReference;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Host name to the services declaring that host.
 *
 * <p>Membership is weak: a service that has been unregistered (or collected) since the last rebuild
 * is dropped from results instead of being returned.
 */
@Component
public class ServiceCache extends InvalidatingCache<Map<String, List<WeakReference<Service>>>>
        implements EntityRegistryListener {

    private final EntityRegistry registry;

    public ServiceCache(EntityRegistry registry) {
        this.registry = registry;
        registry.addListener(this);
    }

    public Set<Service> getServicesForHost(String hostName) {
        List<WeakReference<Service>> refs = current().getOrDefault(hostName, List.of());
        Set<Service> services = new LinkedHashSet<>();
        for (WeakReference<Service> ref : refs) {
            Service service = ref.get();
            if (service == null || !registry.isRegistered(service)) {
                continue;
            }
            services.add(service);
        }
        return Set.copyOf(services);
    }

    @Override
    protected Map<String, List<WeakReference<Service>>> build() {
        Map<String, List<WeakReference<Service>>> byHost = new HashMap<>();
        for (Checkable checkable : registry.snapshot(ObjectKind.SERVICE)) {
            Service service = (Service) checkable;
            String hostName = service.getHostName();
            if (hostName == null) {
                continue;
            }
            byHost.computeIfAbsent(hostName, k -> new ArrayList<>()).add(new WeakReference<>(service));
        }
        Map<String, List<WeakReference<Service>>> frozen = new HashMap<>();
        byHost.forEach((host, refs) -> frozen.put(host, List.copyOf(refs)));
        return Map.copyOf(frozen);
    }

    @Override
    public void onRegistered(Checkable checkable) {
        if (checkable.kind() == ObjectKind.SERVICE) {
            invalidate();
        }
    }

    @Override
    public void onUnregistered(Checkable checkable) {
        if (checkable.kind() == ObjectKind.SERVICE) {
            invalidate();
        }
    }
}
