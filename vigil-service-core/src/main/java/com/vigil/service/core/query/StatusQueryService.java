package com.vigil.service.core.query;

import com.vigil.model.AcknowledgementType;
import com.vigil.model.FlappingSnapshot;
import com.vigil.model.HostState;
import com.vigil.service.core.ack.AcknowledgementManager;
import com.vigil.service.core.cache.HostGroupMembersCache;
import com.vigil.service.core.cache.ServiceCache;
import com.vigil.service.core.dependency.DependencyResolver;
import com.vigil.service.core.flapping.FlappingDetector;
import com.vigil.service.core.model.CheckState;
import com.vigil.service.core.model.Checkable;
import com.vigil.service.core.model.Host;
import com.vigil.service.core.model.Service;
import com.vigil.service.core.registry.EntityRegistry;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;

/** Read-only views for the query listener. Safe to call concurrently with any mutation. */
@org.springframework.stereotype.Service
@RequiredArgsConstructor
public class StatusQueryService {

    private final EntityRegistry registry;
    private final ServiceCache serviceCache;
    private final HostGroupMembersCache hostGroupMembersCache;
    private final DependencyResolver dependencyResolver;
    private final FlappingDetector flappingDetector;
    private final AcknowledgementManager acknowledgementManager;

    /** @throws com.vigil.service.core.registry.EntityNotFoundException for an unknown host */
    public HostStatusView host(String name) {
        return toView(registry.getHost(name));
    }

    /** @throws com.vigil.service.core.registry.EntityNotFoundException for an unknown service */
    public ServiceStatusView service(String name) {
        return toView(registry.getService(name));
    }

    public List<HostStatusView> hosts() {
        return registry.hosts().stream()
                .sorted(Comparator.comparing(Checkable::getName))
                .map(this::toView)
                .toList();
    }

    public List<ServiceStatusView> servicesOfHost(String hostName) {
        return serviceCache.getServicesForHost(hostName).stream()
                .sorted(Comparator.comparing(Checkable::getName))
                .map(this::toView)
                .toList();
    }

    public List<HostStatusView> hostGroupMembers(String groupName) {
        return hostGroupMembersCache.getMembers(groupName).stream()
                .sorted(Comparator.comparing(Checkable::getName))
                .map(this::toView)
                .toList();
    }

    HostStatusView toView(Host host) {
        boolean up = dependencyResolver.isUp(host);
        boolean reachable = dependencyResolver.isReachable(host);
        HostState hostState = !reachable ? HostState.UNREACHABLE : up ? HostState.UP : HostState.DOWN;
        FlappingSnapshot flapping = host.getFlapping();
        CheckState check = host.getCheckState();
        AcknowledgementType acknowledgement = acknowledgementManager.readAndMaybeExpireAcknowledgement(host);
        return new HostStatusView(
                host.getName(),
                host.getAlias(),
                hostState,
                check.state(),
                check.stateType(),
                reachable,
                up,
                flappingDetector.isFlapping(host),
                flapping.getCurrent(),
                flapping.getLastChange(),
                acknowledgement,
                host.getAcknowledgementExpiry(),
                dependencyResolver.isInDowntime(host),
                new TreeSet<>(host.getGroups()),
                names(dependencyResolver.getParentHosts(host)),
                names(dependencyResolver.getParentServices(host)),
                names(serviceCache.getServicesForHost(host.getName())));
    }

    ServiceStatusView toView(Service service) {
        FlappingSnapshot flapping = service.getFlapping();
        CheckState check = service.getCheckState();
        AcknowledgementType acknowledgement = acknowledgementManager.readAndMaybeExpireAcknowledgement(service);
        return new ServiceStatusView(
                service.getName(),
                service.getHostName(),
                service.getAlias(),
                check.state(),
                check.stateType(),
                !check.hasBeenChecked(),
                flappingDetector.isFlapping(service),
                flapping.getCurrent(),
                flapping.getLastChange(),
                acknowledgement,
                service.getAcknowledgementExpiry(),
                dependencyResolver.isInDowntime(service),
                new TreeSet<>(service.getGroups()));
    }

    private static Set<String> names(Set<? extends Checkable> checkables) {
        return checkables.stream().map(Checkable::getName).collect(Collectors.toCollection(TreeSet::new));
    }
}
