package com.vigil.service.core.dependency;

import com.vigil.model.CommentRecord;
import com.vigil.model.DowntimeRecord;
import com.vigil.service.core.cache.CommentCache;
import com.vigil.service.core.cache.DowntimeCache;
import com.vigil.service.core.model.Checkable;
import com.vigil.service.core.model.Host;
import com.vigil.service.core.model.Service;
import com.vigil.service.core.registry.EntityNotFoundException;
import com.vigil.service.core.registry.EntityRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Resolves the name-keyed dependency graph of hosts and evaluates reachability.
 *
 * <p>Relations are stored as names and resolved through the {@link EntityRegistry} on every call.
 * Names that no longer resolve while walking a dependency map are skipped; a name requested directly
 * through {@link #resolveService(Host, String)} fails with {@link EntityNotFoundException}.
 */
@Slf4j
@org.springframework.stereotype.Service
public class DependencyResolver {

    private final EntityRegistry registry;
    private final DowntimeCache downtimeCache;
    private final CommentCache commentCache;
    private final DowntimeActivityEvaluator downtimeEvaluator;
    private final Clock clock;

    public DependencyResolver(
            EntityRegistry registry,
            DowntimeCache downtimeCache,
            CommentCache commentCache,
            DowntimeActivityEvaluator downtimeEvaluator,
            Clock clock) {
        this.registry = registry;
        this.downtimeCache = downtimeCache;
        this.commentCache = commentCache;
        this.downtimeEvaluator = downtimeEvaluator;
        this.clock = clock;
    }

    /** Tries {@code "<host>-<name>"} first, then the bare {@code name}. */
    public Optional<Service> findService(Host host, String name) {
        if (name == null || name.isEmpty()) {
            return Optional.empty();
        }
        Optional<Service> scoped = registry.findService(host.getName() + "-" + name);
        if (scoped.isPresent()) {
            return scoped;
        }
        return registry.findService(name);
    }

    public Service resolveService(Host host, String name) {
        String combinedName = host.getName() + "-" + name;
        if (registry.serviceExists(combinedName)) {
            return registry.getService(combinedName);
        }
        return registry.getService(name);
    }

    /** Declared parent hosts, excluding the host itself and names that are not registered. */
    public Set<Host> getParentHosts(Host host) {
        Set<Host> parents = new LinkedHashSet<>();
        for (String key : host.getHostDependencies().keySet()) {
            if (key.equals(host.getName())) {
                continue;
            }
            Optional<Host> parent = registry.findHost(key);
            if (parent.isPresent()) {
                parents.add(parent.get());
            } else {
                log.debug("{}: skipping unresolved parent host '{}'", host, key);
            }
        }
        return Set.copyOf(parents);
    }

    public Set<Service> getParentServices(Host host) {
        Set<Service> parents = new LinkedHashSet<>();
        for (String key : host.getServiceDependencies().keySet()) {
            Optional<Service> parent = findService(host, key);
            if (parent.isPresent()) {
                parents.add(parent.get());
            } else {
                log.debug("{}: skipping unresolved parent service '{}'", host, key);
            }
        }
        return Set.copyOf(parents);
    }

    /** The single declared host check, resolved like a dependency reference. Empty when unresolved. */
    public Optional<Service> getHostCheckService(Host host) {
        return findService(host, host.getHostCheck());
    }

    /**
     * A host is unreachable when a parent service is in a confirmed (hard, checked) problem state, or a
     * parent host is not up. Pending services and soft problems are ignored.
     */
    public boolean isReachable(Host host) {
        for (Service service : getParentServices(host)) {
            if (service.getCheckState().isHardProblem()) {
                return false;
            }
        }

        for (Host parent : getParentHosts(host)) {
            if (isUp(parent)) {
                continue;
            }
            return false;
        }

        return true;
    }

    /** Up unless one of the resolved host-check services is neither OK nor WARNING. */
    public boolean isUp(Host host) {
        for (String hostCheck : host.getHostChecks()) {
            Optional<Service> service = findService(host, hostCheck);
            if (service.isEmpty()) {
                log.debug("{}: skipping unresolved host check '{}'", host, hostCheck);
                continue;
            }
            if (!service.get().getCheckState().state().isOkOrWarning()) {
                return false;
            }
        }
        return true;
    }

    public Map<String, DowntimeRecord> getDowntimes(Checkable checkable) {
        downtimeCache.validate();
        return checkable.getDowntimes();
    }

    public Map<String, CommentRecord> getComments(Checkable checkable) {
        commentCache.validate();
        return checkable.getComments();
    }

    public boolean isInDowntime(Checkable checkable) {
        Instant now = clock.instant();
        for (DowntimeRecord downtime : getDowntimes(checkable).values()) {
            if (downtimeEvaluator.isActive(downtime, now)) {
                return true;
            }
        }
        return false;
    }
}
