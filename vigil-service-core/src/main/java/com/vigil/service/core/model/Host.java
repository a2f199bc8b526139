package com.vigil.service.core.model;

import com.vigil.model.ObjectKind;
import java.util.Map;
import java.util.Set;

public class Host extends Checkable {

    private volatile String alias;
    private volatile String hostCheck;
    private volatile Set<String> hostChecks = Set.of();
    private volatile Map<String, Object> serviceDescriptions = Map.of();
    private volatile Set<String> convenienceServices = Set.of();

    public Host(String name) {
        super(name);
    }

    @Override
    public ObjectKind kind() {
        return ObjectKind.HOST;
    }

    @Override
    protected String groupsAttribute() {
        return Attributes.HOST_GROUPS;
    }

    /** Declared alias, or the name when none is declared. */
    public String getAlias() {
        String value = alias;
        return value == null || value.isEmpty() ? getName() : value;
    }

    public void setAlias(String alias) {
        this.alias = alias;
        attributeChanged(Attributes.ALIAS);
    }

    public String getHostCheck() {
        return hostCheck;
    }

    public void setHostCheck(String hostCheck) {
        this.hostCheck = hostCheck;
        attributeChanged(Attributes.HOST_CHECK);
    }

    /** Unresolved service names whose state decides whether this host is up. */
    public Set<String> getHostChecks() {
        return hostChecks;
    }

    public void setHostChecks(Set<String> hostChecks) {
        this.hostChecks = hostChecks == null ? Set.of() : Set.copyOf(hostChecks);
        attributeChanged(Attributes.HOST_CHECKS);
    }

    /** Inline service declarations, keyed by short service name. */
    public Map<String, Object> getServiceDescriptions() {
        return serviceDescriptions;
    }

    public void setServiceDescriptions(Map<String, Object> serviceDescriptions) {
        this.serviceDescriptions = copyOf(serviceDescriptions);
        attributeChanged(Attributes.SERVICES);
    }

    /** Names of the services synthesized from the last commit of this host. */
    public Set<String> getConvenienceServices() {
        return convenienceServices;
    }

    public void setConvenienceServices(Set<String> convenienceServices) {
        this.convenienceServices = convenienceServices == null ? Set.of() : Set.copyOf(convenienceServices);
        attributeChanged(Attributes.CONVENIENCE_SERVICES);
    }
}
