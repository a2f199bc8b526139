package com.vigil.service.core.model;

import com.vigil.model.ObjectKind;

public class Service extends Checkable {

    private volatile String hostName;
    private volatile String alias;

    public Service(String name, String hostName) {
        super(name);
        this.hostName = hostName;
    }

    @Override
    public ObjectKind kind() {
        return ObjectKind.SERVICE;
    }

    @Override
    protected String groupsAttribute() {
        return Attributes.SERVICE_GROUPS;
    }

    public String getHostName() {
        return hostName;
    }

    public void setHostName(String hostName) {
        this.hostName = hostName;
        attributeChanged(Attributes.HOST_NAME);
    }

    public String getAlias() {
        String value = alias;
        return value == null || value.isEmpty() ? getName() : value;
    }

    public void setAlias(String alias) {
        this.alias = alias;
        attributeChanged(Attributes.ALIAS);
    }
}
