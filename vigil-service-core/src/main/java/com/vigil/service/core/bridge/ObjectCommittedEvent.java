package com.vigil.service.core.bridge;

import com.vigil.model.ObjectKind;

/** A config item of {@code type} named {@code name} has been committed. */
public record ObjectCommittedEvent(String type, String name, String location) {

    public ObjectKind kind() {
        return ObjectKind.fromTypeName(type);
    }
}
