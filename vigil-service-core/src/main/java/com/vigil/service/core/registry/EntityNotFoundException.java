package com.vigil.service.core.registry;

import com.vigil.model.ObjectKind;

/** A name looked up directly does not belong to a registered entity. */
public class EntityNotFoundException extends IllegalArgumentException {
    private final ObjectKind kind;
    private final String name;

    public EntityNotFoundException(ObjectKind kind, String name) {
        super(kind.typeName() + " '" + name + "' does not exist.");
        this.kind = kind;
        this.name = name;
    }

    public ObjectKind kind() {
        return kind;
    }

    public String name() {
        return name;
    }
}
