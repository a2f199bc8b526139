package com.vigil.service.core.bridge;

import com.vigil.model.ObjectKind;
import com.vigil.service.core.model.Checkable;

/**
 * A config item is being removed. {@code object} is the entity it had materialized, still registered
 * while the event is handled, or {@code null} for templates.
 */
public record ObjectRemovedEvent(String type, String name, Checkable object) {

    public ObjectKind kind() {
        return ObjectKind.fromTypeName(type);
    }
}
