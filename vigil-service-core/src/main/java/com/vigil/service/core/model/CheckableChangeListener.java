package com.vigil.service.core.model;

/** Receives attribute changes of a registered entity, synchronously on the mutating thread. */
@FunctionalInterface
public interface CheckableChangeListener {
    CheckableChangeListener NOOP = (checkable, attribute) -> {};

    void onAttributeChanged(Checkable checkable, String attribute);
}
