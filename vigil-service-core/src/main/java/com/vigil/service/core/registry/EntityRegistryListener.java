package com.vigil.service.core.registry;

import com.vigil.service.core.model.Checkable;

/**
 * Hooks fired synchronously by {@link EntityRegistry} before the mutating call returns. Implementations
 * must stay cheap and must not call back into registry mutations of the same entity.
 */
public interface EntityRegistryListener {

    default void onRegistered(Checkable checkable) {}

    default void onUnregistered(Checkable checkable) {}

    default void onAttributeChanged(Checkable checkable, String attribute) {}
}
