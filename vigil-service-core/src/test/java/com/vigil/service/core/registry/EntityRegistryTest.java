package com.vigil.service.core.registry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.vigil.model.ObjectKind;
import com.vigil.service.core.model.Attributes;
import com.vigil.service.core.model.Checkable;
import com.vigil.service.core.model.Host;
import com.vigil.service.core.model.Service;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.Test;

class EntityRegistryTest {

    private final EntityRegistry registry = new EntityRegistry();

    @Test
    void lookupOfUnknownNameThrowsNotFound() {
        assertThatThrownBy(() -> registry.getHost("ghost"))
                .isInstanceOf(EntityNotFoundException.class)
                .hasMessage("Host 'ghost' does not exist.");

        assertThatThrownBy(() -> registry.getByName(ObjectKind.SERVICE, "ghost"))
                .isInstanceOfSatisfying(EntityNotFoundException.class, ex -> {
                    assertThat(ex.kind()).isEqualTo(ObjectKind.SERVICE);
                    assertThat(ex.name()).isEqualTo("ghost");
                });
        assertThat(registry.findHost("ghost")).isEmpty();
        assertThat(registry.find(ObjectKind.HOST, null)).isEmpty();
    }

    @Test
    void hostsAndServicesHaveSeparateNamespaces() {
        Host host = new Host("db");
        Service service = new Service("db", "db01");
        registry.register(host);
        registry.register(service);

        assertThat(registry.getHost("db")).isSameAs(host);
        assertThat(registry.getService("db")).isSameAs(service);
        assertThat(registry.hostExists("db")).isTrue();
        assertThat(registry.serviceExists("db")).isTrue();
        assertThat(registry.hosts()).containsExactly(host);
        assertThat(registry.services()).containsExactly(service);
    }

    @Test
    void duplicateNameIsRejected() {
        registry.register(new Host("web01"));

        assertThatThrownBy(() -> registry.register(new Host("web01")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("web01");
    }

    @Test
    void registeringTheSameInstanceTwiceIsANoOp() {
        List<Checkable> registered = new CopyOnWriteArrayList<>();
        registry.addListener(new EntityRegistryListener() {
            @Override
            public void onRegistered(Checkable checkable) {
                registered.add(checkable);
            }
        });
        Host host = new Host("web01");

        registry.register(host);
        registry.register(host);

        assertThat(registered).containsExactly(host);
    }

    @Test
    void unregisterFreesTheNameForANewIdentity() {
        Host first = new Host("web01");
        registry.register(first);

        assertThat(registry.unregister(ObjectKind.HOST, "web01")).containsSame(first);
        assertThat(registry.isRegistered(first)).isFalse();
        assertThat(registry.unregister(ObjectKind.HOST, "web01")).isEmpty();

        Host second = new Host("web01");
        registry.register(second);
        assertThat(registry.isRegistered(second)).isTrue();
        assertThat(registry.isRegistered(first)).isFalse();
    }

    @Test
    void listenersSeeRegistrationChangesAndAttributeUpdates() {
        List<String> events = new CopyOnWriteArrayList<>();
        registry.addListener(new EntityRegistryListener() {
            @Override
            public void onRegistered(Checkable checkable) {
                events.add("registered " + checkable.getName());
            }

            @Override
            public void onUnregistered(Checkable checkable) {
                events.add("unregistered " + checkable.getName());
            }

            @Override
            public void onAttributeChanged(Checkable checkable, String attribute) {
                events.add(attribute + " " + checkable.getName());
            }
        });
        Host host = new Host("web01");
        // not attached yet
        host.setGroups(Set.of("linux"));

        registry.register(host);
        host.setGroups(Set.of("linux", "web"));
        registry.unregister(ObjectKind.HOST, "web01");
        host.setGroups(Set.of());

        assertThat(events)
                .containsExactly(
                        "registered web01", Attributes.HOST_GROUPS + " web01", "unregistered web01");
    }

    @Test
    void snapshotIsDetachedFromLaterMutations() {
        registry.register(new Host("a"));
        List<Checkable> snapshot = registry.snapshot(ObjectKind.HOST);
        registry.register(new Host("b"));

        assertThat(snapshot).extracting(Checkable::getName).containsExactly("a");
        assertThat(registry.getAll(ObjectKind.HOST)).hasSize(2);
    }
}
