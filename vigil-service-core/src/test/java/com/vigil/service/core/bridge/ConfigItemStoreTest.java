package com.vigil.service.core.bridge;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ConfigItemStoreTest {

    private final ConfigItemStore store = new ConfigItemStore();

    @Test
    void parentsAreAppliedInOrderBeforeOwnExpressions() {
        store.put(ConfigItem.builder("Service", "base")
                .template(true)
                .set("check_interval", 300)
                .set("macros", Map.of("a", 1))
                .set("servicegroups", List.of("all"))
                .build());
        store.put(ConfigItem.builder("Service", "fast")
                .template(true)
                .set("check_interval", 30)
                .build());

        ConfigItem item = ConfigItem.builder("Service", "web01-http")
                .parent("base")
                .parent("fast")
                .plus("macros", Map.of("b", 2))
                .plus("servicegroups", List.of("web", "all"))
                .set("retry_interval", 10)
                .build();

        Map<String, Object> evaluated = store.evaluate(item);

        assertThat(evaluated).containsEntry("check_interval", 30).containsEntry("retry_interval", 10);
        assertThat(evaluated.get("macros")).isEqualTo(Map.of("a", 1, "b", 2));
        assertThat(evaluated.get("servicegroups")).isEqualTo(List.of("all", "web"));
    }

    @Test
    void setReplacesInheritedCollections() {
        store.put(ConfigItem.builder("Service", "base").set("checkers", List.of("a", "b")).build());

        Map<String, Object> evaluated = store.evaluate(
                ConfigItem.builder("Service", "x").parent("base").set("checkers", List.of("c")).build());

        assertThat(evaluated.get("checkers")).isEqualTo(List.of("c"));
    }

    @Test
    void missingParentIsRejected() {
        ConfigItem item = ConfigItem.builder("Service", "web01-http")
                .parent("nope")
                .location("services.conf:12")
                .build();

        assertThatThrownBy(() -> store.evaluate(item))
                .isInstanceOfSatisfying(InvalidConfigurationException.class, ex -> {
                    assertThat(ex.getMessage())
                            .isEqualTo("Parent object 'nope' of Service 'web01-http' does not exist. (services.conf:12)");
                    assertThat(ex.location()).isEqualTo("services.conf:12");
                });
    }

    @Test
    void inheritanceCycleIsRejected() {
        store.put(ConfigItem.builder("Service", "a").template(true).parent("b").build());
        store.put(ConfigItem.builder("Service", "b").template(true).parent("a").build());

        assertThatThrownBy(() -> store.evaluate(ConfigItem.builder("Service", "c").parent("a").build()))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("Inheritance cycle");
    }

    @Test
    void lookupIsCaseInsensitiveOnTypeOnly() {
        store.put(ConfigItem.of("Host", "web01", Map.of()));

        assertThat(store.exists("host", "web01")).isTrue();
        assertThat(store.exists("Host", "WEB01")).isFalse();
        assertThat(store.remove("HOST", "web01")).isPresent();
        assertThat(store.size()).isZero();
    }

    @Test
    void itemRequiresTypeAndName() {
        assertThatThrownBy(() -> ConfigItem.of("Host", " ", Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(ConfigItem.of("Zone", "z", Map.of()).kind()).isNull();
    }
}
