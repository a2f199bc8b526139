package com.vigil.service.core.bridge;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.vigil.model.ObjectKind;
import com.vigil.service.core.model.Checkable;
import com.vigil.service.core.model.Host;
import com.vigil.service.core.model.Service;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CheckableMaterializerTest {

    private final CheckableMaterializer materializer = new CheckableMaterializer();

    @Test
    void hostAttributesAreConverted() {
        Map<String, Object> props = Map.of(
                "alias", "Web server",
                "hostgroups", List.of("linux", "web"),
                "check_interval", "PT2M",
                "retry_interval", 30,
                "hostdependencies", List.of("router"),
                "servicedependencies", Map.of("uplink", Map.of("ignore_soft", true)),
                "hostchecks", List.of("ping"),
                "enable_flapping", "false",
                "flapping_threshold_high", "40");

        Host host = (Host) materializer.create(ObjectKind.HOST, "web01", props, null);

        assertThat(host.getAlias()).isEqualTo("Web server");
        assertThat(host.getGroups()).containsExactlyInAnyOrder("linux", "web");
        assertThat(host.getCheckInterval()).isEqualTo(Duration.ofMinutes(2));
        assertThat(host.getRetryInterval()).isEqualTo(Duration.ofSeconds(30));
        assertThat(host.getHostDependencies()).containsOnlyKeys("router");
        assertThat(host.getServiceDependencies().get("uplink")).containsEntry("ignore_soft", true);
        assertThat(host.getHostChecks()).containsExactly("ping");
        assertThat(host.isEnableFlapping()).isFalse();
        assertThat(host.getFlappingThresholdHigh()).isEqualTo(40.0);
        assertThat(host.getFlappingThresholdLow()).isNull();
    }

    @Test
    void reapplyResetsMissingAttributes() {
        Checkable host = materializer.create(
                ObjectKind.HOST, "web01", Map.of("check_interval", 60, "hostgroups", List.of("web")), null);

        materializer.apply(host, Map.of(), null);

        assertThat(host.getCheckInterval()).isNull();
        assertThat(host.getGroups()).isEmpty();
        assertThat(host.isEnableFlapping()).isTrue();
    }

    @Test
    void serviceRequiresHostName() {
        assertThatThrownBy(() -> materializer.create(ObjectKind.SERVICE, "http", Map.of(), "services.conf:4"))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("host_name")
                .hasMessageEndingWith("(services.conf:4)");

        Service service = (Service) materializer.create(
                ObjectKind.SERVICE, "web01-http", Map.of("host_name", "web01", "servicegroups", "http"), null);
        assertThat(service.getHostName()).isEqualTo("web01");
        assertThat(service.getGroups()).containsExactly("http");
    }

    @Test
    void invalidDurationIsAConfigurationError() {
        assertThatThrownBy(() -> CheckableMaterializer.toDuration("soon", "check_interval", "a.conf:1"))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("check_interval");
        assertThat(CheckableMaterializer.toDuration(1.5, "check_interval", null)).isEqualTo(Duration.ofMillis(1500));
        assertThat(CheckableMaterializer.toDuration("90", "check_interval", null)).isEqualTo(Duration.ofSeconds(90));
    }

    @Test
    void nonNumericFlappingThresholdIsAConfigurationError() {
        assertThatThrownBy(() -> materializer.create(
                        ObjectKind.HOST, "web01", Map.of("flapping_threshold_high", "often"), "hosts.conf:7"))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("flapping_threshold_high")
                .hasMessageEndingWith("(hosts.conf:7)");

        Host host = (Host) materializer.create(ObjectKind.HOST, "web02", Map.of("flapping_threshold_low", " 12.5 "), null);
        assertThat(host.getFlappingThresholdLow()).isEqualTo(12.5);
    }
}
