package com.vigil.reference;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vigil.model.CheckResult;
import com.vigil.model.ObjectKind;
import com.vigil.model.ServiceState;
import com.vigil.model.StateType;
import com.vigil.service.core.bridge.ConfigErrorReporter;
import com.vigil.service.core.bridge.ConfigItem;
import com.vigil.service.core.bridge.ConfigObjectActivator;
import com.vigil.service.core.bridge.LoggingConfigErrorReporter;
import com.vigil.service.core.checkresult.CheckResultEvent;
import com.vigil.service.core.query.HostStatusView;
import com.vigil.service.core.query.StatusQueryService;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.context.ApplicationEventPublisher;

@SpringBootTest(
        properties = {
            "vigil.retention.enabled=false",
            "vigil.acknowledgements.sweep.enabled=false",
            "spring.main.web-application-type=none"
        })
class VigilApplicationContextTest {

    @Autowired
    ConfigObjectActivator activator;

    @Autowired
    StatusQueryService statusQueryService;

    @Autowired
    ApplicationEventPublisher publisher;

    @Autowired
    ConfigErrorReporter errorReporter;

    @Autowired
    ObjectMapper objectMapper;

    @Autowired
    ApplicationContext applicationContext;

    @Test
    void configCommitsAndCheckResultsFlowThroughTheWiredEngine() {
        activator.commit(ConfigItem.builder("Service", "generic-service")
                .template(true)
                .set("check_interval", 60)
                .build());
        activator.commit(ConfigItem.of("Host", "router", Map.of()));
        activator.commit(ConfigItem.of(
                "Host",
                "web01",
                Map.of(
                        "hostdependencies", Map.of("router", Map.of()),
                        "servicedependencies", Map.of("uplink", Map.of()),
                        "services", Map.of("uplink", "generic-service"))));

        HostStatusView before = statusQueryService.host("web01");
        assertThat(before.reachable()).isTrue();
        assertThat(before.services()).containsExactly("web01-uplink");
        assertThat(before.parentHosts()).containsExactly("router");

        publisher.publishEvent(new CheckResultEvent(
                ObjectKind.SERVICE,
                "web01-uplink",
                CheckResult.builder().state(ServiceState.CRITICAL).build(),
                StateType.HARD,
                true));

        assertThat(statusQueryService.host("web01").reachable()).isFalse();
    }

    @Test
    void invalidInlineDeclarationIsReportedWithoutFailingTheCommit() {
        activator.commit(ConfigItem.of("Host", "db01", Map.of("services", Map.of("bad", List.of("x")))));

        assertThat(errorReporter).isInstanceOf(LoggingConfigErrorReporter.class);
        assertThat(statusQueryService.host("db01").services()).isEmpty();
    }

    @Test
    void engineSuppliesItsOwnMapperWithoutSpringWeb() throws Exception {
        assertThat(applicationContext.containsBean("vigilObjectMapper")).isTrue();
        assertThat(objectMapper.writeValueAsString(Instant.parse("2025-03-01T10:00:00Z")))
                .isEqualTo("\"2025-03-01T10:00:00Z\"");
    }
}
