package com.vigil.service.core.query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.vigil.model.AcknowledgementType;
import com.vigil.model.HostState;
import com.vigil.model.ServiceState;
import com.vigil.model.StateType;
import com.vigil.service.core.EngineFixture;
import com.vigil.service.core.model.Host;
import com.vigil.service.core.model.Service;
import com.vigil.service.core.registry.EntityNotFoundException;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class StatusQueryServiceTest {

    private final EngineFixture engine = new EngineFixture();
    private final StatusQueryService queries = engine.queries;

    @Test
    void hostViewCombinesDependenciesServicesAndGroups() {
        Host router = engine.host("router");
        router.setHostChecks(Set.of("ping"));
        Service ping = engine.service("router-ping", "router");
        Host web = engine.host("web01");
        web.setAlias("Frontend");
        web.setGroups(Set.of("web", "linux"));
        web.setHostDependencies(Map.of("router", Map.of()));
        engine.service("web01-http", "web01");
        engine.service("web01-ssh", "web01");

        HostStatusView view = queries.host("web01");

        assertThat(view.alias()).isEqualTo("Frontend");
        assertThat(view.hostState()).isEqualTo(HostState.UP);
        assertThat(view.reachable()).isTrue();
        assertThat(view.groups()).containsExactly("linux", "web");
        assertThat(view.parentHosts()).containsExactly("router");
        assertThat(view.services()).containsExactly("web01-http", "web01-ssh");
        assertThat(queries.hostGroupMembers("web")).extracting(HostStatusView::name).containsExactly("web01");

        EngineFixture.checked(ping, ServiceState.CRITICAL, StateType.HARD);
        assertThat(queries.host("router").hostState()).isEqualTo(HostState.DOWN);
        assertThat(queries.host("web01").hostState()).isEqualTo(HostState.UNREACHABLE);
    }

    @Test
    void serviceViewReportsPendingAndExpiredAcknowledgement() {
        engine.host("web01");
        Service http = engine.service("web01-http", "web01");
        engine.acknowledgementManager.acknowledge(http, AcknowledgementType.NORMAL, EngineFixture.T0.plusSeconds(30));

        ServiceStatusView pending = queries.service("web01-http");
        assertThat(pending.pending()).isTrue();
        assertThat(pending.hostName()).isEqualTo("web01");
        assertThat(pending.acknowledgement()).isEqualTo(AcknowledgementType.NORMAL);

        EngineFixture.checked(http, ServiceState.OK, StateType.HARD);
        engine.clock.advance(Duration.ofMinutes(1));
        ServiceStatusView later = queries.service("web01-http");
        assertThat(later.pending()).isFalse();
        assertThat(later.acknowledgement()).isEqualTo(AcknowledgementType.NONE);
        assertThat(later.acknowledgementExpiry()).isNull();
        assertThat(queries.servicesOfHost("web01")).extracting(ServiceStatusView::name).containsExactly("web01-http");
    }

    @Test
    void hostsAreListedByName() {
        engine.host("b");
        engine.host("a");

        assertThat(queries.hosts()).extracting(HostStatusView::name).containsExactly("a", "b");
        assertThatThrownBy(() -> queries.host("c")).isInstanceOf(EntityNotFoundException.class);
    }
}
