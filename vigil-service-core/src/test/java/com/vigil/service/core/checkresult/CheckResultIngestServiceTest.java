package com.vigil.service.core.checkresult;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.vigil.model.ObjectKind;
import com.vigil.model.ServiceState;
import com.vigil.model.StateType;
import com.vigil.service.core.EngineFixture;
import com.vigil.service.core.model.Service;
import com.vigil.service.core.registry.EntityNotFoundException;
import org.junit.jupiter.api.Test;

class CheckResultIngestServiceTest {

    private final EngineFixture engine = new EngineFixture();

    @Test
    void resultIsAppliedAndFeedsFlappingHistory() {
        Service service = engine.service("web01-http", "web01");

        engine.checkResults.process(new CheckResultEvent(
                ObjectKind.SERVICE,
                "web01-http",
                EngineFixture.result(ServiceState.CRITICAL),
                StateType.SOFT,
                true));

        assertThat(service.getState()).isEqualTo(ServiceState.CRITICAL);
        assertThat(service.getStateType()).isEqualTo(StateType.SOFT);
        assertThat(service.hasBeenChecked()).isTrue();
        assertThat(service.getFlapping().getIndex()).isEqualTo(1);
        assertThat(service.getFlapping().getBuffer()).isEqualTo(1);
    }

    @Test
    void stateTypeOnlyUpdateKeepsLastResult() {
        Service service = engine.service("web01-http", "web01");
        EngineFixture.checked(service, ServiceState.WARNING, StateType.SOFT);

        engine.checkResults.process(new CheckResultEvent(ObjectKind.SERVICE, "web01-http", null, StateType.HARD, false));

        assertThat(service.getState()).isEqualTo(ServiceState.WARNING);
        assertThat(service.getStateType()).isEqualTo(StateType.HARD);
        assertThat(service.getFlapping().getBuffer()).isZero();
        assertThat(service.getFlapping().getIndex()).isEqualTo(1);
    }

    @Test
    void unknownEntityIsRejected() {
        assertThatThrownBy(() -> engine.checkResults.process(new CheckResultEvent(
                        ObjectKind.HOST, "ghost", EngineFixture.result(ServiceState.OK), StateType.HARD, false)))
                .isInstanceOf(EntityNotFoundException.class);
    }
}
