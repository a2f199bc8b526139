package com.vigil.service.core.checkresult;

import com.vigil.service.core.flapping.FlappingDetector;
import com.vigil.service.core.model.CheckState;
import com.vigil.service.core.model.Checkable;
import com.vigil.service.core.registry.EntityRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class CheckResultIngestService {

    private final EntityRegistry registry;
    private final FlappingDetector flappingDetector;

    /**
     * Applies the result and records the evaluation in the flapping history.
     *
     * @throws com.vigil.service.core.registry.EntityNotFoundException when the entity is not registered
     */
    @EventListener
    public void process(CheckResultEvent event) {
        Checkable checkable = registry.getByName(event.kind(), event.name());
        if (event.result() != null) {
            checkable.applyCheckResult(event.result(), event.stateType());
        } else if (event.stateType() != null) {
            checkable.setStateType(event.stateType());
        }
        flappingDetector.updateFlappingStatus(checkable, event.stateChanged());
        if (log.isDebugEnabled()) {
            CheckState check = checkable.getCheckState();
            log.debug(
                    "Check result for {}: state={} type={} changed={}",
                    checkable,
                    check.state(),
                    check.stateType(),
                    event.stateChanged());
        }
    }
}
