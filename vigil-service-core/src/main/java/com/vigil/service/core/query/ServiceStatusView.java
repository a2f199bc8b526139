package com.vigil.service.core.query;

import com.vigil.model.AcknowledgementType;
import com.vigil.model.ServiceState;
import com.vigil.model.StateType;
import java.time.Instant;
import java.util.Set;

public record ServiceStatusView(
        String name,
        String hostName,
        String alias,
        ServiceState state,
        StateType stateType,
        boolean pending,
        boolean flapping,
        double flappingPercent,
        Instant flappingLastChange,
        AcknowledgementType acknowledgement,
        Instant acknowledgementExpiry,
        boolean inDowntime,
        Set<String> groups) {}
