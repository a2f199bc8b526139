package com.vigil.service.core.query;

import com.vigil.model.AcknowledgementType;
import com.vigil.model.HostState;
import com.vigil.model.ServiceState;
import com.vigil.model.StateType;
import java.time.Instant;
import java.util.Set;

public record HostStatusView(
        String name,
        String alias,
        HostState hostState,
        ServiceState state,
        StateType stateType,
        boolean reachable,
        boolean up,
        boolean flapping,
        double flappingPercent,
        Instant flappingLastChange,
        AcknowledgementType acknowledgement,
        Instant acknowledgementExpiry,
        boolean inDowntime,
        Set<String> groups,
        Set<String> parentHosts,
        Set<String> parentServices,
        Set<String> services) {}
