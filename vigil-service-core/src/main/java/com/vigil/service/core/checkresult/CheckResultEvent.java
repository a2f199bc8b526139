package com.vigil.service.core.checkresult;

import com.vigil.model.CheckResult;
import com.vigil.model.ObjectKind;
import com.vigil.model.StateType;

/**
 * One evaluation cycle reported by the check subsystem.
 *
 * @param stateChanged whether this evaluation changed the entity's state; feeds flapping detection
 */
public record CheckResultEvent(
        ObjectKind kind, String name, CheckResult result, StateType stateType, boolean stateChanged) {}
