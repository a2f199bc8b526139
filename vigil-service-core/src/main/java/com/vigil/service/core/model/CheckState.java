package com.vigil.service.core.model;

import com.vigil.model.CheckResult;
import com.vigil.model.ServiceState;
import com.vigil.model.StateType;

/**
 * State, state type and last result of one entity, read and replaced as a unit.
 *
 * @param lastResult {@code null} while the entity is pending
 */
public record CheckState(ServiceState state, StateType stateType, CheckResult lastResult) {

    public static final CheckState PENDING = new CheckState(ServiceState.OK, StateType.HARD, null);

    public CheckState {
        state = state == null ? ServiceState.UNKNOWN : state;
        stateType = stateType == null ? StateType.HARD : stateType;
    }

    public boolean hasBeenChecked() {
        return lastResult != null;
    }

    /** Confirmed problem: checked, hard and neither OK nor WARNING. */
    public boolean isHardProblem() {
        return hasBeenChecked() && stateType == StateType.HARD && !state.isOkOrWarning();
    }

    CheckState withResult(CheckResult result, StateType type) {
        return new CheckState(result.getState(), type, result);
    }

    CheckState withState(ServiceState state, StateType type) {
        return new CheckState(state, type, lastResult);
    }

    CheckState withStateType(StateType type) {
        return new CheckState(state, type, lastResult);
    }
}
