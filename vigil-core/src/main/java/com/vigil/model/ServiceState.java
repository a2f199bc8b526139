package com.vigil.model;

public enum ServiceState {
    OK(0),
    WARNING(1),
    CRITICAL(2),
    UNKNOWN(3);

    private final int code;

    ServiceState(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /** OK and WARNING never block reachability or host availability. */
    public boolean isOkOrWarning() {
        return this == OK || this == WARNING;
    }

    public static ServiceState fromCode(int code) {
        for (ServiceState state : values()) {
            if (state.code == code) {
                return state;
            }
        }
        return UNKNOWN;
    }
}
