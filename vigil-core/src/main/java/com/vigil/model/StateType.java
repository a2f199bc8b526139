package com.vigil.model;

public enum StateType {
    /** Transient state, retries pending. */
    SOFT,
    /** Confirmed by the retry policy. */
    HARD
}
