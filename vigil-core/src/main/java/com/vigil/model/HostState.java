package com.vigil.model;

/** Derived host availability as reported to readers. */
public enum HostState {
    UP,
    DOWN,
    UNREACHABLE
}
