package com.vigil.service.core.model;

/** Configuration attribute names understood by the engine. */
public final class Attributes {
    public static final String ALIAS = "alias";
    public static final String HOST_NAME = "host_name";
    public static final String HOST_GROUPS = "hostgroups";
    public static final String SERVICE_GROUPS = "servicegroups";
    public static final String MACROS = "macros";
    public static final String CHECK_INTERVAL = "check_interval";
    public static final String RETRY_INTERVAL = "retry_interval";
    public static final String CHECKERS = "checkers";
    public static final String HOST_DEPENDENCIES = "hostdependencies";
    public static final String SERVICE_DEPENDENCIES = "servicedependencies";
    public static final String HOST_CHECK = "hostcheck";
    public static final String HOST_CHECKS = "hostchecks";
    public static final String SERVICES = "services";
    public static final String SERVICE = "service";
    public static final String CONVENIENCE_SERVICES = "convenience_services";
    public static final String ENABLE_FLAPPING = "enable_flapping";
    public static final String FLAPPING_THRESHOLD_LOW = "flapping_threshold_low";
    public static final String FLAPPING_THRESHOLD_HIGH = "flapping_threshold_high";
    public static final String DOWNTIMES = "downtimes";
    public static final String COMMENTS = "comments";

    private Attributes() {}
}
