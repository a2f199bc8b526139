package com.vigil.service.core.model;

import com.vigil.model.AcknowledgementType;
import com.vigil.model.CheckResult;
import com.vigil.model.CommentRecord;
import com.vigil.model.DowntimeRecord;
import com.vigil.model.FlappingSnapshot;
import com.vigil.model.ObjectKind;
import com.vigil.model.ServiceState;
import com.vigil.model.StateType;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Common state of a monitored entity.
 *
 * <p>Configuration attributes are held as immutable values and replaced wholesale; every replacement
 * is announced to the attached {@link CheckableChangeListener}. Flapping history and acknowledgement
 * each have their own lock so updates on one entity never contend with other entities.
 *
 * <p>Identity is the instance: a re-registered name is a different entity.
 */
public abstract class Checkable {

    private final String name;
    private volatile CheckableChangeListener changeListener = CheckableChangeListener.NOOP;

    private volatile CheckState checkState = CheckState.PENDING;

    // configuration
    private volatile Map<String, Object> macros = Map.of();
    private volatile Duration checkInterval;
    private volatile Duration retryInterval;
    private volatile Set<String> checkers = Set.of();
    private volatile Set<String> groups = Set.of();
    private volatile Map<String, Map<String, Object>> hostDependencies = Map.of();
    private volatile Map<String, Map<String, Object>> serviceDependencies = Map.of();
    private volatile boolean enableFlapping = true;
    private volatile Double flappingThresholdLow;
    private volatile Double flappingThresholdHigh;

    // runtime records replicated by the downtime/comment collaborators
    private volatile Map<String, DowntimeRecord> downtimes = Map.of();
    private volatile Map<String, CommentRecord> comments = Map.of();

    private final Object flappingLock = new Object();
    private FlappingSnapshot flapping = FlappingSnapshot.empty();

    private final Object acknowledgementLock = new Object();
    private AcknowledgementType acknowledgement = AcknowledgementType.NONE;
    private Instant acknowledgementExpiry;

    protected Checkable(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Object name must be provided");
        }
        this.name = name;
    }

    public abstract ObjectKind kind();

    /** Attribute carrying group memberships for this variant. */
    protected abstract String groupsAttribute();

    public String getName() {
        return name;
    }

    public void attach(CheckableChangeListener listener) {
        this.changeListener = listener == null ? CheckableChangeListener.NOOP : listener;
    }

    public void detach() {
        this.changeListener = CheckableChangeListener.NOOP;
    }

    protected void attributeChanged(String attribute) {
        changeListener.onAttributeChanged(this, attribute);
    }

    // -------- check state

    /** State, type and last result as one consistent value. */
    public CheckState getCheckState() {
        return checkState;
    }

    public ServiceState getState() {
        return checkState.state();
    }

    public StateType getStateType() {
        return checkState.stateType();
    }

    public CheckResult getLastCheckResult() {
        return checkState.lastResult();
    }

    public boolean hasBeenChecked() {
        return checkState.hasBeenChecked();
    }

    public synchronized void applyCheckResult(CheckResult result, StateType type) {
        Objects.requireNonNull(result, "result");
        this.checkState = checkState.withResult(result, type);
    }

    public synchronized void setState(ServiceState state, StateType type) {
        this.checkState = checkState.withState(state, type);
    }

    public synchronized void setStateType(StateType stateType) {
        this.checkState = checkState.withStateType(stateType);
    }

    // -------- configuration attributes

    public Map<String, Object> getMacros() {
        return macros;
    }

    public void setMacros(Map<String, Object> macros) {
        this.macros = copyOf(macros);
        attributeChanged(Attributes.MACROS);
    }

    public Duration getCheckInterval() {
        return checkInterval;
    }

    public void setCheckInterval(Duration checkInterval) {
        this.checkInterval = checkInterval;
        attributeChanged(Attributes.CHECK_INTERVAL);
    }

    public Duration getRetryInterval() {
        return retryInterval;
    }

    public void setRetryInterval(Duration retryInterval) {
        this.retryInterval = retryInterval;
        attributeChanged(Attributes.RETRY_INTERVAL);
    }

    public Set<String> getCheckers() {
        return checkers;
    }

    public void setCheckers(Set<String> checkers) {
        this.checkers = checkers == null ? Set.of() : Set.copyOf(checkers);
        attributeChanged(Attributes.CHECKERS);
    }

    public Set<String> getGroups() {
        return groups;
    }

    public void setGroups(Set<String> groups) {
        this.groups = groups == null ? Set.of() : Set.copyOf(groups);
        attributeChanged(groupsAttribute());
    }

    /** Referenced host name to dependency metadata. */
    public Map<String, Map<String, Object>> getHostDependencies() {
        return hostDependencies;
    }

    public void setHostDependencies(Map<String, Map<String, Object>> hostDependencies) {
        this.hostDependencies = copyNested(hostDependencies);
        attributeChanged(Attributes.HOST_DEPENDENCIES);
    }

    /** Referenced service name (host-scoped or flat) to dependency metadata. */
    public Map<String, Map<String, Object>> getServiceDependencies() {
        return serviceDependencies;
    }

    public void setServiceDependencies(Map<String, Map<String, Object>> serviceDependencies) {
        this.serviceDependencies = copyNested(serviceDependencies);
        attributeChanged(Attributes.SERVICE_DEPENDENCIES);
    }

    public boolean isEnableFlapping() {
        return enableFlapping;
    }

    public void setEnableFlapping(boolean enableFlapping) {
        this.enableFlapping = enableFlapping;
        attributeChanged(Attributes.ENABLE_FLAPPING);
    }

    /** Per-entity override, {@code null} when the global default applies. */
    public Double getFlappingThresholdLow() {
        return flappingThresholdLow;
    }

    public void setFlappingThresholdLow(Double flappingThresholdLow) {
        this.flappingThresholdLow = flappingThresholdLow;
        attributeChanged(Attributes.FLAPPING_THRESHOLD_LOW);
    }

    public Double getFlappingThresholdHigh() {
        return flappingThresholdHigh;
    }

    public void setFlappingThresholdHigh(Double flappingThresholdHigh) {
        this.flappingThresholdHigh = flappingThresholdHigh;
        attributeChanged(Attributes.FLAPPING_THRESHOLD_HIGH);
    }

    // -------- downtimes and comments

    public Map<String, DowntimeRecord> getDowntimes() {
        return downtimes;
    }

    public synchronized void addDowntime(DowntimeRecord downtime) {
        Objects.requireNonNull(downtime.getId(), "downtime id");
        Map<String, DowntimeRecord> next = new LinkedHashMap<>(downtimes);
        next.put(downtime.getId(), downtime);
        this.downtimes = Map.copyOf(next);
        attributeChanged(Attributes.DOWNTIMES);
    }

    public synchronized boolean removeDowntime(String id) {
        if (!downtimes.containsKey(id)) {
            return false;
        }
        Map<String, DowntimeRecord> next = new LinkedHashMap<>(downtimes);
        next.remove(id);
        this.downtimes = Map.copyOf(next);
        attributeChanged(Attributes.DOWNTIMES);
        return true;
    }

    public Map<String, CommentRecord> getComments() {
        return comments;
    }

    public synchronized void addComment(CommentRecord comment) {
        Objects.requireNonNull(comment.getId(), "comment id");
        Map<String, CommentRecord> next = new LinkedHashMap<>(comments);
        next.put(comment.getId(), comment);
        this.comments = Map.copyOf(next);
        attributeChanged(Attributes.COMMENTS);
    }

    public synchronized boolean removeComment(String id) {
        if (!comments.containsKey(id)) {
            return false;
        }
        Map<String, CommentRecord> next = new LinkedHashMap<>(comments);
        next.remove(id);
        this.comments = Map.copyOf(next);
        attributeChanged(Attributes.COMMENTS);
        return true;
    }

    // -------- flapping

    public FlappingSnapshot getFlapping() {
        synchronized (flappingLock) {
            return flapping;
        }
    }

    /** Applies {@code update} to the flapping history under this entity's flapping lock. */
    public FlappingSnapshot updateFlapping(UnaryOperator<FlappingSnapshot> update) {
        synchronized (flappingLock) {
            FlappingSnapshot next = Objects.requireNonNull(update.apply(flapping), "flapping snapshot");
            this.flapping = next;
            return next;
        }
    }

    // -------- acknowledgement

    /** Stored value without expiry evaluation. */
    public AcknowledgementType getStoredAcknowledgement() {
        synchronized (acknowledgementLock) {
            return acknowledgement;
        }
    }

    public Instant getAcknowledgementExpiry() {
        synchronized (acknowledgementLock) {
            return acknowledgementExpiry;
        }
    }

    public void setAcknowledgement(AcknowledgementType acknowledgement) {
        synchronized (acknowledgementLock) {
            this.acknowledgement = acknowledgement == null ? AcknowledgementType.NONE : acknowledgement;
        }
    }

    /** {@code null} means the acknowledgement never expires. */
    public void setAcknowledgementExpiry(Instant acknowledgementExpiry) {
        synchronized (acknowledgementLock) {
            this.acknowledgementExpiry = acknowledgementExpiry;
        }
    }

    /**
     * Returns the acknowledgement in effect at {@code now}. An acknowledgement whose expiry lies before
     * {@code now} is cleared together with its expiry before returning {@link AcknowledgementType#NONE}.
     */
    public AcknowledgementType readAndMaybeExpireAcknowledgement(Instant now) {
        synchronized (acknowledgementLock) {
            if (acknowledgement != AcknowledgementType.NONE
                    && acknowledgementExpiry != null
                    && acknowledgementExpiry.isBefore(now)) {
                acknowledgement = AcknowledgementType.NONE;
                acknowledgementExpiry = null;
            }
            return acknowledgement;
        }
    }

    @Override
    public String toString() {
        return kind().typeName() + "'" + name + "'";
    }

    static Map<String, Object> copyOf(Map<String, Object> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    private static Map<String, Map<String, Object>> copyNested(Map<String, Map<String, Object>> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        Map<String, Map<String, Object>> copy = new LinkedHashMap<>();
        source.forEach((key, meta) -> {
            if (key != null) {
                copy.put(key, copyOf(meta));
            }
        });
        return Collections.unmodifiableMap(copy);
    }
}
