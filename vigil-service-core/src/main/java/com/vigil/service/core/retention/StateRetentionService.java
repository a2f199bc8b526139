package com.vigil.service.core.retention;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vigil.model.CheckableStateSnapshot;
import com.vigil.model.FlappingSnapshot;
import com.vigil.model.ObjectKind;
import com.vigil.service.core.config.VigilProperties;
import com.vigil.service.core.model.Checkable;
import com.vigil.service.core.registry.EntityRegistry;
import com.vigil.service.core.registry.EntityRegistryListener;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Persists the per-entity state that must survive restarts: flapping history and acknowledgement.
 *
 * <p>Snapshots for names that are not registered yet are held back and applied when the entity
 * registers, so load order relative to configuration commit does not matter.
 */
@Component
public class StateRetentionService implements EntityRegistryListener {

    private static final Logger log = LoggerFactory.getLogger(StateRetentionService.class);
    private static final TypeReference<List<CheckableStateSnapshot>> SNAPSHOT_LIST = new TypeReference<>() {};

    private final EntityRegistry registry;
    private final ObjectMapper mapper;
    private final VigilProperties properties;
    private final ConcurrentMap<PendingKey, CheckableStateSnapshot> pending = new ConcurrentHashMap<>();
    private final ReentrantLock fileLock = new ReentrantLock();

    public StateRetentionService(EntityRegistry registry, ObjectMapper mapper, VigilProperties properties) {
        this.registry = registry;
        this.mapper = mapper;
        this.properties = properties;
        registry.addListener(this);
    }

    public List<CheckableStateSnapshot> capture() {
        List<CheckableStateSnapshot> snapshots = new ArrayList<>();
        for (ObjectKind kind : ObjectKind.values()) {
            for (Checkable checkable : registry.getAll(kind)) {
                snapshots.add(capture(checkable));
            }
        }
        return snapshots;
    }

    public static CheckableStateSnapshot capture(Checkable checkable) {
        return CheckableStateSnapshot.builder()
                .kind(checkable.kind())
                .name(checkable.getName())
                .flapping(checkable.getFlapping())
                .acknowledgement(checkable.getStoredAcknowledgement())
                .acknowledgementExpiry(checkable.getAcknowledgementExpiry())
                .build();
    }

    /** Applies now if the entity is registered, otherwise when it registers. */
    public void restore(CheckableStateSnapshot snapshot) {
        if (snapshot == null || snapshot.getKind() == null || snapshot.getName() == null) {
            return;
        }
        Optional<Checkable> checkable = registry.find(snapshot.getKind(), snapshot.getName());
        if (checkable.isPresent()) {
            apply(checkable.get(), snapshot);
            return;
        }
        PendingKey key = new PendingKey(snapshot.getKind(), snapshot.getName());
        pending.put(key, snapshot);
        // registered between the lookup and the put
        Optional<Checkable> late = registry.find(snapshot.getKind(), snapshot.getName());
        if (late.isPresent() && pending.remove(key, snapshot)) {
            apply(late.get(), snapshot);
        }
    }

    public int pendingCount() {
        return pending.size();
    }

    @Override
    public void onRegistered(Checkable checkable) {
        CheckableStateSnapshot snapshot = pending.remove(new PendingKey(checkable.kind(), checkable.getName()));
        if (snapshot != null) {
            apply(checkable, snapshot);
        }
    }

    public void save(Path path) {
        List<CheckableStateSnapshot> snapshots = capture();
        fileLock.lock();
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
            mapper.writeValue(tmp.toFile(), snapshots);
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Retention saved {} entities to {}", snapshots.size(), path);
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to write retention file " + path, ex);
        } finally {
            fileLock.unlock();
        }
    }

    /** Returns the number of snapshots read; zero when the file does not exist. */
    public int load(Path path) {
        if (!Files.exists(path)) {
            return 0;
        }
        List<CheckableStateSnapshot> snapshots;
        fileLock.lock();
        try {
            snapshots = mapper.readValue(path.toFile(), SNAPSHOT_LIST);
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to read retention file " + path, ex);
        } finally {
            fileLock.unlock();
        }
        snapshots.forEach(this::restore);
        return snapshots.size();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onStartup() {
        if (!properties.getRetention().isEnabled()) {
            return;
        }
        Path path = retentionPath();
        try {
            int loaded = load(path);
            log.info("Retention loaded {} entities from {} ({} pending registration)", loaded, path, pending.size());
        } catch (UncheckedIOException ex) {
            log.warn("Retention load failed: {}", ex.getMessage());
            log.debug("Retention load failure stacktrace", ex);
        }
    }

    @Scheduled(fixedDelayString = "${vigil.retention.interval:PT5M}")
    public void scheduledSave() {
        if (!properties.getRetention().isEnabled()) {
            return;
        }
        try {
            save(retentionPath());
        } catch (UncheckedIOException ex) {
            log.warn("Retention save failed: {}", ex.getMessage());
            log.debug("Retention save failure stacktrace", ex);
        }
    }

    @PreDestroy
    public void onShutdown() {
        if (!properties.getRetention().isEnabled()) {
            return;
        }
        Path path = retentionPath();
        save(path);
        log.info("Retention saved to {} on shutdown", path);
    }

    private Path retentionPath() {
        return Paths.get(properties.getRetention().getPath());
    }

    private static void apply(Checkable checkable, CheckableStateSnapshot snapshot) {
        FlappingSnapshot flapping = snapshot.getFlapping();
        if (flapping != null) {
            FlappingSnapshot sanitized = FlappingSnapshot.builder()
                    .buffer(flapping.getBuffer() & FlappingSnapshot.MASK)
                    .index(Math.floorMod(flapping.getIndex(), FlappingSnapshot.SLOTS))
                    .current(flapping.getCurrent())
                    .flapping(flapping.isFlapping())
                    .lastChange(flapping.getLastChange())
                    .build();
            checkable.updateFlapping(previous -> sanitized);
        }
        checkable.setAcknowledgement(snapshot.getAcknowledgement());
        checkable.setAcknowledgementExpiry(snapshot.getAcknowledgementExpiry());
    }

    private record PendingKey(ObjectKind kind, String name) {}
}
