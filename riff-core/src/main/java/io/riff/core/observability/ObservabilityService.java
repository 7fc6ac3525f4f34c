package io.riff.core.observability;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Append-only audit trail of turn and call outcomes, capped to the most recent events.
 */
public final class ObservabilityService {
    private static final Logger LOG = LoggerFactory.getLogger(ObservabilityService.class);
    private static final int MAX_EVENTS = 20_000;

    private final AuditStore store;
    private final Clock clock;

    public ObservabilityService(AuditStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public synchronized AuditEvent record(String type, Map<String, Object> attributes) throws IOException {
        List<AuditEvent> all = new ArrayList<>(store.load());
        AuditEvent event = new AuditEvent(
            UUID.randomUUID().toString(),
            clock.instant(),
            type,
            attributes
        );
        all.add(event);
        if (all.size() > MAX_EVENTS) {
            all = new ArrayList<>(all.subList(all.size() - MAX_EVENTS, all.size()));
        }
        store.save(all);
        return event;
    }

    /**
     * Records an event without letting a storage failure escape; the failure is logged.
     */
    public void recordQuietly(String type, Map<String, Object> attributes) {
        try {
            record(type, attributes);
        } catch (IOException e) {
            LOG.warn("Failed to record audit event {}: {}", type, e.getMessage());
        }
    }

    public synchronized List<AuditEvent> recent(int limit) throws IOException {
        int safe = Math.max(1, limit);
        return store.load().stream()
            .sorted(Comparator.comparing(AuditEvent::timestamp).reversed())
            .limit(safe)
            .toList();
    }

    public synchronized Map<String, Long> countsByType() throws IOException {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (AuditEvent event : store.load()) {
            counts.merge(event.type(), 1L, Long::sum);
        }
        return counts;
    }
}
