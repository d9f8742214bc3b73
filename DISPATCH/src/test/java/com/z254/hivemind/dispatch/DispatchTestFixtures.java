package com.z254.hivemind.dispatch;

import com.z254.hivemind.dispatch.config.DispatchProperties;
import com.z254.hivemind.dispatch.domain.model.Agent;
import com.z254.hivemind.dispatch.domain.model.Capability;
import com.z254.hivemind.dispatch.domain.model.TaskPriority;
import com.z254.hivemind.dispatch.domain.model.TaskRequest;
import com.z254.hivemind.dispatch.domain.repository.impl.InMemoryDocumentRepository;
import com.z254.hivemind.dispatch.registry.AgentRegistry;
import com.z254.hivemind.dispatch.registry.CapabilityCatalog;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Set;

/**
 * Shared builders for DISPATCH unit tests.
 */
public final class DispatchTestFixtures {

    public static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    private DispatchTestFixtures() {
    }

    public static MutableClock clock() {
        return new MutableClock(NOW);
    }

    public static AgentRegistry registry(DispatchProperties properties, Clock clock) {
        return new AgentRegistry(new CapabilityCatalog(properties), new InMemoryDocumentRepository<>(), clock);
    }

    public static Agent agent(String id, int maxConcurrentTasks, Map<Capability, Double> capabilities) {
        return Agent.builder()
                .id(id)
                .name(id)
                .capabilities(capabilities)
                .maxConcurrentTasks(maxConcurrentTasks)
                .build();
    }

    public static TaskRequest task(String id, Capability... required) {
        return TaskRequest.builder()
                .id(id)
                .type("generic")
                .description("task " + id)
                .requiredCapabilities(Set.of(required))
                .priority(TaskPriority.MEDIUM)
                .createdAt(NOW)
                .build();
    }

    /**
     * A clock tests can move forward.
     */
    public static final class MutableClock extends Clock {

        private Instant instant;

        public MutableClock(Instant start) {
            this.instant = start;
        }

        public void advance(Duration duration) {
            instant = instant.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return instant;
        }
    }
}
