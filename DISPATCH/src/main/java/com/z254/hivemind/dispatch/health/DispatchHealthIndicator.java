package com.z254.hivemind.dispatch.health;

import com.z254.hivemind.dispatch.config.DispatchProperties;
import com.z254.hivemind.dispatch.learning.PatternMiner;
import com.z254.hivemind.dispatch.messaging.MessagingSubstrate;
import com.z254.hivemind.dispatch.registry.AgentRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Health of the DISPATCH service. DOWN when the durable message store cannot be reached.
 */
@Component
@Slf4j
public class DispatchHealthIndicator implements ReactiveHealthIndicator {

    private final MessagingSubstrate messaging;
    private final AgentRegistry registry;
    private final PatternMiner patternMiner;
    private final DispatchProperties properties;

    public DispatchHealthIndicator(MessagingSubstrate messaging,
                                   AgentRegistry registry,
                                   PatternMiner patternMiner,
                                   DispatchProperties properties) {
        this.messaging = messaging;
        this.registry = registry;
        this.patternMiner = patternMiner;
        this.properties = properties;
    }

    @Override
    public Mono<Health> health() {
        return messaging.isDurableStoreAvailable()
                .timeout(Duration.ofSeconds(5))
                .onErrorReturn(false)
                .map(storeUp -> {
                    Health.Builder builder = storeUp ? Health.up() : Health.down();

                    builder.withDetail("durableStore", storeUp ? "UP" : "DOWN");
                    builder.withDetail("messagingBackend", properties.getMessaging().getBackend());
                    builder.withDetail("persistenceBackend", properties.getPersistence().getBackend());
                    builder.withDetail("agents", registry.size());
                    builder.withDetail("systemLoadPercent", registry.systemLoadPercent());
                    builder.withDetail("taskPatterns", patternMiner.taskPatterns().size());
                    builder.withDetail("failurePatterns", patternMiner.failurePatterns().size());

                    return builder.build();
                })
                .onErrorResume(e -> {
                    log.error("Health check failed", e);
                    return Mono.just(Health.down()
                            .withDetail("error", e.getMessage())
                            .build());
                });
    }
}
