package com.z254.hivemind.dispatch.messaging;

import com.z254.hivemind.dispatch.DispatchTestFixtures;
import com.z254.hivemind.dispatch.config.DispatchProperties;
import com.z254.hivemind.dispatch.domain.model.AgentMessage;
import com.z254.hivemind.dispatch.domain.model.MessageType;
import com.z254.hivemind.dispatch.messaging.impl.InMemoryDurableQueue;
import com.z254.hivemind.dispatch.messaging.impl.SinkBroadcastChannel;
import com.z254.hivemind.dispatch.observability.DispatchMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for MessagingSubstrate.
 */
class MessagingSubstrateTest {

    private DispatchProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private DispatchMetrics metrics;

    @BeforeEach
    void setUp() {
        properties = new DispatchProperties();
        properties.getMessaging().setDurableWriteRetries(2);
        properties.getMessaging().setDurableWriteBackoff(Duration.ofMillis(5));
        properties.getMessaging().setBroadcastTimeout(Duration.ofMillis(200));
        meterRegistry = new SimpleMeterRegistry();
        metrics = new DispatchMetrics(meterRegistry);
    }

    private MessagingSubstrate substrate(DurableQueue queue, BroadcastChannel channel) {
        return new MessagingSubstrate(queue, channel, metrics, properties, DispatchTestFixtures.clock());
    }

    @Nested
    @DisplayName("In-memory delivery")
    class InMemoryDeliveryTests {

        private MessagingSubstrate substrate;

        @BeforeEach
        void setUp() {
            substrate = substrate(new InMemoryDurableQueue(100), new SinkBroadcastChannel());
        }

        @Test
        @DisplayName("should return each durable message from exactly one read")
        void readsExactlyOnce() {
            // Given
            substrate.send("dispatcher", "agent-1", MessageType.NOTIFICATION, Map.of("n", 1)).block();
            substrate.send("dispatcher", "agent-1", MessageType.NOTIFICATION, Map.of("n", 2)).block();

            // When / Then
            StepVerifier.create(substrate.read("agent-1"))
                    .assertNext(messages -> assertThat(messages)
                            .extracting(m -> m.getContent().get("n"))
                            .containsExactly(1, 2))
                    .verifyComplete();
            StepVerifier.create(substrate.read("agent-1"))
                    .assertNext(messages -> assertThat(messages).isEmpty())
                    .verifyComplete();
        }

        @Test
        @DisplayName("should assign id and timestamp when the sender leaves them empty")
        void assignsIdentity() {
            AgentMessage sent = substrate.send("a", "b", MessageType.STATUS_UPDATE, Map.of()).block();

            assertThat(sent).isNotNull();
            assertThat(sent.getId()).isNotBlank();
            assertThat(sent.getTimestamp()).isEqualTo(DispatchTestFixtures.NOW);
            assertThat(meterRegistry.counter("dispatch.messages.sent").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should push a message to a listener subscribed before the send")
        void liveListener() {
            // Given
            Flux<AgentMessage> live = substrate.listen("agent-2");

            // When / Then
            StepVerifier.create(live.take(1))
                    .then(() -> substrate.send("agent-1", "agent-2", MessageType.COORDINATION_REQUEST,
                            Map.of("topic", "handoff")).subscribe())
                    .assertNext(received -> {
                        assertThat(received.getFrom()).isEqualTo("agent-1");
                        assertThat(received.getType()).isEqualTo(MessageType.COORDINATION_REQUEST);
                    })
                    .expectComplete()
                    .verify(Duration.ofSeconds(2));
        }

        @Test
        @DisplayName("should keep the durable copy even when nobody listens")
        void durableWithoutListener() {
            substrate.send("dispatcher", "agent-3", MessageType.TASK_ASSIGNMENT, Map.of()).block();

            StepVerifier.create(substrate.pending("agent-3"))
                    .expectNext(1L)
                    .verifyComplete();
        }

        @Test
        @DisplayName("should reject a message without a recipient")
        void blankRecipient() {
            StepVerifier.create(substrate.send("a", " ", MessageType.NOTIFICATION, Map.of()))
                    .expectError(IllegalArgumentException.class)
                    .verify();
        }
    }

    @Nested
    @DisplayName("Failure handling")
    class FailureTests {

        @Test
        @DisplayName("should fail the send after retries run out")
        void retryExhaustion() {
            // Given
            DurableQueue queue = mock(DurableQueue.class);
            when(queue.append(anyString(), any()))
                    .thenReturn(Mono.error(new IllegalStateException("store down")));
            MessagingSubstrate substrate = substrate(queue, new SinkBroadcastChannel());

            // When / Then
            StepVerifier.create(substrate.send("dispatcher", "agent-1", MessageType.NOTIFICATION, Map.of()))
                    .expectErrorSatisfies(error -> {
                        assertThat(error).isInstanceOf(MessageDeliveryException.class);
                        assertThat(((MessageDeliveryException) error).getRecipient()).isEqualTo("agent-1");
                        assertThat(error.getCause()).hasMessage("store down");
                    })
                    .verify(Duration.ofSeconds(5));
            verify(queue, times(3)).append(eq("agent-1"), any());
            assertThat(meterRegistry.counter("dispatch.messages.durable.failed").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should succeed when a transient durable failure clears within the retry budget")
        void transientFailure() {
            // Given
            InMemoryDurableQueue backing = new InMemoryDurableQueue(100);
            AtomicInteger attempts = new AtomicInteger();
            DurableQueue flaky = mock(DurableQueue.class);
            when(flaky.append(anyString(), any())).thenAnswer(invocation -> attempts.incrementAndGet() == 1
                    ? Mono.error(new IllegalStateException("blip"))
                    : backing.append(invocation.getArgument(0), invocation.getArgument(1)));
            MessagingSubstrate substrate = substrate(flaky, new SinkBroadcastChannel());

            // When
            substrate.send("dispatcher", "agent-1", MessageType.NOTIFICATION, Map.of()).block(Duration.ofSeconds(5));

            // Then
            assertThat(attempts).hasValue(2);
            StepVerifier.create(backing.drain("agent-1"))
                    .assertNext(messages -> assertThat(messages).hasSize(1))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should swallow a broadcast failure and count it")
        void broadcastFailure() {
            // Given
            BroadcastChannel channel = mock(BroadcastChannel.class);
            when(channel.publish(anyString(), any())).thenReturn(Mono.error(new IllegalStateException("pubsub down")));
            InMemoryDurableQueue queue = new InMemoryDurableQueue(100);
            MessagingSubstrate substrate = substrate(queue, channel);

            // When
            StepVerifier.create(substrate.send("dispatcher", "agent-1", MessageType.NOTIFICATION, Map.of()))
                    .expectNextCount(1)
                    .verifyComplete();

            // Then
            assertThat(meterRegistry.counter("dispatch.messages.broadcast.failed").count()).isEqualTo(1.0);
            StepVerifier.create(queue.drain("agent-1"))
                    .assertNext(messages -> assertThat(messages).hasSize(1))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should time out a hung broadcast without failing the send")
        void broadcastTimeout() {
            BroadcastChannel channel = mock(BroadcastChannel.class);
            when(channel.publish(anyString(), any())).thenReturn(Mono.never());
            MessagingSubstrate substrate = substrate(new InMemoryDurableQueue(100), channel);

            StepVerifier.create(substrate.send("dispatcher", "agent-1", MessageType.NOTIFICATION, Map.of()))
                    .expectNextCount(1)
                    .expectComplete()
                    .verify(Duration.ofSeconds(2));
            assertThat(meterRegistry.counter("dispatch.messages.broadcast.failed").count()).isEqualTo(1.0);
        }
    }

    @Test
    @DisplayName("should deliver emergency alerts on the emergency channel")
    void emergencyChannel() {
        MessagingSubstrate substrate = substrate(new InMemoryDurableQueue(100), new SinkBroadcastChannel());
        AgentMessage alert = AgentMessage.builder()
                .id("alert-1")
                .from("monitor")
                .to("*")
                .type(MessageType.EMERGENCY_ALERT)
                .content(Map.of("severity", "CRITICAL"))
                .build();

        StepVerifier.create(substrate.listenEmergency().take(1))
                .then(() -> substrate.publishEmergency(alert).subscribe())
                .assertNext(received -> assertThat(received.getId()).isEqualTo("alert-1"))
                .expectComplete()
                .verify(Duration.ofSeconds(2));
        assertThat(alert.getTimestamp()).isEqualTo(DispatchTestFixtures.NOW);
    }
}
