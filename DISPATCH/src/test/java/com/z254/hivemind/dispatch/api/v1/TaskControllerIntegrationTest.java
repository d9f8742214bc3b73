package com.z254.hivemind.dispatch.api.v1;

import com.z254.hivemind.dispatch.api.dto.AgentRequest;
import com.z254.hivemind.dispatch.api.dto.EmergencyRequest;
import com.z254.hivemind.dispatch.api.dto.MessageRequest;
import com.z254.hivemind.dispatch.api.dto.OutcomeRequest;
import com.z254.hivemind.dispatch.api.dto.TaskSubmissionRequest;
import com.z254.hivemind.dispatch.domain.model.FailureCategory;
import com.z254.hivemind.dispatch.domain.model.MessageType;
import com.z254.hivemind.dispatch.domain.model.TaskPriority;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * End-to-end flow over the task, message and insights endpoints with in-memory backends.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@AutoConfigureWebTestClient
@ActiveProfiles("test")
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_EACH_TEST_METHOD)
class TaskControllerIntegrationTest {

    @Autowired
    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        registerAgent("A", Map.of("data-processing", 0.9), 2);
        registerAgent("B", Map.of("data-processing", 0.5), 5);
    }

    private void registerAgent(String id, Map<String, Double> capabilities, int maxConcurrentTasks) {
        webTestClient.post()
                .uri("/api/v1/agents")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(AgentRequest.builder()
                        .id(id)
                        .capabilities(capabilities)
                        .maxConcurrentTasks(maxConcurrentTasks)
                        .build())
                .exchange()
                .expectStatus().isCreated();
    }

    private static TaskSubmissionRequest task(String id) {
        return TaskSubmissionRequest.builder()
                .id(id)
                .type("etl")
                .requiredCapabilities(Set.of("data-processing"))
                .build();
    }

    private WebTestClient.ResponseSpec submit(TaskSubmissionRequest request) {
        return webTestClient.post()
                .uri("/api/v1/tasks")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .exchange();
    }

    @Nested
    @DisplayName("POST /api/v1/tasks")
    class SubmitTests {

        @Test
        @DisplayName("should route to the expert until it is full")
        void routesByScoreAndCapacity() {
            submit(task("t1")).expectStatus().isOk().expectBody().jsonPath("$.agentId").isEqualTo("A");
            submit(task("t2")).expectStatus().isOk().expectBody().jsonPath("$.agentId").isEqualTo("A");
            submit(task("t3")).expectStatus().isOk().expectBody()
                    .jsonPath("$.agentId").isEqualTo("B")
                    .jsonPath("$.candidates").isEqualTo(2);
        }

        @Test
        @DisplayName("should report an unroutable task as a normal response")
        void unroutable() {
            TaskSubmissionRequest request = task("t1");
            request.setRequiredCapabilities(Set.of("voice-processing"));

            submit(request).expectStatus().isOk().expectBody()
                    .jsonPath("$.assigned").isEqualTo(false)
                    .jsonPath("$.reason").isEqualTo("NO_CAPABLE_AGENT");
        }

        @Test
        @DisplayName("should reject a task with an unknown capability")
        void unknownCapability() {
            TaskSubmissionRequest request = task("t1");
            request.setRequiredCapabilities(Set.of("telepathy"));

            submit(request).expectStatus().isBadRequest().expectBody()
                    .jsonPath("$.code").isEqualTo("UNKNOWN_CAPABILITY");
        }

        @Test
        @DisplayName("should route a batch in order")
        void batch() {
            webTestClient.post()
                    .uri("/api/v1/tasks/batch")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(List.of(task("t1"), task("t2"), task("t3")))
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$[0].agentId").isEqualTo("A")
                    .jsonPath("$[1].agentId").isEqualTo("A")
                    .jsonPath("$[2].agentId").isEqualTo("B");
        }

        @Test
        @DisplayName("should preview an escalated priority without routing")
        void previewPriority() {
            TaskSubmissionRequest request = task("t1");
            request.setPriority(TaskPriority.LOW);
            request.setDeadline(Instant.now().plus(Duration.ofMinutes(5)));

            webTestClient.post()
                    .uri("/api/v1/tasks/priority")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(request)
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.priority").isEqualTo("CRITICAL");

            webTestClient.get()
                    .uri("/api/v1/agents/A")
                    .exchange()
                    .expectBody()
                    .jsonPath("$.currentLoad").isEqualTo(0);
        }
    }

    @Nested
    @DisplayName("POST /api/v1/tasks/{taskId}/outcome")
    class OutcomeTests {

        @Test
        @DisplayName("should record the outcome and release the slot")
        void reportOutcome() {
            submit(task("t1")).expectStatus().isOk();

            webTestClient.post()
                    .uri("/api/v1/tasks/{taskId}/outcome", "t1")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(OutcomeRequest.builder()
                            .agentId("A")
                            .success(false)
                            .completionTime(Duration.ofMinutes(3))
                            .failureCategory(FailureCategory.DEPENDENCY_FAILURE)
                            .build())
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.failureCategory").isEqualTo("dependency_failure")
                    .jsonPath("$.currentLoad").isEqualTo(0)
                    .jsonPath("$.learned").isEqualTo(true);

            webTestClient.get()
                    .uri("/api/v1/insights/patterns/failures")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.totalFailurePatterns").isEqualTo(1);
        }

        @Test
        @DisplayName("should return 404 for an unknown agent")
        void unknownAgent() {
            webTestClient.post()
                    .uri("/api/v1/tasks/{taskId}/outcome", "t1")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(OutcomeRequest.builder()
                            .agentId("ghost")
                            .success(true)
                            .completionTime(Duration.ofMinutes(1))
                            .build())
                    .exchange()
                    .expectStatus().isNotFound()
                    .expectBody()
                    .jsonPath("$.code").isEqualTo("AGENT_NOT_FOUND");
        }
    }

    @Nested
    @DisplayName("Messaging endpoints")
    class MessagingTests {

        @Test
        @DisplayName("should deliver the assignment to the agent inbox exactly once")
        void assignmentInInbox() {
            submit(task("t1")).expectStatus().isOk();

            webTestClient.get()
                    .uri("/api/v1/messages/{recipient}", "A")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.length()").isEqualTo(1)
                    .jsonPath("$[0].type").isEqualTo("TASK_ASSIGNMENT")
                    .jsonPath("$[0].content.taskId").isEqualTo("t1");

            webTestClient.get()
                    .uri("/api/v1/messages/{recipient}", "A")
                    .exchange()
                    .expectBody()
                    .jsonPath("$.length()").isEqualTo(0);
        }

        @Test
        @DisplayName("should accept a direct message")
        void sendMessage() {
            webTestClient.post()
                    .uri("/api/v1/messages")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(MessageRequest.builder()
                            .from("A")
                            .to("B")
                            .type(MessageType.KNOWLEDGE_SHARE)
                            .content(Map.of("tip", "batch small files"))
                            .build())
                    .exchange()
                    .expectStatus().isAccepted()
                    .expectBody()
                    .jsonPath("$.id").exists();
        }

        @Test
        @DisplayName("should alert every other agent")
        void emergency() {
            webTestClient.post()
                    .uri("/api/v1/messages/emergency")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(EmergencyRequest.builder()
                            .from("A")
                            .component("database")
                            .status("unreachable")
                            .build())
                    .exchange()
                    .expectStatus().isAccepted()
                    .expectBody()
                    .jsonPath("$.recipients.length()").isEqualTo(1)
                    .jsonPath("$.recipients[0]").isEqualTo("B");
        }
    }

    @Nested
    @DisplayName("Insights endpoints")
    class InsightsTests {

        @Test
        @DisplayName("should report workload after routing")
        void workload() {
            submit(task("t1")).expectStatus().isOk();

            webTestClient.get()
                    .uri("/api/v1/insights/workload")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.totalAgents").isEqualTo(2)
                    .jsonPath("$.agents.A.currentLoad").isEqualTo(1);
        }

        @Test
        @DisplayName("should answer the learning and distribution reports")
        void reports() {
            webTestClient.get()
                    .uri("/api/v1/insights/learning")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.healthStatus").isEqualTo("insufficient_data");

            webTestClient.get()
                    .uri("/api/v1/insights/distribution")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.underutilizedAgents.length()").isEqualTo(2);

            webTestClient.post()
                    .uri("/api/v1/insights/improvements")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$[0].improvementId").isEqualTo("capacity_optimization");
        }
    }
}
