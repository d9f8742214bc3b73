package com.z254.hivemind.dispatch.routing;

import com.z254.hivemind.dispatch.DispatchTestFixtures;
import com.z254.hivemind.dispatch.config.DispatchProperties;
import com.z254.hivemind.dispatch.domain.model.Capability;
import com.z254.hivemind.dispatch.domain.model.TaskPriority;
import com.z254.hivemind.dispatch.domain.model.TaskRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

import static com.z254.hivemind.dispatch.DispatchTestFixtures.NOW;
import static org.assertj.core.api.Assertions.assertThat;

class PriorityAdjusterTest {

    private PriorityAdjuster adjuster;

    @BeforeEach
    void setUp() {
        adjuster = new PriorityAdjuster(DispatchTestFixtures.clock(), new DispatchProperties());
    }

    private static TaskRequest task(TaskPriority priority, Duration age, Duration untilDeadline) {
        return DispatchTestFixtures.task("t1", Capability.CODE_ANALYSIS).toBuilder()
                .priority(priority)
                .createdAt(NOW.minus(age))
                .deadline(untilDeadline == null ? null : NOW.plus(untilDeadline))
                .build();
    }

    @Test
    @DisplayName("should escalate a day-old LOW task one level only")
    void ageEscalatesOneLevel() {
        TaskRequest adjusted = adjuster.adjust(task(TaskPriority.LOW, Duration.ofHours(25), null));

        assertThat(adjusted.getPriority()).isEqualTo(TaskPriority.MEDIUM);
    }

    @Test
    @DisplayName("should leave a fresh task without deadline untouched")
    void freshTaskUnchanged() {
        TaskRequest task = task(TaskPriority.LOW, Duration.ofHours(23), null);

        assertThat(adjuster.adjust(task)).isSameAs(task);
    }

    @Test
    @DisplayName("should make a task CRITICAL when its deadline is under fifteen minutes away")
    void imminentDeadline() {
        assertThat(adjuster.adjust(task(TaskPriority.LOW, Duration.ZERO, Duration.ofMinutes(10))).getPriority())
                .isEqualTo(TaskPriority.CRITICAL);
        assertThat(adjuster.adjust(task(TaskPriority.LOW, Duration.ZERO, Duration.ofMinutes(-5))).getPriority())
                .isEqualTo(TaskPriority.CRITICAL);
    }

    @Test
    @DisplayName("should raise a task to at least HIGH when its deadline is under an hour away")
    void nearDeadline() {
        assertThat(adjuster.adjust(task(TaskPriority.LOW, Duration.ZERO, Duration.ofMinutes(30))).getPriority())
                .isEqualTo(TaskPriority.HIGH);
        assertThat(adjuster.adjust(task(TaskPriority.CRITICAL, Duration.ZERO, Duration.ofMinutes(30))).getPriority())
                .isEqualTo(TaskPriority.CRITICAL);
        assertThat(adjuster.adjust(task(TaskPriority.LOW, Duration.ZERO, Duration.ofHours(2))).getPriority())
                .isEqualTo(TaskPriority.LOW);
    }

    @Test
    @DisplayName("should combine age escalation with the deadline floor")
    void ageAndDeadline() {
        TaskRequest adjusted = adjuster.adjust(task(TaskPriority.HIGH, Duration.ofHours(30), Duration.ofMinutes(45)));

        assertThat(adjusted.getPriority()).isEqualTo(TaskPriority.CRITICAL);
    }

    @ParameterizedTest
    @EnumSource(TaskPriority.class)
    @DisplayName("should only ever move priority upward")
    void monotonic(TaskPriority start) {
        List<Duration> ages = List.of(Duration.ZERO, Duration.ofHours(25), Duration.ofDays(3));
        List<Duration> deadlines = Arrays.asList(null, Duration.ofMinutes(5), Duration.ofMinutes(40), Duration.ofDays(1));
        for (Duration age : ages) {
            for (Duration deadline : deadlines) {
                TaskRequest original = task(start, age, deadline);
                TaskRequest once = adjuster.adjust(original);
                TaskRequest twice = adjuster.adjust(once);

                assertThat(once.getPriority().isBelow(original.getPriority())).isFalse();
                assertThat(twice.getPriority().isBelow(once.getPriority())).isFalse();
            }
        }
    }

    @Test
    @DisplayName("should keep every other field when escalating")
    void preservesFields() {
        TaskRequest original = task(TaskPriority.LOW, Duration.ofHours(25), null);

        TaskRequest adjusted = adjuster.adjust(original);

        assertThat(adjusted.getId()).isEqualTo(original.getId());
        assertThat(adjusted.getRequiredCapabilities()).isEqualTo(original.getRequiredCapabilities());
        assertThat(adjusted.getCreatedAt()).isEqualTo(original.getCreatedAt());
    }
}
