package com.z254.hivemind.dispatch.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * A named competency a task may require and an agent may hold with a proficiency rating.
 * <p>
 * Identity is the normalized tag (lower-case, kebab-case). The set of tags accepted at
 * runtime is owned by {@link com.z254.hivemind.dispatch.registry.CapabilityCatalog};
 * the constants below are the built-in entries it is seeded with.
 */
public final class Capability implements Comparable<Capability> {

    public static final Capability SMS_INTEGRATION = new Capability("sms-integration");
    public static final Capability NLP_PROCESSING = new Capability("nlp-processing");
    public static final Capability PYTHON_DEVELOPMENT = new Capability("python-development");
    public static final Capability MEMORY_MANAGEMENT = new Capability("memory-management");
    public static final Capability DATABASE_OPERATIONS = new Capability("database-operations");
    public static final Capability PERFORMANCE_OPTIMIZATION = new Capability("performance-optimization");
    public static final Capability EMAIL_PROCESSING = new Capability("email-processing");
    public static final Capability ERROR_HANDLING = new Capability("error-handling");
    public static final Capability API_INTEGRATION = new Capability("api-integration");
    public static final Capability TESTING_AUTOMATION = new Capability("testing-automation");
    public static final Capability TASK_ORCHESTRATION = new Capability("task-orchestration");
    public static final Capability SYSTEM_MONITORING = new Capability("system-monitoring");
    public static final Capability DOCUMENTATION = new Capability("documentation");
    public static final Capability VOICE_PROCESSING = new Capability("voice-processing");
    public static final Capability DATA_PROCESSING = new Capability("data-processing");
    public static final Capability CUSTOMER_SERVICE = new Capability("customer-service");
    public static final Capability CODE_ANALYSIS = new Capability("code-analysis");
    public static final Capability COORDINATION = new Capability("coordination");

    public static final List<Capability> BUILT_IN = List.of(
            SMS_INTEGRATION, NLP_PROCESSING, PYTHON_DEVELOPMENT, MEMORY_MANAGEMENT,
            DATABASE_OPERATIONS, PERFORMANCE_OPTIMIZATION, EMAIL_PROCESSING, ERROR_HANDLING,
            API_INTEGRATION, TESTING_AUTOMATION, TASK_ORCHESTRATION, SYSTEM_MONITORING,
            DOCUMENTATION, VOICE_PROCESSING, DATA_PROCESSING, CUSTOMER_SERVICE,
            CODE_ANALYSIS, COORDINATION);

    private final String tag;

    private Capability(String tag) {
        this.tag = tag;
    }

    /**
     * Create a capability from a raw tag. Underscores and whitespace become dashes.
     * This does not check the tag against the catalog.
     */
    @JsonCreator
    public static Capability of(String tag) {
        if (tag == null || tag.isBlank()) {
            throw new IllegalArgumentException("Capability tag must not be blank");
        }
        return new Capability(normalize(tag));
    }

    public static String normalize(String tag) {
        return tag.trim()
                .toLowerCase(Locale.ROOT)
                .replace('_', '-')
                .replaceAll("\\s+", "-");
    }

    @JsonValue
    public String getTag() {
        return tag;
    }

    @Override
    public int compareTo(Capability other) {
        return tag.compareTo(other.tag);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Capability)) return false;
        return tag.equals(((Capability) o).tag);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tag);
    }

    @Override
    public String toString() {
        return tag;
    }
}
