package com.assessmentplatform.common.specialist;

/**
 * Remote decision services the orchestrator consults, with the identifier stamped on
 * recommendations and decisions and the endpoint path the REST transport posts to.
 *
 * <p>{@link #SYSTEM} is not a remote service; it attributes records synthesized by the
 * orchestrator itself (communication errors).
 */
public enum Specialist {
    FIELD_ASSESSOR("field-assessor", "agents/treeai-operations/field-assessment"),
    CERTIFIED_ARBORIST("certified-arborist", "agents/treeai-operations/arborist-assessment"),
    SAFETY_MANAGER("safety-manager", "agents/treeai-operations/safety-analysis"),
    TREESCORE_CALCULATOR("treescore-calculator", "agents/treeai-operations/calculate-treescore"),
    MEASUREMENT_SPECIALIST("ar-realitykit-specialist", "agents/development-team/ar-guidance"),
    SYSTEM("system", null);

    private final String id;
    private final String endpoint;

    Specialist(String id, String endpoint) {
        this.id = id;
        this.endpoint = endpoint;
    }

    public String id() {
        return id;
    }

    /** Path relative to the specialist base URL; {@code null} for {@link #SYSTEM}. */
    public String endpoint() {
        return endpoint;
    }
}
