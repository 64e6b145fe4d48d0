package com.assessmentplatform.common.exception;

import com.assessmentplatform.common.specialist.Specialist;

/**
 * Any failed call to a decision service: transport error, timeout, non-2xx status,
 * malformed body or an agent-reported error.
 */
public class SpecialistException extends RuntimeException {
    private final Specialist specialist;

    public SpecialistException(Specialist specialist, String message) {
        super(message);
        this.specialist = specialist;
    }

    public SpecialistException(Specialist specialist, String message, Throwable cause) {
        super(message, cause);
        this.specialist = specialist;
    }

    public Specialist getSpecialist() {
        return specialist;
    }
}
