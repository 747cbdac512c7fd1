package com.sceneit.engine.model;

/**
 * Thrown by the validated text value types when their input is rejected.
 */
public final class TextValidationException extends IllegalArgumentException {

    public enum Problem {
        EMPTY,
        TOO_LONG,
        CONTROL_CHARS
    }

    private final String field;
    private final Problem problem;

    public TextValidationException(String field, Problem problem, String message) {
        super(field + ": " + message);
        this.field = field;
        this.problem = problem;
    }

    public String field() {
        return field;
    }

    public Problem problem() {
        return problem;
    }
}
