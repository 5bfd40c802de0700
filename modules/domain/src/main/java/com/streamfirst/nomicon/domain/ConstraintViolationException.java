package com.streamfirst.nomicon.domain;

import lombok.Getter;
import lombok.NonNull;

/**
 * Thrown when a finished name breaks one of its resource type's structural rules.
 */
@Getter
public class ConstraintViolationException extends NamingException {

    /**
     * The individual checks, in the order they are evaluated.
     */
    public enum Rule {
        MIN_LENGTH,
        MAX_LENGTH,
        PATTERN,
        FORBIDDEN_PREFIX,
        FORBIDDEN_SUFFIX,
        FORBIDDEN_SUBSTRING,
        IP_ADDRESS
    }

    private final String resourceKey;
    private final String candidateName;
    private final Rule rule;

    public ConstraintViolationException(
            @NonNull String resourceKey, @NonNull String candidateName, @NonNull Rule rule, String detail) {
        super(String.format("resource \"%s\" name \"%s\" %s", resourceKey, candidateName, detail));
        this.resourceKey = resourceKey;
        this.candidateName = candidateName;
        this.rule = rule;
    }

    @Override
    public String errorCode() {
        return "CONSTRAINT_VIOLATION";
    }
}
