package com.dingdangmaoup.contentpool.validation;

import java.util.List;

/**
 * Outcome of manifest validation with every collected error
 */
public final class ValidationResult {

    private static final ValidationResult VALID = new ValidationResult(List.of());

    private final List<String> errors;

    private ValidationResult(List<String> errors) {
        this.errors = List.copyOf(errors);
    }

    public static ValidationResult of(List<String> errors) {
        return errors.isEmpty() ? VALID : new ValidationResult(errors);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public List<String> getErrors() {
        return errors;
    }

    public String joinedErrors() {
        return String.join(", ", errors);
    }
}
