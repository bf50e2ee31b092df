package com.di.insightnova.scaling;

import java.util.List;

/**
 * A scaling policy write that violates the policy invariants. Mapped to 400.
 */
public class PolicyValidationException extends RuntimeException {

    private final List<String> violations;

    public PolicyValidationException(ResourceType type, List<String> violations) {
        super("Invalid scaling policy for " + type + ": " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
