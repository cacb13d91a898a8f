package me.golemcore.reasoning.domain.policy;

/**
 * Raised when an action is malformed and cannot be evaluated. Always treated as
 * a denial.
 */
public class PolicyException extends RuntimeException {

    public PolicyException(String message) {
        super(message);
    }
}
