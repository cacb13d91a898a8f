package me.golemcore.reasoning.domain.output;

import java.util.List;

/**
 * Outcome of checking a final answer against the requested response format.
 *
 * @param valid
 *            whether the answer can be accepted
 * @param output
 *            accepted answer with code fences removed; {@code null} when invalid
 * @param violations
 *            individual problems found, empty when valid
 * @param feedback
 *            message telling the model what to fix; {@code null} when valid
 */
public record OutputValidation(boolean valid, String output, List<String> violations, String feedback) {

    public OutputValidation {
        violations = violations != null ? List.copyOf(violations) : List.of();
    }

    static OutputValidation accepted(String output) {
        return new OutputValidation(true, output, List.of(), null);
    }

    static OutputValidation notJson(String message, int line, int column, String rawPrefix) {
        String problem = "JSON parse error at line " + line + ", column " + column + ": " + message
                + ". Raw text starts with: \"" + rawPrefix + "\"";
        return new OutputValidation(false, null, List.of(problem),
                "Your response was not valid JSON. Error at line " + line + ", column " + column + ": " + message
                        + ". Please respond with a valid JSON object.");
    }

    static OutputValidation violated(List<String> violations) {
        return new OutputValidation(false, null, violations,
                "Your JSON response did not match the required schema. Issues: " + String.join("; ", violations)
                        + ". Please fix these and try again.");
    }
}
