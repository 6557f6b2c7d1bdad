package io.datawrangle.core.model;

/**
 * One structural problem found in a recipe.
 *
 * @param position the offending step, or {@code null} for recipe-level problems
 * @param kind     the step's kind name, or {@code null} when unknown
 * @param rule     the rule that was broken
 * @param message  human-readable description
 */
public record SchemaViolation(StepPosition position, String kind, Rule rule, String message) {

    /** Classification of schema rules. */
    public enum Rule {
        UNKNOWN_SECTION,
        MALFORMED_STEP,
        UNKNOWN_KIND,
        MISSING_REQUIRED_KEY,
        UNKNOWN_KEY,
        WRONG_TYPE,
        INVALID_VALUE,
        UNSUPPORTED_ERROR_POLICY
    }

    /** Top-level step index, or {@code null} for recipe-level violations. */
    public Integer stepIndex() {
        return position != null ? position.index() : null;
    }

    @Override
    public String toString() {
        String where = position != null ? position.toString() : "recipe";
        String what = kind != null ? " (" + kind + ")" : "";
        return where + what + " " + rule + ": " + message;
    }
}
