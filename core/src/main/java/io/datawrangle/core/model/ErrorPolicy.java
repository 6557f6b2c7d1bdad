package io.datawrangle.core.model;

/** How a failing step is handled, selected per step with the {@code on_error} key. */
public enum ErrorPolicy {
    /** Halt the run (default). */
    FAIL("fail"),
    /** Leave the dataset unchanged, record the step as skipped and continue. */
    SKIP_STEP("skip_step"),
    /** Drop the failing rows, record how many were dropped and continue. */
    SKIP_ROW("skip_row");

    private final String key;

    ErrorPolicy(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    /**
     * Parses an {@code on_error} value.
     *
     * @return the policy, or {@code null} if the value is not recognized
     */
    public static ErrorPolicy fromKey(String key) {
        for (ErrorPolicy policy : values()) {
            if (policy.key.equals(key)) {
                return policy;
            }
        }
        return null;
    }
}
