package io.datawrangle.core.error;

import io.datawrangle.core.model.SchemaViolation;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a recipe fails structural validation. Carries every violation found in the document,
 * not only the first one.
 */
public final class SchemaViolationException extends WrangleLoadException {

    private static final long serialVersionUID = 1L;

    private final transient List<SchemaViolation> violations;

    public SchemaViolationException(List<SchemaViolation> violations, String source) {
        super(describe(violations), source);
        this.violations = List.copyOf(violations);
    }

    /** All violations, in document order. */
    public List<SchemaViolation> violations() {
        return violations;
    }

    private static String describe(List<SchemaViolation> violations) {
        return "Recipe has " + violations.size() + " schema violation" + (violations.size() == 1 ? "" : "s") + ": "
                + violations.stream().map(SchemaViolation::toString).collect(Collectors.joining("; "));
    }
}
