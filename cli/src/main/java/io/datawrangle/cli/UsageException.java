package io.datawrangle.cli;

/** Thrown for malformed command lines; {@link RecipeMain} prints usage and exits with 2. */
public class UsageException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public UsageException(String message) {
        super(message);
    }
}
