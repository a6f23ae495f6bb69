package com.allocsafe;

/**
 * Raised by every stage of the pipeline. The {@link ErrorKind} tells callers
 * whether the input, the C text, or a resource limit was at fault.
 */
public class FixerException extends RuntimeException {

    public enum ErrorKind {
        /** A required argument was null or out of range. */
        INVALID_ARGUMENT,
        /** The token range could not be parsed as C. */
        SYNTAX_ERROR,
        /** A configured size limit was exceeded. */
        ALLOCATION_FAILURE,
        /** Two patches edit overlapping token ranges. */
        PATCH_CONFLICT
    }

    private final ErrorKind kind;

    public FixerException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public FixerException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public static FixerException invalidArgument(String message) {
        return new FixerException(ErrorKind.INVALID_ARGUMENT, message);
    }

    public static FixerException syntax(String message) {
        return new FixerException(ErrorKind.SYNTAX_ERROR, message);
    }

    /** Null-check helper used at every public entry point. */
    public static <T> T requireArg(T value, String name) {
        if (value == null) {
            throw invalidArgument(name + " must not be null");
        }
        return value;
    }

    @Override
    public String toString() {
        return "FixerException[" + kind + "]: " + getMessage();
    }
}
