package com.allocsafe.refactor;

/**
 * A function whose signature was changed. The strings are shared with
 * whoever registered the function; nothing is copied.
 */
public final class RefactoredFunction {

    private final String name;
    private final RefactorType type;
    private final String returnType;

    public RefactoredFunction(String name, RefactorType type, String returnType) {
        this.name = name;
        this.type = type;
        this.returnType = returnType;
    }

    public String name() {
        return name;
    }

    public RefactorType type() {
        return type;
    }

    /** Original return type, e.g. {@code char *}; may be {@code null} for VOID_TO_INT. */
    public String returnType() {
        return returnType;
    }

    @Override
    public String toString() {
        return name + " [" + type + (returnType == null ? "" : ", " + returnType) + "]";
    }
}
