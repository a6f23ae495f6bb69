package com.allocsafe.refactor;

/** How a function's signature changed, which decides how its callers are rewritten. */
public enum RefactorType {
    /** {@code void f(..)} now returns an int status. */
    VOID_TO_INT,
    /** {@code T f(..)} now returns an int status and writes its result through a trailing {@code T *out}. */
    PTR_TO_INT_OUT
}
