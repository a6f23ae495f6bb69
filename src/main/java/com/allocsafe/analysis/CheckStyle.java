package com.allocsafe.analysis;

/** How the result of an allocator signals failure. */
public enum CheckStyle {
    /** Returns {@code NULL} on failure. */
    PTR_NULL,
    /** Returns a negative count on failure. */
    INT_NEGATIVE,
    /** Returns a non-zero status on failure. */
    INT_NONZERO
}
