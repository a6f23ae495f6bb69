package com.allocsafe.analysis;

/** Where an allocator hands back the memory it obtained. */
public enum AllocStyle {
    RETURN_PTR,
    /** Through an output argument, e.g. the first parameter of {@code asprintf}. */
    ARG_PTR
}
