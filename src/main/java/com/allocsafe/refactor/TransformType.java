package com.allocsafe.refactor;

/** What happens to the return statements of the body being rewritten. */
public enum TransformType {
    NONE,
    VOID_TO_INT,
    RET_PTR_TO_ARG
}
