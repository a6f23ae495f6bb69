package com.allocsafe.decl;

public enum DeclTypeKind {
    /** Fundamental specifier text such as {@code int} or {@code struct S}. */
    BASE,
    PTR,
    ARRAY,
    FUNC
}
