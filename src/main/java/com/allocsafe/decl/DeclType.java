package com.allocsafe.decl;

import java.util.Objects;

/**
 * One link of a declarator type chain. The chain mirrors how the declarator
 * nests: {@code int *x[3]} is {@code PTR -> ARRAY(3) -> BASE(int)} while
 * {@code int (*x)[3]} is {@code ARRAY(3) -> PTR -> BASE(int)}. Every chain
 * ends in exactly one {@link DeclTypeKind#BASE} node.
 */
public final class DeclType {

    private final DeclTypeKind kind;
    private final String text;
    private final DeclType inner;

    private DeclType(DeclTypeKind kind, String text, DeclType inner) {
        this.kind = kind;
        this.text = text;
        this.inner = inner;
    }

    public static DeclType base(String specifiers) {
        return new DeclType(DeclTypeKind.BASE, Objects.requireNonNull(specifiers), null);
    }

    public static DeclType pointer(String qualifiers, DeclType inner) {
        return new DeclType(DeclTypeKind.PTR, qualifiers, Objects.requireNonNull(inner));
    }

    public static DeclType array(String size, DeclType inner) {
        return new DeclType(DeclTypeKind.ARRAY, size, Objects.requireNonNull(inner));
    }

    public static DeclType function(String params, DeclType inner) {
        return new DeclType(DeclTypeKind.FUNC, Objects.requireNonNull(params), Objects.requireNonNull(inner));
    }

    public DeclTypeKind kind() {
        return kind;
    }

    /** Next node toward the base, {@code null} for BASE. */
    public DeclType inner() {
        return inner;
    }

    /** Specifier text of a BASE node. */
    public String baseName() {
        return kind == DeclTypeKind.BASE ? text : null;
    }

    /** Qualifiers of a PTR node, {@code null} when unqualified. */
    public String qualifiers() {
        return kind == DeclTypeKind.PTR ? text : null;
    }

    /** Dimension text of an ARRAY node, {@code null} for {@code []}. */
    public String arraySize() {
        return kind == DeclTypeKind.ARRAY ? text : null;
    }

    /** Raw parameter text of a FUNC node. */
    public String params() {
        return kind == DeclTypeKind.FUNC ? text : null;
    }

    public boolean is(DeclTypeKind k) {
        return kind == k;
    }

    /** The BASE node at the end of this chain. */
    public DeclType base() {
        DeclType t = this;
        while (t.inner != null) {
            t = t.inner;
        }
        return t;
    }

    public int depth() {
        int d = 0;
        for (DeclType t = this; t != null; t = t.inner) {
            d++;
        }
        return d;
    }

    /**
     * Emits C text declaring {@code name} with this type. A {@code null}
     * name renders the abstract form used in casts.
     */
    public String render(String name) {
        String decl = renderDeclarator(name == null ? "" : name);
        String baseText = base().text;
        return decl.isEmpty() ? baseText : baseText + " " + decl;
    }

    private String renderDeclarator(String name) {
        switch (kind) {
            case BASE:
                return name;
            case PTR: {
                String rest = inner.renderDeclarator(name);
                if (text == null) {
                    return "*" + rest;
                }
                return rest.isEmpty() ? "*" + text : "*" + text + " " + rest;
            }
            case ARRAY:
                return wrapForPostfix(inner.renderDeclarator(name)) + "[" + (text == null ? "" : text) + "]";
            case FUNC:
                return wrapForPostfix(inner.renderDeclarator(name)) + "(" + text + ")";
            default:
                throw new IllegalStateException("unknown kind " + kind);
        }
    }

    private String wrapForPostfix(String rest) {
        return inner.kind == DeclTypeKind.PTR ? "(" + rest + ")" : rest;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DeclType)) {
            return false;
        }
        DeclType other = (DeclType) o;
        return kind == other.kind && Objects.equals(text, other.text) && Objects.equals(inner, other.inner);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, text, inner);
    }

    @Override
    public String toString() {
        String self = kind + (text == null ? "" : "(" + text + ")");
        return inner == null ? self : self + " -> " + inner;
    }
}
