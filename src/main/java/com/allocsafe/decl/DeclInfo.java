package com.allocsafe.decl;

/** Result of parsing one declaration: the declared name and its type chain. */
public final class DeclInfo {

    private final String identifier;
    private final DeclType type;

    public DeclInfo(String identifier, DeclType type) {
        this.identifier = identifier;
        this.type = type;
    }

    /** Declared name, or {@code null} for an abstract declarator. */
    public String identifier() {
        return identifier;
    }

    public DeclType type() {
        return type;
    }

    public boolean isAbstract() {
        return identifier == null;
    }

    public String render() {
        return type.render(identifier);
    }

    @Override
    public String toString() {
        return (identifier == null ? "<abstract>" : identifier) + ": " + type;
    }
}
