package com.allocsafe.lexer;

/**
 * A classified span of the source buffer. The text is not copied; it is cut
 * from the shared source string on demand.
 */
public final class Token {

    private final TokenKind kind;
    private final int start;
    private final int length;
    private final String source;

    Token(TokenKind kind, int start, int length, String source) {
        this.kind = kind;
        this.start = start;
        this.length = length;
        this.source = source;
    }

    public TokenKind kind() {
        return kind;
    }

    /** Character offset of the first character in the source. */
    public int start() {
        return start;
    }

    public int length() {
        return length;
    }

    public int end() {
        return start + length;
    }

    public String text() {
        return source.substring(start, start + length);
    }

    public boolean is(TokenKind k) {
        return kind == k;
    }

    public boolean isIdentifier(String name) {
        return kind == TokenKind.IDENTIFIER && length == name.length()
                && source.startsWith(name, start);
    }

    @Override
    public String toString() {
        return kind + "@" + start + "[" + text() + "]";
    }
}
