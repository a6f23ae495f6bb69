package com.allocsafe.lexer;

import java.util.Iterator;
import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Ordered tokens of one source buffer. Indices into this list are the
 * coordinates used by allocation sites and patches.
 */
public final class TokenList implements Iterable<Token> {

    private final String source;
    private final ImmutableList<Token> tokens;

    TokenList(String source, List<Token> tokens) {
        this.source = source;
        this.tokens = ImmutableList.copyOf(tokens);
    }

    public String source() {
        return source;
    }

    public int size() {
        return tokens.size();
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    public Token get(int index) {
        return tokens.get(index);
    }

    public TokenKind kind(int index) {
        return tokens.get(index).kind();
    }

    public String text(int index) {
        return tokens.get(index).text();
    }

    /** Source text covered by tokens {@code [start, end)}. */
    public String text(int start, int end) {
        if (start >= end || start >= tokens.size()) {
            return "";
        }
        int last = Math.min(end, tokens.size()) - 1;
        return source.substring(tokens.get(start).start(), tokens.get(last).end());
    }

    /** Index of the first non-trivia token at or after {@code from}, or {@code limit}. */
    public int nextSignificant(int from, int limit) {
        int i = Math.max(from, 0);
        int stop = Math.min(limit, tokens.size());
        while (i < stop && tokens.get(i).kind().isTrivia()) {
            i++;
        }
        return i < stop ? i : limit;
    }

    public int nextSignificant(int from) {
        return nextSignificant(from, tokens.size());
    }

    /** Index of the last non-trivia token at or before {@code from}, or -1. */
    public int prevSignificant(int from) {
        int i = Math.min(from, tokens.size() - 1);
        while (i >= 0 && tokens.get(i).kind().isTrivia()) {
            i--;
        }
        return i;
    }

    /**
     * Given the index of an opening {@code (}, {@code [} or <code>{</code>,
     * returns the index of its matching closer, or -1 when unbalanced
     * before {@code limit}.
     */
    public int matchingClose(int open, int limit) {
        TokenKind o = tokens.get(open).kind();
        TokenKind c;
        if (o == TokenKind.LPAREN) {
            c = TokenKind.RPAREN;
        } else if (o == TokenKind.LBRACKET) {
            c = TokenKind.RBRACKET;
        } else if (o == TokenKind.LBRACE) {
            c = TokenKind.RBRACE;
        } else {
            return -1;
        }
        int depth = 0;
        int stop = Math.min(limit, tokens.size());
        for (int i = open; i < stop; i++) {
            TokenKind k = tokens.get(i).kind();
            if (k == o) {
                depth++;
            } else if (k == c) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    public int matchingClose(int open) {
        return matchingClose(open, tokens.size());
    }

    /** Reverse of {@link #matchingClose(int)}: index of the opener, or -1. */
    public int matchingOpen(int close) {
        TokenKind c = tokens.get(close).kind();
        TokenKind o;
        if (c == TokenKind.RPAREN) {
            o = TokenKind.LPAREN;
        } else if (c == TokenKind.RBRACKET) {
            o = TokenKind.LBRACKET;
        } else if (c == TokenKind.RBRACE) {
            o = TokenKind.LBRACE;
        } else {
            return -1;
        }
        int depth = 0;
        for (int i = close; i >= 0; i--) {
            TokenKind k = tokens.get(i).kind();
            if (k == c) {
                depth++;
            } else if (k == o) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /** Tokens {@code [start, end)} as a list re-based to a fresh source string. */
    public TokenList slice(int start, int end) {
        String text = text(start, end);
        if (text.isEmpty()) {
            return new TokenList("", ImmutableList.of());
        }
        int base = tokens.get(start).start();
        ImmutableList.Builder<Token> b = ImmutableList.builder();
        int stop = Math.min(end, tokens.size());
        for (int i = start; i < stop; i++) {
            Token t = tokens.get(i);
            b.add(new Token(t.kind(), t.start() - base, t.length(), text));
        }
        return new TokenList(text, b.build());
    }

    @Override
    public Iterator<Token> iterator() {
        return tokens.iterator();
    }
}
