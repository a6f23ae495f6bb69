package com.allocsafe.lexer;

/** Statement-level navigation over a token list. */
public final class Statements {

    private Statements() {
    }

    /**
     * First significant token of the statement containing {@code idx}: the
     * token after the nearest preceding {@code ;}, <code>{</code> or
     * <code>}</code>.
     */
    public static int start(TokenList tokens, int idx) {
        int i = idx - 1;
        while (i >= 0 && !isBoundary(tokens.kind(i))) {
            i--;
        }
        return tokens.nextSignificant(i + 1);
    }

    /**
     * Index of the {@code ;} ending the statement that contains {@code idx},
     * skipping semicolons nested in parentheses or braces. Returns -1 when
     * there is none, or when {@code idx} sits inside a {@code for} header.
     */
    public static int end(TokenList tokens, int idx) {
        if (inForHeader(tokens, idx)) {
            return -1;
        }
        int depth = 0;
        for (int i = idx; i < tokens.size(); i++) {
            TokenKind k = tokens.kind(i);
            if (k == TokenKind.LPAREN || k == TokenKind.LBRACKET || k == TokenKind.LBRACE) {
                depth++;
            } else if (k == TokenKind.RPAREN || k == TokenKind.RBRACKET || k == TokenKind.RBRACE) {
                if (depth == 0) {
                    // closed an enclosing group; keep scanning for the outer ';'
                    if (k == TokenKind.RBRACE) {
                        return -1;
                    }
                } else {
                    depth--;
                }
            } else if (k == TokenKind.SEMICOLON && depth == 0) {
                return i;
            }
        }
        return -1;
    }

    public static boolean inForHeader(TokenList tokens, int idx) {
        int depth = 0;
        for (int i = idx - 1; i >= 0; i--) {
            TokenKind k = tokens.kind(i);
            if (k == TokenKind.RPAREN) {
                depth++;
            } else if (k == TokenKind.LPAREN) {
                if (depth == 0) {
                    int prev = tokens.prevSignificant(i - 1);
                    if (prev >= 0 && tokens.kind(prev) == TokenKind.KW_FOR) {
                        return true;
                    }
                } else {
                    depth--;
                }
            } else if (k == TokenKind.LBRACE || k == TokenKind.RBRACE) {
                return false;
            }
        }
        return false;
    }

    /** Index of the first top-level {@code ,} in {@code [from, limit)}, or {@code limit}. */
    public static int argumentEnd(TokenList tokens, int from, int limit) {
        int depth = 0;
        for (int i = from; i < limit; i++) {
            TokenKind k = tokens.kind(i);
            if (k == TokenKind.LPAREN || k == TokenKind.LBRACKET || k == TokenKind.LBRACE) {
                depth++;
            } else if (k == TokenKind.RPAREN || k == TokenKind.RBRACKET || k == TokenKind.RBRACE) {
                depth--;
            } else if (k == TokenKind.COMMA && depth == 0) {
                return i;
            }
        }
        return limit;
    }

    /** First token of a simple lvalue ending right before {@code assignIdx}, or -1. */
    public static int lvalueStart(TokenList tokens, int assignIdx) {
        int i = tokens.prevSignificant(assignIdx - 1);
        while (i >= 0) {
            TokenKind k = tokens.kind(i);
            if (k == TokenKind.RBRACKET) {
                int open = tokens.matchingOpen(i);
                if (open < 0) {
                    return -1;
                }
                i = tokens.prevSignificant(open - 1);
            } else if (k == TokenKind.IDENTIFIER) {
                int prev = tokens.prevSignificant(i - 1);
                if (prev >= 0 && (tokens.kind(prev) == TokenKind.ARROW || tokens.kind(prev) == TokenKind.DOT)) {
                    i = tokens.prevSignificant(prev - 1);
                    continue;
                }
                // `*p = ...` at statement start assigns through p
                if (prev >= 0 && tokens.kind(prev) == TokenKind.STAR) {
                    int before = tokens.prevSignificant(prev - 1);
                    if (before < 0 || isBoundary(tokens.kind(before))) {
                        return prev;
                    }
                }
                return i;
            } else {
                return -1;
            }
        }
        return -1;
    }

    /**
     * Index of the top-level {@code =} assigning the value that starts after
     * it, scanning back from {@code idx} to the statement boundary. Returns
     * -1 when {@code idx} is not on the right of a plain assignment.
     */
    public static int assignmentBefore(TokenList tokens, int idx) {
        int depth = 0;
        for (int i = idx - 1; i >= 0; i--) {
            TokenKind k = tokens.kind(i);
            if (k == TokenKind.RPAREN || k == TokenKind.RBRACKET) {
                depth++;
            } else if (k == TokenKind.LPAREN || k == TokenKind.LBRACKET) {
                if (depth == 0) {
                    return -1;
                }
                depth--;
            } else if (k == TokenKind.ASSIGN && depth == 0) {
                return i;
            } else if (isBoundary(k) || (k == TokenKind.COMMA && depth == 0)) {
                return -1;
            }
        }
        return -1;
    }

    /**
     * True when the statement right after {@code prev} is the unbraced body
     * of {@code if}, {@code while}, {@code for}, {@code else} or {@code do}.
     */
    public static boolean isControlledBody(TokenList tokens, int prev) {
        if (prev < 0) {
            return false;
        }
        TokenKind k = tokens.kind(prev);
        if (k == TokenKind.KW_ELSE || k == TokenKind.KW_DO) {
            return true;
        }
        if (k != TokenKind.RPAREN) {
            return false;
        }
        int open = tokens.matchingOpen(prev);
        int kw = open < 0 ? -1 : tokens.prevSignificant(open - 1);
        return kw >= 0 && (tokens.kind(kw) == TokenKind.KW_IF || tokens.kind(kw) == TokenKind.KW_WHILE
                || tokens.kind(kw) == TokenKind.KW_FOR);
    }

    /** Significant token texts of {@code [start, end)} joined without whitespace. */
    public static String compact(TokenList tokens, int start, int end) {
        StringBuilder sb = new StringBuilder();
        for (int i = start; i < end && i < tokens.size(); i++) {
            if (!tokens.kind(i).isTrivia()) {
                sb.append(tokens.text(i));
            }
        }
        return sb.toString();
    }

    public static boolean isBoundary(TokenKind k) {
        return k == TokenKind.SEMICOLON || k == TokenKind.LBRACE || k == TokenKind.RBRACE;
    }
}
