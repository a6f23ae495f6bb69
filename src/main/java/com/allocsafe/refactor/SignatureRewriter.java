package com.allocsafe.refactor;

import com.allocsafe.FixerConfig;
import com.allocsafe.FixerException;
import com.allocsafe.lexer.TokenKind;
import com.allocsafe.lexer.TokenList;

/**
 * Rewrites a function header so that it returns an {@code int} status.
 * <ul>
 * <li>{@code int f(..)} is kept.</li>
 * <li>{@code void f(..)} becomes {@code int f(..)}.</li>
 * <li>{@code T f(a)} becomes {@code int f(a, T *out)}; an empty or
 * {@code (void)} list becomes {@code (T *out)}.</li>
 * </ul>
 * Storage-class specifiers and leading attributes stay in front.
 */
public final class SignatureRewriter {

    private SignatureRewriter() {
    }

    public static String rewrite(TokenList tokens, int start, int end) {
        return rewrite(tokens, start, end, FixerConfig.defaults());
    }

    /** Rewrites the header in tokens {@code [start, end)}, which must stop before the body. */
    public static String rewrite(TokenList tokens, int start, int end, FixerConfig config) {
        FixerException.requireArg(tokens, "tokens");
        int lparen = -1;
        for (int i = start; i < end; i++) {
            if (tokens.kind(i) == TokenKind.LPAREN) {
                lparen = i;
                break;
            }
        }
        if (lparen < 0) {
            throw FixerException.syntax("no parameter list in '" + tokens.text(start, end).trim() + "'");
        }
        int nameIdx = tokens.prevSignificant(lparen - 1);
        if (nameIdx < start || tokens.kind(nameIdx) != TokenKind.IDENTIFIER) {
            throw FixerException.syntax("no function name before '(' in '" + tokens.text(start, end).trim() + "'");
        }
        int rparen = tokens.matchingClose(lparen, end);
        if (rparen < 0) {
            throw FixerException.syntax("unbalanced parameter list in '" + tokens.text(start, end).trim() + "'");
        }
        int typeStart = typeStart(tokens, start, nameIdx);

        String storage = tokens.text(start, typeStart);
        String name = tokens.text(nameIdx);
        String type = tokens.text(typeStart, nameIdx).trim();
        String args = tokens.text(lparen + 1, rparen);
        String knrDecls = tokens.text(rparen + 1, end).trim();

        if (isOnly(tokens, typeStart, nameIdx, TokenKind.KW_INT)) {
            return tokens.text(start, end).trim();
        }
        if (isOnly(tokens, typeStart, nameIdx, TokenKind.KW_VOID)) {
            return storage + "int " + name + "(" + args + ")" + (knrDecls.isEmpty() ? "" : "\n" + knrDecls);
        }

        String outParam = BodyRewriter.declare(pointerTo(type), config.outArgName());
        if (!knrDecls.isEmpty()) {
            return storage + "int " + name + "(" + args.trim() + ", " + config.outArgName() + ")\n"
                    + knrDecls + "\n" + outParam + ";";
        }
        boolean noArgs = tokens.nextSignificant(lparen + 1, rparen) >= rparen
                || isOnly(tokens, lparen + 1, rparen, TokenKind.KW_VOID);
        if (noArgs) {
            return storage + "int " + name + "(" + outParam + ")";
        }
        return storage + "int " + name + "(" + args + ", " + outParam + ")";
    }

    private static String pointerTo(String type) {
        return type.endsWith("*") ? type + "*" : type + " *";
    }

    /** Return type text of the header, without storage specifiers. */
    public static String returnType(TokenList tokens, int start, int nameIdx) {
        return tokens.text(typeStart(tokens, start, nameIdx), nameIdx).trim();
    }

    static int typeStart(TokenList tokens, int start, int nameIdx) {
        int i = tokens.nextSignificant(start, nameIdx);
        while (i < nameIdx) {
            TokenKind k = tokens.kind(i);
            if (k.isStorageSpecifier()) {
                i = tokens.nextSignificant(i + 1, nameIdx);
            } else if (k == TokenKind.IDENTIFIER && isAttribute(tokens.text(i))) {
                int open = tokens.nextSignificant(i + 1, nameIdx);
                if (open < nameIdx && tokens.kind(open) == TokenKind.LPAREN) {
                    int close = tokens.matchingClose(open, nameIdx);
                    i = close < 0 ? nameIdx : tokens.nextSignificant(close + 1, nameIdx);
                } else {
                    i = open;
                }
            } else {
                break;
            }
        }
        return i;
    }

    private static boolean isAttribute(String word) {
        return word.equals("__attribute__") || word.equals("__declspec");
    }

    private static boolean isOnly(TokenList tokens, int start, int end, TokenKind kind) {
        boolean seen = false;
        for (int i = start; i < end; i++) {
            TokenKind k = tokens.kind(i);
            if (k == kind) {
                seen = true;
            } else if (!k.isTrivia()) {
                return false;
            }
        }
        return seen;
    }

    static boolean isPointerType(TokenList tokens, int start, int end) {
        for (int i = start; i < end; i++) {
            if (tokens.kind(i) == TokenKind.STAR) {
                return true;
            }
        }
        return false;
    }
}
