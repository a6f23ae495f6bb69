package com.allocsafe.decl;

import java.util.ArrayList;
import java.util.List;

import com.allocsafe.FixerException;
import com.allocsafe.lexer.TokenKind;
import com.allocsafe.lexer.TokenList;

/**
 * Recursive-descent parser for a single C declaration, resolving declarator
 * precedence with the spiral rule: leading {@code *} tokens wrap whatever the
 * rest of the declarator yields, trailing {@code [..]} and {@code (..)} wrap
 * the declarator built so far, and a parenthesised group binds tighter than
 * both.
 */
public final class DeclaratorParser {

    private final TokenList tokens;
    private int pos;
    private int end;

    private DeclaratorParser(TokenList tokens, int start, int end) {
        this.tokens = tokens;
        this.pos = start;
        this.end = end;
    }

    /**
     * Parses the declaration spanning tokens {@code [start, end)}. Parsing
     * stops quietly at an initializer, a bit-field width, a comma or a
     * semicolon.
     *
     * @throws FixerException {@code INVALID_ARGUMENT} for a null list or a
     *                        range outside it, {@code SYNTAX_ERROR} when the
     *                        tokens do not form a declaration
     */
    public static DeclInfo parseDeclaration(TokenList tokens, int start, int end) {
        FixerException.requireArg(tokens, "tokens");
        if (start < 0 || end > tokens.size() || start > end) {
            throw FixerException.invalidArgument(
                    "range [" + start + ", " + end + ") outside token list of size " + tokens.size());
        }
        DeclaratorParser p = new DeclaratorParser(tokens, start, end);
        return p.parseTop();
    }

    private DeclInfo parseTop() {
        skipTrivia();
        if (pos >= end) {
            throw FixerException.syntax("empty declaration");
        }
        DeclType base = DeclType.base(parseSpecifiers());
        DeclInfo info = parseDeclarator(base);
        skipTrivia();
        while (pos < end && peek() == TokenKind.IDENTIFIER && isAttributeKeyword(tokens.text(pos))) {
            consumeCallLike();
            skipTrivia();
        }
        if (pos < end && !endsDeclarator(peek())) {
            throw FixerException.syntax("unexpected '" + tokens.text(pos) + "' after declarator");
        }
        return info;
    }

    // -------- Specifiers --------

    private String parseSpecifiers() {
        List<String> parts = new ArrayList<>();
        boolean seenType = false;
        while (true) {
            skipTrivia();
            if (pos >= end) {
                break;
            }
            TokenKind k = peek();
            if (k == TokenKind.LBRACKET && peekAt(1) == TokenKind.LBRACKET) {
                parts.add(consumeGroup());
            } else if (k == TokenKind.IDENTIFIER && isAttributeKeyword(tokens.text(pos))) {
                parts.add(consumeCallLike());
            } else if (k == TokenKind.KW_STRUCT || k == TokenKind.KW_UNION || k == TokenKind.KW_ENUM) {
                parts.add(consumeTagged());
                seenType = true;
            } else if (k == TokenKind.KW_ATOMIC && peekAt(1) == TokenKind.LPAREN) {
                parts.add(consumeCallLike());
                seenType = true;
            } else if (k == TokenKind.KW_TYPEOF || k == TokenKind.KW_TYPEOF_UNQUAL || k == TokenKind.KW_BITINT) {
                parts.add(consumeCallLike());
                seenType = true;
            } else if ((k == TokenKind.KW_ALIGNAS || k == TokenKind.KW_ALIGNAS_C23)
                    && peekAt(1) == TokenKind.LPAREN) {
                parts.add(consumeCallLike());
            } else if (k.isDeclarationSpecifier()) {
                parts.add(tokens.text(pos++));
                if (isTypeKeyword(k)) {
                    seenType = true;
                }
            } else if (k == TokenKind.IDENTIFIER && !seenType) {
                // typedef name
                parts.add(tokens.text(pos++));
                seenType = true;
            } else {
                break;
            }
        }
        if (parts.isEmpty()) {
            throw FixerException.syntax("missing type specifier at '" + currentText() + "'");
        }
        return String.join(" ", parts);
    }

    private String consumeTagged() {
        int first = pos;
        pos++;
        skipTrivia();
        while (pos < end && peek() == TokenKind.IDENTIFIER && isAttributeKeyword(tokens.text(pos))) {
            consumeCallLike();
            skipTrivia();
        }
        if (pos < end && peek() == TokenKind.IDENTIFIER) {
            pos++;
            skipTrivia();
        }
        if (pos < end && peek() == TokenKind.LBRACE) {
            int close = closeOf(pos);
            pos = close + 1;
        }
        return squash(tokens.text(first, pos)).trim();
    }

    /** Consumes {@code word ( ... )}, or just {@code word} when no group follows. */
    private String consumeCallLike() {
        int first = pos;
        pos++;
        int open = tokens.nextSignificant(pos, end);
        if (open < end && tokens.kind(open) == TokenKind.LPAREN) {
            pos = closeOf(open) + 1;
        }
        return squash(tokens.text(first, pos));
    }

    private String consumeGroup() {
        int first = pos;
        pos = closeOf(pos) + 1;
        return squash(tokens.text(first, pos));
    }

    // -------- Declarator --------

    private DeclInfo parseDeclarator(DeclType base) {
        List<String> pointers = new ArrayList<>();
        skipTrivia();
        while (pos < end && peek() == TokenKind.STAR) {
            pos++;
            pointers.add(parsePointerQualifiers());
            skipTrivia();
        }

        String name = null;
        DeclType type;
        if (pos < end && peek() == TokenKind.IDENTIFIER && !isAttributeKeyword(tokens.text(pos))) {
            name = tokens.text(pos++);
            type = base;
        } else if (pos < end && peek() == TokenKind.LPAREN && opensGroup(pos)) {
            int close = closeOf(pos);
            DeclaratorParser nested = new DeclaratorParser(tokens, pos + 1, close);
            DeclInfo group = nested.parseDeclarator(base);
            nested.skipTrivia();
            if (nested.pos != close) {
                throw FixerException.syntax("unexpected '" + tokens.text(nested.pos) + "' in grouped declarator");
            }
            pos = close + 1;
            name = group.identifier();
            type = group.type();
        } else {
            type = base;
        }

        type = parsePostfix(type);

        for (int i = pointers.size() - 1; i >= 0; i--) {
            type = DeclType.pointer(pointers.get(i), type);
        }
        return new DeclInfo(name, type);
    }

    private String parsePointerQualifiers() {
        List<String> quals = new ArrayList<>();
        while (true) {
            skipTrivia();
            if (pos >= end) {
                break;
            }
            TokenKind k = peek();
            if (k.isPointerQualifier()) {
                quals.add(tokens.text(pos++));
            } else if (k == TokenKind.IDENTIFIER && isAttributeKeyword(tokens.text(pos))) {
                consumeCallLike();
            } else {
                break;
            }
        }
        return quals.isEmpty() ? null : String.join(" ", quals);
    }

    private DeclType parsePostfix(DeclType type) {
        while (true) {
            skipTrivia();
            if (pos >= end) {
                return type;
            }
            TokenKind k = peek();
            if (k == TokenKind.LBRACKET) {
                int close = closeOf(pos);
                String size = squash(tokens.text(pos + 1, close)).trim();
                type = DeclType.array(size.isEmpty() ? null : size, type);
                pos = close + 1;
            } else if (k == TokenKind.LPAREN) {
                int close = closeOf(pos);
                type = DeclType.function(tokens.text(pos + 1, close).trim(), type);
                pos = close + 1;
            } else {
                return type;
            }
        }
    }

    /**
     * A {@code (} in declarator position starts a nested declarator when the
     * next significant token is a pointer or a name; otherwise it is a
     * parameter list of an abstract function declarator.
     */
    private boolean opensGroup(int open) {
        int next = tokens.nextSignificant(open + 1, end);
        if (next >= end) {
            return false;
        }
        TokenKind k = tokens.kind(next);
        if (k == TokenKind.STAR) {
            return true;
        }
        if (k == TokenKind.IDENTIFIER) {
            return !isAttributeKeyword(tokens.text(next));
        }
        return k == TokenKind.LPAREN && opensGroup(next);
    }

    // -------- Helpers --------

    private int closeOf(int open) {
        int close = tokens.matchingClose(open, end);
        if (close < 0) {
            throw FixerException.syntax("unbalanced '" + tokens.text(open) + "' at token " + open);
        }
        return close;
    }

    private void skipTrivia() {
        while (pos < end && tokens.kind(pos).isTrivia()) {
            pos++;
        }
    }

    private TokenKind peek() {
        return tokens.kind(pos);
    }

    private TokenKind peekAt(int ahead) {
        int i = pos;
        for (int n = 0; n < ahead; n++) {
            i = tokens.nextSignificant(i + 1, end);
            if (i >= end) {
                return null;
            }
        }
        return tokens.kind(i);
    }

    private String currentText() {
        return pos < end ? tokens.text(pos) : "<end>";
    }

    private static boolean endsDeclarator(TokenKind k) {
        return k == TokenKind.ASSIGN || k == TokenKind.COLON || k == TokenKind.COMMA || k == TokenKind.SEMICOLON;
    }

    private static boolean isAttributeKeyword(String word) {
        return word.equals("__attribute__") || word.equals("__declspec") || word.equals("__asm__")
                || word.equals("asm") || word.equals("__extension__");
    }

    private static boolean isTypeKeyword(TokenKind k) {
        switch (k) {
            case KW_CHAR:
            case KW_DOUBLE:
            case KW_FLOAT:
            case KW_INT:
            case KW_LONG:
            case KW_SHORT:
            case KW_SIGNED:
            case KW_UNSIGNED:
            case KW_VOID:
            case KW_BOOL:
            case KW_BOOL_C23:
            case KW_COMPLEX:
            case KW_IMAGINARY:
            case KW_DECIMAL32:
            case KW_DECIMAL64:
            case KW_DECIMAL128:
                return true;
            default:
                return false;
        }
    }

    /** Collapses whitespace runs and newlines to single spaces. */
    static String squash(String s) {
        return s.replaceAll("\\s+", " ");
    }
}
