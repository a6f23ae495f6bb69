package com.allocsafe.cst;

import com.allocsafe.FixerException;
import com.allocsafe.lexer.TokenKind;
import com.allocsafe.lexer.TokenList;

/**
 * Splits a translation unit into its top-level items: preprocessor lines,
 * declarations, prototypes, type definitions and function definitions.
 * Trivia between items belongs to no node.
 */
public final class TopLevelScanner {

    private final TokenList tokens;
    private final CstNodeList nodes = new CstNodeList();

    private TopLevelScanner(TokenList tokens) {
        this.tokens = tokens;
    }

    public static CstNodeList scan(TokenList tokens) {
        FixerException.requireArg(tokens, "tokens");
        TopLevelScanner s = new TopLevelScanner(tokens);
        s.run();
        return s.nodes;
    }

    private void run() {
        int i = 0;
        while (i < tokens.size()) {
            TokenKind k = tokens.kind(i);
            if (k == TokenKind.WHITESPACE || k == TokenKind.COMMENT) {
                i++;
            } else if (k == TokenKind.DIRECTIVE) {
                nodes.add(new CstNode(directiveKind(tokens.text(i)), i, i + 1));
                i++;
            } else if (k == TokenKind.SEMICOLON) {
                nodes.add(new CstNode(CstNodeKind.EXPRESSION, i, i + 1));
                i++;
            } else {
                i = scanItem(i);
            }
        }
    }

    private int scanItem(int start) {
        int n = tokens.size();
        int firstParen = -1;
        boolean sawAssign = false;
        boolean sawBrace = false;
        boolean knr = false;
        int j = start;
        while (j < n) {
            TokenKind k = tokens.kind(j);
            if (k == TokenKind.LPAREN || k == TokenKind.LBRACKET) {
                if (k == TokenKind.LPAREN && firstParen < 0 && !sawAssign) {
                    firstParen = j;
                }
                int close = tokens.matchingClose(j);
                if (close < 0) {
                    break;
                }
                j = close + 1;
                continue;
            }
            if (k == TokenKind.ASSIGN) {
                sawAssign = true;
            } else if (k == TokenKind.SEMICOLON) {
                if (!sawAssign && !sawBrace && isKnrHeader(firstParen)) {
                    knr = true;
                    j++;
                    continue;
                }
                nodes.add(new CstNode(classify(start, firstParen, sawAssign, sawBrace), start, j + 1));
                return j + 1;
            } else if (k == TokenKind.LBRACE) {
                int close = tokens.matchingClose(j);
                if (close < 0) {
                    break;
                }
                int before = tokens.prevSignificant(j - 1);
                boolean afterHeader = before >= start
                        && (tokens.kind(before) == TokenKind.RPAREN || (knr && tokens.kind(before) == TokenKind.SEMICOLON));
                if (!sawAssign && firstParen >= 0 && afterHeader) {
                    nodes.add(new CstNode(CstNodeKind.FUNCTION, start, close + 1));
                    return close + 1;
                }
                sawBrace = true;
                j = close + 1;
                continue;
            }
            j++;
        }
        nodes.add(new CstNode(CstNodeKind.EXPRESSION, start, n));
        return n;
    }

    /** {@code f(a, b) int a; ...}: an identifier list followed by parameter declarations. */
    private boolean isKnrHeader(int firstParen) {
        if (firstParen < 0) {
            return false;
        }
        int name = tokens.prevSignificant(firstParen - 1);
        if (name < 0 || tokens.kind(name) != TokenKind.IDENTIFIER) {
            return false;
        }
        int close = tokens.matchingClose(firstParen);
        boolean sawIdent = false;
        for (int i = firstParen + 1; i < close; i++) {
            TokenKind k = tokens.kind(i);
            if (k == TokenKind.IDENTIFIER) {
                sawIdent = true;
            } else if (k != TokenKind.COMMA && !k.isTrivia()) {
                return false;
            }
        }
        int after = tokens.nextSignificant(close + 1);
        return sawIdent && after < tokens.size()
                && (tokens.kind(after) == TokenKind.IDENTIFIER || tokens.kind(after).isDeclarationSpecifier());
    }

    private CstNodeKind classify(int start, int firstParen, boolean sawAssign, boolean sawBrace) {
        TokenKind first = tokens.kind(start);
        if (first == TokenKind.KW_TYPEDEF) {
            return CstNodeKind.DEFINITION;
        }
        if (sawBrace && first == TokenKind.KW_STRUCT) {
            return CstNodeKind.STRUCT;
        }
        if (sawBrace && first == TokenKind.KW_UNION) {
            return CstNodeKind.UNION;
        }
        if (sawBrace && first == TokenKind.KW_ENUM) {
            return CstNodeKind.ENUM;
        }
        if (firstParen >= 0 && !sawAssign) {
            int name = tokens.prevSignificant(firstParen - 1);
            if (name >= 0 && tokens.kind(name) == TokenKind.IDENTIFIER) {
                return CstNodeKind.FUNCTION_PROTOTYPE;
            }
        }
        return CstNodeKind.DECLARATION;
    }

    static CstNodeKind directiveKind(String directive) {
        String body = directive.startsWith("%:") ? directive.substring(2) : directive.substring(1);
        body = body.trim();
        int end = 0;
        while (end < body.length() && Character.isLetter(body.charAt(end))) {
            end++;
        }
        switch (body.substring(0, end)) {
            case "include":
            case "include_next":
            case "import":
                return CstNodeKind.MACRO_INCLUDE;
            case "define":
                return CstNodeKind.MACRO_DEFINE;
            case "if":
                return CstNodeKind.MACRO_IF;
            case "ifdef":
            case "ifndef":
                return CstNodeKind.MACRO_IF_DEF;
            case "elif":
            case "elifdef":
            case "elifndef":
                return CstNodeKind.MACRO_ELIF;
            case "else":
                return CstNodeKind.MACRO_ELSE;
            case "pragma":
                return CstNodeKind.MACRO_PRAGMA;
            default:
                return CstNodeKind.EXPRESSION;
        }
    }
}
