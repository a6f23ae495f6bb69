package com.allocsafe.lexer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.allocsafe.FixerConfig;
import com.allocsafe.FixerException;
import com.google.common.collect.ImmutableMap;

/**
 * Lossless C lexer. Every character of the input belongs to exactly one
 * token, so joining the token texts gives back the input.
 */
public final class Tokenizer {

    private static final Map<String, TokenKind> PUNCTUATORS = ImmutableMap.<String, TokenKind>builder()
            .put("%:%:", TokenKind.HASH_HASH)
            .put("...", TokenKind.ELLIPSIS)
            .put("<<=", TokenKind.LSHIFT_ASSIGN)
            .put(">>=", TokenKind.RSHIFT_ASSIGN)
            .put("->", TokenKind.ARROW)
            .put("++", TokenKind.INCREMENT)
            .put("--", TokenKind.DECREMENT)
            .put("<<", TokenKind.LSHIFT)
            .put(">>", TokenKind.RSHIFT)
            .put("<=", TokenKind.LE)
            .put(">=", TokenKind.GE)
            .put("==", TokenKind.EQ)
            .put("!=", TokenKind.NE)
            .put("&&", TokenKind.LOGICAL_AND)
            .put("||", TokenKind.LOGICAL_OR)
            .put("+=", TokenKind.PLUS_ASSIGN)
            .put("-=", TokenKind.MINUS_ASSIGN)
            .put("*=", TokenKind.STAR_ASSIGN)
            .put("/=", TokenKind.SLASH_ASSIGN)
            .put("%=", TokenKind.PERCENT_ASSIGN)
            .put("&=", TokenKind.AMP_ASSIGN)
            .put("|=", TokenKind.PIPE_ASSIGN)
            .put("^=", TokenKind.CARET_ASSIGN)
            .put("##", TokenKind.HASH_HASH)
            .put("<:", TokenKind.LBRACKET)
            .put(":>", TokenKind.RBRACKET)
            .put("<%", TokenKind.LBRACE)
            .put("%>", TokenKind.RBRACE)
            .put("%:", TokenKind.HASH)
            .put("{", TokenKind.LBRACE)
            .put("}", TokenKind.RBRACE)
            .put("[", TokenKind.LBRACKET)
            .put("]", TokenKind.RBRACKET)
            .put("(", TokenKind.LPAREN)
            .put(")", TokenKind.RPAREN)
            .put(";", TokenKind.SEMICOLON)
            .put(",", TokenKind.COMMA)
            .put(".", TokenKind.DOT)
            .put("?", TokenKind.QUESTION)
            .put(":", TokenKind.COLON)
            .put("#", TokenKind.HASH)
            .put("=", TokenKind.ASSIGN)
            .put("<", TokenKind.LT)
            .put(">", TokenKind.GT)
            .put("!", TokenKind.NOT)
            .put("~", TokenKind.TILDE)
            .put("&", TokenKind.AMPERSAND)
            .put("|", TokenKind.PIPE)
            .put("^", TokenKind.CARET)
            .put("+", TokenKind.PLUS)
            .put("-", TokenKind.MINUS)
            .put("*", TokenKind.STAR)
            .put("/", TokenKind.SLASH)
            .put("%", TokenKind.PERCENT)
            .build();

    private final String src;
    private final int n;
    private final int limit;
    private final List<Token> out = new ArrayList<>();
    private int pos;
    private boolean atLineStart = true;

    private Tokenizer(String src, int limit) {
        this.src = src;
        this.n = src.length();
        this.limit = limit;
    }

    public static TokenList tokenize(String source) {
        return tokenize(source, FixerConfig.defaults());
    }

    /**
     * Splits {@code source} into tokens.
     *
     * @throws FixerException {@code INVALID_ARGUMENT} for null input,
     *                        {@code ALLOCATION_FAILURE} when the token count
     *                        exceeds {@link FixerConfig#tokenLimit()}
     */
    public static TokenList tokenize(String source, FixerConfig config) {
        FixerException.requireArg(source, "source");
        FixerException.requireArg(config, "config");
        Tokenizer t = new Tokenizer(source, config.tokenLimit());
        t.run();
        return new TokenList(source, t.out);
    }

    private void run() {
        while (pos < n) {
            int start = pos;
            TokenKind kind = scan();
            emit(kind, start);
        }
    }

    private void emit(TokenKind kind, int start) {
        if (out.size() >= limit) {
            throw new FixerException(FixerException.ErrorKind.ALLOCATION_FAILURE,
                    "token limit of " + limit + " exceeded at offset " + start);
        }
        out.add(new Token(kind, start, pos - start, src));
        if (kind != TokenKind.WHITESPACE && kind != TokenKind.COMMENT) {
            atLineStart = false;
        }
    }

    private TokenKind scan() {
        char c = src.charAt(pos);

        if (isSpace(c) || isSplice(pos)) {
            scanWhitespace();
            return TokenKind.WHITESPACE;
        }
        if (c == '/' && peek(1) == '/') {
            while (pos < n && src.charAt(pos) != '\n') {
                pos++;
            }
            return TokenKind.COMMENT;
        }
        if (c == '/' && peek(1) == '*') {
            skipBlockComment();
            return TokenKind.COMMENT;
        }
        if (atLineStart && (c == '#' || (c == '%' && peek(1) == ':'))) {
            scanDirective();
            return TokenKind.DIRECTIVE;
        }
        if (isIdentStart(c)) {
            int start = pos;
            while (pos < n && isIdentPart(src.charAt(pos))) {
                pos++;
            }
            String word = src.substring(start, pos);
            if (pos < n && isEncodingPrefix(word)) {
                char q = src.charAt(pos);
                if (q == '"' || q == '\'') {
                    scanQuoted(q);
                    return q == '"' ? TokenKind.STRING_LITERAL : TokenKind.CHAR_LITERAL;
                }
            }
            return TokenKind.forWord(word);
        }
        if (isDigit(c) || (c == '.' && isDigit(peek(1)))) {
            scanNumber();
            return TokenKind.NUMBER_LITERAL;
        }
        if (c == '"') {
            scanQuoted('"');
            return TokenKind.STRING_LITERAL;
        }
        if (c == '\'') {
            scanQuoted('\'');
            return TokenKind.CHAR_LITERAL;
        }
        for (int len = 4; len >= 1; len--) {
            if (pos + len <= n) {
                TokenKind k = PUNCTUATORS.get(src.substring(pos, pos + len));
                if (k != null) {
                    pos += len;
                    return k;
                }
            }
        }
        pos++;
        return TokenKind.OTHER;
    }

    private void scanWhitespace() {
        while (pos < n) {
            char c = src.charAt(pos);
            if (c == '\n') {
                atLineStart = true;
                pos++;
            } else if (isSpace(c)) {
                pos++;
            } else if (isSplice(pos)) {
                pos += spliceLength(pos);
            } else {
                break;
            }
        }
    }

    private void skipBlockComment() {
        int close = src.indexOf("*/", pos + 2);
        pos = close < 0 ? n : close + 2;
    }

    private void scanDirective() {
        while (pos < n) {
            char c = src.charAt(pos);
            if (c == '\n') {
                break;
            }
            if (isSplice(pos)) {
                pos += spliceLength(pos);
            } else if (c == '/' && peek(1) == '*') {
                skipBlockComment();
            } else if (c == '"' || c == '\'') {
                scanQuoted(c);
            } else {
                pos++;
            }
        }
    }

    // Stops at an unescaped closing quote, a raw newline, or end of input.
    private void scanQuoted(char quote) {
        pos++;
        while (pos < n) {
            char c = src.charAt(pos);
            if (c == '\\' && pos + 1 < n) {
                pos += 2;
            } else if (c == quote) {
                pos++;
                return;
            } else if (c == '\n') {
                return;
            } else {
                pos++;
            }
        }
    }

    private void scanNumber() {
        while (pos < n) {
            char c = src.charAt(pos);
            if ((c == 'e' || c == 'E' || c == 'p' || c == 'P') && (peek(1) == '+' || peek(1) == '-')) {
                pos += 2;
            } else if (c == '\'' && isIdentPart(peek(1))) {
                pos += 2;
            } else if (isIdentPart(c) || c == '.') {
                pos++;
            } else {
                break;
            }
        }
    }

    private char peek(int ahead) {
        int i = pos + ahead;
        return i < n ? src.charAt(i) : '\0';
    }

    private boolean isSplice(int i) {
        if (src.charAt(i) != '\\') {
            return false;
        }
        return spliceLength(i) > 0;
    }

    private int spliceLength(int i) {
        if (i + 1 < n && src.charAt(i + 1) == '\n') {
            return 2;
        }
        if (i + 2 < n && src.charAt(i + 1) == '\r' && src.charAt(i + 2) == '\n') {
            return 3;
        }
        return 0;
    }

    private static boolean isEncodingPrefix(String word) {
        return word.equals("L") || word.equals("u") || word.equals("U") || word.equals("u8");
    }

    private static boolean isSpace(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f' || c == '\u000B';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_' || c == '$' || c > 127;
    }

    private static boolean isIdentPart(char c) {
        return isIdentStart(c) || isDigit(c);
    }
}
