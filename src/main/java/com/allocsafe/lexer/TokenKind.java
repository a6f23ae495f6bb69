package com.allocsafe.lexer;

import java.util.Map;

import com.google.common.collect.ImmutableMap;

/**
 * Classification of a lexical token. Keywords carry their spelling so the
 * tokenizer can look them up; every other kind has a {@code null} spelling.
 */
public enum TokenKind {
    WHITESPACE,
    COMMENT,
    /** A whole preprocessor line, continuations included. */
    DIRECTIVE,
    IDENTIFIER,

    KW_AUTO("auto"),
    KW_BREAK("break"),
    KW_CASE("case"),
    KW_CHAR("char"),
    KW_CONST("const"),
    KW_CONTINUE("continue"),
    KW_DEFAULT("default"),
    KW_DO("do"),
    KW_DOUBLE("double"),
    KW_ELSE("else"),
    KW_ENUM("enum"),
    KW_EXTERN("extern"),
    KW_FLOAT("float"),
    KW_FOR("for"),
    KW_GOTO("goto"),
    KW_IF("if"),
    KW_INLINE("inline"),
    KW_INT("int"),
    KW_LONG("long"),
    KW_REGISTER("register"),
    KW_RESTRICT("restrict"),
    KW_RETURN("return"),
    KW_SHORT("short"),
    KW_SIGNED("signed"),
    KW_SIZEOF("sizeof"),
    KW_STATIC("static"),
    KW_STRUCT("struct"),
    KW_SWITCH("switch"),
    KW_TYPEDEF("typedef"),
    KW_UNION("union"),
    KW_UNSIGNED("unsigned"),
    KW_VOID("void"),
    KW_VOLATILE("volatile"),
    KW_WHILE("while"),
    KW_ALIGNAS("_Alignas"),
    KW_ALIGNOF("_Alignof"),
    KW_ATOMIC("_Atomic"),
    KW_BOOL("_Bool"),
    KW_COMPLEX("_Complex"),
    KW_GENERIC("_Generic"),
    KW_IMAGINARY("_Imaginary"),
    KW_NORETURN("_Noreturn"),
    KW_STATIC_ASSERT("_Static_assert"),
    KW_THREAD_LOCAL("_Thread_local"),
    KW_BITINT("_BitInt"),
    KW_DECIMAL32("_Decimal32"),
    KW_DECIMAL64("_Decimal64"),
    KW_DECIMAL128("_Decimal128"),
    KW_ALIGNAS_C23("alignas"),
    KW_ALIGNOF_C23("alignof"),
    KW_BOOL_C23("bool"),
    KW_CONSTEXPR("constexpr"),
    KW_FALSE("false"),
    KW_TRUE("true"),
    KW_NULLPTR("nullptr"),
    KW_STATIC_ASSERT_C23("static_assert"),
    KW_THREAD_LOCAL_C23("thread_local"),
    KW_TYPEOF("typeof"),
    KW_TYPEOF_UNQUAL("typeof_unqual"),
    KW_GNU_INLINE("__inline"),
    KW_GNU_RESTRICT("__restrict"),

    NUMBER_LITERAL,
    STRING_LITERAL,
    CHAR_LITERAL,

    LBRACE,
    RBRACE,
    LBRACKET,
    RBRACKET,
    LPAREN,
    RPAREN,
    SEMICOLON,
    COMMA,
    DOT,
    ELLIPSIS,
    QUESTION,
    COLON,
    HASH,
    HASH_HASH,

    ASSIGN,
    PLUS_ASSIGN,
    MINUS_ASSIGN,
    STAR_ASSIGN,
    SLASH_ASSIGN,
    PERCENT_ASSIGN,
    AMP_ASSIGN,
    PIPE_ASSIGN,
    CARET_ASSIGN,
    LSHIFT_ASSIGN,
    RSHIFT_ASSIGN,

    EQ,
    NE,
    LT,
    LE,
    GT,
    GE,
    LOGICAL_AND,
    LOGICAL_OR,
    NOT,
    TILDE,
    INCREMENT,
    DECREMENT,
    ARROW,
    AMPERSAND,
    PIPE,
    CARET,
    LSHIFT,
    RSHIFT,
    PLUS,
    MINUS,
    STAR,
    SLASH,
    PERCENT,

    OTHER;

    private static final Map<String, TokenKind> KEYWORDS;

    static {
        ImmutableMap.Builder<String, TokenKind> b = ImmutableMap.builder();
        for (TokenKind k : values()) {
            if (k.spelling != null) {
                b.put(k.spelling, k);
            }
        }
        KEYWORDS = b.build();
    }

    private final String spelling;

    TokenKind() {
        this(null);
    }

    TokenKind(String spelling) {
        this.spelling = spelling;
    }

    /** Keyword spelling, or {@code null} for non-keywords. */
    public String spelling() {
        return spelling;
    }

    public boolean isKeyword() {
        return spelling != null;
    }

    /** Whitespace, comments and preprocessor lines. */
    public boolean isTrivia() {
        return this == WHITESPACE || this == COMMENT || this == DIRECTIVE;
    }

    public boolean isAssignment() {
        switch (this) {
            case ASSIGN:
            case PLUS_ASSIGN:
            case MINUS_ASSIGN:
            case STAR_ASSIGN:
            case SLASH_ASSIGN:
            case PERCENT_ASSIGN:
            case AMP_ASSIGN:
            case PIPE_ASSIGN:
            case CARET_ASSIGN:
            case LSHIFT_ASSIGN:
            case RSHIFT_ASSIGN:
                return true;
            default:
                return false;
        }
    }

    /** Qualifiers that may follow a {@code *} in a declarator. */
    public boolean isPointerQualifier() {
        return this == KW_CONST || this == KW_VOLATILE || this == KW_RESTRICT
                || this == KW_ATOMIC || this == KW_GNU_RESTRICT;
    }

    /** Keywords that can only appear in the specifier part of a declaration. */
    public boolean isDeclarationSpecifier() {
        switch (this) {
            case KW_AUTO:
            case KW_CHAR:
            case KW_CONST:
            case KW_DOUBLE:
            case KW_ENUM:
            case KW_EXTERN:
            case KW_FLOAT:
            case KW_INLINE:
            case KW_INT:
            case KW_LONG:
            case KW_REGISTER:
            case KW_RESTRICT:
            case KW_SHORT:
            case KW_SIGNED:
            case KW_STATIC:
            case KW_STRUCT:
            case KW_TYPEDEF:
            case KW_UNION:
            case KW_UNSIGNED:
            case KW_VOID:
            case KW_VOLATILE:
            case KW_ALIGNAS:
            case KW_ATOMIC:
            case KW_BOOL:
            case KW_COMPLEX:
            case KW_IMAGINARY:
            case KW_NORETURN:
            case KW_THREAD_LOCAL:
            case KW_BITINT:
            case KW_DECIMAL32:
            case KW_DECIMAL64:
            case KW_DECIMAL128:
            case KW_ALIGNAS_C23:
            case KW_BOOL_C23:
            case KW_CONSTEXPR:
            case KW_THREAD_LOCAL_C23:
            case KW_TYPEOF:
            case KW_TYPEOF_UNQUAL:
            case KW_GNU_INLINE:
            case KW_GNU_RESTRICT:
                return true;
            default:
                return false;
        }
    }

    /** Storage-class and function specifiers kept in front of a rewritten signature. */
    public boolean isStorageSpecifier() {
        switch (this) {
            case KW_STATIC:
            case KW_EXTERN:
            case KW_INLINE:
            case KW_GNU_INLINE:
            case KW_NORETURN:
            case KW_THREAD_LOCAL:
            case KW_THREAD_LOCAL_C23:
            case KW_REGISTER:
            case KW_AUTO:
            case KW_CONSTEXPR:
                return true;
            default:
                return false;
        }
    }

    /** Returns the keyword kind for {@code word}, or {@link #IDENTIFIER}. */
    public static TokenKind forWord(String word) {
        TokenKind k = KEYWORDS.get(word);
        return k == null ? IDENTIFIER : k;
    }
}
