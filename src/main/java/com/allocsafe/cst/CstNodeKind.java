package com.allocsafe.cst;

import java.util.Map;

import com.google.common.collect.ImmutableMap;

/** Kinds of concrete-syntax nodes, with the names used in serialized trees. */
public enum CstNodeKind {
    EXPRESSION("Expression"),
    BLOCK_START("BlockStart"),
    BLOCK_END("BlockEnd"),

    LABEL("Label"),
    CASE("Case"),
    SWITCH("Switch"),
    IF("If"),
    ELSE("Else"),
    ELSE_IF("ElseIf"),
    WHILE("While"),
    DO("Do"),
    FOR("For"),
    GO_TO("GoTo"),
    CONTINUE("Continue"),
    BREAK("Break"),
    RETURN("Return"),
    DECLARATION("Declaration"),
    DEFINITION("Definition"),
    STRUCT("Struct"),
    UNION("Union"),
    ENUM("Enum"),
    FUNCTION_PROTOTYPE("FunctionPrototype"),
    FUNCTION("Function"),

    MACRO_IF("MacroIf"),
    MACRO_ELIF("MacroElif"),
    MACRO_IF_DEF("MacroIfDef"),
    MACRO_ELSE("MacroElse"),
    MACRO_DEFINE("MacroDefine"),
    MACRO_INCLUDE("MacroInclude"),
    MACRO_PRAGMA("MacroPragma");

    private static final Map<String, CstNodeKind> BY_NAME;

    static {
        ImmutableMap.Builder<String, CstNodeKind> b = ImmutableMap.builder();
        for (CstNodeKind k : values()) {
            b.put(k.label, k);
        }
        BY_NAME = b.build();
    }

    private final String label;

    CstNodeKind(String label) {
        this.label = label;
    }

    public String toStr() {
        return label;
    }

    /** Case-sensitive inverse of {@link #toStr()}; anything unknown is {@link #EXPRESSION}. */
    public static CstNodeKind fromStr(String s) {
        if (s == null) {
            return EXPRESSION;
        }
        CstNodeKind k = BY_NAME.get(s);
        return k == null ? EXPRESSION : k;
    }
}
