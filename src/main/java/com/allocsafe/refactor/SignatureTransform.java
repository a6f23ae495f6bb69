package com.allocsafe.refactor;

import com.allocsafe.FixerConfig;

/** Settings for rewriting the returns of one function body. */
public final class SignatureTransform {

    private static final SignatureTransform NONE = new SignatureTransform(TransformType.NONE,
            FixerConfig.DEFAULT_OUT_ARG, FixerConfig.DEFAULT_SUCCESS_CODE, FixerConfig.DEFAULT_ERROR_CODE, null);

    private final TransformType type;
    private final String argName;
    private final String successCode;
    private final String errorCode;
    private final String returnType;

    public SignatureTransform(TransformType type, String argName, String successCode, String errorCode,
            String returnType) {
        this.type = type;
        this.argName = argName;
        this.successCode = successCode;
        this.errorCode = errorCode;
        this.returnType = returnType;
    }

    public static SignatureTransform none() {
        return NONE;
    }

    public static SignatureTransform voidToInt(FixerConfig config) {
        return new SignatureTransform(TransformType.VOID_TO_INT, config.outArgName(), config.successCode(),
                config.errorCode(), null);
    }

    public static SignatureTransform retPtrToArg(String returnType, FixerConfig config) {
        return new SignatureTransform(TransformType.RET_PTR_TO_ARG, config.outArgName(), config.successCode(),
                config.errorCode(), returnType);
    }

    public TransformType type() {
        return type;
    }

    public String argName() {
        return argName;
    }

    public String successCode() {
        return successCode;
    }

    public String errorCode() {
        return errorCode;
    }

    public String returnType() {
        return returnType;
    }
}
