package com.allocsafe;

import com.google.common.base.Preconditions;

/**
 * Settings shared by the strategies, the body rewriter and the orchestrator.
 * Instances are immutable; use {@link #builder()} to derive a variant.
 */
public final class FixerConfig {

    public static final String DEFAULT_ERROR_CODE = "ENOMEM";
    public static final String DEFAULT_SUCCESS_CODE = "0";
    public static final String DEFAULT_OUT_ARG = "out";
    public static final String DEFAULT_STATUS_VAR = "rc";
    public static final int DEFAULT_TOKEN_LIMIT = 4_000_000;

    private static final FixerConfig DEFAULTS = builder().build();

    private final String errorCode;
    private final String successCode;
    private final String outArgName;
    private final String statusVar;
    private final int tokenLimit;
    private final boolean printWarnings;

    private FixerConfig(Builder b) {
        this.errorCode = b.errorCode;
        this.successCode = b.successCode;
        this.outArgName = b.outArgName;
        this.statusVar = b.statusVar;
        this.tokenLimit = b.tokenLimit;
        this.printWarnings = b.printWarnings;
    }

    public static FixerConfig defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .errorCode(errorCode)
                .successCode(successCode)
                .outArgName(outArgName)
                .statusVar(statusVar)
                .tokenLimit(tokenLimit)
                .printWarnings(printWarnings);
    }

    /** Value returned from a function when an allocation fails. */
    public String errorCode() {
        return errorCode;
    }

    public String successCode() {
        return successCode;
    }

    public String outArgName() {
        return outArgName;
    }

    /** Name of the local that receives the status of refactored calls. */
    public String statusVar() {
        return statusVar;
    }

    public int tokenLimit() {
        return tokenLimit;
    }

    public boolean printWarnings() {
        return printWarnings;
    }

    /** Prints a {@code WARNING:} line when warnings are enabled. */
    public void warn(String message) {
        if (printWarnings) {
            System.out.println("WARNING: " + message);
        }
    }

    public static final class Builder {
        private String errorCode = DEFAULT_ERROR_CODE;
        private String successCode = DEFAULT_SUCCESS_CODE;
        private String outArgName = DEFAULT_OUT_ARG;
        private String statusVar = DEFAULT_STATUS_VAR;
        private int tokenLimit = DEFAULT_TOKEN_LIMIT;
        private boolean printWarnings = false;

        private Builder() {
        }

        public Builder errorCode(String errorCode) {
            this.errorCode = FixerException.requireArg(errorCode, "errorCode");
            return this;
        }

        public Builder successCode(String successCode) {
            this.successCode = FixerException.requireArg(successCode, "successCode");
            return this;
        }

        public Builder outArgName(String outArgName) {
            this.outArgName = FixerException.requireArg(outArgName, "outArgName");
            return this;
        }

        public Builder statusVar(String statusVar) {
            this.statusVar = FixerException.requireArg(statusVar, "statusVar");
            return this;
        }

        public Builder tokenLimit(int tokenLimit) {
            Preconditions.checkArgument(tokenLimit > 0, "tokenLimit must be positive: %s", tokenLimit);
            this.tokenLimit = tokenLimit;
            return this;
        }

        public Builder printWarnings(boolean printWarnings) {
            this.printWarnings = printWarnings;
            return this;
        }

        public FixerConfig build() {
            return new FixerConfig(this);
        }
    }
}
