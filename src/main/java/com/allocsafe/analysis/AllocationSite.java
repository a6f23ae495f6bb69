package com.allocsafe.analysis;

/**
 * One call to a known allocator. {@code tokenIndex} points at the callee
 * identifier in the analyzed token list.
 */
public final class AllocationSite {

    private final int tokenIndex;
    private final AllocatorSpec spec;
    private final String variable;
    private final boolean checked;
    private final boolean usedBeforeCheck;
    private final boolean returnStatement;

    public AllocationSite(int tokenIndex, AllocatorSpec spec, String variable, boolean checked,
            boolean usedBeforeCheck, boolean returnStatement) {
        this.tokenIndex = tokenIndex;
        this.spec = spec;
        this.variable = variable;
        this.checked = checked;
        this.usedBeforeCheck = usedBeforeCheck;
        this.returnStatement = returnStatement;
    }

    public int tokenIndex() {
        return tokenIndex;
    }

    public AllocatorSpec spec() {
        return spec;
    }

    /** Assigned lvalue text such as {@code p} or {@code s->buf}; {@code null} if unknown. */
    public String variable() {
        return variable;
    }

    public boolean hasVariable() {
        return variable != null;
    }

    public boolean isChecked() {
        return checked;
    }

    public boolean isUsedBeforeCheck() {
        return usedBeforeCheck;
    }

    /** True when the call is the operand of a {@code return}. */
    public boolean isReturnStatement() {
        return returnStatement;
    }

    /** Same site shifted by {@code delta} tokens. */
    public AllocationSite rebase(int delta) {
        return new AllocationSite(tokenIndex + delta, spec, variable, checked, usedBeforeCheck, returnStatement);
    }

    @Override
    public String toString() {
        return "AllocationSite{" + spec.name() + " @" + tokenIndex
                + (variable == null ? "" : " -> " + variable)
                + (checked ? ", checked" : "")
                + (usedBeforeCheck ? ", used before check" : "")
                + (returnStatement ? ", return" : "") + "}";
    }
}
