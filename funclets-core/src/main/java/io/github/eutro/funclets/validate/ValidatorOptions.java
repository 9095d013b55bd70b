package io.github.eutro.funclets.validate;

/**
 * Limits and checks for {@link FunctionBodyValidator}.
 */
public final class ValidatorOptions {
    public static final ValidatorOptions DEFAULT = new ValidatorOptions();

    int maxFunclets = 1 << 16;
    int maxNestingDepth = 1 << 12;
    int maxLocals = 50000;
    boolean verifySsa = true;

    public static ValidatorOptions defaults() {
        return new ValidatorOptions();
    }

    private ValidatorOptions copy() {
        ValidatorOptions o = new ValidatorOptions();
        o.maxFunclets = maxFunclets;
        o.maxNestingDepth = maxNestingDepth;
        o.maxLocals = maxLocals;
        o.verifySsa = verifySsa;
        return o;
    }

    /**
     * The largest {@code num_funclets} a region may declare.
     *
     * @param maxFunclets The limit.
     * @return A copy of these options with the limit set.
     */
    public ValidatorOptions maxFunclets(int maxFunclets) {
        ValidatorOptions o = copy();
        o.maxFunclets = maxFunclets;
        return o;
    }

    public ValidatorOptions maxNestingDepth(int maxNestingDepth) {
        ValidatorOptions o = copy();
        o.maxNestingDepth = maxNestingDepth;
        return o;
    }

    public ValidatorOptions maxLocals(int maxLocals) {
        ValidatorOptions o = copy();
        o.maxLocals = maxLocals;
        return o;
    }

    /**
     * Whether to check the finished IR: no placeholder phis left, and recorded predecessors
     * agreeing with the control instructions.
     *
     * @param verifySsa Whether to verify.
     * @return A copy of these options with the flag set.
     */
    public ValidatorOptions verifySsa(boolean verifySsa) {
        ValidatorOptions o = copy();
        o.verifySsa = verifySsa;
        return o;
    }

    public int getMaxFunclets() {
        return maxFunclets;
    }

    public int getMaxNestingDepth() {
        return maxNestingDepth;
    }

    public int getMaxLocals() {
        return maxLocals;
    }

    public boolean isVerifySsa() {
        return verifySsa;
    }
}
