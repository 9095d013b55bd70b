package io.github.eutro.funclets.ops;

/**
 * Identifies a kind of operation, independent of any immediates it is instantiated with.
 */
public abstract class OpKey {
    public final String mnemonic;

    protected OpKey(String mnemonic) {
        this.mnemonic = mnemonic;
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
