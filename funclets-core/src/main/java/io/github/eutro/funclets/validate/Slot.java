package io.github.eutro.funclets.validate;

/**
 * A variable of the SSA construction: a local, or the operand stack slot at an absolute height.
 */
public final class Slot {
    private static final int LOCAL = 0;
    private static final int STACK = 1;

    private final int kind;
    public final int index;

    private Slot(int kind, int index) {
        this.kind = kind;
        this.index = index;
    }

    public static Slot local(int index) {
        return new Slot(LOCAL, index);
    }

    public static Slot stack(int height) {
        return new Slot(STACK, height);
    }

    public boolean isLocal() {
        return kind == LOCAL;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Slot)) return false;
        Slot slot = (Slot) o;
        return kind == slot.kind && index == slot.index;
    }

    @Override
    public int hashCode() {
        return 31 * kind + index;
    }

    @Override
    public String toString() {
        return (kind == LOCAL ? "l" : "s") + index;
    }
}
