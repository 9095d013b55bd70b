package io.github.eutro.funclets.bytecode;

import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The value types of the host bytecode.
 */
public enum ValType {
    I32(Opcodes.I32, "i32"),
    I64(Opcodes.I64, "i64"),
    F32(Opcodes.F32, "f32"),
    F64(Opcodes.F64, "f64"),
    FUNCREF(Opcodes.FUNCREF, "funcref"),
    EXTERNREF(Opcodes.EXTERNREF, "externref"),
    /**
     * The bottom type, produced by popping from the stack of an unreachable frame.
     * It matches every type, and has no encoding.
     */
    BOTTOM((byte) 0, "bot"),
    ;

    public final byte code;
    public final String mnemonic;

    ValType(byte code, String mnemonic) {
        this.code = code;
        this.mnemonic = mnemonic;
    }

    /**
     * Look up the value type with the given encoding.
     *
     * @param code The byte.
     * @return The type, or null if the byte does not encode a value type.
     */
    public static @Nullable ValType fromCode(byte code) {
        switch (code) {
            case Opcodes.I32:
                return I32;
            case Opcodes.I64:
                return I64;
            case Opcodes.F32:
                return F32;
            case Opcodes.F64:
                return F64;
            case Opcodes.FUNCREF:
                return FUNCREF;
            case Opcodes.EXTERNREF:
                return EXTERNREF;
            default:
                return null;
        }
    }

    /**
     * Whether a value of this type may be used where {@code expected} is required.
     *
     * @param expected The required type.
     * @return Whether it matches.
     */
    public boolean matches(ValType expected) {
        return this == expected || this == BOTTOM || expected == BOTTOM;
    }

    /**
     * Whether {@code actual} has the same length as {@code expected}, and each type {@link #matches(ValType) matches}.
     *
     * @param expected The required types.
     * @param actual   The types given.
     * @return Whether they all match.
     */
    public static boolean allMatch(List<ValType> expected, List<ValType> actual) {
        if (expected.size() != actual.size()) return false;
        for (int i = 0; i < expected.size(); i++) {
            if (!actual.get(i).matches(expected.get(i))) return false;
        }
        return true;
    }

    public boolean isNumeric() {
        return this == I32 || this == I64 || this == F32 || this == F64;
    }

    @Override
    public String toString() {
        return mnemonic;
    }

    public static String format(List<ValType> types) {
        return types.stream().map(ValType::toString).collect(Collectors.joining(" ", "[", "]"));
    }
}
