package io.github.eutro.funclets.validate;

import io.github.eutro.funclets.bytecode.ValType;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Thrown when a function body is invalid.
 * <p>
 * Validation failures are final for the body being validated: no partial result survives them.
 * Bugs in the validator itself are reported with {@link IllegalStateException} instead.
 */
public class ValidationException extends Exception {
    /**
     * What kind of rule the body broke.
     */
    public enum Kind {
        /**
         * Truncated or out-of-range integers, unknown opcodes, zero {@code num_funclets}.
         */
        MALFORMED_ENCODING,
        /**
         * Instructions in places they may not appear, regions ending early, call deltas out of range.
         */
        STRUCTURAL_ERROR,
        /**
         * Operand types disagreeing with what an instruction, call or {@code end} requires,
         * including stack underflow.
         */
        TYPE_MISMATCH,
        /**
         * A declared {@code num_preds} that disagrees with the backward calls actually made.
         */
        PREDECESSOR_COUNT_ERROR,
        /**
         * A funclet other than the first with neither a declared signature nor a caller above it.
         */
        UNRESOLVED_SIGNATURE,
    }

    public final Kind kind;
    public final long offset;
    private int funclet = -1;
    private @Nullable List<ValType> expected;
    private @Nullable List<ValType> actual;

    public ValidationException(Kind kind, long offset, String message) {
        super(message);
        this.kind = kind;
        this.offset = offset;
    }

    public ValidationException withFunclet(int funclet) {
        this.funclet = funclet;
        return this;
    }

    public ValidationException withTypes(List<ValType> expected, List<ValType> actual) {
        this.expected = Collections.unmodifiableList(new ArrayList<>(expected));
        this.actual = Collections.unmodifiableList(new ArrayList<>(actual));
        return this;
    }

    /**
     * Get the index of the funclet the error was found in or refers to.
     *
     * @return The funclet index, or -1 if not applicable.
     */
    public int getFunclet() {
        return funclet;
    }

    public @Nullable List<ValType> getExpected() {
        return expected;
    }

    public @Nullable List<ValType> getActual() {
        return actual;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(kind).append(" at offset ").append(String.format("0x%x", offset)).append(": ").append(super.getMessage());
        if (funclet >= 0) {
            sb.append(" (funclet ").append(funclet).append(')');
        }
        if (expected != null && actual != null) {
            sb.append(" expected ").append(ValType.format(expected))
                    .append(", got ").append(ValType.format(actual));
        }
        return sb.toString();
    }
}
