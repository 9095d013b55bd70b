package io.github.eutro.funclets.ops;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * A key for operations carrying exactly one immediate of type {@code T}.
 *
 * @param <T> The type of the immediate.
 */
public class UnaryOpKey<T> extends OpKey {
    private final Function<T, String> printer;

    public UnaryOpKey(String mnemonic, Function<T, String> printer) {
        super(mnemonic);
        this.printer = printer;
    }

    public UnaryOpKey(String mnemonic) {
        this(mnemonic, Objects::toString);
    }

    public class UnaryOp extends Op {
        public final T arg;

        UnaryOp(T arg) {
            super(UnaryOpKey.this);
            this.arg = arg;
        }

        @Override
        public String toString() {
            return key + " " + printer.apply(arg);
        }
    }

    public UnaryOp create(T arg) {
        if (arg == null) {
            throw new IllegalArgumentException("Argument is null");
        }
        return new UnaryOp(arg);
    }

    @SuppressWarnings("unchecked")
    public @Nullable UnaryOp checkNullable(Op op) {
        return op.key == this ? (UnaryOp) op : null;
    }

    public Optional<UnaryOp> check(Op op) {
        return Optional.ofNullable(checkNullable(op));
    }

    public @Nullable T argNullable(Op op) {
        UnaryOp unary = checkNullable(op);
        return unary == null ? null : unary.arg;
    }

    public UnaryOp cast(Op op) {
        return check(op).orElseThrow(() -> new ClassCastException(op + " is not " + mnemonic));
    }
}
