package io.github.eutro.funclets.bytecode;

import io.github.eutro.funclets.validate.ValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static io.github.eutro.funclets.validate.ValidationException.Kind.MALFORMED_ENCODING;
import static io.github.eutro.funclets.validate.ValidationException.Kind.STRUCTURAL_ERROR;

/**
 * The parts of the enclosing module a function body refers to: the type section,
 * the type of each function, and the globals.
 * <p>
 * A context is immutable once built, and may be shared between threads validating different bodies.
 */
public final class TypeContext {
    public final List<Signature> types;
    public final List<Integer> funcTypes;
    public final List<GlobalType> globals;

    private TypeContext(List<Signature> types, List<Integer> funcTypes, List<GlobalType> globals) {
        this.types = Collections.unmodifiableList(new ArrayList<>(types));
        this.funcTypes = Collections.unmodifiableList(new ArrayList<>(funcTypes));
        this.globals = Collections.unmodifiableList(new ArrayList<>(globals));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class GlobalType {
        public final ValType type;
        public final boolean mutable;

        public GlobalType(ValType type, boolean mutable) {
            this.type = type;
            this.mutable = mutable;
        }

        @Override
        public String toString() {
            return mutable ? "(mut " + type + ")" : type.toString();
        }
    }

    public Signature funcType(int funcIndex, long offset) throws ValidationException {
        if (funcIndex < 0 || funcIndex >= funcTypes.size()) {
            throw new ValidationException(STRUCTURAL_ERROR, offset, "unknown function " + funcIndex);
        }
        return type(funcTypes.get(funcIndex), offset);
    }

    public Signature type(int typeIndex, long offset) throws ValidationException {
        if (typeIndex < 0 || typeIndex >= types.size()) {
            throw new ValidationException(STRUCTURAL_ERROR, offset, "unknown type " + typeIndex);
        }
        return types.get(typeIndex);
    }

    public GlobalType global(int globalIndex, long offset) throws ValidationException {
        if (globalIndex < 0 || globalIndex >= globals.size()) {
            throw new ValidationException(STRUCTURAL_ERROR, offset, "unknown global " + globalIndex);
        }
        return globals.get(globalIndex);
    }

    /**
     * Read a block type: {@code 0x40} for no params and no results, a value type for a single result,
     * or a non-negative type index.
     *
     * @param in The input.
     * @return The expanded signature.
     * @throws ValidationException If the block type is malformed or refers to an unknown type.
     */
    public Signature readBlockType(ByteInputStream in) throws ValidationException {
        int start = in.position();
        long value = in.readVarS33();
        if (value >= 0) {
            return type((int) value, start);
        }
        // negative s33 values are single-byte type codes
        byte code = (byte) (value & 0x7F);
        if (code == Opcodes.EMPTY_TYPE) return Signature.EMPTY;
        ValType type = value < -0x40 ? null : ValType.fromCode(code);
        if (type == null) {
            throw new ValidationException(MALFORMED_ENCODING, start, String.format("invalid block type 0x%x", value & 0x1FFFFFFFFL));
        }
        return Signature.results(type);
    }

    public static ValType readValType(ByteInputStream in) throws ValidationException {
        int start = in.position();
        byte code = in.readByte();
        ValType type = ValType.fromCode(code);
        if (type == null) {
            throw new ValidationException(MALFORMED_ENCODING, start, String.format("invalid value type 0x%02x", code));
        }
        return type;
    }

    public static final class Builder {
        private final List<Signature> types = new ArrayList<>();
        private final List<Integer> funcTypes = new ArrayList<>();
        private final List<GlobalType> globals = new ArrayList<>();

        /**
         * Add a type to the type section.
         *
         * @param sig The type.
         * @return The index of the type.
         */
        public int addType(Signature sig) {
            types.add(sig);
            return types.size() - 1;
        }

        public Builder addFunction(int typeIndex) {
            funcTypes.add(typeIndex);
            return this;
        }

        public Builder addFunction(Signature sig) {
            int idx = types.indexOf(sig);
            return addFunction(idx == -1 ? addType(sig) : idx);
        }

        public Builder addGlobal(ValType type, boolean mutable) {
            globals.add(new GlobalType(type, mutable));
            return this;
        }

        public TypeContext build() {
            return new TypeContext(types, funcTypes, globals);
        }
    }
}
