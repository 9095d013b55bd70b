package io.github.eutro.funclets.api;

import io.github.eutro.funclets.bytecode.ByteInputStream;
import io.github.eutro.funclets.bytecode.Opcodes;
import io.github.eutro.funclets.bytecode.Signature;
import io.github.eutro.funclets.bytecode.TypeContext;
import io.github.eutro.funclets.bytecode.ValType;
import io.github.eutro.funclets.validate.ValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static io.github.eutro.funclets.validate.ValidationException.Kind.MALFORMED_ENCODING;
import static io.github.eutro.funclets.validate.ValidationException.Kind.STRUCTURAL_ERROR;

/**
 * Reads the parts of a binary module that function bodies depend on.
 * <p>
 * The type, import, function, global and code sections are read; every other section is skipped by size.
 * Bodies are not decoded here, only located.
 */
public final class ModuleReader {
    private static final byte SECTION_IMPORT = 2;

    private static final byte IMPORT_FUNC = 0;
    private static final byte IMPORT_TABLE = 1;
    private static final byte IMPORT_MEMORY = 2;
    private static final byte IMPORT_GLOBAL = 3;

    private static final byte REF_NULL = (byte) 0xD0;
    private static final byte REF_FUNC = (byte) 0xD2;

    private ModuleReader() {
    }

    /**
     * A code section entry.
     */
    public static final class CodeBody {
        /**
         * The index of the function in the function index space, imports included.
         */
        public final int funcIndex;
        public final int offset;
        public final int length;

        CodeBody(int funcIndex, int offset, int length) {
            this.funcIndex = funcIndex;
            this.offset = offset;
            this.length = length;
        }
    }

    public static final class ModuleContents {
        public final byte[] bytes;
        public final TypeContext ctx;
        public final int importedFuncs;
        public final List<CodeBody> bodies;

        ModuleContents(byte[] bytes, TypeContext ctx, int importedFuncs, List<CodeBody> bodies) {
            this.bytes = bytes;
            this.ctx = ctx;
            this.importedFuncs = importedFuncs;
            this.bodies = Collections.unmodifiableList(bodies);
        }

        /**
         * Get a fresh cursor over a body. Offsets it reports are offsets into the module.
         *
         * @param body The body.
         * @return The cursor.
         */
        public ByteInputStream open(CodeBody body) {
            return new ByteInputStream(bytes, body.offset, body.length);
        }
    }

    public static ModuleContents read(byte[] bytes) throws ValidationException {
        ByteInputStream in = new ByteInputStream(bytes);
        if (in.remaining() < 8 || in.readInt32LE() != Opcodes.MAGIC) {
            throw new ValidationException(MALFORMED_ENCODING, 0, "not a binary module: bad magic");
        }
        int version = in.readInt32LE();
        if (version != Opcodes.VERSION) {
            throw new ValidationException(MALFORMED_ENCODING, 4, "unsupported module version " + version);
        }

        TypeContext.Builder builder = TypeContext.builder();
        List<Signature> types = new ArrayList<>();
        int importedFuncs = 0;
        int definedFuncs = -1;
        List<CodeBody> bodies = new ArrayList<>();

        while (in.hasMore()) {
            byte id = in.readByte();
            int size = in.readVarIndex();
            int sectionStart = in.position();
            ByteInputStream section = in.slice(size);
            switch (id) {
                case Opcodes.SECTION_TYPE:
                    readTypes(section, builder, types);
                    break;
                case SECTION_IMPORT:
                    importedFuncs = readImports(section, builder, types);
                    break;
                case Opcodes.SECTION_FUNCTION: {
                    definedFuncs = section.readVarIndex();
                    for (int i = 0; i < definedFuncs; i++) {
                        builder.addFunction(checkType(section, types));
                    }
                    break;
                }
                case Opcodes.SECTION_GLOBAL: {
                    int count = section.readVarIndex();
                    for (int i = 0; i < count; i++) {
                        ValType type = TypeContext.readValType(section);
                        boolean mutable = readMutability(section);
                        skipConstExpr(section);
                        builder.addGlobal(type, mutable);
                    }
                    break;
                }
                case Opcodes.SECTION_CODE: {
                    int count = section.readVarIndex();
                    if (count != Math.max(definedFuncs, 0)) {
                        throw new ValidationException(MALFORMED_ENCODING, sectionStart,
                                "code section has " + count + " bodies for " + Math.max(definedFuncs, 0) + " functions");
                    }
                    for (int i = 0; i < count; i++) {
                        int length = section.readVarIndex();
                        int offset = section.position();
                        section.skip(length);
                        bodies.add(new CodeBody(importedFuncs + i, offset, length));
                    }
                    break;
                }
                default:
                    // custom and unrelated sections
                    continue;
            }
            if (section.hasMore()) {
                throw new ValidationException(MALFORMED_ENCODING, section.position(), "section " + id + " size mismatch");
            }
        }
        if (definedFuncs > 0 && bodies.isEmpty()) {
            throw new ValidationException(MALFORMED_ENCODING, in.position(), "function section without code section");
        }
        return new ModuleContents(bytes, builder.build(), importedFuncs, bodies);
    }

    private static void readTypes(ByteInputStream in, TypeContext.Builder builder, List<Signature> types)
            throws ValidationException {
        int count = in.readVarIndex();
        for (int i = 0; i < count; i++) {
            int start = in.position();
            if (in.readByte() != Opcodes.FUNC_TYPE) {
                throw new ValidationException(MALFORMED_ENCODING, start, "expected function type");
            }
            List<ValType> params = readValTypes(in);
            List<ValType> results = readValTypes(in);
            Signature sig = new Signature(params, results);
            types.add(sig);
            builder.addType(sig);
        }
    }

    private static List<ValType> readValTypes(ByteInputStream in) throws ValidationException {
        int count = in.readVarIndex();
        if (count > in.remaining()) {
            throw new ValidationException(MALFORMED_ENCODING, in.position(), "type vector overruns section");
        }
        List<ValType> vts = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            vts.add(TypeContext.readValType(in));
        }
        return vts;
    }

    private static int checkType(ByteInputStream in, List<Signature> types) throws ValidationException {
        int start = in.position();
        int idx = in.readVarIndex();
        if (idx >= types.size()) {
            throw new ValidationException(STRUCTURAL_ERROR, start, "unknown type " + idx);
        }
        return idx;
    }

    private static int readImports(ByteInputStream in, TypeContext.Builder builder, List<Signature> types)
            throws ValidationException {
        int funcs = 0;
        int count = in.readVarIndex();
        for (int i = 0; i < count; i++) {
            in.skip(in.readVarIndex()); // module
            in.skip(in.readVarIndex()); // name
            int start = in.position();
            byte kind = in.readByte();
            switch (kind) {
                case IMPORT_FUNC:
                    builder.addFunction(checkType(in, types));
                    funcs++;
                    break;
                case IMPORT_TABLE:
                    in.readByte();
                    skipLimits(in);
                    break;
                case IMPORT_MEMORY:
                    skipLimits(in);
                    break;
                case IMPORT_GLOBAL: {
                    ValType type = TypeContext.readValType(in);
                    builder.addGlobal(type, readMutability(in));
                    break;
                }
                default:
                    throw new ValidationException(MALFORMED_ENCODING, start, "unknown import kind " + kind);
            }
        }
        return funcs;
    }

    private static void skipLimits(ByteInputStream in) throws ValidationException {
        byte flags = in.readByte();
        in.readVarUInt32();
        if ((flags & 1) != 0) in.readVarUInt32();
    }

    private static boolean readMutability(ByteInputStream in) throws ValidationException {
        int start = in.position();
        byte mut = in.readByte();
        if (mut != 0 && mut != 1) {
            throw new ValidationException(MALFORMED_ENCODING, start, "invalid mutability " + mut);
        }
        return mut == 1;
    }

    private static void skipConstExpr(ByteInputStream in) throws ValidationException {
        while (true) {
            int start = in.position();
            byte op = in.readByte();
            switch (op) {
                case Opcodes.END:
                    return;
                case Opcodes.I32_CONST:
                    in.readVarInt32();
                    break;
                case Opcodes.I64_CONST:
                    in.readVarInt64();
                    break;
                case Opcodes.F32_CONST:
                    in.skip(4);
                    break;
                case Opcodes.F64_CONST:
                    in.skip(8);
                    break;
                case Opcodes.GLOBAL_GET:
                case REF_FUNC:
                    in.readVarIndex();
                    break;
                case REF_NULL:
                    in.readByte();
                    break;
                default:
                    throw new ValidationException(MALFORMED_ENCODING, start,
                            String.format("unsupported constant expression opcode 0x%02x", op & 0xFF));
            }
        }
    }
}
