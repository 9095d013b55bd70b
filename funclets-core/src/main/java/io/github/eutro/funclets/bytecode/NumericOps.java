package io.github.eutro.funclets.bytecode;

import io.github.eutro.funclets.util.InsnMap;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.List;

import static io.github.eutro.funclets.bytecode.ValType.*;

/**
 * The stack signatures of the numeric operators of the host bytecode, {@code 0x45} to {@code 0xC4}.
 */
public final class NumericOps {
    private NumericOps() {
    }

    /**
     * A numeric operator: it pops {@link #params} and pushes one {@link #result}.
     */
    public static final class NumericOp {
        public final byte opcode;
        public final String name;
        public final List<ValType> params;
        public final ValType result;

        NumericOp(byte opcode, String name, List<ValType> params, ValType result) {
            this.opcode = opcode;
            this.name = name;
            this.params = params;
            this.result = result;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    private static final InsnMap<NumericOp> OPS = new InsnMap<>();

    public static @Nullable NumericOp get(byte opcode) {
        return OPS.get(opcode);
    }

    private static int defineAll(int opcode, ValType type, String[] names, int arity, ValType result) {
        List<ValType> params = Collections.nCopies(arity, type);
        for (String name : names) {
            OPS.put((byte) opcode, new NumericOp((byte) opcode, type + "." + name, params, result));
            opcode++;
        }
        return opcode;
    }

    private static void defineConversion(int opcode, String name, ValType from, ValType to) {
        OPS.put((byte) opcode, new NumericOp((byte) opcode, name, Collections.singletonList(from), to));
    }

    static {
        String[] intCmp = {"eq", "ne", "lt_s", "lt_u", "gt_s", "gt_u", "le_s", "le_u", "ge_s", "ge_u"};
        String[] floatCmp = {"eq", "ne", "lt", "gt", "le", "ge"};
        String[] intUn = {"clz", "ctz", "popcnt"};
        String[] intBin = {"add", "sub", "mul", "div_s", "div_u", "rem_s", "rem_u",
                "and", "or", "xor", "shl", "shr_s", "shr_u", "rotl", "rotr"};
        String[] floatUn = {"abs", "neg", "ceil", "floor", "trunc", "nearest", "sqrt"};
        String[] floatBin = {"add", "sub", "mul", "div", "min", "max", "copysign"};

        int op = 0x45;
        op = defineAll(op, I32, new String[]{"eqz"}, 1, I32);
        op = defineAll(op, I32, intCmp, 2, I32);
        op = defineAll(op, I64, new String[]{"eqz"}, 1, I32);
        op = defineAll(op, I64, intCmp, 2, I32);
        op = defineAll(op, F32, floatCmp, 2, I32);
        op = defineAll(op, F64, floatCmp, 2, I32);
        op = defineAll(op, I32, intUn, 1, I32);
        op = defineAll(op, I32, intBin, 2, I32);
        op = defineAll(op, I64, intUn, 1, I64);
        op = defineAll(op, I64, intBin, 2, I64);
        op = defineAll(op, F32, floatUn, 1, F32);
        op = defineAll(op, F32, floatBin, 2, F32);
        op = defineAll(op, F64, floatUn, 1, F64);
        op = defineAll(op, F64, floatBin, 2, F64);
        assert op == 0xA7;

        Object[][] conversions = {
                {"i32.wrap_i64", I64, I32},
                {"i32.trunc_f32_s", F32, I32},
                {"i32.trunc_f32_u", F32, I32},
                {"i32.trunc_f64_s", F64, I32},
                {"i32.trunc_f64_u", F64, I32},
                {"i64.extend_i32_s", I32, I64},
                {"i64.extend_i32_u", I32, I64},
                {"i64.trunc_f32_s", F32, I64},
                {"i64.trunc_f32_u", F32, I64},
                {"i64.trunc_f64_s", F64, I64},
                {"i64.trunc_f64_u", F64, I64},
                {"f32.convert_i32_s", I32, F32},
                {"f32.convert_i32_u", I32, F32},
                {"f32.convert_i64_s", I64, F32},
                {"f32.convert_i64_u", I64, F32},
                {"f32.demote_f64", F64, F32},
                {"f64.convert_i32_s", I32, F64},
                {"f64.convert_i32_u", I32, F64},
                {"f64.convert_i64_s", I64, F64},
                {"f64.convert_i64_u", I64, F64},
                {"f64.promote_f32", F32, F64},
                {"i32.reinterpret_f32", F32, I32},
                {"i64.reinterpret_f64", F64, I64},
                {"f32.reinterpret_i32", I32, F32},
                {"f64.reinterpret_i64", I64, F64},
                {"i32.extend8_s", I32, I32},
                {"i32.extend16_s", I32, I32},
                {"i64.extend8_s", I64, I64},
                {"i64.extend16_s", I64, I64},
                {"i64.extend32_s", I64, I64},
        };
        for (Object[] conv : conversions) {
            defineConversion(op++, (String) conv[0], (ValType) conv[1], (ValType) conv[2]);
        }
        assert op == 0xC5 : Integer.toHexString(op);
    }
}
