package io.github.eutro.funclets.bytecode;

/**
 * Byte constants of the host bytecode: value types, block types, and the control and variable
 * instructions the validator understands. Numeric operators are described by {@link NumericOps}.
 */
public final class Opcodes {
    private Opcodes() {
    }

    // value types
    public static final byte I32 = 0x7F;
    public static final byte I64 = 0x7E;
    public static final byte F32 = 0x7D;
    public static final byte F64 = 0x7C;
    public static final byte FUNCREF = 0x70;
    public static final byte EXTERNREF = 0x6F;

    public static final byte EMPTY_TYPE = 0x40;
    public static final byte FUNC_TYPE = 0x60;

    // control
    public static final byte UNREACHABLE = 0x00;
    public static final byte NOP = 0x01;
    public static final byte BLOCK = 0x02;
    public static final byte LOOP = 0x03;
    public static final byte IF = 0x04;
    public static final byte ELSE = 0x05;
    public static final byte END = 0x0B;
    public static final byte BR = 0x0C;
    public static final byte BR_IF = 0x0D;
    public static final byte BR_TABLE = 0x0E;
    public static final byte RETURN = 0x0F;
    public static final byte CALL = 0x10;

    // funclets
    public static final byte FUNCLET_REGION = 0x16;
    public static final byte FUNCLET_SIG = 0x17;
    public static final byte FUNCLET_CALL = 0x1D;
    public static final byte FUNCLET_CALL_IF = 0x1E;
    public static final byte FUNCLET_CALL_TABLE = 0x1F;

    // parametric
    public static final byte DROP = 0x1A;
    public static final byte SELECT = 0x1B;

    // variables
    public static final byte LOCAL_GET = 0x20;
    public static final byte LOCAL_SET = 0x21;
    public static final byte LOCAL_TEE = 0x22;
    public static final byte GLOBAL_GET = 0x23;
    public static final byte GLOBAL_SET = 0x24;

    // constants
    public static final byte I32_CONST = 0x41;
    public static final byte I64_CONST = 0x42;
    public static final byte F32_CONST = 0x43;
    public static final byte F64_CONST = 0x44;

    // module sections
    public static final byte SECTION_CUSTOM = 0;
    public static final byte SECTION_TYPE = 1;
    public static final byte SECTION_FUNCTION = 3;
    public static final byte SECTION_GLOBAL = 6;
    public static final byte SECTION_CODE = 10;

    public static final int MAGIC = 0x6d736100;
    public static final int VERSION = 1;
}
