package io.github.eutro.funclets.test;

import io.github.eutro.funclets.bytecode.Opcodes;
import io.github.eutro.funclets.bytecode.Signature;
import io.github.eutro.funclets.bytecode.TypeContext;
import io.github.eutro.funclets.bytecode.ValType;
import io.github.eutro.funclets.ext.CommonExts;
import io.github.eutro.funclets.ops.CommonOps;
import io.github.eutro.funclets.ops.HostOps;
import io.github.eutro.funclets.ssa.BasicBlock;
import io.github.eutro.funclets.ssa.Effect;
import io.github.eutro.funclets.ssa.Var;
import io.github.eutro.funclets.validate.FunctionBodyValidator;
import io.github.eutro.funclets.validate.ValidatedBody;
import io.github.eutro.funclets.validate.ValidationException;
import io.github.eutro.funclets.validate.ValidatorOptions;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static io.github.eutro.funclets.bytecode.ValType.*;
import static io.github.eutro.funclets.test.Code.EMPTY;
import static io.github.eutro.funclets.test.FuncletValidatorTest.*;
import static io.github.eutro.funclets.validate.ValidationException.Kind.*;
import static org.junit.jupiter.api.Assertions.*;

public class FunctionBodyValidatorTest {
    static final TypeContext I32_TO_I32 = ctx(Signature.of(new ValType[]{I32}, I32));
    static final TypeContext TO_I32 = ctx(Signature.results(I32));

    static Effect phiOf(Var var) {
        Effect effect = var.getExtOrThrow(CommonExts.ASSIGNED_AT);
        assertTrue(CommonOps.PHI.check(effect.insn().op).isPresent(), effect::toString);
        return effect;
    }

    static Var returned(ValidatedBody body) {
        for (BasicBlock block : body.func.blocks) {
            if (block.getControl().insn().op == CommonOps.RETURN) {
                return block.getControl().insn().args().get(0);
            }
        }
        throw new AssertionError("no return");
    }

    @Test
    void testStraightLine() throws Throwable {
        TypeContext ctx = ctx(Signature.of(new ValType[]{I32, I32}, I32));
        ValidatedBody body = valid(ctx, Code.body()
                .localGet(0).localGet(1).op((byte) 0x6A)
                .end());
        assertEquals(1, body.func.blocks.size());
        assertEquals(Arrays.asList(I32, I32), body.locals);
        assertTrue(body.regions.isEmpty());
    }

    @Test
    void testDeclaredLocals() throws Throwable {
        ValidatedBody body = valid(I32_TO_I32, Code.body(I64)
                .localGet(1).op((byte) 0xA7)
                .end());
        assertEquals(Arrays.asList(I32, I64), body.locals);
        Effect init = body.func.getEntry().getEffects().get(1);
        assertEquals(HostOps.ZEROINIT.create(I64).toString(), init.insn().op.toString());
    }

    @Test
    void testBlockBrIf() throws Throwable {
        ValidatedBody body = valid(I32_TO_I32, Code.body()
                .op(Opcodes.BLOCK).bt(I32)
                .i32(1).localGet(0).brIf(0)
                .drop().i32(2)
                .end()
                .end());
        Effect phi = phiOf(returned(body));
        assertEquals(2, phi.insn().args().size());
    }

    @Test
    void testLoopCounter() throws Throwable {
        ValidatedBody body = valid(I32_TO_I32, Code.body()
                .loop(EMPTY)
                .localGet(0).i32(1).op((byte) 0x6B).localTee(0)
                .brIf(0)
                .end()
                .localGet(0)
                .end());
        BasicBlock header = body.func.blocks.get(1);
        Effect phi = header.getEffects().get(0);
        assertTrue(CommonOps.PHI.check(phi.insn().op).isPresent());
        assertEquals(2, header.getExtOrThrow(CommonExts.PREDS).size());
    }

    @Test
    void testIfElse() throws Throwable {
        ValidatedBody body = valid(I32_TO_I32, Code.body()
                .localGet(0)
                .op(Opcodes.IF).bt(I32).i32(1)
                .op(Opcodes.ELSE).i32(2)
                .end()
                .end());
        assertEquals(2, phiOf(returned(body)).insn().args().size());
    }

    @Test
    void testIfWithoutElse() throws Throwable {
        invalid(TYPE_MISMATCH, I32_TO_I32, Code.body()
                .localGet(0)
                .op(Opcodes.IF).bt(I32).i32(1)
                .end()
                .end());
        // no results, so the missing else passes nothing
        valid(ctx(Signature.params(I32)), Code.body()
                .localGet(0)
                .iff(EMPTY).i32(1).localSet(0)
                .end()
                .end());
    }

    @Test
    void testElseWithoutIf() {
        invalid(STRUCTURAL_ERROR, VOID, Code.body()
                .block(EMPTY).op(Opcodes.ELSE).end()
                .end());
    }

    @Test
    void testBrTable() throws Throwable {
        ValidatedBody body = valid(I32_PARAM, Code.body()
                .block(EMPTY)
                .block(EMPTY)
                .localGet(0).brTable(0, 0, 1)
                .end()
                .end()
                .end());
        assertTrue(body.func.blocks.size() > 4);

        invalid(TYPE_MISMATCH, I32_PARAM, Code.body()
                .block(EMPTY)
                .op(Opcodes.BLOCK).bt(I32)
                .i32(0).localGet(0).brTable(0, 1)
                .end()
                .drop()
                .end()
                .end());
    }

    @Test
    void testSelect() throws Throwable {
        valid(I32_TO_I32, Code.body()
                .i32(1).i32(2).localGet(0).op(Opcodes.SELECT)
                .end());
        invalid(TYPE_MISMATCH, I32_TO_I32, Code.body()
                .i32(1).f32(2).localGet(0).op(Opcodes.SELECT)
                .end());
    }

    @Test
    void testUnreachableIsPolymorphic() throws Throwable {
        valid(TO_I32, Code.body()
                .op(Opcodes.UNREACHABLE).op((byte) 0x6A)
                .end());
        valid(TO_I32, Code.body()
                .op(Opcodes.UNREACHABLE)
                .end());
        valid(TO_I32, Code.body()
                .i32(1).op(Opcodes.RETURN)
                .end());
        invalid(TYPE_MISMATCH, TO_I32, Code.body()
                .op(Opcodes.UNREACHABLE).f32(0)
                .end());
    }

    @Test
    void testBranchFromDeadCode() throws Throwable {
        valid(I32_PARAM, Code.body()
                .block(EMPTY)
                .br(0)
                .localGet(0).brIf(0)
                .end()
                .end());
    }

    @Test
    void testUnderflow() {
        invalid(TYPE_MISMATCH, TO_I32, Code.body()
                .i32(1).op((byte) 0x6A)
                .end());
        invalid(TYPE_MISMATCH, VOID, Code.body()
                .i32(1)
                .end());
    }

    @Test
    void testCalls() throws Throwable {
        TypeContext ctx = TypeContext.builder()
                .addFunction(Signature.results(I32))
                .addFunction(Signature.of(new ValType[]{I32}, I32))
                .build();
        valid(ctx, Code.body()
                .i32(1).op(Opcodes.CALL).u32(1)
                .end());
        invalid(STRUCTURAL_ERROR, ctx, Code.body()
                .op(Opcodes.CALL).u32(5)
                .end());
    }

    @Test
    void testGlobals() throws Throwable {
        TypeContext ctx = TypeContext.builder()
                .addFunction(Signature.EMPTY)
                .addGlobal(I32, false)
                .addGlobal(F64, true)
                .build();
        valid(ctx, Code.body()
                .op(Opcodes.GLOBAL_GET).u32(0).drop()
                .op(Opcodes.GLOBAL_GET).u32(1).op(Opcodes.GLOBAL_SET).u32(1)
                .end());
        invalid(STRUCTURAL_ERROR, ctx, Code.body()
                .i32(1).op(Opcodes.GLOBAL_SET).u32(0)
                .end());
        invalid(STRUCTURAL_ERROR, ctx, Code.body()
                .op(Opcodes.GLOBAL_GET).u32(2)
                .end());
    }

    @Test
    void testMalformed() {
        invalid(MALFORMED_ENCODING, VOID, Code.body().b(0xFF).end());
        invalid(MALFORMED_ENCODING, VOID, Code.body().end().op(Opcodes.NOP));
        invalid(MALFORMED_ENCODING, VOID, Code.body().op(Opcodes.BLOCK).b(0x55).end().end());
        invalid(MALFORMED_ENCODING, VOID, new Code().u32(1).u32(1).b(0x55).end());
    }

    @Test
    void testLimits() {
        ValidationException e = assertThrows(ValidationException.class, () -> FunctionBodyValidator.validate(
                Code.body().block(EMPTY).block(EMPTY).end().end().end().bytes(),
                VOID, 0, ValidatorOptions.defaults().maxNestingDepth(2)));
        assertEquals(STRUCTURAL_ERROR, e.kind);

        e = assertThrows(ValidationException.class, () -> FunctionBodyValidator.validate(
                new Code().u32(1).u32(10).b(I32.code).end().bytes(),
                VOID, 0, ValidatorOptions.defaults().maxLocals(5)));
        assertEquals(MALFORMED_ENCODING, e.kind);
    }

    @Test
    void testLabels() {
        invalid(STRUCTURAL_ERROR, VOID, Code.body().br(3).end());
        invalid(STRUCTURAL_ERROR, VOID, Code.body().localGet(0).end());
    }

    @Test
    void testUnknownFunction() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> FunctionBodyValidator.validate(Code.body().end().bytes(), VOID, 3));
        assertEquals(STRUCTURAL_ERROR, e.kind);
    }
}
