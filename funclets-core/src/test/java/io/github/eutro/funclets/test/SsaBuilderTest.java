package io.github.eutro.funclets.test;

import io.github.eutro.funclets.bytecode.NumericOps;
import io.github.eutro.funclets.ext.CommonExts;
import io.github.eutro.funclets.ops.CommonOps;
import io.github.eutro.funclets.ops.HostOps;
import io.github.eutro.funclets.passes.meta.VerifySsa;
import io.github.eutro.funclets.ssa.*;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SsaBuilderTest {
    static Control ret(Var... vals) {
        return CommonOps.RETURN.insn(vals).jumpsTo();
    }

    static boolean isPhi(Var var) {
        Effect effect = var.getExtOrThrow(CommonExts.ASSIGNED_AT);
        return CommonOps.PHI.check(effect.insn().op).isPresent();
    }

    @Test
    void testStraightLine() {
        Function func = new Function();
        SsaBuilder ssa = new SsaBuilder(func);
        BasicBlock entry = ssa.newSealedBlock();
        Var a = ssa.insert(entry, CommonOps.constant(1), "a");
        ssa.writeVariable("x", entry, a);
        assertSame(a, ssa.readVariable("x", entry));

        BasicBlock next = ssa.newBlock();
        ssa.setControl(entry, CommonOps.br(next));
        ssa.sealBlock(next);
        assertSame(a, ssa.readVariable("x", next));
        ssa.setControl(next, ret(a));
        ssa.finish();
        assertEquals(Arrays.asList(entry), next.getExtOrThrow(CommonExts.PREDS));
    }

    @Test
    void testDiamondPhi() {
        Function func = new Function();
        SsaBuilder ssa = new SsaBuilder(func);
        BasicBlock entry = ssa.newSealedBlock();
        Var a = ssa.insert(entry, CommonOps.constant(1), "a");
        Var c = ssa.insert(entry, CommonOps.constant(0), "c");
        ssa.writeVariable("x", entry, a);

        BasicBlock left = ssa.newBlock();
        BasicBlock right = ssa.newBlock();
        BasicBlock join = ssa.newBlock();
        ssa.setControl(entry, HostOps.brIf(c, left, right));
        ssa.sealBlock(left);
        ssa.sealBlock(right);

        Var b = ssa.insert(left, CommonOps.constant(2), "b");
        ssa.writeVariable("x", left, b);
        ssa.setControl(left, CommonOps.br(join));
        ssa.setControl(right, CommonOps.br(join));
        ssa.sealBlock(join);

        Var x = ssa.readVariable("x", join);
        assertTrue(isPhi(x));
        Insn phi = x.getExtOrThrow(CommonExts.ASSIGNED_AT).insn();
        assertEquals(Arrays.asList(left, right), CommonOps.PHI.cast(phi.op).arg);
        assertEquals(Arrays.asList(b, a), phi.args());

        ssa.setControl(join, ret(x));
        ssa.finish();
        assertSame(phi, join.getEffects().get(0).insn());
        VerifySsa.INSTANCE.runInPlace(func);
    }

    @Test
    void testTrivialLoopPhiRemoved() {
        Function func = new Function();
        SsaBuilder ssa = new SsaBuilder(func);
        BasicBlock entry = ssa.newSealedBlock();
        Var a = ssa.insert(entry, CommonOps.constant(1), "a");
        ssa.writeVariable("x", entry, a);

        BasicBlock header = ssa.newBlock();
        ssa.setControl(entry, CommonOps.br(header));
        Var placeholder = ssa.readVariable("x", header);
        assertNotSame(a, placeholder);
        assertEquals(1, ssa.countPlaceholders());

        Var eqz = ssa.insert(header, HostOps.OPERATOR.create(NumericOps.get((byte) 0x45)).insn(placeholder), "eqz");
        BasicBlock body = ssa.newBlock();
        BasicBlock exit = ssa.newBlock();
        ssa.setControl(header, HostOps.brIf(eqz, body, exit));
        ssa.sealBlock(body);
        ssa.sealBlock(exit);
        ssa.setControl(body, CommonOps.br(header));
        ssa.sealBlock(header);

        assertEquals(0, ssa.countPlaceholders());
        assertSame(a, ssa.resolve(placeholder));
        assertSame(a, ssa.readVariable("x", exit));
        Insn eqzInsn = eqz.getExtOrThrow(CommonExts.ASSIGNED_AT).insn();
        assertSame(a, eqzInsn.args().get(0));

        ssa.setControl(exit, ret());
        ssa.finish();
        for (Effect effect : header.getEffects()) {
            assertFalse(CommonOps.PHI.check(effect.insn().op).isPresent());
        }
        VerifySsa.INSTANCE.runInPlace(func);
    }

    @Test
    void testLoopPhiKept() {
        Function func = new Function();
        SsaBuilder ssa = new SsaBuilder(func);
        BasicBlock entry = ssa.newSealedBlock();
        Var a = ssa.insert(entry, CommonOps.constant(1), "a");
        ssa.writeVariable("x", entry, a);

        BasicBlock header = ssa.newBlock();
        ssa.setControl(entry, CommonOps.br(header));
        Var x = ssa.readVariable("x", header);
        Var next = ssa.insert(header, HostOps.OPERATOR.create(NumericOps.get((byte) 0x45)).insn(x), "next");
        ssa.writeVariable("x", header, next);
        BasicBlock exit = ssa.newBlock();
        ssa.setControl(header, HostOps.brIf(next, header, exit));
        ssa.sealBlock(header);
        ssa.sealBlock(exit);

        assertTrue(isPhi(x));
        assertSame(x, ssa.resolve(x));
        Insn phi = x.getExtOrThrow(CommonExts.ASSIGNED_AT).insn();
        assertEquals(Arrays.asList(a, next), phi.args());

        ssa.setControl(exit, ret(ssa.readVariable("x", exit)));
        ssa.finish();
        VerifySsa.INSTANCE.runInPlace(func);
    }

    @Test
    void testUnreachableReadIsUndef() {
        Function func = new Function();
        SsaBuilder ssa = new SsaBuilder(func);
        BasicBlock dead = ssa.newSealedBlock();
        Var x = ssa.readVariable("x", dead);
        assertSame(ssa.undef(dead), x);
        assertSame(x, ssa.readVariable("x", dead));
        ssa.setControl(dead, ret(x));
        ssa.finish();
        assertSame(CommonOps.UNDEF, dead.getEffects().get(0).insn().op);
    }

    @Test
    void testSealedBlockRejectsPredecessors() {
        Function func = new Function();
        SsaBuilder ssa = new SsaBuilder(func);
        BasicBlock entry = ssa.newSealedBlock();
        BasicBlock target = ssa.newBlock();
        ssa.sealBlock(target);
        ssa.sealBlock(target);
        assertTrue(ssa.isSealed(target));
        assertThrows(IllegalStateException.class, () -> ssa.setControl(entry, CommonOps.br(target)));
    }

    @Test
    void testFinishRejectsUnsealed() {
        Function func = new Function();
        SsaBuilder ssa = new SsaBuilder(func);
        BasicBlock entry = ssa.newSealedBlock();
        BasicBlock open = ssa.newBlock();
        ssa.setControl(entry, CommonOps.br(open));
        ssa.setControl(open, ret());
        assertThrows(IllegalStateException.class, ssa::finish);
    }

    @Test
    void testDuplicateTargetsAreOnePredecessor() {
        Function func = new Function();
        SsaBuilder ssa = new SsaBuilder(func);
        BasicBlock entry = ssa.newSealedBlock();
        Var c = ssa.insert(entry, CommonOps.constant(0), "c");
        BasicBlock target = ssa.newBlock();
        ssa.setControl(entry, HostOps.brTable(c, Arrays.asList(target, target, target)));
        ssa.sealBlock(target);
        List<BasicBlock> preds = ssa.predecessors(target);
        assertEquals(Arrays.asList(entry), preds);
    }

    @Test
    void testNestedLoopsCascade() {
        Function func = new Function();
        SsaBuilder ssa = new SsaBuilder(func);
        BasicBlock entry = ssa.newSealedBlock();
        Var a = ssa.insert(entry, CommonOps.constant(1), "a");
        Var c = ssa.insert(entry, CommonOps.constant(0), "c");
        ssa.writeVariable("x", entry, a);

        BasicBlock outer = ssa.newBlock();
        ssa.setControl(entry, CommonOps.br(outer));
        BasicBlock inner = ssa.newBlock();
        ssa.setControl(outer, CommonOps.br(inner));
        Var read = ssa.readVariable("x", inner);
        BasicBlock latch = ssa.newBlock();
        ssa.setControl(inner, HostOps.brIf(c, inner, latch));
        ssa.sealBlock(inner);
        ssa.sealBlock(latch);
        BasicBlock exit = ssa.newBlock();
        ssa.setControl(latch, HostOps.brIf(c, outer, exit));
        ssa.sealBlock(outer);
        ssa.sealBlock(exit);

        assertSame(a, ssa.resolve(read));
        assertEquals(0, ssa.countPlaceholders());
        ssa.setControl(exit, ret(ssa.readVariable("x", exit)));
        ssa.finish();
        VerifySsa.INSTANCE.runInPlace(func);
    }

    @Test
    void testVerifyChecksOwnership() {
        Function func = new Function();
        SsaBuilder ssa = new SsaBuilder(func);
        BasicBlock entry = ssa.newSealedBlock();
        Var a = ssa.insert(entry, CommonOps.constant(1), "a");
        BasicBlock next = ssa.newBlock();
        ssa.setControl(entry, CommonOps.br(next));
        ssa.sealBlock(next);
        ssa.setControl(next, ret(a));
        ssa.finish();
        VerifySsa.INSTANCE.runInPlace(func);

        Effect def = entry.getEffects().get(0);
        assertSame(entry, def.getExtOrThrow(CommonExts.OWNING_BLOCK));
        assertSame(def, def.insn().getExtOrThrow(CommonExts.OWNING_EFFECT));
        assertSame(func, next.getExtOrThrow(CommonExts.OWNING_FUNCTION));

        // the effect is now listed in both blocks, but only owned by the second
        next.getEffects().add(def);
        assertSame(next, def.getExtOrThrow(CommonExts.OWNING_BLOCK));
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> VerifySsa.INSTANCE.runInPlace(func));
        assertTrue(e.getMessage().contains("owned by"), e::getMessage);
    }
}
