package io.github.eutro.funclets.ssa;

import io.github.eutro.funclets.ext.CommonExts;
import io.github.eutro.funclets.ext.Ext;
import io.github.eutro.funclets.ops.CommonOps;
import org.jetbrains.annotations.Nullable;

import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Builds SSA form while the IR is being generated, following Braun et al.,
 * <i>Simple and Efficient Construction of Static Single Assignment Form</i> (CC 2013).
 * <p>
 * Variables are arbitrary keys compared with {@link Object#equals(Object)}. Reads that cannot be answered
 * locally look through the predecessors of a block; reads in a block that is not yet {@link #sealBlock(BasicBlock) sealed}
 * produce placeholder phis that receive their operands once the block is sealed. Phis that turn out to
 * have a single distinct operand are removed, along with any phis that become trivial as a result.
 * <p>
 * Phis are only materialized into their blocks by {@link #finish()}.
 */
public class SsaBuilder {
    private static final Logger LOGGER = Logger.getLogger(SsaBuilder.class.getName());

    private final Ext<BlockState> stateExt = Ext.create(BlockState.class, "SSA_BLOCK_STATE");

    public final Function func;
    private final Map<Var, Var> replacements = new HashMap<>();
    private final Map<Insn, Phi> phiOf = new IdentityHashMap<>();
    private final List<Phi> allPhis = new ArrayList<>();
    private int phisRemoved = 0;

    public SsaBuilder(Function func) {
        this.func = func;
    }

    private static final class BlockState {
        final List<BasicBlock> preds = new ArrayList<>();
        final Map<Object, Var> defs = new HashMap<>();
        final Map<Object, Phi> incomplete = new LinkedHashMap<>();
        final List<Effect> head = new ArrayList<>();
        @Nullable Var undef;
        boolean sealed;
    }

    private enum PhiState {
        /**
         * Created in an unsealed block, operands not yet known.
         */
        PLACEHOLDER,
        /**
         * Operands known; the phi is a real merge.
         */
        FINAL,
        /**
         * Trivial, replaced by its only distinct operand.
         */
        REMOVED,
    }

    private static final class Phi {
        final Object variable;
        final BasicBlock block;
        final Var var;
        final Effect effect;
        PhiState state;

        Phi(Object variable, BasicBlock block, Var var, Effect effect, PhiState state) {
            this.variable = variable;
            this.block = block;
            this.var = var;
            this.effect = effect;
            this.state = state;
        }

        Insn insn() {
            return effect.insn();
        }
    }

    private BlockState state(BasicBlock block) {
        return block.getExtOrThrow(stateExt);
    }

    /**
     * Create a new, unsealed, block.
     *
     * @return The block.
     */
    public BasicBlock newBlock() {
        BasicBlock bb = func.newBb();
        bb.attachExt(stateExt, new BlockState());
        return bb;
    }

    /**
     * Create a new block and seal it immediately.
     * <p>
     * Used for blocks whose only predecessors are added right away, and for the entry block.
     *
     * @return The block.
     */
    public BasicBlock newSealedBlock() {
        BasicBlock bb = newBlock();
        state(bb).sealed = true;
        return bb;
    }

    public boolean isSealed(BasicBlock block) {
        return state(block).sealed;
    }

    public List<BasicBlock> predecessors(BasicBlock block) {
        return Collections.unmodifiableList(state(block).preds);
    }

    /**
     * Add a predecessor to a block.
     *
     * @param block The block.
     * @param pred  The new predecessor.
     * @throws IllegalStateException If the block is already sealed, which means whoever sealed it was wrong
     *                               about its predecessors being known.
     */
    public void addPredecessor(BasicBlock block, BasicBlock pred) {
        BlockState st = state(block);
        if (st.sealed) {
            throw new IllegalStateException("Adding predecessor " + pred.toTargetString()
                    + " to sealed block " + block.toTargetString());
        }
        st.preds.add(pred);
    }

    /**
     * Set the control instruction of a block, registering it as a predecessor of each distinct target.
     *
     * @param block The block.
     * @param ctrl  The control instruction.
     */
    public void setControl(BasicBlock block, Control ctrl) {
        track(ctrl.insn());
        block.setControl(ctrl);
        for (BasicBlock target : new LinkedHashSet<>(ctrl.targets)) {
            addPredecessor(target, block);
        }
    }

    /**
     * Append an instruction to a block, assigning its result to a new variable.
     *
     * @param block The block.
     * @param insn  The instruction.
     * @param name  The name of the new variable.
     * @return The new variable.
     */
    public Var insert(BasicBlock block, Insn insn, String name) {
        track(insn);
        Var var = func.newVar(name);
        block.addEffect(insn.assignTo(var));
        return var;
    }

    /**
     * Append an instruction with any number of results to a block.
     *
     * @param block   The block.
     * @param insn    The instruction.
     * @param results The number of results.
     * @param name    The name of the new variables.
     * @return The new variables, possibly empty.
     */
    public List<Var> insertMulti(BasicBlock block, Insn insn, int results, String name) {
        track(insn);
        List<Var> vars = new ArrayList<>(results);
        for (int i = 0; i < results; i++) {
            vars.add(func.newVar(name));
        }
        block.addEffect(insn.assignTo(vars));
        return vars;
    }

    private void track(Insn insn) {
        ListIterator<Var> it = insn.args().listIterator();
        while (it.hasNext()) {
            Var arg = resolve(it.next());
            it.set(arg);
            usesOf(arg).add(insn);
        }
    }

    private static Set<Insn> usesOf(Var var) {
        Set<Insn> uses = var.getNullable(CommonExts.USED_AT);
        if (uses == null) {
            uses = new LinkedHashSet<>();
            var.attachExt(CommonExts.USED_AT, uses);
        }
        return uses;
    }

    /**
     * Get the value a variable now stands for, following removed phis.
     *
     * @param var The variable.
     * @return The variable it was replaced with, or itself.
     */
    public Var resolve(Var var) {
        Var cur = var;
        Var next;
        while ((next = replacements.get(cur)) != null) {
            cur = next;
        }
        if (cur != var && replacements.get(var) != cur) {
            replacements.put(var, cur);
        }
        return cur;
    }

    public void writeVariable(Object variable, BasicBlock block, Var value) {
        state(block).defs.put(variable, value);
    }

    public Var readVariable(Object variable, BasicBlock block) {
        Var def = state(block).defs.get(variable);
        if (def != null) return resolve(def);
        return readVariableRecursive(variable, block);
    }

    private Var readVariableRecursive(Object variable, BasicBlock block) {
        // single-predecessor chains are walked iteratively, deep funclet chains would overflow otherwise
        Set<BasicBlock> chain = new LinkedHashSet<>();
        BasicBlock cur = block;
        Var val;
        while (true) {
            BlockState st = state(cur);
            Var def = st.defs.get(variable);
            if (def != null) {
                val = resolve(def);
                break;
            }
            if (!st.sealed) {
                Phi phi = newPhi(variable, cur, PhiState.PLACEHOLDER);
                st.incomplete.put(variable, phi);
                st.defs.put(variable, phi.var);
                val = phi.var;
                break;
            }
            if (st.preds.size() == 1 && chain.add(cur)) {
                cur = st.preds.get(0);
                continue;
            }
            if (st.preds.isEmpty() || chain.contains(cur)) {
                // no definition reaches here, the block is dead
                val = undef(cur);
                st.defs.put(variable, val);
                break;
            }
            Phi phi = newPhi(variable, cur, PhiState.FINAL);
            st.defs.put(variable, phi.var);
            val = addPhiOperands(phi);
            break;
        }
        for (BasicBlock visited : chain) {
            state(visited).defs.put(variable, val);
        }
        return val;
    }

    private Phi newPhi(Object variable, BasicBlock block, PhiState initial) {
        Insn insn = CommonOps.PHI.create(new ArrayList<>()).insn();
        Var var = func.newVar(variable.toString());
        Phi phi = new Phi(variable, block, var, insn.assignTo(var), initial);
        state(block).head.add(phi.effect);
        phiOf.put(insn, phi);
        allPhis.add(phi);
        return phi;
    }

    private Var addPhiOperands(Phi phi) {
        List<BasicBlock> preds = state(phi.block).preds;
        CommonOps.PHI.cast(phi.insn().op).arg.addAll(preds);
        for (BasicBlock pred : preds) {
            Var operand = readVariable(phi.variable, pred);
            phi.insn().args().add(operand);
            usesOf(operand).add(phi.insn());
        }
        return tryRemoveTrivialPhi(phi);
    }

    private Var tryRemoveTrivialPhi(Phi phi) {
        Var same = null;
        for (Var operand : phi.insn().args()) {
            Var op = resolve(operand);
            if (op == same || op == phi.var) continue;
            if (same != null) return phi.var;
            same = op;
        }
        if (same == null) {
            same = undef(phi.block);
        }

        phi.state = PhiState.REMOVED;
        phisRemoved++;
        replacements.put(phi.var, same);
        for (Var operand : phi.insn().args()) {
            usesOf(resolve(operand)).remove(phi.insn());
        }

        Set<Insn> users = usesOf(phi.var);
        users.remove(phi.insn());
        List<Phi> phiUsers = new ArrayList<>();
        for (Insn user : users) {
            ListIterator<Var> it = user.args().listIterator();
            while (it.hasNext()) {
                if (it.next() == phi.var) it.set(same);
            }
            usesOf(same).add(user);
            Phi userPhi = phiOf.get(user);
            if (userPhi != null && userPhi.state == PhiState.FINAL) {
                phiUsers.add(userPhi);
            }
        }
        users.clear();

        for (Phi userPhi : phiUsers) {
            if (userPhi.state == PhiState.FINAL) {
                tryRemoveTrivialPhi(userPhi);
            }
        }
        return same;
    }

    /**
     * Get the undefined value of a block, creating it if needed.
     *
     * @param block The block.
     * @return The undefined value.
     */
    public Var undef(BasicBlock block) {
        BlockState st = state(block);
        if (st.undef == null) {
            Var var = func.newVar("undef");
            st.head.add(CommonOps.UNDEF.insn().assignTo(var));
            st.undef = var;
        }
        return st.undef;
    }

    /**
     * Seal a block, declaring that all of its predecessors are known.
     * <p>
     * Placeholder phis of the block receive their operands. Sealing a sealed block does nothing.
     *
     * @param block The block.
     */
    public void sealBlock(BasicBlock block) {
        BlockState st = state(block);
        if (st.sealed) return;
        st.sealed = true;
        List<Phi> pending = new ArrayList<>(st.incomplete.values());
        st.incomplete.clear();
        for (Phi phi : pending) {
            phi.state = PhiState.FINAL;
            addPhiOperands(phi);
        }
    }

    /**
     * Count the phis that are currently placeholders, in any block.
     *
     * @return The number of placeholder phis.
     */
    public int countPlaceholders() {
        int count = 0;
        for (Phi phi : allPhis) {
            if (phi.state == PhiState.PLACEHOLDER) count++;
        }
        return count;
    }

    /**
     * Finish construction: place surviving phis at the start of their blocks and record
     * {@link CommonExts#PREDS}.
     *
     * @throws IllegalStateException If a block was left unsealed or without a control instruction.
     */
    public void finish() {
        int kept = 0;
        for (BasicBlock block : func.blocks) {
            BlockState st = state(block);
            if (!st.sealed) {
                throw new IllegalStateException("Block " + block.toTargetString() + " was never sealed");
            }
            if (block.getControl() == null) {
                throw new IllegalStateException("Block " + block.toTargetString() + " has no control instruction");
            }
            // phis first, then undef, which may be created after them
            List<Effect> head = new ArrayList<>();
            List<Effect> rest = new ArrayList<>();
            for (Effect effect : st.head) {
                Phi phi = phiOf.get(effect.insn());
                if (phi == null) {
                    rest.add(effect);
                } else if (phi.state != PhiState.REMOVED) {
                    kept++;
                    head.add(effect);
                }
            }
            head.addAll(rest);
            block.getEffects().addAll(0, head);
            block.attachExt(CommonExts.PREDS, new ArrayList<>(st.preds));
            block.removeExt(stateExt);
        }
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(String.format("SSA construction finished: %d blocks, %d phis kept, %d trivial phis removed",
                    func.blocks.size(), kept, phisRemoved));
        }
    }
}
