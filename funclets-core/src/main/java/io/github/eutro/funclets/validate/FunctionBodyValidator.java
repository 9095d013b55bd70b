package io.github.eutro.funclets.validate;

import io.github.eutro.funclets.bytecode.*;
import io.github.eutro.funclets.ops.CommonOps;
import io.github.eutro.funclets.ops.HostOps;
import io.github.eutro.funclets.passes.meta.VerifySsa;
import io.github.eutro.funclets.region.CallEdge;
import io.github.eutro.funclets.region.Funclet;
import io.github.eutro.funclets.region.FuncletCallGraph;
import io.github.eutro.funclets.region.FuncletRegion;
import io.github.eutro.funclets.ssa.BasicBlock;
import io.github.eutro.funclets.ssa.Function;
import io.github.eutro.funclets.ssa.SsaBuilder;
import io.github.eutro.funclets.ssa.Var;
import io.github.eutro.funclets.util.InsnMap;
import org.jetbrains.annotations.Nullable;

import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

import static io.github.eutro.funclets.bytecode.Opcodes.*;
import static io.github.eutro.funclets.validate.ValidationException.Kind.*;

/**
 * Decodes and validates a function body in one forward pass, building its SSA IR as it goes.
 * <p>
 * The body is {@code vec(locals) expr}. Control frames are kept on an explicit stack, funclet regions
 * included, so regions and blocks nest inside each other freely. Each value on the operand stack
 * has a type, and the SSA variable holding it. Values that cross a control edge are passed through
 * {@link Slot#stack(int) stack slots}, so the {@link SsaBuilder} merges them like locals.
 * <p>
 * A validator instance handles one body, on one thread.
 */
public final class FunctionBodyValidator {
    private static final Logger LOGGER = Logger.getLogger(FunctionBodyValidator.class.getName());

    private final ByteInputStream in;
    private final TypeContext ctx;
    private final ValidatorOptions options;
    private final int funcIndex;
    private final Signature funcType;

    private final OperandTypeStack types = new OperandTypeStack();
    private final List<Var> values = new ArrayList<>();
    private final List<ControlFrame> ctrls = new ArrayList<>();
    private final List<ValType> locals = new ArrayList<>();
    private final List<FuncletRegion> regions = new ArrayList<>();

    private final Function func = new Function();
    private final SsaBuilder ssa = new SsaBuilder(func);
    private BasicBlock bb;

    private int insnOffset;
    private int lastOpcode = -1;

    private FunctionBodyValidator(ByteInputStream in, TypeContext ctx, int funcIndex, ValidatorOptions options)
            throws ValidationException {
        this.in = in;
        this.ctx = ctx;
        this.options = options;
        this.funcIndex = funcIndex;
        this.funcType = ctx.funcType(funcIndex, in.position());
    }

    public static ValidatedBody validate(byte[] body, TypeContext ctx, int funcIndex) throws ValidationException {
        return validate(body, ctx, funcIndex, ValidatorOptions.DEFAULT);
    }

    /**
     * Validate a whole byte array as a function body. Bytes after the final {@code end} are an error.
     *
     * @param body      The body.
     * @param ctx       The enclosing module.
     * @param funcIndex The index of the function, which gives its type.
     * @param options   The options.
     * @return The validated body.
     * @throws ValidationException If the body is invalid.
     */
    public static ValidatedBody validate(byte[] body, TypeContext ctx, int funcIndex, ValidatorOptions options)
            throws ValidationException {
        ByteInputStream in = new ByteInputStream(body);
        ValidatedBody result = validate(in, ctx, funcIndex, options);
        if (in.hasMore()) {
            throw new ValidationException(MALFORMED_ENCODING, in.position(),
                    in.remaining() + " trailing bytes after function body");
        }
        return result;
    }

    public static ValidatedBody validate(ByteInputStream in, TypeContext ctx, int funcIndex) throws ValidationException {
        return validate(in, ctx, funcIndex, ValidatorOptions.DEFAULT);
    }

    /**
     * Validate the function body at the cursor, leaving the cursor after its final {@code end}.
     *
     * @param in        The input.
     * @param ctx       The enclosing module.
     * @param funcIndex The index of the function, which gives its type.
     * @param options   The options.
     * @return The validated body.
     * @throws ValidationException If the body is invalid.
     */
    public static ValidatedBody validate(ByteInputStream in, TypeContext ctx, int funcIndex, ValidatorOptions options)
            throws ValidationException {
        return new FunctionBodyValidator(in, ctx, funcIndex, options).run();
    }

    private ValidatedBody run() throws ValidationException {
        readLocals();

        BasicBlock entry = ssa.newSealedBlock();
        for (int i = 0; i < locals.size(); i++) {
            Var local = ssa.insert(entry, i < funcType.params.size()
                            ? CommonOps.ARG.create(i).insn()
                            : HostOps.ZEROINIT.create(locals.get(i)).insn(),
                    "l" + i);
            ssa.writeVariable(Slot.local(i), entry, local);
        }
        bb = entry;
        pushC(ControlFrame.Kind.FUNCTION, new Signature(Collections.emptyList(), funcType.results), null);

        while (!ctrls.isEmpty()) {
            if (!in.hasMore()) {
                throw truncated();
            }
            step();
        }

        ssa.finish();
        if (ssa.countPlaceholders() != 0) {
            throw new IllegalStateException(ssa.countPlaceholders() + " placeholder phis left after construction");
        }
        if (options.verifySsa) {
            VerifySsa.INSTANCE.runInPlace(func);
        }
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("validated function " + funcIndex + ": " + func.blocks.size() + " blocks, "
                    + regions.size() + " regions");
        }
        return new ValidatedBody(funcIndex, funcType, locals, func, regions);
    }

    private void readLocals() throws ValidationException {
        locals.addAll(funcType.params);
        int groups = in.readVarIndex();
        long total = locals.size();
        for (int i = 0; i < groups; i++) {
            int start = in.position();
            int count = in.readVarIndex();
            ValType type = TypeContext.readValType(in);
            total += count;
            if (total > options.maxLocals) {
                throw new ValidationException(MALFORMED_ENCODING, start, "too many locals: " + total);
            }
            locals.addAll(Collections.nCopies(count, type));
        }
    }

    private ValidationException truncated() {
        for (int i = ctrls.size() - 1; i >= 0; i--) {
            FuncletRegion region = ctrls.get(i).region;
            if (region != null) {
                return new ValidationException(STRUCTURAL_ERROR, in.position(),
                        "region ended after " + (region.graph.current() + 1) + " of " + region.size() + " funclets")
                        .withFunclet(region.graph.current());
            }
        }
        return new ValidationException(MALFORMED_ENCODING, in.position(), "unexpected end of function body");
    }

    private void step() throws ValidationException {
        insnOffset = in.position();
        byte opcode = in.readByte();
        ControlFrame top = ctrlsRef(0);
        if (top.betweenFunclets) {
            top.betweenFunclets = false;
            if (opcode == FUNCLET_SIG) {
                Signature sig = ctx.readBlockType(in);
                int preds = in.readVarIndex();
                beginFunclet(top, sig, preds);
                lastOpcode = opcode;
                return;
            }
            beginFunclet(top, null, 0);
        }

        Converter converter = CONVERTERS.get(opcode);
        if (converter != null) {
            converter.convert(this);
        } else {
            NumericOps.NumericOp op = NumericOps.get(opcode);
            if (op == null) {
                throw new ValidationException(MALFORMED_ENCODING, insnOffset,
                        String.format("unknown opcode 0x%02x", opcode & 0xFF));
            }
            List<Var> args = popValues(op.params);
            push(op.result, ssa.insert(bb, HostOps.OPERATOR.create(op).insn(args), "v"));
        }
        lastOpcode = opcode;
    }

    // errors

    private @Nullable FuncletRegion innermostRegion() {
        for (int i = ctrls.size() - 1; i >= 0; i--) {
            FuncletRegion region = ctrls.get(i).region;
            if (region != null) return region;
        }
        return null;
    }

    private ValidationException error(ValidationException.Kind kind, String message) {
        ValidationException e = new ValidationException(kind, insnOffset, message);
        FuncletRegion region = innermostRegion();
        if (region != null && region.graph.current() >= 0) {
            e.withFunclet(region.graph.current());
        }
        return e;
    }

    // frames

    ControlFrame ctrlsRef(int idx) {
        return ctrls.get(ctrls.size() - idx - 1);
    }

    private ControlFrame pushC(ControlFrame.Kind kind, Signature type, @Nullable BasicBlock label) throws ValidationException {
        if (ctrls.size() >= options.maxNestingDepth) {
            throw error(STRUCTURAL_ERROR, "control nesting deeper than " + options.maxNestingDepth);
        }
        ControlFrame frame = new ControlFrame(kind, type, types.height(), label);
        ctrls.add(frame);
        return frame;
    }

    private ControlFrame label(int depth) throws ValidationException {
        if (depth < 0 || depth >= ctrls.size()) {
            throw error(STRUCTURAL_ERROR, "unknown label " + depth);
        }
        return ctrlsRef(depth);
    }

    /**
     * Make the rest of the current frame unreachable, after an unconditional transfer.
     * At the outermost level of a funclet, this ends the funclet instead.
     */
    private void unreachable() throws ValidationException {
        ControlFrame frame = ctrlsRef(0);
        if (frame.kind == ControlFrame.Kind.REGION) {
            endFunclet(frame);
            return;
        }
        truncate(frame.height);
        frame.unreachable = true;
        bb = ssa.newSealedBlock();
    }

    // operands

    private void push(ValType type, Var value) {
        types.push(type);
        values.add(value);
    }

    private void pushValues(List<ValType> pushTypes, List<Var> pushVals) {
        for (int i = 0; i < pushTypes.size(); i++) {
            push(pushTypes.get(i), pushVals.get(i));
        }
    }

    private void truncate(int height) {
        types.truncate(height);
        values.subList(height, values.size()).clear();
    }

    private List<Var> valuesAbove(int height) {
        return Collections.unmodifiableList(new ArrayList<>(values.subList(height, values.size())));
    }

    private ValType peekType() {
        ControlFrame frame = ctrlsRef(0);
        return types.height() > frame.height ? Objects.requireNonNull(types.peek()) : ValType.BOTTOM;
    }

    private Var popValue(@Nullable ValType expected) throws ValidationException {
        return pop(expected, null);
    }

    private Var pop(@Nullable ValType expected, @Nullable List<ValType> popped) throws ValidationException {
        ControlFrame frame = ctrlsRef(0);
        ValType actual = types.popAbove(frame.height);
        Var value;
        if (actual == null) {
            if (!frame.unreachable) {
                throw error(TYPE_MISMATCH, frame.kind == ControlFrame.Kind.REGION
                        ? "stack underflow below region mark"
                        : "stack underflow")
                        .withTypes(expected == null ? Collections.emptyList() : Collections.singletonList(expected),
                                Collections.emptyList());
            }
            actual = ValType.BOTTOM;
            value = ssa.undef(bb);
        } else {
            value = values.remove(values.size() - 1);
        }
        if (expected != null && !actual.matches(expected)) {
            throw error(TYPE_MISMATCH, "operand type mismatch")
                    .withTypes(Collections.singletonList(expected), Collections.singletonList(actual));
        }
        if (popped != null) popped.add(0, actual);
        return value;
    }

    private List<Var> popValues(List<ValType> expected) throws ValidationException {
        return popValues(expected, null);
    }

    private List<Var> popValues(List<ValType> expected, @Nullable List<ValType> popped) throws ValidationException {
        Var[] vals = new Var[expected.size()];
        for (int i = vals.length - 1; i >= 0; i--) {
            vals[i] = pop(expected.get(i), popped);
        }
        return Arrays.asList(vals);
    }

    /**
     * Pop exactly the given types, leaving the frame's stack empty.
     */
    private List<Var> popExact(ControlFrame frame, List<ValType> expected) throws ValidationException {
        List<ValType> actual = types.valuesAbove(frame.height);
        boolean ok = frame.unreachable
                ? actual.size() <= expected.size()
                : ValType.allMatch(expected, actual);
        if (!ok) {
            throw error(TYPE_MISMATCH, "wrong values left on stack at end of " + frame.kind.name().toLowerCase())
                    .withTypes(expected, actual);
        }
        return popValues(expected);
    }

    private void writeSlots(BasicBlock block, int height, List<Var> vals) {
        for (int i = 0; i < vals.size(); i++) {
            ssa.writeVariable(Slot.stack(height + i), block, vals.get(i));
        }
    }

    private List<Var> readSlots(BasicBlock block, int height, int count) {
        List<Var> vals = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            vals.add(ssa.readVariable(Slot.stack(height + i), block));
        }
        return vals;
    }

    /**
     * End {@code from} with a jump to a label, passing {@code vals}.
     */
    private void transfer(BasicBlock from, ControlFrame target, List<Var> vals) {
        if (target.kind == ControlFrame.Kind.FUNCTION) {
            ssa.setControl(from, CommonOps.RETURN.insn(vals).jumpsTo());
        } else {
            writeSlots(from, target.height, vals);
            ssa.setControl(from, CommonOps.br(Objects.requireNonNull(target.label)));
        }
    }

    // funclets

    private void openRegion(Signature sig, int numFunclets) throws ValidationException {
        List<Var> params = popValues(sig.params);
        BasicBlock exit = ssa.newBlock();
        FuncletCallGraph graph = new FuncletCallGraph(numFunclets, sig.params, insnOffset,
                funclet -> ssa.sealBlock(Objects.requireNonNull(funclet.getEntry())));
        for (Funclet funclet : graph.funclets()) {
            funclet.setEntry(ssa.newBlock());
        }
        ControlFrame frame = pushC(ControlFrame.Kind.REGION, sig, exit);
        FuncletRegion region = new FuncletRegion(regions.size(), sig, ctrls.size() - 1,
                insnOffset, frame.height, graph, exit);
        regions.add(region);
        frame.region = region;
        frame.betweenFunclets = true;

        writeSlots(bb, frame.height, params);
        ssa.setControl(bb, CommonOps.br(Objects.requireNonNull(graph.get(0).getEntry())));
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("entered " + region);
        }
    }

    private void beginFunclet(ControlFrame frame, @Nullable Signature sig, int declaredPreds) throws ValidationException {
        FuncletCallGraph graph = Objects.requireNonNull(frame.region).graph;
        Funclet funclet = graph.enter(graph.current() + 1, sig, declaredPreds, insnOffset);
        truncate(frame.height);
        frame.unreachable = false;
        bb = Objects.requireNonNull(funclet.getEntry());
        List<ValType> params = Objects.requireNonNull(funclet.getSignature()).params;
        pushValues(params, readSlots(bb, frame.height, params.size()));
    }

    private void endFunclet(ControlFrame frame) throws ValidationException {
        FuncletRegion region = Objects.requireNonNull(frame.region);
        truncate(frame.height);
        if (!region.graph.isLast()) {
            frame.betweenFunclets = true;
            return;
        }
        region.graph.finish(in.position());
        ssa.sealBlock(region.exit);
        ctrls.remove(ctrls.size() - 1);
        bb = region.exit;
        pushValues(region.signature.results, readSlots(bb, frame.height, region.signature.results.size()));
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("finished " + region + " with " + region.graph.edges().size() + " edges");
        }
    }

    /**
     * Get the region frame, checking that a funclet call is at the outermost level of a funclet.
     */
    private ControlFrame funcletLevel(String insn) throws ValidationException {
        ControlFrame top = ctrlsRef(0);
        if (top.kind != ControlFrame.Kind.REGION) {
            throw error(STRUCTURAL_ERROR, innermostRegion() == null
                    ? insn + " outside of a funclet region"
                    : insn + " must be at the outermost level of a funclet");
        }
        return top;
    }

    private void wireCall(ControlFrame frame, BasicBlock from, CallEdge edge, List<Var> args) {
        FuncletCallGraph graph = Objects.requireNonNull(frame.region).graph;
        writeSlots(from, frame.height, args);
        ssa.setControl(from, CommonOps.br(Objects.requireNonNull(graph.get(edge.callee).getEntry())));
        graph.record(edge);
    }

    /**
     * Read a branch table: a vector of entries, then the default entry, which is last in the result.
     */
    private int[] readTable(boolean signed) throws ValidationException {
        int count = in.readVarIndex();
        if (count > in.remaining()) {
            throw new ValidationException(MALFORMED_ENCODING, in.position(), "table of " + count + " targets overruns body");
        }
        int[] table = new int[count + 1];
        for (int i = 0; i <= count; i++) {
            table[i] = signed ? in.readVarInt32() : in.readVarIndex();
        }
        return table;
    }

    // instructions

    interface Converter {
        void convert(FunctionBodyValidator v) throws ValidationException;
    }

    private static final InsnMap<Converter> CONVERTERS = new InsnMap<>();

    static {
        CONVERTERS.put(UNREACHABLE, v -> {
            v.ssa.setControl(v.bb, CommonOps.trap("unreachable"));
            v.unreachable();
        });
        CONVERTERS.put(NOP, v -> {
        });
        CONVERTERS.put(BLOCK, v -> {
            Signature sig = v.ctx.readBlockType(v.in);
            List<Var> params = v.popValues(sig.params);
            v.pushC(ControlFrame.Kind.BLOCK, sig, v.ssa.newBlock());
            v.pushValues(sig.params, params);
        });
        CONVERTERS.put(LOOP, v -> {
            Signature sig = v.ctx.readBlockType(v.in);
            List<Var> params = v.popValues(sig.params);
            BasicBlock header = v.ssa.newBlock();
            ControlFrame frame = v.pushC(ControlFrame.Kind.LOOP, sig, header);
            v.writeSlots(v.bb, frame.height, params);
            v.ssa.setControl(v.bb, CommonOps.br(header));
            v.bb = header;
            v.pushValues(sig.params, v.readSlots(header, frame.height, sig.params.size()));
        });
        CONVERTERS.put(IF, v -> {
            Signature sig = v.ctx.readBlockType(v.in);
            Var cond = v.popValue(ValType.I32);
            List<Var> params = v.popValues(sig.params);
            BasicBlock thenBb = v.ssa.newBlock();
            BasicBlock elseBb = v.ssa.newBlock();
            v.ssa.setControl(v.bb, HostOps.brIf(cond, thenBb, elseBb));
            v.ssa.sealBlock(thenBb);
            v.ssa.sealBlock(elseBb);
            ControlFrame frame = v.pushC(ControlFrame.Kind.IF, sig, v.ssa.newBlock());
            frame.elseBb = elseBb;
            frame.paramVals = params;
            v.bb = thenBb;
            v.pushValues(sig.params, params);
        });
        CONVERTERS.put(ELSE, v -> {
            ControlFrame frame = v.ctrlsRef(0);
            if (frame.kind != ControlFrame.Kind.IF) {
                throw v.error(STRUCTURAL_ERROR, "else without if");
            }
            v.endArm(frame);
            frame.kind = ControlFrame.Kind.ELSE;
            frame.unreachable = false;
            v.bb = Objects.requireNonNull(frame.elseBb);
            frame.elseBb = null;
            v.pushValues(frame.type.params, Objects.requireNonNull(frame.paramVals));
        });
        CONVERTERS.put(END, FunctionBodyValidator::end);
    }

    /**
     * Leave the current arm of a block, if or else, jumping to its continuation.
     */
    private void endArm(ControlFrame frame) throws ValidationException {
        List<Var> results = popExact(frame, frame.type.results);
        if (frame.unreachable) {
            ssa.setControl(bb, CommonOps.trap("unreachable"));
        } else {
            transfer(bb, frame, results);
        }
    }

    private void end() throws ValidationException {
        ControlFrame frame = ctrlsRef(0);
        switch (frame.kind) {
            case REGION: {
                FuncletCallGraph graph = Objects.requireNonNull(frame.region).graph;
                List<ValType> argTypes = types.valuesAbove(frame.height);
                List<Var> args = valuesAbove(frame.height);
                if (graph.isLast()) {
                    if (!ValType.allMatch(frame.type.results, argTypes)) {
                        throw error(TYPE_MISMATCH, "end of last funclet does not match region results")
                                .withTypes(frame.type.results, argTypes);
                    }
                    transfer(bb, frame, args);
                } else {
                    CallEdge edge = graph.resolve(graph.current(), 1, argTypes, insnOffset);
                    wireCall(frame, bb, edge, args);
                }
                endFunclet(frame);
                return;
            }
            case FUNCTION: {
                List<Var> results = popExact(frame, frame.type.results);
                ssa.setControl(bb, frame.unreachable
                        ? CommonOps.trap("unreachable")
                        : CommonOps.RETURN.insn(results).jumpsTo());
                ctrls.remove(ctrls.size() - 1);
                return;
            }
            case LOOP: {
                List<Var> results = popExact(frame, frame.type.results);
                ssa.sealBlock(Objects.requireNonNull(frame.label));
                ctrls.remove(ctrls.size() - 1);
                pushValues(frame.type.results, results);
                return;
            }
            case IF:
                if (!frame.type.params.equals(frame.type.results)) {
                    throw error(TYPE_MISMATCH, "if without else must have the same params and results")
                            .withTypes(frame.type.results, frame.type.params);
                }
                endArm(frame);
                transfer(Objects.requireNonNull(frame.elseBb), frame, Objects.requireNonNull(frame.paramVals));
                break;
            default:
                endArm(frame);
                break;
        }
        BasicBlock cont = Objects.requireNonNull(frame.label);
        ctrls.remove(ctrls.size() - 1);
        ssa.sealBlock(cont);
        bb = cont;
        pushValues(frame.type.results, readSlots(cont, frame.height, frame.type.results.size()));
    }

    static {
        CONVERTERS.put(BR, v -> {
            ControlFrame target = v.label(v.in.readVarIndex());
            List<Var> vals = v.popValues(target.labelTypes());
            v.transfer(v.bb, target, vals);
            v.unreachable();
        });
        CONVERTERS.put(BR_IF, v -> {
            ControlFrame target = v.label(v.in.readVarIndex());
            Var cond = v.popValue(ValType.I32);
            List<ValType> labelTypes = target.labelTypes();
            List<Var> vals = v.popValues(labelTypes);
            v.pushValues(labelTypes, vals);

            BasicBlock thenBb = v.ssa.newBlock();
            BasicBlock elseBb = v.ssa.newBlock();
            v.ssa.setControl(v.bb, HostOps.brIf(cond, thenBb, elseBb));
            v.ssa.sealBlock(thenBb);
            v.ssa.sealBlock(elseBb);
            v.transfer(thenBb, target, vals);
            v.bb = elseBb;
        });
        CONVERTERS.put(BR_TABLE, v -> {
            int[] depths = v.readTable(false);
            ControlFrame defaultFrame = v.label(depths[depths.length - 1]);
            Var cond = v.popValue(ValType.I32);
            List<ValType> popped = new ArrayList<>();
            List<Var> vals = v.popValues(defaultFrame.labelTypes(), popped);

            Map<Integer, BasicBlock> thrus = new LinkedHashMap<>();
            List<BasicBlock> targets = new ArrayList<>();
            for (int depth : depths) {
                ControlFrame frame = v.label(depth);
                if (!ValType.allMatch(frame.labelTypes(), popped)) {
                    throw v.error(TYPE_MISMATCH, "br_table target " + depth + " does not accept the operands")
                            .withTypes(frame.labelTypes(), popped);
                }
                targets.add(thrus.computeIfAbsent(depth, d -> v.ssa.newBlock()));
            }
            v.ssa.setControl(v.bb, HostOps.brTable(cond, targets));
            for (Map.Entry<Integer, BasicBlock> entry : thrus.entrySet()) {
                v.ssa.sealBlock(entry.getValue());
                v.transfer(entry.getValue(), v.ctrlsRef(entry.getKey()), vals);
            }
            v.unreachable();
        });
        CONVERTERS.put(RETURN, v -> {
            ControlFrame fnFrame = v.ctrls.get(0);
            List<Var> vals = v.popValues(fnFrame.type.results);
            v.transfer(v.bb, fnFrame, vals);
            v.unreachable();
        });
        CONVERTERS.put(CALL, v -> {
            int callee = v.in.readVarIndex();
            Signature type = v.ctx.funcType(callee, v.insnOffset);
            List<Var> args = v.popValues(type.params);
            List<Var> results = v.ssa.insertMulti(v.bb, HostOps.CALL.create(callee).insn(args),
                    type.results.size(), "call");
            v.pushValues(type.results, results);
        });
    }

    static {
        CONVERTERS.put(FUNCLET_REGION, v -> {
            Signature sig = v.ctx.readBlockType(v.in);
            int countOffset = v.in.position();
            int numFunclets = v.in.readVarIndex();
            if (numFunclets == 0) {
                throw new ValidationException(MALFORMED_ENCODING, countOffset, "num_funclets must be positive");
            }
            if (numFunclets > v.options.maxFunclets) {
                throw v.error(STRUCTURAL_ERROR, "region declares " + numFunclets + " funclets, limit is "
                        + v.options.maxFunclets);
            }
            v.openRegion(sig, numFunclets);
        });
        CONVERTERS.put(FUNCLET_SIG, v -> {
            if (v.lastOpcode == FUNCLET_SIG && v.ctrlsRef(0).kind == ControlFrame.Kind.REGION) {
                throw v.error(STRUCTURAL_ERROR, "duplicate funclet_sig");
            }
            throw v.error(STRUCTURAL_ERROR, v.innermostRegion() == null
                    ? "funclet_sig outside of a funclet region"
                    : "funclet_sig must be the first instruction of a funclet");
        });
        CONVERTERS.put(FUNCLET_CALL, v -> {
            int delta = v.in.readVarInt32();
            ControlFrame frame = v.funcletLevel("funclet_call");
            FuncletCallGraph graph = Objects.requireNonNull(frame.region).graph;
            CallEdge edge = graph.resolve(graph.current(), delta, v.types.valuesAbove(frame.height), v.insnOffset);
            v.wireCall(frame, v.bb, edge, v.valuesAbove(frame.height));
            v.endFunclet(frame);
        });
        CONVERTERS.put(FUNCLET_CALL_IF, v -> {
            int delta = v.in.readVarInt32();
            ControlFrame frame = v.funcletLevel("funclet_call_if");
            FuncletCallGraph graph = Objects.requireNonNull(frame.region).graph;
            Var cond = v.popValue(ValType.I32);
            CallEdge edge = graph.resolve(graph.current(), delta, v.types.valuesAbove(frame.height), v.insnOffset);

            BasicBlock thenBb = v.ssa.newBlock();
            BasicBlock elseBb = v.ssa.newBlock();
            v.ssa.setControl(v.bb, HostOps.brIf(cond, thenBb, elseBb));
            v.ssa.sealBlock(thenBb);
            v.ssa.sealBlock(elseBb);
            v.wireCall(frame, thenBb, edge, v.valuesAbove(frame.height));
            v.bb = elseBb;
        });
        CONVERTERS.put(FUNCLET_CALL_TABLE, v -> {
            int[] deltas = v.readTable(true);
            ControlFrame frame = v.funcletLevel("funclet_call_table");
            FuncletCallGraph graph = Objects.requireNonNull(frame.region).graph;
            Var cond = v.popValue(ValType.I32);
            List<ValType> argTypes = v.types.valuesAbove(frame.height);
            List<Var> args = v.valuesAbove(frame.height);

            // one edge per distinct target
            Map<Integer, CallEdge> edges = new LinkedHashMap<>();
            Map<Integer, BasicBlock> thrus = new HashMap<>();
            List<BasicBlock> targets = new ArrayList<>();
            for (int delta : deltas) {
                CallEdge edge = graph.resolve(graph.current(), delta, argTypes, v.insnOffset);
                edges.putIfAbsent(edge.callee, edge);
                targets.add(thrus.computeIfAbsent(edge.callee, c -> v.ssa.newBlock()));
            }
            v.ssa.setControl(v.bb, HostOps.brTable(cond, targets));
            for (CallEdge edge : edges.values()) {
                BasicBlock thru = thrus.get(edge.callee);
                v.ssa.sealBlock(thru);
                v.wireCall(frame, thru, edge, args);
            }
            v.endFunclet(frame);
        });
    }

    static {
        CONVERTERS.put(DROP, v -> v.popValue(null));
        CONVERTERS.put(SELECT, v -> {
            Var cond = v.popValue(ValType.I32);
            ValType iffType = v.peekType();
            Var iff = v.popValue(null);
            ValType iftType = v.peekType();
            Var ift = v.popValue(null);
            if (!iftType.matches(iffType)
                    || !(iftType.isNumeric() || iftType == ValType.BOTTOM)
                    || !(iffType.isNumeric() || iffType == ValType.BOTTOM)) {
                throw v.error(TYPE_MISMATCH, "select operands must be the same numeric type")
                        .withTypes(Collections.singletonList(iftType), Collections.singletonList(iffType));
            }
            ValType result = iftType == ValType.BOTTOM ? iffType : iftType;
            v.push(result, v.ssa.insert(v.bb, HostOps.SELECT.insn(cond, ift, iff), "select"));
        });
    }

    private ValType local(int index) throws ValidationException {
        if (index < 0 || index >= locals.size()) {
            throw error(STRUCTURAL_ERROR, "unknown local " + index);
        }
        return locals.get(index);
    }

    static {
        CONVERTERS.put(LOCAL_GET, v -> {
            int idx = v.in.readVarIndex();
            ValType type = v.local(idx);
            v.push(type, v.ssa.readVariable(Slot.local(idx), v.bb));
        });
        CONVERTERS.put(LOCAL_SET, v -> {
            int idx = v.in.readVarIndex();
            Var value = v.popValue(v.local(idx));
            v.ssa.writeVariable(Slot.local(idx), v.bb, value);
        });
        CONVERTERS.put(LOCAL_TEE, v -> {
            int idx = v.in.readVarIndex();
            ValType type = v.local(idx);
            Var value = v.popValue(type);
            v.ssa.writeVariable(Slot.local(idx), v.bb, value);
            v.push(type, value);
        });
        CONVERTERS.put(GLOBAL_GET, v -> {
            int idx = v.in.readVarIndex();
            TypeContext.GlobalType global = v.ctx.global(idx, v.insnOffset);
            v.push(global.type, v.ssa.insert(v.bb, HostOps.GLOBAL_GET.create(idx).insn(), "g" + idx));
        });
        CONVERTERS.put(GLOBAL_SET, v -> {
            int idx = v.in.readVarIndex();
            TypeContext.GlobalType global = v.ctx.global(idx, v.insnOffset);
            if (!global.mutable) {
                throw v.error(STRUCTURAL_ERROR, "global " + idx + " is immutable");
            }
            Var value = v.popValue(global.type);
            v.ssa.insertMulti(v.bb, HostOps.GLOBAL_SET.create(idx).insn(value), 0, "g" + idx);
        });
    }

    static {
        CONVERTERS.put(I32_CONST, v -> v.push(ValType.I32, v.ssa.insert(v.bb,
                CommonOps.constant(v.in.readVarInt32()), "const")));
        CONVERTERS.put(I64_CONST, v -> v.push(ValType.I64, v.ssa.insert(v.bb,
                CommonOps.constant(v.in.readVarInt64()), "const")));
        CONVERTERS.put(F32_CONST, v -> v.push(ValType.F32, v.ssa.insert(v.bb,
                CommonOps.constant(v.in.readFloat32()), "const")));
        CONVERTERS.put(F64_CONST, v -> v.push(ValType.F64, v.ssa.insert(v.bb,
                CommonOps.constant(v.in.readFloat64()), "const")));
    }
}
