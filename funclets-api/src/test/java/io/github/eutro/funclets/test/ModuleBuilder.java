package io.github.eutro.funclets.test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Assembles binary modules out of raw sections.
 */
public class ModuleBuilder {
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final List<byte[]> types = new ArrayList<>();
    private final List<Integer> funcs = new ArrayList<>();
    private final List<byte[]> bodies = new ArrayList<>();
    private final List<byte[]> imports = new ArrayList<>();
    private final List<byte[]> globals = new ArrayList<>();

    static void u32(ByteArrayOutputStream out, long value) {
        do {
            int b = (int) (value & 0x7F);
            value >>>= 7;
            if (value != 0) b |= 0x80;
            out.write(b);
        } while (value != 0);
    }

    static byte[] bytes(int... bs) {
        byte[] arr = new byte[bs.length];
        for (int i = 0; i < bs.length; i++) arr[i] = (byte) bs[i];
        return arr;
    }

    /**
     * Add a function type.
     *
     * @param params  The parameter type codes.
     * @param results The result type codes.
     * @return The index of the type.
     */
    public int type(int[] params, int... results) {
        ByteArrayOutputStream type = new ByteArrayOutputStream();
        type.write(0x60);
        u32(type, params.length);
        for (int p : params) type.write(p);
        u32(type, results.length);
        for (int r : results) type.write(r);
        types.add(type.toByteArray());
        return types.size() - 1;
    }

    public ModuleBuilder importFunc(String module, String name, int typeIdx) {
        ByteArrayOutputStream imp = new ByteArrayOutputStream();
        name(imp, module);
        name(imp, name);
        imp.write(0);
        u32(imp, typeIdx);
        imports.add(imp.toByteArray());
        return this;
    }

    public ModuleBuilder global(int type, boolean mutable, int... init) {
        ByteArrayOutputStream global = new ByteArrayOutputStream();
        global.write(type);
        global.write(mutable ? 1 : 0);
        for (int b : init) global.write(b);
        global.write(0x0B);
        globals.add(global.toByteArray());
        return this;
    }

    /**
     * Add a defined function.
     *
     * @param typeIdx The index of its type.
     * @param body    Its body, locals included.
     * @return This builder.
     */
    public ModuleBuilder func(int typeIdx, byte[] body) {
        funcs.add(typeIdx);
        bodies.add(body);
        return this;
    }

    private static void name(ByteArrayOutputStream out, String name) {
        byte[] utf8 = name.getBytes(StandardCharsets.UTF_8);
        u32(out, utf8.length);
        out.write(utf8, 0, utf8.length);
    }

    private void section(int id, List<byte[]> entries) {
        if (entries.isEmpty()) return;
        ByteArrayOutputStream content = new ByteArrayOutputStream();
        u32(content, entries.size());
        for (byte[] entry : entries) content.write(entry, 0, entry.length);
        rawSection(id, content.toByteArray());
    }

    private void rawSection(int id, byte[] content) {
        out.write(id);
        u32(out, content.length);
        out.write(content, 0, content.length);
    }

    public byte[] build() {
        out.reset();
        out.write(bytes(0x00, 0x61, 0x73, 0x6D, 0x01, 0x00, 0x00, 0x00), 0, 8);
        section(1, types);
        section(2, imports);
        List<byte[]> funcEntries = new ArrayList<>();
        for (int func : funcs) {
            ByteArrayOutputStream idx = new ByteArrayOutputStream();
            u32(idx, func);
            funcEntries.add(idx.toByteArray());
        }
        section(3, funcEntries);
        section(6, globals);
        ByteArrayOutputStream custom = new ByteArrayOutputStream();
        name(custom, "note");
        custom.write(42);
        rawSection(0, custom.toByteArray());
        List<byte[]> codeEntries = new ArrayList<>();
        for (byte[] body : bodies) {
            ByteArrayOutputStream entry = new ByteArrayOutputStream();
            u32(entry, body.length);
            entry.write(body, 0, body.length);
            codeEntries.add(entry.toByteArray());
        }
        section(10, codeEntries);
        return out.toByteArray();
    }
}
