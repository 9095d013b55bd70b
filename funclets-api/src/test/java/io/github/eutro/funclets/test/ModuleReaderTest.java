package io.github.eutro.funclets.test;

import io.github.eutro.funclets.api.ModuleReader;
import io.github.eutro.funclets.bytecode.ValType;
import io.github.eutro.funclets.validate.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static io.github.eutro.funclets.test.ModuleBuilder.bytes;
import static org.junit.jupiter.api.Assertions.*;

public class ModuleReaderTest {
    static ValidationException.Kind rejected(byte[] module) {
        return assertThrows(ValidationException.class, () -> ModuleReader.read(module)).kind;
    }

    @Test
    void testRead() throws Throwable {
        ModuleReader.ModuleContents module = ModuleReader.read(ModuleValidatorTest.sampleModule());
        assertEquals(2, module.ctx.types.size());
        assertEquals(Arrays.asList(0, 1, 0, 0, 0, 0), module.ctx.funcTypes);
        assertEquals(1, module.ctx.globals.size());
        assertEquals(ValType.I32, module.ctx.globals.get(0).type);
        assertTrue(module.ctx.globals.get(0).mutable);
        assertEquals(5, module.bodies.size());
        assertEquals(ModuleValidatorTest.REGION_BODY.length, module.bodies.get(0).length);
        assertEquals(0x00, module.bytes[module.bodies.get(0).offset]);
        assertEquals(0x16, module.bytes[module.bodies.get(0).offset + 1]);
    }

    @Test
    void testEmptyModule() throws Throwable {
        ModuleReader.ModuleContents module = ModuleReader.read(bytes(0x00, 0x61, 0x73, 0x6D, 0x01, 0x00, 0x00, 0x00));
        assertTrue(module.bodies.isEmpty());
        assertEquals(0, module.importedFuncs);
    }

    @Test
    void testHeader() {
        assertEquals(ValidationException.Kind.MALFORMED_ENCODING, rejected(bytes(0x00, 0x61, 0x73)));
        assertEquals(ValidationException.Kind.MALFORMED_ENCODING,
                rejected(bytes(0x00, 0x61, 0x73, 0x6E, 0x01, 0x00, 0x00, 0x00)));
        assertEquals(ValidationException.Kind.MALFORMED_ENCODING,
                rejected(bytes(0x00, 0x61, 0x73, 0x6D, 0x02, 0x00, 0x00, 0x00)));
    }

    @Test
    void testBodyCountMismatch() {
        byte[] module = bytes(0x00, 0x61, 0x73, 0x6D, 0x01, 0x00, 0x00, 0x00,
                0x01, 0x04, 0x01, 0x60, 0x00, 0x00,
                0x03, 0x02, 0x01, 0x00,
                0x0A, 0x01, 0x00);
        assertEquals(ValidationException.Kind.MALFORMED_ENCODING, rejected(module));
    }

    @Test
    void testUnknownType() {
        byte[] module = bytes(0x00, 0x61, 0x73, 0x6D, 0x01, 0x00, 0x00, 0x00,
                0x03, 0x02, 0x01, 0x05);
        assertEquals(ValidationException.Kind.STRUCTURAL_ERROR, rejected(module));
    }

    @Test
    void testSectionSizeMismatch() {
        byte[] module = bytes(0x00, 0x61, 0x73, 0x6D, 0x01, 0x00, 0x00, 0x00,
                0x01, 0x05, 0x01, 0x60, 0x00, 0x00, 0x00);
        assertEquals(ValidationException.Kind.MALFORMED_ENCODING, rejected(module));
        byte[] overrun = bytes(0x00, 0x61, 0x73, 0x6D, 0x01, 0x00, 0x00, 0x00,
                0x01, 0x09, 0x01, 0x60);
        assertEquals(ValidationException.Kind.MALFORMED_ENCODING, rejected(overrun));
    }
}
