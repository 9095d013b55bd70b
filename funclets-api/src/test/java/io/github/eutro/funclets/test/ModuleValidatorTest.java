package io.github.eutro.funclets.test;

import io.github.eutro.funclets.api.BodyResult;
import io.github.eutro.funclets.api.ModuleReader;
import io.github.eutro.funclets.api.ModuleValidation;
import io.github.eutro.funclets.api.ModuleValidator;
import io.github.eutro.funclets.validate.ValidationException;
import io.github.eutro.funclets.validate.ValidatorOptions;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static io.github.eutro.funclets.test.ModuleBuilder.bytes;
import static org.junit.jupiter.api.Assertions.*;

public class ModuleValidatorTest {
    static final byte[] REGION_BODY = bytes(0x00, 0x16, 0x40, 0x01, 0x20, 0x00, 0x1A, 0x0B, 0x0B);
    static final byte[] BACKWARD_BODY = bytes(0x00, 0x16, 0x40, 0x01, 0x1D, 0x00, 0x0B, 0x0B);
    static final byte[] EMPTY_BODY = bytes(0x00, 0x0B);
    static final byte[] GLOBAL_BODY = bytes(0x00, 0x23, 0x00, 0x24, 0x00, 0x0B);
    static final byte[] TRAILING_BODY = bytes(0x00, 0x0B, 0x01);

    static byte[] sampleModule() {
        ModuleBuilder mb = new ModuleBuilder();
        int voidType = mb.type(new int[0]);
        int i32Type = mb.type(new int[]{0x7F});
        return mb.importFunc("env", "f", voidType)
                .global(0x7F, true, 0x41, 0x00)
                .func(i32Type, REGION_BODY)
                .func(voidType, BACKWARD_BODY)
                .func(voidType, EMPTY_BODY)
                .func(voidType, GLOBAL_BODY)
                .func(voidType, TRAILING_BODY)
                .build();
    }

    @Test
    void testSampleModule() throws Throwable {
        ModuleValidation validation = new ModuleValidator(ValidatorOptions.DEFAULT, 2).validate(sampleModule());
        assertEquals(5, validation.results.size());
        assertEquals(1, validation.module.importedFuncs);
        assertFalse(validation.isValid());
        assertEquals(2, validation.failures().size());

        BodyResult region = validation.get(1);
        assertTrue(region.isValid());
        assertEquals(1, region.getBody().regions.size());

        BodyResult backward = validation.get(2);
        assertFalse(backward.isValid());
        ValidationException error = backward.getValidationError();
        assertNotNull(error);
        assertEquals(ValidationException.Kind.PREDECESSOR_COUNT_ERROR, error.kind);
        ModuleReader.CodeBody body = validation.module.bodies.get(1);
        assertTrue(error.offset > body.offset && error.offset < body.offset + body.length);

        assertTrue(validation.get(3).isValid());
        assertTrue(validation.get(4).isValid());
        assertEquals(ValidationException.Kind.MALFORMED_ENCODING, validation.get(5).getValidationError().kind);
        assertThrows(IllegalArgumentException.class, () -> validation.get(0));
    }

    @Test
    void testFailuresAreIsolated() throws Throwable {
        ModuleBuilder mb = new ModuleBuilder();
        int voidType = mb.type(new int[0]);
        int i32Type = mb.type(new int[]{0x7F});
        int count = 200;
        for (int i = 0; i < count; i++) {
            if (i % 3 == 0) {
                mb.func(voidType, BACKWARD_BODY);
            } else {
                mb.func(i32Type, REGION_BODY);
            }
        }
        ModuleValidation validation = new ModuleValidator(ValidatorOptions.DEFAULT, 8).validate(mb.build());
        assertEquals(count, validation.results.size());
        for (int i = 0; i < count; i++) {
            BodyResult result = validation.results.get(i);
            assertEquals(i, result.funcIndex);
            assertEquals(i % 3 != 0, result.isValid(), result::toString);
        }
    }

    @Test
    void testOwnExecutor() throws Throwable {
        ExecutorService executor = Executors.newFixedThreadPool(3);
        try {
            ModuleReader.ModuleContents module = ModuleReader.read(sampleModule());
            ModuleValidation first = new ModuleValidator().validate(module, executor);
            ModuleValidation second = new ModuleValidator().validate(module, executor);
            assertFalse(executor.isShutdown());
            assertEquals(first.failures().size(), second.failures().size());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testSingleBody() throws Throwable {
        ModuleReader.ModuleContents module = ModuleReader.read(sampleModule());
        BodyResult result = ModuleValidator.validateBody(module, module.bodies.get(0), ValidatorOptions.DEFAULT);
        assertTrue(result.isValid());
        assertNull(result.getError());
        assertEquals(1, result.funcIndex);
    }

    @Test
    void testBadParallelism() {
        assertThrows(IllegalArgumentException.class, () -> new ModuleValidator(ValidatorOptions.DEFAULT, 0));
    }
}
