package io.github.eutro.funclets.test;

import io.github.eutro.funclets.bytecode.ByteInputStream;
import io.github.eutro.funclets.validate.ValidationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ByteInputStreamTest {
    static ByteInputStream bytes(int... bs) {
        byte[] arr = new byte[bs.length];
        for (int i = 0; i < bs.length; i++) arr[i] = (byte) bs[i];
        return new ByteInputStream(arr);
    }

    static void assertMalformed(ValidationException.Kind kind, ThrowingRead read) {
        ValidationException e = assertThrows(ValidationException.class, read::read);
        assertEquals(kind, e.kind);
    }

    interface ThrowingRead {
        void read() throws ValidationException;
    }

    @Test
    void testUnsigned() throws Throwable {
        assertEquals(624485, bytes(0xE5, 0x8E, 0x26).readVarUInt32());
        assertEquals(0, bytes(0x80, 0x00).readVarUInt32());
        assertEquals(-1, bytes(0xFF, 0xFF, 0xFF, 0xFF, 0x0F).readVarUInt32());
    }

    @Test
    void testSigned() throws Throwable {
        assertEquals(-123456, bytes(0xC0, 0xBB, 0x78).readVarInt32());
        assertEquals(-1, bytes(0x7F).readVarInt32());
        assertEquals(63, bytes(0x3F).readVarInt32());
        assertEquals(-1, bytes(0xFF, 0xFF, 0xFF, 0xFF, 0x7F).readVarInt32());
        assertEquals(Long.MIN_VALUE, bytes(0x80, 0x80, 0x80, 0x80, 0x80, 0x80, 0x80, 0x80, 0x80, 0x7F).readVarInt64());
    }

    @Test
    void testS33BlockTypes() throws Throwable {
        assertEquals(-64, bytes(0x40).readVarS33());
        assertEquals(-1, bytes(0x7F).readVarS33());
        assertEquals(200, bytes(0xC8, 0x01).readVarS33());
    }

    @Test
    void testOverlong() {
        assertMalformed(ValidationException.Kind.MALFORMED_ENCODING,
                () -> bytes(0x80, 0x80, 0x80, 0x80, 0x80, 0x00).readVarUInt32());
        assertMalformed(ValidationException.Kind.MALFORMED_ENCODING,
                () -> bytes(0xFF, 0xFF, 0xFF, 0xFF, 0x1F).readVarUInt32());
        assertMalformed(ValidationException.Kind.MALFORMED_ENCODING,
                () -> bytes(0xFF, 0xFF, 0xFF, 0xFF, 0x4F).readVarInt32());
    }

    @Test
    void testTruncated() {
        ValidationException e = assertThrows(ValidationException.class, () -> bytes(0x80).readVarUInt32());
        assertEquals(ValidationException.Kind.MALFORMED_ENCODING, e.kind);
        assertEquals(1, e.offset);
        assertThrows(ValidationException.class, () -> bytes().readByte());
    }

    @Test
    void testIndexRange() {
        assertMalformed(ValidationException.Kind.MALFORMED_ENCODING,
                () -> bytes(0xFF, 0xFF, 0xFF, 0xFF, 0x0F).readVarIndex());
    }

    @Test
    void testSlice() throws Throwable {
        ByteInputStream in = bytes(1, 2, 3, 4);
        in.readByte();
        ByteInputStream slice = in.slice(2);
        assertEquals(1, slice.position());
        assertEquals(2, slice.remaining());
        assertEquals(2, slice.readByte());
        assertEquals(3, in.position());
        assertThrows(ValidationException.class, () -> in.slice(2));
    }
}
