package io.github.eutro.funclets.bytecode;

import io.github.eutro.funclets.validate.ValidationException;

import static io.github.eutro.funclets.validate.ValidationException.Kind.MALFORMED_ENCODING;

/**
 * A forward-only cursor over a byte array, decoding the integer encodings of the host bytecode.
 * <p>
 * Offsets reported by {@link #position()} are absolute indices into the underlying array,
 * so that errors in a slice still point at the right byte of the original input.
 */
public final class ByteInputStream {
    private final byte[] bytes;
    private int pos;
    private final int limit;

    public ByteInputStream(byte[] bytes) {
        this(bytes, 0, bytes.length);
    }

    public ByteInputStream(byte[] bytes, int offset, int length) {
        if (offset < 0 || length < 0 || offset + length > bytes.length) {
            throw new IndexOutOfBoundsException("offset " + offset + ", length " + length + ", size " + bytes.length);
        }
        this.bytes = bytes;
        this.pos = offset;
        this.limit = offset + length;
    }

    public int position() {
        return pos;
    }

    public boolean hasMore() {
        return pos < limit;
    }

    public int remaining() {
        return limit - pos;
    }

    private ValidationException eof() {
        return new ValidationException(MALFORMED_ENCODING, pos, "unexpected end of input");
    }

    public byte peekByte() throws ValidationException {
        if (pos >= limit) throw eof();
        return bytes[pos];
    }

    public byte readByte() throws ValidationException {
        if (pos >= limit) throw eof();
        return bytes[pos++];
    }

    public void skip(int n) throws ValidationException {
        if (n < 0 || n > remaining()) throw eof();
        pos += n;
    }

    /**
     * Split off the next {@code length} bytes as their own stream, and skip them in this one.
     *
     * @param length The number of bytes.
     * @return The new stream.
     * @throws ValidationException If there are not enough bytes left.
     */
    public ByteInputStream slice(int length) throws ValidationException {
        if (length < 0 || length > remaining()) throw eof();
        ByteInputStream slice = new ByteInputStream(bytes, pos, length);
        pos += length;
        return slice;
    }

    private long readUnsigned(int bits) throws ValidationException {
        int start = pos;
        int maxBytes = (bits + 6) / 7;
        long result = 0;
        for (int i = 0; i < maxBytes; i++) {
            byte b = readByte();
            result |= (long) (b & 0x7F) << (7 * i);
            if (i == maxBytes - 1) {
                int remainingBits = bits - 7 * i;
                if ((b & 0x80) != 0) {
                    throw new ValidationException(MALFORMED_ENCODING, start, "integer representation too long");
                }
                if ((b & 0x7F) >> remainingBits != 0) {
                    throw new ValidationException(MALFORMED_ENCODING, start, "integer too large");
                }
            } else if ((b & 0x80) == 0) {
                break;
            }
        }
        return result;
    }

    private long readSigned(int bits) throws ValidationException {
        int start = pos;
        int maxBytes = (bits + 6) / 7;
        long result = 0;
        int shift = 0;
        byte b;
        int i = 0;
        while (true) {
            b = readByte();
            result |= (long) (b & 0x7F) << shift;
            shift += 7;
            if (i == maxBytes - 1) {
                int remainingBits = bits - 7 * i;
                if ((b & 0x80) != 0) {
                    throw new ValidationException(MALFORMED_ENCODING, start, "integer representation too long");
                }
                int top = (b & 0x7F) >> (remainingBits - 1);
                if (top != 0 && top != 0x7F >> (remainingBits - 1)) {
                    throw new ValidationException(MALFORMED_ENCODING, start, "integer too large");
                }
                break;
            }
            if ((b & 0x80) == 0) break;
            i++;
        }
        if (shift < 64 && (b & 0x40) != 0) {
            result |= -1L << shift;
        }
        return result;
    }

    public int readVarUInt32() throws ValidationException {
        return (int) readUnsigned(32);
    }

    /**
     * Read an unsigned 32-bit integer that is used as a count or index, and so must fit in an int.
     *
     * @return The value.
     * @throws ValidationException If the encoding is malformed or the value does not fit.
     */
    public int readVarIndex() throws ValidationException {
        int start = pos;
        int value = readVarUInt32();
        if (value < 0) {
            throw new ValidationException(MALFORMED_ENCODING, start, "index out of range: " + Integer.toUnsignedString(value));
        }
        return value;
    }

    public int readVarInt32() throws ValidationException {
        return (int) readSigned(32);
    }

    public long readVarInt64() throws ValidationException {
        return readSigned(64);
    }

    public long readVarS33() throws ValidationException {
        return readSigned(33);
    }

    public int readInt32LE() throws ValidationException {
        if (remaining() < 4) throw eof();
        int value = (bytes[pos] & 0xFF)
                | (bytes[pos + 1] & 0xFF) << 8
                | (bytes[pos + 2] & 0xFF) << 16
                | (bytes[pos + 3] & 0xFF) << 24;
        pos += 4;
        return value;
    }

    public long readInt64LE() throws ValidationException {
        long lo = readInt32LE() & 0xFFFFFFFFL;
        long hi = readInt32LE() & 0xFFFFFFFFL;
        return lo | hi << 32;
    }

    public float readFloat32() throws ValidationException {
        return Float.intBitsToFloat(readInt32LE());
    }

    public double readFloat64() throws ValidationException {
        return Double.longBitsToDouble(readInt64LE());
    }
}
