package io.ailang.core.bytecode;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/** Growable little-endian byte buffer with in-place patching of already written words. */
final class ByteSink {

    private byte[] buf;
    private int length;

    ByteSink() {
        this(1024);
    }

    ByteSink(int initialCapacity) {
        this.buf = new byte[Math.max(16, initialCapacity)];
    }

    /** Number of bytes written so far; also the offset of the next write. */
    int position() {
        return length;
    }

    void u8(int value) {
        ensure(1);
        buf[length++] = (byte) value;
    }

    void u32(int value) {
        ensure(4);
        putInt(length, value);
        length += 4;
    }

    void i32(int value) {
        u32(value);
    }

    void f64(double value) {
        long bits = Double.doubleToRawLongBits(value);
        ensure(8);
        putInt(length, (int) bits);
        putInt(length + 4, (int) (bits >>> 32));
        length += 8;
    }

    void bytes(byte[] src) {
        ensure(src.length);
        System.arraycopy(src, 0, buf, length, src.length);
        length += src.length;
    }

    /** Writes a u32 byte length followed by the UTF-8 bytes. */
    void utf8(String s) {
        byte[] encoded = s.getBytes(StandardCharsets.UTF_8);
        u32(encoded.length);
        bytes(encoded);
    }

    /** Overwrites the four bytes at {@code at}, which must already have been written. */
    void patchI32(int at, int value) {
        if (at < 0 || at + 4 > length) {
            throw new IndexOutOfBoundsException("patch offset " + at + " outside written range " + length);
        }
        putInt(at, value);
    }

    byte[] toByteArray() {
        return Arrays.copyOf(buf, length);
    }

    private void putInt(int at, int value) {
        buf[at] = (byte) value;
        buf[at + 1] = (byte) (value >>> 8);
        buf[at + 2] = (byte) (value >>> 16);
        buf[at + 3] = (byte) (value >>> 24);
    }

    private void ensure(int n) {
        if (length + n <= buf.length) {
            return;
        }
        int capacity = buf.length;
        while (capacity < length + n) {
            capacity *= 2;
        }
        buf = Arrays.copyOf(buf, capacity);
    }
}
