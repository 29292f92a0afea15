package io.ailang.core.bytecode;

import java.util.Arrays;
import java.util.Base64;
import java.util.Objects;

/**
 * An encoded bytecode module: {@code "ALBC"}, version byte, constant pool, code length, code, END.
 * Immutable; the bytes are copied on the way in and on the way out.
 */
public final class BytecodeModule {

    private final byte[] bytes;

    private BytecodeModule(byte[] bytes) {
        this.bytes = bytes;
    }

    /** Wraps a copy of {@code bytes}. No validation happens until the module is run. */
    public static BytecodeModule of(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes must not be null");
        return new BytecodeModule(bytes.clone());
    }

    /**
     * Decodes standard base64.
     *
     * @throws IllegalArgumentException if {@code base64} is not valid base64
     */
    public static BytecodeModule fromBase64(String base64) {
        Objects.requireNonNull(base64, "base64 must not be null");
        return new BytecodeModule(Base64.getDecoder().decode(base64.strip()));
    }

    /** Returns a copy of the encoded bytes. */
    public byte[] bytes() {
        return bytes.clone();
    }

    public int size() {
        return bytes.length;
    }

    public String toBase64() {
        return Base64.getEncoder().encodeToString(bytes);
    }

    /** Package-private access without copying, for the decoder. */
    byte[] rawBytes() {
        return bytes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BytecodeModule that)) return false;
        return Arrays.equals(bytes, that.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "BytecodeModule{" + bytes.length + " bytes}";
    }
}
