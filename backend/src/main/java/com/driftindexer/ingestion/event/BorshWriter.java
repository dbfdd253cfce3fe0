package com.driftindexer.ingestion.event;

import com.driftindexer.common.Base58;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.util.function.Consumer;

/**
 * Little-endian Borsh writer, the mirror of {@link BorshReader}.
 */
public final class BorshWriter {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();

    public BorshWriter u8(int value) {
        out.write(value & 0xFF);
        return this;
    }

    public BorshWriter u16(int value) {
        return littleEndian(value, 2);
    }

    public BorshWriter u32(long value) {
        return littleEndian(value, 4);
    }

    public BorshWriter i32(int value) {
        return littleEndian(value, 4);
    }

    public BorshWriter i64(long value) {
        return littleEndian(value, 8);
    }

    public BorshWriter u64(BigInteger value) {
        if (value.signum() < 0 || value.bitLength() > 64) {
            throw new IllegalArgumentException("Not a u64: " + value);
        }
        return littleEndian(value.longValue(), 8);
    }

    public BorshWriter bool(boolean value) {
        return u8(value ? 1 : 0);
    }

    public BorshWriter pubkey(String base58) {
        byte[] key = Base58.decode(base58);
        if (key.length != 32) {
            throw new IllegalArgumentException("Not a 32-byte pubkey: " + base58);
        }
        out.writeBytes(key);
        return this;
    }

    public BorshWriter bytes(byte[] value) {
        out.writeBytes(value);
        return this;
    }

    public <T> BorshWriter option(T value, Consumer<T> valueWriter) {
        if (value == null) {
            return u8(0);
        }
        u8(1);
        valueWriter.accept(value);
        return this;
    }

    public BorshWriter variant(Enum<?> value) {
        return u8(value.ordinal());
    }

    public byte[] toByteArray() {
        return out.toByteArray();
    }

    private BorshWriter littleEndian(long value, int width) {
        for (int i = 0; i < width; i++) {
            out.write((int) (value >>> (8 * i)) & 0xFF);
        }
        return this;
    }
}
