package com.driftindexer.ingestion.event;

import com.driftindexer.common.Base58;

import java.math.BigInteger;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.function.Supplier;

/**
 * Sequential little-endian reader over a Borsh payload. Every read failure surfaces as {@link DecodeException}.
 */
public final class BorshReader {

    private static final int PUBKEY_LENGTH = 32;

    private final ByteBuffer buffer;

    public BorshReader(byte[] payload) {
        this.buffer = ByteBuffer.wrap(payload).order(ByteOrder.LITTLE_ENDIAN);
    }

    public int u8() {
        return Byte.toUnsignedInt(guard(() -> buffer.get()));
    }

    public int u16() {
        return Short.toUnsignedInt(guard(() -> buffer.getShort()));
    }

    public long u32() {
        return Integer.toUnsignedLong(guard(() -> buffer.getInt()));
    }

    public int i32() {
        return guard(() -> buffer.getInt());
    }

    public long i64() {
        return guard(() -> buffer.getLong());
    }

    public BigInteger u64() {
        long raw = guard(() -> buffer.getLong());
        BigInteger value = BigInteger.valueOf(raw & Long.MAX_VALUE);
        return raw < 0 ? value.setBit(63) : value;
    }

    public boolean bool() {
        int b = u8();
        if (b > 1) {
            throw new DecodeException("Invalid bool byte " + b + " at offset " + (buffer.position() - 1));
        }
        return b == 1;
    }

    public String pubkey() {
        return Base58.encode(bytes(PUBKEY_LENGTH));
    }

    public byte[] bytes(int length) {
        if (buffer.remaining() < length) {
            throw underflow(length);
        }
        byte[] out = new byte[length];
        buffer.get(out);
        return out;
    }

    /** Borsh Option: one tag byte (0 = None, 1 = Some) followed by the value when present. */
    public <T> T option(Supplier<T> valueReader) {
        int tag = u8();
        if (tag == 0) {
            return null;
        }
        if (tag != 1) {
            throw new DecodeException("Invalid option tag " + tag + " at offset " + (buffer.position() - 1));
        }
        return valueReader.get();
    }

    /** Fieldless Borsh enum: one byte variant index mapped to the constant with that ordinal. */
    public <E extends Enum<E>> E variant(Class<E> type) {
        int index = u8();
        E[] constants = type.getEnumConstants();
        if (index >= constants.length) {
            throw new DecodeException("Invalid " + type.getSimpleName() + " variant " + index);
        }
        return constants[index];
    }

    public void expectEnd() {
        if (buffer.hasRemaining()) {
            throw new DecodeException(buffer.remaining() + " trailing byte(s) after payload");
        }
    }

    private <T> T guard(Supplier<T> read) {
        try {
            return read.get();
        } catch (BufferUnderflowException e) {
            throw new DecodeException("Payload truncated at offset " + buffer.position(), e);
        }
    }

    private DecodeException underflow(int wanted) {
        return new DecodeException("Payload truncated at offset " + buffer.position()
                + ": wanted " + wanted + " byte(s), " + buffer.remaining() + " left");
    }
}
