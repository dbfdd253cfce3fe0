package com.driftindexer.ingestion.adapter.solana;

import com.driftindexer.common.Base58;
import com.driftindexer.ingestion.adapter.UnsupportedTransactionEncodingException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses a serialized Solana transaction (legacy or v0 message) far enough to return the message's static
 * account keys. Keys loaded through address lookup tables are not included.
 */
@Component
public class SolanaTransactionDecoder {

    private static final int SIGNATURE_LENGTH = 64;
    private static final int PUBKEY_LENGTH = 32;
    private static final int BLOCKHASH_LENGTH = 32;
    private static final int VERSION_PREFIX_MASK = 0x80;

    /**
     * @throws UnsupportedTransactionEncodingException if the bytes are not a well-formed transaction
     */
    public List<String> staticAccountKeys(byte[] wire) {
        Cursor c = new Cursor(wire);
        int signatures = c.compactU16();
        c.skip((long) signatures * SIGNATURE_LENGTH);

        int first = c.u8();
        boolean versioned = (first & VERSION_PREFIX_MASK) != 0;
        int requiredSignatures;
        if (versioned) {
            int version = first & ~VERSION_PREFIX_MASK;
            if (version != 0) {
                throw new UnsupportedTransactionEncodingException("Unsupported message version " + version);
            }
            requiredSignatures = c.u8();
        } else {
            requiredSignatures = first;
        }
        c.u8(); // readonly signed
        c.u8(); // readonly unsigned

        int keyCount = c.compactU16();
        if (requiredSignatures == 0 || requiredSignatures > keyCount) {
            throw new UnsupportedTransactionEncodingException(
                    "Malformed message header: " + requiredSignatures + " signer(s) for " + keyCount + " key(s)");
        }
        List<String> keys = new ArrayList<>(keyCount);
        for (int i = 0; i < keyCount; i++) {
            keys.add(Base58.encode(c.bytes(PUBKEY_LENGTH)));
        }
        c.skip(BLOCKHASH_LENGTH);

        int instructions = c.compactU16();
        for (int i = 0; i < instructions; i++) {
            c.u8(); // program id index
            c.skip(c.compactU16()); // account indexes
            c.skip(c.compactU16()); // data
        }
        if (versioned) {
            int lookups = c.compactU16();
            for (int i = 0; i < lookups; i++) {
                c.skip(PUBKEY_LENGTH);
                c.skip(c.compactU16());
                c.skip(c.compactU16());
            }
        }
        if (c.remaining() != 0) {
            throw new UnsupportedTransactionEncodingException(c.remaining() + " trailing byte(s) after message");
        }
        return keys;
    }

    private static final class Cursor {
        private final byte[] data;
        private int pos;

        Cursor(byte[] data) {
            this.data = data;
        }

        int u8() {
            require(1);
            return data[pos++] & 0xFF;
        }

        byte[] bytes(int n) {
            require(n);
            byte[] out = new byte[n];
            System.arraycopy(data, pos, out, 0, n);
            pos += n;
            return out;
        }

        void skip(long n) {
            require(n);
            pos += (int) n;
        }

        /** Solana short-vec length: up to 3 bytes, 7 bits each, little-endian groups. */
        int compactU16() {
            int value = 0;
            for (int i = 0; i < 3; i++) {
                int b = u8();
                value |= (b & 0x7F) << (7 * i);
                if ((b & 0x80) == 0) {
                    if (value > 0xFFFF) {
                        throw new UnsupportedTransactionEncodingException("short-vec length overflow");
                    }
                    return value;
                }
            }
            throw new UnsupportedTransactionEncodingException("short-vec length longer than 3 bytes");
        }

        int remaining() {
            return data.length - pos;
        }

        private void require(long n) {
            if (n < 0 || n > remaining()) {
                throw new UnsupportedTransactionEncodingException(
                        "Transaction truncated at offset " + pos + ": wanted " + n + " byte(s), " + remaining() + " left");
            }
        }
    }
}
