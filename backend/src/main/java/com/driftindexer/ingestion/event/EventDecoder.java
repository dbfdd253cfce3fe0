package com.driftindexer.ingestion.event;

import com.driftindexer.domain.event.DriftEvent;
import com.driftindexer.domain.event.DriftEventKind;

/**
 * Borsh codec for one event kind. Every decoder bean is picked up by {@link EventRegistry}, so supporting a new
 * event means adding a decoder, not touching the scanner.
 */
public interface EventDecoder<T extends DriftEvent> {

    DriftEventKind kind();

    Class<T> eventType();

    default Discriminator discriminator() {
        return Discriminator.forEvent(kind().getEventName());
    }

    /**
     * Decode the payload that follows the discriminant. Strict: truncated input, trailing bytes and invalid
     * option/enum/bool tags fail.
     *
     * @throws DecodeException if the bytes do not match the layout
     */
    T decode(byte[] payload);

    /** Inverse of {@link #decode}; the returned bytes exclude the discriminant. */
    byte[] encode(T event);
}
