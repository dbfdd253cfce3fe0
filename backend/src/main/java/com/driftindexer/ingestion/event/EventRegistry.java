package com.driftindexer.ingestion.event;

import com.driftindexer.domain.event.DriftEvent;
import com.driftindexer.domain.event.DriftEventKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Discriminant -> decoder lookup, built once from all {@link EventDecoder} beans.
 */
@Component
@Slf4j
public class EventRegistry {

    private final Map<Discriminator, EventDecoder<?>> byDiscriminator;
    private final Map<DriftEventKind, EventDecoder<?>> byKind;

    public EventRegistry(List<EventDecoder<?>> decoders) {
        Map<Discriminator, EventDecoder<?>> discriminators = new HashMap<>();
        Map<DriftEventKind, EventDecoder<?>> kinds = new EnumMap<>(DriftEventKind.class);
        for (EventDecoder<?> decoder : decoders) {
            EventDecoder<?> clash = discriminators.putIfAbsent(decoder.discriminator(), decoder);
            if (clash != null || kinds.putIfAbsent(decoder.kind(), decoder) != null) {
                throw new IllegalStateException("Duplicate event decoder for " + decoder.kind()
                        + " (discriminator " + decoder.discriminator() + ")");
            }
        }
        this.byDiscriminator = Map.copyOf(discriminators);
        this.byKind = kinds;
        log.info("Event registry ready: {}", kinds.keySet());
    }

    /**
     * @return the decoded event, or empty when the discriminant is not registered
     * @throws DecodeException if the discriminant is known but the payload does not match its layout
     */
    public Optional<DriftEvent> resolve(Discriminator discriminator, byte[] payload) {
        EventDecoder<?> decoder = byDiscriminator.get(discriminator);
        if (decoder == null) {
            return Optional.empty();
        }
        return Optional.of(decoder.decode(payload));
    }

    /**
     * Full wire form of {@code event}: discriminant followed by the Borsh payload.
     */
    public byte[] encode(DriftEvent event) {
        EventDecoder<?> decoder = byKind.get(event.kind());
        if (decoder == null) {
            throw new IllegalArgumentException("No decoder registered for " + event.kind());
        }
        byte[] payload = encodeWith(decoder, event);
        byte[] tag = decoder.discriminator().toByteArray();
        byte[] out = new byte[tag.length + payload.length];
        System.arraycopy(tag, 0, out, 0, tag.length);
        System.arraycopy(payload, 0, out, tag.length, payload.length);
        return out;
    }

    private static <T extends DriftEvent> byte[] encodeWith(EventDecoder<T> decoder, DriftEvent event) {
        return decoder.encode(decoder.eventType().cast(event));
    }
}
