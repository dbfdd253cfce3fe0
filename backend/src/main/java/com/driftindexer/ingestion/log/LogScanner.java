package com.driftindexer.ingestion.log;

import com.driftindexer.domain.event.DriftEvent;
import com.driftindexer.ingestion.event.Discriminator;
import com.driftindexer.ingestion.event.EventRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Base64;
import java.util.List;
import java.util.Optional;

/**
 * Extracts Anchor events from program log lines of the form {@code "Program log: <base64>"} or
 * {@code "Program data: <base64>"}. Most lines in a transaction belong to other programs or are plain
 * text and yield nothing.
 */
@Component
@RequiredArgsConstructor
public class LogScanner {

    /** Checked in this order. */
    static final List<String> PAYLOAD_MARKERS = List.of("Program log: ", "Program data: ");

    private final EventRegistry eventRegistry;

    /**
     * @return the event embedded in {@code line}, or empty if the line has no marker or an unknown discriminant
     * @throws LogParseException if a marker is present but the remainder is not a base64 envelope
     * @throws com.driftindexer.ingestion.event.DecodeException if the discriminant is known but the payload is malformed
     */
    public Optional<DriftEvent> extract(String line) {
        if (line == null) {
            return Optional.empty();
        }
        Optional<String> encoded = stripMarker(line);
        if (encoded.isEmpty()) {
            return Optional.empty();
        }
        byte[] envelope;
        try {
            envelope = Base64.getDecoder().decode(encoded.get());
        } catch (IllegalArgumentException e) {
            throw new LogParseException("Invalid base64 after log marker: " + abbreviate(encoded.get()), e);
        }
        if (envelope.length < Discriminator.LENGTH) {
            throw new LogParseException("Log payload shorter than discriminator (" + envelope.length + " bytes)");
        }
        Discriminator discriminator = Discriminator.of(Arrays.copyOf(envelope, Discriminator.LENGTH));
        byte[] payload = Arrays.copyOfRange(envelope, Discriminator.LENGTH, envelope.length);
        return eventRegistry.resolve(discriminator, payload);
    }

    private static Optional<String> stripMarker(String line) {
        for (String marker : PAYLOAD_MARKERS) {
            if (line.startsWith(marker)) {
                return Optional.of(line.substring(marker.length()));
            }
        }
        return Optional.empty();
    }

    private static String abbreviate(String s) {
        return s.length() <= 48 ? s : s.substring(0, 48) + "...";
    }
}
