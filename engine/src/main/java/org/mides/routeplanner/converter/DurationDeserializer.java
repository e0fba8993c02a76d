package org.mides.routeplanner.converter;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;

import java.io.IOException;
import java.time.Duration;

/**
 * Reads {@code HH:mm[:ss]} offsets from midnight. {@code 24:00:00} is
 * accepted so an end of day can be written explicitly.
 */
public class DurationDeserializer extends JsonDeserializer<Duration> {

    @Override
    public Duration deserialize(JsonParser p, DeserializationContext context) throws IOException {
        String durationStr = p.getText();
        String[] parts = durationStr.trim().split(":");
        if (parts.length < 2 || parts.length > 3) {
            throw new IOException("Failed to parse Duration: " + durationStr);
        }
        try {
            long hours = Long.parseLong(parts[0]);
            long minutes = Long.parseLong(parts[1]);
            long seconds = parts.length == 3 ? Long.parseLong(parts[2]) : 0;
            if (minutes > 59 || seconds > 59 || hours < 0 || minutes < 0 || seconds < 0) {
                throw new IOException("Failed to parse Duration: " + durationStr);
            }
            return Duration.ofHours(hours).plusMinutes(minutes).plusSeconds(seconds);
        } catch (NumberFormatException e) {
            throw new IOException("Failed to parse Duration", e);
        }
    }
}
