package org.mides.routeplanner.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.mides.routeplanner.converter.DurationDeserializer;
import org.mides.routeplanner.converter.DurationSerializer;

import java.time.Duration;

/**
 * Delivery window expressed as offsets from midnight. The defaults cover
 * the whole day, which is how an order without a window is represented.
 */
@Data
@NoArgsConstructor
public class TimeWindow {
    public static final long MIN_SECONDS = 0;
    public static final long MAX_SECONDS = 86400;

    @NotNull
    @JsonProperty("start")
    @JsonDeserialize(using = DurationDeserializer.class)
    @JsonSerialize(using = DurationSerializer.class)
    private Duration start = Duration.ofSeconds(MIN_SECONDS);

    @NotNull
    @JsonProperty("end")
    @JsonDeserialize(using = DurationDeserializer.class)
    @JsonSerialize(using = DurationSerializer.class)
    private Duration end = Duration.ofSeconds(MAX_SECONDS);

    public TimeWindow(Duration start, Duration end) {
        this.start = start;
        this.end = end;
    }

    public long startSeconds() {
        return start.getSeconds();
    }

    public long endSeconds() {
        return end.getSeconds();
    }

    @JsonIgnore
    public boolean isValid() {
        return startSeconds() <= endSeconds();
    }

    @JsonIgnore
    public boolean isBounded() {
        return isValid() && (startSeconds() > MIN_SECONDS || endSeconds() < MAX_SECONDS);
    }

    /* True when this window closes strictly before the other one opens. */
    public boolean strictlyPrecedes(TimeWindow other) {
        return other != null && isBounded() && other.isBounded() && endSeconds() < other.startSeconds();
    }
}
