package org.mides.routeplanner.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.mides.routeplanner.converter.PriorityDeserializer;
import org.mides.routeplanner.converter.PrioritySerializer;

@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Order {

    @NotNull
    @JsonProperty("id")
    private String id;

    /* Absent when geocoding failed; such orders are never clustered. */
    @Valid
    @JsonProperty("coordinates")
    private Coordinate coordinates;

    @JsonProperty("address")
    private String address;

    @Valid
    @JsonProperty("time_window")
    private TimeWindow timeWindow = new TimeWindow();

    @JsonProperty("priority")
    @JsonSerialize(using = PrioritySerializer.class)
    @JsonDeserialize(using = PriorityDeserializer.class)
    private Priority priority = Priority.NORMAL;

    @JsonProperty("status")
    private OrderStatus status = OrderStatus.PENDING;

    @JsonProperty("parking_required")
    private boolean parkingRequired;

    @JsonProperty("route_id")
    private String routeId;

    @JsonProperty("route_sequence")
    private Integer routeSequence;

    public Order(String id, Coordinate coordinates) {
        this.id = id;
        this.coordinates = coordinates;
    }

    @JsonIgnore
    public boolean isRoutable() {
        return coordinates != null
            && coordinates.getLatitude() != null
            && coordinates.getLongitude() != null;
    }

    @JsonIgnore
    public TimeWindow effectiveTimeWindow() {
        return timeWindow != null ? timeWindow : new TimeWindow();
    }

    @JsonIgnore
    public Priority effectivePriority() {
        return priority != null ? priority : Priority.NORMAL;
    }
}
