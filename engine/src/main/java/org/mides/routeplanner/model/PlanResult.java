package org.mides.routeplanner.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
public class PlanResult {

    @JsonProperty("batch_id")
    private String batchId;

    @JsonProperty("routes")
    private List<Route> routes = new ArrayList<>();

    @JsonProperty("unscheduled_order_ids")
    private List<String> unscheduledOrderIds = new ArrayList<>();

    @JsonProperty("summary")
    private PlanSummary summary;
}
