package com.wingz.api.ride.service.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventStatsResponse {
    private long totalEvents;

    @JsonProperty("events_last_24_hours")
    private long eventsLastDay;

    @JsonProperty("events_last_7_days")
    private long eventsLastWeek;

    private List<EventTypeCountResponse> topEventTypes;
}
