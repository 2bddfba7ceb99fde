package com.wingz.api.ride.service.filter;

import com.wingz.api.shared.entities.RideEvent;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;
import org.springframework.data.domain.Sort;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(OutputCaptureExtension.class)
class RideEventFilterPipelineTest {

    private final RideEventFilterPipeline pipeline = new RideEventFilterPipeline();

    @Test
    void defaultOrderIsNewestFirst() {
        FilterPlan<RideEvent> plan = pipeline.build(Map.of());

        assertTrue(plan.getClauses().isEmpty());
        assertEquals(Sort.Direction.DESC, plan.getSort().getOrderFor("createdAt").getDirection());
    }

    @Test
    void everyRecognisedParameterAddsOneClause() {
        FilterPlan<RideEvent> plan = pipeline.build(Map.of(
                "ride_id", "12",
                "event_type", "Pickup",
                "start_date", "2025-03-01",
                "end_date", "2025-03-14T12:00:00Z",
                "search", "arrived"));

        assertEquals(List.of("ride_id", "event_type", "start_date", "end_date", "search"), plan.describe());
    }

    @Test
    void malformedDatesAreDroppedAndLogged(CapturedOutput output) {
        FilterPlan<RideEvent> plan = pipeline.build(Map.of(
                "start_date", "yesterday",
                "end_date", "2025-13-40"));

        assertTrue(plan.getClauses().isEmpty());
        assertTrue(output.getOut().contains("Ignoring unparseable start_date: yesterday"));
        assertTrue(output.getOut().contains("Ignoring unparseable end_date: 2025-13-40"));
    }

    @Test
    void unknownEventTypeIsDropped() {
        assertFalse(pipeline.build(Map.of("event_type", "midway")).hasClause("event_type"));
    }
}
