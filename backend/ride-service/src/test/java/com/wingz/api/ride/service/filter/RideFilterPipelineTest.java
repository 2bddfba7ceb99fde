package com.wingz.api.ride.service.filter;

import com.wingz.api.shared.entities.Ride;
import org.junit.jupiter.api.Test;
import org.springframework.data.domain.Sort;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RideFilterPipelineTest {

    private final RideFilterPipeline pipeline = new RideFilterPipeline();

    @Test
    void noParametersMeansNoClauses() {
        FilterPlan<Ride> plan = pipeline.build(Map.of());

        assertTrue(plan.getClauses().isEmpty());
        assertEquals(Sort.Direction.DESC, plan.getSort().getOrderFor("pickupTime").getDirection());
        assertNotNull(plan.getSort().getOrderFor("id"));
    }

    @Test
    void everyRecognisedParameterAddsOneClause() {
        FilterPlan<Ride> plan = pipeline.build(Map.of(
                "status", "completed",
                "rider_id", "4",
                "driver_id", "7",
                "start_date", "2025-01-01T00:00:00Z",
                "end_date", "2025-01-31",
                "search", "ann"));

        assertEquals(List.of("status", "rider_id", "driver_id", "start_date", "end_date", "search"),
                plan.describe());
    }

    @Test
    void unparseableValuesAreDropped() {
        FilterPlan<Ride> plan = pipeline.build(Map.of(
                "rider_id", "abc",
                "start_date", "not-a-date",
                "end_date", "2025-02-30T99:00",
                "search", "   "));

        assertTrue(plan.getClauses().isEmpty());
    }

    @Test
    void unknownStatusStillConstrains() {
        assertTrue(pipeline.build(Map.of("status", "active")).hasClause("status"));
    }

    @Test
    void orderingIsHonoured() {
        FilterPlan<Ride> plan = pipeline.build(Map.of("ordering", "status,-created_at"));

        assertEquals(Sort.Direction.ASC, plan.getSort().getOrderFor("status").getDirection());
        assertEquals(Sort.Direction.DESC, plan.getSort().getOrderFor("createdAt").getDirection());
        assertNull(plan.getSort().getOrderFor("pickupTime"));
    }
}
