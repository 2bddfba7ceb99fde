package com.wingz.api.ride.service.filter;

import com.wingz.api.shared.entities.User;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class UserFilterPipelineTest {

    private final UserFilterPipeline pipeline = new UserFilterPipeline();

    @Test
    void filterableRolesConstrain() {
        assertTrue(pipeline.build(Map.of("role", "driver")).hasClause("role"));
        assertTrue(pipeline.build(Map.of("role", "admin")).hasClause("role"));
    }

    @Test
    void dispatcherRoleFilterIsDropped() {
        assertFalse(pipeline.build(Map.of("role", "dispatcher")).hasClause("role"));
        assertFalse(pipeline.build(Map.of("role", "pilot")).hasClause("role"));
    }

    @Test
    void isActiveAndSearchAreApplied() {
        FilterPlan<User> plan = pipeline.build(Map.of("is_active", "no", "search", "555"));

        assertEquals(List.of("is_active", "search"), plan.describe());
    }

    @Test
    void defaultOrderIsNewestJoinedFirst() {
        FilterPlan<User> plan = pipeline.build(Map.of());

        assertTrue(plan.getSort().getOrderFor("dateJoined").isDescending());
    }
}
