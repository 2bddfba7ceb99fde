package com.wingz.api.ride.service.access;

import com.wingz.api.shared.constants.AccessMode;

/**
 * Allow-table of every gated operation: which resource group's policy applies and
 * whether the operation reads or writes.
 */
public enum ApiOperation {
    LIST_RIDES(ResourceGroup.RIDES, AccessMode.READ),
    GET_RIDE(ResourceGroup.RIDES, AccessMode.READ),
    CREATE_RIDE(ResourceGroup.RIDES, AccessMode.WRITE),
    UPDATE_RIDE(ResourceGroup.RIDES, AccessMode.WRITE),
    DELETE_RIDE(ResourceGroup.RIDES, AccessMode.WRITE),
    NEARBY_RIDES(ResourceGroup.RIDES, AccessMode.READ),
    RIDE_EVENTS(ResourceGroup.RIDES, AccessMode.READ),
    RIDE_STATS(ResourceGroup.RIDES, AccessMode.READ),
    ACTIVE_RIDES(ResourceGroup.RIDES, AccessMode.READ),

    LIST_EVENTS(ResourceGroup.RIDE_EVENTS, AccessMode.READ),
    GET_EVENT(ResourceGroup.RIDE_EVENTS, AccessMode.READ),
    CREATE_EVENT(ResourceGroup.RIDE_EVENTS, AccessMode.WRITE),
    UPDATE_EVENT(ResourceGroup.RIDE_EVENTS, AccessMode.WRITE),
    DELETE_EVENT(ResourceGroup.RIDE_EVENTS, AccessMode.WRITE),
    TODAYS_EVENTS(ResourceGroup.RIDE_EVENTS, AccessMode.READ),
    EVENT_TYPES(ResourceGroup.RIDE_EVENTS, AccessMode.READ),
    EVENT_STATS(ResourceGroup.RIDE_EVENTS, AccessMode.READ),

    LIST_USERS(ResourceGroup.USERS, AccessMode.READ),
    GET_USER(ResourceGroup.USERS, AccessMode.READ),
    CREATE_USER(ResourceGroup.USERS, AccessMode.WRITE),
    UPDATE_USER(ResourceGroup.USERS, AccessMode.WRITE),
    DEACTIVATE_USER(ResourceGroup.USERS, AccessMode.WRITE),
    ACTIVATE_USER(ResourceGroup.USERS, AccessMode.WRITE),
    USER_RIDES(ResourceGroup.USERS, AccessMode.READ),
    USER_STATS(ResourceGroup.USERS, AccessMode.READ),
    LIST_DRIVERS(ResourceGroup.USERS, AccessMode.READ),
    LIST_RIDERS(ResourceGroup.USERS, AccessMode.READ),

    CHECK_ROLE(ResourceGroup.ACCOUNT, AccessMode.READ),
    TEST_ADMIN(ResourceGroup.ADMIN, AccessMode.READ);

    private final ResourceGroup group;
    private final AccessMode mode;

    ApiOperation(ResourceGroup group, AccessMode mode) {
        this.group = group;
        this.mode = mode;
    }

    public ResourceGroup getGroup() {
        return group;
    }

    public AccessMode getMode() {
        return mode;
    }
}
