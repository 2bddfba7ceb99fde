package com.wingz.api.ride.service.config;

import com.wingz.api.ride.service.access.ResourceGroup;
import com.wingz.api.shared.access.AccessPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "wingz")
public class WingzProperties {

    private Access access = new Access();
    private Query query = new Query();
    private Seed seed = new Seed();

    @Data
    public static class Access {
        /**
         * Header carrying the id of the caller authenticated upstream.
         */
        private String callerHeader = "X-Caller-Id";
        private AccessPolicy users = AccessPolicy.ADMIN_ONLY;
        private AccessPolicy rides = AccessPolicy.ADMIN_ONLY;
        private AccessPolicy rideEvents = AccessPolicy.ADMIN_ONLY;

        public AccessPolicy policyFor(ResourceGroup group) {
            return switch (group) {
                case USERS -> users;
                case RIDES -> rides;
                case RIDE_EVENTS -> rideEvents;
                case ACCOUNT -> AccessPolicy.ADMIN_WRITE_READ_ANY;
                case ADMIN -> AccessPolicy.ADMIN_ONLY;
            };
        }
    }

    @Data
    public static class Query {
        private double defaultRadiusKm = 10.0;
        private long windowHours = 24;
        private int statsWindowDays = 7;
        private int topEventTypes = 10;
        private int defaultPageSize = 20;
        private int maxPageSize = 100;
    }

    @Data
    public static class Seed {
        private boolean enabled = false;
    }
}
