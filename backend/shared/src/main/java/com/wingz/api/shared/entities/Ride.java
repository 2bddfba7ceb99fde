package com.wingz.api.shared.entities;

import com.wingz.api.shared.constants.RideStatus;
import com.wingz.api.shared.geo.GeoPoint;
import com.wingz.api.shared.geo.HaversineDistance;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.ZonedDateTime;

@Entity
@Table(name = "rides", indexes = {
        @Index(name = "idx_rides_status", columnList = "status"),
        @Index(name = "idx_rides_pickup_time", columnList = "pickup_time"),
        @Index(name = "idx_rides_rider", columnList = "id_rider"),
        @Index(name = "idx_rides_driver", columnList = "id_driver")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Ride {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id_ride")
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private RideStatus status;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "id_rider", nullable = false)
    private User rider;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "id_driver", nullable = false)
    private User driver;

    @Column(name = "pickup_latitude", nullable = false)
    private Double pickupLatitude;

    @Column(name = "pickup_longitude", nullable = false)
    private Double pickupLongitude;

    @Column(name = "dropoff_latitude", nullable = false)
    private Double dropoffLatitude;

    @Column(name = "dropoff_longitude", nullable = false)
    private Double dropoffLongitude;

    @Column(name = "pickup_time", nullable = false)
    private ZonedDateTime pickupTime;

    @Column(name = "created_at", nullable = false, updatable = false)
    private ZonedDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private ZonedDateTime updatedAt;

    public GeoPoint getPickupPoint() {
        return GeoPoint.of(pickupLatitude, pickupLongitude);
    }

    public GeoPoint getDropoffPoint() {
        return GeoPoint.of(dropoffLatitude, dropoffLongitude);
    }

    // Business logic
    public double distanceFrom(GeoPoint point) {
        return HaversineDistance.kilometers(point, getPickupPoint());
    }
}
