package com.wingz.api.shared.entities;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.ZonedDateTime;
import java.util.Locale;

@Entity
@Table(name = "ride_events", indexes = {
        @Index(name = "idx_ride_events_ride", columnList = "id_ride"),
        @Index(name = "idx_ride_events_created_at", columnList = "created_at")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RideEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id_ride_event")
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "id_ride", nullable = false)
    private Ride ride;

    @Column(nullable = false, length = 500)
    private String description;

    @Column(name = "created_at", nullable = false)
    private ZonedDateTime createdAt;

    public boolean isPickupEvent() {
        return mentions("pickup");
    }

    public boolean isDropoffEvent() {
        return mentions("dropoff");
    }

    private boolean mentions(String word) {
        return description != null && description.toLowerCase(Locale.ROOT).contains(word);
    }
}
