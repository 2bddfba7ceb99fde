package com.wingz.api.ride.service.repository;

import com.wingz.api.shared.entities.RideEvent;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.ZonedDateTime;
import java.util.Collection;
import java.util.List;

@Repository
public interface RideEventRepository extends JpaRepository<RideEvent, Long>, JpaSpecificationExecutor<RideEvent> {

    @Query("SELECT e FROM RideEvent e WHERE e.ride.id = :rideId ORDER BY e.createdAt DESC, e.id DESC")
    List<RideEvent> findByRideId(@Param("rideId") Long rideId);

    @Query("SELECT e FROM RideEvent e WHERE e.ride.id = :rideId AND e.createdAt >= :cutoff ORDER BY e.createdAt DESC, e.id DESC")
    List<RideEvent> findByRideIdCreatedSince(@Param("rideId") Long rideId, @Param("cutoff") ZonedDateTime cutoff);

    @Query("SELECT e FROM RideEvent e WHERE e.createdAt >= :cutoff")
    Page<RideEvent> findCreatedSince(@Param("cutoff") ZonedDateTime cutoff, Pageable pageable);

    @Query("SELECT e.ride.id, COUNT(e) FROM RideEvent e WHERE e.ride.id IN :rideIds AND e.createdAt >= :cutoff GROUP BY e.ride.id")
    List<Object[]> countCreatedSinceGroupedByRide(@Param("rideIds") Collection<Long> rideIds,
                                                  @Param("cutoff") ZonedDateTime cutoff);

    long countByCreatedAtGreaterThanEqual(ZonedDateTime cutoff);

    @Query("SELECT e.description, COUNT(e) FROM RideEvent e GROUP BY e.description")
    List<Object[]> countGroupedByDescription();

    @Modifying
    @Query("DELETE FROM RideEvent e WHERE e.ride.id = :rideId")
    int deleteByRideId(@Param("rideId") Long rideId);
}
