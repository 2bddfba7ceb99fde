package com.wingz.api.ride.service.repository;

import com.wingz.api.shared.entities.Ride;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface RideRepository extends JpaRepository<Ride, Long>, JpaSpecificationExecutor<Ride> {

    @Override
    @EntityGraph(attributePaths = {"rider", "driver"})
    Page<Ride> findAll(Specification<Ride> spec, Pageable pageable);

    @Override
    @EntityGraph(attributePaths = {"rider", "driver"})
    List<Ride> findAll(Specification<Ride> spec, Sort sort);

    @EntityGraph(attributePaths = {"rider", "driver"})
    @Query("SELECT r FROM Ride r WHERE r.id = :id")
    Optional<Ride> findWithUsersById(@Param("id") Long id);

    @EntityGraph(attributePaths = {"rider", "driver"})
    @Query("SELECT r FROM Ride r WHERE r.rider.id = :userId OR r.driver.id = :userId ORDER BY r.createdAt DESC, r.id DESC")
    List<Ride> findByParticipant(@Param("userId") Long userId);

    @Query("SELECT r.status, COUNT(r) FROM Ride r GROUP BY r.status")
    List<Object[]> countGroupedByStatus();
}
