package com.wingz.api.ride.service.repository;

import com.wingz.api.shared.constants.UserRole;
import com.wingz.api.shared.entities.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface UserRepository extends JpaRepository<User, Long>, JpaSpecificationExecutor<User> {
    Optional<User> findByEmail(String email);
    boolean existsByEmail(String email);
    List<User> findByRoleAndActiveTrueOrderByDateJoinedDescIdDesc(UserRole role);
    long countByActiveTrue();
    long countByRoleAndActiveTrue(UserRole role);
}
