package com.wingz.api.ride.service.access;

import com.wingz.api.ride.service.config.WingzProperties;
import com.wingz.api.ride.service.repository.UserRepository;
import com.wingz.api.shared.access.CallerIdentity;
import com.wingz.api.shared.entities.User;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Turns the identity header set by the authenticating edge into a caller. Unknown and
 * deactivated users are treated as not authenticated.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CallerResolver {

    private final UserRepository userRepository;
    private final WingzProperties properties;

    public Optional<CallerIdentity> resolve(HttpServletRequest request) {
        String header = request.getHeader(properties.getAccess().getCallerHeader());
        if (header == null || header.isBlank()) {
            return Optional.empty();
        }

        long userId;
        try {
            userId = Long.parseLong(header.trim());
        } catch (NumberFormatException e) {
            log.debug("Ignoring malformed caller header: {}", header);
            return Optional.empty();
        }

        return userRepository.findById(userId)
                .filter(User::isActive)
                .map(user -> new CallerIdentity(user.getId(), user.getEmail(), user.getRole()));
    }
}
