package com.wingz.api.ride.service.access;

import com.wingz.api.ride.service.config.WingzProperties;
import com.wingz.api.shared.access.AccessDecision;
import com.wingz.api.shared.access.AccessPolicy;
import com.wingz.api.shared.access.CallerIdentity;
import com.wingz.api.shared.exception.ForbiddenException;
import com.wingz.api.shared.exception.UnauthenticatedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class AccessGate {

    private final WingzProperties properties;

    public AccessDecision decide(CallerIdentity caller, ApiOperation operation) {
        AccessPolicy policy = properties.getAccess().policyFor(operation.getGroup());
        return policy.authorize(caller, operation.getMode());
    }

    /**
     * Returns the caller when allowed, otherwise throws the matching error kind.
     */
    public CallerIdentity require(CallerIdentity caller, ApiOperation operation) {
        AccessDecision decision = decide(caller, operation);
        if (decision == AccessDecision.UNAUTHENTICATED) {
            log.debug("Rejected unauthenticated call to {}", operation);
            throw new UnauthenticatedException();
        }
        if (decision == AccessDecision.FORBIDDEN) {
            log.warn("Denied {} to user {} with role {}", operation, caller.getUserId(), caller.getRole());
            throw new ForbiddenException();
        }
        return caller;
    }
}
