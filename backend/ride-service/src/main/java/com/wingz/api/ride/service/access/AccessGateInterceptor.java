package com.wingz.api.ride.service.access;

import com.wingz.api.shared.access.CallerIdentity;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Evaluates the access gate before any handler code runs, so a denied caller never learns
 * whether the requested resource exists.
 */
@Component
@RequiredArgsConstructor
public class AccessGateInterceptor implements HandlerInterceptor {

    public static final String CALLER_ATTRIBUTE = "wingz.caller";

    private final CallerResolver callerResolver;
    private final AccessGate accessGate;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!(handler instanceof HandlerMethod)) {
            return true;
        }
        Gated gated = ((HandlerMethod) handler).getMethodAnnotation(Gated.class);
        if (gated == null) {
            return true;
        }

        CallerIdentity caller = callerResolver.resolve(request).orElse(null);
        request.setAttribute(CALLER_ATTRIBUTE, accessGate.require(caller, gated.value()));
        return true;
    }
}
