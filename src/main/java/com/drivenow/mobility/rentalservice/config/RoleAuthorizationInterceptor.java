package com.drivenow.mobility.rentalservice.config;

import com.drivenow.mobility.rentalservice.exception.ForbiddenException;
import com.drivenow.mobility.rentalservice.exception.UnauthorizedException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

import java.util.Arrays;

@Slf4j
public class RoleAuthorizationInterceptor implements HandlerInterceptor {

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!(handler instanceof HandlerMethod handlerMethod)) {
            return true;
        }

        RequireRole requireRole = handlerMethod.getMethodAnnotation(RequireRole.class);
        if (requireRole == null) {
            return true;
        }

        String role = request.getHeader(UserContextResolver.USER_ROLE_HEADER);
        if (role == null || role.isBlank()) {
            throw new UnauthorizedException("Missing authentication headers");
        }

        boolean allowed = Arrays.stream(requireRole.value())
                .anyMatch(required -> required.equalsIgnoreCase(role.trim()));
        if (!allowed) {
            log.warn("Rejected {} {} for role {}", request.getMethod(), request.getRequestURI(), role);
            throw new ForbiddenException("Access denied for role " + role);
        }
        return true;
    }
}
