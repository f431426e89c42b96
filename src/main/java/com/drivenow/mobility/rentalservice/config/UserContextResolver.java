package com.drivenow.mobility.rentalservice.config;

import com.drivenow.mobility.rentalservice.exception.UnauthorizedException;
import com.drivenow.mobility.rentalservice.model.Role;
import org.springframework.core.MethodParameter;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

import java.util.UUID;

public class UserContextResolver implements HandlerMethodArgumentResolver {

    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String USER_ROLE_HEADER = "X-User-Role";

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return UserContext.class.equals(parameter.getParameterType());
    }

    @Override
    public UserContext resolveArgument(MethodParameter parameter, ModelAndViewContainer mavContainer,
                                       NativeWebRequest webRequest, WebDataBinderFactory binderFactory) {
        String userId = webRequest.getHeader(USER_ID_HEADER);
        String role = webRequest.getHeader(USER_ROLE_HEADER);

        if (userId == null || userId.isBlank() || role == null || role.isBlank()) {
            throw new UnauthorizedException("Missing authentication headers");
        }

        try {
            return new UserContext(UUID.fromString(userId.trim()), Role.valueOf(role.trim().toUpperCase()));
        } catch (IllegalArgumentException e) {
            throw new UnauthorizedException("Invalid authentication headers");
        }
    }
}
