package com.drivenow.mobility.rentalservice.config;

import com.drivenow.mobility.rentalservice.model.Role;

import java.util.UUID;

/**
 * Caller identity as forwarded by the API gateway.
 */
public record UserContext(UUID userId, Role role) {

    public boolean isAdmin() {
        return role == Role.ADMIN;
    }
}
