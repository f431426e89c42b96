package com.drivenow.mobility.rentalservice.model;

public enum Role {
    ADMIN,
    CUSTOMER
}
