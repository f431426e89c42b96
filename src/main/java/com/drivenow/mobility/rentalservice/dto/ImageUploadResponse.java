package com.drivenow.mobility.rentalservice.dto;

public record ImageUploadResponse(String message, String imageUrl) {}
