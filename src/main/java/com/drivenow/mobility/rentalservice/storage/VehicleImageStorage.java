package com.drivenow.mobility.rentalservice.storage;

import org.springframework.web.multipart.MultipartFile;

import java.util.UUID;

/**
 * Pass-through store for vehicle images.
 */
public interface VehicleImageStorage {

    /**
     * Stores the image and returns the URL path it is served under.
     */
    String store(UUID vehicleId, MultipartFile file);
}
