package com.drivenow.mobility.rentalservice.service;

import com.drivenow.mobility.rentalservice.dto.ImageUploadResponse;
import com.drivenow.mobility.rentalservice.dto.VehicleRequest;
import com.drivenow.mobility.rentalservice.dto.VehicleResponse;
import com.drivenow.mobility.rentalservice.entity.Vehicle;
import com.drivenow.mobility.rentalservice.exception.ReservationValidationException;
import com.drivenow.mobility.rentalservice.exception.VehicleNotFoundException;
import com.drivenow.mobility.rentalservice.repository.VehicleRepository;
import com.drivenow.mobility.rentalservice.storage.VehicleImageStorage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class VehicleService {

    private final VehicleRepository repository;
    private final VehicleImageStorage imageStorage;

    @Transactional(readOnly = true)
    public List<VehicleResponse> listAvailable() {
        return repository.findByAvailableTrueOrderByCreatedAtDesc().stream()
                .map(VehicleService::toResponse)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<VehicleResponse> listAll() {
        return repository.findAllByOrderByCreatedAtDesc().stream()
                .map(VehicleService::toResponse)
                .toList();
    }

    @Transactional
    public VehicleResponse create(VehicleRequest request) {
        Vehicle vehicle = Vehicle.builder()
                .name(request.name())
                .type(request.type())
                .brand(request.brand())
                .model(request.model())
                .year(request.year())
                .pricePerDay(request.pricePerDay())
                .capacity(request.capacity())
                .description(request.description())
                .available(true)
                .build();

        Vehicle saved = repository.save(vehicle);
        log.info("Created vehicle {} ({} {}, {}/day)", saved.getId(), saved.getBrand(), saved.getModel(),
                saved.getPricePerDay());
        return toResponse(saved);
    }

    /**
     * Enables or disables booking of a vehicle. Existing reservations are kept.
     */
    @Transactional
    public VehicleResponse setAvailability(UUID vehicleId, boolean available) {
        Vehicle vehicle = findVehicleOrThrow(vehicleId);
        vehicle.setAvailable(available);
        Vehicle saved = repository.save(vehicle);
        log.info("Vehicle {} is now {}", vehicleId, available ? "available" : "unavailable");
        return toResponse(saved);
    }

    @Transactional
    public void delete(UUID vehicleId) {
        Vehicle vehicle = findVehicleOrThrow(vehicleId);
        repository.delete(vehicle);
        log.info("Deleted vehicle {}", vehicleId);
    }

    @Transactional
    public ImageUploadResponse uploadImage(UUID vehicleId, MultipartFile file) {
        Vehicle vehicle = findVehicleOrThrow(vehicleId);

        String contentType = file.getContentType();
        if (contentType == null || !contentType.startsWith("image/")) {
            throw new ReservationValidationException("File must be an image");
        }

        String imageUrl = imageStorage.store(vehicleId, file);
        vehicle.setImageUrl(imageUrl);
        repository.save(vehicle);
        return new ImageUploadResponse("Image uploaded successfully", imageUrl);
    }

    private Vehicle findVehicleOrThrow(UUID vehicleId) {
        return repository.findById(vehicleId)
                .orElseThrow(() -> new VehicleNotFoundException("Vehicle not found with id: " + vehicleId));
    }

    static VehicleResponse toResponse(Vehicle vehicle) {
        return new VehicleResponse(
                vehicle.getId(),
                vehicle.getName(),
                vehicle.getType(),
                vehicle.getBrand(),
                vehicle.getModel(),
                vehicle.getYear(),
                vehicle.getPricePerDay(),
                vehicle.getCapacity(),
                vehicle.getImageUrl(),
                vehicle.getDescription(),
                vehicle.isAvailable(),
                vehicle.getCreatedAt()
        );
    }
}
