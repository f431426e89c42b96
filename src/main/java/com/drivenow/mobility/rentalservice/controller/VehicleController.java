package com.drivenow.mobility.rentalservice.controller;

import com.drivenow.mobility.rentalservice.config.RequireRole;
import com.drivenow.mobility.rentalservice.dto.AvailabilityResponse;
import com.drivenow.mobility.rentalservice.dto.ImageUploadResponse;
import com.drivenow.mobility.rentalservice.dto.VehicleAvailabilityRequest;
import com.drivenow.mobility.rentalservice.dto.VehicleRequest;
import com.drivenow.mobility.rentalservice.dto.VehicleResponse;
import com.drivenow.mobility.rentalservice.model.DateInterval;
import com.drivenow.mobility.rentalservice.service.AvailabilityService;
import com.drivenow.mobility.rentalservice.service.VehicleService;
import com.drivenow.mobility.rentalservice.util.CalendarDates;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;
import java.util.UUID;


@RestController
@RequestMapping("/api/vehicles")
@RequiredArgsConstructor
public class VehicleController {

    private final VehicleService vehicleService;
    private final AvailabilityService availabilityService;

    @Operation(summary = "Lists vehicles open for booking")
    @GetMapping
    public List<VehicleResponse> listAvailable() {
        return vehicleService.listAvailable();
    }

    @Operation(summary = "Lists the whole fleet, including vehicles closed for booking")
    @GetMapping("/all")
    @RequireRole("ADMIN")
    public List<VehicleResponse> listAll() {
        return vehicleService.listAll();
    }

    @Operation(summary = "Adds a vehicle to the fleet")
    @PostMapping
    @RequireRole("ADMIN")
    @ResponseStatus(HttpStatus.CREATED)
    public VehicleResponse create(@Valid @RequestBody VehicleRequest request) {
        return vehicleService.create(request);
    }

    @Operation(summary = "Opens or closes a vehicle for booking")
    @PatchMapping("/{id}/availability")
    @RequireRole("ADMIN")
    public VehicleResponse setAvailability(@PathVariable UUID id,
                                           @Valid @RequestBody VehicleAvailabilityRequest request) {
        return vehicleService.setAvailability(id, request.available());
    }

    @Operation(summary = "Removes a vehicle from the fleet")
    @DeleteMapping("/{id}")
    @RequireRole("ADMIN")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable UUID id) {
        vehicleService.delete(id);
    }

    @Operation(summary = "Uploads the vehicle picture")
    @PostMapping(value = "/{id}/upload-image", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @RequireRole("ADMIN")
    public ImageUploadResponse uploadImage(@PathVariable UUID id, @RequestParam("file") MultipartFile file) {
        return vehicleService.uploadImage(id, file);
    }

    @Operation(
            summary = "Checks whether a vehicle is free for a date range",
            description = "Advisory only: the booking re-checks the calendar and may still fail with 409."
    )
    @GetMapping("/{id}/availability")
    public AvailabilityResponse checkAvailability(
            @PathVariable UUID id,
            @Parameter(description = "ISO date or timestamp", example = "2026-03-10")
            @RequestParam("start_date") String startDate,
            @Parameter(description = "ISO date or timestamp, inclusive", example = "2026-03-13")
            @RequestParam("end_date") String endDate
    ) {
        DateInterval interval = DateInterval.of(CalendarDates.parse(startDate), CalendarDates.parse(endDate));
        return new AvailabilityResponse(availabilityService.isAvailable(id, interval));
    }
}
