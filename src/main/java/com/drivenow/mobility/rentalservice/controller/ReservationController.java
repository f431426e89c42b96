package com.drivenow.mobility.rentalservice.controller;

import com.drivenow.mobility.rentalservice.config.RequireRole;
import com.drivenow.mobility.rentalservice.config.UserContext;
import com.drivenow.mobility.rentalservice.dto.CreateReservationRequest;
import com.drivenow.mobility.rentalservice.dto.ReservationResponse;
import com.drivenow.mobility.rentalservice.dto.StatusUpdateResponse;
import com.drivenow.mobility.rentalservice.dto.UpdateReservationStatusRequest;
import com.drivenow.mobility.rentalservice.service.ReservationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;


@RestController
@RequestMapping("/api/bookings")
@RequiredArgsConstructor
public class ReservationController {

    private final ReservationService service;

    @Operation(
            summary = "Books a vehicle for a date range",
            description = """
            Reserves a vehicle for the inclusive range [startDate, endDate]:
            - The vehicle must exist and be available for booking
            - No confirmed or active reservation of the vehicle may share a day with the range
            - Days are counted as the calendar-day difference, at least 1
            - The amount is days times the vehicle rate at booking time and never changes afterwards

            The reservation starts as pending with payment pending.
            """
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "201",
                    description = "Reservation created in pending status",
                    content = @Content(
                            mediaType = "application/json",
                            schema = @Schema(implementation = ReservationResponse.class),
                            examples = @ExampleObject(value = """
                    {
                      "id": "9b2f3c1e-8a47-4d5e-b1f0-2c6e7d8a9b10",
                      "vehicleId": "3f1c2a8e-5b7d-4c0e-9a31-6d2f8b4e1c55",
                      "startDate": "2026-03-10",
                      "endDate": "2026-03-13",
                      "totalDays": 3,
                      "totalAmount": 450.00,
                      "status": "pending",
                      "paymentStatus": "pending"
                    }
                    """
                            )
                    )
            ),
            @ApiResponse(
                    responseCode = "400",
                    description = "Missing field, malformed date or end date before start date",
                    content = @Content(mediaType = "application/problem+json")
            ),
            @ApiResponse(
                    responseCode = "404",
                    description = "Vehicle not found or not available for booking",
                    content = @Content(mediaType = "application/problem+json")
            ),
            @ApiResponse(
                    responseCode = "409",
                    description = "Vehicle already booked during that period",
                    content = @Content(mediaType = "application/problem+json")
            )
    })
    @PostMapping
    @RequireRole({"CUSTOMER", "ADMIN"})
    @ResponseStatus(HttpStatus.CREATED)
    public ReservationResponse createReservation(
            @Valid
            @RequestBody
            @Parameter(description = "Vehicle and inclusive date range", required = true)
            CreateReservationRequest request,
            @Parameter(hidden = true) UserContext userContext
    ) {
        return service.createReservation(request, userContext);
    }

    @Operation(summary = "Lists the caller's own reservations, newest first")
    @GetMapping
    public List<ReservationResponse> getMyReservations(@Parameter(hidden = true) UserContext userContext) {
        return service.getMyReservations(userContext);
    }

    @Operation(summary = "Lists all reservations, newest first")
    @GetMapping("/all")
    @RequireRole("ADMIN")
    public List<ReservationResponse> getAllReservations(@Parameter(hidden = true) UserContext userContext) {
        return service.getAllReservations(userContext);
    }

    @Operation(summary = "Gets a reservation owned by the caller, or any reservation for an admin")
    @GetMapping("/{id}")
    public ReservationResponse getById(@PathVariable UUID id, @Parameter(hidden = true) UserContext userContext) {
        return service.getById(id, userContext);
    }

    @Operation(
            summary = "Moves a reservation through its lifecycle",
            description = """
            pending -> confirmed | cancelled, confirmed -> active | cancelled, active -> completed | cancelled.
            Payment: pending -> paid | failed, paid -> refunded. Re-applying the current value is accepted.
            Confirming re-checks the vehicle calendar and fails with 409 on overlap.
            """
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Status updated"),
            @ApiResponse(responseCode = "400", description = "Illegal transition",
                    content = @Content(mediaType = "application/problem+json")),
            @ApiResponse(responseCode = "404", description = "Reservation not found",
                    content = @Content(mediaType = "application/problem+json")),
            @ApiResponse(responseCode = "409", description = "Overlaps a confirmed or active reservation",
                    content = @Content(mediaType = "application/problem+json"))
    })
    @PutMapping("/{id}/status")
    @RequireRole("ADMIN")
    public StatusUpdateResponse updateStatus(
            @PathVariable UUID id,
            @Valid @RequestBody UpdateReservationStatusRequest request,
            @Parameter(hidden = true) UserContext userContext
    ) {
        return service.updateStatus(id, request, userContext);
    }
}
