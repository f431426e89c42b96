package com.drivenow.mobility.rentalservice.controller;

import com.drivenow.mobility.rentalservice.config.RequireRole;
import com.drivenow.mobility.rentalservice.dto.DashboardStatsResponse;
import com.drivenow.mobility.rentalservice.service.DashboardService;
import io.swagger.v3.oas.annotations.Operation;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;


@RestController
@RequestMapping("/api/dashboard")
@RequiredArgsConstructor
public class DashboardController {

    private final DashboardService dashboardService;

    @Operation(summary = "Fleet and booking statistics; revenue counts paid bookings only")
    @GetMapping("/stats")
    @RequireRole("ADMIN")
    public DashboardStatsResponse getStats() {
        return dashboardService.getStats();
    }
}
