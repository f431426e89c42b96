package com.drivenow.mobility.rentalservice.entity;


import com.drivenow.mobility.rentalservice.model.VehicleType;
import jakarta.persistence.*;
import lombok.*;


import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;


@Entity
@Table(name = "vehicles")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Vehicle {
    @Id
    private UUID id;


    @Column(nullable = false)
    private String name;
    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private VehicleType type;
    private String brand;
    private String model;
    @Column(name = "model_year")
    private int year;
    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal pricePerDay;
    private int capacity;
    private String imageUrl;
    @Column(length = 2000)
    private String description;
    @Builder.Default
    private boolean available = true;
    private LocalDateTime createdAt;


    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        if (id == null) {
            id = UUID.randomUUID();
        }
    }
}
