package com.drivenow.mobility.rentalservice;


import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;


@SpringBootApplication
public class VehicleRentalServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(VehicleRentalServiceApplication.class, args);
    }
}
