package com.drivenow.mobility.rentalservice.service;

import com.drivenow.mobility.rentalservice.dto.ImageUploadResponse;
import com.drivenow.mobility.rentalservice.dto.VehicleRequest;
import com.drivenow.mobility.rentalservice.dto.VehicleResponse;
import com.drivenow.mobility.rentalservice.entity.Vehicle;
import com.drivenow.mobility.rentalservice.exception.ReservationValidationException;
import com.drivenow.mobility.rentalservice.exception.VehicleNotFoundException;
import com.drivenow.mobility.rentalservice.model.VehicleType;
import com.drivenow.mobility.rentalservice.repository.VehicleRepository;
import com.drivenow.mobility.rentalservice.storage.VehicleImageStorage;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockMultipartFile;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class VehicleServiceTest {

    private static final UUID VEHICLE_ID = UUID.randomUUID();

    @Mock
    private VehicleRepository repository;

    @Mock
    private VehicleImageStorage imageStorage;

    @InjectMocks
    private VehicleService service;

    @Test
    void should_createVehicleOpenForBooking() {
        when(repository.save(any(Vehicle.class))).thenAnswer(i -> i.getArgument(0));

        VehicleResponse resp = service.create(new VehicleRequest("Sprinter", VehicleType.VAN, "Mercedes",
                "Sprinter 316", 2022, new BigDecimal("120.50"), 9, "Nine seats"));

        assertThat(resp.available()).isTrue();
        assertThat(resp.type()).isEqualTo(VehicleType.VAN);
        assertThat(resp.pricePerDay()).isEqualByComparingTo("120.50");
        assertThat(resp.imageUrl()).isNull();
    }

    @Test
    void should_listOnlyAvailableVehicles() {
        when(repository.findByAvailableTrueOrderByCreatedAtDesc()).thenReturn(List.of(vehicle(true)));

        assertThat(service.listAvailable()).extracting(VehicleResponse::id).containsExactly(VEHICLE_ID);
        verify(repository, never()).findAllByOrderByCreatedAtDesc();
    }

    @Test
    void should_disableVehicle() {
        Vehicle vehicle = vehicle(true);
        when(repository.findById(VEHICLE_ID)).thenReturn(Optional.of(vehicle));
        when(repository.save(vehicle)).thenReturn(vehicle);

        VehicleResponse resp = service.setAvailability(VEHICLE_ID, false);

        assertThat(resp.available()).isFalse();
        assertThat(vehicle.isAvailable()).isFalse();
    }

    @Test
    void should_throwNotFound_when_deletingUnknownVehicle() {
        when(repository.findById(VEHICLE_ID)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.delete(VEHICLE_ID))
                .isInstanceOf(VehicleNotFoundException.class)
                .hasMessage("Vehicle not found with id: " + VEHICLE_ID);
        verify(repository, never()).delete(any());
    }

    @Test
    void should_storeImageAndRecordUrl() {
        Vehicle vehicle = vehicle(true);
        MockMultipartFile file = new MockMultipartFile("file", "front.png", "image/png", new byte[]{1, 2, 3});
        when(repository.findById(VEHICLE_ID)).thenReturn(Optional.of(vehicle));
        when(imageStorage.store(VEHICLE_ID, file)).thenReturn("/uploads/front.png");

        ImageUploadResponse resp = service.uploadImage(VEHICLE_ID, file);

        assertThat(resp.imageUrl()).isEqualTo("/uploads/front.png");
        assertThat(resp.message()).isEqualTo("Image uploaded successfully");
        assertThat(vehicle.getImageUrl()).isEqualTo("/uploads/front.png");
        verify(repository).save(vehicle);
    }

    @Test
    void should_rejectUpload_when_fileIsNotAnImage() {
        MockMultipartFile file = new MockMultipartFile("file", "notes.txt", "text/plain", "hello".getBytes());
        when(repository.findById(VEHICLE_ID)).thenReturn(Optional.of(vehicle(true)));

        assertThatThrownBy(() -> service.uploadImage(VEHICLE_ID, file))
                .isInstanceOf(ReservationValidationException.class)
                .hasMessage("File must be an image");
        verifyNoInteractions(imageStorage);
    }

    private static Vehicle vehicle(boolean available) {
        return Vehicle.builder()
                .id(VEHICLE_ID)
                .name("Corolla Hybrid")
                .type(VehicleType.CAR)
                .brand("Toyota")
                .model("Corolla")
                .year(2024)
                .capacity(5)
                .pricePerDay(new BigDecimal("150.00"))
                .available(available)
                .build();
    }
}
