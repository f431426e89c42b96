package com.drivenow.mobility.rentalservice.storage;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.UUID;

@Slf4j
@Component
public class FileSystemVehicleImageStorage implements VehicleImageStorage {

    public static final String URL_PREFIX = "/uploads/";

    private final Path root;

    public FileSystemVehicleImageStorage(@Value("${rental.uploads.dir:uploads}") String uploadsDir) {
        this.root = Path.of(uploadsDir).toAbsolutePath().normalize();
    }

    @Override
    public String store(UUID vehicleId, MultipartFile file) {
        String extension = StringUtils.getFilenameExtension(file.getOriginalFilename());
        String filename = vehicleId + "_" + UUID.randomUUID() + (extension != null ? "." + extension : "");

        try {
            Files.createDirectories(root);
            try (InputStream in = file.getInputStream()) {
                Files.copy(in, root.resolve(filename), StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to store image for vehicle " + vehicleId, e);
        }

        log.info("Stored image {} ({} bytes) for vehicle {}", filename, file.getSize(), vehicleId);
        return URL_PREFIX + filename;
    }
}
