package com.carrental.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.*;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Set;

/**
 * Stores profile pictures and vehicle images under the upload directory and hands back the public
 * {@code /uploads/...} path served by {@link com.carrental.config.WebMvcConfig}.
 */
@Service
public class FileUploadService {

    private static final Logger logger = LoggerFactory.getLogger(FileUploadService.class);

    static final Set<String> ALLOWED_EXTENSIONS = Set.of(".jpg", ".jpeg", ".png", ".gif", ".webp");
    static final long MAX_PROFILE_BYTES = 5L * 1024 * 1024;
    static final long MAX_VEHICLE_BYTES = 10L * 1024 * 1024;

    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");
    private static final String PUBLIC_PREFIX = "/uploads/";

    private final Path uploadDir;
    private final Clock clock;

    public FileUploadService(@Value("${file.upload-dir}") String uploadDirProp, Clock clock) throws IOException {
        this.uploadDir = Paths.get(uploadDirProp).toAbsolutePath().normalize();
        this.clock = clock;
        Files.createDirectories(this.uploadDir.resolve("profiles"));
        Files.createDirectories(this.uploadDir.resolve("vehicles"));
    }

    public String uploadProfilePicture(MultipartFile file, Long userId) throws IOException {
        String ext = checkImage(file, MAX_PROFILE_BYTES, "5MB");
        String name = userId + "_" + LocalDateTime.now(clock).format(STAMP) + ext;
        return store(file, "profiles", name);
    }

    public String uploadVehicleImage(MultipartFile file, Long carId) throws IOException {
        String ext = checkImage(file, MAX_VEHICLE_BYTES, "10MB");
        String name = "vehicle_" + carId + "_" + LocalDateTime.now(clock).format(STAMP) + ext;
        return store(file, "vehicles", name);
    }

    /** Deletes a previously stored file by its public path. Returns false if there was nothing to delete. */
    public boolean deleteFile(String publicPath) throws IOException {
        if (publicPath == null || !publicPath.startsWith(PUBLIC_PREFIX)) return false;
        Path target = resolve(publicPath);
        if (!target.startsWith(uploadDir)) {
            throw new IllegalArgumentException("Invalid file path.");
        }
        return Files.deleteIfExists(target);
    }

    Path resolve(String publicPath) {
        return uploadDir.resolve(publicPath.substring(PUBLIC_PREFIX.length())).normalize();
    }

    private String checkImage(MultipartFile file, long maxBytes, String maxLabel) {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("No file provided.");
        }
        if (file.getSize() > maxBytes) {
            throw new IllegalArgumentException("File size must not exceed " + maxLabel + ".");
        }
        String original = StringUtils.cleanPath(file.getOriginalFilename() == null ? "" : file.getOriginalFilename());
        String ext = extractExtension(original);
        if (!ALLOWED_EXTENSIONS.contains(ext)) {
            throw new IllegalArgumentException("Only image files (jpg, jpeg, png, gif, webp) are allowed.");
        }
        return ext;
    }

    private String store(MultipartFile file, String folder, String fileName) throws IOException {
        Path target = uploadDir.resolve(folder).resolve(fileName);
        try (InputStream in = file.getInputStream()) {
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
        }
        logger.info("Stored upload {}", target);
        return PUBLIC_PREFIX + folder + "/" + fileName;
    }

    private static String extractExtension(String filename) {
        int dot = filename.lastIndexOf('.');
        return (dot >= 0 && dot < filename.length() - 1) ? filename.substring(dot).toLowerCase(Locale.ROOT) : "";
    }
}
