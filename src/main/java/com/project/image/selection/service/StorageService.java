package com.project.image.selection.service;

import com.project.image.selection.exceptions.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.atomic.AtomicLong;

@Service
public class StorageService {
    private static final Logger log = LoggerFactory.getLogger(StorageService.class);
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");

    private final Path rootDir;
    // several results are written within the same millisecond
    private final AtomicLong sequence = new AtomicLong();

    public StorageService(@Value("${app.upload.dir:uploads}") String root) {
        this.rootDir = Paths.get(root).toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.rootDir);
            log.info("Using upload directory: {}", this.rootDir);
        } catch (IOException e) {
            throw new StorageException("Cannot create upload directory: " + rootDir, e);
        }
    }

    public record StoredFile(Path path, String filename, String relativeWebPath) {}

    public StoredFile store(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new StorageException("Empty upload");
        }
        String original = StringUtils.cleanPath(file.getOriginalFilename() == null ? "upload" : file.getOriginalFilename());
        String contentType = file.getContentType();
        if (contentType == null || !contentType.startsWith("image/")) {
            throw new StorageException("Only image uploads are allowed (received: " + contentType + ")");
        }
        String safeBase = original.replaceAll("[^a-zA-Z0-9._-]", "_");
        String filename = uniquePrefix() + "_" + safeBase;
        Path target = rootDir.resolve(filename);
        try {
            Files.copy(file.getInputStream(), target, StandardCopyOption.REPLACE_EXISTING);
            log.debug("Stored upload {} as {}", original, filename);
            return new StoredFile(target, filename, "uploads/" + filename);
        } catch (IOException e) {
            throw new StorageException("Failed to store file", e);
        }
    }

    /**
     * Stores a rendered PNG; {@code kind} ends up in the file name ({@code gray}, {@code mask}, ...).
     */
    public StoredFile storeResultImage(byte[] pngBytes, String kind) {
        String filename = uniquePrefix() + "_" + kind.replaceAll("[^a-zA-Z0-9-]", "_") + ".png";
        Path target = rootDir.resolve(filename);
        try {
            Files.write(target, pngBytes);
            return new StoredFile(target, filename, "uploads/" + filename);
        } catch (IOException e) {
            throw new StorageException("Failed to store result image", e);
        }
    }

    /** Looks up a previously stored file by the name {@link #store} or {@link #storeResultImage} returned. */
    public StoredFile load(String filename) {
        if (!StringUtils.hasText(filename)) {
            throw new StorageException("No stored image given");
        }
        Path target = rootDir.resolve(filename).normalize();
        if (!target.getParent().equals(rootDir)) {
            throw new StorageException("Invalid stored image name: " + filename);
        }
        if (!Files.isRegularFile(target)) {
            throw new StorageException("Stored image not found: " + filename);
        }
        return new StoredFile(target, target.getFileName().toString(), "uploads/" + target.getFileName());
    }

    private String uniquePrefix() {
        return TIMESTAMP.format(LocalDateTime.now()) + "_" + sequence.incrementAndGet();
    }
}
