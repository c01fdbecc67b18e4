package com.project.image.selection.controller;

import com.project.image.selection.DTOs.SelectionResult;
import com.project.image.selection.exceptions.SelectionException;
import com.project.image.selection.floodfill.FillAlgorithm;
import com.project.image.selection.service.SelectionService;
import com.project.image.selection.service.StorageService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.multipart.MultipartFile;

import java.awt.Point;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import javax.imageio.ImageIO;

/**
 * Magic-wand front end: upload an image, then click on it to grow a selection from that pixel.
 * Every click is an independent fill on the stored grayscale reference.
 */
@Controller
@Validated
public class SelectionController {
    private static final Logger log = LoggerFactory.getLogger(SelectionController.class);

    public static final List<String> SUPPORTED_FORMATS = List.of(
            "image/jpeg", "image/jpg", "image/png", "image/gif", "image/bmp", "image/webp"
    );
    private static final long MAX_UPLOAD_BYTES = 10 * 1024 * 1024; // 10MB

    private final SelectionService selectionService;
    private final StorageService storageService;

    @Value("${app.selection.default-threshold:128}")
    private int defaultThreshold;

    @Value("${app.selection.default-algorithm:SCANLINE_PARALLEL}")
    private FillAlgorithm defaultAlgorithm;

    @Value("${app.selection.max-dimension:4000}")
    private int maxDimension;

    public SelectionController(SelectionService selectionService, StorageService storageService) {
        this.selectionService = selectionService;
        this.storageService = storageService;
    }

    @GetMapping("/select")
    public String showForm(Model model) {
        model.addAttribute("threshold", defaultThreshold);
        model.addAttribute("algorithm", defaultAlgorithm);
        model.addAttribute("algorithms", FillAlgorithm.values());
        model.addAttribute("supportedFormats", String.join(", ", SUPPORTED_FORMATS));
        return "select";
    }

    @PostMapping(value = "/select", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public String handleUpload(
            @RequestParam("file") @NotNull MultipartFile file,
            @RequestParam(name = "threshold", defaultValue = "128")
            @Min(value = 0, message = "Threshold must be at least 0")
            @Max(value = 255, message = "Threshold must be at most 255")
            int threshold,
            @RequestParam(name = "algorithm", defaultValue = "SCANLINE_PARALLEL") FillAlgorithm algorithm,
            Model model
    ) throws IOException {
        validateUploadedFile(file);
        log.info("Processing upload: {} ({}KB)", file.getOriginalFilename(), file.getSize() / 1024);

        BufferedImage input;
        try (var inputStream = file.getInputStream()) {
            input = ImageIO.read(inputStream);
        }
        validateImage(input);

        var storedOriginal = storageService.store(file);
        // clicks are resolved against the grayscale rendition, exactly what the engine sees
        var storedGray = storageService.storeResultImage(selectionService.grayscalePng(input), "gray");
        log.debug("Stored {} with grayscale reference {}", storedOriginal.filename(), storedGray.filename());

        model.addAttribute("image", storedGray.filename());
        model.addAttribute("originalPath", "/" + storedOriginal.relativeWebPath());
        model.addAttribute("displayPath", "/" + storedGray.relativeWebPath());
        model.addAttribute("width", input.getWidth());
        model.addAttribute("height", input.getHeight());
        populateSettings(model, threshold, algorithm);
        return "selection";
    }

    @PostMapping("/select/fill")
    public String fill(
            @RequestParam("image") String image,
            @RequestParam("seed.x") int x,
            @RequestParam("seed.y") int y,
            @RequestParam(name = "threshold", defaultValue = "128")
            @Min(value = 0, message = "Threshold must be at least 0")
            @Max(value = 255, message = "Threshold must be at most 255")
            int threshold,
            @RequestParam(name = "algorithm", defaultValue = "SCANLINE_PARALLEL") FillAlgorithm algorithm,
            Model model
    ) throws IOException {
        var stored = storageService.load(image);
        BufferedImage reference = readImage(stored.path());

        SelectionResult result = selectionService.select(reference, new Point(x, y), threshold, algorithm);

        var overlayStored = storageService.storeResultImage(result.overlayPng(), "overlay");
        var maskStored = storageService.storeResultImage(result.maskPng(), "mask");

        model.addAttribute("image", stored.filename());
        model.addAttribute("displayPath", "/" + overlayStored.relativeWebPath());
        model.addAttribute("maskPath", "/" + maskStored.relativeWebPath());
        model.addAttribute("width", result.width());
        model.addAttribute("height", result.height());
        model.addAttribute("result", result);
        model.addAttribute("selectedPixels", result.selectedPixels());
        model.addAttribute("areaPercent", String.format("%.2f", result.areaPercent()));
        model.addAttribute("elapsedMs", String.format("%.2f", result.elapsedMillis()));
        populateSettings(model, threshold, algorithm);

        log.info("Selection at ({},{}) on {}: {} pixels", x, y, stored.filename(), result.selectedPixels());
        return "selection";
    }

    private void populateSettings(Model model, int threshold, FillAlgorithm algorithm) {
        model.addAttribute("threshold", threshold);
        model.addAttribute("algorithm", algorithm);
        model.addAttribute("algorithms", FillAlgorithm.values());
    }

    private void validateUploadedFile(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("Please choose a file to upload");
        }

        String contentType = file.getContentType();
        if (contentType == null || !SUPPORTED_FORMATS.contains(contentType.toLowerCase())) {
            throw new IllegalArgumentException(
                    "Unsupported file type: " + contentType +
                            ". Supported types: " + String.join(", ", SUPPORTED_FORMATS)
            );
        }

        if (file.getSize() > MAX_UPLOAD_BYTES) {
            throw new IllegalArgumentException("File too large. Maximum size: 10MB");
        }
    }

    private void validateImage(BufferedImage input) {
        if (input == null) {
            throw new SelectionException("The file is not a valid image or is corrupted.");
        }
        if (input.getWidth() > maxDimension || input.getHeight() > maxDimension) {
            throw new SelectionException("Image too large. Maximum size: " + maxDimension + "x" + maxDimension + " pixels");
        }
        log.debug("Image loaded successfully: {}x{}", input.getWidth(), input.getHeight());
    }

    private BufferedImage readImage(Path path) throws IOException {
        BufferedImage image = ImageIO.read(path.toFile());
        if (image == null) {
            throw new SelectionException("Stored image could not be decoded: " + path.getFileName());
        }
        return image;
    }
}
