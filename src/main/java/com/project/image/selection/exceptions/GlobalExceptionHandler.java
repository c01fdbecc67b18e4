package com.project.image.selection.exceptions;

import com.project.image.selection.controller.SelectionController;
import com.project.image.selection.floodfill.FillAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

import jakarta.validation.ConstraintViolationException;
import java.io.IOException;

@ControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @Value("${app.selection.default-threshold:128}")
    private int defaultThreshold;

    @Value("${app.selection.default-algorithm:SCANLINE_PARALLEL}")
    private FillAlgorithm defaultAlgorithm;

    @ExceptionHandler({StorageException.class, SelectionException.class})
    public String handleDomainExceptions(RuntimeException ex, Model model) {
        log.warn("Domain error: {}", ex.getMessage());
        return selectView(model, ex.getMessage());
    }

    @ExceptionHandler(FloodFillException.class)
    public String handleFloodFillFailure(FloodFillException ex, Model model) {
        log.error("Flood fill failed", ex);
        return selectView(model, "The selection could not be computed. Please try again.");
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public String handleMaxUploadSizeExceeded(MaxUploadSizeExceededException ex, Model model) {
        log.warn("File upload size exceeded: {}", ex.getMessage());
        return selectView(model, "File too large. Maximum size: 10MB");
    }

    @ExceptionHandler({ConstraintViolationException.class, HandlerMethodValidationException.class})
    public String handleValidationErrors(Exception ex, Model model) {
        log.warn("Validation error: {}", ex.getMessage());
        return selectView(model, "Invalid parameters. Threshold must be between 0 and 255.");
    }

    @ExceptionHandler(IOException.class)
    public String handleIOException(IOException ex, Model model) {
        log.error("IO error occurred", ex);
        return selectView(model, "Could not read the image. Please try another file.");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public String handleIllegalArgument(IllegalArgumentException ex, Model model) {
        log.warn("Invalid argument: {}", ex.getMessage());
        return selectView(model, "Invalid parameters: " + ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public String handleUnknownException(Exception ex, Model model) {
        log.error("Unhandled error occurred", ex);
        return selectView(model, "An unexpected error occurred. Please try again.");
    }

    private String selectView(Model model, String error) {
        model.addAttribute("error", error);
        model.addAttribute("threshold", defaultThreshold);
        model.addAttribute("algorithm", defaultAlgorithm);
        model.addAttribute("algorithms", FillAlgorithm.values());
        model.addAttribute("supportedFormats", String.join(", ", SelectionController.SUPPORTED_FORMATS));
        return "select";
    }
}
