package com.project.image.selection.service;

import com.project.image.selection.DTOs.SelectionResult;
import com.project.image.selection.exceptions.SelectionException;
import com.project.image.selection.floodfill.FillAlgorithm;
import com.project.image.selection.floodfill.FillResult;
import com.project.image.selection.floodfill.FillStatistics;
import com.project.image.selection.floodfill.FloodFillEngine;
import com.project.image.selection.floodfill.PixelBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.Color;
import java.awt.Point;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;
import java.io.ByteArrayOutputStream;
import javax.imageio.ImageIO;

/**
 * Adapts uploaded images to the flood-fill engine: converts them to single-channel intensity,
 * runs the chosen algorithm and renders the mask for display.
 */
@Service
public class SelectionService {
    private static final Logger log = LoggerFactory.getLogger(SelectionService.class);

    private static final Color SELECTION_COLOR = new Color(0, 180, 255);

    private final FloodFillEngine engine;

    public SelectionService(FloodFillEngine engine) {
        this.engine = engine;
    }

    public SelectionResult select(BufferedImage input, Point seed, int threshold, FillAlgorithm algorithm) {
        if (input == null) {
            throw new SelectionException("No image to select from.");
        }
        if (seed == null) {
            throw new SelectionException("No seed point given.");
        }
        if (threshold < 0 || threshold > 255) {
            throw new SelectionException("Threshold must be between 0 and 255, got " + threshold);
        }

        PixelBuffer reference = toGrayscale(input);
        final int w = reference.width(), h = reference.height();
        log.info("Selecting from {}x{} image at ({},{}), threshold={}, algorithm={}",
                w, h, seed.x, seed.y, threshold, algorithm);

        FillResult fill = engine.select(algorithm, reference, seed, threshold);
        PixelBuffer mask = fill.mask();
        FillStatistics stats = fill.statistics();

        int selected = 0, full = 0;
        byte[] samples = mask.toByteArray();
        for (byte b : samples) {
            int v = b & 0xFF;
            if (v > 0) selected++;
            if (v == 255) full++;
        }
        int seedValue = reference.contains(seed.x, seed.y) ? reference.get(seed.x, seed.y) : -1;
        log.info("Selected {} pixels ({} fully) in {} ms", selected, full, String.format("%.2f", stats.elapsedMillis()));

        return new SelectionResult(
                w, h, seed.x, seed.y, seedValue, threshold, algorithm,
                selected, full, 100.0 * selected / (w * h),
                stats.rounds(), stats.tileTasks(), stats.elapsedMillis(),
                toPng(toImage(mask)),
                toPng(createOverlayImage(reference, mask))
        );
    }

    /** Grayscale PNG of the image, as the engine sees it. */
    public byte[] grayscalePng(BufferedImage input) {
        return toPng(toImage(toGrayscale(input)));
    }

    /**
     * Single-channel view of the image. 8-bit gray images are taken as they are; anything else is
     * reduced to luma.
     */
    public PixelBuffer toGrayscale(BufferedImage input) {
        final int w = input.getWidth(), h = input.getHeight();
        byte[] gray = new byte[w * h];

        if (input.getType() == BufferedImage.TYPE_BYTE_GRAY) {
            int[] samples = input.getRaster().getSamples(0, 0, w, h, 0, (int[]) null);
            for (int i = 0; i < samples.length; i++) {
                gray[i] = (byte) samples[i];
            }
            return new PixelBuffer(w, h, gray);
        }

        int[] argb = new int[w * h];
        input.getRGB(0, 0, w, h, argb, 0, w);
        for (int i = 0; i < argb.length; i++) {
            int p = argb[i];
            int r = (p >> 16) & 0xFF, g = (p >> 8) & 0xFF, b = p & 0xFF;
            gray[i] = (byte) clamp((int) Math.round(0.2126 * r + 0.7152 * g + 0.0722 * b));
        }
        return new PixelBuffer(w, h, gray);
    }

    private static BufferedImage toImage(PixelBuffer buffer) {
        BufferedImage image = new BufferedImage(buffer.width(), buffer.height(), BufferedImage.TYPE_BYTE_GRAY);
        byte[] target = ((DataBufferByte) image.getRaster().getDataBuffer()).getData();
        System.arraycopy(buffer.toByteArray(), 0, target, 0, target.length);
        return image;
    }

    // the mask is the alpha of the tint, graded edges blend smoothly into the reference
    private static BufferedImage createOverlayImage(PixelBuffer reference, PixelBuffer mask) {
        final int w = reference.width(), h = reference.height();
        BufferedImage overlay = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int base = reference.get(x, y);
                float alpha = mask.get(x, y) / 255f;
                int r = blend(base, SELECTION_COLOR.getRed(), alpha);
                int g = blend(base, SELECTION_COLOR.getGreen(), alpha);
                int b = blend(base, SELECTION_COLOR.getBlue(), alpha);
                overlay.setRGB(x, y, (r << 16) | (g << 8) | b);
            }
        }
        return overlay;
    }

    private static int blend(int orig, int tint, float alpha) {
        return clamp(Math.round(alpha * tint + (1f - alpha) * orig));
    }

    private static int clamp(int v) {
        return (v < 0) ? 0 : Math.min(255, v);
    }

    private static byte[] toPng(BufferedImage img) {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            ImageIO.write(img, "png", baos);
            return baos.toByteArray();
        }
        catch (Exception e) {
            throw new SelectionException("Failed to encode image", e);
        }
    }
}
