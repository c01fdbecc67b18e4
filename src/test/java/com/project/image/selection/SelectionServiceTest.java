package com.project.image.selection;

import com.project.image.selection.DTOs.SelectionResult;
import com.project.image.selection.exceptions.SelectionException;
import com.project.image.selection.floodfill.FillAlgorithm;
import com.project.image.selection.floodfill.FloodFillEngine;
import com.project.image.selection.floodfill.PixelBuffer;
import com.project.image.selection.service.SelectionService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import javax.imageio.ImageIO;
import java.awt.*;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SelectionServiceTest {
    private final ExecutorService executor = Executors.newFixedThreadPool(2);
    private final SelectionService service = new SelectionService(new FloodFillEngine(16, 16, executor));

    @AfterEach
    void shutdown() {
        executor.shutdownNow();
    }

    @Test
    void select_whiteSquare_selectsExactlyTheSquare() throws Exception {
// 100x100 black image with one 20x20 white square
        BufferedImage img = new BufferedImage(100, 100, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = img.createGraphics();
        g.setColor(Color.BLACK); g.fillRect(0,0,100,100);
        g.setColor(Color.WHITE); g.fillRect(10,10,20,20); // 400 px
        g.dispose();

        SelectionResult res = service.select(img, new Point(15, 15), 50, FillAlgorithm.SCANLINE_PARALLEL);

        assertThat(res.seedValue()).isEqualTo(255);
        assertThat(res.selectedPixels()).isEqualTo(400);
        assertThat(res.fullySelectedPixels()).isEqualTo(400);
        assertThat(res.areaPercent()).isEqualTo(4.0);
        assertThat(res.rounds()).isGreaterThan(1);
        assertThat(res.overlayPng()).isNotEmpty();

        BufferedImage mask = ImageIO.read(new ByteArrayInputStream(res.maskPng()));
        assertThat(mask.getWidth()).isEqualTo(100);
        assertThat(mask.getRaster().getSample(15, 15, 0)).isEqualTo(255);
        assertThat(mask.getRaster().getSample(5, 5, 0)).isZero();
    }

    @Test
    void select_sameImageWithEveryAlgorithm_givesSameCounts() {
        BufferedImage img = new BufferedImage(60, 40, BufferedImage.TYPE_BYTE_GRAY);
        for (int y = 0; y < 40; y++) {
            for (int x = 0; x < 60; x++) {
                img.getRaster().setSample(x, y, 0, (x * 7 + y * 3) % 90);
            }
        }

        SelectionResult first = service.select(img, new Point(30, 20), 40, FillAlgorithm.NAIVE);
        for (FillAlgorithm algorithm : FillAlgorithm.values()) {
            SelectionResult other = service.select(img, new Point(30, 20), 40, algorithm);
            assertThat(other.selectedPixels()).as(algorithm.name()).isEqualTo(first.selectedPixels());
            assertThat(other.maskPng()).as(algorithm.name()).isEqualTo(first.maskPng());
        }
    }

    @Test
    void select_seedOutsideImage_selectsNothing() {
        BufferedImage img = new BufferedImage(20, 20, BufferedImage.TYPE_BYTE_GRAY);

        SelectionResult res = service.select(img, new Point(25, 3), 100, FillAlgorithm.NAIVE_PARALLEL);

        assertThat(res.selectedPixels()).isZero();
        assertThat(res.seedValue()).isEqualTo(-1);
    }

    @Test
    void select_rejectsThresholdOutOfRange() {
        BufferedImage img = new BufferedImage(20, 20, BufferedImage.TYPE_BYTE_GRAY);
        assertThatThrownBy(() -> service.select(img, new Point(1, 1), 300, FillAlgorithm.NAIVE))
                .isInstanceOf(SelectionException.class);
    }

    @Test
    void select_rejectsMissingSeed() {
        BufferedImage img = new BufferedImage(20, 20, BufferedImage.TYPE_BYTE_GRAY);
        assertThatThrownBy(() -> service.select(img, null, 10, FillAlgorithm.SCANLINE))
                .isInstanceOf(SelectionException.class)
                .hasMessageContaining("seed");
    }

    @Test
    void toGrayscale_keepsGraySamples_andReducesColorToLuma() {
        BufferedImage gray = new BufferedImage(2, 1, BufferedImage.TYPE_BYTE_GRAY);
        gray.getRaster().setSample(0, 0, 0, 17);
        gray.getRaster().setSample(1, 0, 0, 240);
        assertThat(service.toGrayscale(gray)).isEqualTo(PixelBuffer.of(2, 1, 17, 240));

        BufferedImage rgb = new BufferedImage(2, 1, BufferedImage.TYPE_INT_RGB);
        rgb.setRGB(0, 0, 0xFFFFFF);
        rgb.setRGB(1, 0, 0x00FF00);
        // 0.7152 * 255 = 182.4
        assertThat(service.toGrayscale(rgb)).isEqualTo(PixelBuffer.of(2, 1, 255, 182));
    }
}
