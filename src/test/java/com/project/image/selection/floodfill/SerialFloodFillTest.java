package com.project.image.selection.floodfill;

import org.junit.jupiter.api.Test;

import java.awt.Point;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SerialFloodFillTest {
    private final SerialFloodFill floodFill = new SerialFloodFill();

    @Test
    void uniformRegion_excludesTheOddPixel() {
        PixelBuffer image = PixelBuffer.filled(4, 4, 100);
        image.set(3, 3, 200);

        PixelBuffer mask = floodFill.fill(image, new Point(0, 0), 50).mask();

        PixelBuffer expected = PixelBuffer.filled(4, 4, 255);
        expected.set(3, 3, 0);
        assertThat(mask).isEqualTo(expected);
    }

    @Test
    void excludedPixel_blocksTheOnlyPath() {
        PixelBuffer image = PixelBuffer.of(3, 1, 10, 200, 10);

        PixelBuffer mask = floodFill.fill(image, new Point(0, 0), 50).mask();

        assertThat(mask).isEqualTo(PixelBuffer.of(3, 1, 255, 0, 0));
    }

    @Test
    void largeUniformImage_isFullySelectedWithoutRecursion() {
        PixelBuffer image = PixelBuffer.filled(100, 100, 128);

        PixelBuffer mask = floodFill.fill(image, new Point(50, 50), 1).mask();

        assertThat(mask).isEqualTo(PixelBuffer.filled(100, 100, 255));
    }

    @Test
    void values_areGradedByDifference() {
        PixelBuffer image = PixelBuffer.of(4, 1, 100, 110, 120, 130);

        PixelBuffer mask = floodFill.fill(image, new Point(0, 0), 25).mask();

        // 255 - d * 255 / 25 for d = 0, 10, 20; d = 30 is outside
        assertThat(mask).isEqualTo(PixelBuffer.of(4, 1, 255, 153, 51, 0));
    }

    @Test
    void seedOutsideImage_selectsNothing() {
        PixelBuffer image = PixelBuffer.filled(5, 5, 10);

        assertThat(floodFill.fill(image, new Point(5, 0), 100).mask().countNonZero()).isZero();
        assertThat(floodFill.fill(image, new Point(-1, 2), 100).mask().countNonZero()).isZero();
    }

    @Test
    void zeroThreshold_selectsNothing() {
        PixelBuffer image = PixelBuffer.filled(5, 5, 10);

        assertThat(floodFill.fill(image, new Point(2, 2), 0).mask().countNonZero()).isZero();
    }

    @Test
    void fill_leavesReferenceUntouched() {
        PixelBuffer image = TestImages.blocks(3, 20, 20, 4);
        PixelBuffer before = image.copy();

        floodFill.fill(image, new Point(10, 10), 60);

        assertThat(image).isEqualTo(before);
    }

    @Test
    void invalidThreshold_isRejected() {
        PixelBuffer image = PixelBuffer.filled(2, 2, 0);
        assertThatThrownBy(() -> floodFill.fill(image, new Point(0, 0), 256))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
