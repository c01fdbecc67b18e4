package com.project.image.selection.floodfill;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PixelBufferTest {

    @Test
    void newBuffer_isZeroFilled_andReadsUnsigned() {
        PixelBuffer buffer = new PixelBuffer(3, 2);
        assertThat(buffer.countNonZero()).isZero();

        buffer.set(2, 1, 250);
        assertThat(buffer.get(2, 1)).isEqualTo(250);
        assertThat(buffer.countNonZero()).isEqualTo(1);
    }

    @Test
    void of_isRowMajor() {
        PixelBuffer buffer = PixelBuffer.of(3, 2,
                1, 2, 3,
                4, 5, 6);
        assertThat(buffer.get(0, 1)).isEqualTo(4);
        assertThat(buffer.get(2, 0)).isEqualTo(3);
    }

    @Test
    void outOfBoundsAccess_isRejected() {
        PixelBuffer buffer = new PixelBuffer(4, 4);
        assertThatThrownBy(() -> buffer.get(4, 0)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> buffer.set(0, -1, 1)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> new PixelBuffer(0, 3)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void view_writesOnlyInsideItsRegion() {
        PixelBuffer buffer = new PixelBuffer(8, 8);
        TileView view = buffer.view(new Region(4, 0, 4, 4));

        view.set(5, 1, 7);
        assertThat(buffer.get(5, 1)).isEqualTo(7);
        assertThatThrownBy(() -> view.set(3, 1, 7)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> view.get(5, 4)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThat(buffer.countNonZero()).isEqualTo(1);
    }

    @Test
    void view_mustLieInsideImage() {
        PixelBuffer buffer = new PixelBuffer(8, 8);
        assertThatThrownBy(() -> buffer.view(new Region(6, 6, 4, 4)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void view_bulkCopiesRespectStride() {
        PixelBuffer buffer = PixelBuffer.of(4, 3,
                0, 1, 2, 3,
                4, 5, 6, 7,
                8, 9, 10, 11);
        TileView view = buffer.view(new Region(1, 1, 2, 2));

        byte[] local = new byte[4];
        view.readInto(local);
        assertThat(local).containsExactly(5, 6, 9, 10);

        view.writeFrom(new byte[]{50, 60, 90, 100});
        assertThat(buffer).isEqualTo(PixelBuffer.of(4, 3,
                0, 1, 2, 3,
                4, 50, 60, 7,
                8, 90, 100, 11));
    }

    @Test
    void equality_isBySamples() {
        PixelBuffer a = PixelBuffer.filled(5, 5, 9);
        PixelBuffer b = a.copy();
        assertThat(b).isEqualTo(a).hasSameHashCodeAs(a);

        b.set(0, 0, 10);
        assertThat(b).isNotEqualTo(a);
    }
}
