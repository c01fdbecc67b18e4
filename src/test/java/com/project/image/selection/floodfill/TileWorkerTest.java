package com.project.image.selection.floodfill;

import org.junit.jupiter.api.Test;

import java.awt.Point;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class TileWorkerTest {
    // two 4x4 tiles side by side
    private final PixelBuffer reference = PixelBuffer.filled(8, 4, 50);
    private final TileGrid grid = TileGrid.covering(reference.bounds(), 4, 4);
    private final FillCriteria criteria = new FillCriteria(50, 10);
    private final TileId left = new TileId(0, 0);

    @Test
    void pointWorker_fillsItsTile_andHandsTheEdgeToTheNeighbour() {
        PixelBuffer mask = new PixelBuffer(8, 4);

        TilePropagation<Point> out = new PointTileWorker().processTile(reference, grid.view(mask, left),
                List.of(new Point(1, 1)), criteria, left, reference.bounds());

        assertFilledOnlyLeftTile(mask);
        assertThat(out.targets()).containsOnlyKeys(new TileId(1, 0));
        assertThat(out.targets().get(new TileId(1, 0)))
                .containsExactlyInAnyOrder(new Point(4, 0), new Point(4, 1), new Point(4, 2), new Point(4, 3));
    }

    @Test
    void scanlineWorker_fillsItsTile_andHandsTheEdgeToTheNeighbour() {
        PixelBuffer mask = new PixelBuffer(8, 4);

        TilePropagation<Span> out = new ScanlineTileWorker().processTile(reference, grid.view(mask, left),
                List.of(Span.seed(1, 1)), criteria, left, reference.bounds());

        assertFilledOnlyLeftTile(mask);
        assertThat(out.targets()).containsOnlyKeys(new TileId(1, 0));
        assertThat(out.targets().get(new TileId(1, 0)))
                .extracting(Span::x1, Span::x2, Span::y)
                .containsExactlyInAnyOrder(tuple(4, 4, 0), tuple(4, 4, 1), tuple(4, 4, 2), tuple(4, 4, 3));
    }

    @Test
    void scanlineWorker_sendsChildRowsToTheTileBelow() {
        PixelBuffer tall = PixelBuffer.filled(4, 8, 50);
        TileGrid column = TileGrid.covering(tall.bounds(), 4, 4);
        PixelBuffer mask = new PixelBuffer(4, 8);
        TileId top = new TileId(0, 0);

        TilePropagation<Span> out = new ScanlineTileWorker().processTile(tall, column.view(mask, top),
                List.of(Span.seed(0, 0)), criteria, top, tall.bounds());

        assertThat(out.targets()).containsOnlyKeys(new TileId(0, 1));
        assertThat(out.targets().get(new TileId(0, 1)))
                .extracting(Span::x1, Span::x2, Span::y)
                .containsOnly(tuple(0, 3, 4));
    }

    @Test
    void alreadyFilledSeeds_produceNoWork() {
        PixelBuffer mask = PixelBuffer.filled(8, 4, 255);

        TilePropagation<Span> out = new ScanlineTileWorker().processTile(reference, grid.view(mask, left),
                List.of(new Span(3, 3, 2, 1)), criteria, left, reference.bounds());

        assertThat(out.isEmpty()).isTrue();
    }

    @Test
    void seedOutsideTheTile_isAProgrammingError() {
        PixelBuffer mask = new PixelBuffer(8, 4);

        assertThatThrownBy(() -> new ScanlineTileWorker().processTile(reference, grid.view(mask, left),
                List.of(Span.seed(5, 1)), criteria, left, reference.bounds()))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> new PointTileWorker().processTile(reference, grid.view(mask, left),
                List.of(new Point(5, 1)), criteria, left, reference.bounds()))
                .isInstanceOf(IllegalStateException.class);
    }

    private static void assertFilledOnlyLeftTile(PixelBuffer mask) {
        for (int y = 0; y < 4; y++) {
            for (int x = 0; x < 8; x++) {
                assertThat(mask.get(x, y)).as("(%d,%d)", x, y).isEqualTo(x < 4 ? 255 : 0);
            }
        }
    }
}
