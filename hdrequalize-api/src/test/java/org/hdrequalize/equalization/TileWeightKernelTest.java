package org.hdrequalize.equalization;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class TileWeightKernelTest {

    private static final double EPSILON = 1e-9;

    private static final int[] TILE_SIZES = new int[] {1, 3, 5, 7, 101};

    @Test
    public void weightsSumToOne() {
        for (int ts : TILE_SIZES) {
            TileWeightKernel kernel = TileWeightKernel.forTileSize(ts);
            for (int row = 0; row < ts; row++) {
                for (int col = 0; col < ts; col++) {
                    double sum = 0;
                    for (int oy = 0; oy < 3; oy++) {
                        for (int ox = 0; ox < 3; ox++) {
                            sum += kernel.get(oy, ox, row, col);
                        }
                    }
                    assertEquals("Tile " + ts + " pixel (" + row + "," + col + ")", 1.0, sum, EPSILON);
                }
            }
        }
    }

    @Test
    public void weightsArePointSymmetric() {
        for (int ts : TILE_SIZES) {
            TileWeightKernel kernel = TileWeightKernel.forTileSize(ts);
            for (int oy = 0; oy < 3; oy++) {
                for (int ox = 0; ox < 3; ox++) {
                    for (int row = 0; row < ts; row++) {
                        for (int col = 0; col < ts; col++) {
                            assertEquals(kernel.get(oy, ox, row, col), kernel.get(2 - oy, 2 - ox, ts - 1 - row, ts - 1 - col), EPSILON);
                        }
                    }
                }
            }
        }
    }

    @Test
    public void centerPixelOnlyUsesItsOwnTile() {
        TileWeightKernel kernel = TileWeightKernel.forTileSize(7);
        for (int oy = 0; oy < 3; oy++) {
            for (int ox = 0; ox < 3; ox++) {
                assertEquals(oy == 1 && ox == 1 ? 1.0 : 0.0, kernel.get(oy, ox, 3, 3), 0);
            }
        }
    }

    @Test
    public void centerRowInterpolatesHorizontally() {
        TileWeightKernel kernel = TileWeightKernel.forTileSize(5);
        assertEquals(3. / 5, kernel.get(1, 1, 2, 0), EPSILON);
        assertEquals(2. / 5, kernel.get(1, 0, 2, 0), EPSILON);
        assertEquals(4. / 5, kernel.get(1, 1, 2, 3), EPSILON);
        assertEquals(1. / 5, kernel.get(1, 2, 2, 3), EPSILON);
        assertEquals(0, kernel.get(0, 1, 2, 3), 0);
    }

    @Test
    public void cornerPixelInterpolatesBilinearly() {
        TileWeightKernel kernel = TileWeightKernel.forTileSize(5);
        assertEquals(0.36, kernel.get(1, 1, 0, 0), EPSILON);
        assertEquals(0.24, kernel.get(0, 1, 0, 0), EPSILON);
        assertEquals(0.24, kernel.get(1, 0, 0, 0), EPSILON);
        assertEquals(0.16, kernel.get(0, 0, 0, 0), EPSILON);
        assertEquals(0, kernel.get(2, 2, 0, 0), 0);
        assertEquals(0, kernel.get(0, 2, 0, 0), 0);
    }

    @Test
    public void kernelsAreCachedByTileSize() {
        assertSame(TileWeightKernel.forTileSize(9), TileWeightKernel.forTileSize(9));
        assertEquals(9, TileWeightKernel.forTileSize(9).getTileSize());
    }

    @Test
    public void onlyTheMostRecentKernelsAreCached() {
        for (int ts = 201; ts < 301; ts += 2) {
            assertEquals(ts, TileWeightKernel.forTileSize(ts).getTileSize());
        }
        assertTrue(TileWeightKernel.cachedKernelsCount() <= 16);
    }

    @Test
    public void largeTileWeights() {
        int ts = 2 * 8000 + 1;
        TileWeightKernel kernel = TileWeightKernel.forTileSize(ts);
        int[] positions = new int[] {0, 1, 7999, 8000, 8001, ts - 1};
        for (int row : positions) {
            for (int col : positions) {
                double sum = 0;
                for (int k = 0; k < 9; k++) {
                    sum += kernel.get(k, row, col);
                }
                assertEquals(1.0, sum, EPSILON);
            }
        }
        assertEquals(1.0, kernel.get(1, 1, 8000, 8000), 0);
        assertEquals(kernel.get(0, 0, 0, 0), kernel.get(2, 2, ts - 1, ts - 1), EPSILON);
    }

    @Test(expected = IllegalArgumentException.class)
    public void invalidTileSize() {
        TileWeightKernel.forTileSize(0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void tileSizeTooLarge() {
        TileWeightKernel.forTileSize(EqualizationParams.MAX_TILE_SIZE + 2);
    }
}
