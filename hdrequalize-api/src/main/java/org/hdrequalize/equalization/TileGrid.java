package org.hdrequalize.equalization;

import javax.annotation.Nullable;

/**
 * Partition of a rows x cols raster into square tiles of tileSize pixels. The last tile on each axis may be short.
 * The grid also holds the equalization curve computed for every tile; a tile without valid data has no curve.
 */
public class TileGrid {

    private final int rows;
    private final int cols;
    private final int tileSize;
    private final int rowTiles;
    private final int colTiles;
    private final TileWeightKernel kernel;
    private final CDFCurve[] curves;

    public TileGrid(int rows, int cols, int tileSize) {
        if (tileSize < 1) {
            throw new IllegalArgumentException("Invalid tile size: " + tileSize);
        }
        this.rows = rows;
        this.cols = cols;
        this.tileSize = tileSize;
        this.rowTiles = (rows + tileSize - 1) / tileSize;
        this.colTiles = (cols + tileSize - 1) / tileSize;
        this.kernel = TileWeightKernel.forTileSize(tileSize);
        this.curves = new CDFCurve[rowTiles * colTiles];
    }

    public int getTileSize() {
        return tileSize;
    }

    public int getRowTiles() {
        return rowTiles;
    }

    public int getColTiles() {
        return colTiles;
    }

    public TileWeightKernel getKernel() {
        return kernel;
    }

    /**
     * Inclusive first image row of the tile.
     */
    public int tileMinRow(int rowTile) {
        return rowTile * tileSize;
    }

    /**
     * Exclusive last image row of the tile.
     */
    public int tileMaxRow(int rowTile) {
        return Math.min(rows, (rowTile + 1) * tileSize);
    }

    public int tileMinCol(int colTile) {
        return colTile * tileSize;
    }

    public int tileMaxCol(int colTile) {
        return Math.min(cols, (colTile + 1) * tileSize);
    }

    public boolean contains(int rowTile, int colTile) {
        return rowTile >= 0 && rowTile < rowTiles && colTile >= 0 && colTile < colTiles;
    }

    /**
     * @return the tile's curve or null if the tile is outside the grid or it has no valid data.
     */
    @Nullable
    public CDFCurve getCurve(int rowTile, int colTile) {
        return contains(rowTile, colTile) ? curves[rowTile * colTiles + colTile] : null;
    }

    void setCurve(int rowTile, int colTile, @Nullable CDFCurve curve) {
        curves[rowTile * colTiles + colTile] = curve;
    }

    /**
     * @return the curves of the 3 x 3 tile neighborhood indexed by oy * 3 + ox; unusable neighbors are null.
     */
    CDFCurve[] getNeighborCurves(int rowTile, int colTile) {
        CDFCurve[] neighborCurves = new CDFCurve[9];
        for (int oy = 0; oy < 3; oy++) {
            for (int ox = 0; ox < 3; ox++) {
                neighborCurves[oy * 3 + ox] = getCurve(rowTile - 1 + oy, colTile - 1 + ox);
            }
        }
        return neighborCurves;
    }

    /**
     * Kernel weight that cannot be used at pixel (py, px) of the given tile because the neighbors it belongs to
     * are outside the image or have no curve.
     */
    public double missingWeight(int rowTile, int colTile, int py, int px) {
        CDFCurve[] neighborCurves = getNeighborCurves(rowTile, colTile);
        double missing = 0;
        for (int k = 0; k < 9; k++) {
            if (neighborCurves[k] == null) {
                missing += kernel.get(k, py, px);
            }
        }
        return missing;
    }
}
