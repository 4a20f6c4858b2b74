package org.hdrequalize.equalization;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import javax.annotation.Nullable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Adaptive histogram equalization.
 * <p>
 * The image is split into tiles of (2 * localRadiusPx + 1) pixels and an equalization curve is computed from the
 * valid values of every tile. Each pixel to equalize is then mapped through the curves of its own tile and of the
 * surrounding tiles and the results are blended using the {@link TileWeightKernel} weights. When some of the
 * neighbor tiles are outside the image or have no valid data, the blended value is divided by the weight that was
 * actually used. Pixels to equalize that are not valid data are left unchanged.
 * <p>
 * If an executor is provided the curves and the per tile blending run as one task per tile.
 */
public class AdaptiveEqualizer extends AbstractEqualizer {

    private static final Logger LOG = LoggerFactory.getLogger(AdaptiveEqualizer.class);

    private final ExecutorService executorService;

    public AdaptiveEqualizer(EqualizationParams params) {
        this(params, null);
    }

    public AdaptiveEqualizer(EqualizationParams params, @Nullable ExecutorService executorService) {
        super(params);
        this.executorService = executorService;
    }

    @Override
    boolean[] equalizeMaskedValues(RasterData input, double[] out) {
        TileGrid tileGrid = computeTileCurves(input);
        boolean[] equalized = new boolean[input.values.length];
        LOG.debug("Blending tile equalizations for {}x{} tiles", tileGrid.getRowTiles(), tileGrid.getColTiles());
        runPerTile(tileGrid, (rowTile, colTile) -> equalizeTile(input, tileGrid, rowTile, colTile, out, equalized));
        return equalized;
    }

    /**
     * Compute the equalization curve of every tile. Tiles that have no valid values are left without a curve.
     */
    TileGrid computeTileCurves(RasterData input) {
        TileGrid tileGrid = new TileGrid(input.rows, input.cols, params.getTileSize());
        LOG.debug("Computing histogram equalizations for {}x{} tiles of {} pixels",
                tileGrid.getRowTiles(), tileGrid.getColTiles(), tileGrid.getTileSize());
        runPerTile(tileGrid, (rowTile, colTile) -> tileGrid.setCurve(rowTile, colTile, computeTileCurve(input, tileGrid, rowTile, colTile)));
        return tileGrid;
    }

    private CDFCurve computeTileCurve(RasterData input, TileGrid tileGrid, int rowTile, int colTile) {
        SampleValues tileValues = new SampleValues();
        for (int row = tileGrid.tileMinRow(rowTile); row < tileGrid.tileMaxRow(rowTile); row++) {
            for (int col = tileGrid.tileMinCol(colTile); col < tileGrid.tileMaxCol(colTile); col++) {
                int i = input.index(row, col);
                if (input.validDataMask[i]) {
                    tileValues.add(input.values[i]);
                }
            }
        }
        if (tileValues.isEmpty()) {
            LOG.trace("Tile ({}, {}) has no valid data", rowTile, colTile);
            return null;
        }
        SampleValues histogramValues = params.getStdMultCutoff() != null
                ? tileValues.withinStdDevs(params.getStdMultCutoff())
                : tileValues;
        if (params.hasLogScale()) {
            histogramValues = histogramValues.logScaled(params.getLogOffset());
        }
        if (histogramValues.isEmpty()) {
            LOG.trace("No values left for tile ({}, {}) after filtering {} valid values", rowTile, colTile, tileValues.size());
            return null;
        }
        return HistogramBuilder.buildCDF(
                histogramValues.toArray(),
                params.getNumberOfBins(),
                params.getClipLimit(),
                params.getSlopeLimit());
    }

    private void equalizeTile(RasterData input, TileGrid tileGrid, int rowTile, int colTile, double[] out, boolean[] equalized) {
        TileWeightKernel kernel = tileGrid.getKernel();
        CDFCurve[] neighborCurves = null;
        int minRow = tileGrid.tileMinRow(rowTile);
        int minCol = tileGrid.tileMinCol(colTile);
        for (int row = minRow; row < tileGrid.tileMaxRow(rowTile); row++) {
            for (int col = minCol; col < tileGrid.tileMaxCol(colTile); col++) {
                int i = input.index(row, col);
                if (!input.maskToEqualize[i] || !input.validDataMask[i]) {
                    // fill values are never mapped
                    continue;
                }
                if (neighborCurves == null) {
                    neighborCurves = tileGrid.getNeighborCurves(rowTile, colTile);
                }
                double value = params.hasLogScale() ? Math.log(input.values[i] + params.getLogOffset()) : input.values[i];
                int py = row - minRow;
                int px = col - minCol;
                double weightedSum = 0;
                double missingWeight = 0;
                boolean hasContributions = false;
                for (int k = 0; k < 9; k++) {
                    double w = kernel.get(k, py, px);
                    if (w == 0) {
                        continue;
                    }
                    if (neighborCurves[k] != null) {
                        weightedSum += w * neighborCurves[k].map(value);
                        hasContributions = true;
                    } else {
                        missingWeight += w;
                    }
                }
                if (!hasContributions) {
                    // no usable tile around this pixel
                    continue;
                }
                if (missingWeight > 0) {
                    weightedSum /= 1 - missingWeight;
                }
                out[i] = weightedSum;
                equalized[i] = true;
            }
        }
    }

    @FunctionalInterface
    private interface TileOp {
        void apply(int rowTile, int colTile);
    }

    private void runPerTile(TileGrid tileGrid, TileOp tileOp) {
        if (executorService == null) {
            for (int rowTile = 0; rowTile < tileGrid.getRowTiles(); rowTile++) {
                for (int colTile = 0; colTile < tileGrid.getColTiles(); colTile++) {
                    tileOp.apply(rowTile, colTile);
                }
            }
            return;
        }
        List<Callable<Void>> tileTasks = new ArrayList<>();
        for (int rowTile = 0; rowTile < tileGrid.getRowTiles(); rowTile++) {
            for (int colTile = 0; colTile < tileGrid.getColTiles(); colTile++) {
                int rt = rowTile;
                int ct = colTile;
                tileTasks.add(() -> {
                    tileOp.apply(rt, ct);
                    return null;
                });
            }
        }
        try {
            for (Future<Void> f : executorService.invokeAll(tileTasks)) {
                f.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Tile equalization failed", e.getCause());
        }
    }
}
