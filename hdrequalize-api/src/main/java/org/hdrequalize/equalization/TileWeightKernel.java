package org.hdrequalize.equalization;

import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;

/**
 * Interpolation weights for a tile surrounded by its 8 neighbors.
 * <p>
 * get(oy, ox, py, px) is the contribution of the curve of the tile at relative tile offset (oy - 1, ox - 1)
 * to the pixel (py, px) of the current tile. The pixel in the middle of the tile only uses its own tile, pixels
 * on the middle row or column interpolate linearly with the nearest horizontal or vertical neighbor and all other
 * pixels interpolate bilinearly with the nearest 3 neighbors. For every pixel the 9 weights add up to 1.
 * <p>
 * Distances are measured from the tile center to the pixel centers (row + 0.5, col + 0.5) and not to the pixel
 * corners. This departs from a literal corner based formula but it makes the weights point symmetric around the
 * tile center. Because the bilinear weights separate into a row factor and a column factor only the 3 x tileSize
 * factors are stored.
 * <p>
 * Kernels only depend on the tile size so the most recently used ones are cached.
 */
public final class TileWeightKernel {

    private static final int MAX_CACHED_KERNELS = 16;

    private static final LoadingCache<Integer, TileWeightKernel> KERNELS = CacheBuilder.newBuilder()
            .concurrencyLevel(4)
            .maximumSize(MAX_CACHED_KERNELS)
            .build(new CacheLoader<Integer, TileWeightKernel>() {
                @Override
                public TileWeightKernel load(Integer tileSize) {
                    return new TileWeightKernel(tileSize);
                }
            });

    private final int tileSize;
    // factors[o * tileSize + p] is the weight along one axis of the tile at offset o - 1 for position p
    private final double[] factors;

    public static TileWeightKernel forTileSize(int tileSize) {
        if (tileSize < 1) {
            throw new IllegalArgumentException("Invalid tile size: " + tileSize);
        }
        if (tileSize > EqualizationParams.MAX_TILE_SIZE) {
            throw new IllegalArgumentException("Tile size " + tileSize + " exceeds " + EqualizationParams.MAX_TILE_SIZE);
        }
        return KERNELS.getUnchecked(tileSize);
    }

    private TileWeightKernel(int tileSize) {
        this.tileSize = tileSize;
        this.factors = new double[3 * tileSize];
        calculateFactors();
    }

    private void calculateFactors() {
        int centerIndex = tileSize / 2;
        double centerDist = tileSize / 2.0;
        double ts = tileSize;
        for (int p = 0; p < tileSize; p++) {
            double dist = Math.abs(centerDist - (p + 0.5));
            factors[tileSize + p] = p == centerIndex ? 1.0 : (ts - dist) / ts;
            if (p < centerIndex) {
                factors[p] = dist / ts;
            } else if (p > centerIndex) {
                factors[2 * tileSize + p] = dist / ts;
            }
        }
    }

    public int getTileSize() {
        return tileSize;
    }

    public double get(int oy, int ox, int py, int px) {
        return factors[oy * tileSize + py] * factors[ox * tileSize + px];
    }

    /**
     * @param offsetIndex neighbor index oy * 3 + ox
     */
    double get(int offsetIndex, int py, int px) {
        return get(offsetIndex / 3, offsetIndex % 3, py, px);
    }

    static long cachedKernelsCount() {
        return KERNELS.size();
    }
}
