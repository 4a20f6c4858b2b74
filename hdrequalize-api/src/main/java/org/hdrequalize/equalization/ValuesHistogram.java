package org.hdrequalize.equalization;

import java.util.Arrays;

/**
 * Equal width histogram of real values over the [min, max] range of the values.
 * All bins are half open except the last one which also holds the max value.
 */
class ValuesHistogram {
    private final double[] binEdges;
    private final long[] counts;
    private final long total;

    private ValuesHistogram(double[] binEdges, long[] counts, long total) {
        this.binEdges = binEdges;
        this.counts = counts;
        this.total = total;
    }

    static ValuesHistogram fromValues(double[] values, int nbins) {
        if (values.length == 0) {
            throw new IllegalArgumentException("Cannot build a histogram from an empty sample");
        }
        if (nbins < 1) {
            throw new IllegalArgumentException("Invalid number of bins: " + nbins);
        }
        double minValue = Double.POSITIVE_INFINITY;
        double maxValue = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            if (v < minValue) minValue = v;
            if (v > maxValue) maxValue = v;
        }
        if (!Double.isFinite(minValue) || !Double.isFinite(maxValue)) {
            throw new IllegalArgumentException("Histogram range [" + minValue + ", " + maxValue + "] is not finite");
        }
        if (minValue == maxValue) {
            minValue -= 0.5;
            maxValue += 0.5;
        }
        double[] binEdges = createBinEdges(minValue, maxValue, nbins);
        long[] counts = new long[nbins];
        double norm = nbins / (maxValue - minValue);
        long total = 0;
        for (double v : values) {
            if (Double.isNaN(v)) {
                continue;
            }
            int bin = (int) ((v - minValue) * norm);
            if (bin >= nbins) {
                bin = nbins - 1;
            }
            // the computed index may be off by one because of rounding
            if (v < binEdges[bin]) {
                bin--;
            } else if (bin != nbins - 1 && v >= binEdges[bin + 1]) {
                bin++;
            }
            counts[bin]++;
            total++;
        }
        return new ValuesHistogram(binEdges, counts, total);
    }

    private static double[] createBinEdges(double minValue, double maxValue, int nbins) {
        double[] edges = new double[nbins + 1];
        double step = (maxValue - minValue) / nbins;
        for (int i = 0; i < nbins; i++) {
            edges[i] = minValue + i * step;
        }
        edges[nbins] = maxValue;
        return edges;
    }

    int getNumBins() {
        return counts.length;
    }

    long getTotal() {
        return total;
    }

    long[] getCounts() {
        return Arrays.copyOf(counts, counts.length);
    }

    double[] getBinEdges() {
        return Arrays.copyOf(binEdges, binEdges.length);
    }
}
