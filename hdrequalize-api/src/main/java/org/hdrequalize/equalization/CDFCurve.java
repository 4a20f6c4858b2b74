package org.hdrequalize.equalization;

import java.util.Arrays;

import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Equalization curve: a cumulative distribution function sampled at the lower edge of each histogram bin.
 */
public class CDFCurve {

    private final double[] cdf;
    private final double[] binEdges;

    /**
     * @param cdf      non-decreasing cumulative distribution values, one per bin
     * @param binEdges bin edges - one more than the number of cdf values
     */
    public CDFCurve(double[] cdf, double[] binEdges) {
        if (cdf.length == 0 || binEdges.length != cdf.length + 1) {
            throw new IllegalArgumentException("Expected " + (cdf.length + 1) + " bin edges for " + cdf.length +
                    " cdf values but found " + binEdges.length);
        }
        this.cdf = Arrays.copyOf(cdf, cdf.length);
        this.binEdges = Arrays.copyOf(binEdges, binEdges.length);
    }

    public int getNumberOfBins() {
        return cdf.length;
    }

    public double[] getCdf() {
        return Arrays.copyOf(cdf, cdf.length);
    }

    public double[] getBinEdges() {
        return Arrays.copyOf(binEdges, binEdges.length);
    }

    /**
     * Linearly interpolate the value through the curve. Values below the first bin edge map to the first cdf value,
     * values above the last lower bin edge map to the last cdf value and NaN maps to NaN.
     */
    public double map(double value) {
        if (Double.isNaN(value)) {
            return Double.NaN;
        }
        int last = cdf.length - 1;
        if (value <= binEdges[0]) {
            return cdf[0];
        }
        if (value >= binEdges[last]) {
            return cdf[last];
        }
        int pos = Arrays.binarySearch(binEdges, 0, cdf.length, value);
        if (pos >= 0) {
            return cdf[pos];
        }
        int hi = -pos - 1;
        int lo = hi - 1;
        double slope = (cdf[hi] - cdf[lo]) / (binEdges[hi] - binEdges[lo]);
        return cdf[lo] + slope * (value - binEdges[lo]);
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("bins", cdf.length)
                .append("minEdge", binEdges[0])
                .append("maxEdge", binEdges[binEdges.length - 1])
                .toString();
    }
}
