package org.hdrequalize.equalization;

import javax.annotation.Nullable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the contrast limited cumulative distribution function used to equalize a sample of values.
 */
public class HistogramBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(HistogramBuilder.class);

    /**
     * Build the equalization curve for the given sample.
     *
     * @param validData    sample values - must not be empty
     * @param numberOfBins number of histogram bins
     * @param clipLimit    if set, bins holding more than clipLimit values are reset to
     *                     clipLimit * (sample size / numberOfBins) values
     * @param slopeLimit   if set, no cdf step may exceed slopeLimit * (sample size / numberOfBins)
     * @return the cdf rescaled to [0, numberOfBins - 1] together with the histogram bin edges
     */
    public static CDFCurve buildCDF(double[] validData,
                                    int numberOfBins,
                                    @Nullable Double clipLimit,
                                    @Nullable Double slopeLimit) {
        ValuesHistogram histogram = ValuesHistogram.fromValues(validData, numberOfBins);
        long[] counts = histogram.getCounts();
        double valuesPerBin = validData.length / (double) numberOfBins;

        if (clipLimit != null) {
            long pixelsToClipAt = (long) (clipLimit * valuesPerBin);
            int clippedBins = 0;
            for (int b = 0; b < counts.length; b++) {
                // the count is compared with the limit itself and not with the clip target
                if (counts[b] > clipLimit) {
                    counts[b] = pixelsToClipAt;
                    clippedBins++;
                }
            }
            LOG.trace("Clipped {} bins to {} values", clippedBins, pixelsToClipAt);
        }

        long[] cdf = new long[counts.length];
        long runningTotal = 0;
        for (int b = 0; b < counts.length; b++) {
            runningTotal += counts[b];
            cdf[b] = runningTotal;
        }

        if (slopeLimit != null) {
            long heightLimit = (long) (slopeLimit * valuesPerBin);
            long cumulativeExcessHeight = 0;
            for (int b = 1; b < cdf.length; b++) {
                long currentCount = cdf[b];
                long diffFromAcceptable = currentCount - cdf[b - 1] - heightLimit - cumulativeExcessHeight;
                cumulativeExcessHeight += Math.max(diffFromAcceptable, 0);
                cdf[b] = currentCount - cumulativeExcessHeight;
            }
            LOG.trace("Limited cdf steps to {} removing {} values", heightLimit, cumulativeExcessHeight);
        }

        double[] normalizedCdf = new double[cdf.length];
        long cdfMax = cdf[cdf.length - 1];
        if (cdfMax != 0) {
            for (int b = 0; b < cdf.length; b++) {
                normalizedCdf[b] = (numberOfBins - 1) * (double) cdf[b] / cdfMax;
            }
        }
        return new CDFCurve(normalizedCdf, histogram.getBinEdges());
    }
}
