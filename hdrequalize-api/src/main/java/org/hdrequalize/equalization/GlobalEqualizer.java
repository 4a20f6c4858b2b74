package org.hdrequalize.equalization;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Equalizes the whole masked region with a single curve built from all valid values.
 * Values further than stdMultCutoff standard deviations from the mean are left out of the histogram so that
 * a few extreme values do not take over the bins. The log scale and radius parameters are not used.
 */
public class GlobalEqualizer extends AbstractEqualizer {

    private static final Logger LOG = LoggerFactory.getLogger(GlobalEqualizer.class);

    public GlobalEqualizer(EqualizationParams params) {
        super(params);
    }

    @Override
    boolean[] equalizeMaskedValues(RasterData input, double[] out) {
        SampleValues validValues = input.selectValidValues();
        if (validValues.isEmpty()) {
            throw new IllegalArgumentException("No valid data to equalize");
        }
        LOG.debug("Determining data range for histogram equalization of {} valid values", validValues.size());
        SampleValues histogramValues = params.getStdMultCutoff() != null
                ? validValues.withinStdDevs(params.getStdMultCutoff())
                : validValues;

        LOG.debug("Running histogram equalization on {} values", histogramValues.size());
        CDFCurve curve = HistogramBuilder.buildCDF(
                histogramValues.toArray(),
                params.getNumberOfBins(),
                params.getClipLimit(),
                params.getSlopeLimit());

        for (int i = 0; i < input.values.length; i++) {
            if (input.maskToEqualize[i]) {
                out[i] = curve.map(input.values[i]);
            }
        }
        return input.maskToEqualize;
    }
}
