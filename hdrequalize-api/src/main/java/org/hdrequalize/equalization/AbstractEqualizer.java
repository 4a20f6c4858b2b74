package org.hdrequalize.equalization;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.type.BooleanType;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.DoubleType;
import org.hdrequalize.image.ImageAccessUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Common input checks, output handling and normalization for the equalizers.
 */
public abstract class AbstractEqualizer implements Equalizer {

    private static final Logger LOG = LoggerFactory.getLogger(AbstractEqualizer.class);

    final EqualizationParams params;

    protected AbstractEqualizer(EqualizationParams params) {
        params.validate();
        this.params = new EqualizationParams(params);
    }

    @Override
    public EqualizationParams getParams() {
        return new EqualizationParams(params);
    }

    @Override
    public <T extends RealType<T>, M extends BooleanType<M>, V extends BooleanType<V>> Img<DoubleType> equalize(RandomAccessibleInterval<T> data,
                                                                                                                RandomAccessibleInterval<M> maskToEqualize,
                                                                                                                RandomAccessibleInterval<V> validDataMask) {
        RasterData input = RasterData.fromImages(data, maskToEqualize, validDataMask);
        double[] out = input.values.clone();
        boolean[] equalized = equalizeValues(input, out);
        Img<DoubleType> outImage = ImageAccessUtils.createDoubleImg(input.values, input.cols, input.rows);
        ImageAccessUtils.setSelectedValues(outImage, out, equalized);
        return outImage;
    }

    @Override
    public <T extends RealType<T>, M extends BooleanType<M>, V extends BooleanType<V>, O extends RealType<O>> void equalize(RandomAccessibleInterval<T> data,
                                                                                                                            RandomAccessibleInterval<M> maskToEqualize,
                                                                                                                            RandomAccessibleInterval<V> validDataMask,
                                                                                                                            RandomAccessibleInterval<O> out) {
        ImageAccessUtils.checkSameShape(data, out, "Output");
        RasterData input = RasterData.fromImages(data, maskToEqualize, validDataMask);
        double[] outValues = ImageAccessUtils.toDoubleArray(out);
        boolean[] equalized = equalizeValues(input, outValues);
        ImageAccessUtils.setSelectedValues(out, outValues, equalized);
    }

    /**
     * Equalize the input, normalizing the result if requested.
     *
     * @param input raster values and masks
     * @param out   output values - only the equalized entries are changed
     * @return the entries of out that were equalized
     */
    boolean[] equalizeValues(RasterData input, double[] out) {
        long startTime = System.currentTimeMillis();
        boolean[] equalized = equalizeMaskedValues(input, out);
        if (params.isZeroToOneNormalization()) {
            Normalizer.normalizeToUnitRange(out, equalized, params.getNumberOfBins());
        }
        LOG.debug("Equalized {}x{} image with {} in {}s", input.rows, input.cols, params, (System.currentTimeMillis() - startTime) / 1000.);
        return equalized;
    }

    /**
     * Write the equalized value of the pixels selected by the input's maskToEqualize to out.
     *
     * @return the entries of out that were written
     */
    abstract boolean[] equalizeMaskedValues(RasterData input, double[] out);
}
