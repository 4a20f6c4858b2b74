package org.hdrequalize.equalization;

import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.BooleanType;
import net.imglib2.type.numeric.RealType;
import net.imglib2.view.Views;
import org.hdrequalize.image.ImageAccessUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Linear rescale of equalized values from [theoreticalMin, theoreticalMax] to [0, 1].
 * The theoretical range is trusted - values outside of it are not clamped.
 */
public class Normalizer {

    private static final Logger LOG = LoggerFactory.getLogger(Normalizer.class);

    public static void normalizeToUnitRange(double[] data, boolean[] mask, double theoreticalMax) {
        normalizeToUnitRange(data, mask, theoreticalMax, 0);
    }

    public static void normalizeToUnitRange(double[] data, boolean[] mask, double theoreticalMax, double theoreticalMin) {
        LOG.debug("Normalizing equalized data from [{}, {}] to the 0 to 1 range", theoreticalMin, theoreticalMax);
        double range = theoreticalMax - theoreticalMin;
        for (int i = 0; i < data.length; i++) {
            if (mask[i]) {
                data[i] = (data[i] - theoreticalMin) / range;
            }
        }
    }

    public static <T extends RealType<T>, M extends BooleanType<M>> void normalizeToUnitRange(RandomAccessibleInterval<T> data,
                                                                                            RandomAccessibleInterval<M> mask,
                                                                                            double theoreticalMax,
                                                                                            double theoreticalMin) {
        ImageAccessUtils.checkSameShape(data, mask, "Mask");
        LOG.debug("Normalizing image values from [{}, {}] to the 0 to 1 range", theoreticalMin, theoreticalMax);
        double range = theoreticalMax - theoreticalMin;
        Cursor<T> dataCursor = Views.flatIterable(data).cursor();
        Cursor<M> maskCursor = Views.flatIterable(mask).cursor();
        while (dataCursor.hasNext()) {
            T pixel = dataCursor.next();
            if (maskCursor.next().get()) {
                pixel.setReal((pixel.getRealDouble() - theoreticalMin) / range);
            }
        }
    }
}
