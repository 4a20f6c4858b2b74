package org.hdrequalize.equalization;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.type.BooleanType;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.DoubleType;

/**
 * Histogram equalization of the pixels of a 2-D image selected by a mask. Dimension 0 of the image is the column
 * and dimension 1 is the row. The input image is never modified.
 */
public interface Equalizer {

    EqualizationParams getParams();

    /**
     * Equalize the selected pixels using only the selected pixels for statistics.
     *
     * @return a copy of the data in which the pixels selected by maskToEqualize are equalized
     */
    default <T extends RealType<T>, M extends BooleanType<M>> Img<DoubleType> equalize(RandomAccessibleInterval<T> data,
                                                                                       RandomAccessibleInterval<M> maskToEqualize) {
        return equalize(data, maskToEqualize, maskToEqualize);
    }

    /**
     * @param data           image values
     * @param maskToEqualize pixels that must be replaced with their equalized value
     * @param validDataMask  pixels usable for computing the equalization statistics
     * @return a copy of the data in which the pixels selected by maskToEqualize are equalized
     */
    <T extends RealType<T>, M extends BooleanType<M>, V extends BooleanType<V>> Img<DoubleType> equalize(RandomAccessibleInterval<T> data,
                                                                                                         RandomAccessibleInterval<M> maskToEqualize,
                                                                                                         RandomAccessibleInterval<V> validDataMask);

    /**
     * Write the equalized values in the output image. Output pixels outside maskToEqualize are left unchanged.
     */
    <T extends RealType<T>, M extends BooleanType<M>, V extends BooleanType<V>, O extends RealType<O>> void equalize(RandomAccessibleInterval<T> data,
                                                                                                                     RandomAccessibleInterval<M> maskToEqualize,
                                                                                                                     RandomAccessibleInterval<V> validDataMask,
                                                                                                                     RandomAccessibleInterval<O> out);
}
