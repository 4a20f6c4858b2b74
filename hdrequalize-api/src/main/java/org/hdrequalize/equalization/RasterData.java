package org.hdrequalize.equalization;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.BooleanType;
import net.imglib2.type.numeric.RealType;
import org.hdrequalize.image.ImageAccessUtils;

/**
 * Row major copy of the image values and masks used by the equalizers.
 */
class RasterData {
    final int rows;
    final int cols;
    final double[] values;
    final boolean[] maskToEqualize;
    final boolean[] validDataMask;

    RasterData(int rows, int cols, double[] values, boolean[] maskToEqualize, boolean[] validDataMask) {
        if (values.length != rows * cols || maskToEqualize.length != values.length || validDataMask.length != values.length) {
            throw new IllegalArgumentException("Values and masks must have " + rows + "x" + cols + " elements");
        }
        this.rows = rows;
        this.cols = cols;
        this.values = values;
        this.maskToEqualize = maskToEqualize;
        this.validDataMask = validDataMask;
    }

    static <T extends RealType<T>, M extends BooleanType<M>, V extends BooleanType<V>> RasterData fromImages(RandomAccessibleInterval<T> data,
                                                                                                               RandomAccessibleInterval<M> maskToEqualize,
                                                                                                               RandomAccessibleInterval<V> validDataMask) {
        ImageAccessUtils.get2DSize(data);
        ImageAccessUtils.checkSameShape(data, maskToEqualize, "Mask to equalize");
        ImageAccessUtils.checkSameShape(data, validDataMask, "Valid data mask");
        return new RasterData(
                (int) data.dimension(1),
                (int) data.dimension(0),
                ImageAccessUtils.toDoubleArray(data),
                ImageAccessUtils.toBooleanArray(maskToEqualize),
                ImageAccessUtils.toBooleanArray(validDataMask)
        );
    }

    int index(int row, int col) {
        return row * cols + col;
    }

    SampleValues selectValidValues() {
        SampleValues selected = new SampleValues(values.length);
        for (int i = 0; i < values.length; i++) {
            if (validDataMask[i]) {
                selected.add(values[i]);
            }
        }
        return selected;
    }
}
