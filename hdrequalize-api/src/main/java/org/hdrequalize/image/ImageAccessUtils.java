package org.hdrequalize.image;

import java.util.Arrays;

import net.imglib2.Cursor;
import net.imglib2.Interval;
import net.imglib2.IterableInterval;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.BooleanType;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.view.Views;

/**
 * Helpers for moving 2-D rasters between imglib2 images and flat row-major arrays.
 * Flat index of a pixel at (col, row) is {@code row * cols + col}, which is the flat iteration order
 * of a zero-min 2-D interval.
 */
public class ImageAccessUtils {

    public static long getMaxSize(long[] shape) {
        return Arrays.stream(shape).reduce(1, (a, d) -> a * d);
    }

    public static boolean sameShape(Interval ref, Interval img) {
        long[] refShape = ref.dimensionsAsLongArray();
        long[] imgShape = img.dimensionsAsLongArray();
        if (refShape.length != imgShape.length)
            return false;
        for (int d = 0; d < refShape.length; d++) {
            if (refShape[d] != imgShape[d])
                return false;
        }
        return true;
    }

    public static boolean differentShape(Interval ref, Interval img) {
        return !sameShape(ref, img);
    }

    /**
     * @throws IllegalArgumentException if img does not have the same shape as ref
     */
    public static void checkSameShape(Interval ref, Interval img, String imgName) {
        if (differentShape(ref, img)) {
            throw new IllegalArgumentException(imgName + " shape " + Arrays.toString(img.dimensionsAsLongArray()) +
                    " does not match the data shape " + Arrays.toString(ref.dimensionsAsLongArray()));
        }
    }

    /**
     * @return the number of elements of a 2-D interval as an int.
     */
    public static int get2DSize(Interval interval) {
        if (interval.numDimensions() != 2) {
            throw new IllegalArgumentException("Expected a 2-D image but found " + interval.numDimensions() + " dimensions");
        }
        long size = getMaxSize(interval.dimensionsAsLongArray());
        if (size > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Image with " + size + " pixels is too large");
        }
        return (int) size;
    }

    public static <T extends RealType<T>> double[] toDoubleArray(RandomAccessibleInterval<T> image) {
        double[] values = new double[get2DSize(image)];
        Cursor<T> cursor = Views.flatIterable(image).cursor();
        int i = 0;
        while (cursor.hasNext()) {
            values[i++] = cursor.next().getRealDouble();
        }
        return values;
    }

    public static <B extends BooleanType<B>> boolean[] toBooleanArray(RandomAccessibleInterval<B> mask) {
        boolean[] values = new boolean[get2DSize(mask)];
        Cursor<B> cursor = Views.flatIterable(mask).cursor();
        int i = 0;
        while (cursor.hasNext()) {
            values[i++] = cursor.next().get();
        }
        return values;
    }

    /**
     * Wrap a copy of the values as a cols x rows image.
     */
    public static Img<DoubleType> createDoubleImg(double[] values, long cols, long rows) {
        return ArrayImgs.doubles(Arrays.copyOf(values, values.length), cols, rows);
    }

    /**
     * Write values[i] into the i-th pixel (flat iteration order) of the target for every i selected by the mask.
     * Target pixels that are not selected are left unchanged.
     */
    public static <T extends RealType<T>> void setSelectedValues(RandomAccessibleInterval<T> target,
                                                                 double[] values,
                                                                 boolean[] selection) {
        IterableInterval<T> targetIterable = Views.flatIterable(target);
        Cursor<T> targetCursor = targetIterable.cursor();
        int i = 0;
        while (targetCursor.hasNext()) {
            T pixel = targetCursor.next();
            if (selection[i]) {
                pixel.setReal(values[i]);
            }
            i++;
        }
    }
}
