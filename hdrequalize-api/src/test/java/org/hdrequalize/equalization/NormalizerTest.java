package org.hdrequalize.equalization;

import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.logic.BitType;
import net.imglib2.type.numeric.real.DoubleType;
import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertTrue;

public class NormalizerTest {

    @Test
    public void normalizeSelectedValues() {
        double[] data = new double[] {0, 25, 50, 100, 7};
        boolean[] mask = new boolean[] {true, true, true, true, false};

        Normalizer.normalizeToUnitRange(data, mask, 100);

        assertArrayEquals(new double[] {0, 0.25, 0.5, 1, 7}, data, 1e-12);
    }

    @Test
    public void normalizeWithNonZeroMinimum() {
        double[] data = new double[] {10, 15, 20, 30};
        boolean[] mask = new boolean[] {true, true, true, true};

        Normalizer.normalizeToUnitRange(data, mask, 30, 10);

        assertArrayEquals(new double[] {0, 0.25, 0.5, 1}, data, 1e-12);
    }

    @Test
    public void valuesOutsideTheTheoreticalRangeAreNotClamped() {
        double[] data = new double[] {-10, 200};
        boolean[] mask = new boolean[] {true, true};

        Normalizer.normalizeToUnitRange(data, mask, 100);

        assertArrayEquals(new double[] {-0.1, 2}, data, 1e-12);
    }

    @Test
    public void normalizeImage() {
        int rows = 2;
        int cols = 3;
        Img<DoubleType> data = EqualizationTestUtils.createImage(new double[] {2, 4, 6, 8, 10, 12}, rows, cols);
        Img<BitType> mask = EqualizationTestUtils.createMask(rows, cols, (row, col) -> row == 0);

        Normalizer.normalizeToUnitRange(data, mask, 6, 2);

        assertArrayEquals(new double[] {0, 0.5, 1, 8, 10, 12}, EqualizationTestUtils.toArray(data), 1e-12);
    }

    @Test
    public void imageAndMaskMustHaveTheSameShape() {
        Img<DoubleType> data = ArrayImgs.doubles(3, 2);
        Img<BitType> mask = ArrayImgs.bits(2, 3);
        try {
            Normalizer.normalizeToUnitRange(data, mask, 1, 0);
            throw new AssertionError("Expected the normalization to fail");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().startsWith("Mask shape"));
        }
    }
}
