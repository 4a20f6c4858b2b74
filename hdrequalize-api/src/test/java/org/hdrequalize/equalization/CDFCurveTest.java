package org.hdrequalize.equalization;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class CDFCurveTest {

    private final CDFCurve curve = new CDFCurve(new double[] {0, 1, 3, 3}, new double[] {0, 1, 2, 3, 4});

    @Test
    public void mapInterpolatesBetweenLowerBinEdges() {
        assertEquals(0.5, curve.map(0.5), 1e-12);
        assertEquals(1, curve.map(1), 1e-12);
        assertEquals(2, curve.map(1.5), 1e-12);
        assertEquals(3, curve.map(2.5), 1e-12);
    }

    @Test
    public void mapClampsOutsideValues() {
        assertEquals(0, curve.map(-10), 0);
        assertEquals(0, curve.map(Double.NEGATIVE_INFINITY), 0);
        assertEquals(3, curve.map(3), 0);
        assertEquals(3, curve.map(3.9), 0);
        assertEquals(3, curve.map(1e9), 0);
    }

    @Test
    public void mapNaN() {
        assertTrue(Double.isNaN(curve.map(Double.NaN)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void edgesMustMatchBins() {
        new CDFCurve(new double[] {0, 1}, new double[] {0, 1});
    }
}
