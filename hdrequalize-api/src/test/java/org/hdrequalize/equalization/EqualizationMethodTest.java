package org.hdrequalize.equalization;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertTrue;

public class EqualizationMethodTest {

    @Test
    public void methodNamesAreCaseInsensitive() {
        assertEquals(EqualizationMethod.GLOBAL, EqualizationMethod.fromName("global"));
        assertEquals(EqualizationMethod.ADAPTIVE, EqualizationMethod.fromName(" Adaptive "));
        assertEquals(EqualizationMethod.ADAPTIVE, EqualizationMethod.fromName("ADAPTIVE"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void unknownMethodName() {
        EqualizationMethod.fromName("clahe");
    }

    @Test
    public void createEqualizers() {
        EqualizationParams params = new EqualizationParams().setNumberOfBins(16);
        ExecutorService executorService = Executors.newSingleThreadExecutor();
        try {
            assertTrue(EqualizationMethod.GLOBAL.createEqualizer(params, executorService) instanceof GlobalEqualizer);
            assertTrue(EqualizationMethod.ADAPTIVE.createEqualizer(params, executorService) instanceof AdaptiveEqualizer);
            assertTrue(EqualizationMethod.ADAPTIVE.createEqualizer(params, null) instanceof AdaptiveEqualizer);
        } finally {
            executorService.shutdownNow();
        }
    }

    @Test
    public void equalizerKeepsItsOwnCopyOfTheParams() {
        EqualizationParams params = new EqualizationParams().setNumberOfBins(16);
        Equalizer equalizer = EqualizationMethod.GLOBAL.createEqualizer(params, null);

        params.setNumberOfBins(32);

        assertEquals(16, equalizer.getParams().getNumberOfBins());
        assertNotSame(params, equalizer.getParams());
    }

    @Test
    public void invalidParamsAreRejected() {
        EqualizationParams[] invalidParams = new EqualizationParams[] {
                new EqualizationParams().setNumberOfBins(0),
                new EqualizationParams().setLocalRadiusPx(-1),
                new EqualizationParams().setLocalRadiusPx(EqualizationParams.MAX_LOCAL_RADIUS_PX + 1),
                new EqualizationParams().setStdMultCutoff(0.0),
                new EqualizationParams().setClipLimit(-1.0),
                new EqualizationParams().setSlopeLimit(Double.NaN),
                new EqualizationParams().setLogOffset(Double.POSITIVE_INFINITY)
        };
        for (EqualizationParams params : invalidParams) {
            for (EqualizationMethod method : EqualizationMethod.values()) {
                try {
                    method.createEqualizer(params, null);
                    throw new AssertionError("Expected " + params + " to be rejected by " + method);
                } catch (IllegalArgumentException expected) {
                    // invalid
                }
            }
        }
    }
}
