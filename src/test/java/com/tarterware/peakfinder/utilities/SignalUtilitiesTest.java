package com.tarterware.peakfinder.utilities;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class SignalUtilitiesTest
{
    @Test
    void testInterpolateClampsOutsideTheSamples()
    {
        double[] xp = { 0.0, 10.0, 20.0 };
        double[] fp = { 0.0, 10.0, 0.0 };

        double[] result = SignalUtilities.interpolate(xp, fp, new double[] { -5.0, 0.0, 5.0, 10.0, 15.0, 25.0 });

        assertArrayEquals(new double[] { 0.0, 0.0, 5.0, 10.0, 5.0, 0.0 }, result, 1e-12);
    }

    @Test
    void testInterpolateRejectsMismatchedSamples()
    {
        assertThrows(IllegalArgumentException.class,
                () -> SignalUtilities.interpolate(new double[] { 0.0, 1.0 }, new double[] { 1.0 }, new double[] { 0.5 }));
        assertThrows(IllegalArgumentException.class,
                () -> SignalUtilities.interpolate(new double[0], new double[0], new double[] { 0.5 }));
    }

    @Test
    void testBounds()
    {
        double[] sorted = { 1.0, 2.0, 2.0, 3.0 };

        assertEquals(1, SignalUtilities.lowerBound(sorted, 2.0));
        assertEquals(3, SignalUtilities.upperBound(sorted, 2.0));
        assertEquals(0, SignalUtilities.lowerBound(sorted, 0.0));
        assertEquals(4, SignalUtilities.upperBound(sorted, 5.0));
    }

    @Test
    void testRunningMeanClipsAtTheEnds()
    {
        double[] values = { 1.0, 2.0, 3.0, 4.0, 5.0 };

        // Window [i - 1, i + 1], clipped.
        assertArrayEquals(new double[] { 1.5, 2.0, 3.0, 4.0, 4.5 }, SignalUtilities.runningMean(values, 3), 1e-12);

        // Even window [i - 1, i].
        assertArrayEquals(new double[] { 1.0, 1.5, 2.5, 3.5, 4.5 }, SignalUtilities.runningMean(values, 2), 1e-12);
    }

    @Test
    void testRunningMeanNarrowWindowIsIdentity()
    {
        double[] values = { 3.0, -1.0, 7.0 };

        assertArrayEquals(values, SignalUtilities.runningMean(values, 0), 0.0);
        assertArrayEquals(values, SignalUtilities.runningMean(values, 1), 0.0);
        assertThrows(IllegalArgumentException.class, () -> SignalUtilities.runningMean(values, -1));
    }

    @Test
    void testRunningMeanKeepsConstantSignal()
    {
        double[] values = { 4.0, 4.0, 4.0, 4.0, 4.0, 4.0, 4.0 };

        assertArrayEquals(values, SignalUtilities.runningMean(values, 4), 1e-12);
    }

    @Test
    void testSecondDifference()
    {
        double[] values = { 0.0, 1.0, 4.0, 9.0, 16.0 };

        assertArrayEquals(new double[] { 2.0, 2.0, 2.0, 2.0, 2.0 }, SignalUtilities.secondDifference(values), 1e-12);
        assertArrayEquals(new double[] { 0.0, 0.0 }, SignalUtilities.secondDifference(new double[] { 1.0, 2.0 }),
                0.0);
    }

    @Test
    void testApplySignAndSelect()
    {
        double[] values = { 1.0, -2.0, 3.0 };

        assertArrayEquals(new double[] { -1.0, 2.0, -3.0 }, SignalUtilities.applySign(values, true), 0.0);
        assertArrayEquals(values, SignalUtilities.applySign(values, false), 0.0);
        assertArrayEquals(new double[] { 3.0, 1.0 }, SignalUtilities.select(values, new int[] { 2, 0 }), 0.0);
    }
}
