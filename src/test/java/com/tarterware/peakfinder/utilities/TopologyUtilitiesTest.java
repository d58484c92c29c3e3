package com.tarterware.peakfinder.utilities;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;

class TopologyUtilitiesTest
{
    @Test
    void testBearingIsClockwiseFromNorth()
    {
        Coordinate origin = new Coordinate(0.0, 0.0);

        assertEquals(0.0, TopologyUtilities.getBearing(origin, new Coordinate(0.0, 1.0)), 1e-9);
        assertEquals(90.0, TopologyUtilities.getBearing(origin, new Coordinate(1.0, 0.0)), 1e-9);
        assertEquals(180.0, TopologyUtilities.getBearing(origin, new Coordinate(0.0, -1.0)), 1e-9);
        assertEquals(270.0, TopologyUtilities.getBearing(origin, new Coordinate(-1.0, 0.0)), 1e-9);
        assertEquals(45.0, TopologyUtilities.getBearing(origin, new Coordinate(1.0, 1.0)), 1e-9);
    }

    @Test
    void testNormalizeDegrees()
    {
        assertEquals(350.0, TopologyUtilities.normalizeDegrees(-10.0), 1e-9);
        assertEquals(10.0, TopologyUtilities.normalizeDegrees(370.0), 1e-9);
        assertEquals(0.0, TopologyUtilities.normalizeDegrees(360.0), 1e-9);
    }

    @Test
    void testMeanBearingWrapsAroundNorth()
    {
        double mean = TopologyUtilities.getMeanBearing(new double[] { 350.0, 10.0 });
        assertTrue(mean < 1e-9 || mean > 360.0 - 1e-9);

        assertEquals(90.0, TopologyUtilities.getMeanBearing(new double[] { 80.0, 100.0 }), 1e-9);
        assertTrue(Double.isNaN(TopologyUtilities.getMeanBearing(new double[0])));
    }

    @Test
    void testCumulativeDistances()
    {
        Coordinate[] coordinates = TopologyUtilities.toCoordinates(new double[] { 0.0, 3.0, 3.0 },
                new double[] { 0.0, 4.0, 10.0 });

        assertArrayEquals(new double[] { 0.0, 5.0, 11.0 }, TopologyUtilities.getCumulativeDistances(coordinates),
                1e-12);
    }

    @Test
    void testInvalidInput()
    {
        assertThrows(IllegalArgumentException.class,
                () -> TopologyUtilities.toCoordinates(new double[] { 0.0 }, new double[] { 0.0, 1.0 }));
        assertThrows(IllegalArgumentException.class,
                () -> TopologyUtilities.createLineString(new Coordinate[] { new Coordinate(0.0, 0.0) }));
    }
}
