package com.tarterware.peakfinder.utilities;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;

public class TopologyUtilities
{
    public static double DEGREES_PER_CIRCLE = 360.0;

    private static final GeometryFactory geometryFactory = new GeometryFactory();

    /**
     * Create the planar coordinates of a line from its separate x and y arrays.
     *
     * @param x Easting of each vertex.
     * @param y Northing of each vertex.
     * @return One Coordinate per vertex.
     */
    static public Coordinate[] toCoordinates(double[] x, double[] y)
    {
        if (x == null || y == null)
        {
            throw new IllegalArgumentException("x and y cannot be null!");
        }
        if (x.length != y.length)
        {
            throw new IllegalArgumentException(
                    "x and y must have the same length: " + x.length + " != " + y.length);
        }

        Coordinate[] coordinates = new Coordinate[x.length];
        for (int i = 0; i < x.length; ++i)
        {
            coordinates[i] = new Coordinate(x[i], y[i]);
        }
        return coordinates;
    }

    /**
     * Create a JTS LineString through the given coordinates.
     *
     * @param coordinates At least two coordinates.
     * @return LineString through the coordinates.
     */
    static public LineString createLineString(Coordinate[] coordinates)
    {
        if (coordinates == null || coordinates.length < 2)
        {
            throw new IllegalArgumentException("A line needs at least two coordinates!");
        }
        return geometryFactory.createLineString(coordinates);
    }

    /**
     * Get the arc length from the first coordinate to each coordinate.
     *
     * @param coordinates Ordered vertices of the line.
     * @return Cumulative distance at each vertex, starting at 0.
     */
    static public double[] getCumulativeDistances(Coordinate[] coordinates)
    {
        double[] distances = new double[coordinates.length];
        for (int i = 1; i < coordinates.length; ++i)
        {
            distances[i] = distances[i - 1] + coordinates[i - 1].distance(coordinates[i]);
        }
        return distances;
    }

    /**
     * Get the bearing, clockwise from grid north, of the direction from one
     * coordinate to another.
     *
     * @param from Start coordinate.
     * @param to   End coordinate.
     * @return Bearing in degrees, in [0, 360). East is 90.
     */
    static public double getBearing(Coordinate from, Coordinate to)
    {
        double dx = to.x - from.x;
        double dy = to.y - from.y;
        return normalizeDegrees(90.0 - Math.toDegrees(Math.atan2(dy, dx)));
    }

    /**
     * Wrap an angle in degrees into [0, 360).
     *
     * @param degrees Any angle.
     * @return Equivalent angle in [0, 360).
     */
    static public double normalizeDegrees(double degrees)
    {
        double normalized = degrees % DEGREES_PER_CIRCLE;
        if (normalized < 0.0)
        {
            normalized += DEGREES_PER_CIRCLE;
        }
        // -1e-15 % 360 + 360 rounds to 360
        if (normalized >= DEGREES_PER_CIRCLE)
        {
            normalized = 0.0;
        }
        return normalized;
    }

    /**
     * Average a set of bearings on the circle, so that 350 and 10 average to 0
     * rather than 180.
     *
     * @param degBearings Bearings in degrees.
     * @return Mean bearing in [0, 360), or NaN when there are no bearings.
     */
    static public double getMeanBearing(double[] degBearings)
    {
        if (degBearings == null || degBearings.length == 0)
        {
            return Double.NaN;
        }

        double sumSin = 0.0;
        double sumCos = 0.0;
        for (double degBearing : degBearings)
        {
            double radBearing = Math.toRadians(degBearing);
            sumSin += Math.sin(radBearing);
            sumCos += Math.cos(radBearing);
        }
        return normalizeDegrees(Math.toDegrees(Math.atan2(sumSin, sumCos)));
    }
}
