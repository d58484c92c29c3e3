package com.tarterware.peakfinder.components;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.linearref.LengthIndexedLine;

import com.tarterware.peakfinder.utilities.SignalUtilities;
import com.tarterware.peakfinder.utilities.TopologyUtilities;

import lombok.Getter;

/**
 * Uniform one-dimensional coordinate system along one line segment.
 *
 * <p>
 * The raw vertices of a survey line are irregularly spaced. This class measures
 * the cumulative arc length of the raw vertices and defines a regular grid of
 * locations, {@code sampling} apart, from the start of the line to its end.
 * Channel values are interpolated onto that grid by
 * {@link #resampleValues(double[])}, then optionally smoothed with a running
 * mean.
 * </p>
 *
 * <p>
 * The geometry is held as a JTS {@link LengthIndexedLine}, so the planar
 * coordinate of any resampled location is extracted by length along the line.
 * </p>
 *
 * <p>
 * A line with fewer than two raw vertices, or with zero length, is not
 * {@link #isValid() valid}: its resampled arrays are empty and callers are
 * expected to skip it.
 * </p>
 *
 * <p>
 * Instances are immutable once constructed.
 * </p>
 *
 * @see LengthIndexedLine
 */
public class LinePosition
{
    private static final double GRID_TOLERANCE = 1e-9;

    // Arc length at each raw vertex.
    private final double[] locations;

    // Regular grid of arc lengths, sampling apart.
    private final double[] locationsResampled;

    // Planar coordinates at each resampled location.
    private final double[] xResampled;
    private final double[] yResampled;

    @Getter
    private final double sampling;

    @Getter
    private final int smoothing;

    @Getter
    private final boolean residual;

    @Getter
    private final boolean valid;

    private final LengthIndexedLine lengthIndexedLine;

    /**
     * Build the resampled coordinate system of a line.
     *
     * @param x         Easting of each raw vertex, in line order.
     * @param y         Northing of each raw vertex.
     * @param sampling  Resampling interval; when null the mean spacing of the
     *                  raw vertices is used.
     * @param smoothing Running mean window in resampled samples; 0 disables
     *                  smoothing.
     * @param residual  When set, {@link #resampleValues(double[])} returns the
     *                  raw values minus their running mean.
     * @throws IllegalArgumentException if sampling is not positive or smoothing
     *                                  is negative.
     */
    public LinePosition(double[] x, double[] y, Double sampling, int smoothing, boolean residual)
    {
        if (sampling != null && !(sampling > 0.0))
        {
            throw new IllegalArgumentException("sampling must be > 0: " + sampling);
        }
        if (smoothing < 0)
        {
            throw new IllegalArgumentException("smoothing must be >= 0: " + smoothing);
        }

        Coordinate[] coordinates = TopologyUtilities.toCoordinates(x, y);
        this.smoothing = smoothing;
        this.residual = residual;
        this.locations = TopologyUtilities.getCumulativeDistances(coordinates);

        double length = locations.length > 0 ? locations[locations.length - 1] : 0.0;
        if (coordinates.length < 2 || !(length > 0.0))
        {
            this.valid = false;
            this.sampling = sampling == null ? 0.0 : sampling;
            this.lengthIndexedLine = null;
            this.locationsResampled = new double[0];
            this.xResampled = new double[0];
            this.yResampled = new double[0];
            return;
        }

        this.valid = true;
        this.sampling = (sampling != null) ? sampling : length / (coordinates.length - 1);

        LineString lineString = TopologyUtilities.createLineString(coordinates);
        this.lengthIndexedLine = new LengthIndexedLine(lineString);

        // Keep the end of the line when it falls on the grid.
        int count = (int) Math.floor(length / this.sampling + GRID_TOLERANCE) + 1;
        this.locationsResampled = new double[count];
        this.xResampled = new double[count];
        this.yResampled = new double[count];
        for (int i = 0; i < count; ++i)
        {
            locationsResampled[i] = i * this.sampling;
            Coordinate point = lengthIndexedLine.extractPoint(locationsResampled[i]);
            xResampled[i] = point.x;
            yResampled[i] = point.y;
        }
    }

    /**
     * Build a line position without smoothing.
     *
     * @param x        Easting of each raw vertex.
     * @param y        Northing of each raw vertex.
     * @param sampling Resampling interval, or null for the mean raw spacing.
     */
    public LinePosition(double[] x, double[] y, Double sampling)
    {
        this(x, y, sampling, 0, false);
    }

    /**
     * Arc length of each raw vertex from the start of the line.
     *
     * @return Copy of the raw locations.
     */
    public double[] getLocations()
    {
        return locations.clone();
    }

    /**
     * Regular grid of arc lengths, {@link #getSampling()} apart.
     *
     * @return Copy of the resampled locations; empty for an invalid line.
     */
    public double[] getLocationsResampled()
    {
        return locationsResampled.clone();
    }

    /**
     * Arc length of one resampled sample.
     *
     * @param index Resampled index.
     * @return Distance from the start of the line.
     */
    public double getLocation(int index)
    {
        return locationsResampled[index];
    }

    /**
     * Number of resampled samples.
     *
     * @return Sample count; 0 for an invalid line.
     */
    public int getResampledCount()
    {
        return locationsResampled.length;
    }

    /**
     * Easting at each resampled location.
     *
     * @return Copy of the resampled x coordinates.
     */
    public double[] getXResampled()
    {
        return xResampled.clone();
    }

    /**
     * Northing at each resampled location.
     *
     * @return Copy of the resampled y coordinates.
     */
    public double[] getYResampled()
    {
        return yResampled.clone();
    }

    /**
     * Planar coordinate of one resampled sample.
     *
     * @param index Resampled index.
     * @return Coordinate on the line.
     */
    public Coordinate getCoordinate(int index)
    {
        return new Coordinate(xResampled[index], yResampled[index]);
    }

    /**
     * Total arc length of the line.
     *
     * @return Length, 0 for an invalid line.
     */
    public double getLength()
    {
        return lengthIndexedLine == null ? 0.0 : lengthIndexedLine.getEndIndex();
    }

    /**
     * Interpolate one channel's raw values onto the resampled grid.
     *
     * @param values One value per raw vertex.
     * @return The smoothed values (or residual when configured) and the
     *         unsmoothed resampled values.
     * @throws IllegalArgumentException if values does not have one entry per raw
     *                                  vertex.
     */
    public ResampledValues resampleValues(double[] values)
    {
        if (values == null || values.length != locations.length)
        {
            throw new IllegalArgumentException("Expected " + locations.length + " values, got "
                    + (values == null ? "null" : String.valueOf(values.length)));
        }
        if (!valid)
        {
            return new ResampledValues(new double[0], new double[0]);
        }

        double[] raw = SignalUtilities.interpolate(locations, values, locationsResampled);
        double[] smoothed = raw;
        if (smoothing > 0)
        {
            double[] mean = SignalUtilities.runningMean(raw, smoothing);
            if (residual)
            {
                smoothed = new double[raw.length];
                for (int i = 0; i < raw.length; ++i)
                {
                    smoothed[i] = raw[i] - mean[i];
                }
            }
            else
            {
                smoothed = mean;
            }
        }
        return new ResampledValues(smoothed, raw.clone());
    }

    /**
     * Bearing of the line's overall direction, from its first to its last
     * resampled point.
     *
     * @return Degrees clockwise from north in [0, 360); NaN for an invalid line.
     */
    public double computeAzimuth()
    {
        if (!valid)
        {
            return Double.NaN;
        }
        Coordinate first = lengthIndexedLine.extractPoint(lengthIndexedLine.getStartIndex());
        Coordinate last = lengthIndexedLine.extractPoint(lengthIndexedLine.getEndIndex());
        return TopologyUtilities.getBearing(first, last);
    }

    /**
     * Bearing of the line at each resampled sample, taken from that sample to
     * the next one (the last sample reuses the previous direction).
     *
     * @return One bearing per resampled sample, degrees in [0, 360).
     */
    public double[] computeLocalAzimuth()
    {
        int n = locationsResampled.length;
        double[] azimuth = new double[n];
        if (n == 0)
        {
            return azimuth;
        }
        if (n == 1)
        {
            azimuth[0] = computeAzimuth();
            return azimuth;
        }

        for (int i = 0; i < n - 1; ++i)
        {
            azimuth[i] = TopologyUtilities.getBearing(getCoordinate(i), getCoordinate(i + 1));
        }
        azimuth[n - 1] = azimuth[n - 2];
        return azimuth;
    }

    /**
     * Nearest resampled sample of a raw vertex.
     *
     * @param rawIndex Raw vertex index.
     * @return Resampled index, or -1 for an invalid line.
     */
    public int rawToResampledIndex(int rawIndex)
    {
        if (!valid)
        {
            return -1;
        }
        int index = (int) Math.round(locations[rawIndex] / sampling);
        return Math.max(0, Math.min(locationsResampled.length - 1, index));
    }

    /**
     * Nearest raw vertex of a resampled sample, measured along the line.
     *
     * @param resampledIndex Resampled index.
     * @return Raw vertex index, or -1 for an invalid line.
     */
    public int resampledToRawIndex(int resampledIndex)
    {
        if (!valid)
        {
            return -1;
        }
        double location = locationsResampled[resampledIndex];
        int upper = SignalUtilities.lowerBound(locations, location);
        if (upper >= locations.length)
        {
            return locations.length - 1;
        }
        if (upper == 0)
        {
            return 0;
        }
        return (location - locations[upper - 1] <= locations[upper] - location) ? upper - 1 : upper;
    }
}
