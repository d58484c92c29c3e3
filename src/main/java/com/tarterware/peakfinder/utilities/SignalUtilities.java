package com.tarterware.peakfinder.utilities;

import java.util.Arrays;

/**
 * Numeric helpers for one-dimensional signals sampled along a line.
 */
public class SignalUtilities
{
    /**
     * Piecewise-linear interpolation of {@code fp(xp)} at each of {@code x}.
     * Values outside the range of {@code xp} are clamped to the end values.
     *
     * @param xp Non-decreasing sample locations.
     * @param fp Sample values, same length as {@code xp}.
     * @param x  Locations to interpolate at.
     * @return Interpolated values, one per entry of {@code x}.
     */
    public static double[] interpolate(double[] xp, double[] fp, double[] x)
    {
        if (xp.length != fp.length)
        {
            throw new IllegalArgumentException(
                    "Sample locations and values differ in length: " + xp.length + " != " + fp.length);
        }
        if (xp.length == 0)
        {
            throw new IllegalArgumentException("Cannot interpolate without samples!");
        }

        int last = xp.length - 1;
        double[] result = new double[x.length];
        for (int i = 0; i < x.length; ++i)
        {
            double location = x[i];
            if (location <= xp[0])
            {
                result[i] = fp[0];
                continue;
            }
            if (location >= xp[last])
            {
                result[i] = fp[last];
                continue;
            }

            // xp[upper] > location >= xp[upper - 1], so the interval has width.
            int upper = upperBound(xp, location);
            int lower = upper - 1;
            double fraction = (location - xp[lower]) / (xp[upper] - xp[lower]);
            result[i] = fp[lower] + fraction * (fp[upper] - fp[lower]);
        }
        return result;
    }

    /**
     * Index of the first entry strictly greater than {@code value}.
     *
     * @param sorted Non-decreasing array.
     * @param value  Search value.
     * @return Insertion point after any equal entries.
     */
    public static int upperBound(double[] sorted, double value)
    {
        int low = 0;
        int high = sorted.length;
        while (low < high)
        {
            int mid = (low + high) >>> 1;
            if (sorted[mid] <= value)
            {
                low = mid + 1;
            }
            else
            {
                high = mid;
            }
        }
        return low;
    }

    /**
     * Index of the first entry greater than or equal to {@code value}.
     *
     * @param sorted Non-decreasing array.
     * @param value  Search value.
     * @return Insertion point before any equal entries.
     */
    public static int lowerBound(double[] sorted, double value)
    {
        int low = 0;
        int high = sorted.length;
        while (low < high)
        {
            int mid = (low + high) >>> 1;
            if (sorted[mid] < value)
            {
                low = mid + 1;
            }
            else
            {
                high = mid;
            }
        }
        return low;
    }

    /**
     * Centered moving average over {@code width} samples. The window is clipped
     * at both ends of the signal, so edge samples average fewer values.
     *
     * @param values Signal to smooth.
     * @param width  Window size in samples. Widths of 0 or 1 leave the signal
     *               unchanged.
     * @return Smoothed copy of the signal.
     */
    public static double[] runningMean(double[] values, int width)
    {
        if (width < 0)
        {
            throw new IllegalArgumentException("Smoothing width cannot be negative: " + width);
        }
        if (width <= 1)
        {
            return Arrays.copyOf(values, values.length);
        }

        int n = values.length;
        int half = width / 2;

        // Summed per window; running totals lose the small tail values.
        double[] smoothed = new double[n];
        for (int i = 0; i < n; ++i)
        {
            int a = Math.max(0, i - half);
            int b = Math.min(n - 1, i - half + width - 1);
            double sum = 0.0;
            for (int k = a; k <= b; ++k)
            {
                sum += values[k];
            }
            smoothed[i] = sum / (b - a + 1);
        }
        return smoothed;
    }

    /**
     * Discrete second difference, {@code v[i-1] - 2 v[i] + v[i+1]}. The end
     * samples copy their nearest interior neighbour.
     *
     * @param values Signal, at least three samples long.
     * @return Curvature estimate per sample.
     */
    public static double[] secondDifference(double[] values)
    {
        int n = values.length;
        double[] curvature = new double[n];
        if (n < 3)
        {
            return curvature;
        }
        for (int i = 1; i < n - 1; ++i)
        {
            curvature[i] = values[i - 1] - 2.0 * values[i] + values[i + 1];
        }
        curvature[0] = curvature[1];
        curvature[n - 1] = curvature[n - 2];
        return curvature;
    }

    /**
     * Multiply every sample by -1 when {@code flip} is set.
     *
     * @param values Signal.
     * @param flip   Whether to invert the sign.
     * @return A new array, flipped or copied.
     */
    public static double[] applySign(double[] values, boolean flip)
    {
        double[] result = new double[values.length];
        double sign = flip ? -1.0 : 1.0;
        for (int i = 0; i < values.length; ++i)
        {
            result[i] = sign * values[i];
        }
        return result;
    }

    /**
     * Gather the entries of {@code values} at the given indices.
     *
     * @param values  Source array.
     * @param indices Positions to take, in output order.
     * @return The selected values.
     */
    public static double[] select(double[] values, int[] indices)
    {
        double[] result = new double[indices.length];
        for (int i = 0; i < indices.length; ++i)
        {
            result[i] = values[indices[i]];
        }
        return result;
    }
}
