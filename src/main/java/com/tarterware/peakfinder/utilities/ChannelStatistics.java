package com.tarterware.peakfinder.utilities;

import java.util.Arrays;

/**
 * Summary statistics (count, mean, standard deviation, min, max and
 * percentiles) of one channel's values. NaN samples are ignored.
 */
public class ChannelStatistics
{
    // Finite samples in ascending order
    private final double[] sorted;

    private double mean = 0.0;

    // Sample variance
    private double variance = 0.0;

    /**
     * Constructs the statistics of the given values.
     *
     * @param values the channel values; may contain NaN
     * @throws IllegalArgumentException if values is null
     */
    public ChannelStatistics(double[] values)
    {
        if (values == null)
        {
            throw new IllegalArgumentException("Values cannot be null");
        }

        this.sorted = Arrays.stream(values).filter(v -> !Double.isNaN(v)).sorted().toArray();

        recalcAll();
    }

    /**
     * Recalculates mean and variance from the current samples.
     */
    private void recalcAll()
    {
        double sum = 0.0;
        double sumSq = 0.0;
        int n = sorted.length;

        for (double v : sorted)
        {
            sum += v;
            sumSq += v * v;
        }

        mean = (n > 0) ? sum / n : 0.0;

        if (n > 1)
        {
            variance = Math.max(0.0, (sumSq - n * mean * mean) / (n - 1));
        }
        else
        {
            variance = 0.0;
        }
    }

    /**
     * Returns the average of the values.
     *
     * @return the mean value, or 0 if there are no values
     */
    public double getMean()
    {
        return mean;
    }

    /**
     * Returns the standard deviation of the values.
     *
     * @return the standard deviation, or 0 if fewer than two values exist
     */
    public double getStandardDeviation()
    {
        return Math.sqrt(variance);
    }

    /**
     * Returns the minimum value.
     *
     * @return the minimum value, or NaN if there are no values
     */
    public double getMin()
    {
        return sorted.length > 0 ? sorted[0] : Double.NaN;
    }

    /**
     * Returns the maximum value.
     *
     * @return the maximum value, or NaN if there are no values
     */
    public double getMax()
    {
        return sorted.length > 0 ? sorted[sorted.length - 1] : Double.NaN;
    }

    /**
     * Returns the dynamic range, max - min.
     *
     * @return the range, or 0 if there are no values
     */
    public double getRange()
    {
        return sorted.length > 0 ? getMax() - getMin() : 0.0;
    }

    /**
     * Returns the number of (non-NaN) values.
     *
     * @return the number of values
     */
    public int getCount()
    {
        return sorted.length;
    }

    /**
     * Returns the percentile of the values, linearly interpolated between the
     * closest ranks.
     *
     * @param percent percentile in [0, 100]
     * @return the percentile, or NaN if there are no values
     * @throws IllegalArgumentException if percent is outside [0, 100]
     */
    public double getPercentile(double percent)
    {
        if (percent < 0.0 || percent > 100.0)
        {
            throw new IllegalArgumentException("Percentile must be within [0, 100]: " + percent);
        }
        if (sorted.length == 0)
        {
            return Double.NaN;
        }

        double position = percent / 100.0 * (sorted.length - 1);
        int lo = (int) Math.floor(position);
        int hi = (int) Math.ceil(position);
        if (lo == hi)
        {
            return sorted[lo];
        }
        double t = position - lo;
        return sorted[lo] * (1.0 - t) + sorted[hi] * t;
    }
}
