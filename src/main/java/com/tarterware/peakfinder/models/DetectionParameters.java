package com.tarterware.peakfinder.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Parameters that control resampling, per-channel peak detection, clustering
 * and merging of anomalies along a line. Distances are in the survey's planar
 * units (usually meters).
 */
@NoArgsConstructor
@AllArgsConstructor
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class DetectionParameters
{
    // Running mean window, in resampled samples. 0 disables smoothing.
    int smoothing = 6;

    // Maximum spread of colocated peak positions across channels.
    double maxMigration = 25.0;

    // Minimum number of distinct channels in an anomaly group.
    int minChannels = 1;

    // Minimum anomaly amplitude, percent of the channel's dynamic range.
    double minAmplitude = 1.0;

    // Minimum data value at the peak.
    double minValue = Double.NEGATIVE_INFINITY;

    // Minimum anomaly width from start to end.
    double minWidth = 100.0;

    // Number of consecutive groups merged into one composite group.
    int numberOfGroups = 1;

    // Maximum gap between groups merged into one composite.
    double maxSeparation = 100.0;

    // Invert the data sign before detection, to find troughs.
    boolean flipSign = false;

    // Resampling interval; the mean raw spacing is used when null.
    Double sampling;

    // Replace the smoothed signal by the residual (raw - running mean).
    boolean residual = false;

    /**
     * Copy constructor.
     *
     * @param other Parameters to copy.
     */
    public DetectionParameters(DetectionParameters other)
    {
        this(other.smoothing, other.maxMigration, other.minChannels, other.minAmplitude, other.minValue,
                other.minWidth, other.numberOfGroups, other.maxSeparation, other.flipSign, other.sampling, other.residual);
    }

    /**
     * Check every parameter against its valid range.
     *
     * @throws IllegalArgumentException naming the first parameter out of range.
     */
    public void validate()
    {
        if (smoothing < 0)
        {
            throw new IllegalArgumentException("smoothing must be >= 0: " + smoothing);
        }
        if (!(maxMigration > 0.0))
        {
            throw new IllegalArgumentException("maxMigration must be > 0: " + maxMigration);
        }
        if (minChannels < 1)
        {
            throw new IllegalArgumentException("minChannels must be >= 1: " + minChannels);
        }
        if (!(minAmplitude >= 0.0 && minAmplitude <= 100.0))
        {
            throw new IllegalArgumentException("minAmplitude must be within [0, 100] percent: " + minAmplitude);
        }
        if (Double.isNaN(minValue))
        {
            throw new IllegalArgumentException("minValue cannot be NaN");
        }
        if (!(minWidth > 0.0))
        {
            throw new IllegalArgumentException("minWidth must be > 0: " + minWidth);
        }
        if (numberOfGroups < 1)
        {
            throw new IllegalArgumentException("numberOfGroups must be >= 1: " + numberOfGroups);
        }
        if (!(maxSeparation >= 0.0))
        {
            throw new IllegalArgumentException("maxSeparation must be >= 0: " + maxSeparation);
        }
        if (sampling != null && !(sampling > 0.0))
        {
            throw new IllegalArgumentException("sampling must be > 0 when given: " + sampling);
        }
    }
}
