package com.tarterware.peakfinder.components;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * One channel's values on the resampled grid of a {@link LinePosition}.
 */
@Getter
@AllArgsConstructor
public class ResampledValues
{
    // Values used for detection: smoothed, or the residual when configured.
    private final double[] values;

    // Interpolated values before smoothing.
    private final double[] rawValues;
}
