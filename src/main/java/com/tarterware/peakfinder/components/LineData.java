package com.tarterware.peakfinder.components;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tarterware.peakfinder.utilities.ChannelStatistics;
import com.tarterware.peakfinder.utilities.SignalUtilities;

import lombok.Getter;

/**
 * Values of one channel along one line segment, and the anomalies detected on
 * them.
 *
 * <p>
 * The raw values are resampled onto the grid of the shared
 * {@link LinePosition} the first time they are needed. Peak detection runs on
 * the smoothed resampled values:
 * <ol>
 * <li>Scan for local maxima: a strict rise followed by a fall. A flat top uses
 * its middle sample as the peak.</li>
 * <li>Walk outward from the peak while the signal keeps descending to find
 * {@code start} and {@code end}. The walk stops at a local minimum, at the
 * first sample at or below zero (for a positive peak), or at the end of the
 * previous anomaly.</li>
 * <li>Walk outward from the peak while the curvature stays negative to find the
 * inflection points.</li>
 * <li>Keep the candidate only if its amplitude, as a percent of the channel's
 * dynamic range, reaches {@code minAmplitude}, its peak value reaches
 * {@code minValue} and its width reaches {@code minWidth}.</li>
 * </ol>
 * Scanning resumes after {@code end}, so anomalies of one channel never
 * overlap.
 * </p>
 *
 * <p>
 * Results are computed once and cached. Instances are not safe for concurrent
 * first access.
 * </p>
 */
public class LineData
{
    @Getter
    private final LinePosition position;

    @Getter
    private final String channelId;

    @Getter
    private final String channelName;

    // One value per raw vertex of the line, sign already applied.
    private final double[] values;

    @Getter
    private final double minAmplitude;

    @Getter
    private final double minValue;

    @Getter
    private final double minWidth;

    private ResampledValues resampledValues;

    private List<Anomaly> anomalies;

    private static final Logger logger = LoggerFactory.getLogger(LineData.class);

    /**
     * @param position     Resampled geometry of the line segment.
     * @param channelId    Channel identifier.
     * @param channelName  Display name of the channel.
     * @param values       Channel value at each raw vertex of the segment.
     * @param minAmplitude Minimum amplitude, percent of the dynamic range.
     * @param minValue     Minimum value at the peak.
     * @param minWidth     Minimum distance from start to end.
     */
    public LineData(LinePosition position, String channelId, String channelName, double[] values,
            double minAmplitude, double minValue, double minWidth)
    {
        if (position == null)
        {
            throw new IllegalArgumentException("position cannot be null!");
        }
        if (values == null)
        {
            throw new IllegalArgumentException("values cannot be null for channel " + channelId);
        }
        if (!(minAmplitude >= 0.0 && minAmplitude <= 100.0))
        {
            throw new IllegalArgumentException("minAmplitude must be within [0, 100]: " + minAmplitude);
        }
        if (minWidth < 0.0)
        {
            throw new IllegalArgumentException("minWidth cannot be negative: " + minWidth);
        }

        this.position = position;
        this.channelId = channelId;
        this.channelName = channelName == null ? channelId : channelName;
        this.values = values;
        this.minAmplitude = minAmplitude;
        this.minValue = minValue;
        this.minWidth = minWidth;
    }

    /**
     * Smoothed values on the resampled grid; these are the values detection
     * runs on.
     *
     * @return Resampled, smoothed values.
     */
    public double[] getValuesResampled()
    {
        return getResampledValues().getValues().clone();
    }

    /**
     * Resampled values before smoothing.
     *
     * @return Resampled raw values.
     */
    public double[] getValuesResampledRaw()
    {
        return getResampledValues().getRawValues().clone();
    }

    /**
     * Smoothed resampled value at one index.
     *
     * @param index Resampled index.
     * @return Value at that index.
     */
    public double getValueAt(int index)
    {
        return getResampledValues().getValues()[index];
    }

    /**
     * Anomalies of this channel, ordered along the line.
     *
     * @return Unmodifiable list, computed on first access.
     */
    public List<Anomaly> getAnomalies()
    {
        if (anomalies == null)
        {
            anomalies = Collections.unmodifiableList(findAnomalies());
        }
        return anomalies;
    }

    private ResampledValues getResampledValues()
    {
        if (resampledValues == null)
        {
            resampledValues = position.resampleValues(values);
        }
        return resampledValues;
    }

    private List<Anomaly> findAnomalies()
    {
        List<Anomaly> listAnomalies = new ArrayList<Anomaly>();

        double[] v = getResampledValues().getValues();
        int n = v.length;
        if (n < 3)
        {
            return listAnomalies;
        }

        double range = new ChannelStatistics(v).getRange();
        if (!(range > 0.0))
        {
            return listAnomalies;
        }

        double[] curvature = SignalUtilities.secondDifference(v);

        // First index a new anomaly may start at.
        int lowerBound = 0;
        int i = 1;
        while (i < n - 1)
        {
            if (!(v[i] > v[i - 1]))
            {
                ++i;
                continue;
            }

            // Extend over a flat top.
            int top = i;
            while (top + 1 < n && v[top + 1] == v[top])
            {
                ++top;
            }
            if (top >= n - 1 || v[top + 1] > v[top])
            {
                i = top + 1;
                continue;
            }

            int peak = (i + top) / 2;
            boolean positivePeak = v[peak] > 0.0;

            int start = i;
            while (start > lowerBound && v[start - 1] < v[start] && (!positivePeak || v[start] > 0.0))
            {
                --start;
            }

            int end = top;
            while (end < n - 1 && v[end + 1] < v[end] && (!positivePeak || v[end] > 0.0))
            {
                ++end;
            }

            int inflectUp = peak;
            while (inflectUp > start && curvature[inflectUp - 1] < 0.0)
            {
                --inflectUp;
            }

            int inflectDown = peak;
            while (inflectDown < end && curvature[inflectDown + 1] < 0.0)
            {
                ++inflectDown;
            }

            double amplitude = Math.min(v[peak] - v[start], v[peak] - v[end]);
            double percentAmplitude = amplitude / range * 100.0;
            double width = position.getLocation(end) - position.getLocation(start);

            if (percentAmplitude >= minAmplitude && v[peak] >= minValue && width >= minWidth)
            {
                listAnomalies.add(new Anomaly(this, start, end, peak, inflectUp, inflectDown, amplitude));
                lowerBound = end + 1;
            }

            i = end + 1;
        }

        logger.debug("Channel {}: {} anomalies", channelName, listAnomalies.size());
        return listAnomalies;
    }
}
