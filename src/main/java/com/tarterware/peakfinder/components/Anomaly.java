package com.tarterware.peakfinder.components;

import lombok.Getter;
import lombok.ToString;

/**
 * One peak-shaped feature detected on one channel. All positions are indices
 * into the resampled grid of the owning {@link LineData}'s
 * {@link LinePosition}, ordered
 * {@code start <= inflectUp <= peak <= inflectDown <= end}.
 */
@Getter
@ToString(exclude = "parent")
public class Anomaly
{
    // Channel the anomaly was detected on. Lookup only.
    private final LineData parent;

    private final int start;

    private final int end;

    private final int peak;

    private final int inflectUp;

    private final int inflectDown;

    // Height of the peak above the higher of its two bounding lows.
    private final double amplitude;

    public Anomaly(LineData parent, int start, int end, int peak, int inflectUp, int inflectDown, double amplitude)
    {
        if (parent == null)
        {
            throw new IllegalArgumentException("An anomaly needs its channel!");
        }
        if (!(start <= inflectUp && inflectUp <= peak && peak <= inflectDown && inflectDown <= end))
        {
            throw new IllegalArgumentException("Anomaly indices out of order: start=" + start + ", inflectUp="
                    + inflectUp + ", peak=" + peak + ", inflectDown=" + inflectDown + ", end=" + end);
        }

        this.parent = parent;
        this.start = start;
        this.end = end;
        this.peak = peak;
        this.inflectUp = inflectUp;
        this.inflectDown = inflectDown;
        this.amplitude = amplitude;
    }

    /**
     * Identifier of this anomaly that is stable across runs: the channel id and
     * the peak index.
     *
     * @return {@code channelId@peak}
     */
    public String getIdentifier()
    {
        return parent.getChannelId() + "@" + peak;
    }

    /**
     * Detection value at the peak.
     *
     * @return The channel's resampled (smoothed) value at the peak index.
     */
    public double getPeakValue()
    {
        return parent.getValueAt(peak);
    }
}
