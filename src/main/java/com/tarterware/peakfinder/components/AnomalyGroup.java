package com.tarterware.peakfinder.components;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.tarterware.peakfinder.models.PropertyGroup;
import com.tarterware.peakfinder.utilities.TopologyUtilities;

import lombok.Getter;

/**
 * Anomalies of several channels of one property group attributed to one
 * physical source.
 *
 * <p>
 * A <em>base</em> group holds at most one anomaly per channel and has no
 * subgroups. A <em>composite</em> group is built by {@link #merge} from two
 * groups that share no anomaly; its anomalies, azimuths and peak values are the
 * concatenation of both operands' and its {@link #getSubgroups() subgroups} are
 * the union of their {@link #getConstituents() constituents}.
 * </p>
 *
 * <p>
 * Groups are immutable. The position and channels are shared, read-only
 * references owned by the {@link LineAnomaly} that built them.
 * </p>
 */
public class AnomalyGroup
{
    /**
     * Side of the peak the line travels toward, from the line's azimuth.
     */
    public enum Orientation
    {
        LEFT, RIGHT
    }

    @Getter
    private final LinePosition position;

    @Getter
    private final List<Anomaly> anomalies;

    @Getter
    private final PropertyGroup propertyGroup;

    // Line azimuth at each anomaly's peak.
    private final double[] fullAzimuth;

    @Getter
    private final Map<String, LineData> channels;

    // Detection value at each anomaly's peak.
    private final double[] fullPeakValues;

    // Constituent base groups; empty for a base group.
    @Getter
    private final Set<GroupKey> subgroups;

    @Getter
    private final GroupKey key;

    @Getter
    private final int lineId;

    @Getter
    private final int part;

    /**
     * Construct a base group.
     *
     * @param position       Line geometry.
     * @param anomalies      Anomalies, at most one per channel.
     * @param propertyGroup  Property group the channels belong to.
     * @param fullAzimuth    Line azimuth at each anomaly's peak.
     * @param channels       Channel id to its line data.
     * @param fullPeakValues Value at each anomaly's peak.
     * @param lineId         Line the group was found on.
     * @param part           Part of the line.
     */
    public AnomalyGroup(LinePosition position, List<Anomaly> anomalies, PropertyGroup propertyGroup,
            double[] fullAzimuth, Map<String, LineData> channels, double[] fullPeakValues, int lineId, int part)
    {
        this(position, anomalies, propertyGroup, fullAzimuth, channels, fullPeakValues, Collections.emptySet(),
                lineId, part);

        Set<String> channelIds = new HashSet<String>();
        for (Anomaly anomaly : anomalies)
        {
            if (!channelIds.add(anomaly.getParent().getChannelId()))
            {
                throw new IllegalArgumentException(
                        "Channel " + anomaly.getParent().getChannelId() + " appears twice in one group");
            }
        }
    }

    private AnomalyGroup(LinePosition position, List<Anomaly> anomalies, PropertyGroup propertyGroup,
            double[] fullAzimuth, Map<String, LineData> channels, double[] fullPeakValues, Set<GroupKey> subgroups,
            int lineId, int part)
    {
        if (anomalies == null || anomalies.isEmpty())
        {
            throw new IllegalArgumentException("An anomaly group needs at least one anomaly!");
        }
        if (fullAzimuth.length != anomalies.size() || fullPeakValues.length != anomalies.size())
        {
            throw new IllegalArgumentException("Need one azimuth and one peak value per anomaly");
        }

        this.position = position;
        this.anomalies = Collections.unmodifiableList(new ArrayList<Anomaly>(anomalies));
        this.propertyGroup = propertyGroup;
        this.fullAzimuth = fullAzimuth.clone();
        this.channels = channels;
        this.fullPeakValues = fullPeakValues.clone();
        this.subgroups = subgroups;
        this.key = new GroupKey(anomalies);
        this.lineId = lineId;
        this.part = part;
    }

    /**
     * Build the composite of two groups. The operand starting first contributes
     * its anomalies first.
     *
     * @param first  One group.
     * @param second Another group sharing no constituent or anomaly with
     *               {@code first}.
     * @return Composite group whose subgroups are the union of both operands'
     *         constituents.
     */
    public static AnomalyGroup merge(AnomalyGroup first, AnomalyGroup second)
    {
        if (first.getStart() > second.getStart())
        {
            AnomalyGroup swap = first;
            first = second;
            second = swap;
        }

        List<Anomaly> listAnomalies = new ArrayList<Anomaly>(first.anomalies);
        listAnomalies.addAll(second.anomalies);

        Set<GroupKey> union = new LinkedHashSet<GroupKey>(first.getConstituents());
        union.addAll(second.getConstituents());

        Map<String, LineData> mergedChannels = new LinkedHashMap<String, LineData>(first.channels);
        mergedChannels.putAll(second.channels);

        return new AnomalyGroup(first.position, listAnomalies, first.propertyGroup,
                concat(first.fullAzimuth, second.fullAzimuth), mergedChannels,
                concat(first.fullPeakValues, second.fullPeakValues), Collections.unmodifiableSet(union), first.lineId,
                first.part);
    }

    private static double[] concat(double[] a, double[] b)
    {
        double[] result = Arrays.copyOf(a, a.length + b.length);
        System.arraycopy(b, 0, result, a.length, b.length);
        return result;
    }

    /**
     * Whether this group was built by merging other groups.
     *
     * @return true for a composite.
     */
    public boolean isComposite()
    {
        return !subgroups.isEmpty();
    }

    /**
     * Base groups this group is made of: its subgroups, or itself for a base
     * group.
     *
     * @return Set of base group keys.
     */
    public Set<GroupKey> getConstituents()
    {
        return isComposite() ? subgroups : Collections.singleton(key);
    }

    /**
     * Whether the two groups have an anomaly in common.
     *
     * @param other Another group.
     * @return true if any anomaly identifier appears in both.
     */
    public boolean sharesAnomalyWith(AnomalyGroup other)
    {
        Set<String> ids = new HashSet<String>(key.getAnomalyIds());
        for (String id : other.key.getAnomalyIds())
        {
            if (ids.contains(id))
            {
                return true;
            }
        }
        return false;
    }

    /**
     * First resampled index covered by the group.
     *
     * @return Minimum anomaly start.
     */
    public int getStart()
    {
        return anomalies.stream().mapToInt(Anomaly::getStart).min().getAsInt();
    }

    /**
     * Last resampled index covered by the group.
     *
     * @return Maximum anomaly end.
     */
    public int getEnd()
    {
        return anomalies.stream().mapToInt(Anomaly::getEnd).max().getAsInt();
    }

    /**
     * Peak index of each anomaly, in group order.
     *
     * @return Peak indices.
     */
    public List<Integer> getPeaks()
    {
        List<Integer> peaks = new ArrayList<Integer>(anomalies.size());
        for (Anomaly anomaly : anomalies)
        {
            peaks.add(anomaly.getPeak());
        }
        return peaks;
    }

    public double[] getFullAzimuth()
    {
        return fullAzimuth.clone();
    }

    public double[] getFullPeakValues()
    {
        return fullPeakValues.clone();
    }

    /**
     * Mean line bearing over the group's peaks.
     *
     * @return Degrees in [0, 360).
     */
    public double getAzimuth()
    {
        return TopologyUtilities.getMeanBearing(fullAzimuth);
    }

    /**
     * Orientation used to draw the group's asymmetry marker.
     *
     * @return RIGHT when the azimuth is below 180 degrees, otherwise LEFT.
     */
    public Orientation getOrientation()
    {
        return getAzimuth() < 180.0 ? Orientation.RIGHT : Orientation.LEFT;
    }

    /**
     * Location along the line of the first anomaly's peak.
     *
     * @return Distance from the start of the line.
     */
    public double getPeakLocation()
    {
        return position.getLocation(anomalies.get(0).getPeak());
    }

    /**
     * Spread of the peak locations across the group's anomalies.
     *
     * @return Max minus min peak location.
     */
    public double getMigration()
    {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (Anomaly anomaly : anomalies)
        {
            double location = position.getLocation(anomaly.getPeak());
            min = Math.min(min, location);
            max = Math.max(max, location);
        }
        return max - min;
    }

    /**
     * Largest peak value of the group.
     *
     * @return Maximum of the peak values.
     */
    public double getAmplitude()
    {
        return Arrays.stream(fullPeakValues).max().getAsDouble();
    }

    /**
     * Names of the channels of each anomaly, in group order.
     *
     * @return Channel display names.
     */
    public List<String> getChannelNames()
    {
        List<String> names = new ArrayList<String>(anomalies.size());
        for (Anomaly anomaly : anomalies)
        {
            names.add(anomaly.getParent().getChannelName());
        }
        return names;
    }

    @Override
    public String toString()
    {
        return "AnomalyGroup(line=" + lineId + ", part=" + part + ", propertyGroup="
                + (propertyGroup == null ? null : propertyGroup.getName()) + ", start=" + getStart() + ", end="
                + getEnd() + ", peaks=" + getPeaks() + ", subgroups=" + subgroups.size() + ")";
    }
}
