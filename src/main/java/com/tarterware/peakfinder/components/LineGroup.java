package com.tarterware.peakfinder.components;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tarterware.peakfinder.models.PropertyGroup;
import com.tarterware.peakfinder.utilities.SignalUtilities;

import lombok.Getter;

/**
 * Groups the anomalies of one property group's channels along one line
 * segment.
 *
 * <p>
 * {@link #compute()} clusters colocated anomalies of different channels into
 * base {@link AnomalyGroup}s. Anomalies are visited channel by channel, in the
 * order the property group lists its channels; each anomaly not yet assigned
 * seeds a cluster of the anomalies whose peaks lie within {@code maxMigration}
 * of its own. The cluster is then trimmed:
 * <ul>
 * <li>If the channels present skip more than one channel, the cluster is cut
 * after the last channel before the gap.</li>
 * <li>Of several anomalies on one channel, only the one nearest the seed's peak
 * is kept.</li>
 * </ul>
 * Clusters covering fewer than {@code minChannels} channels are dropped. The
 * visiting order decides the outcome when clusters overlap.
 * </p>
 *
 * <p>
 * When {@code numberOfGroups > 1}, {@link #groupNGroups(List)} merges
 * consecutive base groups lying within {@code maxSeparation} of each other
 * into composites of exactly {@code numberOfGroups} base groups.
 * </p>
 *
 * <p>
 * Groups are computed once and cached.
 * </p>
 */
public class LineGroup
{
    @Getter
    private final LinePosition position;

    @Getter
    private final Map<String, LineData> lineDataset;

    @Getter
    private final PropertyGroup propertyGroup;

    @Getter
    private final double maxMigration;

    @Getter
    private final int minChannels;

    @Getter
    private final int numberOfGroups;

    @Getter
    private final double maxSeparation;

    @Getter
    private final int lineId;

    @Getter
    private final int part;

    private Map<String, LineData> channels;

    private List<AnomalyGroup> groups;

    private static final Logger logger = LoggerFactory.getLogger(LineGroup.class);

    /**
     * @param position       Resampled geometry of the line segment.
     * @param lineDataset    Line data of every active channel, by channel id.
     * @param propertyGroup  Channels to group together.
     * @param maxMigration   Maximum distance between colocated peaks.
     * @param minChannels    Minimum number of channels in a group.
     * @param numberOfGroups Number of base groups per composite; 1 disables
     *                       merging.
     * @param maxSeparation  Maximum gap between merged groups.
     * @param lineId         Line the segment belongs to.
     * @param part           Part of the line.
     */
    public LineGroup(LinePosition position, Map<String, LineData> lineDataset, PropertyGroup propertyGroup,
            double maxMigration, int minChannels, int numberOfGroups, double maxSeparation, int lineId, int part)
    {
        if (position == null || lineDataset == null || propertyGroup == null)
        {
            throw new IllegalArgumentException("position, lineDataset and propertyGroup are required!");
        }
        propertyGroup.validate();
        if (!(maxMigration > 0.0))
        {
            throw new IllegalArgumentException("maxMigration must be > 0: " + maxMigration);
        }
        if (minChannels < 1)
        {
            throw new IllegalArgumentException("minChannels must be >= 1: " + minChannels);
        }
        if (numberOfGroups < 1)
        {
            throw new IllegalArgumentException("numberOfGroups must be >= 1: " + numberOfGroups);
        }
        if (!(maxSeparation >= 0.0))
        {
            throw new IllegalArgumentException("maxSeparation must be >= 0: " + maxSeparation);
        }

        this.position = position;
        this.lineDataset = lineDataset;
        this.propertyGroup = propertyGroup;
        this.maxMigration = maxMigration;
        this.minChannels = minChannels;
        this.numberOfGroups = numberOfGroups;
        this.maxSeparation = maxSeparation;
        this.lineId = lineId;
        this.part = part;
    }

    /**
     * Anomaly groups of this property group: base groups, or composites of
     * {@code numberOfGroups} base groups when merging is enabled.
     *
     * @return Unmodifiable list, computed on first access.
     */
    public List<AnomalyGroup> getGroups()
    {
        if (groups == null)
        {
            List<AnomalyGroup> listGroups = compute();
            if (numberOfGroups > 1)
            {
                listGroups = groupNGroups(listGroups);
            }
            groups = Collections.unmodifiableList(listGroups);

            logger.debug("Line {} part {} group {}: {} groups", lineId, part, propertyGroup.getName(),
                    groups.size());
        }
        return groups;
    }

    /**
     * Line data of the property group's channels, in the property group's
     * channel order. Channels without line data are left out.
     *
     * @return Channel id to line data.
     */
    public Map<String, LineData> getChannels()
    {
        if (channels == null)
        {
            Map<String, LineData> mapChannels = new LinkedHashMap<String, LineData>();
            for (String channelId : propertyGroup.getChannels())
            {
                LineData lineData = lineDataset.get(channelId);
                if (lineData == null)
                {
                    logger.debug("Channel {} of group {} has no data; skipped", channelId, propertyGroup.getName());
                    continue;
                }
                mapChannels.put(channelId, lineData);
            }
            channels = Collections.unmodifiableMap(mapChannels);
        }
        return channels;
    }

    /**
     * Cluster the channels' anomalies into base groups.
     *
     * @return Base groups, in the order their seeds were visited.
     */
    public List<AnomalyGroup> compute()
    {
        List<AnomalyGroup> listGroups = new ArrayList<AnomalyGroup>();
        Map<String, LineData> mapChannels = getChannels();
        if (mapChannels.isEmpty() || !position.isValid())
        {
            return listGroups;
        }

        double[] azimuth = position.computeLocalAzimuth();

        // Flatten the anomalies of every channel, channel by channel.
        List<Anomaly> fullAnomalies = new ArrayList<Anomaly>();
        List<Integer> listChannels = new ArrayList<Integer>();
        List<Double> listPeakPositions = new ArrayList<Double>();
        int channelIndex = 0;
        for (LineData lineData : mapChannels.values())
        {
            for (Anomaly anomaly : lineData.getAnomalies())
            {
                fullAnomalies.add(anomaly);
                listChannels.add(channelIndex);
                listPeakPositions.add(position.getLocation(anomaly.getPeak()));
            }
            ++channelIndex;
        }
        int[] fullChannels = listChannels.stream().mapToInt(Integer::intValue).toArray();
        double[] peakPositions = listPeakPositions.stream().mapToDouble(Double::doubleValue).toArray();

        int[] groupIds = new int[fullAnomalies.size()];
        Arrays.fill(groupIds, -1);
        int groupId = -1;

        for (int ind = 0; ind < fullAnomalies.size(); ++ind)
        {
            if (groupIds[ind] != -1)
            {
                continue;
            }

            List<Integer> near = getNearPeaks(ind, fullChannels, peakPositions);
            Set<Integer> nearChannels = new HashSet<Integer>();
            for (int j : near)
            {
                nearChannels.add(fullChannels[j]);
            }
            if (near.isEmpty() || nearChannels.size() < minChannels)
            {
                continue;
            }

            ++groupId;
            List<Anomaly> nearAnomalies = new ArrayList<Anomaly>(near.size());
            double[] nearAzimuth = new double[near.size()];
            double[] nearValues = new double[near.size()];
            for (int k = 0; k < near.size(); ++k)
            {
                int j = near.get(k);
                groupIds[j] = groupId;
                Anomaly anomaly = fullAnomalies.get(j);
                nearAnomalies.add(anomaly);
                nearAzimuth[k] = azimuth[anomaly.getPeak()];
                nearValues[k] = anomaly.getPeakValue();
            }

            listGroups.add(new AnomalyGroup(position, nearAnomalies, propertyGroup, nearAzimuth, mapChannels,
                    nearValues, lineId, part));
        }

        return listGroups;
    }

    /**
     * Anomalies whose peaks are within the migration distance of one anomaly's
     * peak, trimmed at channel gaps and reduced to the nearest anomaly per
     * channel.
     *
     * @param ind           Index of the seed anomaly.
     * @param fullChannels  Channel index of every anomaly.
     * @param peakPositions Peak location of every anomaly.
     * @return Indices of the clustered anomalies, in visiting order.
     */
    List<Integer> getNearPeaks(int ind, int[] fullChannels, double[] peakPositions)
    {
        double[] dist = new double[peakPositions.length];
        List<Integer> near = new ArrayList<Integer>();
        for (int j = 0; j < peakPositions.length; ++j)
        {
            dist[j] = Math.abs(peakPositions[ind] - peakPositions[j]);
            if (dist[j] < maxMigration)
            {
                near.add(j);
            }
        }

        // Cut the cluster at the first channel gap wider than one channel.
        List<Integer> gates = distinctSortedChannels(near, fullChannels);
        for (int g = 0; g + 1 < gates.size(); ++g)
        {
            if (gates.get(g + 1) - gates.get(g) > 2)
            {
                int cutoff = gates.get(g);
                near.removeIf(j -> fullChannels[j] > cutoff);
                break;
            }
        }

        // Keep the nearest anomaly of any channel present more than once.
        Map<Integer, Integer> nearestByChannel = new TreeMap<Integer, Integer>();
        for (int j : near)
        {
            Integer best = nearestByChannel.get(fullChannels[j]);
            if (best == null || dist[j] < dist[best])
            {
                nearestByChannel.put(fullChannels[j], j);
            }
        }
        near.removeIf(j -> !nearestByChannel.get(fullChannels[j]).equals(j));

        return near;
    }

    private static List<Integer> distinctSortedChannels(List<Integer> indices, int[] fullChannels)
    {
        Set<Integer> gates = new TreeSet<Integer>();
        for (int j : indices)
        {
            gates.add(fullChannels[j]);
        }
        return new ArrayList<Integer>(gates);
    }

    /**
     * Merge consecutive groups into composites of {@code numberOfGroups} base
     * groups. Each pass pairs every group with the groups starting or ending
     * within {@code maxSeparation} of it and adds the new composites to the
     * working list, so a composite grows by at least one base group per pass.
     * Pairs sharing a base group or an anomaly are skipped, and a constituent
     * set is only ever built once.
     *
     * @param baseGroups Groups to merge.
     * @return Composites of exactly {@code numberOfGroups} base groups, ordered
     *         by start.
     */
    public List<AnomalyGroup> groupNGroups(List<AnomalyGroup> baseGroups)
    {
        if (position.getSampling() <= 0.0)
        {
            throw new IllegalStateException("Merging groups needs a defined sampling interval");
        }

        double delta = maxSeparation / position.getSampling();

        Map<Set<GroupKey>, AnomalyGroup> mapSeen = new LinkedHashMap<Set<GroupKey>, AnomalyGroup>();
        for (AnomalyGroup group : baseGroups)
        {
            mapSeen.putIfAbsent(Set.copyOf(group.getConstituents()), group);
        }
        List<AnomalyGroup> working = new ArrayList<AnomalyGroup>(mapSeen.values());

        for (int iteration = 1; iteration < numberOfGroups; ++iteration)
        {
            working.sort(Comparator.comparingInt(AnomalyGroup::getStart));

            int count = working.size();
            double[] starts = new double[count];
            double[] maxEnds = new double[count];
            double runningMax = Double.NEGATIVE_INFINITY;
            for (int k = 0; k < count; ++k)
            {
                starts[k] = working.get(k).getStart();
                runningMax = Math.max(runningMax, working.get(k).getEnd());
                maxEnds[k] = runningMax;
            }

            List<AnomalyGroup> listNew = new ArrayList<AnomalyGroup>();
            for (AnomalyGroup group : working)
            {
                // Partners end after group.start - delta and start before group.end + delta.
                int first = SignalUtilities.lowerBound(maxEnds, group.getStart() - delta);
                int last = SignalUtilities.upperBound(starts, group.getEnd() + delta) - 1;

                for (int k = first; k <= last; ++k)
                {
                    AnomalyGroup partner = working.get(k);
                    if (partner == group || partner.getEnd() < group.getStart() - delta)
                    {
                        continue;
                    }
                    if (!Collections.disjoint(partner.getConstituents(), group.getConstituents())
                            || partner.sharesAnomalyWith(group))
                    {
                        continue;
                    }

                    Set<GroupKey> union = new HashSet<GroupKey>(group.getConstituents());
                    union.addAll(partner.getConstituents());
                    if (union.size() > numberOfGroups)
                    {
                        continue;
                    }

                    Set<GroupKey> unionKey = Set.copyOf(union);
                    if (mapSeen.containsKey(unionKey))
                    {
                        continue;
                    }

                    AnomalyGroup composite = AnomalyGroup.merge(group, partner);
                    mapSeen.put(unionKey, composite);
                    listNew.add(composite);
                }
            }

            if (listNew.isEmpty())
            {
                break;
            }
            working.addAll(listNew);
        }

        List<AnomalyGroup> listMerged = new ArrayList<AnomalyGroup>();
        for (AnomalyGroup group : working)
        {
            if (group.getConstituents().size() == numberOfGroups)
            {
                listMerged.add(group);
            }
        }
        listMerged.sort(Comparator.comparingInt(AnomalyGroup::getStart).thenComparing(g -> g.getKey().toString()));
        return listMerged;
    }
}
