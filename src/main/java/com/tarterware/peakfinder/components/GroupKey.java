package com.tarterware.peakfinder.components;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Value identity of a base anomaly group: the sorted identifiers of its
 * anomalies. Two groups built from the same anomalies have equal keys, whatever
 * object or thread produced them.
 */
@Getter
@EqualsAndHashCode
public final class GroupKey implements Comparable<GroupKey>
{
    private final List<String> anomalyIds;

    public GroupKey(Collection<Anomaly> anomalies)
    {
        List<String> ids = new ArrayList<String>(anomalies.size());
        for (Anomaly anomaly : anomalies)
        {
            ids.add(anomaly.getIdentifier());
        }
        Collections.sort(ids);
        this.anomalyIds = Collections.unmodifiableList(ids);
    }

    @Override
    public int compareTo(GroupKey other)
    {
        return toString().compareTo(other.toString());
    }

    @Override
    public String toString()
    {
        return String.join(",", anomalyIds);
    }
}
