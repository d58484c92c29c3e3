package com.tarterware.peakfinder.models;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Read-only view of a survey: vertex locations, the line and part each vertex
 * belongs to, and the values of every channel at each vertex. All per-vertex
 * arrays share one length.
 */
@NoArgsConstructor
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class SurveyData
{
    double[] x;

    double[] y;

    // Line id of each vertex.
    int[] lineIds;

    // Optional connectivity id of each vertex; a change starts a new part.
    int[] parts;

    // Channel id to the channel's value at each vertex.
    Map<String, double[]> channelValues = new HashMap<String, double[]>();

    // Channel id to display name.
    Map<String, String> channelNames = new HashMap<String, String>();

    /**
     * Number of vertices in the survey.
     *
     * @return Vertex count, 0 when no locations are set.
     */
    @JsonIgnore
    public int getVertexCount()
    {
        return x == null ? 0 : x.length;
    }

    /**
     * Display name of a channel, falling back to its id.
     *
     * @param channelId Channel id.
     * @return Name to show for the channel.
     */
    public String getChannelName(String channelId)
    {
        String name = channelNames == null ? null : channelNames.get(channelId);
        return name == null ? channelId : name;
    }

    /**
     * Check that every per-vertex array has the vertex count.
     *
     * @throws IllegalArgumentException describing the first mismatch.
     */
    public void validate()
    {
        if (x == null || y == null)
        {
            throw new IllegalArgumentException("Survey locations x and y are required!");
        }
        int count = x.length;
        if (y.length != count)
        {
            throw new IllegalArgumentException("y has " + y.length + " values; expected " + count);
        }
        if (lineIds == null || lineIds.length != count)
        {
            throw new IllegalArgumentException("lineIds must hold one id per vertex (" + count + ")");
        }
        if (parts != null && parts.length != count)
        {
            throw new IllegalArgumentException("parts has " + parts.length + " values; expected " + count);
        }
        if (channelValues != null)
        {
            for (Map.Entry<String, double[]> entry : channelValues.entrySet())
            {
                if (entry.getValue() == null || entry.getValue().length != count)
                {
                    throw new IllegalArgumentException(
                            "Channel " + entry.getKey() + " must hold one value per vertex (" + count + ")");
                }
            }
        }
    }

    /**
     * Distinct line ids, ascending.
     *
     * @return Sorted line ids.
     */
    @JsonIgnore
    public SortedSet<Integer> getLineIdSet()
    {
        SortedSet<Integer> ids = new TreeSet<Integer>();
        if (lineIds != null)
        {
            Arrays.stream(lineIds).forEach(ids::add);
        }
        return ids;
    }

    /**
     * Vertex indices of a line, split into physically contiguous parts. A new
     * part starts where the vertex indices jump (the line was flown again later)
     * or where the connectivity id changes.
     *
     * @param lineId Line to look up.
     * @return Index arrays in survey order; empty when the line does not exist.
     */
    public List<int[]> getLineParts(int lineId)
    {
        List<int[]> listParts = new ArrayList<int[]>();
        if (lineIds == null)
        {
            return listParts;
        }

        List<Integer> current = new ArrayList<Integer>();
        int previous = -1;
        for (int i = 0; i < lineIds.length; ++i)
        {
            if (lineIds[i] != lineId)
            {
                continue;
            }

            if (previous >= 0 && startsNewPart(previous, i))
            {
                listParts.add(current.stream().mapToInt(Integer::intValue).toArray());
                current = new ArrayList<Integer>();
            }
            current.add(i);
            previous = i;
        }
        if (!current.isEmpty())
        {
            listParts.add(current.stream().mapToInt(Integer::intValue).toArray());
        }
        return listParts;
    }

    /**
     * Parts of every line in the survey, built in one pass over the vertices.
     *
     * @return Line id to its parts, in ascending line id order.
     */
    @JsonIgnore
    public Map<Integer, List<int[]>> getAllLineParts()
    {
        Map<Integer, List<int[]>> mapParts = new TreeMap<Integer, List<int[]>>();
        if (lineIds == null)
        {
            return mapParts;
        }

        // Open part and last vertex of every line seen so far.
        Map<Integer, List<Integer>> mapCurrent = new HashMap<Integer, List<Integer>>();
        Map<Integer, Integer> mapPrevious = new HashMap<Integer, Integer>();
        for (int i = 0; i < lineIds.length; ++i)
        {
            int lineId = lineIds[i];
            List<Integer> current = mapCurrent.get(lineId);
            if (current == null)
            {
                current = new ArrayList<Integer>();
                mapCurrent.put(lineId, current);
                mapParts.put(lineId, new ArrayList<int[]>());
            }
            else if (startsNewPart(mapPrevious.get(lineId), i))
            {
                mapParts.get(lineId).add(current.stream().mapToInt(Integer::intValue).toArray());
                current = new ArrayList<Integer>();
                mapCurrent.put(lineId, current);
            }
            current.add(i);
            mapPrevious.put(lineId, i);
        }

        for (Map.Entry<Integer, List<Integer>> entry : mapCurrent.entrySet())
        {
            mapParts.get(entry.getKey()).add(entry.getValue().stream().mapToInt(Integer::intValue).toArray());
        }
        return mapParts;
    }

    // A vertex of the same line starts a new part after an index jump or a connectivity change.
    private boolean startsNewPart(int previous, int i)
    {
        return (i != previous + 1) || (parts != null && parts[i] != parts[previous]);
    }
}
