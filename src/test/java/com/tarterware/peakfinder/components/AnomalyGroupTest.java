package com.tarterware.peakfinder.components;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.tarterware.peakfinder.models.PropertyGroup;

import utils.TestUtils;

class AnomalyGroupTest
{
    private static final int COUNT = 101;

    private LinePosition position;

    private LineData channelA;

    private LineData channelB;

    private Map<String, LineData> channels;

    private PropertyGroup propertyGroup;

    @BeforeEach
    void setup()
    {
        position = TestUtils.straightLine(COUNT);
        channelA = TestUtils.channel(position, "a", TestUtils.bumps(COUNT, 3.0, 20, 50, 80));
        channelB = TestUtils.channel(position, "b", TestUtils.bumps(COUNT, 3.0, 52));

        channels = new LinkedHashMap<String, LineData>();
        channels.put("a", channelA);
        channels.put("b", channelB);

        propertyGroup = new PropertyGroup("receiver", Arrays.asList("a", "b"), "#ff0000");
    }

    private AnomalyGroup baseGroup(double azimuth, Anomaly... anomalies)
    {
        double[] azimuths = new double[anomalies.length];
        double[] values = new double[anomalies.length];
        for (int k = 0; k < anomalies.length; ++k)
        {
            azimuths[k] = azimuth;
            values[k] = anomalies[k].getPeakValue();
        }
        return new AnomalyGroup(position, Arrays.asList(anomalies), propertyGroup, azimuths, channels, values, 7, 1);
    }

    @Test
    void testBaseGroupAttributes()
    {
        Anomaly a50 = channelA.getAnomalies().get(1);
        Anomaly b52 = channelB.getAnomalies().get(0);

        AnomalyGroup group = baseGroup(90.0, a50, b52);

        assertFalse(group.isComposite());
        assertTrue(group.getSubgroups().isEmpty());
        assertEquals(Collections.singleton(group.getKey()), group.getConstituents());
        assertEquals(Arrays.asList(50, 52), group.getPeaks());
        assertEquals(Math.min(a50.getStart(), b52.getStart()), group.getStart());
        assertEquals(Math.max(a50.getEnd(), b52.getEnd()), group.getEnd());
        assertEquals(500.0, group.getPeakLocation(), 1e-9);
        assertEquals(20.0, group.getMigration(), 1e-9);
        assertEquals(10.0, group.getAmplitude(), 1e-3);
        assertEquals(90.0, group.getAzimuth(), 1e-9);
        assertEquals(AnomalyGroup.Orientation.RIGHT, group.getOrientation());
        assertEquals(Arrays.asList("a", "b"), group.getChannelNames());
        assertEquals(7, group.getLineId());
        assertEquals(1, group.getPart());
    }

    @Test
    void testOrientationLeftForWestwardLines()
    {
        AnomalyGroup group = baseGroup(270.0, channelB.getAnomalies().get(0));

        assertEquals(AnomalyGroup.Orientation.LEFT, group.getOrientation());
    }

    @Test
    void testBaseGroupRejectsRepeatedChannel()
    {
        List<Anomaly> anomalies = channelA.getAnomalies();

        assertThrows(IllegalArgumentException.class, () -> baseGroup(90.0, anomalies.get(0), anomalies.get(1)));
    }

    @Test
    void testGroupNeedsAnomalies()
    {
        assertThrows(IllegalArgumentException.class, () -> new AnomalyGroup(position, Collections.emptyList(),
                propertyGroup, new double[0], channels, new double[0], 7, 1));
        assertThrows(IllegalArgumentException.class,
                () -> new AnomalyGroup(position, Arrays.asList(channelB.getAnomalies().get(0)), propertyGroup,
                        new double[] { 90.0, 90.0 }, channels, new double[] { 1.0 }, 7, 1));
    }

    @Test
    void testMergePutsEarlierGroupFirst()
    {
        AnomalyGroup early = baseGroup(80.0, channelA.getAnomalies().get(0));
        AnomalyGroup late = baseGroup(100.0, channelA.getAnomalies().get(1));

        AnomalyGroup composite = AnomalyGroup.merge(late, early);

        assertTrue(composite.isComposite());
        assertEquals(Set.of(early.getKey(), late.getKey()), composite.getSubgroups());
        assertEquals(composite.getSubgroups(), composite.getConstituents());
        assertEquals(Arrays.asList(20, 50), composite.getPeaks());
        assertArrayEquals(new double[] { 80.0, 100.0 }, composite.getFullAzimuth(), 0.0);
        assertEquals(early.getStart(), composite.getStart());
        assertEquals(late.getEnd(), composite.getEnd());
        assertEquals(90.0, composite.getAzimuth(), 1e-9);
        assertEquals(300.0, composite.getMigration(), 1e-9);
    }

    @Test
    void testMergeOfCompositesUnionsConstituents()
    {
        List<Anomaly> anomalies = channelA.getAnomalies();
        AnomalyGroup first = baseGroup(90.0, anomalies.get(0));
        AnomalyGroup second = baseGroup(90.0, anomalies.get(1));
        AnomalyGroup third = baseGroup(90.0, anomalies.get(2));

        AnomalyGroup composite = AnomalyGroup.merge(AnomalyGroup.merge(first, second), third);

        assertEquals(Set.of(first.getKey(), second.getKey(), third.getKey()), composite.getConstituents());
        assertEquals(Arrays.asList(20, 50, 80), composite.getPeaks());
        assertEquals(3, composite.getFullPeakValues().length);
    }

    @Test
    void testSharesAnomalyWith()
    {
        Anomaly a50 = channelA.getAnomalies().get(1);
        Anomaly b52 = channelB.getAnomalies().get(0);

        AnomalyGroup pair = baseGroup(90.0, a50, b52);
        AnomalyGroup single = baseGroup(90.0, b52);
        AnomalyGroup other = baseGroup(90.0, channelA.getAnomalies().get(0));

        assertTrue(pair.sharesAnomalyWith(single));
        assertFalse(pair.sharesAnomalyWith(other));
    }
}
