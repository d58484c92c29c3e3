package com.tarterware.peakfinder.components;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

import utils.TestUtils;

class AnomalyTest
{
    private final LineData lineData = TestUtils.channel(TestUtils.straightLine(11), "ch1",
            TestUtils.bumps(11, 1.0, 5));

    @Test
    void testIndicesMustBeOrdered()
    {
        assertThrows(IllegalArgumentException.class, () -> new Anomaly(lineData, 3, 8, 2, 2, 6, 1.0));
        assertThrows(IllegalArgumentException.class, () -> new Anomaly(lineData, 0, 8, 5, 6, 7, 1.0));
        assertThrows(IllegalArgumentException.class, () -> new Anomaly(lineData, 0, 6, 5, 4, 7, 1.0));
        assertThrows(IllegalArgumentException.class, () -> new Anomaly(null, 0, 8, 5, 4, 6, 1.0));
    }

    @Test
    void testDegenerateAnomalyIsAllowed()
    {
        Anomaly anomaly = new Anomaly(lineData, 5, 5, 5, 5, 5, 0.0);

        assertEquals(5, anomaly.getStart());
        assertEquals(5, anomaly.getEnd());
    }

    @Test
    void testIdentifierAndPeakValue()
    {
        Anomaly anomaly = new Anomaly(lineData, 2, 8, 5, 4, 6, 10.0);

        assertEquals("ch1@5", anomaly.getIdentifier());
        assertEquals(10.0, anomaly.getPeakValue(), 1e-12);
        assertEquals(lineData, anomaly.getParent());
    }

    @Test
    void testGroupKeyIsOrderIndependent()
    {
        Anomaly first = new Anomaly(lineData, 0, 4, 2, 1, 3, 1.0);
        Anomaly second = new Anomaly(lineData, 5, 9, 7, 6, 8, 1.0);

        GroupKey key = new GroupKey(Arrays.asList(second, first));

        assertEquals(new GroupKey(Arrays.asList(first, second)), key);
        assertEquals(new GroupKey(Arrays.asList(first, second)).hashCode(), key.hashCode());
        assertEquals("ch1@2,ch1@7", key.toString());
        assertNotEquals(new GroupKey(Arrays.asList(first)), key);
    }
}
