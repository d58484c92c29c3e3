package com.tarterware.peakfinder;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import com.tarterware.peakfinder.components.PeakFinderDriver;
import com.tarterware.peakfinder.models.DetectionParameters;

@SpringBootTest
class PeakFinderApplicationTests
{
    @Autowired
    private PeakFinderDriver peakFinderDriver;

    @Autowired
    private DetectionParameters defaultDetectionParameters;

    @Test
    void contextLoads()
    {
        assertNotNull(peakFinderDriver);
    }

    @Test
    void defaultParametersComeFromProperties()
    {
        assertEquals(6, defaultDetectionParameters.getSmoothing());
        assertEquals(25.0, defaultDetectionParameters.getMaxMigration(), 0.0);
        assertEquals(Double.NEGATIVE_INFINITY, defaultDetectionParameters.getMinValue(), 0.0);
        assertEquals(1, defaultDetectionParameters.getNumberOfGroups());
    }
}
