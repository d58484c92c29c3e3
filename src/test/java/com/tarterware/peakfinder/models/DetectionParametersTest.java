package com.tarterware.peakfinder.models;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

class DetectionParametersTest
{
    @Test
    void testDefaults()
    {
        DetectionParameters parameters = new DetectionParameters();

        assertEquals(6, parameters.getSmoothing());
        assertEquals(25.0, parameters.getMaxMigration(), 0.0);
        assertEquals(1, parameters.getMinChannels());
        assertEquals(1.0, parameters.getMinAmplitude(), 0.0);
        assertEquals(Double.NEGATIVE_INFINITY, parameters.getMinValue(), 0.0);
        assertEquals(100.0, parameters.getMinWidth(), 0.0);
        assertEquals(1, parameters.getNumberOfGroups());
        assertEquals(100.0, parameters.getMaxSeparation(), 0.0);
        assertFalse(parameters.isFlipSign());
        assertNull(parameters.getSampling());
        parameters.validate();
    }

    @Test
    void testValidateRejectsOutOfRange()
    {
        DetectionParameters parameters = new DetectionParameters();

        parameters.setSmoothing(-1);
        assertThrows(IllegalArgumentException.class, parameters::validate);

        parameters = new DetectionParameters();
        parameters.setMaxMigration(0.0);
        assertThrows(IllegalArgumentException.class, parameters::validate);

        parameters = new DetectionParameters();
        parameters.setMinChannels(0);
        assertThrows(IllegalArgumentException.class, parameters::validate);

        parameters = new DetectionParameters();
        parameters.setMinAmplitude(150.0);
        assertThrows(IllegalArgumentException.class, parameters::validate);

        parameters = new DetectionParameters();
        parameters.setMinWidth(0.0);
        assertThrows(IllegalArgumentException.class, parameters::validate);

        parameters = new DetectionParameters();
        parameters.setNumberOfGroups(0);
        assertThrows(IllegalArgumentException.class, parameters::validate);

        parameters = new DetectionParameters();
        parameters.setMaxSeparation(-5.0);
        assertThrows(IllegalArgumentException.class, parameters::validate);

        parameters = new DetectionParameters();
        parameters.setSampling(0.0);
        assertThrows(IllegalArgumentException.class, parameters::validate);
    }

    @Test
    void testCopyIsIndependent()
    {
        DetectionParameters parameters = new DetectionParameters();
        DetectionParameters copy = new DetectionParameters(parameters);

        copy.setMinChannels(3);

        assertEquals(parameters.getSmoothing(), copy.getSmoothing());
        assertEquals(1, parameters.getMinChannels());
    }

    @Test
    void testJsonKeepsDefaultsForMissingFields() throws JsonProcessingException
    {
        ObjectMapper objectMapper = new ObjectMapper();

        DetectionParameters parameters = objectMapper
                .readValue("{\"minChannels\": 2, \"numberOfGroups\": 3, \"unknown\": true}", DetectionParameters.class);

        assertEquals(2, parameters.getMinChannels());
        assertEquals(3, parameters.getNumberOfGroups());
        assertEquals(6, parameters.getSmoothing());
    }
}
