package com.tarterware.peakfinder.configs;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.tarterware.peakfinder.models.DetectionParameters;

@Configuration
public class PeakFinderConfig
{
    // Number of line parts computed concurrently.
    @Value("${com.tarterware.peakfinder.line-threads:4}")
    private int lineThreads;

    @Value("${com.tarterware.peakfinder.smoothing:6}")
    private int smoothing;

    @Value("${com.tarterware.peakfinder.max-migration:25.0}")
    private double maxMigration;

    @Value("${com.tarterware.peakfinder.min-channels:1}")
    private int minChannels;

    @Value("${com.tarterware.peakfinder.min-amplitude:1.0}")
    private double minAmplitude;

    @Value("${com.tarterware.peakfinder.min-value:-Infinity}")
    private double minValue;

    @Value("${com.tarterware.peakfinder.min-width:100.0}")
    private double minWidth;

    @Value("${com.tarterware.peakfinder.number-of-groups:1}")
    private int numberOfGroups;

    @Value("${com.tarterware.peakfinder.max-separation:100.0}")
    private double maxSeparation;

    @Value("${com.tarterware.peakfinder.flip-sign:false}")
    private boolean flipSign;

    @Value("${com.tarterware.peakfinder.residual:false}")
    private boolean residual;

    private static final Logger logger = LoggerFactory.getLogger(PeakFinderConfig.class);

    @Bean(destroyMethod = "shutdown")
    ExecutorService lineExecutor()
    {
        logger.info("Starting line executor with {} threads", lineThreads);
        return Executors.newFixedThreadPool(lineThreads);
    }

    @Bean
    DetectionParameters defaultDetectionParameters()
    {
        DetectionParameters parameters = new DetectionParameters(smoothing, maxMigration, minChannels, minAmplitude,
                minValue, minWidth, numberOfGroups, maxSeparation, flipSign, null, residual);
        parameters.validate();
        return parameters;
    }
}
