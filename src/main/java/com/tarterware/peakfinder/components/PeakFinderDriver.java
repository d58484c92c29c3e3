package com.tarterware.peakfinder.components;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.tarterware.peakfinder.models.DetectionParameters;
import com.tarterware.peakfinder.models.PropertyGroup;
import com.tarterware.peakfinder.models.SurveyData;
import com.tarterware.peakfinder.models.ThresholdSuggestion;
import com.tarterware.peakfinder.utilities.ChannelStatistics;
import com.tarterware.peakfinder.utilities.SignalUtilities;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

/**
 * Runs anomaly detection over many lines of a survey.
 *
 * <p>
 * Every (line, part) pair is computed by its own task on the line executor.
 * Each task builds and owns its {@link LineAnomaly}, so no mutable state is
 * shared between tasks; the survey is only read. Groups are computed inside the
 * task, so a completed {@link Future} holds a fully computed result.
 * </p>
 */
@Component
public class PeakFinderDriver
{
    // Pool the line tasks run on.
    private final ExecutorService lineExecutor;

    private final Timer lineComputeTimer;

    private final Counter anomalyGroupCounter;

    public static final String ENDPOINT_LINE_COMPUTE_TIME = "peakfinder.line.compute.time";
    public static final String ENDPOINT_ANOMALY_GROUPS = "peakfinder.anomaly.groups";

    // Percentile of the absolute channel values used as the linear threshold.
    private static final double LINEAR_THRESHOLD_PERCENTILE = 95.0;

    private static final Logger logger = LoggerFactory.getLogger(PeakFinderDriver.class);

    /**
     * @param lineExecutor  Executor the line tasks are submitted to.
     * @param meterRegistry Creates and manages application's set of meters.
     */
    public PeakFinderDriver(ExecutorService lineExecutor, MeterRegistry meterRegistry)
    {
        this.lineExecutor = lineExecutor;

        this.lineComputeTimer = Timer.builder(ENDPOINT_LINE_COMPUTE_TIME)
                .description("Time to detect and group the anomalies of one line part").register(meterRegistry);
        this.anomalyGroupCounter = Counter.builder(ENDPOINT_ANOMALY_GROUPS)
                .description("Number of anomaly groups emitted").register(meterRegistry);
    }

    /**
     * Submit one task per part of every given line.
     *
     * @param lineParts      Line id to the vertex indices of each of its parts.
     * @param survey         Survey the indices refer to.
     * @param propertyGroups Property groups to detect anomalies for.
     * @param parameters     Detection parameters shared by all lines.
     * @return One future per (line, part), in line then part order.
     * @throws IllegalArgumentException if the survey, property groups or
     *                                  parameters are invalid.
     */
    public List<Future<LineAnomaly>> computeLines(Map<Integer, List<int[]>> lineParts, SurveyData survey,
            List<PropertyGroup> propertyGroups, DetectionParameters parameters)
    {
        if (lineParts == null || survey == null || propertyGroups == null || parameters == null)
        {
            throw new IllegalArgumentException("lineParts, survey, propertyGroups and parameters are required!");
        }
        survey.validate();
        parameters.validate();
        PropertyGroup.validateAll(propertyGroups);

        // Each task gets its own copy so callers can reuse theirs.
        final DetectionParameters taskParameters = new DetectionParameters(parameters);

        List<Future<LineAnomaly>> listFutures = new ArrayList<Future<LineAnomaly>>();
        for (Map.Entry<Integer, List<int[]>> entry : lineParts.entrySet())
        {
            final int lineId = entry.getKey();
            List<int[]> parts = entry.getValue();
            for (int part = 0; part < parts.size(); ++part)
            {
                final int partIndex = part;
                final int[] indices = parts.get(part);
                listFutures.add(lineExecutor.submit(() ->
                {
                    try
                    {
                        return computeLine(lineId, partIndex, indices, survey, propertyGroups, taskParameters);
                    }
                    catch (RuntimeException e)
                    {
                        throw new IllegalStateException("Line " + lineId + " part " + partIndex + " failed", e);
                    }
                }));
            }
        }

        logger.info("Submitted {} line parts over {} lines", listFutures.size(), lineParts.size());
        return listFutures;
    }

    /**
     * Submit one task per part of every line of the survey.
     *
     * @param survey         Survey to process.
     * @param propertyGroups Property groups to detect anomalies for.
     * @param parameters     Detection parameters shared by all lines.
     * @return One future per (line, part).
     */
    public List<Future<LineAnomaly>> computeLines(SurveyData survey, List<PropertyGroup> propertyGroups,
            DetectionParameters parameters)
    {
        if (survey == null)
        {
            throw new IllegalArgumentException("survey is required!");
        }
        survey.validate();
        return computeLines(survey.getAllLineParts(), survey, propertyGroups, parameters);
    }

    /**
     * Wait for every future and return the results in submission order.
     *
     * @param futures Futures returned by {@link #computeLines}.
     * @return Computed line anomalies.
     * @throws IllegalStateException if a task failed or the wait was
     *                               interrupted.
     */
    public List<LineAnomaly> collectResults(List<Future<LineAnomaly>> futures)
    {
        List<LineAnomaly> listResults = new ArrayList<LineAnomaly>(futures.size());
        for (Future<LineAnomaly> future : futures)
        {
            try
            {
                listResults.add(future.get());
            }
            catch (InterruptedException e)
            {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while waiting for line results", e);
            }
            catch (ExecutionException e)
            {
                Throwable cause = e.getCause();
                if (cause instanceof IllegalStateException)
                {
                    throw (IllegalStateException) cause;
                }
                throw new IllegalStateException("Line computation failed", cause);
            }
        }

        int groupCount = listResults.stream().mapToInt(lineAnomaly -> lineAnomaly.getGroups().size()).sum();
        logger.info("Computed {} line parts; {} anomaly groups", listResults.size(), groupCount);
        return listResults;
    }

    /**
     * Compute one part of one line on the calling thread.
     *
     * @param lineId         Line id.
     * @param part           Index of the part within the line.
     * @param indices        Vertex indices of the part.
     * @param survey         Survey the indices refer to.
     * @param propertyGroups Property groups to detect anomalies for.
     * @param parameters     Detection parameters.
     * @return The line anomaly, with its groups already computed.
     */
    public LineAnomaly computeLine(int lineId, int part, int[] indices, SurveyData survey,
            List<PropertyGroup> propertyGroups, DetectionParameters parameters)
    {
        Timer.Sample sample = Timer.start();
        try
        {
            LineAnomaly lineAnomaly = new LineAnomaly(lineId, part, survey, indices, propertyGroups, parameters);
            int groupCount = lineAnomaly.getGroups().size();
            anomalyGroupCounter.increment(groupCount);

            logger.debug("Line {} part {}: {} anomaly groups", lineId, part, groupCount);
            return lineAnomaly;
        }
        catch (RuntimeException e)
        {
            logger.error("Unexpected Exception computing line {} part {}", lineId, part, e);
            throw e;
        }
        finally
        {
            sample.stop(lineComputeTimer);
        }
    }

    /**
     * Suggest starting values for the minimum value and the linear threshold
     * from the data of every channel of the property groups.
     *
     * @param survey         Survey to read the channels from.
     * @param propertyGroups Property groups whose channels are considered.
     * @param flipSign       Whether the data is inverted before detection.
     * @return The suggestion, or null when no channel has data.
     * @throws IllegalArgumentException if the survey is missing or a property
     *                                  group is malformed.
     */
    public ThresholdSuggestion suggestThresholds(SurveyData survey, List<PropertyGroup> propertyGroups,
            boolean flipSign)
    {
        if (survey == null || propertyGroups == null)
        {
            throw new IllegalArgumentException("survey and propertyGroups are required!");
        }
        PropertyGroup.validateAll(propertyGroups);

        Set<String> channelIds = new LinkedHashSet<String>();
        for (PropertyGroup propertyGroup : propertyGroups)
        {
            channelIds.addAll(propertyGroup.getChannels());
        }

        double minValue = Double.POSITIVE_INFINITY;
        double linearThreshold = Double.POSITIVE_INFINITY;
        int channelCount = 0;
        for (String channelId : channelIds)
        {
            double[] values = survey.getChannelValues() == null ? null : survey.getChannelValues().get(channelId);
            if (values == null)
            {
                continue;
            }

            double[] signed = SignalUtilities.applySign(values, flipSign);
            ChannelStatistics statistics = new ChannelStatistics(signed);
            if (statistics.getCount() == 0)
            {
                continue;
            }

            double[] absolute = new double[signed.length];
            for (int i = 0; i < signed.length; ++i)
            {
                absolute[i] = Math.abs(signed[i]);
            }

            minValue = Math.min(minValue, statistics.getMin());
            linearThreshold = Math.min(linearThreshold,
                    new ChannelStatistics(absolute).getPercentile(LINEAR_THRESHOLD_PERCENTILE));
            ++channelCount;
        }

        if (channelCount == 0)
        {
            return null;
        }

        ThresholdSuggestion suggestion = new ThresholdSuggestion();
        suggestion.setMinValue(minValue);
        suggestion.setLinearThreshold(linearThreshold);
        return suggestion;
    }
}
