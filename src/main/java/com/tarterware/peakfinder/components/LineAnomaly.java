package com.tarterware.peakfinder.components;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tarterware.peakfinder.models.DetectionParameters;
import com.tarterware.peakfinder.models.PropertyGroup;
import com.tarterware.peakfinder.models.SurveyData;
import com.tarterware.peakfinder.utilities.SignalUtilities;

import lombok.Getter;

/**
 * All anomaly groups of one part of one survey line.
 *
 * <p>
 * Builds one {@link LinePosition} for the part's vertices, one
 * {@link LineData} per channel used by any property group, and one
 * {@link LineGroup} per property group. Everything is computed on first access
 * and cached; the survey itself is only read.
 * </p>
 *
 * <p>
 * A part with fewer than two vertices, or with zero length, has no position and
 * no groups.
 * </p>
 */
public class LineAnomaly
{
    @Getter
    private final int lineId;

    @Getter
    private final int part;

    private final SurveyData survey;

    private final int[] lineIndices;

    @Getter
    private final List<PropertyGroup> propertyGroups;

    @Getter
    private final DetectionParameters parameters;

    private LinePosition position;

    private boolean positionComputed;

    private Map<String, LineData> lineDataset;

    private List<LineGroup> anomalies;

    private static final Logger logger = LoggerFactory.getLogger(LineAnomaly.class);

    /**
     * @param lineId         Line id.
     * @param part           Index of the part within the line.
     * @param survey         Survey to read locations and channel values from.
     * @param lineIndices    Vertex indices of the part, in line order.
     * @param propertyGroups Property groups to detect anomalies for.
     * @param parameters     Detection parameters.
     * @throws IllegalArgumentException if the parameters are out of range or a
     *                                  property group is malformed.
     */
    public LineAnomaly(int lineId, int part, SurveyData survey, int[] lineIndices,
            List<PropertyGroup> propertyGroups, DetectionParameters parameters)
    {
        if (survey == null || lineIndices == null || propertyGroups == null || parameters == null)
        {
            throw new IllegalArgumentException("survey, lineIndices, propertyGroups and parameters are required!");
        }
        parameters.validate();
        PropertyGroup.validateAll(propertyGroups);

        this.lineId = lineId;
        this.part = part;
        this.survey = survey;
        this.lineIndices = lineIndices.clone();
        this.propertyGroups = Collections.unmodifiableList(new ArrayList<PropertyGroup>(propertyGroups));
        this.parameters = new DetectionParameters(parameters);
    }

    /**
     * Vertex indices of this part.
     *
     * @return Copy of the indices.
     */
    public int[] getLineIndices()
    {
        return lineIndices.clone();
    }

    /**
     * Resampled geometry of the part.
     *
     * @return The position, or null when the part has too few vertices.
     */
    public LinePosition getPosition()
    {
        if (!positionComputed)
        {
            positionComputed = true;
            if (lineIndices.length < 2)
            {
                logger.warn("Line {} part {} has {} vertices; skipped", lineId, part, lineIndices.length);
                return null;
            }

            LinePosition linePosition = new LinePosition(SignalUtilities.select(survey.getX(), lineIndices),
                    SignalUtilities.select(survey.getY(), lineIndices), parameters.getSampling(),
                    parameters.getSmoothing(), parameters.isResidual());
            if (!linePosition.isValid())
            {
                logger.warn("Line {} part {} has zero length; skipped", lineId, part);
                return null;
            }
            position = linePosition;
        }
        return position;
    }

    /**
     * Line data of every channel referenced by the property groups and present
     * in the survey, sign-flipped when requested.
     *
     * @return Channel id to line data; empty when there is no position.
     */
    public Map<String, LineData> getLineDataset()
    {
        if (lineDataset == null)
        {
            Map<String, LineData> mapDataset = new LinkedHashMap<String, LineData>();
            LinePosition linePosition = getPosition();
            if (linePosition != null)
            {
                Set<String> channelIds = new LinkedHashSet<String>();
                for (PropertyGroup propertyGroup : propertyGroups)
                {
                    channelIds.addAll(propertyGroup.getChannels());
                }

                for (String channelId : channelIds)
                {
                    double[] values = survey.getChannelValues() == null ? null
                            : survey.getChannelValues().get(channelId);
                    if (values == null)
                    {
                        logger.debug("Channel {} not found in survey", channelId);
                        continue;
                    }

                    double[] lineValues = SignalUtilities.applySign(SignalUtilities.select(values, lineIndices),
                            parameters.isFlipSign());
                    mapDataset.put(channelId,
                            new LineData(linePosition, channelId, survey.getChannelName(channelId), lineValues,
                                    parameters.getMinAmplitude(), parameters.getMinValue(), parameters.getMinWidth()));
                }
            }
            lineDataset = Collections.unmodifiableMap(mapDataset);
        }
        return lineDataset;
    }

    /**
     * One line group per property group.
     *
     * @return Line groups in property group order; empty when there is no
     *         position.
     */
    public List<LineGroup> getAnomalies()
    {
        if (anomalies == null)
        {
            List<LineGroup> listLineGroups = new ArrayList<LineGroup>();
            LinePosition linePosition = getPosition();
            if (linePosition != null)
            {
                for (PropertyGroup propertyGroup : propertyGroups)
                {
                    listLineGroups.add(new LineGroup(linePosition, getLineDataset(), propertyGroup,
                            parameters.getMaxMigration(), parameters.getMinChannels(),
                            parameters.getNumberOfGroups(), parameters.getMaxSeparation(), lineId, part));
                }
            }
            anomalies = Collections.unmodifiableList(listLineGroups);
        }
        return anomalies;
    }

    /**
     * Anomaly groups of every property group, flattened.
     *
     * @return Groups tagged with this line id and part.
     */
    public List<AnomalyGroup> getGroups()
    {
        List<AnomalyGroup> listGroups = new ArrayList<AnomalyGroup>();
        for (LineGroup lineGroup : getAnomalies())
        {
            listGroups.addAll(lineGroup.getGroups());
        }
        return listGroups;
    }
}
