package com.tarterware.peakfinder.controllers;

import java.util.List;
import java.util.concurrent.Future;

import org.locationtech.jts.geom.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.tarterware.peakfinder.components.AnomalyGroup;
import com.tarterware.peakfinder.components.LineAnomaly;
import com.tarterware.peakfinder.components.LinePosition;
import com.tarterware.peakfinder.components.PeakFinderDriver;
import com.tarterware.peakfinder.models.AnomalyGroupSummary;
import com.tarterware.peakfinder.models.DetectionParameters;
import com.tarterware.peakfinder.models.LineAnomalyRequest;
import com.tarterware.peakfinder.models.LineAnomalyResponse;
import com.tarterware.peakfinder.models.PropertyGroup;
import com.tarterware.peakfinder.models.SurveyAnomalyResponse;
import com.tarterware.peakfinder.models.ThresholdSuggestion;

@RestController
@RequestMapping("/api/anomalies")
public class LineAnomalyController
{
    @Autowired
    PeakFinderDriver peakFinderDriver;

    @Autowired
    DetectionParameters defaultDetectionParameters;

    private static final Logger logger = LoggerFactory.getLogger(LineAnomalyController.class);

    @PostMapping("/compute-line")
    ResponseEntity<SurveyAnomalyResponse> computeLine(@RequestBody LineAnomalyRequest request)
    {
        SurveyAnomalyResponse surveyResponse = new SurveyAnomalyResponse();

        if (request == null || request.getSurvey() == null)
        {
            surveyResponse.setMessage("A survey is required!");
            return new ResponseEntity<SurveyAnomalyResponse>(surveyResponse, HttpStatus.BAD_REQUEST);
        }
        if (request.getLineId() == null)
        {
            surveyResponse.setMessage("A lineId is required!");
            return new ResponseEntity<SurveyAnomalyResponse>(surveyResponse, HttpStatus.BAD_REQUEST);
        }

        try
        {
            request.getSurvey().validate();
            PropertyGroup.validateAll(request.getPropertyGroups());
            DetectionParameters parameters = getParametersFor(request);

            List<int[]> parts = request.getSurvey().getLineParts(request.getLineId());
            if (parts.isEmpty())
            {
                surveyResponse.setMessage("Line " + request.getLineId() + " not found in survey");
                return new ResponseEntity<SurveyAnomalyResponse>(surveyResponse, HttpStatus.NOT_FOUND);
            }

            for (int part = 0; part < parts.size(); ++part)
            {
                LineAnomaly lineAnomaly = peakFinderDriver.computeLine(request.getLineId(), part, parts.get(part),
                        request.getSurvey(), request.getPropertyGroups(), parameters);
                addResponseFor(surveyResponse, lineAnomaly);
            }
        }
        catch (IllegalArgumentException ex)
        {
            surveyResponse.setMessage(ex.getMessage());
            return new ResponseEntity<SurveyAnomalyResponse>(surveyResponse, HttpStatus.BAD_REQUEST);
        }

        return new ResponseEntity<SurveyAnomalyResponse>(surveyResponse, HttpStatus.OK);
    }

    @PostMapping("/compute-survey")
    ResponseEntity<SurveyAnomalyResponse> computeSurvey(@RequestBody LineAnomalyRequest request)
    {
        SurveyAnomalyResponse surveyResponse = new SurveyAnomalyResponse();

        if (request == null || request.getSurvey() == null)
        {
            surveyResponse.setMessage("A survey is required!");
            return new ResponseEntity<SurveyAnomalyResponse>(surveyResponse, HttpStatus.BAD_REQUEST);
        }

        List<LineAnomaly> listLineAnomalies;
        try
        {
            List<Future<LineAnomaly>> futures = peakFinderDriver.computeLines(request.getSurvey(),
                    request.getPropertyGroups(), getParametersFor(request));
            listLineAnomalies = peakFinderDriver.collectResults(futures);
        }
        catch (IllegalArgumentException ex)
        {
            surveyResponse.setMessage(ex.getMessage());
            return new ResponseEntity<SurveyAnomalyResponse>(surveyResponse, HttpStatus.BAD_REQUEST);
        }
        catch (IllegalStateException ex)
        {
            logger.error("Survey computation failed", ex);
            surveyResponse.setMessage(ex.getMessage());
            return new ResponseEntity<SurveyAnomalyResponse>(surveyResponse, HttpStatus.INTERNAL_SERVER_ERROR);
        }

        for (LineAnomaly lineAnomaly : listLineAnomalies)
        {
            addResponseFor(surveyResponse, lineAnomaly);
        }

        return new ResponseEntity<SurveyAnomalyResponse>(surveyResponse, HttpStatus.OK);
    }

    @PostMapping("/suggest-thresholds")
    ResponseEntity<ThresholdSuggestion> suggestThresholds(@RequestBody LineAnomalyRequest request)
    {
        if (request == null || request.getSurvey() == null)
        {
            ThresholdSuggestion suggestion = new ThresholdSuggestion();
            suggestion.setMessage("A survey is required!");
            return new ResponseEntity<ThresholdSuggestion>(suggestion, HttpStatus.BAD_REQUEST);
        }

        DetectionParameters parameters = request.getParameters() == null ? defaultDetectionParameters
                : request.getParameters();
        ThresholdSuggestion suggestion;
        try
        {
            suggestion = peakFinderDriver.suggestThresholds(request.getSurvey(), request.getPropertyGroups(),
                    parameters.isFlipSign());
        }
        catch (IllegalArgumentException ex)
        {
            ThresholdSuggestion badRequest = new ThresholdSuggestion();
            badRequest.setMessage(ex.getMessage());
            return new ResponseEntity<ThresholdSuggestion>(badRequest, HttpStatus.BAD_REQUEST);
        }
        if (suggestion == null)
        {
            return new ResponseEntity<>(HttpStatus.NOT_FOUND);
        }

        return new ResponseEntity<ThresholdSuggestion>(suggestion, HttpStatus.OK);
    }

    private DetectionParameters getParametersFor(LineAnomalyRequest request)
    {
        DetectionParameters parameters = new DetectionParameters(
                request.getParameters() == null ? defaultDetectionParameters : request.getParameters());
        parameters.validate();
        return parameters;
    }

    private void addResponseFor(SurveyAnomalyResponse surveyResponse, LineAnomaly lineAnomaly)
    {
        LineAnomalyResponse lineResponse = new LineAnomalyResponse();
        lineResponse.setLineId(lineAnomaly.getLineId());
        lineResponse.setPart(lineAnomaly.getPart());

        LinePosition position = lineAnomaly.getPosition();
        lineResponse.setValid(position != null);
        if (position != null)
        {
            lineResponse.setLength(position.getLength());
            lineResponse.setSampling(position.getSampling());
        }

        for (AnomalyGroup group : lineAnomaly.getGroups())
        {
            lineResponse.getGroups().add(createSummaryFor(group));
        }

        surveyResponse.getLines().add(lineResponse);
        surveyResponse.setGroupCount(surveyResponse.getGroupCount() + lineResponse.getGroups().size());
    }

    private AnomalyGroupSummary createSummaryFor(AnomalyGroup group)
    {
        AnomalyGroupSummary summary = new AnomalyGroupSummary();
        summary.setLineId(group.getLineId());
        summary.setPart(group.getPart());
        summary.setPropertyGroup(group.getPropertyGroup().getName());
        summary.setStart(group.getStart());
        summary.setEnd(group.getEnd());
        summary.setPeaks(group.getPeaks());
        summary.setChannels(group.getChannelNames());
        summary.setPeakLocation(group.getPeakLocation());

        Coordinate peakCoordinate = group.getPosition().getCoordinate(group.getAnomalies().get(0).getPeak());
        summary.setX(peakCoordinate.getX());
        summary.setY(peakCoordinate.getY());

        summary.setAzimuth(group.getAzimuth());
        summary.setOrientation(group.getOrientation().name());
        summary.setMigration(group.getMigration());
        summary.setAmplitude(group.getAmplitude());
        summary.setSubgroupCount(group.getSubgroups().size());

        return summary;
    }
}
