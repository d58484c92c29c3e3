package com.tarterware.peakfinder.models;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Data;
import lombok.NoArgsConstructor;

@NoArgsConstructor
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class LineAnomalyRequest
{
	SurveyData survey;

	List<PropertyGroup> propertyGroups = new ArrayList<PropertyGroup>();

	// Defaults are used when absent.
	DetectionParameters parameters;

	// Only read by the single line request.
	Integer lineId;
}
