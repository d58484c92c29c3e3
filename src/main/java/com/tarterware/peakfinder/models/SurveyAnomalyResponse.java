package com.tarterware.peakfinder.models;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Data;
import lombok.NoArgsConstructor;

@NoArgsConstructor
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class SurveyAnomalyResponse
{
	String message;

	int groupCount;

	List<LineAnomalyResponse> lines = new ArrayList<LineAnomalyResponse>();
}
