package com.tarterware.peakfinder.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Starting values for the detection thresholds, derived from the data of a
 * survey's channels.
 */
@NoArgsConstructor
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ThresholdSuggestion
{
	// Smallest (sign-applied) value over all channels.
	double minValue;

	// Smallest 95th percentile of the absolute values over all channels.
	double linearThreshold;

	String message;
}
