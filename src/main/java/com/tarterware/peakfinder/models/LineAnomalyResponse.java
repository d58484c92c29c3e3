package com.tarterware.peakfinder.models;

import java.util.ArrayList;
import java.util.List;

import lombok.Data;
import lombok.NoArgsConstructor;

@NoArgsConstructor
@Data
public class LineAnomalyResponse
{
	int lineId;

	int part;

	// False when the part was too short to process.
	boolean valid;

	double length;

	double sampling;

	List<AnomalyGroupSummary> groups = new ArrayList<AnomalyGroupSummary>();
}
