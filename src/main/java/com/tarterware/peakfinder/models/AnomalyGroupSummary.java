package com.tarterware.peakfinder.models;

import java.util.ArrayList;
import java.util.List;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Serializable view of one anomaly group, as returned by the REST interface.
 */
@NoArgsConstructor
@Data
public class AnomalyGroupSummary
{
	int lineId;

	int part;

	String propertyGroup;

	int start;

	int end;

	List<Integer> peaks = new ArrayList<Integer>();

	List<String> channels = new ArrayList<String>();

	double peakLocation;

	double x;

	double y;

	double azimuth;

	String orientation;

	double migration;

	double amplitude;

	int subgroupCount;
}
