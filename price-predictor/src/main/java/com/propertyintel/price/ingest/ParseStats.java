package com.propertyintel.price.ingest;

/**
 * Row counts from one pass over a raw CSV file.
 */
public record ParseStats(int rowsRead, int rowsParsed, int rowsSkipped) {
}
