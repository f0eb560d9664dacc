package com.propertyintel.price.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.Set;

/**
 * Result of one prediction request, with enough fit diagnostics to judge it.
 */
@Value
@Builder
public class PricePrediction {
    double latitude;
    double longitude;
    LocalDate date;
    PropertyType propertyType;

    double predictedPrice;

    int trainingRows;
    int validationRows;
    double validationMae;

    /** false when validation MAE exceeded the configured warning threshold */
    boolean maeWithinThreshold;

    /** Requested POI attribute keys the source could not provide */
    Set<String> unavailablePoiKeys;
}
