package com.propertyintel.price.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * One row of price-paid data joined with postcode coordinates.
 *
 * Categorical fields are kept as the raw strings the store returned so that the
 * schema validator can reject values outside their domain. Everything is boxed
 * because nullability is itself a validated property.
 */
@Value
@Builder(toBuilder = true)
public class PriceRecord {

    Long price;
    LocalDate dateOfTransfer;
    String postcode;

    /** F, S, D, T or O */
    String propertyType;

    /** Y or N */
    String newBuildFlag;

    /** F (freehold) or L (leasehold) */
    String tenureType;

    String locality;        // optional
    String townCity;
    String district;        // optional
    String county;          // optional
    String country;

    Double latitude;
    Double longitude;

    /** Store-assigned identifier, unique across a result set */
    Long rowId;

    public GeoPoint location() {
        return new GeoPoint(latitude, longitude);
    }
}
