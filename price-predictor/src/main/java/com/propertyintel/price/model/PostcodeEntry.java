package com.propertyintel.price.model;

import lombok.Builder;
import lombok.Data;

/**
 * One row of the open postcode geo dataset, ready for the postcode_data table.
 */
@Data
@Builder
public class PostcodeEntry {

    private String postcode;
    private String status;          // live | terminated
    private String usertype;        // small | large
    private Integer easting;
    private Integer northing;
    private int positionalQualityIndicator;
    private String country;
    private double latitude;
    private double longitude;
    private String postcodeNoSpace;
    private String postcodeFixedWidthSeven;
    private String postcodeFixedWidthEight;
    private String postcodeArea;
    private String postcodeDistrict;
    private String postcodeSector;
    private String outcode;
    private String incode;
}
