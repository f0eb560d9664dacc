package com.propertyintel.price.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;

/**
 * One transaction from the HM Land Registry price-paid CSV, ready for the pp_data table.
 *
 * Source columns (no header row):
 *   transaction id, price, date of transfer, postcode, property type, old/new,
 *   duration, PAON, SAON, street, locality, town/city, district, county,
 *   PPD category type, record status
 */
@Data
@Builder
public class PricePaidEntry {

    /** Land Registry transaction GUID, braces included */
    private String transactionId;

    private long price;
    private LocalDate dateOfTransfer;
    private String postcode;
    private String propertyType;
    private String newBuildFlag;
    private String tenureType;

    // ── Address ─────────────────────────────────────────────────────────────
    private String primaryAddressableObjectName;
    private String secondaryAddressableObjectName;
    private String street;
    private String locality;
    private String townCity;
    private String district;
    private String county;

    // ── Record metadata ─────────────────────────────────────────────────────
    /** A = standard price paid, B = additional (repossessions, buy-to-lets, ...) */
    private String ppdCategoryType;

    /** A = addition, C = change, D = delete (monthly files only) */
    private String recordStatus;
}
